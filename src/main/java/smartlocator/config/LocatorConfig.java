package smartlocator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.ai.LLMClient;
import smartlocator.engine.PipelineOptions;
import smartlocator.engine.ScanScope;
import smartlocator.model.Framework;
import smartlocator.model.MinStability;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads scanner settings from {@code config.properties} (classpath) and
 * exposes typed accessor methods with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file (higher priority; not committed to VCS).
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>scan.scope</td><td>all</td><td>{@code all} or {@code interactive}</td></tr>
 *   <tr><td>scan.identifying.attributes</td><td>name,data-testid,data-test,data-test-id,data-qa,data-cy</td><td>Attributes tried after {@code id}, in order</td></tr>
 *   <tr><td>engine.parallelism</td><td>(CPU count)</td><td>Candidate-generation threads</td></tr>
 *   <tr><td>validation.threads</td><td>4</td><td>Concurrent selector resolves</td></tr>
 *   <tr><td>validation.timeout.sec</td><td>10</td><td>Timeout per selector resolve</td></tr>
 *   <tr><td>auth.timeout.sec</td><td>30</td><td>Timeout for the whole login</td></tr>
 *   <tr><td>source.http.timeout.sec</td><td>20</td><td>HTTP fetch timeout for URL input</td></tr>
 *   <tr><td>source.page.load.timeout.sec</td><td>30</td><td>Browser page-load timeout</td></tr>
 *   <tr><td>browser.type</td><td>chrome</td><td>{@code chrome}, {@code edge} or {@code firefox}</td></tr>
 *   <tr><td>ai.enabled</td><td>false</td><td>Enrich reports with LLM suggestions</td></tr>
 *   <tr><td>ai.max.elements</td><td>25</td><td>Elements sent for enrichment per scan</td></tr>
 *   <tr><td>ai.llm.*</td><td>see {@link #createLLMClient()}</td><td>OpenAI-compatible endpoint</td></tr>
 * </table>
 */
public class LocatorConfig {

    private static final Logger log = LoggerFactory.getLogger(LocatorConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_SCAN_SCOPE          = "scan.scope";
    static final String KEY_IDENTIFYING_ATTRS   = "scan.identifying.attributes";
    static final String KEY_PARALLELISM         = "engine.parallelism";
    static final String KEY_VALIDATION_THREADS  = "validation.threads";
    static final String KEY_VALIDATION_TIMEOUT  = "validation.timeout.sec";
    static final String KEY_AUTH_TIMEOUT        = "auth.timeout.sec";
    static final String KEY_HTTP_TIMEOUT        = "source.http.timeout.sec";
    static final String KEY_PAGE_LOAD_TIMEOUT   = "source.page.load.timeout.sec";
    static final String KEY_BROWSER             = "browser.type";
    static final String KEY_AI_ENABLED          = "ai.enabled";
    static final String KEY_AI_MAX_ELEMENTS     = "ai.max.elements";

    // Defaults
    private static final String DEFAULT_SCAN_SCOPE         = "all";
    private static final int    DEFAULT_VALIDATION_THREADS = 4;
    private static final int    DEFAULT_VALIDATION_TIMEOUT = 10;
    private static final int    DEFAULT_AUTH_TIMEOUT       = 30;
    private static final int    DEFAULT_HTTP_TIMEOUT       = 20;
    private static final int    DEFAULT_PAGE_LOAD_TIMEOUT  = 30;
    private static final String DEFAULT_BROWSER            = "chrome";
    private static final int    DEFAULT_AI_MAX_ELEMENTS    = 25;

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath. A missing {@code config.properties}
     * is tolerated (all defaults apply); {@code config.local.properties} is optional.
     */
    public LocatorConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests: accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    LocatorConfig(Properties props) {
        this.props = props;
    }

    // ── Scan ──────────────────────────────────────────────────────────────

    /**
     * Default scan scope.
     *
     * @throws IllegalArgumentException if the configured value is neither {@code all} nor {@code interactive}
     */
    public ScanScope getScanScope() {
        return ScanScope.parse(props.getProperty(KEY_SCAN_SCOPE, DEFAULT_SCAN_SCOPE));
    }

    /** Identifying attributes besides {@code id}, lower-cased, in configured order. */
    public List<String> getIdentifyingAttributes() {
        String raw = props.getProperty(KEY_IDENTIFYING_ATTRS);
        if (raw == null || raw.isBlank()) return PipelineOptions.DEFAULT_IDENTIFYING_ATTRIBUTES;
        return Arrays.stream(raw.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty() && !"id".equals(s))
                .distinct()
                .collect(Collectors.toList());
    }

    public int getParallelism() {
        return Math.max(1, getInt(KEY_PARALLELISM, Runtime.getRuntime().availableProcessors()));
    }

    // ── Validation ────────────────────────────────────────────────────────

    public int getValidationThreads() {
        return Math.max(1, getInt(KEY_VALIDATION_THREADS, DEFAULT_VALIDATION_THREADS));
    }

    public Duration getValidationTimeout() {
        return Duration.ofSeconds(getInt(KEY_VALIDATION_TIMEOUT, DEFAULT_VALIDATION_TIMEOUT));
    }

    public Duration getAuthTimeout() {
        return Duration.ofSeconds(getInt(KEY_AUTH_TIMEOUT, DEFAULT_AUTH_TIMEOUT));
    }

    // ── Sources ───────────────────────────────────────────────────────────

    public Duration getHttpTimeout() {
        return Duration.ofSeconds(getInt(KEY_HTTP_TIMEOUT, DEFAULT_HTTP_TIMEOUT));
    }

    public Duration getPageLoadTimeout() {
        return Duration.ofSeconds(getInt(KEY_PAGE_LOAD_TIMEOUT, DEFAULT_PAGE_LOAD_TIMEOUT));
    }

    public String getBrowserType() {
        return props.getProperty(KEY_BROWSER, DEFAULT_BROWSER).trim().toLowerCase(Locale.ROOT);
    }

    // ── AI ────────────────────────────────────────────────────────────────

    public boolean isAiEnabled() {
        return Boolean.parseBoolean(props.getProperty(KEY_AI_ENABLED, "false").trim());
    }

    /** Upper bound on elements sent to the LLM per scan. */
    public int getAiMaxElements() {
        return getInt(KEY_AI_MAX_ELEMENTS, DEFAULT_AI_MAX_ELEMENTS);
    }

    /**
     * Creates an {@link LLMClient} from the {@code ai.llm.*} keys:
     * <ul>
     *   <li>{@code ai.llm.base.url}: {@code http://localhost:11434/v1}</li>
     *   <li>{@code ai.llm.model}: {@code qwen2.5-coder:32b}</li>
     *   <li>{@code ai.llm.temperature}: {@code 0.1}</li>
     *   <li>{@code ai.llm.max.tokens}: {@code 1024}</li>
     *   <li>{@code ai.llm.timeout.sec}: {@code 120}</li>
     *   <li>{@code ai.llm.retry.count}: {@code 2}</li>
     *   <li>{@code ai.llm.retry.delay.ms}: {@code 2000}</li>
     * </ul>
     */
    public LLMClient createLLMClient() {
        String baseUrl = props.getProperty("ai.llm.base.url", "http://localhost:11434/v1").trim();
        String model   = props.getProperty("ai.llm.model", "qwen2.5-coder:32b").trim();
        return new LLMClient(baseUrl, model,
                getDouble("ai.llm.temperature", 0.1),
                getInt("ai.llm.max.tokens", 1024),
                getInt("ai.llm.timeout.sec", 120),
                getInt("ai.llm.retry.count", 2),
                getLong("ai.llm.retry.delay.ms", 2000L));
    }

    // ── Pipeline ──────────────────────────────────────────────────────────

    /** Pipeline options from configuration: all labels, both frameworks. */
    public PipelineOptions toPipelineOptions() {
        return new PipelineOptions(MinStability.ALL, EnumSet.allOf(Framework.class), getScanScope(),
                getIdentifyingAttributes(), getParallelism());
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}; all settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}; using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
