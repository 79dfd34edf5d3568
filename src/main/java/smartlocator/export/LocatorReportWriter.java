package smartlocator.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.engine.SmartLocatorException;
import smartlocator.engine.Stage;
import smartlocator.model.LocatorReport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@code locators.json}.
 *
 * <p>On read the JSON is checked against {@code locator-report-schema.json}
 * before it is mapped, so hand-edited reports fail with a readable message.
 * On write the report is pretty-printed with ISO-8601 timestamps.
 */
public final class LocatorReportWriter {

    private static final Logger log = LoggerFactory.getLogger(LocatorReportWriter.class);

    public static final String FILE_NAME = "locators.json";

    private static final String SCHEMA_RESOURCE = "/locator-report-schema.json";

    /** Shared mapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static volatile JsonSchema schema;

    private LocatorReportWriter() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Writes {@code report} to {@code path}, creating parent directories.
     */
    public static void write(LocatorReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), report);
        log.info("Wrote {} locators to {}", report.getLocators().size(), path);
    }

    public static String toJson(LocatorReport report) throws IOException {
        return MAPPER.writeValueAsString(report);
    }

    /**
     * Reads a report written by {@link #write}.
     *
     * @throws IOException           if the file cannot be read or is not JSON
     * @throws SmartLocatorException (stage {@code export}) if the JSON does not match the report schema
     */
    public static LocatorReport read(Path path) throws IOException {
        log.debug("Reading locator report from {}", path);
        JsonNode tree = MAPPER.readTree(Files.readString(path));
        validateSchema(tree, path.toString());
        LocatorReport report = MAPPER.treeToValue(tree, LocatorReport.class);
        log.info("Loaded {} locators from {}", report.getLocators().size(), path);
        return report;
    }

    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode tree, String source) {
        JsonSchema s = getSchema();
        if (s == null) {
            log.warn("{} not found on classpath; skipping schema validation", SCHEMA_RESOURCE);
            return;
        }
        Set<ValidationMessage> errors = s.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Not a locator report: ").append(source);
            errors.forEach(e -> sb.append("\n  ").append(e.getMessage()));
            throw new SmartLocatorException(Stage.EXPORT, sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (schema == null) {
            synchronized (LocatorReportWriter.class) {
                if (schema == null) {
                    try (InputStream is = LocatorReportWriter.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) return null;
                        schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                        log.debug("Report schema loaded from {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load report schema: {}", e.getMessage());
                    }
                }
            }
        }
        return schema;
    }
}
