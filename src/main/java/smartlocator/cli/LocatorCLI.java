package smartlocator.cli;

import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import smartlocator.ai.LlmEnrichmentAdapter;
import smartlocator.config.LocatorConfig;
import smartlocator.dom.DomParser;
import smartlocator.engine.LocatorPipeline;
import smartlocator.engine.PipelineOptions;
import smartlocator.engine.ScanResult;
import smartlocator.engine.ScanScope;
import smartlocator.engine.SmartLocatorException;
import smartlocator.engine.Stage;
import smartlocator.export.LocatorReportWriter;
import smartlocator.export.MarkdownExporter;
import smartlocator.export.PageObjectExporter;
import smartlocator.export.ReportAssembler;
import smartlocator.model.ElementModel;
import smartlocator.model.Framework;
import smartlocator.model.LocatorReport;
import smartlocator.model.LocatorSummary;
import smartlocator.model.MinStability;
import smartlocator.source.BrowserFactory;
import smartlocator.source.DocumentLoader;
import smartlocator.source.LoadedDocument;
import smartlocator.validation.AuthOptions;
import smartlocator.validation.LocatorValidator;
import smartlocator.validation.ValidationOutcome;
import smartlocator.validation.ValidationSession;
import smartlocator.validation.WebDriverSelectorResolver;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry-point for Smart Locator.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code smart-locator scan}    generate ranked locators for a URL, file or inline markup</li>
 *   <li>{@code smart-locator export}  re-emit Page Objects and Markdown from a saved {@code locators.json}</li>
 *   <li>{@code smart-locator version} print build version</li>
 * </ul>
 *
 * <p>Fatal errors end the process with exit code 1 and a one-line message on stderr.
 */
@Command(
        name        = "smart-locator",
        description = "Generates stable, ranked element locators for Playwright and Selenium",
        version     = LocatorCLI.VERSION,
        mixinStandardHelpOptions = true,
        subcommands = {
                LocatorCLI.ScanCommand.class,
                LocatorCLI.ExportCommand.class,
                LocatorCLI.VersionCommand.class
        }
)
public class LocatorCLI implements Callable<Integer> {

    static final String VERSION = "1.0.0-SNAPSHOT";

    private static final Logger log = LoggerFactory.getLogger(LocatorCLI.class);

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /** Command line with the fatal-error mapping installed. */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new LocatorCLI());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.debug("Command failed", ex);
            commandLine.getErr().println("Error: " + oneLine(ex));
            commandLine.getErr().flush();
            return 1;
        });
        return cmd;
    }

    static String oneLine(Throwable ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) msg = ex.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl >= 0 ? msg.substring(0, nl).trim() : msg.trim();
    }

    // ── Scan ──────────────────────────────────────────────────────────────────

    /**
     * Loads a document, runs the locator pipeline and writes
     * {@code locators.json}, the Page Objects and optionally {@code locators.md}.
     */
    @Command(
            name        = "scan",
            description = "Generate ranked locators for a page",
            mixinStandardHelpOptions = true
    )
    static class ScanCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

        @Spec
        CommandSpec spec;

        @Option(names = {"-i", "--input"}, required = true,
                description = "URL, HTML file path or inline HTML markup")
        String input;

        @Option(names = {"-f", "--frameworks"}, defaultValue = "Playwright,Selenium",
                description = "Comma-separated target frameworks (default: ${DEFAULT-VALUE})")
        String frameworks;

        @Option(names = {"-o", "--output"}, defaultValue = "output",
                description = "Output directory (default: ${DEFAULT-VALUE})")
        Path outputDir;

        @Option(names = {"-c", "--class-name"}, defaultValue = "PageLocators",
                description = "Page Object class name (default: ${DEFAULT-VALUE})")
        String className;

        @Option(names = {"-s", "--min-stability"},
                description = "Minimum stability label: High, Medium or Low (default: all)")
        String minStability;

        @Option(names = "--js", description = "Render the page in a headless browser before scanning")
        boolean renderJs;

        @Option(names = "--validate", description = "Resolve each locator against the live page")
        boolean validate;

        @Option(names = "--scope", description = "Elements to scan: interactive or all (default from config)")
        String scope;

        @Option(names = "--markdown", description = "Also write " + MarkdownExporter.FILE_NAME)
        boolean markdown;

        @Option(names = "--ai", description = "Ask the configured LLM for extra locator suggestions")
        boolean ai;

        @Option(names = "--auth-storage-state", description = "Storage state JSON with cookies and localStorage")
        Path authStorageState;

        @Option(names = "--auth-url", description = "Login page URL")
        String authUrl;

        @Option(names = "--auth-user", description = "Login user name")
        String authUser;

        @Option(names = "--auth-pass", description = "Login password")
        String authPass;

        @Option(names = "--user-selector", description = "CSS selector of the user name field")
        String userSelector;

        @Option(names = "--pass-selector", description = "CSS selector of the password field")
        String passSelector;

        @Option(names = "--submit-selector", description = "CSS selector of the submit button")
        String submitSelector;

        @Option(names = "--auth-wait-selector", description = "CSS selector that appears after login")
        String authWaitSelector;

        @Option(names = "--auth-wait-url-contains", description = "URL fragment expected after login")
        String authWaitUrlContains;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            LocatorConfig config = new LocatorConfig();

            Set<Framework> selected = Framework.parseList(frameworks);
            PipelineOptions options = config.toPipelineOptions()
                    .withFrameworks(selected)
                    .withMinStability(MinStability.parse(minStability))
                    .withScope(scope != null ? ScanScope.parse(scope) : config.getScanScope());
            PageObjectExporter pageObjects = new PageObjectExporter();
            PageObjectExporter.requireClassName(className);

            BrowserFactory browsers = new BrowserFactory(config.getBrowserType(), config.getPageLoadTimeout());
            LoadedDocument doc = new DocumentLoader(config.getHttpTimeout(), browsers).load(input, renderJs);
            out.printf("Source    : %s (%s)%n", doc.source(), doc.kind().name().toLowerCase(Locale.ROOT));

            ElementModel model = new DomParser().parse(doc.markup());
            LocatorPipeline pipeline = new LocatorPipeline(options);

            boolean aiRequested = ai || config.isAiEnabled();
            if (aiRequested) {
                pipeline.withEnrichment(new LlmEnrichmentAdapter(config.createLLMClient()), config.getAiMaxElements());
            }

            ScanResult result;
            WebDriver driver = null;
            try {
                if (validate && doc.isLive()) {
                    driver = browsers.get();
                    AuthOptions auth = authOptions();
                    ValidationSession session = new ValidationSession(
                            auth.toAuthenticator(driver, doc.pageUrl(), config.getAuthTimeout()),
                            config.getAuthTimeout());
                    LocatorValidator validator = new LocatorValidator(new WebDriverSelectorResolver(driver),
                            config.getValidationThreads(), config.getValidationTimeout());
                    pipeline.withValidation(validator, session);
                } else if (validate) {
                    log.warn("Validation skipped: inline markup has no page to resolve against");
                }
                result = pipeline.run(model);
            } finally {
                if (driver != null) {
                    quietQuit(driver);
                }
            }

            LocatorReport report = new ReportAssembler().assemble(result,
                    doc.kind() == LoadedDocument.Kind.RAW ? null : doc.source(),
                    selected, minStability, className, aiRequested);

            Path json = writeAll(report, selected, pageObjects);
            printSummary(out, result, json);
            return 0;
        }

        AuthOptions authOptions() {
            return new AuthOptions()
                    .setStorageState(authStorageState)
                    .setAuthUrl(authUrl)
                    .setUser(authUser)
                    .setPassword(authPass)
                    .setUserSelector(userSelector)
                    .setPassSelector(passSelector)
                    .setSubmitSelector(submitSelector)
                    .setWaitSelector(authWaitSelector)
                    .setWaitUrlContains(authWaitUrlContains);
        }

        private Path writeAll(LocatorReport report, Set<Framework> selected, PageObjectExporter pageObjects) {
            try {
                Files.createDirectories(outputDir);
                Path json = outputDir.resolve(LocatorReportWriter.FILE_NAME);
                LocatorReportWriter.write(report, json);
                pageObjects.write(report.getLocators(), selected, className, outputDir);
                if (markdown) {
                    new MarkdownExporter().write(report, outputDir);
                }
                return json;
            } catch (IOException e) {
                throw new SmartLocatorException(Stage.EXPORT, "Cannot write to " + outputDir + ": " + e.getMessage(), e);
            }
        }

        private static void printSummary(PrintWriter out, ScanResult result, Path json) {
            LocatorSummary s = result.summary();
            out.printf("Elements  : %d%n", s.getTotalElements());
            out.printf("Locators  : %d%n", s.getTotalLocators());
            out.printf("Types     : %s%n", s.getLocatorDistribution());
            out.printf("Stability : %s%n", s.getStability());
            result.validationOutcome().ifPresent(v -> printValidation(out, v));
            if (!result.suggestions().isEmpty()) {
                out.printf("AI        : suggestions for %d element(s)%n", result.suggestions().size());
            }
            out.printf("Report    : %s%n", json.toAbsolutePath());
        }

        private static void printValidation(PrintWriter out, ValidationOutcome v) {
            if (v.isAborted()) {
                out.printf("Validation: aborted (%s)%n", v.abortReason());
            } else {
                out.printf("Validation: %d resolved, %d error(s) of %d%n", v.resolved(), v.errors(), v.attempted());
            }
        }

        private static void quietQuit(WebDriver driver) {
            try {
                driver.quit();
            } catch (RuntimeException e) {
                log.warn("Failed to close browser: {}", e.getMessage());
            }
        }
    }

    // ── Export ────────────────────────────────────────────────────────────────

    /**
     * Re-emits Page Objects (and optionally Markdown) from an existing report.
     */
    @Command(
            name        = "export",
            description = "Generate Page Objects from a saved " + LocatorReportWriter.FILE_NAME,
            mixinStandardHelpOptions = true
    )
    static class ExportCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to " + LocatorReportWriter.FILE_NAME)
        Path reportFile;

        @Option(names = {"-f", "--frameworks"}, defaultValue = "Playwright,Selenium",
                description = "Comma-separated target frameworks (default: ${DEFAULT-VALUE})")
        String frameworks;

        @Option(names = {"-c", "--class-name"},
                description = "Page Object class name (default: the report's class_name)")
        String className;

        @Option(names = {"-o", "--output"}, defaultValue = "output",
                description = "Output directory (default: ${DEFAULT-VALUE})")
        Path outputDir;

        @Option(names = {"-p", "--package"}, description = "Java package of the generated classes")
        String packageName;

        @Option(names = "--markdown", description = "Also write " + MarkdownExporter.FILE_NAME)
        boolean markdown;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            if (!Files.exists(reportFile)) {
                throw new SmartLocatorException(Stage.EXPORT, "Report file not found: " + reportFile.toAbsolutePath());
            }
            LocatorReport report = LocatorReportWriter.read(reportFile);

            String cls = className;
            if (cls == null && report.getMetadata() != null) cls = report.getMetadata().getClassName();
            if (cls == null) cls = "PageLocators";

            Set<Framework> selected = Framework.parseList(frameworks);
            Map<Framework, Path> written = new PageObjectExporter(packageName)
                    .write(report.getLocators(), selected, cls, outputDir);
            written.forEach((f, p) -> out.printf("%-10s: %s%n", f.displayName(), p.toAbsolutePath()));
            if (markdown) {
                out.printf("%-10s: %s%n", "Markdown", new MarkdownExporter().write(report, outputDir).toAbsolutePath());
            }
            return 0;
        }
    }

    // ── Version ───────────────────────────────────────────────────────────────

    @Command(
            name        = "version",
            description = "Print Smart Locator version",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().getOut().println("Smart Locator " + VERSION);
            spec.commandLine().getOut().println("Selenium WebDriver 4.21.0 | jsoup 1.17.2 | Jackson 2.17.1");
            return 0;
        }
    }
}
