package smartlocator.cli;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;
import smartlocator.export.LocatorReportWriter;
import smartlocator.model.LocatorReport;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives {@link LocatorCLI} in-process on inline markup, so no browser or
 * network is needed.
 */
public class LocatorCLITest {

    private static final String PAGE =
            "<form><input id='email' name='email' class='form-control'>"
          + "<button class='btn primary'>Sign in</button></form>";

    private Path tempDir;
    private StringWriter out;
    private StringWriter err;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("locator-cli-test-");
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> walk = Files.walk(tempDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private int run(String... args) {
        CommandLine cmd = LocatorCLI.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    // ── scan ──────────────────────────────────────────────────────────────

    @Test
    public void scan_inlineMarkup_writesReportAndPageObjects() throws IOException {
        Path outDir = tempDir.resolve("out");

        int exit = run("scan", "-i", PAGE, "-o", outDir.toString(), "-c", "LoginPage", "--markdown");

        assertThat(exit).as("stderr: %s", err).isZero();
        assertThat(outDir.resolve("locators.json")).exists();
        assertThat(outDir.resolve("LoginPagePlaywright.java")).exists();
        assertThat(outDir.resolve("LoginPageSelenium.java")).exists();
        assertThat(outDir.resolve("locators.md")).exists();
        assertThat(out.toString()).contains("Locators  :").contains("Report    :");

        LocatorReport report = LocatorReportWriter.read(outDir.resolve("locators.json"));
        assertThat(report.getMetadata().getSource()).isEqualTo("html_content");
        assertThat(report.getMetadata().getClassName()).isEqualTo("LoginPage");
        assertThat(report.getLocators()).extracting(r -> r.getLocatorValue()).contains("#email");
    }

    @Test
    public void scan_seleniumOnly_highStability() throws IOException {
        Path outDir = tempDir.resolve("selenium");

        int exit = run("scan", "-i", PAGE, "-o", outDir.toString(), "-f", "selenium", "-s", "High");

        assertThat(exit).isZero();
        assertThat(outDir.resolve("PageLocatorsSelenium.java")).exists();
        assertThat(outDir.resolve("PageLocatorsPlaywright.java")).doesNotExist();
        LocatorReport report = LocatorReportWriter.read(outDir.resolve("locators.json"));
        assertThat(report.getLocators()).isNotEmpty()
                .allMatch(r -> "High".equals(r.getStability()))
                .noneMatch(r -> "Role Selector".equals(r.getLocatorType()));
        assertThat(report.getMetadata().getMinStability()).isEqualTo("High");
    }

    @Test
    public void scan_missingFile_failsWithOneLine() {
        int exit = run("scan", "-i", tempDir.resolve("absent.html").toString(), "-o", tempDir.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: [load] Input file not found");
        assertThat(err.toString().trim().lines()).hasSize(1);
    }

    @Test
    public void scan_invalidClassName_fails() {
        int exit = run("scan", "-i", PAGE, "-o", tempDir.toString(), "-c", "my-page");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid Java class name: 'my-page'");
    }

    @Test
    public void scan_unknownFramework_fails() {
        int exit = run("scan", "-i", PAGE, "-o", tempDir.toString(), "-f", "Cypress");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown framework: 'Cypress'");
    }

    @Test
    public void scan_withoutInput_isUsageError() {
        assertThat(run("scan")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    // ── export ────────────────────────────────────────────────────────────

    @Test
    public void export_fromSavedReport_usesReportClassName() throws IOException {
        Path scanDir = tempDir.resolve("scan");
        assertThat(run("scan", "-i", PAGE, "-o", scanDir.toString(), "-c", "LoginPage")).isZero();
        Path exportDir = tempDir.resolve("export");

        int exit = run("export", scanDir.resolve("locators.json").toString(),
                "-o", exportDir.toString(), "-f", "Playwright", "-p", "com.acme.pages");

        assertThat(exit).as("stderr: %s", err).isZero();
        Path playwright = exportDir.resolve("LoginPagePlaywright.java");
        assertThat(playwright).exists();
        assertThat(Files.readString(playwright, StandardCharsets.UTF_8)).startsWith("package com.acme.pages;");
        assertThat(exportDir.resolve("LoginPageSelenium.java")).doesNotExist();
    }

    @Test
    public void export_missingReport_fails() {
        int exit = run("export", tempDir.resolve("nope.json").toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: [export] Report file not found");
    }

    // ── version / helpers ─────────────────────────────────────────────────

    @Test
    public void version_printsVersion() {
        assertThat(run("version")).isZero();
        assertThat(out.toString()).startsWith("Smart Locator " + LocatorCLI.VERSION);
    }

    @Test
    public void oneLine_keepsFirstLineOrClassName() {
        assertThat(LocatorCLI.oneLine(new IllegalStateException("first\nsecond"))).isEqualTo("first");
        assertThat(LocatorCLI.oneLine(new IllegalStateException())).isEqualTo("IllegalStateException");
    }
}
