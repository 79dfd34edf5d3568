package smartlocator.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.model.Framework;
import smartlocator.model.FrameworkTag;
import smartlocator.model.LocatorRecord;
import smartlocator.model.LocatorType;

import javax.lang.model.SourceVersion;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Generates Java Page Object classes from report rows: one locator per
 * custom name, the one with the highest stability score, ties broken by the
 * selector type the framework handles best.
 *
 * <ul>
 *   <li>{@code <Class>Playwright.java}: public {@code Locator} fields built in the constructor</li>
 *   <li>{@code <Class>Selenium.java}: {@code By} constants plus a finder method per element</li>
 * </ul>
 */
public class PageObjectExporter {

    private static final Logger log = LoggerFactory.getLogger(PageObjectExporter.class);

    private static final Map<LocatorType, Integer> PLAYWRIGHT_PREFERENCE =
            Map.of(LocatorType.ROLE, 0, LocatorType.CSS, 1, LocatorType.XPATH, 2);
    private static final Map<LocatorType, Integer> SELENIUM_PREFERENCE =
            Map.of(LocatorType.CSS, 0, LocatorType.XPATH, 1, LocatorType.ROLE, 9);

    private final String packageName;

    /** @param packageName package of the generated classes; {@code null} or blank for none */
    public PageObjectExporter(String packageName) {
        if (packageName != null && !packageName.isBlank() && !SourceVersion.isName(packageName.trim())) {
            throw new IllegalArgumentException("Invalid Java package name: " + packageName);
        }
        this.packageName = packageName == null || packageName.isBlank() ? null : packageName.trim();
    }

    public PageObjectExporter() {
        this(null);
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Best row per custom name for {@code framework}, sorted by name.
     * Rows the framework cannot execute are skipped.
     */
    public Map<String, LocatorRecord> selectBest(List<LocatorRecord> records, Framework framework) {
        Map<LocatorType, Integer> preference = framework == Framework.PLAYWRIGHT
                ? PLAYWRIGHT_PREFERENCE : SELENIUM_PREFERENCE;
        Comparator<LocatorRecord> better = Comparator
                .comparingInt(LocatorRecord::getStabilityScore)
                .thenComparing(r -> -preference.getOrDefault(typeOf(r), 9));

        Map<String, LocatorRecord> best = new TreeMap<>();
        for (LocatorRecord r : records) {
            if (!FrameworkTag.fromDisplayName(r.getAutomationTool()).supports(framework)) continue;
            if (framework == Framework.SELENIUM && typeOf(r) == LocatorType.ROLE) continue;
            String name = r.getCustomName() == null || r.getCustomName().isBlank() ? "element" : r.getCustomName();
            best.merge(name, r, (curr, cand) -> better.compare(cand, curr) > 0 ? cand : curr);
        }
        return best;
    }

    public String renderPlaywright(List<LocatorRecord> records, String className) {
        String cls = requireClassName(className) + "Playwright";
        Map<String, LocatorRecord> best = selectBest(records, Framework.PLAYWRIGHT);
        Map<String, String> fields = fieldNames(best);

        StringBuilder src = header();
        src.append("import com.microsoft.playwright.Locator;\n")
           .append("import com.microsoft.playwright.Page;\n")
           .append("import com.microsoft.playwright.options.AriaRole;\n\n")
           .append("public class ").append(cls).append(" {\n\n")
           .append("    private final Page page;\n\n");
        best.forEach((name, r) -> src.append("    public final Locator ").append(fields.get(name)).append(";\n"));
        src.append("\n    public ").append(cls).append("(Page page) {\n")
           .append("        this.page = page;\n");
        best.forEach((name, r) -> src.append("        this.").append(fields.get(name)).append(" = ")
                .append(CodeSnippets.playwrightLocator(typeOf(r), r.getLocatorValue())).append(";\n"));
        src.append("    }\n\n")
           .append("    public Page page() {\n")
           .append("        return page;\n")
           .append("    }\n")
           .append("}\n");
        return src.toString();
    }

    public String renderSelenium(List<LocatorRecord> records, String className) {
        String cls = requireClassName(className) + "Selenium";
        Map<String, LocatorRecord> best = selectBest(records, Framework.SELENIUM);
        Map<String, String> fields = fieldNames(best);

        StringBuilder src = header();
        src.append("import org.openqa.selenium.By;\n")
           .append("import org.openqa.selenium.WebDriver;\n")
           .append("import org.openqa.selenium.WebElement;\n\n")
           .append("public class ").append(cls).append(" {\n\n");
        best.forEach((name, r) -> src.append("    public static final By ").append(constant(fields.get(name)))
                .append(" = ").append(CodeSnippets.seleniumBy(typeOf(r), r.getLocatorValue())).append(";\n"));
        src.append("\n    private final WebDriver driver;\n\n")
           .append("    public ").append(cls).append("(WebDriver driver) {\n")
           .append("        this.driver = driver;\n")
           .append("    }\n");
        best.forEach((name, r) -> src.append("\n    public WebElement ").append(fields.get(name)).append("() {\n")
                .append("        return driver.findElement(").append(constant(fields.get(name))).append(");\n")
                .append("    }\n"));
        src.append("}\n");
        return src.toString();
    }

    /**
     * Writes one class per requested framework into {@code dir}.
     *
     * @return written files keyed by framework
     */
    public Map<Framework, Path> write(List<LocatorRecord> records, Set<Framework> frameworks,
                                      String className, Path dir) throws IOException {
        Files.createDirectories(dir);
        Map<Framework, Path> written = new LinkedHashMap<>();
        for (Framework f : frameworks) {
            String source = f == Framework.PLAYWRIGHT
                    ? renderPlaywright(records, className)
                    : renderSelenium(records, className);
            Path out = dir.resolve(className + f.displayName() + ".java");
            Files.writeString(out, source, StandardCharsets.UTF_8);
            log.info("Wrote {} Page Object to {}", f.displayName(), out);
            written.put(f, out);
        }
        return written;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private StringBuilder header() {
        StringBuilder sb = new StringBuilder();
        if (packageName != null) sb.append("package ").append(packageName).append(";\n\n");
        return sb;
    }

    private static LocatorType typeOf(LocatorRecord r) {
        return LocatorType.fromDisplayName(r.getLocatorType());
    }

    /** @throws IllegalArgumentException unless {@code className} is a usable Java class name */
    public static String requireClassName(String className) {
        if (className == null || !SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
            throw new IllegalArgumentException("Invalid Java class name: '" + className + "'");
        }
        return className;
    }

    /** Unique Java field names for the custom names, in map order. */
    static Map<String, String> fieldNames(Map<String, LocatorRecord> best) {
        Map<String, String> out = new LinkedHashMap<>();
        Set<String> used = new HashSet<>(List.of("page", "driver"));
        for (String name : best.keySet()) {
            String base = javaIdentifier(name);
            String candidate = base;
            for (int i = 2; !used.add(candidate); i++) {
                candidate = base + i;
            }
            out.put(name, candidate);
        }
        return out;
    }

    static String javaIdentifier(String name) {
        List<String> words = new ArrayList<>();
        for (String w : name.split("[^A-Za-z0-9]+")) {
            if (!w.isEmpty()) words.add(w);
        }
        if (words.isEmpty()) return "element";
        StringBuilder sb = new StringBuilder(words.get(0).substring(0, 1).toLowerCase(Locale.ROOT))
                .append(words.get(0).substring(1));
        for (int i = 1; i < words.size(); i++) {
            String w = words.get(i);
            sb.append(w.substring(0, 1).toUpperCase(Locale.ROOT)).append(w.substring(1));
        }
        String id = sb.toString();
        if (Character.isDigit(id.charAt(0))) id = "e" + id;
        return SourceVersion.isKeyword(id) ? id + "Element" : id;
    }

    /** {@code submitButton} to {@code SUBMIT_BUTTON}. */
    static String constant(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }
}
