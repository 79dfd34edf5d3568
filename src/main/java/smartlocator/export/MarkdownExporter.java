package smartlocator.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.model.LocatorRecord;
import smartlocator.model.LocatorReport;
import smartlocator.model.LocatorSummary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Renders a report as a Markdown summary plus one table row per locator. */
public class MarkdownExporter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownExporter.class);

    public static final String FILE_NAME = "locators.md";

    public String render(LocatorReport report) {
        StringBuilder md = new StringBuilder();
        String title = report.getMetadata() != null && report.getMetadata().getClassName() != null
                ? report.getMetadata().getClassName()
                : "Page";
        md.append("# Locators: ").append(title).append("\n\n");

        if (report.getMetadata() != null) {
            md.append("- Source: `").append(report.getMetadata().getSource()).append("`\n");
            md.append("- Frameworks: ").append(String.join(", ", report.getMetadata().getFrameworks())).append('\n');
            md.append("- Minimum stability: ").append(report.getMetadata().getMinStability()).append('\n');
        }
        LocatorSummary s = report.getSummary();
        if (s != null) {
            md.append("- Elements scanned: ").append(s.getTotalElements()).append('\n');
            md.append("- Locators: ").append(s.getTotalLocators()).append('\n');
            md.append("- Stability: ").append(counts(s.getStability())).append('\n');
            md.append("- Types: ").append(counts(s.getLocatorDistribution())).append('\n');
        }
        md.append('\n');

        boolean validated = report.getLocators().stream().anyMatch(r -> r.getValidated() != null);
        md.append("| Name | Type | Locator | Stability | Score | Tool | Flags |");
        if (validated) md.append(" Matches |");
        md.append('\n');
        md.append("|---|---|---|---|---|---|---|");
        if (validated) md.append("---|");
        md.append('\n');

        for (LocatorRecord r : report.getLocators()) {
            md.append("| ").append(cell(r.getCustomName()))
              .append(" | ").append(cell(r.getLocatorType()))
              .append(" | `").append(code(r.getLocatorValue())).append('`')
              .append(" | ").append(cell(r.getStability()))
              .append(" | ").append(r.getStabilityScore())
              .append(" | ").append(cell(r.getAutomationTool()))
              .append(" | ").append(flags(r))
              .append(" |");
            if (validated) md.append(' ').append(matches(r)).append(" |");
            md.append('\n');
        }
        return md.toString();
    }

    public Path write(LocatorReport report, Path dir) throws IOException {
        Files.createDirectories(dir);
        Path out = dir.resolve(FILE_NAME);
        Files.writeString(out, render(report), StandardCharsets.UTF_8);
        log.info("Wrote Markdown table to {}", out);
        return out;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private static String flags(LocatorRecord r) {
        List<String> f = new ArrayList<>();
        if (r.isDynamic())   f.add("dynamic");
        if (r.isDuplicate()) f.add("duplicate");
        return f.isEmpty() ? "" : String.join(", ", f);
    }

    private static String matches(LocatorRecord r) {
        if (r.getValidationError() != null) return "error: " + cell(r.getValidationError());
        if (r.getMatchCount() != null) return String.valueOf(r.getMatchCount());
        return "";
    }

    private static String counts(Map<String, Integer> m) {
        StringBuilder sb = new StringBuilder();
        m.forEach((k, v) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(k).append(' ').append(v);
        });
        return sb.toString();
    }

    static String cell(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\").replace("|", "\\|").replaceAll("\\s+", " ");
    }

    /** Inline code cannot hold backticks, and pipes would still split the row. */
    static String code(String s) {
        return s == null ? "" : s.replace("`", "'").replace("|", "\\|").replaceAll("\\s+", " ");
    }
}
