package smartlocator.export;

import smartlocator.engine.ScanResult;
import smartlocator.model.Framework;
import smartlocator.model.FrameworkTag;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.LocatorRecord;
import smartlocator.model.LocatorReport;
import smartlocator.model.ReportMetadata;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Turns pipeline output into the serialisable {@link LocatorReport}. */
public class ReportAssembler {

    /** Recorded as the source of inline markup. */
    public static final String RAW_SOURCE = "html_content";

    public LocatorRecord toRecord(LocatorCandidate c) {
        FrameworkTag tag = c.getFrameworkTag() != null ? c.getFrameworkTag() : FrameworkTag.forType(c.getType());

        LocatorRecord r = new LocatorRecord();
        r.setCustomName(c.getCustomName());
        r.setLocatorType(c.getType().displayName());
        r.setLocatorValue(c.getValue());
        r.setStability(c.getStabilityLabel().displayName());
        r.setStabilityScore(c.getStabilityScore());
        r.setAutomationTool(tag.displayName());
        if (tag.supports(Framework.PLAYWRIGHT)) {
            r.setPlaywrightCode(CodeSnippets.playwrightLocator(c.getType(), c.getValue()));
        }
        if (tag.supports(Framework.SELENIUM)) {
            r.setSeleniumCode(CodeSnippets.seleniumFind(c.getType(), c.getValue()));
        }
        r.setValidated(c.getValidated());
        r.setMatchCount(c.getMatchCount());
        r.setValidationError(c.getValidationError());
        r.setDynamic(c.isDynamic());
        r.setDuplicate(c.isDuplicate());
        r.setWarnings(List.copyOf(c.getWarnings()));
        return r;
    }

    /**
     * @param source     URL, file path, or {@code null} for inline markup
     * @param frameworks frameworks the run was made for
     * @param minLabel   requested minimum stability as given, e.g. {@code "High"}; {@code null} for none
     * @param className  Page Object class name
     * @param aiEnriched whether enrichment was requested for the run
     */
    public LocatorReport assemble(ScanResult result, String source, Set<Framework> frameworks,
                                  String minLabel, String className, boolean aiEnriched) {
        ReportMetadata meta = new ReportMetadata();
        meta.setGeneratedAt(Instant.now());
        meta.setSource(source != null ? source : RAW_SOURCE);
        meta.setFrameworks(frameworks.stream().map(Framework::displayName).collect(Collectors.toList()));
        meta.setMinStability(minLabel != null ? minLabel : "None");
        meta.setValidated(result.isValidated());
        meta.setAiEnriched(aiEnriched);
        meta.setClassName(className);

        LocatorReport report = new LocatorReport();
        report.setMetadata(meta);
        report.setSummary(result.summary());
        report.setLocators(result.locators().stream().map(this::toRecord).collect(Collectors.toList()));
        report.setAiSuggestions(result.suggestions());
        return report;
    }
}
