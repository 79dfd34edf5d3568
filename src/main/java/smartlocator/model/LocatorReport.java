package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of {@code locators.json}: metadata, summary, the filtered and ranked
 * locators, and AI suggestions when an enrichment adapter produced any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocatorReport {

    @JsonProperty("metadata")
    private ReportMetadata metadata;

    @JsonProperty("summary")
    private LocatorSummary summary;

    @JsonProperty("locators")
    private List<LocatorRecord> locators = new ArrayList<>();

    /** Omitted entirely when no adapter is configured or it returned nothing. */
    @JsonProperty("ai_suggestions")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<ElementSuggestion> aiSuggestions = new ArrayList<>();

    public LocatorReport() {}

    public ReportMetadata          getMetadata()      { return metadata; }
    public LocatorSummary          getSummary()       { return summary; }
    public List<LocatorRecord>     getLocators()      { return locators; }
    public List<ElementSuggestion> getAiSuggestions() { return aiSuggestions; }

    public void setMetadata(ReportMetadata metadata)   { this.metadata = metadata; }
    public void setSummary(LocatorSummary summary)     { this.summary = summary; }
    public void setLocators(List<LocatorRecord> locators) {
        this.locators = locators != null ? locators : new ArrayList<>();
    }
    public void setAiSuggestions(List<ElementSuggestion> aiSuggestions) {
        this.aiSuggestions = aiSuggestions != null ? aiSuggestions : new ArrayList<>();
    }

    @Override
    public String toString() {
        return String.format("LocatorReport{locators=%d, summary=%s}", locators.size(), summary);
    }
}
