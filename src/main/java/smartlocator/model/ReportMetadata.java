package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Run parameters recorded at the top of {@code locators.json}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportMetadata {

    @JsonProperty("generated_at")
    private Instant generatedAt;

    /** The URL, the file path, or {@code "html_content"} for raw markup. */
    @JsonProperty("source")
    private String source;

    @JsonProperty("frameworks")
    private List<String> frameworks = new ArrayList<>();

    @JsonProperty("min_stability")
    private String minStability;

    @JsonProperty("validated")
    private boolean validated;

    @JsonProperty("ai_enriched")
    private boolean aiEnriched;

    @JsonProperty("class_name")
    private String className;

    public ReportMetadata() {}

    public Instant      getGeneratedAt()  { return generatedAt; }
    public String       getSource()       { return source; }
    public List<String> getFrameworks()   { return frameworks; }
    public String       getMinStability() { return minStability; }
    public boolean      isValidated()     { return validated; }
    public boolean      isAiEnriched()    { return aiEnriched; }
    public String       getClassName()    { return className; }

    public void setGeneratedAt(Instant generatedAt)    { this.generatedAt = generatedAt; }
    public void setSource(String source)               { this.source = source; }
    public void setFrameworks(List<String> frameworks) { this.frameworks = frameworks; }
    public void setMinStability(String minStability)   { this.minStability = minStability; }
    public void setValidated(boolean validated)        { this.validated = validated; }
    public void setAiEnriched(boolean aiEnriched)      { this.aiEnriched = aiEnriched; }
    public void setClassName(String className)         { this.className = className; }
}
