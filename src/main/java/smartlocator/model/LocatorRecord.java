package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Exported view of a scored candidate: the row consumed by JSON, Markdown
 * and Page-Object exporters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocatorRecord {

    @JsonProperty("custom_name")
    private String customName;

    @JsonProperty("locator_type")
    private String locatorType;

    @JsonProperty("locator_value")
    private String locatorValue;

    @JsonProperty("stability")
    private String stability;

    @JsonProperty("stability_score")
    private int stabilityScore;

    @JsonProperty("automation_tool")
    private String automationTool;

    @JsonProperty("playwright_code")
    private String playwrightCode;

    @JsonProperty("selenium_code")
    private String seleniumCode;

    /** Null until validation runs. */
    @JsonProperty("validated")
    private Boolean validated;

    @JsonProperty("match_count")
    private Integer matchCount;

    @JsonProperty("validation_error")
    private String validationError;

    @JsonProperty("dynamic")
    private boolean dynamic;

    @JsonProperty("duplicate")
    private boolean duplicate;

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    public LocatorRecord() {}

    public String       getCustomName()      { return customName; }
    public String       getLocatorType()     { return locatorType; }
    public String       getLocatorValue()    { return locatorValue; }
    public String       getStability()       { return stability; }
    public int          getStabilityScore()  { return stabilityScore; }
    public String       getAutomationTool()  { return automationTool; }
    public String       getPlaywrightCode()  { return playwrightCode; }
    public String       getSeleniumCode()    { return seleniumCode; }
    public Boolean      getValidated()       { return validated; }
    public Integer      getMatchCount()      { return matchCount; }
    public String       getValidationError() { return validationError; }
    public boolean      isDynamic()          { return dynamic; }
    public boolean      isDuplicate()        { return duplicate; }
    public List<String> getWarnings()        { return warnings; }

    public void setCustomName(String customName)           { this.customName = customName; }
    public void setLocatorType(String locatorType)         { this.locatorType = locatorType; }
    public void setLocatorValue(String locatorValue)       { this.locatorValue = locatorValue; }
    public void setStability(String stability)             { this.stability = stability; }
    public void setStabilityScore(int stabilityScore)      { this.stabilityScore = stabilityScore; }
    public void setAutomationTool(String automationTool)   { this.automationTool = automationTool; }
    public void setPlaywrightCode(String playwrightCode)   { this.playwrightCode = playwrightCode; }
    public void setSeleniumCode(String seleniumCode)       { this.seleniumCode = seleniumCode; }
    public void setValidated(Boolean validated)            { this.validated = validated; }
    public void setMatchCount(Integer matchCount)          { this.matchCount = matchCount; }
    public void setValidationError(String validationError) { this.validationError = validationError; }
    public void setDynamic(boolean dynamic)                { this.dynamic = dynamic; }
    public void setDuplicate(boolean duplicate)            { this.duplicate = duplicate; }
    public void setWarnings(List<String> warnings)         { this.warnings = warnings != null ? warnings : new ArrayList<>(); }

    @Override
    public String toString() {
        return String.format("LocatorRecord{%s %s='%s' %s(%d)}",
                customName, locatorType, locatorValue, stability, stabilityScore);
    }
}
