package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document-level counts for the exported report. Map keys are lower-case
 * ({@code css}/{@code xpath}/{@code role}, {@code playwright}/{@code selenium}/{@code both},
 * {@code high}/{@code medium}/{@code low}) and always present, zero when unused.
 */
public class LocatorSummary {

    @JsonProperty("total_elements")
    private int totalElements;

    @JsonProperty("total_locators")
    private int totalLocators;

    @JsonProperty("locator_distribution")
    private Map<String, Integer> locatorDistribution = new LinkedHashMap<>();

    @JsonProperty("framework_split")
    private Map<String, Integer> frameworkSplit = new LinkedHashMap<>();

    @JsonProperty("stability")
    private Map<String, Integer> stability = new LinkedHashMap<>();

    public LocatorSummary() {}

    public LocatorSummary(int totalElements, int totalLocators,
                          Map<String, Integer> locatorDistribution,
                          Map<String, Integer> frameworkSplit,
                          Map<String, Integer> stability) {
        this.totalElements       = totalElements;
        this.totalLocators       = totalLocators;
        this.locatorDistribution = new LinkedHashMap<>(locatorDistribution);
        this.frameworkSplit      = new LinkedHashMap<>(frameworkSplit);
        this.stability           = new LinkedHashMap<>(stability);
    }

    public int                  getTotalElements()       { return totalElements; }
    public int                  getTotalLocators()       { return totalLocators; }
    public Map<String, Integer> getLocatorDistribution() { return locatorDistribution; }
    public Map<String, Integer> getFrameworkSplit()      { return frameworkSplit; }
    public Map<String, Integer> getStability()           { return stability; }

    @Override
    public String toString() {
        return String.format("LocatorSummary{elements=%d, locators=%d, types=%s, frameworks=%s, stability=%s}",
                totalElements, totalLocators, locatorDistribution, frameworkSplit, stability);
    }
}
