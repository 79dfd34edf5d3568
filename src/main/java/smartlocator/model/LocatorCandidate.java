package smartlocator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One selector proposed for one element, plus the annotations the later
 * pipeline phases attach to it.
 *
 * <p>Identity ({@code elementIndex}, {@code strategy}, {@code value} and the
 * strategy payload) is fixed at construction. The annotation fields are
 * written by exactly one phase each:
 * <ul>
 *   <li>detector: {@link #markDynamic}, {@link #markDuplicate}</li>
 *   <li>scorer: {@link #applyScore}</li>
 *   <li>aggregator: {@link #tagFramework}</li>
 *   <li>validator: {@link #recordMatchCount}, {@link #recordValidationError}</li>
 * </ul>
 * Phases run one after another, never concurrently on the same candidate.
 */
public class LocatorCandidate {

    private final int          elementIndex;
    private final Strategy     strategy;
    private final String       value;
    private final AttributeKey key;
    private final RoleQuery    roleQuery;
    private final String       customName;

    private Integer      stabilityScore;
    private boolean      dynamic;
    private boolean      duplicate;
    private FrameworkTag frameworkTag;
    private final List<String> warnings = new ArrayList<>();

    private Boolean validated;
    private Integer matchCount;
    private String  validationError;

    private LocatorCandidate(int elementIndex, Strategy strategy, String value,
                             AttributeKey key, RoleQuery roleQuery, String customName) {
        this.elementIndex = elementIndex;
        this.strategy     = Objects.requireNonNull(strategy, "strategy");
        this.value        = Objects.requireNonNull(value, "value");
        this.key          = key;
        this.roleQuery    = roleQuery;
        this.customName   = customName;
    }

    // ── Factories ─────────────────────────────────────────────────────────

    /** ID, ATTRIBUTE or CLASS candidate keyed by an identifying attribute pair. */
    public static LocatorCandidate attributeBased(int elementIndex, Strategy strategy, String value,
                                                  AttributeKey key, String customName) {
        if (strategy.type() != LocatorType.CSS) {
            throw new IllegalArgumentException("Attribute-keyed candidates must be CSS, got " + strategy);
        }
        return new LocatorCandidate(elementIndex, strategy, value,
                Objects.requireNonNull(key, "key"), null, customName);
    }

    public static LocatorCandidate role(int elementIndex, String value, RoleQuery roleQuery, String customName) {
        Objects.requireNonNull(roleQuery, "roleQuery");
        return new LocatorCandidate(elementIndex, Strategy.ROLE, value,
                AttributeKey.of(AttributeKey.ROLE, roleQuery.frequencyValue()), roleQuery, customName);
    }

    public static LocatorCandidate absoluteXPath(int elementIndex, String xpath, String customName) {
        return new LocatorCandidate(elementIndex, Strategy.ABSOLUTE_XPATH, xpath, null, null, customName);
    }

    // ── Identity ──────────────────────────────────────────────────────────

    public int          getElementIndex() { return elementIndex; }
    public Strategy     getStrategy()     { return strategy; }
    public LocatorType  getType()         { return strategy.type(); }
    public String       getValue()        { return value; }
    public String       getCustomName()   { return customName; }

    /** Identifying attribute pair, or {@code null} for absolute XPath. */
    public AttributeKey getKey()          { return key; }

    /** Role payload, or {@code null} unless this is a role selector. */
    public RoleQuery    getRoleQuery()    { return roleQuery; }

    // ── Annotations ───────────────────────────────────────────────────────

    public Integer      getStabilityScore() { return stabilityScore; }
    public boolean      isDynamic()         { return dynamic; }
    public boolean      isDuplicate()       { return duplicate; }
    public FrameworkTag getFrameworkTag()   { return frameworkTag; }
    public List<String> getWarnings()       { return Collections.unmodifiableList(warnings); }
    public Boolean      getValidated()      { return validated; }
    public Integer      getMatchCount()     { return matchCount; }
    public String       getValidationError(){ return validationError; }

    public boolean isScored() { return stabilityScore != null; }

    /**
     * Label derived from the current score.
     *
     * @throws IllegalStateException if the scorer has not run yet
     */
    public StabilityLabel getStabilityLabel() {
        if (stabilityScore == null) {
            throw new IllegalStateException("Candidate not scored yet: " + this);
        }
        return StabilityLabel.fromScore(stabilityScore);
    }

    public void markDynamic(String warning) {
        this.dynamic = true;
        addWarning(warning);
    }

    public void markDuplicate(String warning) {
        this.duplicate = true;
        addWarning(warning);
    }

    public void applyScore(int score) {
        if (score < 1 || score > 10) {
            throw new IllegalArgumentException("Stability score out of range [1,10]: " + score);
        }
        this.stabilityScore = score;
    }

    public void tagFramework(FrameworkTag tag) {
        this.frameworkTag = tag;
    }

    /** Appends a warning unless an identical one is already recorded. */
    public void addWarning(String warning) {
        if (warning != null && !warning.isBlank() && !warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public void recordMatchCount(int count) {
        this.validated       = Boolean.TRUE;
        this.matchCount      = count;
        this.validationError = null;
    }

    public void recordValidationError(String error) {
        this.validated       = Boolean.TRUE;
        this.validationError = error == null || error.isBlank() ? "Unknown validation error" : error;
    }

    @Override
    public String toString() {
        return String.format("LocatorCandidate{#%d %s '%s'%s%s%s}",
                elementIndex, strategy, value,
                stabilityScore != null ? " score=" + stabilityScore : "",
                dynamic ? " [DYNAMIC]" : "",
                duplicate ? " [DUPLICATE]" : "");
    }
}
