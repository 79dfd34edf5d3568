package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative stability derived from the numeric score.
 *
 * <p>{@link #fromScore(int)} is the only way to obtain a label for a score;
 * filters and exporters must go through it.
 */
public enum StabilityLabel {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    /** Lowest score labelled High. */
    public static final int HIGH_THRESHOLD = 8;
    /** Lowest score labelled Medium. */
    public static final int MEDIUM_THRESHOLD = 4;

    private final String displayName;

    StabilityLabel(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() { return displayName; }

    public static StabilityLabel fromScore(int score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
