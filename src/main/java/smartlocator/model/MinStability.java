package smartlocator.model;

import java.util.Locale;

/**
 * Minimum stability threshold applied by the aggregator.
 * {@code LOW} and {@code ALL} both keep every candidate.
 */
public enum MinStability {
    HIGH,
    MEDIUM,
    ALL;

    public boolean accepts(StabilityLabel label) {
        switch (this) {
            case HIGH:
                return label == StabilityLabel.HIGH;
            case MEDIUM:
                return label != StabilityLabel.LOW;
            case ALL:
            default:
                return true;
        }
    }

    /**
     * Parses {@code High}, {@code Medium}, {@code Low} or {@code All}
     * case-insensitively; {@code null} or blank means {@link #ALL}.
     */
    public static MinStability parse(String raw) {
        if (raw == null || raw.isBlank()) return ALL;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high":
                return HIGH;
            case "medium":
                return MEDIUM;
            case "low":
            case "all":
            case "none":
                return ALL;
            default:
                throw new IllegalArgumentException("Unknown minimum stability: '" + raw
                        + "' (expected High, Medium, Low or All)");
        }
    }
}
