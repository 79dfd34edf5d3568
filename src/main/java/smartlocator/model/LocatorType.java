package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Selector syntax of a {@link LocatorCandidate}. Closed set: scoring, framework
 * tagging and export switch over it exhaustively.
 */
public enum LocatorType {
    CSS("CSS Selector"),
    XPATH("XPath"),
    ROLE("Role Selector");

    private final String displayName;

    LocatorType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() { return displayName; }

    /**
     * Inverse of {@link #displayName()}, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static LocatorType fromDisplayName(String name) {
        for (LocatorType t : values()) {
            if (t.displayName.equalsIgnoreCase(name == null ? "" : name.trim())) return t;
        }
        throw new IllegalArgumentException("Unknown locator type: '" + name + "'");
    }
}
