package smartlocator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which frameworks can execute a candidate's selector syntax. */
public enum FrameworkTag {
    PLAYWRIGHT_ONLY("Playwright"),
    SELENIUM_ONLY("Selenium"),
    BOTH("Both");

    private final String displayName;

    FrameworkTag(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() { return displayName; }

    /** Role selectors need accessibility-role queries, which only Playwright offers. */
    public static FrameworkTag forType(LocatorType type) {
        switch (type) {
            case ROLE:
                return PLAYWRIGHT_ONLY;
            case CSS:
            case XPATH:
                return BOTH;
            default:
                throw new IllegalArgumentException("Unhandled locator type: " + type);
        }
    }

    /** Inverse of {@link #displayName()}; unknown or missing names mean {@link #BOTH}. */
    public static FrameworkTag fromDisplayName(String name) {
        for (FrameworkTag t : values()) {
            if (t.displayName.equalsIgnoreCase(name == null ? "" : name.trim())) return t;
        }
        return BOTH;
    }

    public boolean supports(Framework framework) {
        switch (this) {
            case BOTH:
                return true;
            case PLAYWRIGHT_ONLY:
                return framework == Framework.PLAYWRIGHT;
            case SELENIUM_ONLY:
                return framework == Framework.SELENIUM;
            default:
                return false;
        }
    }
}
