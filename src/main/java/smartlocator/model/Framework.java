package smartlocator.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** Automation framework a report is generated for. */
public enum Framework {
    PLAYWRIGHT("Playwright"),
    SELENIUM("Selenium");

    private final String displayName;

    Framework(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    /**
     * Parses a case-insensitive framework name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Framework parse(String raw) {
        String key = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        for (Framework f : values()) {
            if (f.name().equals(key)) return f;
        }
        throw new IllegalArgumentException("Unknown framework: '" + raw
                + "' (expected Playwright or Selenium)");
    }

    /**
     * Parses a comma-separated list such as {@code "Playwright,Selenium"}.
     * Blank tokens are skipped; an empty result is an error.
     */
    public static Set<Framework> parseList(String csv) {
        Set<Framework> result = new LinkedHashSet<>();
        if (csv != null) {
            Arrays.stream(csv.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(s -> result.add(parse(s)));
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("No valid frameworks specified. Use Playwright and/or Selenium.");
        }
        return result;
    }
}
