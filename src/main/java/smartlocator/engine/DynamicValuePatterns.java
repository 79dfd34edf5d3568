package smartlocator.engine;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Heuristics for attribute values that look machine-generated and are likely
 * to change between builds or page loads.
 *
 * <p>Numeric checks run on tokens split at non-alphanumerics and at
 * letter/digit boundaries ({@code item12345} → {@code item}, {@code 12345});
 * the hex check runs on tokens split at non-alphanumerics only and needs at
 * least one digit, so plain words such as {@code deadbeef} or {@code facade}
 * are not flagged.
 */
public final class DynamicValuePatterns {

    private static final Pattern UUID = Pattern.compile(
            "(?i)(?<![0-9a-f])[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}(?![0-9a-f])");
    private static final Pattern TIMESTAMP = Pattern.compile(
            "(?<!\\d)(19|20)\\d{2}[-_/.]?(0[1-9]|1[0-2])[-_/.]?(0[1-9]|[12]\\d|3[01])(?!\\d)");
    private static final Pattern EPOCH = Pattern.compile("^\\d{10}(\\d{3})?$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern HEX = Pattern.compile("^(?i)[0-9a-f]+$");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");

    static final int MIN_NUMERIC_LENGTH = 4;
    static final int MIN_HEX_LENGTH = 8;

    private DynamicValuePatterns() {}

    /**
     * Describes why {@code value} looks generated, or empty when it does not.
     */
    public static Optional<String> reason(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();

        if (UUID.matcher(v).find()) return Optional.of("UUID");
        if (TIMESTAMP.matcher(v).find()) return Optional.of("timestamp-like digits");

        for (String token : v.split("[^A-Za-z0-9]+")) {
            if (token.isEmpty()) continue;
            if (EPOCH.matcher(token).matches()) return Optional.of("timestamp-like digits");
            if (token.length() >= MIN_HEX_LENGTH && HEX.matcher(token).matches()
                    && HAS_DIGIT.matcher(token).find() && !DIGITS.matcher(token).matches()) {
                return Optional.of("hexadecimal token");
            }
            for (String part : token.split("(?<=\\d)(?=\\D)|(?<=\\D)(?=\\d)")) {
                if (part.length() >= MIN_NUMERIC_LENGTH && DIGITS.matcher(part).matches()) {
                    return Optional.of("numeric token");
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isDynamic(String value) {
        return reason(value).isPresent();
    }
}
