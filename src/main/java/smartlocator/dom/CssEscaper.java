package smartlocator.dom;

/**
 * CSS serialisation helpers (CSSOM "serialize an identifier" and
 * "serialize a string").
 */
public final class CssEscaper {

    private CssEscaper() {}

    /** Escapes {@code ident} so it can follow {@code #} or {@code .} in a selector. */
    public static String identifier(String ident) {
        StringBuilder sb = new StringBuilder(ident.length() + 8);
        int length = ident.length();
        for (int i = 0; i < length; i++) {
            char c = ident.charAt(i);
            if (c == 0) {
                sb.append('\uFFFD');
            } else if ((c >= 0x01 && c <= 0x1F) || c == 0x7F
                    || (i == 0 && isDigit(c))
                    || (i == 1 && isDigit(c) && ident.charAt(0) == '-')) {
                sb.append('\\').append(Integer.toHexString(c)).append(' ');
            } else if (i == 0 && c == '-' && length == 1) {
                sb.append("\\-");
            } else if (c >= 0x80 || c == '-' || c == '_' || isDigit(c)
                    || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.toString();
    }

    /** Double-quoted CSS string literal, e.g. {@code "a \"b\""}. */
    public static String quoted(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if ((c >= 0x01 && c <= 0x1F) || c == 0x7F) {
                sb.append('\\').append(Integer.toHexString(c)).append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Reverses {@link #quoted}: strips the surrounding quotes and resolves
     * backslash escapes, hex escapes included.
     *
     * @throws IllegalArgumentException if {@code literal} is not a double-quoted string
     */
    public static String unquoted(String literal) {
        if (literal == null || literal.length() < 2
                || literal.charAt(0) != '"' || literal.charAt(literal.length() - 1) != '"') {
            throw new IllegalArgumentException("Not a quoted CSS string: " + literal);
        }
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i == body.length() - 1) {
                sb.append(c);
                continue;
            }
            int j = i + 1;
            int end = j;
            while (end < body.length() && end - j < 6 && isHex(body.charAt(end))) end++;
            if (end > j) {
                sb.appendCodePoint(Integer.parseInt(body.substring(j, end), 16));
                if (end < body.length() && body.charAt(end) == ' ') end++;
                i = end - 1;
            } else {
                sb.append(body.charAt(j));
                i = j;
            }
        }
        return sb.toString();
    }

    /** True when {@code ident} serialises to itself (no escaping needed). */
    public static boolean isPlainIdentifier(String ident) {
        return !ident.isEmpty() && identifier(ident).equals(ident);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHex(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
