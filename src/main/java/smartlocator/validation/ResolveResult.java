package smartlocator.validation;

/**
 * Outcome of resolving one selector against a live page: either a match
 * count or an error message, never both.
 */
public record ResolveResult(Integer matchCount, String error) {

    public static ResolveResult matched(int count) {
        if (count < 0) throw new IllegalArgumentException("Negative match count: " + count);
        return new ResolveResult(count, null);
    }

    public static ResolveResult failed(String error) {
        return new ResolveResult(null, error == null || error.isBlank() ? "Unknown resolver error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
