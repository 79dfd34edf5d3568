package smartlocator.validation;

import smartlocator.model.LocatorType;

/**
 * Counts how many elements a selector matches in the page under test.
 *
 * <p>Implementations may throw {@link AuthenticationException} when the
 * session is no longer logged in; any other failure should be reported as
 * {@link ResolveResult#failed}.
 */
@FunctionalInterface
public interface SelectorResolver {

    ResolveResult resolve(LocatorType type, String value);

    /**
     * Resolves this resolver can serve at the same time. A value below 1
     * means no limit.
     */
    default int maxConcurrentCalls() {
        return Integer.MAX_VALUE;
    }
}
