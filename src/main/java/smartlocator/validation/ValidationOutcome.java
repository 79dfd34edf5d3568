package smartlocator.validation;

/**
 * Totals of one validation run.
 *
 * @param finalState   session state when the run ended ({@code DONE} or {@code FAILED})
 * @param attempted    candidates submitted to the resolver
 * @param resolved     candidates that received a match count
 * @param errors       candidates that received a validation error
 * @param abortReason  why validation stopped early, or {@code null}
 */
public record ValidationOutcome(ValidationSession.State finalState, int attempted, int resolved,
                                int errors, String abortReason) {

    public static ValidationOutcome aborted(ValidationSession.State state, String reason) {
        return new ValidationOutcome(state, 0, 0, 0, reason);
    }

    public boolean isAborted() {
        return abortReason != null;
    }
}
