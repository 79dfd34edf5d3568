package smartlocator.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lifecycle of one live-validation run:
 * <pre>
 *   IDLE ─▶ AUTHENTICATING ─▶ READY ─▶ VALIDATING ─▶ DONE
 *                  │                        │
 *                  └────────▶ FAILED ◀──────┘
 * </pre>
 * Any transition not drawn above raises {@link IllegalStateException}.
 * Authentication is bounded by its own timeout; running past it moves the
 * session to {@code FAILED} and raises {@link AuthenticationException}.
 */
public class ValidationSession {

    private static final Logger log = LoggerFactory.getLogger(ValidationSession.class);

    public enum State { IDLE, AUTHENTICATING, READY, VALIDATING, DONE, FAILED }

    private static final Map<State, Set<State>> TRANSITIONS = Map.of(
            State.IDLE,           Set.of(State.AUTHENTICATING),
            State.AUTHENTICATING, Set.of(State.READY, State.FAILED),
            State.READY,          Set.of(State.VALIDATING, State.FAILED),
            State.VALIDATING,     Set.of(State.DONE, State.FAILED),
            State.DONE,           Set.of(),
            State.FAILED,         Set.of());

    private final Authenticator authenticator;
    private final Duration      authTimeout;

    private State  state = State.IDLE;
    private String failureReason;

    public ValidationSession(Authenticator authenticator, Duration authTimeout) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.authTimeout   = Objects.requireNonNull(authTimeout, "authTimeout");
    }

    /** Session for public pages: authentication is a no-op. */
    public static ValidationSession unauthenticated() {
        return new ValidationSession(NoAuthentication.INSTANCE, Duration.ofSeconds(1));
    }

    // ── Transitions ───────────────────────────────────────────────────────

    /**
     * Runs the authenticator on a dedicated thread, waiting at most the
     * configured timeout.
     *
     * @throws AuthenticationException if the authenticator fails or times out
     * @throws IllegalStateException   if the session is not {@code IDLE}
     */
    public void authenticate() {
        transition(State.AUTHENTICATING);
        log.info("Authenticating ({}), timeout {}s", authenticator.describe(), authTimeout.toSeconds());

        ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "smart-locator-auth");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<?> login = exec.submit(authenticator::authenticate);
            try {
                login.get(authTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                login.cancel(true);
                throw fail(new AuthenticationException(
                        "Authentication timed out after " + authTimeout.toSeconds() + "s (" + authenticator.describe() + ")", e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                login.cancel(true);
                throw fail(new AuthenticationException("Interrupted while authenticating", e));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof AuthenticationException) {
                    throw fail((AuthenticationException) cause);
                }
                throw fail(new AuthenticationException("Authentication failed: " + cause.getMessage(), cause));
            }
        } finally {
            exec.shutdownNow();
        }
        transition(State.READY);
    }

    /** READY → VALIDATING. */
    public void beginValidation() {
        transition(State.VALIDATING);
    }

    /** VALIDATING → DONE. */
    public void complete() {
        transition(State.DONE);
    }

    /**
     * Moves to {@code FAILED} and records the reason.
     *
     * @throws IllegalStateException from {@code IDLE} or a terminal state
     */
    public synchronized void fail(String reason) {
        transition(State.FAILED);
        this.failureReason = reason;
        log.warn("Validation session failed: {}", reason);
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public synchronized State getState() { return state; }

    public synchronized String getFailureReason() { return failureReason; }

    public synchronized boolean isTerminal() {
        return state == State.DONE || state == State.FAILED;
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private AuthenticationException fail(AuthenticationException e) {
        fail(e.getMessage());
        return e;
    }

    private synchronized void transition(State next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Illegal validation session transition " + state + " -> " + next);
        }
        log.debug("Validation session {} -> {}", state, next);
        state = next;
    }
}
