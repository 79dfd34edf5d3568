package smartlocator.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smartlocator.model.LocatorCandidate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves candidates against a live page through an injected
 * {@link SelectorResolver} and records the outcome on each candidate.
 *
 * <p>Resolves run on a fixed pool of {@code threads} workers, capped by
 * {@link SelectorResolver#maxConcurrentCalls()}. A call holds its slot until
 * the resolver returns, even after it timed out, and {@code callTimeout}
 * starts only once the slot is taken. A slow or failing selector only
 * affects its own candidate:
 * <ul>
 *   <li>success: {@code validated=true}, {@code matchCount=N}, plus a warning when N ≠ 1</li>
 *   <li>resolver error, exception or timeout: {@code validated=true}, {@code validationError}</li>
 * </ul>
 * An {@link AuthenticationException}, at login or from any resolve, stops the
 * run: candidates not yet recorded keep {@code null} validation fields.
 */
public class LocatorValidator {

    private static final Logger log = LoggerFactory.getLogger(LocatorValidator.class);

    private final SelectorResolver resolver;
    private final int              threads;
    private final Duration         callTimeout;

    public LocatorValidator(SelectorResolver resolver, int threads, Duration callTimeout) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        this.resolver    = Objects.requireNonNull(resolver, "resolver");
        this.threads     = threads;
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Authenticates through {@code session}, then validates every candidate.
     * Never throws for per-candidate problems.
     */
    public ValidationOutcome validate(List<LocatorCandidate> candidates, ValidationSession session) {
        try {
            session.authenticate();
        } catch (AuthenticationException e) {
            log.warn("Skipping validation: {}", e.getMessage());
            return ValidationOutcome.aborted(session.getState(), e.getMessage());
        }
        session.beginValidation();
        int concurrency = concurrency();
        log.info("Validating {} locators ({} threads, {}s per selector)",
                candidates.size(), concurrency, callTimeout.toSeconds());

        AtomicBoolean aborted = new AtomicBoolean(false);
        Semaphore slots = new Semaphore(concurrency);
        ExecutorService workers = Executors.newFixedThreadPool(concurrency, daemon("smart-locator-validate"));
        ExecutorService calls   = Executors.newCachedThreadPool(daemon("smart-locator-resolve"));
        try {
            List<Future<ResolveResult>> pending = new ArrayList<>(candidates.size());
            for (LocatorCandidate c : candidates) {
                pending.add(workers.submit(() -> aborted.get() ? null : resolveOne(c, calls, slots)));
            }

            int resolved = 0;
            int errors = 0;
            String abortReason = null;
            for (int i = 0; i < candidates.size(); i++) {
                Future<ResolveResult> f = pending.get(i);
                if (abortReason != null) {
                    f.cancel(true);
                    continue;
                }
                LocatorCandidate c = candidates.get(i);
                try {
                    ResolveResult r = f.get();
                    if (r == null) continue;
                    if (apply(c, r)) resolved++; else errors++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof AuthenticationException) {
                        aborted.set(true);
                        abortReason = cause.getMessage();
                        log.warn("Authentication lost during validation, remaining selectors skipped: {}", abortReason);
                    } else {
                        c.recordValidationError(describe(cause));
                        errors++;
                    }
                } catch (CancellationException e) {
                    c.recordValidationError("Validation cancelled");
                    errors++;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    aborted.set(true);
                    abortReason = "Interrupted while validating";
                }
            }

            if (abortReason != null) {
                session.fail(abortReason);
            } else {
                session.complete();
            }
            log.info("Validation finished: {} resolved, {} errors{}", resolved, errors,
                    abortReason != null ? ", aborted" : "");
            return new ValidationOutcome(session.getState(), candidates.size(), resolved, errors, abortReason);
        } finally {
            workers.shutdownNow();
            calls.shutdownNow();
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private int concurrency() {
        int cap = resolver.maxConcurrentCalls();
        return cap < 1 ? threads : Math.min(threads, cap);
    }

    /**
     * Runs one resolve on {@code calls}, bounded by the per-call timeout.
     * The slot is released by the call when the resolver returns, or here if
     * the call was cancelled before it started.
     */
    private ResolveResult resolveOne(LocatorCandidate c, ExecutorService calls, Semaphore slots) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResolveResult.failed("Validation interrupted");
        }
        AtomicBoolean started = new AtomicBoolean(false);
        Future<ResolveResult> call;
        try {
            call = calls.submit(() -> {
                if (!started.compareAndSet(false, true)) return null;
                try {
                    return resolver.resolve(c.getType(), c.getValue());
                } finally {
                    slots.release();
                }
            });
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
        try {
            ResolveResult r = call.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return r != null ? r : ResolveResult.failed("Resolver returned no result");
        } catch (TimeoutException e) {
            abandon(call, started, slots);
            log.debug("Timed out resolving {}", c.getValue());
            return ResolveResult.failed("Validation timed out after " + callTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(call, started, slots);
            return ResolveResult.failed("Validation interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AuthenticationException) {
                throw (AuthenticationException) e.getCause();
            }
            log.debug("Resolver threw for {}: {}", c.getValue(), e.getCause().toString());
            return ResolveResult.failed(describe(e.getCause()));
        }
    }

    private static void abandon(Future<ResolveResult> call, AtomicBoolean started, Semaphore slots) {
        call.cancel(true);
        if (started.compareAndSet(false, true)) {
            slots.release();
        }
    }

    /** Writes {@code r} onto {@code c}; true for a match count, false for an error. */
    private static boolean apply(LocatorCandidate c, ResolveResult r) {
        if (!r.isSuccess()) {
            c.recordValidationError(r.error());
            return false;
        }
        int n = r.matchCount();
        c.recordMatchCount(n);
        if (n == 0) {
            c.addWarning("Selector matched no elements");
        } else if (n > 1) {
            c.addWarning("Selector matched " + n + " elements");
        }
        log.debug("Validated {} -> {} match(es)", c.getValue(), n);
        return true;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg.lines().findFirst().orElse(msg);
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
