package io.codeforesight.reasoning;

import io.codeforesight.config.GateConfig.ReasoningSettings;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded retries around a reasoning backend.
 * <p>
 * Each attempt runs under a per-attempt timeout. Between attempts the client waits
 * {@code initialBackoff * 2^(attempt-1)}, or the server's Retry-After if longer, capped at
 * {@code maxBackoff}. All attempts share one {@link TimeBudget}; when it runs out the last
 * failure is rethrown. Authentication failures are not retried. When the primary model keeps
 * failing, one attempt is made against the fallback model.
 */
public class ResilientReasoningClient implements ReasoningClient, AutoCloseable {

    private final ReasoningClient primary;
    private final ReasoningClient fallback;
    private final ReasoningSettings settings;
    private final Sleeper sleeper;
    private final TimeBudget budget;
    private final ExecutorService executor;

    /**
     * @param primary  backend tried first
     * @param fallback backend tried once after the primary is exhausted; may be null
     * @param settings retry, timeout and budget settings
     * @param sleeper  waits between attempts
     * @param budget   deadline shared by every call made through this client
     */
    public ResilientReasoningClient(ReasoningClient primary, ReasoningClient fallback,
                                    ReasoningSettings settings, Sleeper sleeper, TimeBudget budget) {
        this.primary = primary;
        this.fallback = fallback;
        this.settings = settings;
        this.sleeper = sleeper;
        this.budget = budget;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "reasoning-call");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String name() {
        return primary.name();
    }

    @Override
    public ReasoningResponse analyze(ReasoningRequest request) throws ReasoningServiceException {
        ReasoningServiceException last = null;
        int maxAttempts = settings.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (budget.isExhausted()) {
                throw budgetExhausted(last);
            }
            try {
                return attempt(primary, request);
            } catch (ReasoningServiceException e) {
                last = e;
                if (!e.kind().isRetryable()) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = backoffMillis(attempt, e.retryAfter().orElse(null));
                if (delay >= budget.remainingMillis()) {
                    throw budgetExhausted(e);
                }
                System.err.println("Warning: reasoning attempt " + attempt + "/" + maxAttempts + " on "
                        + primary.name() + " failed (" + e.kind().id() + "): " + e.getMessage()
                        + "; retrying in " + delay + " ms");
                pause(delay);
            }
        }

        if (fallback != null && !budget.isExhausted()) {
            System.err.println("Warning: " + primary.name() + " unavailable, trying fallback model " + fallback.name());
            try {
                return attempt(fallback, request);
            } catch (ReasoningServiceException e) {
                last = e;
            }
        }
        throw last;
    }

    /**
     * Delay before the attempt following {@code attempt}.
     */
    long backoffMillis(int attempt, Duration retryAfter) {
        long exponential = settings.initialBackoffMillis() << Math.min(attempt - 1, 20);
        long hinted = retryAfter != null ? retryAfter.toMillis() : 0L;
        return Math.min(Math.max(exponential, hinted), settings.maxBackoffMillis());
    }

    private ReasoningResponse attempt(ReasoningClient client, ReasoningRequest request)
            throws ReasoningServiceException {
        long timeout = Math.min(settings.attemptTimeoutSeconds() * 1000L, budget.remainingMillis());
        Future<ReasoningResponse> future = executor.submit(() -> client.analyze(request));
        try {
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ReasoningServiceException(ReasoningServiceException.Kind.TIMEOUT,
                    client.name() + " did not answer within " + timeout + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReasoningServiceException rse) {
                throw rse;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE,
                    client.name() + " failed: " + cause, cause);
        } catch (CancellationException e) {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE,
                    client.name() + " call was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE,
                    "Interrupted while waiting for " + client.name(), e);
        }
    }

    private void pause(long millis) throws ReasoningServiceException {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReasoningServiceException(ReasoningServiceException.Kind.UNAVAILABLE,
                    "Interrupted during backoff", e);
        }
    }

    private static ReasoningServiceException budgetExhausted(ReasoningServiceException last) {
        String detail = last != null ? " (last failure: " + last.kind().id() + ": " + last.getMessage() + ")" : "";
        return new ReasoningServiceException(ReasoningServiceException.Kind.TIMEOUT,
                "Reasoning time budget exhausted" + detail, last);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
