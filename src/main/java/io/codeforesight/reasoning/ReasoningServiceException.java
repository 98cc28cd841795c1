package io.codeforesight.reasoning;

import java.time.Duration;
import java.util.Optional;

/**
 * The reasoning backend could not produce a usable answer. Non-fatal: the consuming
 * stage becomes indeterminate.
 */
public class ReasoningServiceException extends Exception {

    /**
     * Failure classes reported by a reasoning backend.
     */
    public enum Kind {
        TIMEOUT("timeout"),
        AUTH("auth"),
        RATE_LIMIT("rate_limit"),
        UNAVAILABLE("unavailable"),
        MALFORMED("malformed");

        private final String id;

        Kind(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        /**
         * Authentication failures are permanent for the run; everything else may succeed on retry.
         */
        public boolean isRetryable() {
            return this != AUTH;
        }
    }

    private final Kind kind;
    private final Duration retryAfter;

    public ReasoningServiceException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ReasoningServiceException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ReasoningServiceException(Kind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Server-suggested wait before the next attempt (from a Retry-After header).
     */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
