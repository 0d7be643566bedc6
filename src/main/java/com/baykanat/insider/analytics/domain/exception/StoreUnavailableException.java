package com.baykanat.insider.analytics.domain.exception;

/** Circuit breaker açık; GlobalExceptionHandler 503 + Retry-After döner. */
public class StoreUnavailableException extends RuntimeException {

    private final int retryAfterSeconds;

    public StoreUnavailableException(String message, int retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
