package com.klinevault.core.error;

import java.time.Duration;

/**
 * 429/418 response. Retryable; the server's Retry-After hint, when present, overrides the backoff delay.
 */
public class RateLimitedException extends ClientErrorException {

    private final Duration retryAfter;

    public RateLimitedException(int statusCode, String url, Duration retryAfter) {
        super(statusCode, url, "Rate limited (HTTP " + statusCode + ")"
            + (retryAfter != null ? ", retry after " + retryAfter.toSeconds() + "s" : "") + ": " + url);
        this.retryAfter = retryAfter;
    }

    /**
     * Server-declared wait, or null when the response carried no hint.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
