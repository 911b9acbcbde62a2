package com.klinevault.data.resilience;

import com.klinevault.core.error.CircuitOpenException;
import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.error.RateLimitedException;
import com.klinevault.core.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Retry with exponential backoff and a circuit breaker around backend calls.
 *
 * Every attempt asks the breaker for permission and reports its outcome; an unchecked exception
 * from the call counts as a failure. Retries apply only to retryable errors (transport failures,
 * 5xx, rate limits). An open circuit short-circuits to the supplied fallback without touching
 * the backend. The caller's deadline caps the whole sequence: once the next backoff would
 * overrun it, a TIMEOUT is raised instead of waiting.
 */
public class ResilienceWrapper {

    private static final Logger log = LoggerFactory.getLogger(ResilienceWrapper.class);

    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final Sleeper sleeper;
    private final Random random;

    public ResilienceWrapper(RetryPolicy retryPolicy, CircuitBreaker circuitBreaker) {
        this(retryPolicy, circuitBreaker, Sleeper.SYSTEM, new Random());
    }

    public ResilienceWrapper(RetryPolicy retryPolicy, CircuitBreaker circuitBreaker, Sleeper sleeper, Random random) {
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreaker;
        this.sleeper = sleeper;
        this.random = random;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public <T> T execute(ResilientCall<T> call, Deadline deadline) throws DataSourceException {
        return execute(call, Fallback.propagate(), deadline);
    }

    public <T> T execute(ResilientCall<T> call, Fallback<T> fallback, Deadline deadline) throws DataSourceException {
        CircuitKey key = circuitBreaker.getKey();
        DataSourceException lastError = null;

        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            deadline.check(key + " attempt " + (attempt + 1));

            if (!circuitBreaker.tryAcquire()) {
                log.debug("Circuit {} open, short-circuiting to fallback", key);
                return fallback.recover(new CircuitOpenException(key.toString(), circuitBreaker.retryAt()));
            }

            try {
                T result = call.call();
                circuitBreaker.recordSuccess();
                return result;
            } catch (RuntimeException e) {
                circuitBreaker.recordFailure();
                throw e;
            } catch (DataSourceException e) {
                lastError = e;
                if (isCallerTimeout(e, deadline)) {
                    circuitBreaker.release();
                    throw e;
                }
                recordOutcome(e);

                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt + 1 >= retryPolicy.maxAttempts()) {
                    break;
                }

                Duration delay = retryDelay(e, attempt);
                if (deadline.remaining().compareTo(delay) < 0) {
                    throw new TransportException(TransportException.Kind.TIMEOUT,
                        "Deadline exceeded for " + key + " after " + (attempt + 1) + " attempt(s)", e);
                }
                log.warn("Retrying {} after error (attempt {}/{}) in {}ms: {}",
                    key, attempt + 1, retryPolicy.maxAttempts(), delay.toMillis(), e.getMessage());
                sleep(delay);
            }
        }

        log.warn("{} failed after {} attempt(s): {}", key, retryPolicy.maxAttempts(),
            lastError != null ? lastError.getMessage() : "unknown error");
        throw lastError;
    }

    /**
     * Non-retryable errors (plain 4xx) mean the backend is up and answering; they don't count against the circuit.
     */
    private void recordOutcome(DataSourceException e) {
        if (e.isRetryable()) {
            circuitBreaker.recordFailure();
        } else {
            circuitBreaker.recordSuccess();
        }
    }

    /**
     * A timeout after the caller's own deadline ran out is the caller's budget, not a backend failure.
     */
    private static boolean isCallerTimeout(DataSourceException e, Deadline deadline) {
        return e instanceof TransportException transport && transport.isTimeout() && deadline.isExpired();
    }

    private Duration retryDelay(DataSourceException e, int attempt) {
        if (e instanceof RateLimitedException rateLimited && rateLimited.getRetryAfter() != null) {
            return rateLimited.getRetryAfter();
        }
        return retryPolicy.delayFor(attempt, random);
    }

    private void sleep(Duration delay) throws TransportException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "Interrupted during retry backoff", e);
        }
    }
}
