package com.klinevault.data.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-state circuit breaker.
 *
 * CLOSED counts consecutive failures and opens at the threshold. OPEN rejects every call
 * until the recovery timeout has elapsed; the next call then moves to HALF_OPEN and is let
 * through as a probe. While HALF_OPEN at most {@code halfOpenMaxCalls} probes run; that many
 * successes close the circuit, any probe failure reopens it.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final CircuitKey key;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int halfOpenPermits;
    private Instant lastFailureTime;
    private Instant openedAt;

    public CircuitBreaker(CircuitKey key, CircuitBreakerPolicy policy, Clock clock) {
        this.key = key;
        this.policy = policy;
        this.clock = clock;
    }

    public CircuitKey getKey() {
        return key;
    }

    /**
     * Ask permission for one call. Moves OPEN to HALF_OPEN once the recovery timeout has elapsed.
     *
     * @return false when the call must be short-circuited
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (clock.instant().isBefore(openedAt.plus(policy.recoveryTimeout()))) {
                        return false;
                    }
                    state = CircuitState.HALF_OPEN;
                    successCount = 0;
                    halfOpenPermits = 0;
                    log.info("Circuit {} half-open, probing", key);
                    // fall through to hand out the first probe permit
                case HALF_OPEN:
                default:
                    if (halfOpenPermits >= policy.halfOpenMaxCalls()) {
                        return false;
                    }
                    halfOpenPermits++;
                    return true;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= policy.halfOpenMaxCalls()) {
                    state = CircuitState.CLOSED;
                    failureCount = 0;
                    successCount = 0;
                    halfOpenPermits = 0;
                    openedAt = null;
                    log.info("Circuit {} closed after successful probe", key);
                }
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            lastFailureTime = clock.instant();
            switch (state) {
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= policy.failureThreshold()) {
                        open();
                        log.error("Circuit {} opened after {} consecutive failures", key, failureCount);
                    }
                }
                case HALF_OPEN -> {
                    failureCount++;
                    open();
                    log.warn("Circuit {} probe failed, reopening", key);
                }
                case OPEN -> failureCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand back a permit whose call ended without saying anything about the backend,
     * e.g. when the caller's deadline ran out first.
     */
    public void release() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN && halfOpenPermits > 0) {
                halfOpenPermits--;
            }
        } finally {
            lock.unlock();
        }
    }

    private void open() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
        successCount = 0;
        halfOpenPermits = 0;
    }

    /**
     * Current state without side effects. An OPEN circuit past its recovery timeout still reports OPEN
     * until a call asks for permission.
     */
    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a call made now would be let through (without consuming a probe permit).
     */
    public boolean isCallPermitted() {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> !clock.instant().isBefore(openedAt.plus(policy.recoveryTimeout()));
                case HALF_OPEN -> halfOpenPermits < policy.halfOpenMaxCalls();
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * When an OPEN circuit will admit a probe, or null when not open.
     */
    public Instant retryAt() {
        lock.lock();
        try {
            return openedAt != null ? openedAt.plus(policy.recoveryTimeout()) : null;
        } finally {
            lock.unlock();
        }
    }

    public Status getStatus() {
        lock.lock();
        try {
            return new Status(state, failureCount, successCount, lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            halfOpenPermits = 0;
            openedAt = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time view of the breaker counters.
     */
    public record Status(
        CircuitState state,
        int failureCount,
        int successCount,
        Instant lastFailureTime
    ) {}
}
