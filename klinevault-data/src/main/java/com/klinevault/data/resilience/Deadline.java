package com.klinevault.data.resilience;

import com.klinevault.core.error.TransportException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * End-to-end time budget for one caller request, shared across retries and failover.
 */
public final class Deadline {

    private static final Duration UNBOUNDED = Duration.ofDays(365);

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline none() {
        return new Deadline(null, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public boolean isBounded() {
        return expiresAt != null;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * Time left, never negative. Unbounded deadlines report a year.
     */
    public Duration remaining() {
        if (expiresAt == null) {
            return UNBOUNDED;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * The smaller of the given timeout and the remaining budget.
     */
    public Duration cap(Duration timeout) {
        Duration left = remaining();
        return timeout == null || left.compareTo(timeout) < 0 ? left : timeout;
    }

    /**
     * @throws TransportException TIMEOUT once the deadline has passed
     */
    public void check(String operation) throws TransportException {
        if (isExpired()) {
            throw TransportException.timeout("Deadline exceeded before " + operation);
        }
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
