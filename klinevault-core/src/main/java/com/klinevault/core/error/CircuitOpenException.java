package com.klinevault.core.error;

import java.time.Instant;

/**
 * Call short-circuited because the backend's circuit breaker is open.
 */
public class CircuitOpenException extends ExhaustionException {

    private final String circuit;
    private final Instant retryAt;

    public CircuitOpenException(String circuit, Instant retryAt) {
        super("Circuit " + circuit + " is open until " + retryAt);
        this.circuit = circuit;
        this.retryAt = retryAt;
    }

    public String getCircuit() {
        return circuit;
    }

    /**
     * Earliest time a probe call will be let through.
     */
    public Instant getRetryAt() {
        return retryAt;
    }
}
