package com.klinevault.data.resilience;

import java.time.Duration;

/**
 * @param failureThreshold consecutive failures that open the circuit
 * @param recoveryTimeout  how long the circuit stays open before probing
 * @param halfOpenMaxCalls probe calls allowed while half-open; that many successes close the circuit
 */
public record CircuitBreakerPolicy(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls) {

    public CircuitBreakerPolicy {
        if (failureThreshold < 1 || halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("failureThreshold and halfOpenMaxCalls must be >= 1");
        }
    }

    public static CircuitBreakerPolicy defaults() {
        return new CircuitBreakerPolicy(5, Duration.ofSeconds(60), 1);
    }
}
