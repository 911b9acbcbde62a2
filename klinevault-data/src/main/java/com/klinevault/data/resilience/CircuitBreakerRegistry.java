package com.klinevault.data.resilience;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One circuit breaker per (backend, strategy) pair. Owned by a single orchestrator.
 */
public class CircuitBreakerRegistry {

    private final CircuitBreakerPolicy policy;
    private final Clock clock;
    private final Map<CircuitKey, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public CircuitBreaker get(CircuitKey key) {
        return breakers.computeIfAbsent(key, k -> new CircuitBreaker(k, policy, clock));
    }

    /**
     * Status of every breaker created so far, keyed by "backend/strategy".
     */
    public Map<String, CircuitBreaker.Status> statuses() {
        Map<String, CircuitBreaker.Status> result = new TreeMap<>();
        breakers.forEach((key, breaker) -> result.put(key.toString(), breaker.getStatus()));
        return result;
    }
}
