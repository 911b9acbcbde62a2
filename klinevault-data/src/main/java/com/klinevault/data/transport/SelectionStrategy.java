package com.klinevault.data.transport;

/**
 * How a {@link SelectingTransport} picks a backend for each call.
 */
public enum SelectionStrategy {
    /**
     * Always the first backend.
     */
    SINGLE,

    /**
     * Backends in priority order; the first one that answers wins.
     */
    FAILOVER,

    /**
     * One backend per call, rotating.
     */
    ROUND_ROBIN,

    /**
     * Uniform random backend per call.
     */
    RANDOM;

    public static SelectionStrategy fromConfig(String value) {
        if (value == null || value.isBlank()) return FAILOVER;
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
