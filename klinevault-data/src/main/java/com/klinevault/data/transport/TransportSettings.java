package com.klinevault.data.transport;

import java.time.Duration;

/**
 * Connection settings shared by the built-in transports.
 */
public record TransportSettings(
    Duration connectTimeout,
    Duration requestTimeout,
    int maxIdleConnections
) {
    public static TransportSettings defaults() {
        return new TransportSettings(Duration.ofSeconds(10), Duration.ofSeconds(30), 5);
    }

    /**
     * Settings for large archive downloads (daily ZIPs of 1s data can be tens of MB).
     */
    public TransportSettings forBulkDownloads() {
        return new TransportSettings(connectTimeout.multipliedBy(2), requestTimeout.multipliedBy(10), 2);
    }
}
