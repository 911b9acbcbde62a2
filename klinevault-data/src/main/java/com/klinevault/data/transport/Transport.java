package com.klinevault.data.transport;

import com.klinevault.core.error.TransportException;

/**
 * Uniform request interface over a network backend.
 * Implementations throw only {@link TransportException}; HTTP status handling is left to the caller.
 */
public interface Transport extends AutoCloseable {

    /**
     * Registry identifier, e.g. "okhttp".
     */
    String id();

    /**
     * Acquire resources. Idempotent.
     */
    default void open() throws TransportException {
    }

    TransportResponse request(TransportRequest request) throws TransportException;

    /**
     * Release pooled connections. Idempotent, never throws.
     */
    @Override
    void close();
}
