package com.klinevault.data.transport;

/**
 * Factory for one transport implementation, registered under an identifier.
 */
public interface TransportProvider {

    String id();

    /**
     * Whether the implementation can be created in this runtime (e.g. its library is on the classpath).
     */
    boolean isAvailable();

    Transport create(TransportSettings settings);
}
