package com.klinevault.core.error;

/**
 * Root of every error a caller of the data layer can receive.
 */
public abstract class DataSourceException extends Exception {

    protected DataSourceException(String message) {
        super(message);
    }

    protected DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the resilience layer may retry the failed call.
     */
    public boolean isRetryable() {
        return false;
    }
}
