package com.klinevault.core.error;

/**
 * Terminal failure: nothing left to try.
 */
public abstract class ExhaustionException extends DataSourceException {

    protected ExhaustionException(String message) {
        super(message);
    }

    protected ExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }
}
