package com.klinevault.core.error;

/**
 * Network-level failure, normalized across transport implementations.
 */
public class TransportException extends DataSourceException {

    public enum Kind {
        TIMEOUT,
        CONNECTION_FAILED,
        PROTOCOL_ERROR
    }

    private final Kind kind;

    public TransportException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    public static TransportException timeout(String message) {
        return new TransportException(Kind.TIMEOUT, message);
    }

    public static TransportException timeout(String message, Throwable cause) {
        return new TransportException(Kind.TIMEOUT, message, cause);
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }
}
