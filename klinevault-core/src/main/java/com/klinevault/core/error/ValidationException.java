package com.klinevault.core.error;

/**
 * Fetched or cached bars failed a structural, integrity or boundary check.
 * Never cached, never retried against the same backend.
 */
public class ValidationException extends DataSourceException {

    public enum Kind {
        BOUNDARY_MISMATCH,
        SCHEMA_INVALID,
        INTEGRITY_CHECK_FAILED
    }

    private final Kind kind;

    public ValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ValidationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
