package com.klinevault.core.error;

/**
 * The backend answered with a non-success HTTP status.
 */
public abstract class ResponseException extends DataSourceException {

    private final int statusCode;
    private final String url;

    protected ResponseException(int statusCode, String url, String message) {
        super(message);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }
}
