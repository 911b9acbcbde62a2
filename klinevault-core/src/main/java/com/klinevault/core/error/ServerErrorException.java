package com.klinevault.core.error;

/**
 * 5xx response.
 */
public class ServerErrorException extends ResponseException {

    public ServerErrorException(int statusCode, String url, String message) {
        super(statusCode, url, message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
