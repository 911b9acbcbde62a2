package com.klinevault.core.error;

/**
 * 4xx response. Never retried unless it is a rate-limit signal.
 */
public class ClientErrorException extends ResponseException {

    public ClientErrorException(int statusCode, String url, String message) {
        super(statusCode, url, message);
    }

    public boolean isNotFound() {
        return getStatusCode() == 404;
    }
}
