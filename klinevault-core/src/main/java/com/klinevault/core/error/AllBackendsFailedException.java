package com.klinevault.core.error;

import java.util.List;

/**
 * Every backend eligible for a request failed. The cause is the last underlying error.
 */
public class AllBackendsFailedException extends ExhaustionException {

    private final List<String> attemptedBackends;

    public AllBackendsFailedException(String request, List<String> attemptedBackends, DataSourceException lastError) {
        super("All backends failed for " + request + " (tried " + attemptedBackends + "): "
            + (lastError != null ? lastError.getMessage() : "no backend available"), lastError);
        this.attemptedBackends = List.copyOf(attemptedBackends);
    }

    public List<String> getAttemptedBackends() {
        return attemptedBackends;
    }

    public DataSourceException getLastError() {
        return (DataSourceException) getCause();
    }
}
