package com.klinevault.data.resilience;

import com.klinevault.core.error.DataSourceException;

/**
 * What a short-circuited call returns instead of reaching the backend.
 */
@FunctionalInterface
public interface Fallback<T> {

    T recover(DataSourceException cause) throws DataSourceException;

    /**
     * Fallback that rethrows the short-circuit error.
     */
    static <T> Fallback<T> propagate() {
        return cause -> {
            throw cause;
        };
    }
}
