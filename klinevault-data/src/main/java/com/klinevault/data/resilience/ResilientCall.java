package com.klinevault.data.resilience;

import com.klinevault.core.error.DataSourceException;

@FunctionalInterface
public interface ResilientCall<T> {
    T call() throws DataSourceException;
}
