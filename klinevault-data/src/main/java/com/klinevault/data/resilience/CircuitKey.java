package com.klinevault.data.resilience;

import com.klinevault.data.transport.SelectionStrategy;

/**
 * Circuit breakers are scoped per backend and transport selection strategy.
 */
public record CircuitKey(String backend, SelectionStrategy strategy) {

    @Override
    public String toString() {
        return backend + "/" + strategy;
    }
}
