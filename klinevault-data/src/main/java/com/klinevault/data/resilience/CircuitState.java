package com.klinevault.data.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
