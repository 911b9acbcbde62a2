package com.klinevault.data.resilience;

import java.time.Duration;

/**
 * Backoff delay seam.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
