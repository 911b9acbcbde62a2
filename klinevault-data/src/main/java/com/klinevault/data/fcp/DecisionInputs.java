package com.klinevault.data.fcp;

import com.klinevault.data.cache.CacheLookup;
import com.klinevault.data.resilience.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * Everything the decision engine looks at for one partition.
 *
 * @param cacheAge         age of the cached entry, null on a miss
 * @param partitionEnd     exclusive end of the partition
 * @param incrementalState circuit state of the incremental backend
 * @param archiveState     circuit state of the archive backend
 */
public record DecisionInputs(
    CacheLookup.Status cacheStatus,
    Duration cacheAge,
    Instant partitionEnd,
    Instant now,
    CircuitState incrementalState,
    CircuitState archiveState,
    SourceOverride override
) {
    public DecisionInputs {
        if (override == null) {
            override = SourceOverride.AUTO;
        }
    }
}
