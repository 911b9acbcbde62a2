package com.klinevault.data.fcp;

/**
 * Caller control over backend choice and cache use.
 */
public enum SourceOverride {
    /** Let the decision engine choose. */
    AUTO,
    /** Incremental backend only, no failover. */
    INCREMENTAL,
    /** Archive backend only, no failover. */
    ARCHIVE,
    /** Refetch even when the cached entry is fresh. */
    REFRESH;

    public boolean isPinned() {
        return this == INCREMENTAL || this == ARCHIVE;
    }
}
