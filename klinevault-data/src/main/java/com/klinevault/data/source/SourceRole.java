package com.klinevault.data.source;

/**
 * Part a source plays in the fetch protocol.
 */
public enum SourceRole {
    /** Low-latency API, current up to the last closed bar. */
    INCREMENTAL,
    /** Bulk historical partitions, published with a delay. */
    ARCHIVE;

    public SourceRole other() {
        return this == INCREMENTAL ? ARCHIVE : INCREMENTAL;
    }
}
