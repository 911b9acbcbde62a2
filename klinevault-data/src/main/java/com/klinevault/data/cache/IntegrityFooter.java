package com.klinevault.data.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.klinevault.data.transport.HttpClientFactory;

import java.time.Instant;

/**
 * Integrity marker and boundary metadata written as the last line of a cache file.
 * Boundaries are stored in the form the incremental backend produces and are never re-derived on read.
 */
public record IntegrityFooter(
    int rows,
    String sha256,
    long firstOpenTime,
    long lastOpenTime,
    long expectedCount,
    String source,
    Instant writtenAt
) {
    public static final String PREFIX = "#";

    public String toLine() throws JsonProcessingException {
        return PREFIX + HttpClientFactory.getMapper().writeValueAsString(this);
    }

    public static IntegrityFooter fromLine(String line) throws JsonProcessingException {
        if (!line.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not a footer line");
        }
        return HttpClientFactory.getMapper().readValue(line.substring(PREFIX.length()), IntegrityFooter.class);
    }
}
