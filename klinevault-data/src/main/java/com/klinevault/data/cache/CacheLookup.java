package com.klinevault.data.cache;

import com.klinevault.core.error.ValidationException;

/**
 * Outcome of a cache read. Invalid entries carry the reason and never any bars.
 */
public record CacheLookup(Status status, CacheEntry entry, ValidationException error) {

    public enum Status {
        HIT,
        MISS,
        INVALID
    }

    public static CacheLookup hit(CacheEntry entry) {
        return new CacheLookup(Status.HIT, entry, null);
    }

    public static CacheLookup miss() {
        return new CacheLookup(Status.MISS, null, null);
    }

    public static CacheLookup invalid(ValidationException error) {
        return new CacheLookup(Status.INVALID, null, error);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }
}
