package com.klinevault.data.boundary;

import com.klinevault.core.model.Interval;

/**
 * A range expressed the way the incremental backend answers it.
 *
 * @param effectiveStart first open time returned
 * @param effectiveEnd   last open time when the backend end is inclusive, otherwise the exclusive bound
 * @param expectedCount  number of bars in the range, 0 when nothing falls inside it
 */
public record ResolvedBoundaries(long effectiveStart, long effectiveEnd, long expectedCount, Interval interval) {

    public boolean isEmpty() {
        return expectedCount <= 0;
    }

    public long firstOpenTime() {
        return effectiveStart;
    }

    /**
     * Open time of the last bar, or -1 when the range is empty.
     */
    public long lastOpenTime() {
        return isEmpty() ? -1 : effectiveStart + (expectedCount - 1) * interval.getMillis();
    }
}
