package com.klinevault.data.boundary;

import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;

import java.util.List;

/**
 * How the incremental backend interprets the edges of a requested range.
 *
 * @param startRounding direction an off-grid start is moved onto the interval grid
 * @param endInclusive  whether a bar opening exactly at the requested end is returned
 */
public record BoundaryRules(StartRounding startRounding, boolean endInclusive) {

    public enum StartRounding {
        UP,
        DOWN
    }

    public BoundaryRules {
        if (startRounding == null) {
            throw new IllegalArgumentException("startRounding is required");
        }
    }

    /**
     * What Binance klines endpoints do: start rounds up, end is inclusive.
     */
    public static BoundaryRules standard() {
        return new BoundaryRules(StartRounding.UP, true);
    }

    /**
     * Derive the rules from the answer to a probe request.
     * The probe start must be off-grid and the probe end on-grid, with at least two
     * whole bars in between.
     *
     * @return the inferred rules, or null when the answer is too short to tell
     */
    public static BoundaryRules infer(long probeStart, long probeEnd, Interval interval, List<Bar> answer) {
        if (answer == null || answer.isEmpty()) {
            return null;
        }
        long firstOpen = answer.get(0).openTime();
        long lastOpen = answer.get(answer.size() - 1).openTime();

        StartRounding rounding;
        if (firstOpen == interval.ceil(probeStart)) {
            rounding = StartRounding.UP;
        } else if (firstOpen == interval.floor(probeStart)) {
            rounding = StartRounding.DOWN;
        } else {
            return null;
        }
        return new BoundaryRules(rounding, lastOpen == probeEnd);
    }

    /**
     * First grid point the backend returns for a requested start.
     */
    public long alignStart(long start, Interval interval) {
        return startRounding == StartRounding.UP ? interval.ceil(start) : interval.floor(start);
    }
}
