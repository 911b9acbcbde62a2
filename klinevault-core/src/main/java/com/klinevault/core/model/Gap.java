package com.klinevault.core.model;

/**
 * Run of missing grid slots in a bar sequence, identified by the open times of the first
 * and last missing bar.
 */
public record Gap(long firstMissing, long lastMissing, Interval interval, Position position) {

    /**
     * Where the run sits relative to the bars that are present.
     */
    public enum Position {
        /** Before the first bar present. */
        LEADING,
        /** Between two bars present. */
        INTERIOR,
        /** After the last bar present. */
        TRAILING,
        /** No bars present at all. */
        WHOLE
    }

    public Gap {
        if (interval == null || position == null) {
            throw new IllegalArgumentException("interval and position are required");
        }
        if (lastMissing < firstMissing) {
            throw new IllegalArgumentException("Gap ends before it starts: " + firstMissing + " > " + lastMissing);
        }
    }

    public int missingCount() {
        return (int) ((lastMissing - firstMissing) / interval.getMillis() + 1);
    }

    /**
     * Whether the run touches an edge of the expected range rather than sitting between bars.
     */
    public boolean isEdge() {
        return position != Position.INTERIOR;
    }

    /**
     * Half-open window holding exactly the missing bars, e.g. to refetch them.
     */
    public TimeWindow toWindow() {
        return new TimeWindow(firstMissing, lastMissing + interval.getMillis(), interval);
    }
}
