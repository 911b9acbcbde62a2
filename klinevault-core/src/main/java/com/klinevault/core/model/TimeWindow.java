package com.klinevault.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open request window [start, end) in epoch milliseconds.
 * A bar belongs to the window when its open time is at or after start and before end.
 * How the backends treat the edges is resolved by the boundary validator, not here.
 */
public record TimeWindow(long start, long end, Interval interval) {

    public TimeWindow {
        if (interval == null) {
            throw new IllegalArgumentException("interval is required");
        }
        if (start >= end) {
            throw new IllegalArgumentException("start must be before end: " + start + " >= " + end);
        }
    }

    public static TimeWindow of(Instant start, Instant end, Interval interval) {
        return new TimeWindow(start.toEpochMilli(), end.toEpochMilli(), interval);
    }

    /**
     * Window covering one whole UTC day.
     */
    public static TimeWindow ofDay(LocalDate date, Interval interval) {
        long dayStart = date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        long dayEnd = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return new TimeWindow(dayStart, dayEnd, interval);
    }

    public Instant startInstant() {
        return Instant.ofEpochMilli(start);
    }

    public Instant endInstant() {
        return Instant.ofEpochMilli(end);
    }

    public long durationMs() {
        return end - start;
    }

    public boolean contains(long timestamp) {
        return timestamp >= start && timestamp < end;
    }

    /**
     * UTC dates touched by this window, in order.
     */
    public List<LocalDate> dates() {
        LocalDate first = Instant.ofEpochMilli(start).atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate last = Instant.ofEpochMilli(end - 1).atZone(ZoneOffset.UTC).toLocalDate();
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = first; !d.isAfter(last); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }

    /**
     * Intersection with another window, or null if they don't overlap.
     */
    public TimeWindow intersect(TimeWindow other) {
        long s = Math.max(start, other.start);
        long e = Math.min(end, other.end);
        return s < e ? new TimeWindow(s, e, interval) : null;
    }

    /**
     * Same window with the end moved back to the given time, or null if nothing remains.
     */
    public TimeWindow truncateAt(long cutoff) {
        if (cutoff >= end) return this;
        return cutoff > start ? new TimeWindow(start, cutoff, interval) : null;
    }

    @Override
    public String toString() {
        return "[" + startInstant() + ", " + endInstant() + ") " + interval;
    }
}
