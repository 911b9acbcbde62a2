package com.klinevault.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Kline interval on a fixed UTC grid.
 * Every interval divides a day evenly, so daily cache partitions always start and end on the grid.
 */
public enum Interval {
    SECOND_1("1s", Duration.ofSeconds(1)),
    MINUTE_1("1m", Duration.ofMinutes(1)),
    MINUTE_3("3m", Duration.ofMinutes(3)),
    MINUTE_5("5m", Duration.ofMinutes(5)),
    MINUTE_15("15m", Duration.ofMinutes(15)),
    MINUTE_30("30m", Duration.ofMinutes(30)),
    HOUR_1("1h", Duration.ofHours(1)),
    HOUR_2("2h", Duration.ofHours(2)),
    HOUR_4("4h", Duration.ofHours(4)),
    HOUR_6("6h", Duration.ofHours(6)),
    HOUR_8("8h", Duration.ofHours(8)),
    HOUR_12("12h", Duration.ofHours(12)),
    DAY_1("1d", Duration.ofDays(1));

    private final String code;
    private final long millis;

    Interval(String code, Duration duration) {
        this.code = code;
        this.millis = duration.toMillis();
    }

    /**
     * Binance interval code, e.g. "1h".
     */
    @JsonValue
    public String getCode() {
        return code;
    }

    public long getMillis() {
        return millis;
    }

    public Duration toDuration() {
        return Duration.ofMillis(millis);
    }

    /**
     * Number of bars in one UTC day.
     */
    public int barsPerDay() {
        return (int) (Duration.ofDays(1).toMillis() / millis);
    }

    /**
     * Largest grid point at or before the timestamp.
     */
    public long floor(long timestamp) {
        return Math.floorDiv(timestamp, millis) * millis;
    }

    /**
     * Smallest grid point at or after the timestamp.
     */
    public long ceil(long timestamp) {
        long floor = floor(timestamp);
        return floor == timestamp ? floor : floor + millis;
    }

    public boolean isAligned(long timestamp) {
        return Math.floorMod(timestamp, millis) == 0;
    }

    @JsonCreator
    public static Interval fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Interval code is null");
        }
        for (Interval interval : values()) {
            if (interval.code.equals(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unsupported interval: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
