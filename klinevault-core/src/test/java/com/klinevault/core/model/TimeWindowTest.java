package com.klinevault.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    @Test
    @DisplayName("Should reject empty or inverted windows")
    void rejectsInvertedWindow() {
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(10, 10, Interval.MINUTE_1));
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(11, 10, Interval.MINUTE_1));
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(0, 10, null));
    }

    @Test
    @DisplayName("Day window spans exactly one UTC day")
    void dayWindow() {
        TimeWindow day = TimeWindow.ofDay(LocalDate.of(2024, 3, 10), Interval.HOUR_1);

        assertEquals(Instant.parse("2024-03-10T00:00:00Z"), day.startInstant());
        assertEquals(Instant.parse("2024-03-11T00:00:00Z"), day.endInstant());
        assertEquals(List.of(LocalDate.of(2024, 3, 10)), day.dates());
    }

    @Test
    @DisplayName("Dates include every UTC day the window touches, excluding the end instant")
    void datesAcrossMidnight() {
        TimeWindow window = TimeWindow.of(
            Instant.parse("2024-03-10T22:00:00Z"), Instant.parse("2024-03-12T00:00:00Z"), Interval.HOUR_1);

        assertEquals(List.of(LocalDate.of(2024, 3, 10), LocalDate.of(2024, 3, 11)), window.dates());
    }

    @Test
    @DisplayName("Should contain its start but not its end")
    void halfOpen() {
        TimeWindow window = new TimeWindow(100, 200, Interval.MINUTE_1);

        assertTrue(window.contains(100));
        assertTrue(window.contains(199));
        assertFalse(window.contains(200));
    }

    @Test
    @DisplayName("Should intersect and truncate")
    void intersectAndTruncate() {
        TimeWindow a = new TimeWindow(100, 200, Interval.MINUTE_1);
        TimeWindow b = new TimeWindow(150, 300, Interval.MINUTE_1);

        assertEquals(new TimeWindow(150, 200, Interval.MINUTE_1), a.intersect(b));
        assertNull(a.intersect(new TimeWindow(200, 300, Interval.MINUTE_1)));
        assertEquals(new TimeWindow(100, 150, Interval.MINUTE_1), a.truncateAt(150));
        assertSame(a, a.truncateAt(500));
        assertNull(a.truncateAt(100));
    }
}
