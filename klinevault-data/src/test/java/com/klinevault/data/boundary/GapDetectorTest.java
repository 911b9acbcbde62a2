package com.klinevault.data.boundary;

import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Gap;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GapDetectorTest {

    private static final long HOUR = Interval.HOUR_1.getMillis();
    private static final long START = 1_716_163_200_000L; // 2024-05-20T00:00Z

    @Test
    @DisplayName("Contiguous bars have no gaps")
    void noGaps() {
        assertTrue(GapDetector.findGaps(TestFixtures.bars(Interval.HOUR_1, START, 24), Interval.HOUR_1).isEmpty());
    }

    @Test
    @DisplayName("Should report a run of missing bars with its size")
    void interiorGap() {
        // Given: hours 5, 6 and 7 missing
        List<Bar> bars = new ArrayList<>(TestFixtures.bars(Interval.HOUR_1, START, 24));
        bars.subList(5, 8).clear();

        // When
        List<Gap> gaps = GapDetector.findGaps(bars, Interval.HOUR_1);

        // Then
        assertEquals(List.of(new Gap(START + 5 * HOUR, START + 7 * HOUR, Interval.HOUR_1, Gap.Position.INTERIOR)), gaps);
        assertEquals(3, gaps.get(0).missingCount());
        assertFalse(gaps.get(0).isEdge());
    }

    @Test
    @DisplayName("A gap converts to the half-open window that refetches exactly its bars")
    void gapWindow() {
        Gap gap = new Gap(START + 5 * HOUR, START + 7 * HOUR, Interval.HOUR_1, Gap.Position.INTERIOR);

        TimeWindow window = gap.toWindow();

        assertEquals(START + 5 * HOUR, window.start());
        assertEquals(START + 8 * HOUR, window.end());
        assertEquals(Interval.HOUR_1, window.interval());
    }

    @Test
    @DisplayName("Should report missing bars at both edges of the expected range")
    void edgeGaps() {
        List<Bar> bars = TestFixtures.bars(Interval.HOUR_1, START + 2 * HOUR, 20);
        ResolvedBoundaries expected = new ResolvedBoundaries(START, START + 23 * HOUR, 24, Interval.HOUR_1);

        List<Gap> gaps = GapDetector.findGaps(bars, expected);

        assertEquals(List.of(
            new Gap(START, START + HOUR, Interval.HOUR_1, Gap.Position.LEADING),
            new Gap(START + 22 * HOUR, START + 23 * HOUR, Interval.HOUR_1, Gap.Position.TRAILING)), gaps);
        assertTrue(gaps.stream().allMatch(Gap::isEdge));
        assertEquals(2, gaps.get(1).missingCount());
    }

    @Test
    @DisplayName("No bars at all is one gap covering the range")
    void allMissing() {
        ResolvedBoundaries expected = new ResolvedBoundaries(START, START + 23 * HOUR, 24, Interval.HOUR_1);

        List<Gap> gaps = GapDetector.findGaps(List.of(), expected);

        assertEquals(List.of(new Gap(START, START + 23 * HOUR, Interval.HOUR_1, Gap.Position.WHOLE)), gaps);
        assertEquals(24, gaps.get(0).missingCount());
    }
}
