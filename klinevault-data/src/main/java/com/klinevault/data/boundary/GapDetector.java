package com.klinevault.data.boundary;

import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Gap;
import com.klinevault.core.model.Interval;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds missing grid slots in an ordered bar sequence.
 */
public final class GapDetector {

    private GapDetector() {
    }

    /**
     * Gaps between consecutive bars.
     */
    public static List<Gap> findGaps(List<Bar> bars, Interval interval) {
        List<Gap> gaps = new ArrayList<>();
        long step = interval.getMillis();
        for (int i = 1; i < bars.size(); i++) {
            long previous = bars.get(i - 1).openTime();
            long current = bars.get(i).openTime();
            if (current - previous > step) {
                addGap(gaps, previous + step, current - step, interval, Gap.Position.INTERIOR);
            }
        }
        return gaps;
    }

    /**
     * Gaps against an expected range, including missing bars before the first and after the last.
     */
    public static List<Gap> findGaps(List<Bar> bars, ResolvedBoundaries expected) {
        if (expected.isEmpty()) {
            return List.of();
        }
        Interval interval = expected.interval();
        long step = interval.getMillis();
        long first = expected.firstOpenTime();
        long last = expected.lastOpenTime();

        if (bars.isEmpty()) {
            List<Gap> all = new ArrayList<>();
            addGap(all, first, last, interval, Gap.Position.WHOLE);
            return all;
        }

        List<Gap> gaps = new ArrayList<>();
        long firstSeen = bars.get(0).openTime();
        long lastSeen = bars.get(bars.size() - 1).openTime();
        if (firstSeen > first) {
            addGap(gaps, first, Math.min(firstSeen - step, last), interval, Gap.Position.LEADING);
        }
        gaps.addAll(findGaps(bars, interval));
        if (lastSeen < last) {
            addGap(gaps, Math.max(lastSeen + step, first), last, interval, Gap.Position.TRAILING);
        }
        return gaps;
    }

    private static void addGap(List<Gap> gaps, long from, long to, Interval interval, Gap.Position position) {
        if (to < from) return;
        gaps.add(new Gap(from, to, interval, position));
    }
}
