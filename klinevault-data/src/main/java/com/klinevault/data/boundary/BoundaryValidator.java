package com.klinevault.data.boundary;

import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.error.TransportException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.resilience.Deadline;
import com.klinevault.data.resilience.ResilienceWrapper;
import com.klinevault.data.resilience.ResilientCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single authority for time-window arithmetic.
 *
 * Boundary rules are learned from the incremental backend (one probe per interval) and
 * kept for the lifetime of the validator, and in the rules file when one is attached.
 * Everything that needs to know which bars a range contains (fetch trimming, cache
 * validation, cache metadata) asks this class. Only {@link #calibrate} talks to the backend.
 */
public class BoundaryValidator {

    private static final Logger log = LoggerFactory.getLogger(BoundaryValidator.class);

    // Probe far enough back that every interval has closed bars around the reference time
    private static final Duration PROBE_LOOKBACK = Duration.ofDays(3);

    private final BoundaryProbe probe;
    private final BoundaryRulesFile rulesFile;
    private final BoundaryRules fallbackRules;
    private final Clock clock;
    private final Map<Interval, BoundaryRules> rulesByInterval = new ConcurrentHashMap<>();
    private final Set<Interval> rulesFileRead = ConcurrentHashMap.newKeySet();

    public BoundaryValidator(BoundaryProbe probe, Clock clock) {
        this(probe, null, BoundaryRules.standard(), clock);
    }

    /**
     * @param rulesFile where learned rules are recorded and read back; may be null
     */
    public BoundaryValidator(BoundaryProbe probe, BoundaryRulesFile rulesFile, Clock clock) {
        this(probe, rulesFile, BoundaryRules.standard(), clock);
    }

    private BoundaryValidator(BoundaryProbe probe, BoundaryRulesFile rulesFile, BoundaryRules fallbackRules,
                              Clock clock) {
        this.probe = probe;
        this.rulesFile = rulesFile;
        this.fallbackRules = fallbackRules;
        this.clock = clock;
    }

    /**
     * Validator that never probes and applies the given rules to every interval.
     */
    public static BoundaryValidator withRules(BoundaryRules rules, Clock clock) {
        return new BoundaryValidator(null, null, rules, clock);
    }

    /**
     * Rules for an interval: learned by this validator, recorded in the rules file, or the
     * standard rules until a probe succeeds. Never calls the backend.
     */
    public BoundaryRules rulesFor(Interval interval) {
        BoundaryRules known = knownRules(interval);
        return known != null ? known : fallbackRules;
    }

    /**
     * Whether the interval's rules still have to be learned from the backend.
     */
    public boolean needsCalibration(Interval interval) {
        return probe != null && knownRules(interval) == null;
    }

    /**
     * Learn the interval's rules from the backend unless they are already known.
     * A failed or inconclusive probe is not remembered: the standard rules apply until
     * the next calibration succeeds.
     *
     * @param through  resilience wrapper of the probed backend; null calls it directly
     * @param deadline budget of the request that needs the rules
     * @throws TransportException TIMEOUT when the deadline ran out during the probe
     */
    public BoundaryRules calibrate(Interval interval, Deadline deadline, ResilienceWrapper through)
            throws TransportException {
        if (!needsCalibration(interval)) {
            return rulesFor(interval);
        }
        long reference = clock.millis() - PROBE_LOOKBACK.toMillis();
        ResilientCall<BoundaryRules> call = () -> probe.probe(interval, reference, deadline);
        try {
            BoundaryRules probed = through != null ? through.execute(call, deadline) : call.call();
            if (probed != null) {
                log.info("Boundary rules for {}: start rounds {}, end {}",
                    interval, probed.startRounding(), probed.endInclusive() ? "inclusive" : "exclusive");
                rulesByInterval.put(interval, probed);
                record(interval, probed);
                return probed;
            }
            log.warn("Boundary probe for {} was inconclusive; using standard rules for now", interval);
        } catch (DataSourceException e) {
            if (deadline.isExpired()) {
                throw TransportException.timeout("Deadline exceeded while calibrating boundaries for " + interval, e);
            }
            log.warn("Boundary probe for {} failed ({}); using standard rules for now", interval, e.getMessage());
        }
        return fallbackRules;
    }

    private BoundaryRules knownRules(Interval interval) {
        BoundaryRules learned = rulesByInterval.get(interval);
        if (learned != null || rulesFile == null || !rulesFileRead.add(interval)) {
            return learned;
        }
        BoundaryRules recorded = rulesFile.load(interval);
        if (recorded == null) {
            return null;
        }
        BoundaryRules previous = rulesByInterval.putIfAbsent(interval, recorded);
        return previous != null ? previous : recorded;
    }

    private void record(Interval interval, BoundaryRules rules) {
        if (rulesFile == null) {
            return;
        }
        try {
            rulesFile.save(interval, rules);
        } catch (IOException e) {
            // Learned rules still hold for this process
            log.warn("Could not record boundary rules in {}: {}", rulesFile.getFile(), e.getMessage());
        }
    }

    /**
     * A range is valid when it is ordered, does not start in the future and holds at least one bar.
     */
    public boolean isValidRange(long start, long end, Interval interval) {
        if (start >= end || start > clock.millis()) {
            return false;
        }
        return !resolveBoundaries(start, end, interval).isEmpty();
    }

    /**
     * Apply the backend's own edge rules to a raw range. Idempotent on its own output.
     */
    public ResolvedBoundaries resolveBoundaries(long start, long end, Interval interval) {
        BoundaryRules rules = rulesFor(interval);
        long step = interval.getMillis();
        long effectiveStart = rules.alignStart(start, interval);

        if (rules.endInclusive()) {
            long lastOpen = interval.floor(end);
            long count = lastOpen >= effectiveStart ? (lastOpen - effectiveStart) / step + 1 : 0;
            return new ResolvedBoundaries(effectiveStart, lastOpen, count, interval);
        }
        long exclusiveEnd = interval.ceil(end);
        long count = exclusiveEnd > effectiveStart ? (exclusiveEnd - effectiveStart) / step : 0;
        return new ResolvedBoundaries(effectiveStart, exclusiveEnd, count, interval);
    }

    /**
     * Bars a half-open caller window contains: the backend's first bar for the start,
     * up to the last bar opening strictly before the end.
     */
    public ResolvedBoundaries resolveWindow(TimeWindow window) {
        Interval interval = window.interval();
        BoundaryRules rules = rulesFor(interval);
        long step = interval.getMillis();
        long first = rules.alignStart(window.start(), interval);
        long last = interval.ceil(window.end()) - step;
        long count = last >= first ? (last - first) / step + 1 : 0;
        long backendEnd = rules.endInclusive() ? last : last + step;
        return new ResolvedBoundaries(first, backendEnd, count, interval);
    }

    /**
     * Whether the bars are exactly the ones the window resolves to: count, first and last open time.
     */
    public boolean matchesExpectedRange(List<Bar> bars, TimeWindow window) {
        ResolvedBoundaries expected = resolveWindow(window);
        if (expected.isEmpty()) {
            return bars.isEmpty();
        }
        return bars.size() == expected.expectedCount()
            && bars.get(0).openTime() == expected.firstOpenTime()
            && bars.get(bars.size() - 1).openTime() == expected.lastOpenTime();
    }

    /**
     * Keep exactly the bars of the window, in input order.
     */
    public List<Bar> clip(List<Bar> bars, TimeWindow window) {
        ResolvedBoundaries expected = resolveWindow(window);
        if (expected.isEmpty()) {
            return List.of();
        }
        long first = expected.firstOpenTime();
        long last = expected.lastOpenTime();
        List<Bar> clipped = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            if (bar.openTime() >= first && bar.openTime() <= last) {
                clipped.add(bar);
            }
        }
        return clipped;
    }

    public Clock getClock() {
        return clock;
    }
}
