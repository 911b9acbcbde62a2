package com.klinevault.data.boundary;

import com.klinevault.core.error.ServerErrorException;
import com.klinevault.core.error.TransportException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.TimeWindow;
import com.klinevault.data.TestFixtures;
import com.klinevault.data.resilience.Deadline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryValidatorTest {

    private static final long HOUR = 3_600_000L;
    private static final LocalDate DAY = LocalDate.of(2024, 5, 20);
    private static final long DAY_START = TestFixtures.dayStart(DAY);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private static BoundaryValidator validator(BoundaryRules rules) {
        return BoundaryValidator.withRules(rules, CLOCK);
    }

    @Nested
    @DisplayName("resolveBoundaries")
    class ResolveBoundariesTests {

        @Test
        @DisplayName("Standard rules round the start up and include an on-grid end")
        void standardRules() {
            ResolvedBoundaries r = validator(BoundaryRules.standard())
                .resolveBoundaries(DAY_START + 10 * HOUR + 1, DAY_START + 14 * HOUR, Interval.HOUR_1);

            assertEquals(DAY_START + 11 * HOUR, r.effectiveStart());
            assertEquals(DAY_START + 14 * HOUR, r.effectiveEnd());
            assertEquals(4, r.expectedCount());
            assertEquals(DAY_START + 14 * HOUR, r.lastOpenTime());
        }

        @Test
        @DisplayName("Exclusive end drops the bar opening at the end")
        void exclusiveEnd() {
            BoundaryRules rules = new BoundaryRules(BoundaryRules.StartRounding.UP, false);

            ResolvedBoundaries r = validator(rules)
                .resolveBoundaries(DAY_START + 10 * HOUR + 1, DAY_START + 14 * HOUR, Interval.HOUR_1);

            assertEquals(DAY_START + 14 * HOUR, r.effectiveEnd());
            assertEquals(3, r.expectedCount());
            assertEquals(DAY_START + 13 * HOUR, r.lastOpenTime());
        }

        @Test
        @DisplayName("Round-down start includes the bar containing the start")
        void roundDown() {
            BoundaryRules rules = new BoundaryRules(BoundaryRules.StartRounding.DOWN, true);

            ResolvedBoundaries r = validator(rules)
                .resolveBoundaries(DAY_START + 10 * HOUR + 1, DAY_START + 14 * HOUR, Interval.HOUR_1);

            assertEquals(DAY_START + 10 * HOUR, r.effectiveStart());
            assertEquals(5, r.expectedCount());
        }

        @Test
        @DisplayName("A range shorter than one bar resolves to nothing")
        void emptyRange() {
            ResolvedBoundaries r = validator(BoundaryRules.standard())
                .resolveBoundaries(DAY_START + 10 * HOUR + 1, DAY_START + 10 * HOUR + 5_000, Interval.HOUR_1);

            assertTrue(r.isEmpty());
            assertEquals(-1, r.lastOpenTime());
        }

        @Test
        @DisplayName("Resolving a resolved range gives the same range, for every rule set and interval")
        void idempotent() {
            Random random = new Random(20240520);
            BoundaryRules[] ruleSets = {
                new BoundaryRules(BoundaryRules.StartRounding.UP, true),
                new BoundaryRules(BoundaryRules.StartRounding.UP, false),
                new BoundaryRules(BoundaryRules.StartRounding.DOWN, true),
                new BoundaryRules(BoundaryRules.StartRounding.DOWN, false)
            };

            for (BoundaryRules rules : ruleSets) {
                BoundaryValidator v = validator(rules);
                for (Interval interval : Interval.values()) {
                    for (int i = 0; i < 50; i++) {
                        long start = DAY_START + (long) (random.nextDouble() * 5 * 86_400_000L);
                        long end = start + 1 + (long) (random.nextDouble() * 3 * 86_400_000L);

                        ResolvedBoundaries once = v.resolveBoundaries(start, end, interval);
                        ResolvedBoundaries twice = v.resolveBoundaries(once.effectiveStart(), once.effectiveEnd(), interval);

                        assertEquals(once, twice, rules + " " + interval + " [" + start + ", " + end + "]");
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("Half-open windows")
    class WindowTests {

        private final BoundaryValidator validator = validator(BoundaryRules.standard());
        private final TimeWindow day = TimeWindow.ofDay(DAY, Interval.HOUR_1);

        @Test
        @DisplayName("A UTC day of 1h bars holds 24 bars from 00:00 to 23:00")
        void dayHolds24Bars() {
            ResolvedBoundaries r = validator.resolveWindow(day);

            assertEquals(24, r.expectedCount());
            assertEquals(DAY_START, r.firstOpenTime());
            assertEquals(DAY_START + 23 * HOUR, r.lastOpenTime());
        }

        @Test
        @DisplayName("Clip drops the bar a backend returns for an inclusive end")
        void clipsInclusiveEnd() {
            // Given: what an inclusive-end backend answers for [00:00, next 00:00]
            List<Bar> answer = TestFixtures.bars(Interval.HOUR_1, DAY_START, 25);

            // When
            List<Bar> clipped = validator.clip(answer, day);

            // Then
            assertEquals(24, clipped.size());
            assertTrue(validator.matchesExpectedRange(clipped, day));
            assertFalse(validator.matchesExpectedRange(answer, day));
        }

        @Test
        @DisplayName("Should reject a sequence missing its last bar")
        void detectsMissingBar() {
            List<Bar> short23 = TestFixtures.bars(Interval.HOUR_1, DAY_START, 23);

            assertFalse(validator.matchesExpectedRange(short23, day));
        }

        @Test
        @DisplayName("An off-grid window end keeps the bar that opens before it")
        void offGridEnd() {
            TimeWindow window = new TimeWindow(DAY_START, DAY_START + 2 * HOUR + 1, Interval.HOUR_1);

            assertEquals(3, validator.resolveWindow(window).expectedCount());
        }
    }

    @Nested
    @DisplayName("isValidRange")
    class ValidRangeTests {

        private final BoundaryValidator validator = validator(BoundaryRules.standard());

        @Test
        @DisplayName("Should accept an ordered past range with bars in it")
        void acceptsPastRange() {
            assertTrue(validator.isValidRange(DAY_START, DAY_START + HOUR, Interval.HOUR_1));
        }

        @Test
        @DisplayName("Should reject inverted, future and bar-less ranges")
        void rejectsBadRanges() {
            long future = CLOCK.millis() + HOUR;

            assertFalse(validator.isValidRange(DAY_START + HOUR, DAY_START, Interval.HOUR_1));
            assertFalse(validator.isValidRange(future, future + 10 * HOUR, Interval.HOUR_1));
            assertFalse(validator.isValidRange(DAY_START + 1, DAY_START + 1000, Interval.HOUR_1));
        }
    }

    @Nested
    @DisplayName("Calibration")
    class CalibrationTests {

        @TempDir
        Path dir;

        private final BoundaryRules exclusive = new BoundaryRules(BoundaryRules.StartRounding.UP, false);

        @Test
        @DisplayName("Should calibrate once per interval and keep the rules")
        void calibratesOncePerInterval() throws Exception {
            // Given
            AtomicInteger checks = new AtomicInteger();
            BoundaryValidator validator = new BoundaryValidator((interval, reference, deadline) -> {
                checks.incrementAndGet();
                assertTrue(reference < CLOCK.millis());
                return exclusive;
            }, CLOCK);

            // When
            BoundaryRules first = validator.calibrate(Interval.MINUTE_1, Deadline.none(), null);
            validator.calibrate(Interval.MINUTE_1, Deadline.none(), null);
            validator.calibrate(Interval.HOUR_1, Deadline.none(), null);

            // Then
            assertEquals(exclusive, first);
            assertEquals(exclusive, validator.rulesFor(Interval.MINUTE_1));
            assertFalse(validator.needsCalibration(Interval.MINUTE_1));
            assertEquals(2, checks.get());
        }

        @Test
        @DisplayName("rulesFor never calls the backend")
        void rulesForStaysOffline() {
            AtomicInteger checks = new AtomicInteger();
            BoundaryValidator validator = new BoundaryValidator((interval, reference, deadline) -> {
                checks.incrementAndGet();
                return exclusive;
            }, CLOCK);

            assertEquals(BoundaryRules.standard(), validator.rulesFor(Interval.HOUR_1));
            assertTrue(validator.isValidRange(DAY_START, DAY_START + HOUR, Interval.HOUR_1));
            assertTrue(validator.needsCalibration(Interval.HOUR_1));
            assertEquals(0, checks.get());
        }

        @Test
        @DisplayName("A failed calibration falls back to standard rules and is tried again next time")
        void failedCalibrationIsRetried() throws Exception {
            // Given: the first boundary check fails, the second answers
            AtomicInteger checks = new AtomicInteger();
            BoundaryValidator validator = new BoundaryValidator((interval, reference, deadline) -> {
                if (checks.incrementAndGet() == 1) {
                    throw new ServerErrorException(500, "klines", "down");
                }
                return exclusive;
            }, CLOCK);

            // When / Then
            assertEquals(BoundaryRules.standard(), validator.calibrate(Interval.HOUR_1, Deadline.none(), null));
            assertTrue(validator.needsCalibration(Interval.HOUR_1));

            assertEquals(exclusive, validator.calibrate(Interval.HOUR_1, Deadline.none(), null));
            assertFalse(validator.needsCalibration(Interval.HOUR_1));
            assertEquals(2, checks.get());
        }

        @Test
        @DisplayName("An inconclusive boundary check falls back to standard rules without remembering them")
        void inconclusiveCalibration() throws Exception {
            BoundaryValidator validator = new BoundaryValidator((interval, reference, deadline) -> null, CLOCK);

            assertEquals(BoundaryRules.standard(), validator.calibrate(Interval.MINUTE_5, Deadline.none(), null));
            assertTrue(validator.needsCalibration(Interval.MINUTE_5));
        }

        @Test
        @DisplayName("Should hand the caller's deadline to the boundary check and time out when it runs out")
        void calibrationHonorsDeadline() {
            // Given: a boundary check that takes two seconds against a one second budget
            TestFixtures.MutableClock clock = new TestFixtures.MutableClock(CLOCK.instant());
            Deadline budget = Deadline.after(Duration.ofSeconds(1), clock);
            BoundaryValidator validator = new BoundaryValidator((interval, reference, deadline) -> {
                assertSame(budget, deadline);
                clock.advance(Duration.ofSeconds(2));
                throw TransportException.timeout("read timed out");
            }, clock);

            // When
            TransportException e = assertThrows(TransportException.class,
                () -> validator.calibrate(Interval.HOUR_1, budget, null));

            // Then
            assertTrue(e.isTimeout());
            assertTrue(validator.needsCalibration(Interval.HOUR_1));
        }

        @Test
        @DisplayName("Rules learned by one validator are read back by the next without probing")
        void rulesFileSurvivesRestart() throws Exception {
            // Given
            BoundaryRulesFile file = new BoundaryRulesFile(dir.resolve("boundary-rules.json"));
            new BoundaryValidator((interval, reference, deadline) -> exclusive, file, CLOCK)
                .calibrate(Interval.MINUTE_15, Deadline.none(), null);

            // When
            BoundaryValidator restarted = new BoundaryValidator((interval, reference, deadline) -> {
                throw new AssertionError("asked the backend although the rules were recorded");
            }, new BoundaryRulesFile(file.getFile()), CLOCK);

            // Then
            assertFalse(restarted.needsCalibration(Interval.MINUTE_15));
            assertEquals(exclusive, restarted.rulesFor(Interval.MINUTE_15));
            assertTrue(restarted.needsCalibration(Interval.HOUR_1));
        }

        @Test
        @DisplayName("An unreadable rules file counts as empty")
        void unreadableRulesFile() throws Exception {
            Path path = dir.resolve("boundary-rules.json");
            Files.writeString(path, "{not json");
            BoundaryValidator validator = new BoundaryValidator((interval, reference, deadline) -> exclusive,
                new BoundaryRulesFile(path), CLOCK);

            assertTrue(validator.needsCalibration(Interval.HOUR_1));
            assertEquals(exclusive, validator.calibrate(Interval.HOUR_1, Deadline.none(), null));
            assertEquals(exclusive, new BoundaryRulesFile(path).load(Interval.HOUR_1));
        }
    }
}
