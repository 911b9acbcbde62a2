package com.klinevault.data.fcp;

import com.klinevault.core.error.ServerErrorException;
import com.klinevault.core.error.TransportException;
import com.klinevault.core.model.Bar;
import com.klinevault.core.model.Interval;
import com.klinevault.core.model.MarketType;
import com.klinevault.data.TestFixtures;
import com.klinevault.data.resilience.Deadline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InFlightRequestsTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 20);
    private static final PartitionKey KEY = new PartitionKey(MarketType.SPOT, "btcusdt", Interval.HOUR_1, DATE);

    private final InFlightRequests inFlight = new InFlightRequests();
    private final ExecutorService pool = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    /**
     * Start a leader that blocks until released, and wait until it is running.
     */
    private Future<List<Bar>> blockedLeader(InFlightRequests.Loader afterRelease, CountDownLatch release,
                                            AtomicInteger loads) throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        Future<List<Bar>> leader = pool.submit(() -> inFlight.execute(KEY, Deadline.none(), () -> {
            loads.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "interrupted", e);
            }
            return afterRelease.load();
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        return leader;
    }

    @Test
    @DisplayName("Concurrent callers share one load")
    void collapsesConcurrentLoads() throws Exception {
        // Given
        List<Bar> day = TestFixtures.fullDay(Interval.HOUR_1, DATE);
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        Future<List<Bar>> leader = blockedLeader(() -> day, release, loads);

        // When: followers join while the leader is still loading
        List<Future<List<Bar>>> followers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            followers.add(pool.submit(() -> inFlight.execute(KEY, Deadline.none(), () -> {
                loads.incrementAndGet();
                return List.of();
            })));
        }
        Thread.sleep(200);
        release.countDown();

        // Then
        assertSame(day, leader.get(5, TimeUnit.SECONDS));
        for (Future<List<Bar>> f : followers) {
            assertSame(day, f.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, loads.get());
        assertEquals(0, inFlight.size());
    }

    @Test
    @DisplayName("Followers receive the leader's error")
    void sharesError() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        Future<List<Bar>> leader = blockedLeader(() -> {
            throw new ServerErrorException(503, "fake://", "down");
        }, release, loads);

        Future<List<Bar>> follower = pool.submit(() -> inFlight.execute(KEY, Deadline.none(), List::of));
        Thread.sleep(200);
        release.countDown();

        ExecutionException leaderError = assertThrows(ExecutionException.class, () -> leader.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ServerErrorException.class, leaderError.getCause());
        ExecutionException followerError = assertThrows(ExecutionException.class, () -> follower.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ServerErrorException.class, followerError.getCause());
        assertEquals(1, loads.get());
    }

    @Test
    @DisplayName("A finished load is not reused")
    void sequentialCallsLoadAgain() throws Exception {
        AtomicInteger loads = new AtomicInteger();

        inFlight.execute(KEY, Deadline.none(), () -> {
            loads.incrementAndGet();
            return List.of();
        });
        inFlight.execute(KEY, Deadline.none(), () -> {
            loads.incrementAndGet();
            return List.of();
        });

        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("Different partitions load independently")
    void independentKeys() throws Exception {
        PartitionKey other = new PartitionKey(MarketType.SPOT, "BTCUSDT", Interval.HOUR_1, DATE.plusDays(1));
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        Future<List<Bar>> leader = blockedLeader(List::of, release, loads);

        inFlight.execute(other, Deadline.none(), () -> {
            loads.incrementAndGet();
            return List.of();
        });

        assertEquals(2, loads.get());
        release.countDown();
        leader.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("A follower gives up when its deadline runs out")
    void followerDeadline() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        Future<List<Bar>> leader = blockedLeader(List::of, release, loads);

        TransportException e = assertThrows(TransportException.class, () ->
            inFlight.execute(KEY, Deadline.after(Duration.ofMillis(50), Clock.systemUTC()), List::of));

        assertEquals(TransportException.Kind.TIMEOUT, e.getKind());
        release.countDown();
        leader.get(5, TimeUnit.SECONDS);
    }
}
