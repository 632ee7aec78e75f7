package io.fleetcron.internal.coordination;

import io.fleetcron.core.LeaseState;
import io.fleetcron.core.SemaphoreLease;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyCoordinatorTest {

    private final InMemoryCoordinationService service = new InMemoryCoordinationService();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldGrantAtMostMaxConcurrentSlots() throws Exception {
        ConcurrencyCoordinator a = coordinator();
        ConcurrencyCoordinator b = coordinator();
        ConcurrencyCoordinator c = coordinator();

        assertTrue(a.lock("db", "a", 2, false, null));
        assertTrue(b.lock("db", "b", 2, false, null));
        assertFalse(c.lock("db", "c", 2, false, null));

        Future<Boolean> waiting = executor.submit(() -> c.lock("db", "c", 2, true, Duration.ofSeconds(5)));
        TimeUnit.MILLISECONDS.sleep(100);
        assertFalse(waiting.isDone());

        assertTrue(a.unlock("db", "a"));
        assertTrue(waiting.get(5, TimeUnit.SECONDS));
        assertTrue(c.isHeld("db", "c"));
        assertFalse(a.isHeld("db", "a"));
    }

    @Test
    void blockedCallersShouldBeServedInArrivalOrder() throws Exception {
        ConcurrencyCoordinator holder = coordinator();
        assertTrue(holder.lock("db", "holder", 1, false, null));

        List<String> order = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> waiters = new ArrayList<>();
        for (String id : List.of("first", "second", "third")) {
            ConcurrencyCoordinator coordinator = coordinator();
            CountDownLatch queued = new CountDownLatch(1);
            waiters.add(executor.submit(() -> {
                queued.countDown();
                if (coordinator.lock("db", id, 1, true, Duration.ofSeconds(10))) {
                    order.add(id);
                    coordinator.unlock("db", id);
                }
                return null;
            }));
            queued.await();
            // let the request node be created before the next caller arrives
            TimeUnit.MILLISECONDS.sleep(100);
        }

        holder.unlock("db", "holder");
        for (Future<?> w : waiters) {
            w.get(10, TimeUnit.SECONDS);
        }
        assertEquals(List.of("first", "second", "third"), order);
    }

    @Test
    void blockingLockShouldGiveUpAfterTimeout() {
        ConcurrencyCoordinator a = coordinator();
        ConcurrencyCoordinator b = coordinator();
        assertTrue(a.lock("db", "a", 1, false, null));

        assertFalse(b.lock("db", "b", 1, true, Duration.ofMillis(200)));

        a.unlock("db", "a");
        assertTrue(b.lock("db", "b", 1, false, null));
    }

    @Test
    void unlockShouldBeIdempotentAndRelockCheap() {
        ConcurrencyCoordinator a = coordinator();

        assertTrue(a.lock("db", "a", 1, false, null));
        assertTrue(a.lock("db", "a", 1, false, null));
        assertTrue(a.unlock("db", "a"));
        assertTrue(a.unlock("db", "a"));
        assertTrue(a.unlock("db", "never-locked"));
        assertTrue(a.lock("db", "a", 1, false, null));
    }

    @Test
    void expiredSessionShouldLoseLeasesAndFreeSlots() {
        InMemoryCoordinationService.Session session = service.openSession();
        ConcurrencyCoordinator a = new ConcurrencyCoordinator(session, "/fleetcron", Clock.systemUTC());
        ConcurrencyCoordinator b = coordinator();
        assertTrue(a.lock("db", "a", 1, false, null));
        SemaphoreLease lease = a.lease("db", "a").orElseThrow();
        assertEquals(LeaseState.GRANTED, lease.state());

        service.expire(session);

        assertEquals(LeaseState.LOST, lease.state());
        assertFalse(a.isHeld("db", "a"));
        assertTrue(b.lock("db", "b", 1, false, null));
    }

    @Test
    void unavailableServiceShouldFailClosed() {
        ConcurrencyCoordinator a = coordinator();
        assertTrue(a.lock("db", "a", 1, false, null));
        SemaphoreLease lease = a.lease("db", "a").orElseThrow();

        service.setAvailable(false);

        assertFalse(a.lock("db", "other", 5, false, null));
        assertFalse(a.minParty("quorum", "a", 1, false, null));
        assertFalse(a.unlock("db", "a"));
        assertEquals(LeaseState.LOST, lease.state());
        assertFalse(a.isHeld("db", "a"));

        service.setAvailable(true);
        assertTrue(a.lock("db", "other", 5, false, null));
    }

    @Test
    void minPartyShouldCountDistinctIdentifiers() throws Exception {
        ConcurrencyCoordinator a = coordinator();
        ConcurrencyCoordinator b = coordinator();
        ConcurrencyCoordinator c = coordinator();

        assertFalse(a.minParty("quorum", "a", 2, false, null));
        assertFalse(a.minParty("quorum", "a", 2, false, null));
        // same identifier from another client is still one member
        assertFalse(b.minParty("quorum", "a", 2, false, null));

        Future<Boolean> waiting = executor.submit(() -> c.minParty("quorum", "c", 3, true, Duration.ofSeconds(5)));
        TimeUnit.MILLISECONDS.sleep(100);
        assertTrue(b.minParty("quorum", "b", 2, false, null));
        assertTrue(waiting.get(5, TimeUnit.SECONDS));

        assertTrue(a.leaveParty("quorum", "a"));
        assertTrue(b.leaveParty("quorum", "a"));
        assertFalse(c.minParty("quorum", "c", 3, false, null));
    }

    @Test
    void resourceNamesMustBePlainSegments() {
        ConcurrencyCoordinator a = coordinator();

        assertThrows(IllegalArgumentException.class, () -> a.lock("a/b", "a", 1, false, null));
        assertThrows(IllegalArgumentException.class, () -> a.lock("db", " ", 1, false, null));
        assertThrows(IllegalArgumentException.class, () -> a.lock("db", "a", 0, false, null));
    }

    @Test
    void blockingCallsShouldRequireAPositiveTimeout() {
        ConcurrencyCoordinator holder = coordinator();
        ConcurrencyCoordinator a = coordinator();
        assertTrue(holder.lock("db", "holder", 1, false, null));

        assertThrows(IllegalArgumentException.class, () -> a.lock("db", "a", 1, true, null));
        assertThrows(IllegalArgumentException.class, () -> a.lock("db", "a", 1, true, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> a.minParty("quorum", "a", 2, true, null));
        assertThrows(IllegalArgumentException.class, () -> a.minParty("quorum", "a", 2, true, Duration.ofSeconds(-1)));

        // rejected calls leave no request node behind
        assertTrue(holder.unlock("db", "holder"));
        assertTrue(a.lock("db", "a", 1, false, null));
    }

    @Test
    void releaseAllShouldFreeEverySlot() {
        ConcurrencyCoordinator a = coordinator();
        ConcurrencyCoordinator b = coordinator();
        assertTrue(a.lock("db", "a1", 2, false, null));
        assertTrue(a.lock("db", "a2", 2, false, null));
        assertFalse(b.lock("db", "b", 2, false, null));

        a.releaseAll();

        assertTrue(b.lock("db", "b", 2, false, null));
    }

    private ConcurrencyCoordinator coordinator() {
        return new ConcurrencyCoordinator(service.openSession(), "/fleetcron", Clock.systemUTC());
    }
}
