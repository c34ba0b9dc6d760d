package in.receipttrack.relay.registry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionRegistry.
 *
 * Tests:
 * - Id assignment and lookup
 * - Idempotent unregister
 * - Capacity limit
 * - Closed connections are refused
 * - Snapshot isolation and consistency under concurrent mutation
 */
class ConnectionRegistryTest {

    @Test
    void testRegisterAssignsUniqueIds() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(10);
        FakeClientConnection a = new FakeClientConnection();
        FakeClientConnection b = new FakeClientConnection();

        long idA = registry.register(a);
        long idB = registry.register(b);

        assertNotEquals(idA, idB);
        assertEquals(idA, a.connectionId(), "Connection learns its id");
        assertEquals(idB, b.connectionId());
        assertEquals(2, registry.size());
        assertSame(a, registry.find(idA).orElseThrow());
    }

    @Test
    void testUnregisterIsIdempotent() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(10);
        long id = registry.register(new FakeClientConnection());

        registry.unregister(id);
        registry.unregister(id);
        registry.unregister(999);

        assertEquals(0, registry.size());
        assertTrue(registry.find(id).isEmpty());
    }

    @Test
    void testLimitReached() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(2);
        registry.register(new FakeClientConnection());
        long second = registry.register(new FakeClientConnection());

        RegistryExhaustedException e = assertThrows(RegistryExhaustedException.class,
            () -> registry.register(new FakeClientConnection()));
        assertEquals(2, e.getLimit());
        assertEquals(2, registry.size(), "Existing connections are unaffected");

        registry.unregister(second);
        assertDoesNotThrow(() -> registry.register(new FakeClientConnection()), "Freed slot is reusable");
    }

    @Test
    void testClosedConnectionRefused() {
        ConnectionRegistry registry = new ConnectionRegistry(10);
        FakeClientConnection closing = new FakeClientConnection();
        closing.requestClose("bye");

        assertThrows(IllegalStateException.class, () -> registry.register(closing));
        assertEquals(0, registry.size());
    }

    @Test
    void testSnapshotIsPointInTime() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(10);
        long a = registry.register(new FakeClientConnection());
        registry.register(new FakeClientConnection());

        List<ClientConnection> snapshot = registry.snapshot();
        registry.unregister(a);
        registry.register(new FakeClientConnection());

        assertEquals(2, snapshot.size(), "Later mutation does not change an existing snapshot");
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new FakeClientConnection()));
    }

    @Test
    void testCloseAllRequestsCloseOnEveryConnection() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(10);
        FakeClientConnection a = new FakeClientConnection();
        FakeClientConnection b = new FakeClientConnection();
        registry.register(a);
        registry.register(b);

        registry.closeAll("shutdown");

        assertEquals("shutdown", a.closeReason());
        assertEquals("shutdown", b.closeReason());
    }

    @Test
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionRegistry(0));
    }

    /**
     * Writers churn register/unregister pairs while readers take snapshots. Every
     * snapshot must be internally consistent: no duplicates, only connections that
     * were registered at some point, never more than the limit.
     */
    @Test
    void testSnapshotConsistencyUnderConcurrentMutation() throws Exception {
        int limit = 1_000;
        ConnectionRegistry registry = new ConnectionRegistry(limit);
        Set<ClientConnection> everRegistered = ConcurrentHashMap.newKeySet();
        ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
        AtomicBoolean stop = new AtomicBoolean(false);
        CountDownLatch startGate = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            futures.add(pool.submit(() -> {
                startGate.await();
                for (int i = 0; i < 2_000; i++) {
                    FakeClientConnection c = new FakeClientConnection();
                    everRegistered.add(c);
                    long id = registry.register(c);
                    if (i % 3 != 0) {
                        registry.unregister(id);
                    }
                    if (registry.size() > limit / 2) {
                        for (ClientConnection existing : registry.snapshot()) {
                            registry.unregister(existing.connectionId());
                        }
                    }
                }
                return null;
            }));
        }
        for (int r = 0; r < 4; r++) {
            futures.add(pool.submit(() -> {
                startGate.await();
                while (!stop.get()) {
                    List<ClientConnection> snapshot = registry.snapshot();
                    Set<Long> ids = new HashSet<>();
                    for (ClientConnection c : snapshot) {
                        if (!ids.add(c.connectionId())) {
                            violations.add("duplicate id " + c.connectionId());
                        }
                        if (c.connectionId() == 0) {
                            violations.add("unassigned id in snapshot");
                        }
                        if (!everRegistered.contains(c)) {
                            violations.add("unknown connection in snapshot");
                        }
                    }
                    if (snapshot.size() > limit) {
                        violations.add("snapshot exceeds limit: " + snapshot.size());
                    }
                }
                return null;
            }));
        }

        startGate.countDown();
        for (int i = 0; i < 4; i++) {
            futures.get(i).get(30, TimeUnit.SECONDS);
        }
        stop.set(true);
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        assertTrue(violations.isEmpty(), "Snapshot violations: " + violations);
        Set<Long> finalIds = new HashSet<>();
        for (ClientConnection c : registry.snapshot()) {
            assertTrue(finalIds.add(c.connectionId()));
            assertTrue(registry.find(c.connectionId()).isPresent());
        }
        assertEquals(registry.size(), finalIds.size());
    }
}
