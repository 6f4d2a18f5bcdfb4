package com.lyshra.open.flow.core.engine.store.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryClusterMemory")
class InMemoryClusterMemoryTest {

    private InMemoryClusterMemory memory;

    @BeforeEach
    void setUp() {
        memory = new InMemoryClusterMemory();
    }

    @Test
    @DisplayName("entries are scoped by namespace")
    void namespaces() {
        memory.put("a", "key", 1);
        memory.put("b", "key", 2);

        assertEquals(Optional.of(1), memory.get("a", "key"));
        assertEquals(Optional.of(2), memory.get("b", "key"));
        assertEquals(Set.of("key"), memory.keys("a"));
        assertTrue(memory.delete("a", "key"));
        assertFalse(memory.delete("a", "key"));
        assertFalse(memory.exists("a", "key"));
        assertTrue(memory.exists("b", "key"));
    }

    @Test
    @DisplayName("opening a new session drops the previous contents")
    void reopen() {
        memory.put("a", "key", 1);
        memory.shutdown();

        assertFalse(memory.isAvailable());

        memory.open();

        assertTrue(memory.isAvailable());
        assertTrue(memory.keys("a").isEmpty());
    }

    @Test
    @DisplayName("unreachable memory rejects every operation")
    void unavailable() {
        memory.setAvailable(false);

        assertThrows(IllegalStateException.class, () -> memory.put("a", "key", 1));
        assertThrows(IllegalStateException.class, () -> memory.get("a", "key"));
        assertThrows(IllegalStateException.class, () -> memory.clear("a"));
    }

    @Test
    @DisplayName("clear is atomic with respect to concurrent puts")
    void clearLinearizesWithPuts() throws Exception {
        // Given
        int writers = 4;
        int putsPerWriter = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger cleared = new AtomicInteger();

        try {
            // When
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < putsPerWriter; i++) {
                        memory.put("ns", writer + "-" + i, i);
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    cleared.addAndGet(memory.clear("ns"));
                }
                return null;
            }));
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            // Then every put was either cleared exactly once or is still present
            int remaining = memory.keys("ns").size();
            assertEquals(writers * putsPerWriter, cleared.get() + remaining);
        } finally {
            pool.shutdownNow();
        }
    }
}
