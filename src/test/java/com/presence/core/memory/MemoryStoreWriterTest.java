package com.presence.core.memory;

import com.presence.core.events.EventBus;
import com.presence.core.events.PresenceEvent;
import com.presence.core.metrics.PresenceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class MemoryStoreWriterTest {

    private SimpleMeterRegistry registry;
    private PresenceMetrics metrics;
    private EventBus eventBus;
    private List<PresenceEvent> events;
    private MemoryStoreWriter writer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PresenceMetrics(registry);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        if (writer != null) {
            writer.shutdown();
        }
    }

    @Test
    @DisplayName("successful write completes with true")
    void successfulWrite() throws Exception {
        var store = new InMemoryMemoryStore();
        writer = new MemoryStoreWriter(store, metrics, eventBus, 1000, MemoryStoreWriter.QUEUE_CAPACITY);

        assertTrue(writer.write("u1", "turn", Map.of("input", "hi")).get(2, TimeUnit.SECONDS));
        assertEquals(1, store.query("u1", null).size());
        assertEquals(0, writer.failureCount());
    }

    @Test
    @DisplayName("store failure is counted, published and never thrown")
    void failingStore() throws Exception {
        MemoryStore store = mock(MemoryStore.class);
        doThrow(new MemoryStoreException("disk full")).when(store).store(anyString(), anyString(), any());
        writer = new MemoryStoreWriter(store, metrics, eventBus, 1000, MemoryStoreWriter.QUEUE_CAPACITY);

        assertFalse(writer.write("u1", "turn", Map.of()).get(2, TimeUnit.SECONDS));
        assertEquals(1, writer.failureCount());
        assertEquals(1.0, metrics.storeFailureCount());
        var failures = events.stream().filter(e -> PresenceEvent.STORE_WRITE_FAILED.equals(e.eventType())).toList();
        assertEquals(1, failures.size());
        assertEquals("disk full", failures.get(0).payload().get("reason"));
    }

    @Test
    @DisplayName("slow store times out as a failure")
    void slowStoreTimesOut() throws Exception {
        MemoryStore store = mock(MemoryStore.class);
        doAnswer(invocation -> {
            Thread.sleep(1000);
            return null;
        }).when(store).store(anyString(), anyString(), any());
        writer = new MemoryStoreWriter(store, metrics, eventBus, 50, MemoryStoreWriter.QUEUE_CAPACITY);

        assertFalse(writer.write("u1", "turn", Map.of()).get(2, TimeUnit.SECONDS));
        assertEquals(1, writer.failureCount());
        assertTrue(events.get(0).payload().get("reason").toString().contains("timed out"));
    }

    @Test
    @DisplayName("timed-out writes give their threads back to later writes")
    void timedOutWriteIsCancelled() throws Exception {
        MemoryStore store = mock(MemoryStore.class);
        var calls = new AtomicInteger();
        doAnswer(invocation -> {
            if (calls.incrementAndGet() <= MemoryStoreWriter.POOL_SIZE) {
                Thread.sleep(10_000);
            }
            return null;
        }).when(store).store(anyString(), anyString(), any());
        writer = new MemoryStoreWriter(store, metrics, eventBus, 200, MemoryStoreWriter.QUEUE_CAPACITY);

        for (int i = 0; i < MemoryStoreWriter.POOL_SIZE; i++) {
            assertFalse(writer.write("u1", "turn", Map.of()).get(2, TimeUnit.SECONDS));
        }

        assertTrue(writer.write("u1", "turn", Map.of()).get(2, TimeUnit.SECONDS));
        assertEquals(MemoryStoreWriter.POOL_SIZE, writer.failureCount());
    }

    @Test
    @DisplayName("write arriving at a full queue is dropped as a failure")
    void fullQueueDropsWrite() throws Exception {
        MemoryStore store = mock(MemoryStore.class);
        var release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(store).store(anyString(), anyString(), any());
        writer = new MemoryStoreWriter(store, metrics, eventBus, 5000, 1);

        var accepted = new ArrayList<CompletableFuture<Boolean>>();
        for (int i = 0; i < MemoryStoreWriter.POOL_SIZE + 1; i++) {
            accepted.add(writer.write("u1", "turn", Map.of("n", i)));
        }
        var dropped = writer.write("u1", "turn", Map.of("n", "overflow"));

        assertTrue(dropped.isDone());
        assertFalse(dropped.get());
        assertEquals(1, writer.failureCount());
        assertEquals(1.0, metrics.storeFailureCount());
        assertTrue(events.get(0).payload().get("reason").toString().contains("queue full"));

        release.countDown();
        for (CompletableFuture<Boolean> write : accepted) {
            assertTrue(write.get(2, TimeUnit.SECONDS));
        }
    }
}
