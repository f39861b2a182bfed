package io.elasticpool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.function.LongFunction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public final class WorkerRegistryTest {
    private final CountDownLatch release = new CountDownLatch(1);

    private final LongFunction<WorkerDescriptor> spawner = id -> new WorkerDescriptor(id, new Thread(() -> {
        try {
            release.await();
        } catch (InterruptedException ignored) {
        }
    }, "registry-test-" + id));

    @AfterEach
    public void releaseThreads() {
        release.countDown();
    }

    @Test
    public void testAddRespectsMaximum() {
        final WorkerRegistry registry = new WorkerRegistry();
        assertNotNull(registry.tryAdd(2, () -> false, spawner));
        assertNotNull(registry.tryAdd(2, () -> false, spawner));
        assertNull(registry.tryAdd(2, () -> false, spawner));
        assertEquals(2, registry.getCurrentThreadCount());
        assertEquals(2, registry.getIdleThreadCount());
        assertEquals(2, registry.getLargestThreadCount());
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    public void testAddRefusedWhenStopped() {
        final WorkerRegistry registry = new WorkerRegistry();
        assertNull(registry.tryAdd(2, () -> true, spawner));
        assertEquals(0, registry.getCurrentThreadCount());
    }

    @Test
    public void testSpawnFailureRollsBack() {
        final WorkerRegistry registry = new WorkerRegistry();
        assertThrows(ThreadCreationException.class, () -> registry.tryAdd(2, () -> false, id -> {
            throw new OutOfMemoryError("unable to create native thread");
        }));
        assertThrows(ThreadCreationException.class, () -> registry.tryAdd(2, () -> false, id -> null));
        assertEquals(0, registry.getCurrentThreadCount());
        assertEquals(0, registry.getIdleThreadCount());
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    public void testTransitionsTrackIdleCount() {
        final WorkerRegistry registry = new WorkerRegistry();
        final WorkerDescriptor worker = registry.tryAdd(1, () -> false, spawner);
        assertEquals(WorkerState.IDLE, worker.getState());
        registry.transition(worker, WorkerState.BUSY);
        assertEquals(0, registry.getIdleThreadCount());
        registry.transition(worker, WorkerState.PAUSED);
        assertEquals(0, registry.getIdleThreadCount());
        registry.transition(worker, WorkerState.IDLE);
        assertEquals(1, registry.getIdleThreadCount());
        registry.transition(worker, WorkerState.RETIRED);
        assertEquals(0, registry.getIdleThreadCount());
        assertNotNull(worker.getStopTime());
        // retired is final
        registry.transition(worker, WorkerState.IDLE);
        assertEquals(WorkerState.RETIRED, worker.getState());
        assertEquals(1, registry.getCurrentThreadCount());
        assertTrue(registry.remove(worker));
        assertFalse(registry.remove(worker));
        assertEquals(0, registry.getCurrentThreadCount());
    }

    @Test
    public void testRetireKeepsMinimum() {
        final WorkerRegistry registry = new WorkerRegistry();
        final WorkerDescriptor first = registry.tryAdd(2, () -> false, spawner);
        final WorkerDescriptor second = registry.tryAdd(2, () -> false, spawner);
        assertTrue(registry.tryRetire(first, 1));
        assertFalse(registry.tryRetire(second, 1));
        assertEquals(1, registry.getCurrentThreadCount());
        assertEquals(1, registry.getIdleThreadCount());
        assertEquals(WorkerState.RETIRED, first.getState());
        assertEquals(2, registry.getLargestThreadCount());
    }

    @Test
    public void testIsWorkerThread() {
        final WorkerRegistry registry = new WorkerRegistry();
        final WorkerDescriptor worker = registry.tryAdd(1, () -> false, spawner);
        assertTrue(registry.isWorkerThread(worker.getThread()));
        assertFalse(registry.isWorkerThread(Thread.currentThread()));
        registry.remove(worker);
        assertFalse(registry.isWorkerThread(worker.getThread()));
    }
}
