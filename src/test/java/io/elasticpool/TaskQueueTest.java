package io.elasticpool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(30)
public final class TaskQueueTest {

    private static PoolTask<Object> task() {
        return new PoolTask<>(() -> null);
    }

    @Test
    public void testFifoOrder() {
        final TaskQueue queue = new TaskQueue();
        final PoolTask<Object> first = task();
        final PoolTask<Object> second = task();
        queue.offer(first, () -> false);
        queue.offer(second, () -> false);
        assertEquals(2, queue.size());
        assertSame(first, queue.claim(0L, () -> false));
        assertSame(second, queue.claim(0L, () -> false));
        assertNull(queue.claim(0L, () -> false));
        assertEquals(2, queue.inFlight());
        queue.complete();
        queue.complete();
        assertEquals(0, queue.inFlight());
    }

    @Test
    public void testOfferRefusedWhenStopped() {
        final TaskQueue queue = new TaskQueue();
        assertFalse(queue.offer(task(), () -> true));
        assertEquals(0, queue.size());
        assertTrue(queue.offer(task(), () -> false));
        assertEquals(1, queue.size());
    }

    @Test
    public void testClaimTimesOut() {
        final TaskQueue queue = new TaskQueue();
        final long start = System.nanoTime();
        assertNull(queue.claim(TimeUnit.MILLISECONDS.toNanos(50L), () -> false));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40L));
    }

    @Test
    public void testClaimHonorsStopWaiting() {
        final TaskQueue queue = new TaskQueue();
        queue.offer(task(), () -> false);
        assertNull(queue.claim(Long.MAX_VALUE, () -> true));
        assertEquals(1, queue.size());
        assertEquals(0, queue.inFlight());
    }

    @Test
    public void testOfferWakesWaitingClaim() throws Exception {
        final TaskQueue queue = new TaskQueue();
        final AtomicReference<PoolTask<?>> claimed = new AtomicReference<>();
        final Thread consumer = new Thread(() -> claimed.set(queue.claim(TimeUnit.SECONDS.toNanos(10L), () -> false)));
        consumer.start();
        final PoolTask<Object> task = task();
        queue.offer(task, () -> false);
        consumer.join();
        assertSame(task, claimed.get());
    }

    @Test
    public void testWakeAllReleasesWaiters() throws Exception {
        final TaskQueue queue = new TaskQueue();
        final AtomicBoolean stop = new AtomicBoolean();
        final AtomicReference<PoolTask<?>> claimed = new AtomicReference<>(task());
        final Thread consumer = new Thread(() -> claimed.set(queue.claim(Long.MAX_VALUE, stop::get)));
        consumer.start();
        Thread.sleep(50L);
        stop.set(true);
        queue.wakeAll();
        consumer.join();
        assertNull(claimed.get());
    }

    @Test
    public void testClear() {
        final TaskQueue queue = new TaskQueue();
        final PoolTask<Object> first = task();
        final PoolTask<Object> second = task();
        queue.offer(first, () -> false);
        queue.offer(second, () -> false);
        final List<PoolTask<?>> removed = queue.clear();
        assertEquals(List.of(first, second), removed);
        assertEquals(0, queue.size());
    }

    @Test
    public void testQuiescence() throws Exception {
        final TaskQueue queue = new TaskQueue();
        assertTrue(queue.awaitQuiescence(0L, TimeUnit.NANOSECONDS, () -> false));
        queue.offer(task(), () -> false);
        assertFalse(queue.awaitQuiescence(10L, TimeUnit.MILLISECONDS, () -> false));
        assertTrue(queue.awaitQuiescence(10L, TimeUnit.MILLISECONDS, () -> true));
        queue.claim(0L, () -> false);
        // claimed but still running
        assertFalse(queue.awaitQuiescence(10L, TimeUnit.MILLISECONDS, () -> false));
        final Thread finisher = new Thread(() -> {
            try {
                Thread.sleep(50L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            queue.complete();
        });
        finisher.start();
        assertTrue(queue.awaitQuiescence(10L, TimeUnit.SECONDS, () -> false));
        finisher.join();
    }
}
