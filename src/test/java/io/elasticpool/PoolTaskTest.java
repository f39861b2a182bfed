package io.elasticpool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

public final class PoolTaskTest {

    static final class RecordingListener implements TaskFuture.Listener<Object, String> {
        final List<String> events = new ArrayList<>();

        public void handleComplete(final TaskFuture<?> future, final String attachment) {
            events.add("complete:" + attachment);
        }

        public void handleFailed(final TaskFuture<?> future, final Throwable cause, final String attachment) {
            events.add("failed:" + attachment + ":" + cause.getMessage());
        }

        public void handleAbandoned(final TaskFuture<?> future, final String attachment) {
            events.add("abandoned:" + attachment);
        }
    }

    @Test
    public void testComplete() throws Exception {
        final PoolTask<String> task = new PoolTask<>(() -> "done");
        assertEquals(TaskFuture.Status.WAITING, task.getStatus());
        assertFalse(task.isDone());
        assertEquals(TaskFuture.Status.WAITING, task.await(10, TimeUnit.MILLISECONDS));
        assertThrows(TimeoutException.class, () -> task.get(10, TimeUnit.MILLISECONDS));
        task.run();
        assertTrue(task.isDone());
        assertFalse(task.isCancelled());
        assertEquals(TaskFuture.Status.COMPLETE, task.await());
        assertEquals("done", task.get());
        assertEquals("done", task.getUninterruptibly());
        assertEquals("done", task.get(1, TimeUnit.SECONDS));
    }

    @Test
    public void testRunsOnce() {
        final AtomicInteger calls = new AtomicInteger();
        final PoolTask<Integer> task = new PoolTask<>(calls::incrementAndGet);
        task.run();
        task.run();
        assertEquals(1, calls.get());
        assertFalse(task.abandon());
    }

    @Test
    public void testFailureIsCaptured() {
        final Error error = new AssertionError("bad");
        final PoolTask<Object> task = new PoolTask<>(() -> {
            throw error;
        });
        task.run();
        assertEquals(TaskFuture.Status.FAILED, task.getStatus());
        final ExecutionException e = assertThrows(ExecutionException.class, task::getUninterruptibly);
        assertSame(error, e.getCause());
    }

    @Test
    public void testAbandon() {
        final AtomicInteger calls = new AtomicInteger();
        final PoolTask<Integer> task = new PoolTask<>(calls::incrementAndGet);
        assertTrue(task.abandon());
        assertFalse(task.abandon());
        task.run();
        assertEquals(0, calls.get());
        assertTrue(task.isCancelled());
        assertTrue(task.isDone());
        assertFalse(task.cancel(true));
        Assertions.assertThatExceptionOfType(CancellationException.class).isThrownBy(task::get);
        Assertions.assertThatExceptionOfType(TaskAbandonedException.class).isThrownBy(() -> task.getUninterruptibly(1, TimeUnit.SECONDS));
    }

    @Test
    public void testListeners() {
        final RecordingListener listener = new RecordingListener();
        final PoolTask<String> completed = new PoolTask<>(() -> "x");
        completed.addListener(listener, "before");
        completed.run();
        completed.addListener(listener, "after");

        final PoolTask<String> failed = new PoolTask<>(() -> {
            throw new IllegalStateException("oops");
        });
        failed.addListener(listener, "f");
        failed.run();

        final PoolTask<String> abandoned = new PoolTask<>(() -> "never");
        abandoned.addListener(listener, "a");
        abandoned.abandon();

        Assertions.assertThat(listener.events).containsExactly("complete:before", "complete:after", "failed:f:oops", "abandoned:a");
    }

    @Test
    public void testListenerFailureDoesNotAffectTask() throws Exception {
        final PoolTask<String> task = new PoolTask<>(() -> "value");
        task.addListener(new TaskFuture.AbstractListener<Object, Void>() {
            public void handleComplete(final TaskFuture<?> future, final Void attachment) {
                throw new RuntimeException("listener");
            }
        }, null);
        task.run();
        assertEquals("value", task.get());
    }

    @Test
    public void testVoidCallable() throws Exception {
        final PoolTask<Object> task = new PoolTask<>(() -> null);
        task.run();
        assertNull(task.get());
    }
}
