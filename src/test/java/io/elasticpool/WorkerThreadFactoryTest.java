package io.elasticpool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

public final class WorkerThreadFactoryTest {
    private static final Runnable NULL_RUNNABLE = () -> {};

    @Test
    public void testNamePattern() {
        final ThreadGroup group = new ThreadGroup(new ThreadGroup("one"), "two");
        final WorkerThreadFactory factory = new WorkerThreadFactory(group, null, null, "-%p-%%-%t-%G-", null);
        final String first = factory.newThread(NULL_RUNNABLE).getName();
        final String second = factory.newThread(NULL_RUNNABLE).getName();
        assertTrue(first.matches("-([a-z]+:)*one:two-%-1-two-"), "Wrong thread name (" + first + ")");
        assertTrue(second.matches("-([a-z]+:)*one:two-%-2-two-"), "Wrong thread name (" + second + ")");
    }

    @Test
    public void testDefaultPattern() {
        final String name = new WorkerThreadFactory().newThread(NULL_RUNNABLE).getName();
        assertTrue(name.matches("elastic-pool-\\d+-worker-1"), "Wrong thread name (" + name + ")");
    }

    @Test
    public void testDaemon() {
        assertTrue(new WorkerThreadFactory(null, Boolean.TRUE, null, "%t", null).newThread(NULL_RUNNABLE).isDaemon(), "Thread is not a daemon thread");
        assertFalse(new WorkerThreadFactory(null, Boolean.FALSE, null, "%t", null).newThread(NULL_RUNNABLE).isDaemon(), "Thread should not be a daemon thread");
        assertTrue(new WorkerThreadFactory().newThread(NULL_RUNNABLE).isDaemon(), "Default threads are daemon threads");
    }

    @Test
    public void testUncaughtHandler() throws InterruptedException {
        final AtomicBoolean called = new AtomicBoolean();
        final WorkerThreadFactory factory = new WorkerThreadFactory(null, null, null, null, (t, e) -> called.set(true));
        final Thread t = factory.newThread(() -> {
            throw new RuntimeException("...");
        });
        t.start();
        t.join();
        assertTrue(called.get(), "Handler was not called");
    }

    @Test
    public void testDefaultUncaughtHandlerLogs() {
        final Thread t = new WorkerThreadFactory().newThread(NULL_RUNNABLE);
        assertTrue(t.getUncaughtExceptionHandler() instanceof LoggingUncaughtExceptionHandler);
    }

    @Test
    public void testInitialPriority() {
        assertEquals(1, new WorkerThreadFactory(null, null, Integer.valueOf(1), null, null).newThread(NULL_RUNNABLE).getPriority(), "Wrong initial thread priority");
        assertEquals(2, new WorkerThreadFactory(null, null, Integer.valueOf(2), null, null).newThread(NULL_RUNNABLE).getPriority(), "Wrong initial thread priority");
        final ThreadGroup grp = new ThreadGroup("blah");
        grp.setMaxPriority(5);
        assertEquals(5, new WorkerThreadFactory(grp, null, Integer.valueOf(10), null, null).newThread(NULL_RUNNABLE).getPriority(), "Wrong initial thread priority");
        assertSame(grp, new WorkerThreadFactory(grp, null, null, null, null).newThread(NULL_RUNNABLE).getThreadGroup());
    }
}
