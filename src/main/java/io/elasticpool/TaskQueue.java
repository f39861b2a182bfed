/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2017 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.elasticpool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * The FIFO buffer of pending tasks, with its own lock and wake signals.  The queue also counts the tasks which
 * were claimed from it but not yet {@linkplain #complete() completed}, so that quiescence (nothing queued and
 * nothing running) can be observed atomically under the queue lock.
 * <p>
 * The queue lock is never held while acquiring any other pool lock.
 */
final class TaskQueue {

    private final Lock lock = new ReentrantLock();
    // signal when a task is written to the queue, or when waiting consumers must re-check the pool status
    private final Condition enqueueCondition = lock.newCondition();
    // signal when the queue is empty and no claimed task is still running
    private final Condition drainedCondition = lock.newCondition();

    // all protected by lock...
    private final ArrayDeque<PoolTask<?>> tasks = new ArrayDeque<>();
    private int inFlight;

    TaskQueue() {
    }

    /**
     * Append a task and wake one waiting consumer, unless the pool is stopped.
     *
     * @param task the task
     * @param stopped checked under the lock; the task is refused when it returns {@code true}
     * @return {@code true} if the task was queued, {@code false} if it was refused
     */
    boolean offer(final PoolTask<?> task, final BooleanSupplier stopped) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            if (stopped.getAsBoolean()) {
                return false;
            }
            tasks.addLast(task);
            enqueueCondition.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim the head task, waiting up to the given time for one to become available.  A claimed task must later be
     * reported through {@link #complete()}.
     *
     * @param timeoutNanos the maximum time to wait, in nanoseconds
     * @param stopWaiting checked before every claim attempt and after every wake; when it returns {@code true} the
     *      wait ends without claiming
     * @return the claimed task, or {@code null} if the time elapsed or {@code stopWaiting} returned {@code true}
     */
    PoolTask<?> claim(final long timeoutNanos, final BooleanSupplier stopWaiting) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            long remaining = timeoutNanos;
            for (;;) {
                if (stopWaiting.getAsBoolean()) {
                    return null;
                }
                final PoolTask<?> task = tasks.pollFirst();
                if (task != null) {
                    inFlight++;
                    return task;
                }
                if (remaining <= 0L) {
                    return null;
                }
                try {
                    remaining = enqueueCondition.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    // workers are not interruptible while waiting; the status check decides
                    Thread.interrupted();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Report that a task previously returned by {@link #claim(long, BooleanSupplier)} has finished running.
     */
    void complete() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            assert inFlight > 0;
            if (--inFlight == 0 && tasks.isEmpty()) {
                drainedCondition.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every queued task.  Tasks already claimed are unaffected.
     *
     * @return the removed tasks, in queue order
     */
    List<PoolTask<?>> clear() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            final List<PoolTask<?>> list = new ArrayList<>(tasks);
            tasks.clear();
            if (inFlight == 0) {
                drainedCondition.signalAll();
            }
            return list;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake every waiting consumer and every quiescence waiter so that they re-check the pool status.
     */
    void wakeAll() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            enqueueCondition.signalAll();
            drainedCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until the queue is empty and no claimed task is running, or until {@code stopWaiting} returns
     * {@code true}.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit
     * @param stopWaiting checked after every wake
     * @return {@code true} if the queue became quiescent or {@code stopWaiting} returned {@code true},
     *      {@code false} if the time elapsed
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    boolean awaitQuiescence(final long timeout, final TimeUnit unit, final BooleanSupplier stopWaiting) throws InterruptedException {
        final Lock lock = this.lock;
        lock.lockInterruptibly();
        try {
            long remaining = unit.toNanos(timeout);
            while (! (tasks.isEmpty() && inFlight == 0) && ! stopWaiting.getAsBoolean()) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = drainedCondition.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the number of queued tasks.
     *
     * @return the number of queued tasks
     */
    int size() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get the number of claimed tasks which are still running.
     *
     * @return the number of running tasks
     */
    int inFlight() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }
}
