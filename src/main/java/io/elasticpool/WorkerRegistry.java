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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.LongFunction;

import org.jboss.logging.Logger;

/**
 * The set of live worker descriptors, keyed by worker identity, and the two pool counters.  The counters are only
 * mutated under the registry lock but may be read without it; such reads are heuristics and every decision based
 * on them is validated again under the lock before it is committed.
 * <p>
 * The registry lock is never held while acquiring any other pool lock.
 */
final class WorkerRegistry {
    private static final Logger log = Logger.getLogger("io.elasticpool.worker");

    private final Lock lock = new ReentrantLock();

    // all protected by lock...
    private final Map<Long, WorkerDescriptor> workers = new LinkedHashMap<>();
    private long nextId = 1L;
    private int largestThreadCount;

    // written under lock, read anywhere
    private final AtomicInteger currentThreadCount = new AtomicInteger();
    private final AtomicInteger idleThreadCount = new AtomicInteger();

    WorkerRegistry() {
    }

    /**
     * Create, register and start a new idle worker, unless the pool is stopped or already has
     * {@code maxThreads} workers.
     *
     * @param maxThreads the maximum number of workers
     * @param stopped checked under the lock; no worker is added when it returns {@code true}
     * @param spawner creates the descriptor, with an unstarted thread, for a given identity
     * @return the new worker, or {@code null} if the pool is stopped or full
     * @throws ThreadCreationException if the thread could not be created or started
     */
    WorkerDescriptor tryAdd(final int maxThreads, final BooleanSupplier stopped, final LongFunction<WorkerDescriptor> spawner) throws ThreadCreationException {
        final Lock lock = this.lock;
        lock.lock();
        try {
            if (stopped.getAsBoolean() || currentThreadCount.get() >= maxThreads) {
                return null;
            }
            final long id = nextId++;
            final WorkerDescriptor descriptor;
            try {
                descriptor = spawner.apply(id);
            } catch (ThreadCreationException e) {
                throw e;
            } catch (Throwable t) {
                throw Messages.msg.threadCreationFailed(t);
            }
            if (descriptor == null) {
                throw Messages.msg.noThreadCreated();
            }
            workers.put(Long.valueOf(id), descriptor);
            final int current = currentThreadCount.incrementAndGet();
            idleThreadCount.incrementAndGet();
            try {
                descriptor.getThread().start();
            } catch (Throwable t) {
                workers.remove(Long.valueOf(id));
                currentThreadCount.decrementAndGet();
                idleThreadCount.decrementAndGet();
                throw Messages.msg.threadCreationFailed(t);
            }
            if (current > largestThreadCount) {
                largestThreadCount = current;
            }
            log.tracef("Added %s, %d threads", descriptor, current);
            return descriptor;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move a registered worker to a new state, keeping the idle counter in step.
     *
     * @param descriptor the worker
     * @param newState the new state
     */
    void transition(final WorkerDescriptor descriptor, final WorkerState newState) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            final WorkerState oldState = descriptor.getState();
            if (oldState == newState || oldState == WorkerState.RETIRED) {
                return;
            }
            if (oldState == WorkerState.IDLE) {
                idleThreadCount.decrementAndGet();
            }
            if (newState == WorkerState.IDLE) {
                idleThreadCount.incrementAndGet();
            }
            descriptor.setState(newState);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a worker which timed out while idle, provided the pool keeps more than {@code minThreads} workers.
     *
     * @param descriptor the worker
     * @param minThreads the floor on the number of workers
     * @return {@code true} if the worker was removed and should exit
     */
    boolean tryRetire(final WorkerDescriptor descriptor, final int minThreads) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            if (currentThreadCount.get() <= minThreads) {
                return false;
            }
            return doRemove(descriptor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a worker unconditionally.  Used once the worker thread has been joined.
     *
     * @param descriptor the worker
     * @return {@code true} if the worker was still registered
     */
    boolean remove(final WorkerDescriptor descriptor) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return doRemove(descriptor);
        } finally {
            lock.unlock();
        }
    }

    private boolean doRemove(final WorkerDescriptor descriptor) {
        if (workers.remove(Long.valueOf(descriptor.getId())) == null) {
            return false;
        }
        if (descriptor.getState() == WorkerState.IDLE) {
            idleThreadCount.decrementAndGet();
        }
        descriptor.setState(WorkerState.RETIRED);
        final int current = currentThreadCount.decrementAndGet();
        log.tracef("Removed %s, %d threads", descriptor, current);
        return true;
    }

    /**
     * Determine whether the given thread backs one of the registered workers.
     *
     * @param thread the thread
     * @return {@code true} if the thread is a registered worker
     */
    boolean isWorkerThread(final Thread thread) {
        final Lock lock = this.lock;
        lock.lock();
        try {
            for (WorkerDescriptor descriptor : workers.values()) {
                if (descriptor.getThread() == thread) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get a snapshot of the registered workers, in spawn order.
     *
     * @return the snapshot
     */
    List<WorkerDescriptor> snapshot() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(workers.values()));
        } finally {
            lock.unlock();
        }
    }

    int getCurrentThreadCount() {
        return currentThreadCount.get();
    }

    int getIdleThreadCount() {
        return idleThreadCount.get();
    }

    int getLargestThreadCount() {
        final Lock lock = this.lock;
        lock.lock();
        try {
            return largestThreadCount;
        } finally {
            lock.unlock();
        }
    }
}
