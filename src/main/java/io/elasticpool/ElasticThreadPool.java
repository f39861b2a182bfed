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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import io.elasticpool.management.ElasticThreadPoolMXBean;
import io.elasticpool.management.ManageableElasticThreadPool;
import io.smallrye.common.constraint.Assert;
import io.smallrye.common.cpu.ProcessorInfo;
import io.smallrye.common.function.ExceptionBiFunction;
import io.smallrye.common.function.ExceptionFunction;
import org.jboss.logging.Logger;

/**
 * An elastic worker thread pool.  Submitted tasks are queued in FIFO order and executed by a set of worker threads
 * whose size floats between a minimum and a maximum: a worker is added at once whenever more tasks are queued than
 * there are idle workers to claim them, while a worker which waits longer than the maximum idle time for a task
 * retires, as long as more than the minimum number of workers remain.
 * <p>
 * The pool is created stopped and starts implicitly on the first submission.  It may be paused, which lets busy
 * workers finish their current task and then holds every worker until it is resumed, and stopped, which abandons
 * the queued tasks, waits for the running ones and then joins every worker.  A stopped pool may be started again.
 * <p>
 * New instances are created with one of the constructors, or by configuring a {@link Builder} and calling its
 * {@link Builder#build() build()} method.
 */
public final class ElasticThreadPool implements Executor, ManageableElasticThreadPool {
    static {
        Version.getVersionString();
    }

    /*
    ┌──────────────────────────┐
    │ Explanation of operation │
    └──────────────────────────┘

    Three structures are shared between submitters, workers and control operations, each with its own guard:
      • the task queue (TaskQueue), under the queue lock, with an enqueue signal for waiting workers and a drained
        signal for quiescence waiters;
      • the worker registry (WorkerRegistry), under the registry lock, which also owns the current and idle thread
        counters (written under the lock, read anywhere);
      • the pool status (this.status), an atomic value paired with the status lock and its signal, on which paused
        workers wait.
    None of these locks is ever acquired while another one is held.  The control lock only serializes start() and
    stop() and is always acquired first.  pause() and resume() are single status transitions and take no lock, so a
    task may call them while stop() is joining its thread; start() from a worker never waits for the control lock.

    Lock-free reads of the counters and of the configuration are heuristics.  Growth re-checks the maximum under
    the registry lock and retirement re-checks the minimum under the registry lock, so neither bound is crossed by
    a committed change.

    Status changes are published before the matching signal is sent: pause() and stop() wake the queue waiters,
    resume() and stop() wake the status waiters.  Every waiter re-reads the status after it wakes, under the lock
    which the signal is sent under, so no wakeup is lost.

    Workers leaving because of an idle timeout deregister themselves and are never joined.  Workers leaving because
    of stop() only mark themselves retired; stop() joins each registered thread and deregisters it afterwards.
     */

    private static final Logger log = Logger.getLogger("io.elasticpool.pool");

    /**
     * The default minimum number of threads.
     */
    public static final int DEFAULT_MIN_THREADS = 1;
    /**
     * The default maximum idle time.
     */
    public static final Duration DEFAULT_MAX_IDLE_TIME = Duration.ofMillis(250L);

    private static final AtomicReferenceFieldUpdater<ElasticThreadPool, PoolStatus> statusUpdater = AtomicReferenceFieldUpdater.newUpdater(ElasticThreadPool.class, PoolStatus.class, "status");

    private static final TaskFuture.Listener<Object, Void> FAILURE_LOGGER = new TaskFuture.AbstractListener<Object, Void>() {
        public void handleFailed(final TaskFuture<? extends Object> future, final Throwable cause, final Void attachment) {
            log.errorf(cause, "Exception thrown from pool task");
        }
    };

    // =======================================================
    // Shared structures
    // =======================================================

    private final ThreadFactory threadFactory;
    private final TaskQueue queue = new TaskQueue();
    private final WorkerRegistry registry = new WorkerRegistry();

    /**
     * Serializes start and stop.
     */
    private final Lock controlLock = new ReentrantLock();
    private final Lock statusLock = new ReentrantLock();
    // signal when the status leaves PAUSE
    private final Condition statusCondition = statusLock.newCondition();

    private volatile PoolStatus status = PoolStatus.STOP;

    private final BooleanSupplier notRunning = () -> status != PoolStatus.RUNNING;
    private final BooleanSupplier stopped = () -> status == PoolStatus.STOP;

    // =======================================================
    // Configuration, read without locking
    // =======================================================

    private volatile int minThreads;
    private volatile int maxThreads;
    private volatile long maxIdleNanos;

    // =======================================================
    // Statistics
    // =======================================================

    private final LongAdder submittedTaskCounter = new LongAdder();
    private final LongAdder completedTaskCounter = new LongAdder();
    private final LongAdder abandonedTaskCounter = new LongAdder();

    private final MXBeanImpl mxBean = new MXBeanImpl();

    /**
     * Construct a new instance with the default configuration: one minimum thread, as many maximum threads as
     * there are available processors, and an idle time of 250 milliseconds.
     */
    public ElasticThreadPool() {
        this(new Builder());
    }

    /**
     * Construct a new instance.
     *
     * @param minThreads the minimum number of threads (must be greater than or equal to 0)
     * @param maxThreads the maximum number of threads (must be greater than or equal to 1)
     * @param maxIdleTime the time an idle thread waits for a task before it may retire (must be positive)
     */
    public ElasticThreadPool(final int minThreads, final int maxThreads, final Duration maxIdleTime) {
        this(new Builder().setMinThreads(minThreads).setMaxThreads(maxThreads).setMaxIdleTime(maxIdleTime));
    }

    ElasticThreadPool(final Builder builder) {
        this.threadFactory = builder.getThreadFactory();
        this.minThreads = builder.getMinThreads();
        this.maxThreads = builder.getMaxThreads();
        this.maxIdleNanos = TimeUtil.clampedPositiveNanos(builder.getMaxIdleTime());
    }

    // =======================================================
    // Builder
    // =======================================================

    /**
     * The builder class for an {@code ElasticThreadPool}.  All the fields are initialized to the defaults of the
     * no-argument constructor.
     */
    public static final class Builder {
        private ThreadFactory threadFactory;
        private int minThreads = DEFAULT_MIN_THREADS;
        private int maxThreads = ProcessorInfo.availableProcessors();
        private Duration maxIdleTime = DEFAULT_MAX_IDLE_TIME;

        /**
         * Construct a new instance.
         */
        public Builder() {}

        /**
         * Get the configured thread factory.
         *
         * @return the configured thread factory, or {@code null} to use a new {@link WorkerThreadFactory}
         */
        public ThreadFactory getThreadFactory() {
            return threadFactory != null ? threadFactory : new WorkerThreadFactory();
        }

        /**
         * Set the configured thread factory.
         *
         * @param threadFactory the configured thread factory (must not be {@code null})
         * @return this builder
         */
        public Builder setThreadFactory(final ThreadFactory threadFactory) {
            Assert.checkNotNullParam("threadFactory", threadFactory);
            this.threadFactory = threadFactory;
            return this;
        }

        /**
         * Get the minimum number of threads.
         *
         * @return the minimum number of threads
         */
        public int getMinThreads() {
            return minThreads;
        }

        /**
         * Set the minimum number of threads.  While the pool is started, idle threads only retire while there are
         * more than this many.  If it exceeds the maximum, the maximum is used as the floor.
         *
         * @param minThreads the minimum number of threads (must be greater than or equal to 0)
         * @return this builder
         */
        public Builder setMinThreads(final int minThreads) {
            Assert.checkMinimumParameter("minThreads", 0, minThreads);
            this.minThreads = minThreads;
            return this;
        }

        /**
         * Get the maximum number of threads.
         *
         * @return the maximum number of threads
         */
        public int getMaxThreads() {
            return maxThreads;
        }

        /**
         * Set the maximum number of threads.  The pool never has more live threads than this.
         *
         * @param maxThreads the maximum number of threads (must be greater than or equal to 1)
         * @return this builder
         */
        public Builder setMaxThreads(final int maxThreads) {
            Assert.checkMinimumParameter("maxThreads", 1, maxThreads);
            this.maxThreads = maxThreads;
            return this;
        }

        /**
         * Get the maximum idle time.
         *
         * @return the maximum idle time
         */
        public Duration getMaxIdleTime() {
            return maxIdleTime;
        }

        /**
         * Set the time an idle thread waits for a task before it may retire.
         *
         * @param maxIdleTime the maximum idle time (must be positive)
         * @return this builder
         */
        public Builder setMaxIdleTime(final Duration maxIdleTime) {
            Assert.checkNotNullParam("maxIdleTime", maxIdleTime);
            if (! TimeUtil.isPositive(maxIdleTime)) {
                throw Messages.msg.nonPositiveIdleTime(maxIdleTime);
            }
            this.maxIdleTime = maxIdleTime;
            return this;
        }

        /**
         * Construct the pool from this builder.  The pool is stopped until it is started or a task is submitted.
         *
         * @return the new pool
         */
        public ElasticThreadPool build() {
            return new ElasticThreadPool(this);
        }
    }

    // =======================================================
    // Submission
    // =======================================================

    /**
     * Submit a task.  The pool is started first if it is stopped, and grows by one thread if more tasks are
     * queued than threads are idle and the maximum has not been reached.  A task which races with a completing
     * {@link #stop()} is abandoned.
     *
     * @param task the task (must not be {@code null})
     * @param <R> the result type
     * @return the result handle
     */
    public <R> TaskFuture<R> submit(final Callable<R> task) {
        Assert.checkNotNullParam("task", task);
        return enqueue(new PoolTask<R>(task));
    }

    /**
     * Submit a task which produces no value.
     *
     * @param task the task (must not be {@code null})
     * @return the result handle, which completes with {@code null}
     */
    public TaskFuture<?> submit(final Runnable task) {
        return submit(task, null);
    }

    /**
     * Submit a task which produces a fixed value.
     *
     * @param task the task (must not be {@code null})
     * @param result the value to complete the handle with
     * @param <R> the result type
     * @return the result handle
     */
    public <R> TaskFuture<R> submit(final Runnable task, final R result) {
        Assert.checkNotNullParam("task", task);
        return enqueue(new PoolTask<R>(Executors.callable(task, result)));
    }

    /**
     * Submit a function with its argument, bound now.
     *
     * @param function the function (must not be {@code null})
     * @param arg the argument
     * @param <A> the argument type
     * @param <R> the result type
     * @return the result handle
     */
    public <A, R> TaskFuture<R> submit(final ExceptionFunction<? super A, ? extends R, ?> function, final A arg) {
        Assert.checkNotNullParam("function", function);
        return enqueue(new PoolTask<R>(() -> function.apply(arg)));
    }

    /**
     * Submit a function with its two arguments, bound now.
     *
     * @param function the function (must not be {@code null})
     * @param arg1 the first argument
     * @param arg2 the second argument
     * @param <A> the first argument type
     * @param <B> the second argument type
     * @param <R> the result type
     * @return the result handle
     */
    public <A, B, R> TaskFuture<R> submit(final ExceptionBiFunction<? super A, ? super B, ? extends R, ?> function, final A arg1, final B arg2) {
        Assert.checkNotNullParam("function", function);
        return enqueue(new PoolTask<R>(() -> function.apply(arg1, arg2)));
    }

    /**
     * Execute a task.  Throwables raised by the task are logged, since there is no handle to carry them.
     *
     * @param command the task (must not be {@code null})
     */
    public void execute(final Runnable command) {
        submit(command).addListener(FAILURE_LOGGER, null);
    }

    private <R> TaskFuture<R> enqueue(final PoolTask<R> task) {
        if (status == PoolStatus.STOP) {
            if (registry.isWorkerThread(Thread.currentThread())) {
                // stop() is joining the submitting thread
                task.abandon();
                abandonedTaskCounter.increment();
                return task;
            }
            start();
        }
        submittedTaskCounter.increment();
        if (! queue.offer(task, stopped)) {
            // stop() completed after the status check above
            task.abandon();
            abandonedTaskCounter.increment();
            return task;
        }
        // checked after the offer, so that a worker retiring concurrently sees the task or we see it gone
        growIfBacklogged();
        return task;
    }

    /**
     * Add a worker if more tasks are queued than there are idle workers to claim them.  Paused workers are not
     * idle, but they will drain the queue on resume, so nothing is added while the pool is paused.
     */
    private void growIfBacklogged() {
        if (status == PoolStatus.RUNNING && queue.size() > registry.getIdleThreadCount()) {
            tryGrow();
        }
    }

    private void tryGrow() {
        if (registry.getCurrentThreadCount() < maxThreads) {
            try {
                createThread();
            } catch (ThreadCreationException e) {
                Messages.msg.growthFailed(e, registry.getCurrentThreadCount());
            }
        }
    }

    // =======================================================
    // Control
    // =======================================================

    /**
     * Start the pool with the minimum number of threads.
     *
     * @return {@link ControlStatus#SUCCESS}, {@link ControlStatus#ALREADY_RUNNING} if the pool was running or
     *      paused, or {@link ControlStatus#THREAD_CREATION_FAILED} if a thread could not be created
     */
    public ControlStatus start() {
        return start(0);
    }

    /**
     * Start the pool with {@code max(startThreads, minThreads)} threads, but no more than the maximum.  The pool
     * stays started and usable even if some of the threads could not be created.
     *
     * @param startThreads the number of threads to start (must be greater than or equal to 0)
     * @return {@link ControlStatus#SUCCESS}, {@link ControlStatus#ALREADY_RUNNING} if the pool was running or
     *      paused, {@link ControlStatus#INVALID_STATE} if called from one of this pool's workers while the pool is
     *      stopping, or {@link ControlStatus#THREAD_CREATION_FAILED} if a thread could not be created
     */
    public ControlStatus start(final int startThreads) {
        Assert.checkMinimumParameter("startThreads", 0, startThreads);
        if (registry.isWorkerThread(Thread.currentThread())) {
            // a registered worker means the pool is started, or stopping and joining this thread
            return status == PoolStatus.STOP ? ControlStatus.INVALID_STATE : ControlStatus.ALREADY_RUNNING;
        }
        final Lock controlLock = this.controlLock;
        controlLock.lock();
        try {
            if (! statusUpdater.compareAndSet(this, PoolStatus.STOP, PoolStatus.RUNNING)) {
                return ControlStatus.ALREADY_RUNNING;
            }
            final int requested = Math.min(Math.max(startThreads, minThreads), maxThreads);
            for (int i = 0; i < requested; i ++) {
                try {
                    createThread();
                } catch (ThreadCreationException e) {
                    Messages.msg.startIncomplete(e, registry.getCurrentThreadCount(), requested);
                    return ControlStatus.THREAD_CREATION_FAILED;
                }
            }
            log.debugf("Started %s", this);
            return ControlStatus.SUCCESS;
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Stop the pool.  Queued tasks are abandoned; tasks already claimed by a worker run to completion, after which
     * every worker is joined and deregistered.  This method waits for the running tasks and cannot be interrupted;
     * if the calling thread is interrupted while waiting, its interrupt status is set again on return.
     *
     * @return {@link ControlStatus#SUCCESS}, or {@link ControlStatus#ALREADY_STOPPED} if the pool was stopped
     * @throws IllegalStateException if called from one of this pool's workers
     */
    public ControlStatus stop() {
        if (registry.isWorkerThread(Thread.currentThread())) {
            throw Messages.msg.cannotControlFromWorker("stop");
        }
        final Lock controlLock = this.controlLock;
        controlLock.lock();
        try {
            final PoolStatus oldStatus = statusUpdater.getAndSet(this, PoolStatus.STOP);
            if (oldStatus == PoolStatus.STOP) {
                return ControlStatus.ALREADY_STOPPED;
            }
            // wake up the whole town
            signalStatusChange();
            queue.wakeAll();
            abandon(queue.clear());
            boolean intr = false;
            try {
                for (WorkerDescriptor descriptor : registry.snapshot()) {
                    for (;;) try {
                        descriptor.getThread().join();
                        break;
                    } catch (InterruptedException e) {
                        intr = true;
                    }
                    deleteThread(descriptor);
                }
            } finally {
                if (intr) {
                    Thread.currentThread().interrupt();
                }
            }
            // submissions which raced with the status change
            abandon(queue.clear());
            log.debugf("Stopped %s", this);
            return ControlStatus.SUCCESS;
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Pause the pool.  Busy workers finish their current task and then wait; idle workers wait at once.
     * Submissions are still accepted and queued.
     *
     * @return {@link ControlStatus#SUCCESS}, or {@link ControlStatus#INVALID_STATE} if the pool was not running
     */
    public ControlStatus pause() {
        if (! statusUpdater.compareAndSet(this, PoolStatus.RUNNING, PoolStatus.PAUSE)) {
            return ControlStatus.INVALID_STATE;
        }
        queue.wakeAll();
        log.debugf("Paused %s", this);
        return ControlStatus.SUCCESS;
    }

    /**
     * Resume a paused pool.  The waiting workers go back to draining the queue.
     *
     * @return {@link ControlStatus#SUCCESS}, or {@link ControlStatus#INVALID_STATE} if the pool was not paused
     */
    public ControlStatus resume() {
        if (! statusUpdater.compareAndSet(this, PoolStatus.PAUSE, PoolStatus.RUNNING)) {
            return ControlStatus.INVALID_STATE;
        }
        signalStatusChange();
        // every worker may have retired while paused
        growIfBacklogged();
        log.debugf("Resumed %s", this);
        return ControlStatus.SUCCESS;
    }

    /**
     * Wait until the queue is empty and no worker is running a task, or until the pool is stopped.  This is a
     * best-effort barrier: other threads may submit new tasks as soon as it returns.  The pool status is not
     * changed.
     *
     * @return {@link ControlStatus#SUCCESS}
     * @throws InterruptedException if the calling thread was interrupted while waiting
     * @throws IllegalStateException if called from one of this pool's workers
     */
    public ControlStatus awaitQuiescence() throws InterruptedException {
        awaitQuiescence(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        return ControlStatus.SUCCESS;
    }

    /**
     * Wait until the queue is empty and no worker is running a task, until the pool is stopped, or until the given
     * time elapses.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit (must not be {@code null})
     * @return {@code true} if the pool became quiescent or was stopped, {@code false} if the time elapsed
     * @throws InterruptedException if the calling thread was interrupted while waiting
     * @throws IllegalStateException if called from one of this pool's workers
     */
    public boolean awaitQuiescence(final long timeout, final TimeUnit unit) throws InterruptedException {
        Assert.checkNotNullParam("unit", unit);
        if (registry.isWorkerThread(Thread.currentThread())) {
            throw Messages.msg.cannotControlFromWorker("awaitQuiescence");
        }
        return queue.awaitQuiescence(timeout, unit, stopped);
    }

    private void signalStatusChange() {
        final Lock statusLock = this.statusLock;
        statusLock.lock();
        try {
            statusCondition.signalAll();
        } finally {
            statusLock.unlock();
        }
    }

    private void abandon(final List<PoolTask<?>> tasks) {
        for (PoolTask<?> task : tasks) {
            if (task.abandon()) {
                abandonedTaskCounter.increment();
            }
        }
    }

    // =======================================================
    // Worker creation and removal
    // =======================================================

    /**
     * Add one idle worker, unless the pool is stopped or already at its maximum size.
     *
     * @return {@code true} if a worker was added
     * @throws ThreadCreationException if the thread could not be created or started
     */
    boolean createThread() throws ThreadCreationException {
        return registry.tryAdd(maxThreads, stopped, this::spawnWorker) != null;
    }

    private WorkerDescriptor spawnWorker(final long id) {
        final ThreadBody body = new ThreadBody();
        final Thread thread = threadFactory.newThread(body);
        if (thread == null) {
            throw Messages.msg.noThreadCreated();
        }
        final WorkerDescriptor descriptor = new WorkerDescriptor(id, thread);
        body.descriptor = descriptor;
        return descriptor;
    }

    /**
     * Deregister a worker, recording its stop time.
     *
     * @param descriptor the worker
     * @return {@code true} if the worker was registered
     */
    boolean deleteThread(final WorkerDescriptor descriptor) {
        return registry.remove(descriptor);
    }

    // =======================================================
    // Configuration
    // =======================================================

    /**
     * Get the configured minimum number of threads.
     *
     * @return the minimum number of threads
     */
    public int getMinThreads() {
        return minThreads;
    }

    /**
     * Set the minimum number of threads.  No thread is started or stopped by this call; the new value applies from
     * the next scaling decision.  If it exceeds the maximum, the maximum is used as the floor.
     *
     * @param minThreads the minimum number of threads (must be greater than or equal to 0)
     */
    public void setMinThreads(final int minThreads) {
        Assert.checkMinimumParameter("minThreads", 0, minThreads);
        this.minThreads = minThreads;
    }

    /**
     * Get the configured maximum number of threads.
     *
     * @return the maximum number of threads
     */
    public int getMaxThreads() {
        return maxThreads;
    }

    /**
     * Set the maximum number of threads.  Excess threads are not stopped; they retire through the idle timeout.
     *
     * @param maxThreads the maximum number of threads (must be greater than or equal to 1)
     */
    public void setMaxThreads(final int maxThreads) {
        Assert.checkMinimumParameter("maxThreads", 1, maxThreads);
        this.maxThreads = maxThreads;
    }

    /**
     * Get the maximum idle time.
     *
     * @return the maximum idle time
     */
    public Duration getMaxIdleTime() {
        return Duration.ofNanos(maxIdleNanos);
    }

    /**
     * Set the time an idle thread waits for a task before it may retire.  Threads already waiting finish their
     * current wait first.
     *
     * @param maxIdleTime the maximum idle time (must be positive)
     */
    public void setMaxIdleTime(final Duration maxIdleTime) {
        Assert.checkNotNullParam("maxIdleTime", maxIdleTime);
        if (! TimeUtil.isPositive(maxIdleTime)) {
            throw Messages.msg.nonPositiveIdleTime(maxIdleTime);
        }
        this.maxIdleNanos = TimeUtil.clampedPositiveNanos(maxIdleTime);
    }

    int getEffectiveMinThreads() {
        return Math.min(minThreads, maxThreads);
    }

    // =======================================================
    // Status and counters
    // =======================================================

    /**
     * Get the pool status.
     *
     * @return the pool status
     */
    public PoolStatus getStatus() {
        return status;
    }

    /**
     * Determine whether the pool is started, that is running or paused.
     *
     * @return {@code true} if the pool is not stopped
     */
    public boolean isStarted() {
        return status != PoolStatus.STOP;
    }

    /**
     * Determine whether the pool is stopped.
     *
     * @return {@code true} if the pool is stopped
     */
    public boolean isStopped() {
        return status == PoolStatus.STOP;
    }

    /**
     * Determine whether the pool is paused.
     *
     * @return {@code true} if the pool is paused
     */
    public boolean isPaused() {
        return status == PoolStatus.PAUSE;
    }

    /**
     * Get the current number of threads.
     *
     * @return the current number of threads
     */
    public int getCurrentThreadCount() {
        return registry.getCurrentThreadCount();
    }

    /**
     * Get the number of threads waiting for a task.  Paused threads are not idle.
     *
     * @return the number of idle threads
     */
    public int getIdleThreadCount() {
        return registry.getIdleThreadCount();
    }

    /**
     * Get the number of threads running a task.
     *
     * @return the number of busy threads
     */
    public int getActiveCount() {
        return queue.inFlight();
    }

    /**
     * Get the largest number of threads alive at once since the pool was constructed.
     *
     * @return the largest number of threads
     */
    public int getLargestThreadCount() {
        return registry.getLargestThreadCount();
    }

    /**
     * Get the number of queued tasks not yet claimed by a worker.
     *
     * @return the queue size
     */
    public int getQueueSize() {
        return queue.size();
    }

    /**
     * Get a snapshot of the registered workers.
     *
     * @return the workers, in spawn order
     */
    public List<WorkerDescriptor> getWorkers() {
        return registry.snapshot();
    }

    /**
     * Get the number of tasks accepted by this pool.
     *
     * @return the submitted task count
     */
    public long getSubmittedTaskCount() {
        return submittedTaskCounter.sum();
    }

    /**
     * Get the number of tasks which finished running.
     *
     * @return the completed task count
     */
    public long getCompletedTaskCount() {
        return completedTaskCounter.sum();
    }

    /**
     * Get the number of tasks abandoned unclaimed by {@link #stop()}.
     *
     * @return the abandoned task count
     */
    public long getAbandonedTaskCount() {
        return abandonedTaskCounter.sum();
    }

    public ElasticThreadPoolMXBean getThreadPoolMXBean() {
        return mxBean;
    }

    public String toString() {
        return String.format("%s[%s, %d/%d threads, %d idle]", super.toString(), status, Integer.valueOf(registry.getCurrentThreadCount()), Integer.valueOf(maxThreads), Integer.valueOf(registry.getIdleThreadCount()));
    }

    // =======================================================
    // Worker body
    // =======================================================

    final class ThreadBody implements Runnable {
        // set before the thread is started
        private WorkerDescriptor descriptor;

        ThreadBody() {
        }

        /**
         * Execute the body of the worker.  The worker starts out idle and registered; it deregisters itself only
         * when it retires after idling, and leaves deregistration to {@link #stop()} otherwise.
         */
        public void run() {
            final WorkerDescriptor self = descriptor;
            final TaskQueue queue = ElasticThreadPool.this.queue;
            final WorkerRegistry registry = ElasticThreadPool.this.registry;
            boolean stopping = false;
            try {
                for (;;) {
                    final PoolStatus status = ElasticThreadPool.this.status;
                    if (status == PoolStatus.STOP) {
                        stopping = true;
                        registry.transition(self, WorkerState.RETIRED);
                        return;
                    }
                    if (status == PoolStatus.PAUSE) {
                        registry.transition(self, WorkerState.PAUSED);
                        awaitStatusChange();
                        registry.transition(self, WorkerState.IDLE);
                        continue;
                    }
                    final PoolTask<?> task = queue.claim(maxIdleNanos, notRunning);
                    if (task == null) {
                        if (ElasticThreadPool.this.status == PoolStatus.RUNNING && registry.tryRetire(self, getEffectiveMinThreads())) {
                            log.tracef("Worker %s retired after idling", self);
                            // a task may have arrived while we were retiring
                            growIfBacklogged();
                            return;
                        }
                        continue;
                    }
                    registry.transition(self, WorkerState.BUSY);
                    // a burst may have queued more tasks than the remaining idle workers can take
                    growIfBacklogged();
                    try {
                        task.run();
                    } finally {
                        completedTaskCounter.increment();
                        registry.transition(self, WorkerState.IDLE);
                        queue.complete();
                        // clear interrupt status
                        Thread.interrupted();
                    }
                }
            } finally {
                if (! stopping) {
                    // no-op unless the loop ended abnormally
                    registry.remove(self);
                }
            }
        }

        private void awaitStatusChange() {
            final Lock statusLock = ElasticThreadPool.this.statusLock;
            statusLock.lock();
            try {
                while (ElasticThreadPool.this.status == PoolStatus.PAUSE) {
                    statusCondition.awaitUninterruptibly();
                }
            } finally {
                statusLock.unlock();
            }
        }
    }

    // =======================================================
    // Management
    // =======================================================

    final class MXBeanImpl implements ElasticThreadPoolMXBean {
        MXBeanImpl() {
        }

        public int getMinThreads() {
            return ElasticThreadPool.this.getMinThreads();
        }

        public void setMinThreads(final int minThreads) {
            ElasticThreadPool.this.setMinThreads(minThreads);
        }

        public int getMaxThreads() {
            return ElasticThreadPool.this.getMaxThreads();
        }

        public void setMaxThreads(final int maxThreads) {
            ElasticThreadPool.this.setMaxThreads(maxThreads);
        }

        public long getMaxIdleTimeMillis() {
            return ElasticThreadPool.this.getMaxIdleTime().toMillis();
        }

        public void setMaxIdleTimeMillis(final long millis) {
            ElasticThreadPool.this.setMaxIdleTime(Duration.ofMillis(millis));
        }

        public int getCurrentThreadCount() {
            return ElasticThreadPool.this.getCurrentThreadCount();
        }

        public int getIdleThreadCount() {
            return ElasticThreadPool.this.getIdleThreadCount();
        }

        public int getActiveCount() {
            return ElasticThreadPool.this.getActiveCount();
        }

        public int getLargestThreadCount() {
            return ElasticThreadPool.this.getLargestThreadCount();
        }

        public int getQueueSize() {
            return ElasticThreadPool.this.getQueueSize();
        }

        public String getStatus() {
            return ElasticThreadPool.this.getStatus().name();
        }

        public long getSubmittedTaskCount() {
            return ElasticThreadPool.this.getSubmittedTaskCount();
        }

        public long getCompletedTaskCount() {
            return ElasticThreadPool.this.getCompletedTaskCount();
        }

        public long getAbandonedTaskCount() {
            return ElasticThreadPool.this.getAbandonedTaskCount();
        }

        public boolean pause() {
            return ElasticThreadPool.this.pause() == ControlStatus.SUCCESS;
        }

        public boolean resume() {
            return ElasticThreadPool.this.resume() == ControlStatus.SUCCESS;
        }
    }
}
