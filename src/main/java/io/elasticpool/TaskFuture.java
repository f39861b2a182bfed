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

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The one-shot result handle of a task submitted to an {@link ElasticThreadPool}.  The handle is resolved exactly
 * once: with the value the task produced, with the throwable it raised, or as abandoned if the pool was stopped
 * before any worker claimed the task.
 * <p>
 * Accepted tasks cannot be cancelled; {@link #cancel(boolean)} always returns {@code false}.  Discarding a handle
 * has no effect on the execution of its task.
 *
 * @param <T> the result type
 */
public interface TaskFuture<T> extends Future<T> {

    /**
     * Wait if necessary for this task to be resolved, returning the outcome.
     *
     * @return the final status
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    Status await() throws InterruptedException;

    /**
     * Wait if necessary for this task to be resolved, returning the outcome, for up to the given amount of time.
     *
     * @param timeout the amount of time to wait
     * @param unit the time unit
     * @return the status, which is {@link Status#WAITING} if the time elapsed first
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    Status await(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Wait uninterruptibly for this task to be resolved, returning the outcome.
     *
     * @return the final status
     */
    Status awaitUninterruptibly();

    /**
     * Wait uninterruptibly for the result of this task.
     *
     * @return the result
     * @throws TaskAbandonedException if the task was abandoned by a stopping pool
     * @throws ExecutionException if the task failed
     */
    T getUninterruptibly() throws CancellationException, ExecutionException;

    /**
     * Wait uninterruptibly for the result of this task, for up to the given amount of time.
     *
     * @param timeout the amount of time to wait
     * @param unit the time unit
     * @return the result
     * @throws TaskAbandonedException if the task was abandoned by a stopping pool
     * @throws ExecutionException if the task failed
     * @throws TimeoutException if the time elapsed before the task was resolved
     */
    T getUninterruptibly(long timeout, TimeUnit unit) throws CancellationException, ExecutionException, TimeoutException;

    /**
     * Get the current status without waiting.
     *
     * @return the current status
     */
    Status getStatus();

    /**
     * Register a listener to be called once this task is resolved.  If the task is already resolved, the listener
     * is called immediately on the calling thread; otherwise it is called on the thread which resolves the task.
     *
     * @param listener the listener (must not be {@code null})
     * @param attachment the attachment to pass to the listener
     * @param <A> the attachment type
     */
    <A> void addListener(Listener<? super T, A> listener, A attachment);

    /**
     * Tasks accepted by a pool are never cancelled on request.
     *
     * @param mayInterruptIfRunning ignored
     * @return {@code false} always
     */
    boolean cancel(boolean mayInterruptIfRunning);

    /**
     * Determine whether this task was abandoned by a stopping pool.
     *
     * @return {@code true} if the status is {@link Status#ABANDONED}
     */
    boolean isCancelled();

    /**
     * The possible statuses of a task handle.
     */
    enum Status {
        /**
         * The task has not been resolved yet.
         */
        WAITING,
        /**
         * The task returned a value.
         */
        COMPLETE,
        /**
         * The task threw an exception or error.
         */
        FAILED,
        /**
         * The task was discarded unclaimed when its pool stopped.
         */
        ABANDONED,
        ;
    }

    /**
     * A listener for task resolution.
     *
     * @param <T> the result type
     * @param <A> the attachment type
     */
    interface Listener<T, A> extends java.util.EventListener {

        /**
         * Handle a successful result.
         *
         * @param future the handle
         * @param attachment the attachment
         */
        void handleComplete(TaskFuture<? extends T> future, A attachment);

        /**
         * Handle a failure.
         *
         * @param future the handle
         * @param cause the throwable raised by the task
         * @param attachment the attachment
         */
        void handleFailed(TaskFuture<? extends T> future, Throwable cause, A attachment);

        /**
         * Handle abandonment.
         *
         * @param future the handle
         * @param attachment the attachment
         */
        void handleAbandoned(TaskFuture<? extends T> future, A attachment);
    }

    /**
     * An abstract base class for listeners which only care about some outcomes.
     *
     * @param <T> the result type
     * @param <A> the attachment type
     */
    abstract class AbstractListener<T, A> implements Listener<T, A> {

        public void handleComplete(final TaskFuture<? extends T> future, final A attachment) {
        }

        public void handleFailed(final TaskFuture<? extends T> future, final Throwable cause, final A attachment) {
        }

        public void handleAbandoned(final TaskFuture<? extends T> future, final A attachment) {
        }
    }
}
