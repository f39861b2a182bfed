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


package io.elasticpool.management;

/**
 * An MXBean which exposes the configuration, counters and control operations of an elastic thread pool.
 */
public interface ElasticThreadPoolMXBean {
    /**
     * Get the minimum number of worker threads kept while the pool is started.
     *
     * @return the minimum thread count
     */
    int getMinThreads();

    /**
     * Set the minimum number of worker threads.  Takes effect on the next scaling decision.
     *
     * @param minThreads the minimum thread count (must be greater than or equal to 0)
     */
    void setMinThreads(int minThreads);

    /**
     * Get the maximum number of worker threads.
     *
     * @return the maximum thread count
     */
    int getMaxThreads();

    /**
     * Set the maximum number of worker threads.  Lowering it never stops busy workers; excess workers leave
     * through the idle timeout.
     *
     * @param maxThreads the maximum thread count (must be greater than or equal to 1)
     */
    void setMaxThreads(int maxThreads);

    /**
     * Get the time an idle worker waits for a task before it may retire, in milliseconds.
     *
     * @return the maximum idle time in milliseconds
     */
    long getMaxIdleTimeMillis();

    /**
     * Set the time an idle worker waits for a task before it may retire, in milliseconds.
     *
     * @param millis the maximum idle time (must be greater than 0)
     */
    void setMaxIdleTimeMillis(long millis);

    /**
     * Get the current number of worker threads.
     *
     * @return the current thread count
     */
    int getCurrentThreadCount();

    /**
     * Get the number of worker threads waiting for a task.
     *
     * @return the idle thread count
     */
    int getIdleThreadCount();

    /**
     * Get the number of worker threads executing a task.
     *
     * @return the active thread count
     */
    int getActiveCount();

    /**
     * Get the largest number of worker threads ever alive at once.
     *
     * @return the largest thread count
     */
    int getLargestThreadCount();

    /**
     * Get the number of queued, unclaimed tasks.
     *
     * @return the queue size
     */
    int getQueueSize();

    /**
     * Get the pool status name: {@code STOP}, {@code RUNNING} or {@code PAUSE}.
     *
     * @return the status name
     */
    String getStatus();

    /**
     * Get the number of tasks accepted by the pool.
     *
     * @return the submitted task count
     */
    long getSubmittedTaskCount();

    /**
     * Get the number of tasks which finished running, successfully or not.
     *
     * @return the completed task count
     */
    long getCompletedTaskCount();

    /**
     * Get the number of tasks discarded unclaimed by {@code stop()}.
     *
     * @return the abandoned task count
     */
    long getAbandonedTaskCount();

    /**
     * Pause the pool.
     *
     * @return {@code true} if the pool was running and is now paused
     */
    boolean pause();

    /**
     * Resume the pool.
     *
     * @return {@code true} if the pool was paused and is now running
     */
    boolean resume();
}
