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

import java.time.Instant;

/**
 * The registry entry of one worker thread.  Descriptors are created when a worker is spawned and stay in the
 * registry for the lifetime of the backing thread; the state and stop time are only changed by the
 * {@link WorkerRegistry}, under its lock.
 */
public final class WorkerDescriptor {
    private final long id;
    private final Thread thread;
    private final Instant startTime;
    private volatile WorkerState state;
    private volatile Instant stopTime;

    WorkerDescriptor(final long id, final Thread thread) {
        this.id = id;
        this.thread = thread;
        this.startTime = Instant.now();
        this.state = WorkerState.IDLE;
    }

    /**
     * Get the identity of this worker, unique within its pool.
     *
     * @return the identity
     */
    public long getId() {
        return id;
    }

    /**
     * Get the name of the backing thread.
     *
     * @return the thread name
     */
    public String getThreadName() {
        return thread.getName();
    }

    /**
     * Get the current worker state.
     *
     * @return the state
     */
    public WorkerState getState() {
        return state;
    }

    /**
     * Get the time at which this worker was spawned.
     *
     * @return the start time
     */
    public Instant getStartTime() {
        return startTime;
    }

    /**
     * Get the time at which this worker retired.
     *
     * @return the stop time, or {@code null} if the worker has not retired
     */
    public Instant getStopTime() {
        return stopTime;
    }

    /**
     * Get the thread backing this worker.
     *
     * @return the thread
     */
    public Thread getThread() {
        return thread;
    }

    void setState(final WorkerState state) {
        this.state = state;
        if (state == WorkerState.RETIRED && stopTime == null) {
            stopTime = Instant.now();
        }
    }

    public String toString() {
        return String.format("worker %d (%s) %s", Long.valueOf(id), thread.getName(), state);
    }
}
