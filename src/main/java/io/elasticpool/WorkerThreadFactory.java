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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import org.jboss.logging.Logger;

/**
 * The default factory for pool worker threads.  Threads are named from a pattern (see {@link ThreadNameInfo} for
 * the escapes), are daemon threads unless configured otherwise, and report uncaught throwables to the
 * {@code io.elasticpool.worker} log category.
 */
public final class WorkerThreadFactory implements ThreadFactory {
    /**
     * The default name pattern.
     */
    public static final String DEFAULT_NAME_PATTERN = "elastic-pool-%f-worker-%t";

    private final ThreadGroup threadGroup;
    private final Boolean daemon;
    private final Integer initialPriority;
    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;
    private final String namePattern;

    private final AtomicLong factoryThreadIndexSequence = new AtomicLong(1L);

    private final long factoryIndex;

    private static final AtomicLong globalThreadIndexSequence = new AtomicLong(1L);
    private static final AtomicLong factoryIndexSequence = new AtomicLong(1L);

    /**
     * Construct a new instance.
     *
     * @param threadGroup the thread group to assign threads to (may be {@code null} for the creating thread's group)
     * @param daemon whether the created threads should be daemon threads, or {@code null} to inherit the setting
     *      of the creating thread
     * @param initialPriority the initial thread priority, or {@code null} to use the thread group's setting
     * @param namePattern the name pattern string, or {@code null} for {@link #DEFAULT_NAME_PATTERN}
     * @param uncaughtExceptionHandler the uncaught exception handler, or {@code null} to log uncaught throwables
     */
    public WorkerThreadFactory(ThreadGroup threadGroup, final Boolean daemon, final Integer initialPriority, String namePattern, final Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        if (threadGroup == null) {
            threadGroup = Thread.currentThread().getThreadGroup();
        }
        this.threadGroup = threadGroup;
        this.daemon = daemon;
        this.initialPriority = initialPriority;
        this.uncaughtExceptionHandler = uncaughtExceptionHandler != null ? uncaughtExceptionHandler : new LoggingUncaughtExceptionHandler(Logger.getLogger("io.elasticpool.worker"));
        factoryIndex = factoryIndexSequence.getAndIncrement();
        if (namePattern == null) {
            namePattern = DEFAULT_NAME_PATTERN;
        }
        this.namePattern = namePattern;
    }

    /**
     * Construct a new instance which creates daemon threads with the default name pattern.
     */
    public WorkerThreadFactory() {
        this(null, Boolean.TRUE, null, null, null);
    }

    public Thread newThread(final Runnable target) {
        final ThreadNameInfo nameInfo = new ThreadNameInfo(globalThreadIndexSequence.getAndIncrement(), factoryThreadIndexSequence.getAndIncrement(), factoryIndex);
        final Thread thread = new Thread(threadGroup, target);
        thread.setName(nameInfo.format(thread, namePattern));
        if (initialPriority != null) thread.setPriority(initialPriority.intValue());
        if (daemon != null) thread.setDaemon(daemon.booleanValue());
        thread.setUncaughtExceptionHandler(uncaughtExceptionHandler);
        return thread;
    }

    public String toString() {
        return String.format("%s[\"%s\"]", super.toString(), namePattern);
    }
}
