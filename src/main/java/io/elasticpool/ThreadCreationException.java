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

import java.util.concurrent.RejectedExecutionException;

/**
 * Thrown when a worker thread could not be created for a pool, either because the thread factory refused to
 * produce one or because the thread could not be started.  Growth is best-effort, so this exception is normally
 * logged and absorbed by the pool; {@link ElasticThreadPool#start(int)} reports it as
 * {@link ControlStatus#THREAD_CREATION_FAILED}.
 */
public final class ThreadCreationException extends RejectedExecutionException {

    private static final long serialVersionUID = -2712458034917530981L;

    /**
     * Constructs a {@code ThreadCreationException} with no detail message.
     */
    public ThreadCreationException() {
    }

    /**
     * Constructs a {@code ThreadCreationException} with the specified detail message.
     *
     * @param msg the detail message
     */
    public ThreadCreationException(final String msg) {
        super(msg);
    }

    /**
     * Constructs a {@code ThreadCreationException} with the specified detail message and cause.
     *
     * @param msg the detail message
     * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method)
     */
    public ThreadCreationException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
