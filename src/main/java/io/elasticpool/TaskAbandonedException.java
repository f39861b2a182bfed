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

/**
 * Thrown when retrieving the result of a task which was accepted by a pool but discarded, unclaimed, when the pool
 * was stopped.  The task body never ran.
 */
public class TaskAbandonedException extends CancellationException {

    private static final long serialVersionUID = 6093857254421749820L;

    /**
     * Constructs a {@code TaskAbandonedException} with no detail message.
     */
    public TaskAbandonedException() {
    }

    /**
     * Constructs a {@code TaskAbandonedException} with the specified detail message.
     *
     * @param msg the detail message
     */
    public TaskAbandonedException(final String msg) {
        super(msg);
    }
}
