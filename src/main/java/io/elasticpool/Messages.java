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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

/**
 * Log messages and exceptions of the elastic pool.
 */
@MessageLogger(projectCode = "EPOOL", length = 5)
interface Messages extends BasicLogger {
    Messages msg = Logger.getMessageLogger(Messages.class, "io.elasticpool");

    // version
    @Message(value = "Elastic Pool version %s")
    @LogMessage(level = Logger.Level.INFO)
    void version(String version);

    // thread creation

    @Message(id = 1, value = "Thread factory did not produce a thread")
    ThreadCreationException noThreadCreated();

    @Message(id = 2, value = "Unable to create a worker thread")
    ThreadCreationException threadCreationFailed(@Cause Throwable cause);

    @Message(id = 3, value = "Pool started with %d of %d requested worker threads")
    @LogMessage(level = Logger.Level.WARN)
    void startIncomplete(@Cause Throwable cause, int started, int requested);

    @Message(id = 4, value = "Unable to add a worker thread to a pool of %d threads")
    @LogMessage(level = Logger.Level.DEBUG)
    void growthFailed(@Cause Throwable cause, int current);

    // task results

    @Message(id = 10, value = "Task was abandoned because its pool was stopped")
    TaskAbandonedException taskAbandoned();

    @Message(id = 11, value = "Task failed")
    ExecutionException taskFailed(@Cause Throwable cause);

    @Message(id = 12, value = "Operation timed out")
    TimeoutException operationTimedOut();

    @Message(id = 13, value = "Completion listener %s threw an exception")
    @LogMessage(level = Logger.Level.ERROR)
    void listenerFailed(@Cause Throwable cause, Object listener);

    // control

    @Message(id = 20, value = "Cannot call %s() on a thread pool from one of its own threads")
    IllegalStateException cannotControlFromWorker(String methodName);

    // validation

    @Message(id = 100, value = "Maximum idle time must be positive but was %s")
    IllegalArgumentException nonPositiveIdleTime(Duration actual);
}
