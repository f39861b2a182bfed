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

/**
 * The outcome of a pool control operation.  Redundant control calls are never errors; they report one of the
 * no-op outcomes instead.
 */
public enum ControlStatus {
    /**
     * The operation took effect.
     */
    SUCCESS,
    /**
     * {@code start()} was called on a pool which was already started (running or paused).
     */
    ALREADY_RUNNING,
    /**
     * {@code stop()} was called on a pool which was already stopped.
     */
    ALREADY_STOPPED,
    /**
     * {@code pause()} or {@code resume()} was called while the pool was not in the state it leaves.
     */
    INVALID_STATE,
    /**
     * The pool was started, but at least one of the requested worker threads could not be created.
     */
    THREAD_CREATION_FAILED,
    ;

    /**
     * Determine whether this outcome changed the pool state.
     *
     * @return {@code true} for {@link #SUCCESS} and {@link #THREAD_CREATION_FAILED}
     */
    public boolean isEffective() {
        return this == SUCCESS || this == THREAD_CREATION_FAILED;
    }
}
