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
 * A thread pool which can be managed through an MXBean.
 */
public interface ManageableElasticThreadPool {

    /**
     * Create or acquire an MXBean instance for this thread pool.  Note that the thread pool itself may not
     * do anything in particular to register (or unregister) the MXBean with a JMX server; that is the
     * caller's responsibility.
     *
     * @return the MXBean instance (must not be {@code null})
     */
    ElasticThreadPoolMXBean getThreadPoolMXBean();
}
