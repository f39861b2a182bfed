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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The sequence numbers of one thread made by a {@link WorkerThreadFactory}, which its name pattern may refer to.
 */
final class ThreadNameInfo {
    private static final Pattern ESCAPE = Pattern.compile("%(.)");

    private final long globalIndex;
    private final long factoryThreadIndex;
    private final long factoryIndex;

    ThreadNameInfo(final long globalIndex, final long factoryThreadIndex, final long factoryIndex) {
        this.globalIndex = globalIndex;
        this.factoryThreadIndex = factoryThreadIndex;
        this.factoryIndex = factoryIndex;
    }

    /**
     * Expand a name pattern for the given thread.
     * <ul>
     * <li>{@code %%} - a percent sign</li>
     * <li>{@code %t} - the thread's index within its factory</li>
     * <li>{@code %g} - the thread's index among all factories</li>
     * <li>{@code %f} - the factory's index</li>
     * <li>{@code %p} - the {@code ":"}-separated path of thread group names</li>
     * <li>{@code %G} - the thread group name</li>
     * <li>{@code %i} - the thread ID</li>
     * </ul>
     * Any other escape expands to nothing.
     *
     * @param thread the thread
     * @param pattern the name pattern
     * @return the expanded name
     */
    String format(final Thread thread, final String pattern) {
        final ThreadGroup group = thread.getThreadGroup();
        final Matcher matcher = ESCAPE.matcher(pattern);
        final StringBuilder b = new StringBuilder(pattern.length() + 16);
        int last = 0;
        while (matcher.find()) {
            b.append(pattern, last, matcher.start());
            last = matcher.end();
            switch (matcher.group(1).charAt(0)) {
                case '%': b.append('%'); break;
                case 't': b.append(factoryThreadIndex); break;
                case 'g': b.append(globalIndex); break;
                case 'f': b.append(factoryIndex); break;
                case 'p': if (group != null) appendPath(group, b); break;
                case 'G': if (group != null) b.append(group.getName()); break;
                case 'i': b.append(thread.getId()); break;
                default: break;
            }
        }
        return b.append(pattern, last, pattern.length()).toString();
    }

    private static void appendPath(final ThreadGroup group, final StringBuilder b) {
        final ThreadGroup parent = group.getParent();
        if (parent != null) {
            appendPath(parent, b);
            b.append(':');
        }
        b.append(group.getName());
    }
}
