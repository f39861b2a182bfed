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

import static java.lang.Math.max;

import java.time.Duration;

/**
 */
final class TimeUtil {
    private TimeUtil() {}

    private static final long LARGEST_SECONDS = 9_223_372_035L; // Long.MAX_VALUE / 1_000_000_000L - 1

    /**
     * Convert a duration to a positive nanosecond count, saturating at {@code Long.MAX_VALUE}.
     *
     * @param duration the duration
     * @return the nanoseconds, at least 1
     */
    static long clampedPositiveNanos(Duration duration) {
        final long seconds = max(0L, duration.getSeconds());
        return seconds > LARGEST_SECONDS ? Long.MAX_VALUE : max(1, seconds * 1_000_000_000L + duration.getNano());
    }

    static boolean isPositive(Duration duration) {
        return ! (duration.isNegative() || duration.isZero());
    }
}
