/*
 * Copyright 2021 Netflix, Inc.
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

package com.netflix.placement.common.util;

import java.time.Duration;

/**
 * Data and time supplementary functions.
 */
public final class DateTimeExt {

    private DateTimeExt() {
    }

    public static String toTimeUnitString(Duration duration) {
        return toTimeUnitString(duration.toMillis());
    }

    /**
     * Given a duration in milliseconds, format it using time units. For example 3600,000 is formatted as 1h.
     * Negative values are formatted with a leading minus sign.
     */
    public static String toTimeUnitString(long timeMs) {
        // Units are taken from the magnitude of each part, as -Long.MIN_VALUE does not fit in a long.
        long ms = Math.abs(timeMs % 1000);
        long sec = Math.abs(timeMs / 1000);
        long min = sec / 60;
        long hour = min / 60;
        long day = hour / 24;

        StringBuilder sb = new StringBuilder();

        if (day > 0) {
            sb.append(' ').append(day).append("d");
        }
        if (hour % 24 > 0) {
            sb.append(' ').append(hour % 24).append("h");
        }
        if (min % 60 > 0) {
            sb.append(' ').append(min % 60).append("min");
        }
        if (sec % 60 > 0) {
            sb.append(' ').append(sec % 60).append("s");
        }
        if (ms > 0) {
            sb.append(' ').append(ms).append("ms");
        }
        if (sb.length() == 0) {
            return "0ms";
        }
        return timeMs < 0 ? "-" + sb.substring(1) : sb.substring(1);
    }
}
