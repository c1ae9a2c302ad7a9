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

package com.netflix.placement.common.util.time;

/**
 * Time source used by all placement components. Production code uses {@link Clocks#system()}, tests inject
 * a {@link TestClock} so that time dependent decisions are fully deterministic.
 */
public interface Clock {
    /**
     * Time elapsed in nanoseconds.
     */
    long nanoTime();

    /**
     * Current time in milliseconds, equivalent to {@link System#currentTimeMillis()}.
     */
    long wallTime();
}
