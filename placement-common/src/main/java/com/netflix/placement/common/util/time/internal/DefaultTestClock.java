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

package com.netflix.placement.common.util.time.internal;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.netflix.placement.common.util.time.TestClock;

public class DefaultTestClock implements TestClock {

    private final AtomicLong currentTimeMs;

    public DefaultTestClock(long startTimeMs) {
        this.currentTimeMs = new AtomicLong(startTimeMs);
    }

    @Override
    public long advanceTime(long interval, TimeUnit timeUnit) {
        Preconditions.checkArgument(interval >= 0, "Time cannot be moved backwards: %s", interval);
        return currentTimeMs.addAndGet(timeUnit.toMillis(interval));
    }

    @Override
    public long nanoTime() {
        return TimeUnit.MILLISECONDS.toNanos(currentTimeMs.get());
    }

    @Override
    public long wallTime() {
        return currentTimeMs.get();
    }
}
