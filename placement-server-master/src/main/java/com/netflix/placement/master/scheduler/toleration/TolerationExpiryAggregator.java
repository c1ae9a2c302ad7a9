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

package com.netflix.placement.master.scheduler.toleration;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.google.common.math.LongMath;

/**
 * Computes how long a cluster may still be selected, given its tolerated taints with a bounded toleration time.
 * The remaining time of a single taint is its toleration time minus the time elapsed since the taint was added.
 * A taint without the added time is considered due immediately.
 */
public final class TolerationExpiryAggregator {

    private TolerationExpiryAggregator() {
    }

    /**
     * Remaining toleration time at the given time (epoch milliseconds). Negative if already expired.
     * Computed in milliseconds, saturating at {@link Long#MIN_VALUE} and {@link Long#MAX_VALUE}, so the result
     * can always be converted back with {@link Duration#toMillis()}.
     */
    public static Duration remaining(ExpiringToleration expiringToleration, long now) {
        return Duration.ofMillis(remainingMs(expiringToleration, now));
    }

    private static long remainingMs(ExpiringToleration expiringToleration, long now) {
        return expiringToleration.getTaint().getTimeAdded()
                .map(timeAdded -> {
                    long tolerationMs = LongMath.saturatedMultiply(expiringToleration.getTolerationSeconds(), 1_000L);
                    long elapsedMs = LongMath.saturatedSubtract(now, timeAdded);
                    return LongMath.saturatedSubtract(tolerationMs, elapsedMs);
                })
                .orElse(0L);
    }

    /**
     * Returns the entry that expires first. For equal remaining times, the first one in the list is returned.
     */
    public static Optional<ExpiringToleration> findEarliestExpiring(List<ExpiringToleration> toleratedExpiring, long now) {
        ExpiringToleration earliest = null;
        Duration earliestRemaining = null;
        for (ExpiringToleration expiring : toleratedExpiring) {
            Duration remaining = remaining(expiring, now);
            if (earliestRemaining == null || remaining.compareTo(earliestRemaining) < 0) {
                earliest = expiring;
                earliestRemaining = remaining;
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * Minimum remaining toleration time, or {@link Optional#empty()} if the list is empty, which means that all
     * taints are tolerated forever.
     */
    public static Optional<Duration> minimumRemaining(List<ExpiringToleration> toleratedExpiring, long now) {
        return findEarliestExpiring(toleratedExpiring, now).map(expiring -> remaining(expiring, now));
    }
}
