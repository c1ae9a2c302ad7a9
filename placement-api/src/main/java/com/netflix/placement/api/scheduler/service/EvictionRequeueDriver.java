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

package com.netflix.placement.api.scheduler.service;

import java.time.Duration;
import java.util.Map;

import com.netflix.placement.api.scheduler.model.ScheduleOutcome;

/**
 * Triggers re-evaluation of placements when their tolerated taints expire, so clusters can be evicted from
 * placement decisions without polling.
 */
public interface EvictionRequeueDriver {

    /**
     * Requests the placement to be evaluated again no later than the given delay. If a request for the same
     * placement is already pending, the earlier of the two is kept.
     */
    void requeue(String placementId, Duration delay);

    /**
     * Forwards {@link ScheduleOutcome#getRequeueAfter()} to {@link #requeue(String, Duration)} if the outcome
     * requests it. Does nothing otherwise.
     */
    default void onScheduleOutcome(ScheduleOutcome outcome) {
        if (outcome.isRequeue()) {
            requeue(outcome.getPlacementId(), outcome.getRequeueAfter());
        }
    }

    /**
     * Drops the pending request for a placement, if there is one.
     */
    boolean cancel(String placementId);

    /**
     * Returns placement ids with the time (epoch milliseconds) at which their re-evaluation is due.
     */
    Map<String, Long> getPendingRequeues();
}
