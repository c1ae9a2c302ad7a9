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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.netflix.placement.api.cluster.model.ManagedCluster;
import com.netflix.placement.api.placement.model.Placement;
import com.netflix.placement.api.scheduler.model.ScheduleOutcome;

/**
 * Scheduling stage that filters candidate clusters by their taints and the placement tolerations, and computes
 * when the placement must be evaluated again because a tolerated taint is about to expire.
 * <p>
 * Implementations are pure functions of their arguments. The evaluation time is always provided by the caller,
 * so evaluating the same input twice with the same time yields the same outcome.
 */
public interface ScheduleDecisionExtender {

    /**
     * Validates placement tolerations. Returns field path to message map, which is empty for a valid placement.
     */
    Map<String, String> validate(Placement placement);

    /**
     * Evaluates a placement against candidate clusters, which passed the previous filter stages. Invalid
     * placements do not cause an exception. Instead, all candidates are rejected, and the validation errors
     * are returned in the outcome.
     *
     * @param existingDecision clusters already selected by the placement
     * @param now              evaluation time in epoch milliseconds
     */
    ScheduleOutcome schedule(Placement placement, List<ManagedCluster> candidates, Set<String> existingDecision, long now);

    default ScheduleOutcome schedule(Placement placement, List<ManagedCluster> candidates, long now) {
        return schedule(placement, candidates, Collections.emptySet(), now);
    }

    /**
     * Evaluates many placements against the same candidate set. A failure while evaluating one placement
     * affects only that placement outcome. The result map is keyed by placement id, in the input order.
     */
    Map<String, ScheduleOutcome> scheduleAll(List<Placement> placements, List<ManagedCluster> candidates, long now);
}
