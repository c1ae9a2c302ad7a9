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
import java.util.concurrent.TimeUnit;

import com.netflix.placement.api.scheduler.model.ClusterRejection;
import com.netflix.placement.common.runtime.PlacementRuntime;
import com.netflix.placement.master.MetricConstants;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;

final class TaintTolerationMetrics {

    private static final String ROOT = MetricConstants.METRIC_SCHEDULER + "taintToleration.";

    private final Registry registry;

    private final Id clustersId;
    private final Id validationFailuresId;
    private final Id evaluationFailuresId;
    private final Id requeueDelayId;

    TaintTolerationMetrics(PlacementRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.clustersId = registry.createId(ROOT + "clusters");
        this.validationFailuresId = registry.createId(ROOT + "validationFailures");
        this.evaluationFailuresId = registry.createId(ROOT + "evaluationFailures");
        this.requeueDelayId = registry.createId(ROOT + "requeueDelay");
    }

    void admitted() {
        registry.counter(clustersId.withTag("decision", "admitted").withTag("reason", "tolerated")).increment();
    }

    void rejected(ClusterRejection.Reason reason) {
        registry.counter(clustersId.withTag("decision", "rejected").withTag("reason", reason.name())).increment();
    }

    void validationFailure() {
        registry.counter(validationFailuresId).increment();
    }

    void evaluationFailure() {
        registry.counter(evaluationFailuresId).increment();
    }

    void requeue(Duration delay) {
        registry.timer(requeueDelayId).record(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
