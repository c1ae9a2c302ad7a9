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

package com.netflix.placement.master.scheduler;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "placement.scheduler")
public interface SchedulerConfiguration {

    /**
     * If false, the taint/toleration stage admits all candidate clusters, and never requests a requeue.
     */
    @DefaultValue("true")
    boolean isTaintTolerationEnabled();

    /**
     * Upper bound for the requeue delay. Placements with long toleration periods are re-evaluated at least
     * this often. A non-positive value disables the limit.
     */
    @DefaultValue("86400000")
    long getMaxRequeueDelayMs();

    /**
     * Name of the single threaded scheduler running the eviction requeue timers.
     */
    @DefaultValue("evictionRequeueDriver")
    String getRequeueDriverSchedulerName();
}
