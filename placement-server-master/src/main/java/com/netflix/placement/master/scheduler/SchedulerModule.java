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

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.placement.api.scheduler.service.EvictionRequeueDriver;
import com.netflix.placement.api.scheduler.service.ScheduleDecisionExtender;
import com.netflix.placement.master.eviction.DefaultEvictionRequeueDriver;
import com.netflix.placement.master.scheduler.toleration.TaintTolerationScheduleExtender;

/**
 * Binds the taint/toleration scheduling stage, and the eviction requeue driver. The embedding application must
 * provide {@link com.netflix.placement.common.runtime.PlacementRuntime}, {@link ConfigProxyFactory} and
 * {@link com.netflix.placement.api.scheduler.service.PlacementReevaluationHandler} bindings.
 */
public final class SchedulerModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(ScheduleDecisionExtender.class).to(TaintTolerationScheduleExtender.class);
        bind(EvictionRequeueDriver.class).to(DefaultEvictionRequeueDriver.class);
    }

    @Provides
    @Singleton
    public SchedulerConfiguration getSchedulerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(SchedulerConfiguration.class);
    }
}
