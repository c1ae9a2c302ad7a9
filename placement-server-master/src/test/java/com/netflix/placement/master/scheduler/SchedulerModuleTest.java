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

import java.util.Collections;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.config.MapConfig;
import com.netflix.placement.api.scheduler.service.EvictionRequeueDriver;
import com.netflix.placement.api.scheduler.service.PlacementReevaluationHandler;
import com.netflix.placement.api.scheduler.service.ScheduleDecisionExtender;
import com.netflix.placement.common.runtime.PlacementRuntime;
import com.netflix.placement.common.runtime.PlacementRuntimes;
import com.netflix.placement.common.util.archaius2.Archaius2Ext;
import com.netflix.placement.master.eviction.DefaultEvictionRequeueDriver;
import com.netflix.placement.master.scheduler.toleration.TaintTolerationScheduleExtender;
import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

public class SchedulerModuleTest {

    private Injector injector;

    @After
    public void tearDown() {
        if (injector != null) {
            ((DefaultEvictionRequeueDriver) injector.getInstance(EvictionRequeueDriver.class)).shutdown();
        }
    }

    @Test
    public void testBindings() {
        injector = Guice.createInjector(new SchedulerModule(), new AbstractModule() {
            @Override
            protected void configure() {
                bind(PlacementRuntime.class).toInstance(PlacementRuntimes.internal());
                bind(ConfigProxyFactory.class).toInstance(Archaius2Ext.newConfigProxyFactory(new MapConfig(
                        Collections.singletonMap("placement.scheduler.maxRequeueDelayMs", "60000")
                )));
                bind(PlacementReevaluationHandler.class).toInstance(mock(PlacementReevaluationHandler.class));
            }
        });

        assertThat(injector.getInstance(ScheduleDecisionExtender.class)).isInstanceOf(TaintTolerationScheduleExtender.class);
        assertThat(injector.getInstance(ScheduleDecisionExtender.class)).isSameAs(injector.getInstance(ScheduleDecisionExtender.class));
        assertThat(injector.getInstance(EvictionRequeueDriver.class)).isInstanceOf(DefaultEvictionRequeueDriver.class);

        SchedulerConfiguration configuration = injector.getInstance(SchedulerConfiguration.class);
        assertThat(configuration.isTaintTolerationEnabled()).isTrue();
        assertThat(configuration.getMaxRequeueDelayMs()).isEqualTo(60_000);
        assertThat(configuration.getRequeueDriverSchedulerName()).isEqualTo("evictionRequeueDriver");
    }
}
