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

package com.netflix.placement.common.runtime.internal;

import com.netflix.placement.common.runtime.PlacementRuntime;
import com.netflix.placement.common.util.time.Clock;
import com.netflix.placement.common.util.time.Clocks;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;

public class DefaultPlacementRuntime implements PlacementRuntime {

    private final Registry registry;
    private final Clock clock;

    public DefaultPlacementRuntime(Registry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private Registry registry;
        private Clock clock;

        private Builder() {
        }

        public Builder withRegistry(Registry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultPlacementRuntime build() {
            if (registry == null) {
                registry = new DefaultRegistry();
            }
            if (clock == null) {
                clock = Clocks.system();
            }
            return new DefaultPlacementRuntime(registry, clock);
        }
    }
}
