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

package com.netflix.placement.common.runtime;

import com.netflix.placement.common.runtime.internal.DefaultPlacementRuntime;
import com.netflix.placement.common.util.time.Clocks;
import com.netflix.placement.common.util.time.TestClock;
import com.netflix.spectator.api.DefaultRegistry;

public final class PlacementRuntimes {

    private PlacementRuntimes() {
    }

    public static PlacementRuntime internal() {
        return DefaultPlacementRuntime.newBuilder().build();
    }

    public static PlacementRuntime test() {
        return test(Clocks.test());
    }

    public static PlacementRuntime test(TestClock clock) {
        return DefaultPlacementRuntime.newBuilder()
                .withClock(clock)
                .withRegistry(new DefaultRegistry())
                .build();
    }
}
