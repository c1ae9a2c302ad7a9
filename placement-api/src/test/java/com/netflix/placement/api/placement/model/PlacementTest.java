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

package com.netflix.placement.api.placement.model;

import com.netflix.placement.api.cluster.model.TaintEffect;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PlacementTest {

    @Test
    public void testTolerationDefaults() {
        Toleration toleration = Toleration.newBuilder().build();
        assertThat(toleration.getKey()).isEmpty();
        assertThat(toleration.getOperator()).isEqualTo(TolerationOperator.Equal);
        assertThat(toleration.getValue()).isEmpty();
        assertThat(toleration.getEffect()).isEmpty();
        assertThat(toleration.getTolerationSeconds()).isEmpty();
    }

    @Test
    public void testTolerationBuilderCopies() {
        Toleration.Builder builder = Toleration.newBuilder()
                .withKey("unreachable")
                .withOperator(TolerationOperator.Exists)
                .withEffect(TaintEffect.NoSelect)
                .withTolerationSeconds(300);
        Toleration original = builder.build();

        assertThat(builder.but().build()).isEqualTo(original);
        assertThat(original.toBuilder().build()).isEqualTo(original);
        assertThat(builder.but().withTolerationSeconds(10).build()).isNotEqualTo(original);
    }

    @Test
    public void testPlacementId() {
        Placement placement = Placement.newBuilder()
                .withNamespace("default")
                .withName("placement1")
                .withToleration(Toleration.newBuilder().withKey("gpu").build())
                .build();

        assertThat(placement.getId()).isEqualTo("default/placement1");
        assertThat(placement.getTolerations()).hasSize(1);
        assertThat(placement.toBuilder().build()).isEqualTo(placement);
    }

    @Test
    public void testPlacementRequiresNamespaceAndName() {
        assertThatThrownBy(() -> Placement.newBuilder().withName("placement1").build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Placement.newBuilder().withNamespace("default").build()).isInstanceOf(IllegalArgumentException.class);
    }
}
