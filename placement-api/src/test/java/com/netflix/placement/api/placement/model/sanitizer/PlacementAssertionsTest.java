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

package com.netflix.placement.api.placement.model.sanitizer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import com.netflix.placement.api.placement.model.Placement;
import com.netflix.placement.api.placement.model.Toleration;
import com.netflix.placement.api.placement.model.TolerationOperator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

public class PlacementAssertionsTest {

    private final PlacementAssertions assertions = new PlacementAssertions();

    @Test
    public void testValidTolerations() {
        Placement placement = newPlacement(
                Toleration.newBuilder().withKey("gpu").withValue("true").build(),
                Toleration.newBuilder().withKey("unreachable").withOperator(TolerationOperator.Exists).withTolerationSeconds(300).build(),
                Toleration.newBuilder().withOperator(TolerationOperator.Exists).build()
        );
        assertThat(assertions.validateTolerations(placement)).isEmpty();
    }

    @Test
    public void testPlacementWithoutTolerationsIsValid() {
        assertThat(assertions.validateTolerations(newPlacement())).isEmpty();
    }

    @Test
    public void testEmptyKeyWithEqualOperator() {
        Placement placement = newPlacement(
                Toleration.newBuilder().withKey("gpu").build(),
                Toleration.newBuilder().withValue("true").build()
        );

        Map<String, String> violations = assertions.validateTolerations(placement);
        assertThat(violations).containsOnlyKeys("tolerations[1].operator");
        assertThat(violations.get("tolerations[1].operator")).isEqualTo(PlacementAssertions.EMPTY_KEY_REQUIRES_EXISTS);
    }

    @Test
    public void testMissingOperatorAndNullToleration() {
        Placement placement = newPlacement(
                new Toleration("gpu", null, "true", Optional.empty(), Optional.empty()),
                null,
                Toleration.newBuilder().withKey("").withOperator(TolerationOperator.Equal).build()
        );

        Map<String, String> violations = assertions.validateTolerations(placement);
        assertThat(violations).containsExactly(
                entry("tolerations[0].operator", PlacementAssertions.OPERATOR_NOT_SET),
                entry("tolerations[1]", "toleration must not be null"),
                entry("tolerations[2].operator", PlacementAssertions.EMPTY_KEY_REQUIRES_EXISTS)
        );
    }

    private static Placement newPlacement(Toleration... tolerations) {
        return Placement.newBuilder()
                .withNamespace("default")
                .withName("placement1")
                .withTolerations(Arrays.asList(tolerations))
                .build();
    }
}
