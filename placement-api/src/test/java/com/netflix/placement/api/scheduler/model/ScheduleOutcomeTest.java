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

package com.netflix.placement.api.scheduler.model;

import java.time.Duration;
import java.util.Collections;

import com.netflix.placement.api.scheduler.model.ClusterRejection.Reason;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScheduleOutcomeTest {

    private static final String PLACEMENT_ID = "default/placement1";

    @Test
    public void testOutcomeWithoutRequeue() {
        ScheduleOutcome outcome = ScheduleOutcome.newBuilder()
                .withPlacementId(PLACEMENT_ID)
                .withAdmittedCluster("cluster1")
                .withRejection(new ClusterRejection("cluster2", Reason.UntoleratedTaint, "not tolerated"))
                .build();

        assertThat(outcome.getAdmittedClusters()).containsExactly("cluster1");
        assertThat(outcome.getRejectedClusters()).containsExactly("cluster2");
        assertThat(outcome.findRejection("cluster2").map(ClusterRejection::getReason)).contains(Reason.UntoleratedTaint);
        assertThat(outcome.findRejection("cluster1")).isEmpty();
        assertThat(outcome.isRequeue()).isFalse();
        assertThat(outcome.getRequeueAfter()).isEqualTo(Duration.ZERO);
        assertThat(outcome.isValid()).isTrue();
    }

    @Test
    public void testOutcomeWithRequeue() {
        ScheduleOutcome outcome = ScheduleOutcome.newBuilder()
                .withPlacementId(PLACEMENT_ID)
                .withAdmittedCluster("cluster1")
                .withRequeueAfter(Duration.ofSeconds(30))
                .build();

        assertThat(outcome.isRequeue()).isTrue();
        assertThat(outcome.getRequeueAfter()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    public void testNullRequeueDelayClearsRequest() {
        ScheduleOutcome outcome = ScheduleOutcome.newBuilder()
                .withPlacementId(PLACEMENT_ID)
                .withRequeueAfter(Duration.ofSeconds(30))
                .withRequeueAfter(null)
                .build();
        assertThat(outcome.isRequeue()).isFalse();
    }

    @Test
    public void testNonPositiveRequeueDelayIsRejected() {
        assertThatThrownBy(() -> ScheduleOutcome.newBuilder().withPlacementId(PLACEMENT_ID).withRequeueAfter(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScheduleOutcome.newBuilder().withPlacementId(PLACEMENT_ID).withRequeueAfter(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testClusterCannotBeAdmittedAndRejected() {
        assertThatThrownBy(() -> ScheduleOutcome.newBuilder()
                .withPlacementId(PLACEMENT_ID)
                .withAdmittedCluster("cluster1")
                .withRejection(new ClusterRejection("cluster1", Reason.TolerationExpired, "expired"))
                .build()
        ).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPlacementIdIsRequired() {
        assertThatThrownBy(() -> ScheduleOutcome.newBuilder().build()).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void testValidationErrors() {
        ScheduleOutcome outcome = ScheduleOutcome.newBuilder()
                .withPlacementId(PLACEMENT_ID)
                .withRejection(new ClusterRejection("cluster1", Reason.InvalidPlacement, "invalid"))
                .withValidationErrors(Collections.singletonMap("tolerations[0].operator", "bad operator"))
                .build();
        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getValidationErrors()).containsEntry("tolerations[0].operator", "bad operator");
    }
}
