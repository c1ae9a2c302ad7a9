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

import java.util.Arrays;
import java.util.Collections;

import com.netflix.placement.api.cluster.model.Taint;
import com.netflix.placement.api.cluster.model.TaintEffect;
import com.netflix.placement.api.placement.model.Toleration;
import com.netflix.placement.api.placement.model.TolerationOperator;
import org.junit.Test;

import static com.netflix.placement.master.scheduler.SchedulerTestUtils.equalToleration;
import static com.netflix.placement.master.scheduler.SchedulerTestUtils.existsToleration;
import static com.netflix.placement.master.scheduler.SchedulerTestUtils.taint;
import static com.netflix.placement.master.scheduler.toleration.TaintTolerationMatcher.matches;
import static com.netflix.placement.master.scheduler.toleration.TaintTolerationMatcher.tolerated;
import static org.assertj.core.api.Assertions.assertThat;

public class TaintTolerationMatcherTest {

    private static final Taint GPU_TAINT = taint("gpu", "true");

    @Test
    public void testWildcardExistsMatchesAnyTaint() {
        Toleration wildcard = existsToleration("");
        assertThat(matches(GPU_TAINT, wildcard)).isTrue();
        assertThat(matches(taint("unreachable", ""), wildcard)).isTrue();
        assertThat(matches(taint("zone", "us-east-1a", TaintEffect.NoSelectIfNew), wildcard)).isTrue();
    }

    @Test
    public void testEqualRequiresKeyAndValue() {
        assertThat(matches(GPU_TAINT, equalToleration("gpu", "true"))).isTrue();
        assertThat(matches(GPU_TAINT, equalToleration("gpu", "false"))).isFalse();
        assertThat(matches(GPU_TAINT, equalToleration("gpu", ""))).isFalse();
        assertThat(matches(GPU_TAINT, equalToleration("fpga", "true"))).isFalse();
    }

    @Test
    public void testEqualIsDefaultOperator() {
        Toleration toleration = Toleration.newBuilder().withKey("gpu").withValue("true").build();
        assertThat(toleration.getOperator()).isEqualTo(TolerationOperator.Equal);
        assertThat(matches(GPU_TAINT, toleration)).isTrue();
        assertThat(matches(taint("gpu", "false"), toleration)).isFalse();
    }

    @Test
    public void testEqualWithEmptyValuesMatches() {
        assertThat(matches(taint("unhealthy", ""), equalToleration("unhealthy", null))).isTrue();
    }

    @Test
    public void testExistsIgnoresValues() {
        Toleration toleration = Toleration.newBuilder().withKey("gpu").withOperator(TolerationOperator.Exists).withValue("other").build();
        assertThat(matches(GPU_TAINT, toleration)).isTrue();
        assertThat(matches(taint("fpga", "true"), toleration)).isFalse();
    }

    @Test
    public void testEffectMustMatchIfSet() {
        Toleration noSelectOnly = existsToleration("gpu").toBuilder().withEffect(TaintEffect.NoSelect).build();
        assertThat(matches(GPU_TAINT, noSelectOnly)).isTrue();
        assertThat(matches(taint("gpu", "true", TaintEffect.NoSelectIfNew), noSelectOnly)).isFalse();
    }

    @Test
    public void testClusterWithoutTaintsIsAdmitted() {
        TolerationResult result = tolerated(Collections.emptyList(), Collections.emptyList());
        assertThat(result.isAdmitted()).isTrue();
        assertThat(result.getToleratedExpiring()).isEmpty();
    }

    @Test
    public void testAllTaintsMustBeTolerated() {
        Taint unreachable = taint("unreachable", "");
        TolerationResult result = tolerated(Arrays.asList(GPU_TAINT, unreachable), Collections.singletonList(equalToleration("gpu", "true")));
        assertThat(result.isAdmitted()).isFalse();
        assertThat(result.getUntoleratedTaint()).contains(unreachable);
        assertThat(result.getToleratedExpiring()).isEmpty();
    }

    @Test
    public void testEachTaintNeedsOnlyOneMatchingToleration() {
        TolerationResult result = tolerated(
                Arrays.asList(GPU_TAINT, taint("unreachable", "")),
                Arrays.asList(equalToleration("gpu", "true"), existsToleration("unreachable"), existsToleration("unused"))
        );
        assertThat(result.isAdmitted()).isTrue();
        assertThat(result.getToleratedExpiring()).isEmpty();
    }

    @Test
    public void testExpiringTolerationsAreRecordedInTaintOrder() {
        Taint unreachable = taint("unreachable", "");
        Taint unhealthy = taint("unhealthy", "");
        Toleration unhealthyToleration = existsToleration("unhealthy", 30);
        Toleration unreachableToleration = existsToleration("unreachable", 90);

        TolerationResult result = tolerated(
                Arrays.asList(unreachable, GPU_TAINT, unhealthy),
                Arrays.asList(unhealthyToleration, equalToleration("gpu", "true"), unreachableToleration)
        );
        assertThat(result.isAdmitted()).isTrue();
        assertThat(result.getToleratedExpiring()).containsExactly(
                new ExpiringToleration(unreachable, unreachableToleration, 2),
                new ExpiringToleration(unhealthy, unhealthyToleration, 0)
        );
    }

    @Test
    public void testFirstMatchingTolerationWins() {
        Taint unreachable = taint("unreachable", "");
        Toleration first = existsToleration("unreachable", 300);
        Toleration second = existsToleration("unreachable", 10);

        TolerationResult result = tolerated(Collections.singletonList(unreachable), Arrays.asList(first, second));
        assertThat(result.getToleratedExpiring()).containsExactly(new ExpiringToleration(unreachable, first, 0));

        // A forever toleration declared first shadows a later bounded one.
        TolerationResult foreverFirst = tolerated(Collections.singletonList(unreachable), Arrays.asList(existsToleration(""), second));
        assertThat(foreverFirst.isAdmitted()).isTrue();
        assertThat(foreverFirst.getToleratedExpiring()).isEmpty();
    }

    @Test
    public void testPreferNoSelectTaintsNeverReject() {
        TolerationResult result = tolerated(Collections.singletonList(taint("maintenance", "", TaintEffect.PreferNoSelect)), Collections.emptyList());
        assertThat(result.isAdmitted()).isTrue();
    }

    @Test
    public void testNoSelectIfNewTaintsOnlyRejectNewClusters() {
        Taint taint = taint("draining", "", TaintEffect.NoSelectIfNew);
        assertThat(tolerated(Collections.singletonList(taint), Collections.emptyList(), false).isAdmitted()).isFalse();
        assertThat(tolerated(Collections.singletonList(taint), Collections.emptyList(), true).isAdmitted()).isTrue();
    }
}
