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

import java.util.ArrayList;
import java.util.List;

import com.netflix.placement.api.cluster.model.Taint;
import com.netflix.placement.api.cluster.model.TaintEffect;
import com.netflix.placement.api.placement.model.Toleration;
import com.netflix.placement.api.placement.model.TolerationOperator;
import com.netflix.placement.common.util.StringExt;

/**
 * Matches cluster taints against placement tolerations.
 * <p>
 * A cluster is admitted only if each of its taints is matched by at least one toleration. When more than one
 * toleration matches a taint, the first one in the placement declaration order is used, so the toleration
 * time of a later toleration is never considered. Callers must preserve the toleration order.
 */
public final class TaintTolerationMatcher {

    private TaintTolerationMatcher() {
    }

    /**
     * Returns true if the toleration matches the taint. An empty toleration key matches all taint keys.
     * The {@link TolerationOperator#Exists} operator ignores values, and {@link TolerationOperator#Equal} requires
     * them to be equal. If the toleration has an effect, it must be equal to the taint effect.
     */
    public static boolean matches(Taint taint, Toleration toleration) {
        if (StringExt.isNotEmpty(toleration.getKey()) && !toleration.getKey().equals(taint.getKey())) {
            return false;
        }
        if (toleration.getEffect().isPresent() && toleration.getEffect().get() != taint.getEffect()) {
            return false;
        }
        if (toleration.getOperator() == TolerationOperator.Exists) {
            return true;
        }
        return StringExt.nonNull(toleration.getValue()).equals(StringExt.nonNull(taint.getValue()));
    }

    /**
     * Equivalent to {@link #tolerated(List, List, boolean)} for a cluster which is not in the placement
     * decision yet.
     */
    public static TolerationResult tolerated(List<Taint> taints, List<Toleration> tolerations) {
        return tolerated(taints, tolerations, false);
    }

    /**
     * Evaluates all taints of a cluster.
     *
     * @param inExistingDecision true if the cluster is already selected by the placement, in which case
     *                           {@link TaintEffect#NoSelectIfNew} taints do not apply
     */
    public static TolerationResult tolerated(List<Taint> taints, List<Toleration> tolerations, boolean inExistingDecision) {
        List<ExpiringToleration> expiring = new ArrayList<>();
        for (Taint taint : taints) {
            if (!isSelectionBlocking(taint, inExistingDecision)) {
                continue;
            }
            int matchIndex = findFirstMatch(taint, tolerations);
            if (matchIndex < 0) {
                return TolerationResult.untolerated(taint);
            }
            Toleration match = tolerations.get(matchIndex);
            if (match.getTolerationSeconds().isPresent()) {
                expiring.add(new ExpiringToleration(taint, match, matchIndex));
            }
        }
        return TolerationResult.tolerated(expiring);
    }

    private static boolean isSelectionBlocking(Taint taint, boolean inExistingDecision) {
        switch (taint.getEffect()) {
            case PreferNoSelect:
                return false;
            case NoSelectIfNew:
                return !inExistingDecision;
            case NoSelect:
            default:
                return true;
        }
    }

    private static int findFirstMatch(Taint taint, List<Toleration> tolerations) {
        for (int i = 0; i < tolerations.size(); i++) {
            if (matches(taint, tolerations.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
