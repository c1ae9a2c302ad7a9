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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.netflix.placement.api.cluster.model.Taint;

/**
 * Result of matching all taints of a cluster against the placement tolerations.
 */
public class TolerationResult {

    private static final TolerationResult TOLERATED_FOREVER = new TolerationResult(true, Optional.empty(), Collections.emptyList());

    private final boolean admitted;
    private final Optional<Taint> untoleratedTaint;
    private final List<ExpiringToleration> toleratedExpiring;

    private TolerationResult(boolean admitted, Optional<Taint> untoleratedTaint, List<ExpiringToleration> toleratedExpiring) {
        this.admitted = admitted;
        this.untoleratedTaint = untoleratedTaint;
        this.toleratedExpiring = toleratedExpiring;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    /**
     * The first taint, in the cluster declaration order, that no toleration matches.
     */
    public Optional<Taint> getUntoleratedTaint() {
        return untoleratedTaint;
    }

    /**
     * Tolerated taints with a bounded toleration time, in the cluster taint order. Empty if the cluster was
     * not admitted.
     */
    public List<ExpiringToleration> getToleratedExpiring() {
        return toleratedExpiring;
    }

    @Override
    public String toString() {
        return "TolerationResult{" +
                "admitted=" + admitted +
                ", untoleratedTaint=" + untoleratedTaint +
                ", toleratedExpiring=" + toleratedExpiring +
                '}';
    }

    public static TolerationResult untolerated(Taint taint) {
        return new TolerationResult(false, Optional.of(taint), Collections.emptyList());
    }

    public static TolerationResult tolerated(List<ExpiringToleration> toleratedExpiring) {
        if (toleratedExpiring.isEmpty()) {
            return TOLERATED_FOREVER;
        }
        return new TolerationResult(true, Optional.empty(), Collections.unmodifiableList(toleratedExpiring));
    }
}
