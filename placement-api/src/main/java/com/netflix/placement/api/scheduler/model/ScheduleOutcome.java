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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * Result of a single taint/toleration evaluation cycle for one placement. Admitted clusters are passed to the
 * next scheduling stages. If {@link #isRequeue()} is true, the placement must be evaluated again no later than
 * {@link #getRequeueAfter()} from the evaluation time, as this is when the earliest toleration expires.
 * <p>
 * Outcomes are recomputed on each cycle, and are never persisted.
 */
public class ScheduleOutcome {

    private final String placementId;
    private final Set<String> admittedClusters;
    private final Map<String, ClusterRejection> rejections;
    private final boolean requeue;
    private final Duration requeueAfter;
    private final Map<String, String> validationErrors;

    public ScheduleOutcome(String placementId,
                           Set<String> admittedClusters,
                           Map<String, ClusterRejection> rejections,
                           boolean requeue,
                           Duration requeueAfter,
                           Map<String, String> validationErrors) {
        this.placementId = placementId;
        this.admittedClusters = admittedClusters;
        this.rejections = rejections;
        this.requeue = requeue;
        this.requeueAfter = requeueAfter;
        this.validationErrors = validationErrors;
    }

    public String getPlacementId() {
        return placementId;
    }

    /**
     * Clusters that passed the stage, in the candidate order.
     */
    public Set<String> getAdmittedClusters() {
        return admittedClusters;
    }

    /**
     * Clusters removed from further consideration, in the candidate order.
     */
    public Set<String> getRejectedClusters() {
        return rejections.keySet();
    }

    public Map<String, ClusterRejection> getRejections() {
        return rejections;
    }

    public Optional<ClusterRejection> findRejection(String clusterName) {
        return Optional.ofNullable(rejections.get(clusterName));
    }

    public boolean isRequeue() {
        return requeue;
    }

    /**
     * Delay after which the placement must be evaluated again. Set to {@link Duration#ZERO} if
     * {@link #isRequeue()} is false.
     */
    public Duration getRequeueAfter() {
        return requeueAfter;
    }

    /**
     * Placement validation errors (field path to message). If not empty, all clusters are rejected.
     */
    public Map<String, String> getValidationErrors() {
        return validationErrors;
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScheduleOutcome that = (ScheduleOutcome) o;
        return requeue == that.requeue &&
                Objects.equals(placementId, that.placementId) &&
                Objects.equals(admittedClusters, that.admittedClusters) &&
                Objects.equals(rejections, that.rejections) &&
                Objects.equals(requeueAfter, that.requeueAfter) &&
                Objects.equals(validationErrors, that.validationErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(placementId, admittedClusters, rejections, requeue, requeueAfter, validationErrors);
    }

    @Override
    public String toString() {
        return "ScheduleOutcome{" +
                "placementId='" + placementId + '\'' +
                ", admittedClusters=" + admittedClusters +
                ", rejections=" + rejections.values() +
                ", requeue=" + requeue +
                ", requeueAfter=" + requeueAfter +
                ", validationErrors=" + validationErrors +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String placementId;
        private final Set<String> admittedClusters = new LinkedHashSet<>();
        private final Map<String, ClusterRejection> rejections = new LinkedHashMap<>();
        private Duration requeueAfter;
        private final Map<String, String> validationErrors = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder withPlacementId(String placementId) {
            this.placementId = placementId;
            return this;
        }

        public Builder withAdmittedCluster(String clusterName) {
            this.admittedClusters.add(clusterName);
            return this;
        }

        public Builder withRejection(ClusterRejection rejection) {
            this.rejections.put(rejection.getClusterName(), rejection);
            return this;
        }

        /**
         * Requeue the placement after the given delay. A null value clears the requeue request.
         */
        public Builder withRequeueAfter(Duration requeueAfter) {
            this.requeueAfter = requeueAfter;
            return this;
        }

        public Builder withValidationErrors(Map<String, String> validationErrors) {
            this.validationErrors.putAll(validationErrors);
            return this;
        }

        public ScheduleOutcome build() {
            Preconditions.checkNotNull(placementId, "Placement id not set");
            Preconditions.checkArgument(requeueAfter == null || !requeueAfter.isNegative() && !requeueAfter.isZero(),
                    "Requeue delay must be positive: %s", requeueAfter);
            for (String clusterName : admittedClusters) {
                Preconditions.checkArgument(!rejections.containsKey(clusterName), "Cluster %s both admitted and rejected", clusterName);
            }
            return new ScheduleOutcome(
                    placementId,
                    Collections.unmodifiableSet(new LinkedHashSet<>(admittedClusters)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(rejections)),
                    requeueAfter != null,
                    requeueAfter == null ? Duration.ZERO : requeueAfter,
                    Collections.unmodifiableMap(new LinkedHashMap<>(validationErrors))
            );
        }
    }
}
