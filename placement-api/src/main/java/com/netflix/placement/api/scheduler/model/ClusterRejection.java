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

import java.util.Objects;

/**
 * Explains why a candidate cluster was removed from further consideration by the taint/toleration stage.
 */
public class ClusterRejection {

    public enum Reason {
        /**
         * The cluster has a taint that no placement toleration matches.
         */
        UntoleratedTaint,

        /**
         * All taints are tolerated, but the toleration period of at least one of them has elapsed.
         */
        TolerationExpired,

        /**
         * The placement tolerations are invalid, so no cluster can be selected until they are fixed.
         */
        InvalidPlacement,

        /**
         * Unexpected error during the placement evaluation.
         */
        EvaluationFailure
    }

    private final String clusterName;
    private final Reason reason;
    private final String message;

    public ClusterRejection(String clusterName, Reason reason, String message) {
        this.clusterName = clusterName;
        this.reason = reason;
        this.message = message;
    }

    public String getClusterName() {
        return clusterName;
    }

    public Reason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClusterRejection that = (ClusterRejection) o;
        return Objects.equals(clusterName, that.clusterName) &&
                reason == that.reason &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clusterName, reason, message);
    }

    @Override
    public String toString() {
        return "ClusterRejection{" +
                "clusterName='" + clusterName + '\'' +
                ", reason=" + reason +
                ", message='" + message + '\'' +
                '}';
    }
}
