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

package com.netflix.placement.api.cluster.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.placement.common.util.StringExt;

/**
 * A remote cluster registered with the control plane, and a candidate placement target. Taints are kept in
 * the order they were declared.
 */
public class ManagedCluster {

    private final String name;
    private final List<Taint> taints;

    public ManagedCluster(String name, List<Taint> taints) {
        this.name = name;
        this.taints = taints;
    }

    public String getName() {
        return name;
    }

    public List<Taint> getTaints() {
        return taints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ManagedCluster that = (ManagedCluster) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(taints, that.taints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, taints);
    }

    @Override
    public String toString() {
        return "ManagedCluster{" +
                "name='" + name + '\'' +
                ", taints=" + taints +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder().withName(name).withTaints(taints);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private List<Taint> taints = new ArrayList<>();

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withTaints(List<Taint> taints) {
            this.taints = new ArrayList<>(taints);
            return this;
        }

        public Builder withTaint(Taint taint) {
            this.taints.add(taint);
            return this;
        }

        public ManagedCluster build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(name), "Cluster name must not be empty");
            return new ManagedCluster(name, Collections.unmodifiableList(new ArrayList<>(taints)));
        }
    }
}
