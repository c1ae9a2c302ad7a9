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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.netflix.placement.common.util.StringExt;

/**
 * Placement policy, reduced to the data the taint/toleration stage reads. The toleration order is significant:
 * when several tolerations match the same taint, the first one declared wins.
 */
public class Placement {

    private final String namespace;
    private final String name;
    private final List<Toleration> tolerations;

    public Placement(String namespace, String name, List<Toleration> tolerations) {
        this.namespace = namespace;
        this.name = name;
        this.tolerations = tolerations;
    }

    /**
     * Placement identifier in the namespace/name format.
     */
    public String getId() {
        return namespace + '/' + name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public List<Toleration> getTolerations() {
        return tolerations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Placement placement = (Placement) o;
        return Objects.equals(namespace, placement.namespace) &&
                Objects.equals(name, placement.name) &&
                Objects.equals(tolerations, placement.tolerations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name, tolerations);
    }

    @Override
    public String toString() {
        return "Placement{" +
                "namespace='" + namespace + '\'' +
                ", name='" + name + '\'' +
                ", tolerations=" + tolerations +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder().withNamespace(namespace).withName(name).withTolerations(tolerations);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String namespace;
        private String name;
        private List<Toleration> tolerations = new ArrayList<>();

        private Builder() {
        }

        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withTolerations(List<Toleration> tolerations) {
            this.tolerations = new ArrayList<>(tolerations);
            return this;
        }

        public Builder withToleration(Toleration toleration) {
            this.tolerations.add(toleration);
            return this;
        }

        public Placement build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(namespace), "Placement namespace must not be empty");
            Preconditions.checkArgument(StringExt.isNotEmpty(name), "Placement name must not be empty");
            return new Placement(namespace, name, Collections.unmodifiableList(new ArrayList<>(tolerations)));
        }
    }
}
