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

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.netflix.placement.common.util.StringExt;

/**
 * A repelling marker attached to a managed cluster. The time the taint was added is stamped by the component
 * that creates the taint, and may not be known yet.
 */
public class Taint {

    private final String key;
    private final String value;
    private final TaintEffect effect;
    private final Optional<Long> timeAdded;

    public Taint(String key, String value, TaintEffect effect, Optional<Long> timeAdded) {
        this.key = key;
        this.value = value;
        this.effect = effect;
        this.timeAdded = timeAdded;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public TaintEffect getEffect() {
        return effect;
    }

    /**
     * Time (epoch milliseconds) at which the taint was applied to the cluster.
     */
    public Optional<Long> getTimeAdded() {
        return timeAdded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Taint taint = (Taint) o;
        return Objects.equals(key, taint.key) &&
                Objects.equals(value, taint.value) &&
                effect == taint.effect &&
                Objects.equals(timeAdded, taint.timeAdded);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, effect, timeAdded);
    }

    @Override
    public String toString() {
        return "Taint{" +
                "key='" + key + '\'' +
                ", value='" + value + '\'' +
                ", effect=" + effect +
                ", timeAdded=" + timeAdded +
                '}';
    }

    public Builder toBuilder() {
        Builder builder = newBuilder().withKey(key).withValue(value).withEffect(effect);
        timeAdded.ifPresent(builder::withTimeAdded);
        return builder;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String key;
        private String value;
        private TaintEffect effect;
        private Long timeAdded;

        private Builder() {
        }

        public Builder withKey(String key) {
            this.key = key;
            return this;
        }

        public Builder withValue(String value) {
            this.value = value;
            return this;
        }

        public Builder withEffect(TaintEffect effect) {
            this.effect = effect;
            return this;
        }

        public Builder withTimeAdded(long timeAdded) {
            this.timeAdded = timeAdded;
            return this;
        }

        public Builder withoutTimeAdded() {
            this.timeAdded = null;
            return this;
        }

        public Taint build() {
            Preconditions.checkArgument(StringExt.isNotEmpty(key), "Taint key must not be empty");
            return new Taint(
                    key,
                    StringExt.nonNull(value),
                    effect == null ? TaintEffect.NoSelect : effect,
                    Optional.ofNullable(timeAdded)
            );
        }
    }
}
