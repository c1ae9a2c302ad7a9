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

import java.util.Objects;
import java.util.Optional;

import com.netflix.placement.api.cluster.model.Taint;
import com.netflix.placement.api.cluster.model.TaintEffect;
import com.netflix.placement.common.util.StringExt;

/**
 * A placement side declaration cancelling the repelling effect of matching {@link Taint}s, optionally for a
 * bounded time.
 * <p>
 * An empty key matches all taint keys, and is only valid with the {@link TolerationOperator#Exists} operator.
 * If {@link #getTolerationSeconds()} is not set, matching taints are tolerated forever. Zero or a negative value
 * means that the taint is not tolerated at all once it is in place.
 */
public class Toleration {

    private final String key;
    private final TolerationOperator operator;
    private final String value;
    private final Optional<TaintEffect> effect;
    private final Optional<Long> tolerationSeconds;

    public Toleration(String key,
                      TolerationOperator operator,
                      String value,
                      Optional<TaintEffect> effect,
                      Optional<Long> tolerationSeconds) {
        this.key = key;
        this.operator = operator;
        this.value = value;
        this.effect = effect;
        this.tolerationSeconds = tolerationSeconds;
    }

    public String getKey() {
        return key;
    }

    public TolerationOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    /**
     * Taint effect to match. If not set, taints with any effect are matched.
     */
    public Optional<TaintEffect> getEffect() {
        return effect;
    }

    public Optional<Long> getTolerationSeconds() {
        return tolerationSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Toleration that = (Toleration) o;
        return Objects.equals(key, that.key) &&
                operator == that.operator &&
                Objects.equals(value, that.value) &&
                Objects.equals(effect, that.effect) &&
                Objects.equals(tolerationSeconds, that.tolerationSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, operator, value, effect, tolerationSeconds);
    }

    @Override
    public String toString() {
        return "Toleration{" +
                "key='" + key + '\'' +
                ", operator=" + operator +
                ", value='" + value + '\'' +
                ", effect=" + effect +
                ", tolerationSeconds=" + tolerationSeconds +
                '}';
    }

    public Builder toBuilder() {
        Builder builder = newBuilder().withKey(key).withOperator(operator).withValue(value);
        effect.ifPresent(builder::withEffect);
        tolerationSeconds.ifPresent(builder::withTolerationSeconds);
        return builder;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String key;
        private TolerationOperator operator;
        private String value;
        private TaintEffect effect;
        private Long tolerationSeconds;

        private Builder() {
        }

        public Builder withKey(String key) {
            this.key = key;
            return this;
        }

        public Builder withOperator(TolerationOperator operator) {
            this.operator = operator;
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

        public Builder withTolerationSeconds(long tolerationSeconds) {
            this.tolerationSeconds = tolerationSeconds;
            return this;
        }

        public Builder but() {
            Builder builder = newBuilder().withKey(key).withOperator(operator).withValue(value).withEffect(effect);
            builder.tolerationSeconds = tolerationSeconds;
            return builder;
        }

        public Toleration build() {
            return new Toleration(
                    StringExt.nonNull(key),
                    operator == null ? TolerationOperator.Equal : operator,
                    StringExt.nonNull(value),
                    Optional.ofNullable(effect),
                    Optional.ofNullable(tolerationSeconds)
            );
        }
    }
}
