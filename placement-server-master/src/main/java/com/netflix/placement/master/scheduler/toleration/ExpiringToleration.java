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

import java.util.Objects;

import com.netflix.placement.api.cluster.model.Taint;
import com.netflix.placement.api.placement.model.Toleration;

/**
 * A taint tolerated for a limited time, paired with the toleration that matched it first.
 */
public class ExpiringToleration {

    private final Taint taint;
    private final Toleration toleration;
    private final int tolerationIndex;

    public ExpiringToleration(Taint taint, Toleration toleration, int tolerationIndex) {
        this.taint = taint;
        this.toleration = toleration;
        this.tolerationIndex = tolerationIndex;
    }

    public Taint getTaint() {
        return taint;
    }

    public Toleration getToleration() {
        return toleration;
    }

    /**
     * Position of the toleration in the placement toleration list.
     */
    public int getTolerationIndex() {
        return tolerationIndex;
    }

    public long getTolerationSeconds() {
        return toleration.getTolerationSeconds().orElseThrow(() -> new IllegalStateException("Toleration without expiry: " + toleration));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExpiringToleration that = (ExpiringToleration) o;
        return tolerationIndex == that.tolerationIndex &&
                Objects.equals(taint, that.taint) &&
                Objects.equals(toleration, that.toleration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taint, toleration, tolerationIndex);
    }

    @Override
    public String toString() {
        return "ExpiringToleration{" +
                "taint=" + taint +
                ", toleration=" + toleration +
                ", tolerationIndex=" + tolerationIndex +
                '}';
    }
}
