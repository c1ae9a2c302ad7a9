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

/**
 * Defines how strongly a {@link Taint} repels placements that do not tolerate it.
 */
public enum TaintEffect {

    /**
     * Placements that do not tolerate the taint cannot select the cluster.
     */
    NoSelect,

    /**
     * Like {@link #NoSelect}, but clusters already selected by a placement are kept.
     */
    NoSelectIfNew,

    /**
     * Scoring hint only. The cluster stays selectable.
     */
    PreferNoSelect
}
