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

package com.netflix.placement.api.placement.model.sanitizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.netflix.placement.api.placement.model.Placement;
import com.netflix.placement.api.placement.model.Toleration;
import com.netflix.placement.api.placement.model.TolerationOperator;
import com.netflix.placement.common.util.StringExt;

/**
 * Structural checks of placement tolerations. Violations are returned as a map of field path to message,
 * in toleration declaration order. An empty map means the placement is valid.
 */
public class PlacementAssertions {

    public static final String EMPTY_KEY_REQUIRES_EXISTS = "empty key must be used with the Exists operator";

    public static final String OPERATOR_NOT_SET = "operator must be set";

    public Map<String, String> validateTolerations(Placement placement) {
        Map<String, String> violations = new LinkedHashMap<>();

        List<Toleration> tolerations = placement.getTolerations();
        for (int i = 0; i < tolerations.size(); i++) {
            Toleration toleration = tolerations.get(i);
            if (toleration == null) {
                violations.put(tolerationPath(i), "toleration must not be null");
                continue;
            }
            if (toleration.getOperator() == null) {
                violations.put(tolerationPath(i) + ".operator", OPERATOR_NOT_SET);
            } else if (StringExt.isEmpty(toleration.getKey()) && toleration.getOperator() == TolerationOperator.Equal) {
                violations.put(tolerationPath(i) + ".operator", EMPTY_KEY_REQUIRES_EXISTS);
            }
        }

        return violations;
    }

    public static String tolerationPath(int index) {
        return "tolerations[" + index + "]";
    }
}
