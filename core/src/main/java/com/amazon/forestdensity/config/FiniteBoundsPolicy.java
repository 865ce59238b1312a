/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.forestdensity.config;

import static com.amazon.forestdensity.CommonUtils.checkConfiguration;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.Locale;

/**
 * How infinite leaf bounds of continuous variables are replaced.
 */
public enum FiniteBoundsPolicy {

    /**
     * infinite bounds are kept
     */
    NONE("no"),
    /**
     * infinite bounds are set to the empirical extrema of the leaf, widened by
     * epsilon
     */
    LOCAL("local"),
    /**
     * every tree starts from the global empirical extrema, widened by epsilon
     */
    GLOBAL("global");

    private final String externalName;

    FiniteBoundsPolicy(String externalName) {
        this.externalName = externalName;
    }

    public String getExternalName() {
        return externalName;
    }

    public static FiniteBoundsPolicy fromName(String name) {
        checkNotNull(name, "finite bounds name must not be null");
        String lower = name.toLowerCase(Locale.ROOT);
        for (FiniteBoundsPolicy policy : values()) {
            if (policy.externalName.equals(lower) || policy.name().equalsIgnoreCase(name)) {
                return policy;
            }
        }
        checkConfiguration(false, "finite bounds policy not recognized: " + name);
        return null;
    }
}
