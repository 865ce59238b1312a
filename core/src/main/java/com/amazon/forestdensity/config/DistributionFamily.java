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
 * The distribution used for continuous variables within a leaf. Categorical
 * variables always use {@link #MULTINOMIAL}.
 */
public enum DistributionFamily {

    /**
     * normal distribution truncated to the leaf interval
     */
    TRUNCATED_NORMAL("truncnorm", true),
    /**
     * uniform distribution over the leaf interval, which must be finite
     */
    UNIFORM("unif", true),
    /**
     * distribution over the levels of a categorical variable
     */
    MULTINOMIAL("multinom", false);

    private final String externalName;
    private final boolean continuous;

    DistributionFamily(String externalName, boolean continuous) {
        this.externalName = externalName;
        this.continuous = continuous;
    }

    public String getExternalName() {
        return externalName;
    }

    public boolean isContinuous() {
        return continuous;
    }

    /**
     * Resolves a continuous family from its external name ({@code truncnorm} or
     * {@code unif}) or its constant name.
     *
     * @param name the name of the family
     * @return the family
     * @throws com.amazon.forestdensity.ConfigurationException if the name is not a
     *                                                         supported continuous
     *                                                         family
     */
    public static DistributionFamily fromName(String name) {
        checkNotNull(name, "family name must not be null");
        String lower = name.toLowerCase(Locale.ROOT);
        for (DistributionFamily family : values()) {
            if (family.continuous && (family.externalName.equals(lower) || family.name().equalsIgnoreCase(name))) {
                return family;
            }
        }
        checkConfiguration(false, "family not recognized: " + name);
        return null;
    }
}
