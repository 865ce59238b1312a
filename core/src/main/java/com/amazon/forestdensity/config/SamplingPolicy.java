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
 * Which training rows are used, per tree, to estimate coverage and leaf
 * parameters.
 */
public enum SamplingPolicy {

    /**
     * every row of the estimation dataset
     */
    ALL("all"),
    /**
     * rows left out of the bootstrap sample of the tree; the estimation dataset
     * must be the training dataset
     */
    OUT_OF_BAG("oob"),
    /**
     * rows drawn at least once into the bootstrap sample of the tree
     */
    IN_BAG("inbag");

    private final String externalName;

    SamplingPolicy(String externalName) {
        this.externalName = externalName;
    }

    public String getExternalName() {
        return externalName;
    }

    /**
     * @return true if the policy needs the in-bag counts of the forest
     */
    public boolean usesInBagCounts() {
        return this != ALL;
    }

    /**
     * Decides if a row is used for a tree.
     *
     * @param inBagCount the number of times the row was drawn for the tree
     * @return true if the row is kept
     */
    public boolean keeps(int inBagCount) {
        switch (this) {
        case OUT_OF_BAG:
            return inBagCount == 0;
        case IN_BAG:
            return inBagCount > 0;
        default:
            return true;
        }
    }

    public static SamplingPolicy fromName(String name) {
        checkNotNull(name, "sampling policy name must not be null");
        String lower = name.toLowerCase(Locale.ROOT);
        for (SamplingPolicy policy : values()) {
            if (policy.externalName.equals(lower) || policy.name().equalsIgnoreCase(name)) {
                return policy;
            }
        }
        checkConfiguration(false, "sampling policy not recognized: " + name);
        return null;
    }
}
