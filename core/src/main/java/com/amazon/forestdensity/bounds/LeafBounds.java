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

package com.amazon.forestdensity.bounds;

import java.util.Arrays;

import lombok.Getter;

/**
 * The axis-aligned region of a leaf: one interval per variable, each side
 * possibly infinite. The region holds the values v with {@code min < v <= max},
 * which is how the splits of the tree route rows.
 */
public class LeafBounds {

    @Getter
    private final int tree;

    @Getter
    private final int leaf;

    private final double[] min;
    private final double[] max;

    public LeafBounds(int tree, int leaf, double[] min, double[] max) {
        this.tree = tree;
        this.leaf = leaf;
        this.min = Arrays.copyOf(min, min.length);
        this.max = Arrays.copyOf(max, max.length);
    }

    public double getMin(int variable) {
        return min[variable];
    }

    public double getMax(int variable) {
        return max[variable];
    }

    public int getNumberOfVariables() {
        return min.length;
    }

    /**
     * The smallest level ordinal of a categorical variable inside the region.
     * Levels are the integers {@code 1..k}; a level L is admissible when
     * {@code min < L <= max}.
     *
     * @param variable a categorical variable
     * @return the first admissible ordinal
     */
    public int getFirstLevel(int variable) {
        double lower = min[variable];
        if (Double.isInfinite(lower)) {
            return 1;
        }
        return Math.max(1, (int) Math.floor(lower) + 1);
    }

    /**
     * The largest level ordinal of a categorical variable inside the region.
     *
     * @param variable       a categorical variable
     * @param numberOfLevels the number of levels k of the variable
     * @return the last admissible ordinal, smaller than the first one if no level
     *         is admissible
     */
    public int getLastLevel(int variable, int numberOfLevels) {
        double upper = max[variable];
        if (Double.isInfinite(upper)) {
            return numberOfLevels;
        }
        return Math.min(numberOfLevels, (int) Math.floor(upper));
    }
}
