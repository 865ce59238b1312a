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

/**
 * The boxes of all the nodes of one tree, indexed by node id and variable.
 */
public class NodeBounds {

    private final double[][] lowerBounds;
    private final double[][] upperBounds;

    NodeBounds(double[][] lowerBounds, double[][] upperBounds) {
        this.lowerBounds = lowerBounds;
        this.upperBounds = upperBounds;
    }

    public int getNumberOfNodes() {
        return lowerBounds.length;
    }

    public double getMin(int node, int variable) {
        return lowerBounds[node][variable];
    }

    public double getMax(int node, int variable) {
        return upperBounds[node][variable];
    }

    double[] getMinValues(int node) {
        return lowerBounds[node];
    }

    double[] getMaxValues(int node) {
        return upperBounds[node];
    }
}
