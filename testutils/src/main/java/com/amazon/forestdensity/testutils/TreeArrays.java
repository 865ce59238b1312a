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

package com.amazon.forestdensity.testutils;

/**
 * The parallel arrays describing a generated tree, in the layout a forest
 * trainer exposes: node 0 is the root, a left child of 0 marks a leaf, and
 * children always have larger ids than their parent.
 */
public class TreeArrays {

    public final int[] splitVariables;
    public final double[] splitValues;
    public final int[] leftChildren;
    public final int[] rightChildren;
    public final int[] inBagCounts;

    public TreeArrays(int[] splitVariables, double[] splitValues, int[] leftChildren, int[] rightChildren,
            int[] inBagCounts) {
        this.splitVariables = splitVariables;
        this.splitValues = splitValues;
        this.leftChildren = leftChildren;
        this.rightChildren = rightChildren;
        this.inBagCounts = inBagCounts;
    }

    public int getNumberOfNodes() {
        return splitVariables.length;
    }

    /**
     * Routes a row the way the trainer does: left when the value is less than or
     * equal to the split value, right otherwise, including for NaN.
     *
     * @param row the row
     * @return the leaf the row terminates in
     */
    public int route(double[] row) {
        int node = 0;
        while (leftChildren[node] != 0) {
            node = (row[splitVariables[node]] <= splitValues[node]) ? leftChildren[node] : rightChildren[node];
        }
        return node;
    }
}
