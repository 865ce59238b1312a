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

package com.amazon.forestdensity.forest;

import static com.amazon.forestdensity.CommonUtils.checkArgument;
import static com.amazon.forestdensity.CommonUtils.checkData;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Optional;

/**
 * A binary decision tree stored as parallel arrays indexed by node id. Node 0
 * is the root. A node whose left child is {@link #NO_CHILD} is a leaf. Child ids
 * are always larger than the id of their parent, so iterating over the nodes in
 * index order visits every parent before its children.
 *
 * A row is routed to the left child when its value for the split variable is
 * less than or equal to the split value, and to the right child otherwise. A
 * missing value (NaN) is routed to the right.
 */
public class DecisionTree {

    public static final int NO_CHILD = 0;

    private final int[] splitVariables;
    private final double[] splitValues;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final int[] inBagCounts;

    /**
     * @param splitVariables the split variable of every node, ignored for leaves
     * @param splitValues    the split value of every node, ignored for leaves
     * @param leftChildren   the left child of every node, {@link #NO_CHILD} for
     *                       leaves
     * @param rightChildren  the right child of every node, {@link #NO_CHILD} for
     *                       leaves
     * @param inBagCounts    the number of times each training row was drawn for
     *                       this tree, or null if the trainer did not keep them
     */
    public DecisionTree(int[] splitVariables, double[] splitValues, int[] leftChildren, int[] rightChildren,
            int[] inBagCounts) {
        checkNotNull(splitVariables, "splitVariables must not be null");
        checkNotNull(splitValues, "splitValues must not be null");
        checkNotNull(leftChildren, "leftChildren must not be null");
        checkNotNull(rightChildren, "rightChildren must not be null");
        int numberOfNodes = splitVariables.length;
        checkArgument(numberOfNodes > 0, "a tree needs at least a root");
        checkArgument(splitValues.length == numberOfNodes && leftChildren.length == numberOfNodes
                && rightChildren.length == numberOfNodes, "incorrect lengths of node arrays");
        for (int node = 0; node < numberOfNodes; node++) {
            if (leftChildren[node] != NO_CHILD) {
                checkData(leftChildren[node] > node && leftChildren[node] < numberOfNodes,
                        "invalid left child of node " + node);
                checkData(rightChildren[node] > node && rightChildren[node] < numberOfNodes,
                        "invalid right child of node " + node);
                checkData(splitVariables[node] >= 0, "invalid split variable of node " + node);
            }
        }
        this.splitVariables = Arrays.copyOf(splitVariables, numberOfNodes);
        this.splitValues = Arrays.copyOf(splitValues, numberOfNodes);
        this.leftChildren = Arrays.copyOf(leftChildren, numberOfNodes);
        this.rightChildren = Arrays.copyOf(rightChildren, numberOfNodes);
        this.inBagCounts = (inBagCounts == null) ? null : Arrays.copyOf(inBagCounts, inBagCounts.length);
    }

    public DecisionTree(int[] splitVariables, double[] splitValues, int[] leftChildren, int[] rightChildren) {
        this(splitVariables, splitValues, leftChildren, rightChildren, null);
    }

    public int getNumberOfNodes() {
        return splitVariables.length;
    }

    public boolean isLeaf(int node) {
        return leftChildren[node] == NO_CHILD;
    }

    public int getSplitVariable(int node) {
        return splitVariables[node];
    }

    public double getSplitValue(int node) {
        return splitValues[node];
    }

    public int getLeftChild(int node) {
        return leftChildren[node];
    }

    public int getRightChild(int node) {
        return rightChildren[node];
    }

    /**
     * @return the largest split variable used by an internal node, or -1 for a
     *         tree that is a single leaf
     */
    public int getMaxSplitVariable() {
        int max = -1;
        for (int node = 0; node < splitVariables.length; node++) {
            if (!isLeaf(node)) {
                max = Math.max(max, splitVariables[node]);
            }
        }
        return max;
    }

    public Optional<int[]> getInBagCounts() {
        return Optional.ofNullable(inBagCounts);
    }

    /**
     * Follows the splits of the tree from the root.
     *
     * @param row the values of a row, indexed by variable
     * @return the id of the leaf the row terminates in
     */
    public int getTerminalNode(double[] row) {
        int node = 0;
        while (leftChildren[node] != NO_CHILD) {
            node = (row[splitVariables[node]] <= splitValues[node]) ? leftChildren[node] : rightChildren[node];
        }
        return node;
    }
}
