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

import static com.amazon.forestdensity.CommonUtils.checkArgument;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.forest.DecisionTree;

/**
 * Reconstructs the bounding box of every node of a tree by pushing the split
 * constraints from the root down to the leaves.
 */
public class TreeBoundExtractor {

    private final double[] rootMin;
    private final double[] rootMax;

    /**
     * @param rootMin the lower bounds of the root box, one per variable
     * @param rootMax the upper bounds of the root box, one per variable
     */
    public TreeBoundExtractor(double[] rootMin, double[] rootMax) {
        checkNotNull(rootMin, "rootMin must not be null");
        checkNotNull(rootMax, "rootMax must not be null");
        checkArgument(rootMin.length == rootMax.length, "incorrect lengths of root bounds");
        for (int j = 0; j < rootMin.length; j++) {
            checkArgument(rootMin[j] <= rootMax[j], "empty root interval for variable " + j);
        }
        this.rootMin = Arrays.copyOf(rootMin, rootMin.length);
        this.rootMax = Arrays.copyOf(rootMax, rootMax.length);
    }

    /**
     * An extractor whose root box is unbounded on every variable.
     *
     * @param numberOfVariables the number of variables
     * @return the extractor
     */
    public static TreeBoundExtractor unbounded(int numberOfVariables) {
        double[] min = new double[numberOfVariables];
        double[] max = new double[numberOfVariables];
        Arrays.fill(min, Double.NEGATIVE_INFINITY);
        Arrays.fill(max, Double.POSITIVE_INFINITY);
        return new TreeBoundExtractor(min, max);
    }

    /**
     * An extractor whose root box is bounded on continuous variables by their
     * global empirical extrema; the gap between the extrema is widened by a
     * factor {@code 1 + epsilon}. Categorical variables stay unbounded.
     *
     * @param data    the encoded estimation dataset
     * @param epsilon the slack factor
     * @return the extractor
     */
    public static TreeBoundExtractor globallyBounded(EncodedDataset data, double epsilon) {
        int d = data.getNumberOfVariables();
        double[] min = new double[d];
        double[] max = new double[d];
        for (int j = 0; j < d; j++) {
            if (data.isContinuous(j)) {
                double gap = data.getGlobalMax(j) - data.getGlobalMin(j);
                min[j] = data.getGlobalMin(j) - epsilon / 2 * gap;
                max[j] = data.getGlobalMax(j) + epsilon / 2 * gap;
            } else {
                min[j] = Double.NEGATIVE_INFINITY;
                max[j] = Double.POSITIVE_INFINITY;
            }
        }
        return new TreeBoundExtractor(min, max);
    }

    public int getNumberOfVariables() {
        return rootMin.length;
    }

    /**
     * Computes the box of every node. Nodes are processed in index order, which
     * visits parents before children. The children of a node inherit its box;
     * the left child is then capped at the split value on the split variable and
     * the right child starts there. When both children are the same node, it
     * inherits the box unchanged.
     *
     * @param tree the tree
     * @return the boxes of all nodes
     */
    public NodeBounds computeNodeBounds(DecisionTree tree) {
        checkNotNull(tree, "tree must not be null");
        int numberOfNodes = tree.getNumberOfNodes();
        double[][] lower = new double[numberOfNodes][];
        double[][] upper = new double[numberOfNodes][];
        lower[0] = Arrays.copyOf(rootMin, rootMin.length);
        upper[0] = Arrays.copyOf(rootMax, rootMax.length);

        for (int node = 0; node < numberOfNodes; node++) {
            if (lower[node] == null) {
                // unreachable from the root
                lower[node] = Arrays.copyOf(rootMin, rootMin.length);
                upper[node] = Arrays.copyOf(rootMax, rootMax.length);
            }
            if (tree.isLeaf(node)) {
                continue;
            }
            int left = tree.getLeftChild(node);
            int right = tree.getRightChild(node);
            lower[left] = Arrays.copyOf(lower[node], lower[node].length);
            upper[left] = Arrays.copyOf(upper[node], upper[node].length);
            lower[right] = Arrays.copyOf(lower[node], lower[node].length);
            upper[right] = Arrays.copyOf(upper[node], upper[node].length);
            if (left != right) {
                int variable = tree.getSplitVariable(node);
                checkArgument(variable < rootMin.length, "split variable out of range");
                double split = tree.getSplitValue(node);
                upper[left][variable] = Math.min(upper[left][variable], split);
                lower[right][variable] = Math.max(lower[right][variable], split);
            }
        }
        return new NodeBounds(lower, upper);
    }

    /**
     * Computes the boxes of the leaves of a tree, in increasing leaf id.
     *
     * @param treeIndex the index of the tree in the forest
     * @param tree      the tree
     * @return one entry per leaf
     */
    public List<LeafBounds> extract(int treeIndex, DecisionTree tree) {
        NodeBounds nodeBounds = computeNodeBounds(tree);
        List<LeafBounds> leaves = new ArrayList<>();
        for (int node = 0; node < tree.getNumberOfNodes(); node++) {
            if (tree.isLeaf(node)) {
                leaves.add(new LeafBounds(treeIndex, node, nodeBounds.getMinValues(node),
                        nodeBounds.getMaxValues(node)));
            }
        }
        return leaves;
    }
}
