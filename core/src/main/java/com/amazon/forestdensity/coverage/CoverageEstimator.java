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

package com.amazon.forestdensity.coverage;

import static com.amazon.forestdensity.CommonUtils.checkConfiguration;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;
import static com.amazon.forestdensity.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.forestdensity.config.SamplingPolicy;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.forest.DecisionTree;
import com.amazon.forestdensity.forest.Forest;

/**
 * Routes the rows of the estimation dataset through a tree, filters them with
 * the sampling policy and computes the coverage of every leaf.
 */
public class CoverageEstimator {

    @Getter
    private final SamplingPolicy samplingPolicy;

    public CoverageEstimator(SamplingPolicy samplingPolicy) {
        this.samplingPolicy = checkNotNull(samplingPolicy, "samplingPolicy must not be null");
    }

    /**
     * Checks that the policy can be applied to a dataset of the given size. The
     * out-of-bag policy is only meaningful on the training rows, so the dataset
     * must have as many rows as the forest was trained on, or half as many for
     * forests trained with honest splitting.
     *
     * @param forest       the forest
     * @param numberOfRows the number of rows of the estimation dataset
     * @throws com.amazon.forestdensity.ConfigurationException if the policy cannot
     *                                                         be applied
     */
    public void validate(Forest forest, int numberOfRows) {
        checkNotNull(forest, "forest must not be null");
        if (samplingPolicy == SamplingPolicy.OUT_OF_BAG) {
            checkConfiguration(
                    numberOfRows == forest.getNumberOfSamples() || 2L * numberOfRows == forest.getNumberOfSamples(),
                    "forest must be trained on the estimation dataset when using out-of-bag rows");
        }
        if (samplingPolicy.usesInBagCounts()) {
            checkConfiguration(forest.hasInBagCounts(), "sampling policy " + samplingPolicy.getExternalName()
                    + " requires the in-bag counts of every tree");
            for (DecisionTree tree : forest.getTrees()) {
                checkConfiguration(tree.getInBagCounts().get().length >= numberOfRows,
                        "in-bag counts do not cover the estimation dataset");
            }
        }
    }

    /**
     * Computes the terminal node of every row and the rows kept for the tree.
     *
     * @param treeIndex the index of the tree
     * @param tree      the tree
     * @param data      the encoded estimation dataset
     * @return the assignment
     */
    public LeafAssignment assign(int treeIndex, DecisionTree tree, EncodedDataset data) {
        int n = data.getNumberOfRows();
        int[] terminalNodes = new int[n];
        for (int i = 0; i < n; i++) {
            terminalNodes[i] = tree.getTerminalNode(data.getRow(i));
        }
        int[] kept = new int[n];
        int numberKept = 0;
        int[] inBagCounts = samplingPolicy.usesInBagCounts() ? tree.getInBagCounts().get() : null;
        for (int i = 0; i < n; i++) {
            if (inBagCounts == null || samplingPolicy.keeps(inBagCounts[i])) {
                kept[numberKept++] = i;
            }
        }
        int[] keptRows = new int[numberKept];
        System.arraycopy(kept, 0, keptRows, 0, numberKept);
        return new LeafAssignment(treeIndex, terminalNodes, keptRows);
    }

    /**
     * Computes the coverage of the leaves that hold at least one kept row. Leaves
     * without kept rows are left out and therefore take no part in the circuit.
     *
     * @param assignment the assignment of the rows of the tree
     * @param tree       the tree
     * @return the coverage of the leaves, in increasing leaf id
     */
    public List<LeafCoverage> estimate(LeafAssignment assignment, DecisionTree tree) {
        int[] counts = new int[tree.getNumberOfNodes()];
        int total = assignment.getNumberOfKeptRows();
        for (int index = 0; index < total; index++) {
            counts[assignment.getTerminalNode(assignment.getKeptRow(index))]++;
        }
        List<LeafCoverage> result = new ArrayList<>();
        for (int node = 0; node < counts.length; node++) {
            if (counts[node] > 0) {
                checkState(tree.isLeaf(node), "rows must terminate in leaves");
                result.add(new LeafCoverage(assignment.getTree(), node, counts[node], (double) counts[node] / total));
            }
        }
        return result;
    }
}
