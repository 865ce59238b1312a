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

package com.amazon.forestdensity.estimator;

import static com.amazon.forestdensity.CommonUtils.checkArgument;
import static com.amazon.forestdensity.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.forestdensity.bounds.LeafBounds;
import com.amazon.forestdensity.circuit.CategoricalLeafParameters;
import com.amazon.forestdensity.coverage.LeafAssignment;
import com.amazon.forestdensity.data.ColumnKind;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.index.IndexedLeaf;

/**
 * Estimates, for every leaf of a tree and every categorical variable, a
 * multinomial distribution over the levels from the kept rows terminating in
 * the leaf.
 *
 * The levels admissible in a leaf are the ordinals {@code L} with
 * {@code min < L <= max} for the leaf interval of the variable. With a positive
 * pseudocount {@code alpha} every admissible level receives
 * {@code (count + alpha) / (total + alpha * k)}, which is the posterior mean
 * under a flat Dirichlet prior; with {@code alpha = 0} only observed levels are
 * reported. A leaf where every value of the variable is missing is given a
 * uniform distribution over its admissible levels, or over all levels when its
 * region admits none.
 */
public class CategoricalParameterEstimator {

    @Getter
    private final double alpha;

    public CategoricalParameterEstimator(double alpha) {
        checkArgument(alpha >= 0, "alpha must be nonnegative");
        this.alpha = alpha;
    }

    /**
     * Estimates the parameters of the leaves of one tree.
     *
     * @param assignment the terminal nodes and kept rows of the tree
     * @param leaves     the indexed leaves of the tree, in increasing leaf id
     * @param data       the encoded estimation dataset
     * @return one row per (leaf, categorical variable, level), ordered by leaf,
     *         variable and level ordinal
     */
    public List<CategoricalLeafParameters> estimate(LeafAssignment assignment, List<IndexedLeaf> leaves,
            EncodedDataset data) {
        int[] variables = data.getVariables(ColumnKind.CATEGORICAL);
        List<CategoricalLeafParameters> result = new ArrayList<>();
        if (variables.length == 0 || leaves.isEmpty()) {
            return result;
        }

        Map<Integer, Integer> positions = new HashMap<>();
        for (int pos = 0; pos < leaves.size(); pos++) {
            positions.put(leaves.get(pos).getLeaf(), pos);
        }
        int[] rowCounts = new int[leaves.size()];
        int[][] missing = new int[leaves.size()][variables.length];
        // levelCounts[leaf][variable][ordinal], ordinal 0 unused
        int[][][] levelCounts = new int[leaves.size()][variables.length][];
        for (int pos = 0; pos < leaves.size(); pos++) {
            for (int index = 0; index < variables.length; index++) {
                levelCounts[pos][index] = new int[data.getLevels(variables[index]).size() + 1];
            }
        }
        for (int k = 0; k < assignment.getNumberOfKeptRows(); k++) {
            int row = assignment.getKeptRow(k);
            Integer pos = positions.get(assignment.getTerminalNode(row));
            checkState(pos != null, "kept row in a leaf without coverage");
            rowCounts[pos]++;
            for (int index = 0; index < variables.length; index++) {
                double value = data.getValue(row, variables[index]);
                if (Double.isNaN(value)) {
                    missing[pos][index]++;
                } else {
                    levelCounts[pos][index][(int) value]++;
                }
            }
        }

        for (int pos = 0; pos < leaves.size(); pos++) {
            for (int index = 0; index < variables.length; index++) {
                estimateGroup(leaves.get(pos), variables[index], levelCounts[pos][index], missing[pos][index],
                        rowCounts[pos], data, result);
            }
        }
        return result;
    }

    void estimateGroup(IndexedLeaf leaf, int variable, int[] counts, int missing, int rowCount, EncodedDataset data,
            List<CategoricalLeafParameters> result) {
        List<String> labels = data.getLevels(variable);
        String name = data.getName(variable);
        LeafBounds bounds = leaf.getBounds();
        int first = bounds.getFirstLevel(variable);
        int last = bounds.getLastLevel(variable, labels.size());
        double naShare = (double) missing / rowCount;

        if (missing == rowCount) {
            if (first > last) {
                // missing values routed past the largest level
                first = 1;
                last = labels.size();
            }
            int admissible = last - first + 1;
            for (int level = first; level <= last; level++) {
                result.add(new CategoricalLeafParameters(leaf.getFIdx(), name, labels.get(level - 1),
                        1.0 / admissible, naShare));
            }
            return;
        }

        int observed = rowCount - missing;
        if (alpha == 0) {
            for (int level = 1; level < counts.length; level++) {
                if (counts[level] > 0) {
                    result.add(new CategoricalLeafParameters(leaf.getFIdx(), name, labels.get(level - 1),
                            (double) counts[level] / observed, naShare));
                }
            }
        } else {
            int admissible = last - first + 1;
            int covered = 0;
            for (int level = first; level <= last; level++) {
                covered += counts[level];
                result.add(new CategoricalLeafParameters(leaf.getFIdx(), name, labels.get(level - 1),
                        (counts[level] + alpha) / (observed + alpha * admissible), naShare));
            }
            checkState(covered == observed, "observed levels of " + name + " outside the leaf region");
        }
    }
}
