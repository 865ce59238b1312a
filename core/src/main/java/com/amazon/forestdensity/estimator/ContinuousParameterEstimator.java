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
import static com.amazon.forestdensity.CommonUtils.checkNotNull;
import static com.amazon.forestdensity.CommonUtils.checkState;
import static com.amazon.forestdensity.CommonUtils.finiteOr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import com.amazon.forestdensity.bounds.LeafBounds;
import com.amazon.forestdensity.circuit.ContinuousLeafParameters;
import com.amazon.forestdensity.config.DistributionFamily;
import com.amazon.forestdensity.config.FiniteBoundsPolicy;
import com.amazon.forestdensity.coverage.LeafAssignment;
import com.amazon.forestdensity.data.ColumnKind;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.index.IndexedLeaf;

/**
 * Estimates, for every leaf of a tree and every continuous variable, the
 * parameters of a truncated normal or uniform distribution from the kept rows
 * terminating in the leaf.
 *
 * Degenerate leaves are repaired so that every output row is usable by a
 * sampler: leaves where all values of a variable are missing get a finite
 * interval and a centered mean, and leaves with zero sample variance get a
 * standard deviation drawn from a prior that places 95% of its mass inside the
 * leaf box. With {@code nu0 = 2} prior degrees of freedom the posterior mode of
 * the variance is {@code 2 / n * sigma0^2}: a single observation returns the
 * prior, and more identical observations shrink it towards zero.
 */
public class ContinuousParameterEstimator {

    /**
     * the smallest width given to an interval built around a single value
     */
    public static final double MIN_RANGE = 1e-12;

    /**
     * the 97.5th percentile of the standard normal distribution
     */
    static final double Z_975 = new NormalDistribution().inverseCumulativeProbability(0.975);

    @Getter
    private final DistributionFamily family;

    @Getter
    private final FiniteBoundsPolicy finiteBounds;

    @Getter
    private final double epsilon;

    public ContinuousParameterEstimator(DistributionFamily family, FiniteBoundsPolicy finiteBounds, double epsilon) {
        checkNotNull(family, "family must not be null");
        checkNotNull(finiteBounds, "finiteBounds must not be null");
        checkArgument(family.isContinuous(), "family must be a continuous family");
        checkArgument(family != DistributionFamily.UNIFORM || finiteBounds != FiniteBoundsPolicy.NONE,
                "the uniform family requires finite bounds");
        checkArgument(epsilon >= 0, "epsilon must be nonnegative");
        this.family = family;
        this.finiteBounds = finiteBounds;
        this.epsilon = epsilon;
    }

    /**
     * Estimates the parameters of the leaves of one tree.
     *
     * @param assignment the terminal nodes and kept rows of the tree
     * @param leaves     the indexed leaves of the tree, in increasing leaf id
     * @param data       the encoded estimation dataset
     * @return one row per (leaf, continuous variable), ordered by leaf and then
     *         by variable
     */
    public List<ContinuousLeafParameters> estimate(LeafAssignment assignment, List<IndexedLeaf> leaves,
            EncodedDataset data) {
        int[] variables = data.getVariables(ColumnKind.CONTINUOUS);
        List<ContinuousLeafParameters> result = new ArrayList<>();
        if (variables.length == 0 || leaves.isEmpty()) {
            return result;
        }

        Map<Integer, Integer> positions = new HashMap<>();
        for (int pos = 0; pos < leaves.size(); pos++) {
            positions.put(leaves.get(pos).getLeaf(), pos);
        }
        int[] rowCounts = new int[leaves.size()];
        SummaryStatistics[][] statistics = new SummaryStatistics[leaves.size()][variables.length];
        for (int pos = 0; pos < leaves.size(); pos++) {
            for (int index = 0; index < variables.length; index++) {
                statistics[pos][index] = new SummaryStatistics();
            }
        }
        for (int k = 0; k < assignment.getNumberOfKeptRows(); k++) {
            int row = assignment.getKeptRow(k);
            Integer pos = positions.get(assignment.getTerminalNode(row));
            checkState(pos != null, "kept row in a leaf without coverage");
            rowCounts[pos]++;
            for (int index = 0; index < variables.length; index++) {
                double value = data.getValue(row, variables[index]);
                if (!Double.isNaN(value)) {
                    statistics[pos][index].addValue(value);
                }
            }
        }

        double replacementRange = replacementRange(statistics);
        for (int pos = 0; pos < leaves.size(); pos++) {
            IndexedLeaf leaf = leaves.get(pos);
            for (int index = 0; index < variables.length; index++) {
                result.add(estimateGroup(leaf, variables[index], statistics[pos][index], rowCounts[pos],
                        replacementRange, data));
            }
        }
        return result;
    }

    /**
     * The width used for intervals around a single value: the smallest positive
     * empirical range in the tree, capped at {@code max(epsilon, MIN_RANGE)}.
     */
    double replacementRange(SummaryStatistics[][] statistics) {
        double smallest = Double.POSITIVE_INFINITY;
        for (SummaryStatistics[] leafStatistics : statistics) {
            for (SummaryStatistics group : leafStatistics) {
                if (group.getN() > 0) {
                    double range = group.getMax() - group.getMin();
                    if (range > 0) {
                        smallest = Math.min(smallest, range);
                    }
                }
            }
        }
        return Math.min(smallest, Math.max(epsilon, MIN_RANGE));
    }

    ContinuousLeafParameters estimateGroup(IndexedLeaf leaf, int variable, SummaryStatistics group, int rowCount,
            double replacementRange, EncodedDataset data) {
        LeafBounds bounds = leaf.getBounds();
        double min = bounds.getMin(variable);
        double max = bounds.getMax(variable);
        long observed = group.getN();
        double naShare = (double) (rowCount - observed) / rowCount;
        double globalMin = data.getGlobalMin(variable);
        double globalMax = data.getGlobalMax(variable);

        if (finiteBounds == FiniteBoundsPolicy.LOCAL && observed > 0) {
            double empiricalMin = group.getMin();
            double empiricalMax = group.getMax();
            double length = empiricalMax - empiricalMin;
            if (length == 0) {
                empiricalMin -= replacementRange / 2;
                empiricalMax += replacementRange / 2;
                length = replacementRange;
            }
            if (Double.isInfinite(min)) {
                min = empiricalMin - length * epsilon / 2;
            }
            if (Double.isInfinite(max)) {
                max = empiricalMax + length * epsilon / 2;
            }
        }

        if (observed == 0) {
            min = finiteOr(min, globalMin);
            max = finiteOr(max, globalMax);
        }

        if (family == DistributionFamily.UNIFORM) {
            return new ContinuousLeafParameters(leaf.getFIdx(), data.getName(variable), min, max, Double.NaN,
                    Double.NaN, naShare);
        }

        double mu;
        double sigma;
        if (observed == 0) {
            mu = (min + max) / 2;
            sigma = 0;
        } else {
            mu = group.getMean();
            sigma = (observed < 2) ? 0 : group.getStandardDeviation();
        }
        if (sigma == 0) {
            sigma = priorStandardDeviation(finiteOr(min, globalMin), finiteOr(max, globalMax), rowCount,
                    replacementRange);
        }
        checkState(sigma > 0, "standard deviation must be positive");
        return new ContinuousLeafParameters(leaf.getFIdx(), data.getName(variable), min, max, mu, sigma, naShare);
    }

    /**
     * The posterior mode of the standard deviation of a leaf whose observed values
     * are all equal.
     *
     * @param lower            the finite lower bound of the leaf
     * @param upper            the finite upper bound of the leaf
     * @param rowCount         the number of rows in the leaf
     * @param replacementRange the width used when the box has no width
     * @return a positive standard deviation
     */
    static double priorStandardDeviation(double lower, double upper, int rowCount, double replacementRange) {
        double halfWidth = (upper - lower) / 2;
        if (!(halfWidth > 0)) {
            halfWidth = replacementRange / 2;
        }
        double sigma0 = halfWidth / Z_975;
        return Math.sqrt(2.0 / rowCount * sigma0 * sigma0);
    }
}
