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

package com.amazon.forestdensity;

import static com.amazon.forestdensity.CommonUtils.checkConfiguration;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.forestdensity.bounds.LeafBounds;
import com.amazon.forestdensity.bounds.TreeBoundExtractor;
import com.amazon.forestdensity.circuit.CategoricalLeafParameters;
import com.amazon.forestdensity.circuit.CircuitAssembler;
import com.amazon.forestdensity.circuit.ContinuousLeafParameters;
import com.amazon.forestdensity.circuit.ProbabilisticCircuit;
import com.amazon.forestdensity.config.DistributionFamily;
import com.amazon.forestdensity.config.FiniteBoundsPolicy;
import com.amazon.forestdensity.config.SamplingPolicy;
import com.amazon.forestdensity.coverage.CoverageEstimator;
import com.amazon.forestdensity.coverage.LeafAssignment;
import com.amazon.forestdensity.coverage.LeafCoverage;
import com.amazon.forestdensity.data.Dataset;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.estimator.CategoricalParameterEstimator;
import com.amazon.forestdensity.estimator.ContinuousParameterEstimator;
import com.amazon.forestdensity.executor.AbstractTreeExecutor;
import com.amazon.forestdensity.executor.ParallelTreeExecutor;
import com.amazon.forestdensity.executor.SequentialTreeExecutor;
import com.amazon.forestdensity.forest.Forest;
import com.amazon.forestdensity.index.GlobalLeafIndexer;
import com.amazon.forestdensity.index.IndexedLeaf;
import com.amazon.forestdensity.index.LeafIndex;

/**
 * The ForestDensityEstimator class is the entry point to the algorithms in this
 * package. It turns a trained forest and an estimation dataset into a
 * {@link ProbabilisticCircuit}: every leaf of every tree becomes a mixture
 * component weighted by its coverage, with one distribution per variable.
 *
 * Estimation runs in two passes over the trees. The first pass computes the
 * bounds of every leaf and the coverage of the leaves under the sampling
 * policy; the leaves are then numbered across the forest. The second pass
 * routes the rows again and estimates the continuous and categorical
 * parameters of every leaf. Both passes treat the trees independently and may
 * run in parallel; their results are concatenated in tree order, so the output
 * does not depend on the execution mode.
 *
 * An estimator holds no state between calls; {@link #estimate} is a
 * deterministic function of its arguments.
 */
public class ForestDensityEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ForestDensityEstimator.class);

    /**
     * Default sampling policy: every row is used for every tree.
     */
    public static final SamplingPolicy DEFAULT_SAMPLING_POLICY = SamplingPolicy.ALL;

    /**
     * Default distribution of continuous variables.
     */
    public static final DistributionFamily DEFAULT_FAMILY = DistributionFamily.TRUNCATED_NORMAL;

    /**
     * Default treatment of infinite bounds: they are kept.
     */
    public static final FiniteBoundsPolicy DEFAULT_FINITE_BOUNDS = FiniteBoundsPolicy.NONE;

    /**
     * Default pseudocount for categorical variables, which disables smoothing.
     */
    public static final double DEFAULT_ALPHA = 0.0;

    /**
     * Default slack on empirical bounds.
     */
    public static final double DEFAULT_EPSILON = 0.0;

    /**
     * Parallel execution is enabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = true;

    @Getter
    private final SamplingPolicy samplingPolicy;

    @Getter
    private final DistributionFamily family;

    /**
     * The policy actually applied, which may differ from the requested one for the
     * uniform family.
     */
    @Getter
    private final FiniteBoundsPolicy finiteBounds;

    @Getter
    private final double alpha;

    @Getter
    private final double epsilon;

    @Getter
    private final boolean parallelExecutionEnabled;

    @Getter
    private final int threadPoolSize;

    private final AbstractTreeExecutor executor;
    private final CoverageEstimator coverageEstimator;
    private final GlobalLeafIndexer indexer;
    private final ContinuousParameterEstimator continuousEstimator;
    private final CategoricalParameterEstimator categoricalEstimator;
    private final CircuitAssembler assembler;

    public ForestDensityEstimator(Builder<?> builder) {
        checkNotNull(builder.samplingPolicy, "samplingPolicy must not be null");
        checkNotNull(builder.family, "family must not be null");
        checkNotNull(builder.finiteBounds, "finiteBounds must not be null");
        checkConfiguration(builder.family.isContinuous(), "family not recognized: " + builder.family);
        checkConfiguration(builder.alpha >= 0, "alpha must be nonnegative");
        checkConfiguration(builder.epsilon >= 0, "epsilon must be nonnegative");
        builder.threadPoolSize.ifPresent(n -> checkConfiguration(n > 0 || !builder.parallelExecutionEnabled,
                "threadPoolSize must be greater than 0. To disable thread pool, set parallel execution to 'false'."));

        samplingPolicy = builder.samplingPolicy;
        family = builder.family;
        alpha = builder.alpha;
        epsilon = builder.epsilon;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;

        if (family == DistributionFamily.UNIFORM && builder.finiteBounds == FiniteBoundsPolicy.NONE) {
            LOG.warn("Density estimation with uniform distribution requires finite bounds. "
                    + "Resetting finiteBounds to LOCAL.");
            finiteBounds = FiniteBoundsPolicy.LOCAL;
        } else {
            finiteBounds = builder.finiteBounds;
        }

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            executor = new ParallelTreeExecutor(threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialTreeExecutor();
        }

        coverageEstimator = new CoverageEstimator(samplingPolicy);
        indexer = new GlobalLeafIndexer();
        continuousEstimator = new ContinuousParameterEstimator(family, finiteBounds, epsilon);
        categoricalEstimator = new CategoricalParameterEstimator(alpha);
        assembler = new CircuitAssembler(family);
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Estimates the probabilistic circuit of a forest. The configuration is
     * checked against the forest and the dataset before any computation starts;
     * a failed check aborts the estimation.
     *
     * @param forest  the trained forest
     * @param dataset the rows used for estimation; column i must hold the variable
     *                the forest refers to as split variable i
     * @return the circuit
     * @throws ConfigurationException if the options cannot be applied to the forest
     *                                and dataset
     * @throws DataException          if the dataset or the forest holds values a
     *                                circuit cannot represent
     */
    public ProbabilisticCircuit estimate(Forest forest, Dataset dataset) {
        checkNotNull(forest, "forest must not be null");
        checkNotNull(dataset, "dataset must not be null");
        coverageEstimator.validate(forest, dataset.getNumberOfRows());
        EncodedDataset data = new EncodedDataset(dataset, forest);

        TreeBoundExtractor extractor = (finiteBounds == FiniteBoundsPolicy.GLOBAL)
                ? TreeBoundExtractor.globallyBounded(data, epsilon)
                : TreeBoundExtractor.unbounded(data.getNumberOfVariables());

        List<TreeLeaves> treeLeaves = executor.traverseTrees(forest, (treeIndex, tree) -> {
            LeafAssignment assignment = coverageEstimator.assign(treeIndex, tree, data);
            return new TreeLeaves(extractor.extract(treeIndex, tree), coverageEstimator.estimate(assignment, tree));
        }, Collectors.toList());

        List<LeafBounds> bounds = new ArrayList<>();
        List<LeafCoverage> coverage = new ArrayList<>();
        for (TreeLeaves leaves : treeLeaves) {
            bounds.addAll(leaves.bounds);
            coverage.addAll(leaves.coverage);
        }
        LeafIndex leafIndex = indexer.index(bounds, coverage);
        LOG.debug("indexed {} of {} leaves over {} trees", leafIndex.size(), bounds.size(),
                forest.getNumberOfTrees());

        List<TreeParameters> treeParameters = executor.traverseTrees(forest, (treeIndex, tree) -> {
            LeafAssignment assignment = coverageEstimator.assign(treeIndex, tree, data);
            List<IndexedLeaf> leaves = leafIndex.getLeavesOfTree(treeIndex);
            return new TreeParameters(continuousEstimator.estimate(assignment, leaves, data),
                    categoricalEstimator.estimate(assignment, leaves, data));
        }, Collectors.toList());

        List<ContinuousLeafParameters> continuous = new ArrayList<>();
        List<CategoricalLeafParameters> categorical = new ArrayList<>();
        for (TreeParameters parameters : treeParameters) {
            continuous.addAll(parameters.continuous);
            categorical.addAll(parameters.categorical);
        }
        LOG.debug("estimated {} continuous and {} categorical parameter rows", continuous.size(),
                categorical.size());

        return assembler.assemble(leafIndex, continuous, categorical, dataset, data);
    }

    private static class TreeLeaves {
        private final List<LeafBounds> bounds;
        private final List<LeafCoverage> coverage;

        TreeLeaves(List<LeafBounds> bounds, List<LeafCoverage> coverage) {
            this.bounds = bounds;
            this.coverage = coverage;
        }
    }

    private static class TreeParameters {
        private final List<ContinuousLeafParameters> continuous;
        private final List<CategoricalLeafParameters> categorical;

        TreeParameters(List<ContinuousLeafParameters> continuous, List<CategoricalLeafParameters> categorical) {
            this.continuous = continuous;
            this.categorical = categorical;
        }
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private SamplingPolicy samplingPolicy = DEFAULT_SAMPLING_POLICY;
        private DistributionFamily family = DEFAULT_FAMILY;
        private FiniteBoundsPolicy finiteBounds = DEFAULT_FINITE_BOUNDS;
        private double alpha = DEFAULT_ALPHA;
        private double epsilon = DEFAULT_EPSILON;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T samplingPolicy(SamplingPolicy samplingPolicy) {
            this.samplingPolicy = samplingPolicy;
            return (T) this;
        }

        public T samplingPolicy(String name) {
            return samplingPolicy(SamplingPolicy.fromName(name));
        }

        public T family(DistributionFamily family) {
            this.family = family;
            return (T) this;
        }

        public T family(String name) {
            return family(DistributionFamily.fromName(name));
        }

        public T finiteBounds(FiniteBoundsPolicy finiteBounds) {
            this.finiteBounds = finiteBounds;
            return (T) this;
        }

        public T finiteBounds(String name) {
            return finiteBounds(FiniteBoundsPolicy.fromName(name));
        }

        public T alpha(double alpha) {
            this.alpha = alpha;
            return (T) this;
        }

        public T epsilon(double epsilon) {
            this.epsilon = epsilon;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public ForestDensityEstimator build() {
            return new ForestDensityEstimator(this);
        }
    }
}
