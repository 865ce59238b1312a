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

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.forestdensity.circuit.ProbabilisticCircuit;
import com.amazon.forestdensity.config.FiniteBoundsPolicy;
import com.amazon.forestdensity.config.SamplingPolicy;
import com.amazon.forestdensity.data.Dataset;
import com.amazon.forestdensity.forest.DecisionTree;
import com.amazon.forestdensity.forest.Forest;
import com.amazon.forestdensity.testutils.MixedTestData;
import com.amazon.forestdensity.testutils.RandomTreeGenerator;
import com.amazon.forestdensity.testutils.TreeArrays;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class ForestDensityEstimatorBenchmark {

    public final static int DATA_SIZE = 10_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "4", "16" })
        int numberOfContinuous;

        @Param({ "50", "200" })
        int numberOfTrees;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        @Param({ "ALL", "OUT_OF_BAG" })
        SamplingPolicy samplingPolicy;

        Forest forest;
        Dataset dataset;

        @Setup(Level.Trial)
        public void setUpData() {
            MixedTestData testData = new MixedTestData(numberOfContinuous, 2, 5, 0.05, 3);
            double[][] rows = testData.generateTestData(DATA_SIZE, 17);
            forest = buildForest(testData, rows, numberOfTrees, 19);
            dataset = buildDataset(testData, rows);
        }
    }

    static Forest buildForest(MixedTestData testData, double[][] rows, int numberOfTrees, long seed) {
        List<TreeArrays> trees = new RandomTreeGenerator(10, 20).generateForest(rows,
                testData.getCategoricalColumns(), numberOfTrees, seed);
        Forest.Builder<?> builder = Forest.builder().numberOfSamples(rows.length)
                .numberOfVariables(testData.getNumberOfColumns());
        for (TreeArrays tree : trees) {
            builder.addTree(new DecisionTree(tree.splitVariables, tree.splitValues, tree.leftChildren,
                    tree.rightChildren, tree.inBagCounts));
        }
        for (int j = 0; j < testData.getNumberOfColumns(); j++) {
            if (testData.isCategorical(j)) {
                builder.levels(j, testData.getLevels());
            }
        }
        return builder.build();
    }

    static Dataset buildDataset(MixedTestData testData, double[][] rows) {
        Dataset.Builder<?> builder = Dataset.builder();
        for (int j = 0; j < testData.getNumberOfColumns(); j++) {
            if (testData.isCategorical(j)) {
                builder.addCategorical("c" + j, testData.getLevels(), MixedTestData.categoricalColumn(rows, j));
            } else {
                builder.addContinuous("x" + j, MixedTestData.continuousColumn(rows, j));
            }
        }
        return builder.build();
    }

    @Benchmark
    public ProbabilisticCircuit estimateTruncatedNormal(BenchmarkState state) {
        ForestDensityEstimator estimator = ForestDensityEstimator.builder().samplingPolicy(state.samplingPolicy)
                .parallelExecutionEnabled(state.parallelExecutionEnabled).alpha(0.1).build();
        return estimator.estimate(state.forest, state.dataset);
    }

    @Benchmark
    public ProbabilisticCircuit estimateUniform(BenchmarkState state) {
        ForestDensityEstimator estimator = ForestDensityEstimator.builder().samplingPolicy(state.samplingPolicy)
                .parallelExecutionEnabled(state.parallelExecutionEnabled).family("unif")
                .finiteBounds(FiniteBoundsPolicy.GLOBAL).epsilon(0.1).build();
        return estimator.estimate(state.forest, state.dataset);
    }
}
