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
import com.amazon.forestdensity.forest.Forest;
import com.amazon.forestdensity.state.ProbabilisticCircuitMapper;
import com.amazon.forestdensity.state.ProbabilisticCircuitState;
import com.amazon.forestdensity.testutils.MixedTestData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ProbabilisticCircuitMapperBenchmark {
    public static final int NUM_ROWS = 2048;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "10" })
        int numberOfContinuous;

        @Param({ "50" })
        int numberOfTrees;

        ProbabilisticCircuit circuit;
        ProbabilisticCircuitState circuitState;
        String json;

        @Setup(Level.Trial)
        public void setUpCircuit() throws JsonProcessingException {
            MixedTestData testData = new MixedTestData(numberOfContinuous, 2, 4, 0.0, 2);
            double[][] rows = testData.generateTestData(NUM_ROWS, 23);
            Forest forest = ForestDensityEstimatorBenchmark.buildForest(testData, rows, numberOfTrees, 29);
            circuit = ForestDensityEstimator.builder().finiteBounds(FiniteBoundsPolicy.LOCAL).build().estimate(forest,
                    ForestDensityEstimatorBenchmark.buildDataset(testData, rows));
            circuitState = new ProbabilisticCircuitMapper().toState(circuit);
            json = new ObjectMapper().writeValueAsString(circuitState);
        }
    }

    @Benchmark
    public ProbabilisticCircuitState toState(BenchmarkState state) {
        return new ProbabilisticCircuitMapper().toState(state.circuit);
    }

    @Benchmark
    public ProbabilisticCircuit roundTripFromState(BenchmarkState state) {
        ProbabilisticCircuitMapper mapper = new ProbabilisticCircuitMapper();
        return mapper.toModel(mapper.toState(state.circuit));
    }

    @Benchmark
    public String roundTripFromJson(BenchmarkState state) throws JsonProcessingException {
        ObjectMapper jsonMapper = new ObjectMapper();
        ProbabilisticCircuitState circuitState = jsonMapper.readValue(state.json, ProbabilisticCircuitState.class);
        ProbabilisticCircuitMapper mapper = new ProbabilisticCircuitMapper();
        return jsonMapper.writeValueAsString(mapper.toState(mapper.toModel(circuitState)));
    }
}
