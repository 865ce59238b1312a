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

import static com.amazon.forestdensity.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.forestdensity.TestUtils;
import com.amazon.forestdensity.bounds.LeafBounds;
import com.amazon.forestdensity.bounds.TreeBoundExtractor;
import com.amazon.forestdensity.circuit.CategoricalLeafParameters;
import com.amazon.forestdensity.config.SamplingPolicy;
import com.amazon.forestdensity.coverage.CoverageEstimator;
import com.amazon.forestdensity.coverage.LeafAssignment;
import com.amazon.forestdensity.data.ColumnKind;
import com.amazon.forestdensity.data.Dataset;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.forest.DecisionTree;
import com.amazon.forestdensity.forest.Forest;
import com.amazon.forestdensity.index.GlobalLeafIndexer;
import com.amazon.forestdensity.index.LeafIndex;
import com.amazon.forestdensity.testutils.MixedTestData;

public class CategoricalParameterEstimatorTest {

    private static final List<String> LEVELS = List.of("a", "b", "c");

    private static List<CategoricalLeafParameters> estimateSingleTree(double alpha, DecisionTree tree,
            Dataset dataset) {
        Forest.Builder<?> builder = Forest.builder().numberOfSamples(dataset.getNumberOfRows())
                .numberOfVariables(dataset.getNumberOfColumns()).addTree(tree);
        for (int j = 0; j < dataset.getNumberOfColumns(); j++) {
            if (dataset.getColumn(j).getKind() == ColumnKind.CATEGORICAL) {
                builder.levels(j, LEVELS);
            }
        }
        EncodedDataset data = new EncodedDataset(dataset, builder.build());
        CoverageEstimator coverageEstimator = new CoverageEstimator(SamplingPolicy.ALL);
        LeafAssignment assignment = coverageEstimator.assign(0, tree, data);
        LeafIndex index = new GlobalLeafIndexer().index(
                TreeBoundExtractor.unbounded(data.getNumberOfVariables()).extract(0, tree),
                coverageEstimator.estimate(assignment, tree));
        return new CategoricalParameterEstimator(alpha).estimate(assignment, index.getLeavesOfTree(0), data);
    }

    private static Map<String, Double> probabilities(List<CategoricalLeafParameters> result, int fIdx) {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        result.stream().filter(parameters -> parameters.getFIdx() == fIdx)
                .forEach(parameters -> probabilities.put(parameters.getLevel(), parameters.getProb()));
        return probabilities;
    }

    @Test
    public void testLaplaceSmoothing() {
        Dataset dataset = Dataset.builder().addCategorical("c", LEVELS, new String[] { "a", "a" }).build();
        List<CategoricalLeafParameters> result = estimateSingleTree(1.0, TestUtils.stump(null), dataset);

        assertEquals(List.of("a", "b", "c"),
                result.stream().map(CategoricalLeafParameters::getLevel).collect(Collectors.toList()));
        assertEquals(0.6, result.get(0).getProb(), EPSILON);
        assertEquals(0.2, result.get(1).getProb(), EPSILON);
        assertEquals(0.2, result.get(2).getProb(), EPSILON);
        assertTrue(result.stream().allMatch(parameters -> parameters.getNaShare() == 0.0));
        assertTrue(result.stream().allMatch(parameters -> "c".equals(parameters.getVariable())));
    }

    @Test
    public void testObservedFrequencies() {
        Dataset dataset = Dataset.builder().addCategorical("c", LEVELS, new String[] { "a", "c", "a", null, "a" })
                .build();
        List<CategoricalLeafParameters> result = estimateSingleTree(0.0, TestUtils.stump(null), dataset);

        assertEquals(2, result.size());
        assertEquals("a", result.get(0).getLevel());
        assertEquals(0.75, result.get(0).getProb(), EPSILON);
        assertEquals("c", result.get(1).getLevel());
        assertEquals(0.25, result.get(1).getProb(), EPSILON);
        assertEquals(0.2, result.get(0).getNaShare(), EPSILON);
    }

    @Test
    public void testAllMissingLeafIsUniformOverItsLevels() {
        // 0: c <= 1.5 ? 1 : 2
        // 2: y <= 2.5 ? 3 : 4, and node 4 only holds rows with c missing
        DecisionTree tree = new DecisionTree(new int[] { 0, 0, 1, 0, 0 }, new double[] { 1.5, 0, 2.5, 0, 0 },
                new int[] { 1, 0, 3, 0, 0 }, new int[] { 2, 0, 4, 0, 0 });
        Dataset dataset = Dataset.builder().addCategorical("c", LEVELS, new String[] { "a", "b", "c", null, null })
                .addContinuous("y", new double[] { 1, 1, 2, 3, 4 }).build();

        List<CategoricalLeafParameters> observed = estimateSingleTree(0.0, tree, dataset);
        assertEquals(Map.of("a", 1.0), probabilities(observed, 1));
        assertEquals(Map.of("b", 0.5, "c", 0.5), probabilities(observed, 2));
        assertEquals(Map.of("b", 0.5, "c", 0.5), probabilities(observed, 3));
        assertTrue(observed.stream().filter(parameters -> parameters.getFIdx() == 3)
                .allMatch(parameters -> parameters.getNaShare() == 1.0));

        List<CategoricalLeafParameters> smoothed = estimateSingleTree(1.0, tree, dataset);
        assertEquals(Map.of("a", 1.0), probabilities(smoothed, 1));
        assertEquals(Map.of("b", 0.5, "c", 0.5), probabilities(smoothed, 3));
    }

    @Test
    public void testAllMissingLeafBeyondTheLevels() {
        // missing values are routed right of the largest level
        Dataset dataset = Dataset.builder().addCategorical("c", LEVELS, new String[] { "a", "c", null, null })
                .build();
        List<CategoricalLeafParameters> result = estimateSingleTree(0.0, TestUtils.singleSplit(0, 3, null),
                dataset);
        Map<String, Double> missing = probabilities(result, 2);
        assertEquals(3, missing.size());
        missing.values().forEach(prob -> assertEquals(1.0 / 3, prob, EPSILON));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 0.5, 2.0 })
    public void testRandomForestProbabilitiesSumToOne(double alpha) {
        MixedTestData generator = new MixedTestData(1, 3, 5, 0.1, 1);
        double[][] rows = generator.generateTestData(400, 59);
        Forest forest = TestUtils.randomForest(generator, rows, 8, 61);
        EncodedDataset data = new EncodedDataset(TestUtils.toDataset(generator, rows), forest);
        CategoricalParameterEstimator estimator = new CategoricalParameterEstimator(alpha);
        CoverageEstimator coverageEstimator = new CoverageEstimator(SamplingPolicy.ALL);
        TreeBoundExtractor extractor = TreeBoundExtractor.unbounded(data.getNumberOfVariables());

        for (int t = 0; t < forest.getNumberOfTrees(); t++) {
            DecisionTree tree = forest.getTree(t);
            LeafAssignment assignment = coverageEstimator.assign(t, tree, data);
            LeafIndex index = new GlobalLeafIndexer().index(extractor.extract(t, tree),
                    coverageEstimator.estimate(assignment, tree));
            List<CategoricalLeafParameters> result = estimator.estimate(assignment, index.getLeavesOfTree(t), data);

            Map<String, List<CategoricalLeafParameters>> groups = result.stream().collect(
                    Collectors.groupingBy(parameters -> parameters.getFIdx() + "/" + parameters.getVariable()));
            assertEquals(index.size() * 3, groups.size());
            for (List<CategoricalLeafParameters> group : groups.values()) {
                double sum = 0;
                for (CategoricalLeafParameters parameters : group) {
                    assertTrue(parameters.getProb() > 0);
                    assertTrue(parameters.getNaShare() >= 0 && parameters.getNaShare() <= 1);
                    sum += parameters.getProb();
                }
                assertEquals(1.0, sum, EPSILON);

                CategoricalLeafParameters first = group.get(0);
                if (alpha > 0 && first.getNaShare() < 1) {
                    LeafBounds bounds = index.get(first.getFIdx()).getBounds();
                    int variable = Integer.parseInt(first.getVariable().substring(3));
                    int admissible = bounds.getLastLevel(variable, 5) - bounds.getFirstLevel(variable) + 1;
                    assertEquals(admissible, group.size());
                }
            }

            List<Integer> order = new ArrayList<>();
            result.forEach(parameters -> order.add(parameters.getFIdx()));
            for (int i = 1; i < order.size(); i++) {
                assertTrue(order.get(i - 1) <= order.get(i));
            }
        }
    }

    @Test
    public void testNegativeAlpha() {
        assertThrows(IllegalArgumentException.class, () -> new CategoricalParameterEstimator(-1));
    }
}
