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

package com.amazon.forestdensity.circuit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.junit.jupiter.api.Test;

import com.amazon.forestdensity.TestUtils;
import com.amazon.forestdensity.bounds.TreeBoundExtractor;
import com.amazon.forestdensity.config.DistributionFamily;
import com.amazon.forestdensity.coverage.LeafCoverage;
import com.amazon.forestdensity.data.CategoricalColumn;
import com.amazon.forestdensity.data.ColumnKind;
import com.amazon.forestdensity.data.ContinuousColumn;
import com.amazon.forestdensity.data.Dataset;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.forest.Forest;
import com.amazon.forestdensity.index.GlobalLeafIndexer;
import com.amazon.forestdensity.index.LeafIndex;

public class CircuitAssemblerTest {

    @Test
    public void testAssemble() {
        Forest forest = Forest.builder().numberOfSamples(3).numberOfVariables(2)
                .addTree(TestUtils.singleSplit(0, 1.5, null)).build();
        Dataset dataset = Dataset.builder()
                .addColumn(new ContinuousColumn("age", new double[] { 1, 2, 3 }, Integer.class))
                .addColumn(new CategoricalColumn("flag", List.of("no", "yes"), new String[] { "no", "yes", "no" },
                        Boolean.class))
                .inputType("table").build();
        EncodedDataset data = new EncodedDataset(dataset, forest);
        List<LeafCoverage> coverage = List.of(new LeafCoverage(0, 1, 1, 1.0 / 3),
                new LeafCoverage(0, 2, 2, 2.0 / 3));
        LeafIndex index = new GlobalLeafIndexer()
                .index(TreeBoundExtractor.unbounded(2).extract(0, forest.getTree(0)), coverage);
        List<ContinuousLeafParameters> continuous = List
                .of(new ContinuousLeafParameters(1, "age", 0, 1.5, 1, 0.1, 0));
        List<CategoricalLeafParameters> categorical = List.of(new CategoricalLeafParameters(2, "flag", "no", 1, 0));

        ProbabilisticCircuit circuit = new CircuitAssembler(DistributionFamily.UNIFORM).assemble(index, continuous,
                categorical, dataset, data);

        assertEquals(2, circuit.getNumberOfLeaves());
        assertEquals(2, circuit.getLeaves().get(1).getFIdx());
        assertEquals(2, circuit.getLeaves().get(1).getLeaf());
        assertEquals(2.0 / 3, circuit.getLeaves().get(1).getCoverage());
        assertSame(continuous.get(0), circuit.getContinuousParameters().get(0));
        assertSame(categorical.get(0), circuit.getCategoricalParameters().get(0));

        VariableMetadata age = circuit.getMetadata().get(0);
        assertEquals("Integer", age.getTypeClass());
        assertEquals(ColumnKind.CONTINUOUS, age.getKind());
        assertEquals(DistributionFamily.UNIFORM, age.getFamily());
        assertEquals(OptionalInt.of(0), age.getDecimals());
        VariableMetadata flag = circuit.getMetadata().get(1);
        assertEquals("Boolean", flag.getTypeClass());
        assertEquals(DistributionFamily.MULTINOMIAL, flag.getFamily());
        assertEquals(OptionalInt.empty(), flag.getDecimals());

        assertEquals(List.of("no", "yes"), circuit.getLevels().get("flag"));
        assertEquals(1, circuit.getLevels().size());
        assertEquals("table", circuit.getInputType());
    }

    @Test
    public void testCircuitIsImmutable() {
        ProbabilisticCircuit circuit = new ProbabilisticCircuit(List.of(), List.of(),
                List.of(new CircuitLeaf(1, 0, 0, 1.0)), List.of(), Map.of("c", List.of("a")), "Dataset");
        assertThrows(UnsupportedOperationException.class, () -> circuit.getLeaves().clear());
        assertThrows(UnsupportedOperationException.class, () -> circuit.getLevels().put("d", List.of()));
        assertThrows(UnsupportedOperationException.class, () -> circuit.getLevels().get("c").add("b"));
    }
}
