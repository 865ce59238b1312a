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

package com.amazon.forestdensity.data;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.forestdensity.ConfigurationException;
import com.amazon.forestdensity.DataException;
import com.amazon.forestdensity.TestUtils;
import com.amazon.forestdensity.forest.Forest;

public class EncodedDatasetTest {

    private Forest forest;

    @BeforeEach
    public void setUp() {
        // the trainer saw the levels in a different order than the column lists them
        forest = Forest.builder().numberOfSamples(4).numberOfVariables(2).addTree(TestUtils.singleSplit(1, 1.5, null))
                .levels(1, List.of("red", "green", "blue")).build();
    }

    @Test
    public void testEncoding() {
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { 1.25, -3, Double.NaN, 10.5 })
                .addCategorical("color", List.of("blue", "green", "red"), new String[] { "blue", null, "red", "green" })
                .build();
        EncodedDataset data = new EncodedDataset(dataset, forest);

        assertEquals(4, data.getNumberOfRows());
        assertEquals(2, data.getNumberOfVariables());
        assertArrayEquals(new double[] { 1.25, 3 }, data.getRow(0));
        assertTrue(Double.isNaN(data.getValue(1, 1)));
        assertTrue(Double.isNaN(data.getValue(2, 0)));
        assertEquals(1, data.getValue(2, 1));
        assertEquals(2, data.getValue(3, 1));

        assertEquals("x", data.getName(0));
        assertTrue(data.isContinuous(0));
        assertFalse(data.isContinuous(1));
        assertEquals(ColumnKind.CATEGORICAL, data.getKind(1));
        assertArrayEquals(new int[] { 0 }, data.getVariables(ColumnKind.CONTINUOUS));
        assertArrayEquals(new int[] { 1 }, data.getVariables(ColumnKind.CATEGORICAL));

        assertEquals(-3, data.getGlobalMin(0));
        assertEquals(10.5, data.getGlobalMax(0));
        assertEquals(2, data.getDecimals(0));
        assertEquals(-1, data.getDecimals(1));
        assertEquals(List.of("red", "green", "blue"), data.getLevels(1));
    }

    @Test
    public void testColumnLevelsUsedWithoutTrainerLevels() {
        Forest unlabeled = Forest.builder().numberOfSamples(2).numberOfVariables(1).addTree(TestUtils.stump(null))
                .build();
        Dataset dataset = Dataset.builder().addCategorical("c", List.of("u", "v"), new String[] { "v", "u" }).build();
        EncodedDataset data = new EncodedDataset(dataset, unlabeled);
        assertEquals(2, data.getValue(0, 0));
        assertEquals(1, data.getValue(1, 0));
    }

    @Test
    public void testColumnCountMismatch() {
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { 1, 2 }).build();
        assertThrows(ConfigurationException.class, () -> new EncodedDataset(dataset, forest));
    }

    @Test
    public void testSplitVariableOutOfRange() {
        Forest wide = Forest.builder().numberOfSamples(2).numberOfVariables(1)
                .addTree(TestUtils.singleSplit(3, 0.5, null)).build();
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { 1, 2 }).build();
        assertThrows(DataException.class, () -> new EncodedDataset(dataset, wide));
    }

    @Test
    public void testInfiniteValue() {
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { 1, Double.POSITIVE_INFINITY })
                .addCategorical("color", List.of("red"), new String[] { "red", "red" }).build();
        assertThrows(DataException.class, () -> new EncodedDataset(dataset, forest));
    }

    @Test
    public void testContinuousColumnWithoutObservedValues() {
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { Double.NaN, Double.NaN })
                .addCategorical("color", List.of("red"), new String[] { "red", "red" }).build();
        assertThrows(DataException.class, () -> new EncodedDataset(dataset, forest));
    }

    @Test
    public void testLevelUnknownToTrainer() {
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { 1, 2 })
                .addCategorical("color", List.of("red", "purple"), new String[] { "red", "purple" }).build();
        assertThrows(DataException.class, () -> new EncodedDataset(dataset, forest));
    }

    @Test
    public void testInvalidColumns() {
        assertThrows(DataException.class,
                () -> new CategoricalColumn("c", List.of("a"), new String[] { "a", "b" }));
        assertThrows(IllegalArgumentException.class,
                () -> new CategoricalColumn("c", List.of("a", "a"), new String[] { "a" }));
        assertThrows(IllegalArgumentException.class, () -> Dataset.builder().addContinuous("x", new double[] { 1 })
                .addContinuous("y", new double[] { 1, 2 }).build());
        assertThrows(IllegalArgumentException.class, () -> Dataset.builder().addContinuous("x", new double[] { 1 })
                .addContinuous("x", new double[] { 2 }).build());
    }
}
