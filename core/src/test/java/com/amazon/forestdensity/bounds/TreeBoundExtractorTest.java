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

import static com.amazon.forestdensity.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.forestdensity.TestUtils;
import com.amazon.forestdensity.data.Dataset;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.forest.DecisionTree;
import com.amazon.forestdensity.forest.Forest;
import com.amazon.forestdensity.testutils.MixedTestData;

public class TreeBoundExtractorTest {

    private static final double INF = Double.POSITIVE_INFINITY;

    private DecisionTree tree;
    private TreeBoundExtractor extractor;

    @BeforeEach
    public void setUp() {
        // 0: x0 <= 5 ? 1 : 2
        // 1: x1 <= 2 ? 3 : 4
        // 2: pruned, both children are 5
        tree = new DecisionTree(new int[] { 0, 1, 0, 0, 0, 0 }, new double[] { 5, 2, 7, 0, 0, 0 },
                new int[] { 1, 3, 5, 0, 0, 0 }, new int[] { 2, 4, 5, 0, 0, 0 });
        extractor = TreeBoundExtractor.unbounded(2);
    }

    @Test
    public void testNodeBounds() {
        NodeBounds bounds = extractor.computeNodeBounds(tree);
        assertEquals(6, bounds.getNumberOfNodes());

        assertEquals(-INF, bounds.getMin(0, 0));
        assertEquals(INF, bounds.getMax(0, 0));

        assertEquals(-INF, bounds.getMin(1, 0));
        assertEquals(5, bounds.getMax(1, 0));
        assertEquals(5, bounds.getMin(2, 0));
        assertEquals(INF, bounds.getMax(2, 0));

        assertEquals(-INF, bounds.getMin(3, 1));
        assertEquals(2, bounds.getMax(3, 1));
        assertEquals(2, bounds.getMin(4, 1));
        assertEquals(INF, bounds.getMax(4, 1));
        assertEquals(5, bounds.getMax(3, 0));
        assertEquals(5, bounds.getMax(4, 0));
    }

    @Test
    public void testPrunedNodeInheritsBounds() {
        NodeBounds bounds = extractor.computeNodeBounds(tree);
        for (int variable = 0; variable < 2; variable++) {
            assertEquals(bounds.getMin(2, variable), bounds.getMin(5, variable));
            assertEquals(bounds.getMax(2, variable), bounds.getMax(5, variable));
        }
    }

    @Test
    public void testExtractLeaves() {
        List<LeafBounds> leaves = extractor.extract(3, tree);
        assertEquals(List.of(3, 4, 5), leaves.stream().map(LeafBounds::getLeaf).collect(Collectors.toList()));
        assertTrue(leaves.stream().allMatch(leaf -> leaf.getTree() == 3));
        LeafBounds leaf = leaves.get(1);
        assertEquals(2, leaf.getNumberOfVariables());
        assertEquals(-INF, leaf.getMin(0));
        assertEquals(5, leaf.getMax(0));
        assertEquals(2, leaf.getMin(1));
        assertEquals(INF, leaf.getMax(1));
    }

    @Test
    public void testSingleLeafTree() {
        List<LeafBounds> leaves = extractor.extract(0, TestUtils.stump(null));
        assertEquals(1, leaves.size());
        assertEquals(0, leaves.get(0).getLeaf());
        assertEquals(-INF, leaves.get(0).getMin(1));
        assertEquals(INF, leaves.get(0).getMax(1));
    }

    @Test
    public void testGloballyBounded() {
        Dataset dataset = Dataset.builder().addContinuous("x", new double[] { 1, 3, Double.NaN, 5 })
                .addCategorical("c", List.of("a", "b"), new String[] { "a", "b", "a", null }).build();
        Forest forest = Forest.builder().numberOfSamples(4).numberOfVariables(2)
                .addTree(TestUtils.singleSplit(0, 2, null)).build();
        EncodedDataset data = new EncodedDataset(dataset, forest);

        TreeBoundExtractor global = TreeBoundExtractor.globallyBounded(data, 0.5);
        List<LeafBounds> leaves = global.extract(0, forest.getTree(0));
        // gap 4 widened by 0.5 / 2 * 4 = 1 on each side
        assertEquals(0, leaves.get(0).getMin(0), EPSILON);
        assertEquals(2, leaves.get(0).getMax(0), EPSILON);
        assertEquals(2, leaves.get(1).getMin(0), EPSILON);
        assertEquals(6, leaves.get(1).getMax(0), EPSILON);
        assertEquals(-INF, leaves.get(1).getMin(1));
        assertEquals(INF, leaves.get(1).getMax(1));
    }

    @Test
    public void testLevelRange() {
        LeafBounds unbounded = new LeafBounds(0, 0, new double[] { -INF }, new double[] { INF });
        assertEquals(1, unbounded.getFirstLevel(0));
        assertEquals(4, unbounded.getLastLevel(0, 4));

        LeafBounds halfIntegers = new LeafBounds(0, 0, new double[] { 1.5 }, new double[] { 3.5 });
        assertEquals(2, halfIntegers.getFirstLevel(0));
        assertEquals(3, halfIntegers.getLastLevel(0, 4));

        // integral split values: L <= 2 goes left, so the right child starts at 3
        LeafBounds integers = new LeafBounds(0, 0, new double[] { 2 }, new double[] { 4 });
        assertEquals(3, integers.getFirstLevel(0));
        assertEquals(4, integers.getLastLevel(0, 4));
    }

    @Test
    public void testInvalidRootBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new TreeBoundExtractor(new double[] { 1 }, new double[] { 0 }));
        assertThrows(IllegalArgumentException.class,
                () -> new TreeBoundExtractor(new double[] { 1 }, new double[] { 2, 3 }));
        assertThrows(IllegalArgumentException.class, () -> TreeBoundExtractor.unbounded(1).computeNodeBounds(tree));
    }

    @Test
    public void testChildrenPartitionTheirParent() {
        MixedTestData generator = new MixedTestData(3, 2, 5, 0.0, 2);
        double[][] rows = generator.generateTestData(400, 11);
        Forest forest = TestUtils.randomForest(generator, rows, 10, 17);
        TreeBoundExtractor unbounded = TreeBoundExtractor.unbounded(generator.getNumberOfColumns());

        for (DecisionTree randomTree : forest.getTrees()) {
            NodeBounds bounds = unbounded.computeNodeBounds(randomTree);
            for (int node = 0; node < randomTree.getNumberOfNodes(); node++) {
                if (randomTree.isLeaf(node)) {
                    continue;
                }
                int left = randomTree.getLeftChild(node);
                int right = randomTree.getRightChild(node);
                int splitVariable = randomTree.getSplitVariable(node);
                assertEquals(bounds.getMax(left, splitVariable), bounds.getMin(right, splitVariable));
                for (int variable = 0; variable < generator.getNumberOfColumns(); variable++) {
                    for (int child : new int[] { left, right }) {
                        assertTrue(bounds.getMin(child, variable) >= bounds.getMin(node, variable));
                        assertTrue(bounds.getMax(child, variable) <= bounds.getMax(node, variable));
                        if (variable != splitVariable) {
                            assertEquals(bounds.getMin(node, variable), bounds.getMin(child, variable));
                            assertEquals(bounds.getMax(node, variable), bounds.getMax(child, variable));
                        }
                    }
                }
            }
        }
    }

    @Test
    public void testEveryRowLiesInExactlyItsTerminalLeaf() {
        MixedTestData generator = new MixedTestData(2, 2, 3, 0.0, 1);
        double[][] rows = generator.generateTestData(300, 5);
        Forest forest = TestUtils.randomForest(generator, rows, 5, 23);
        TreeBoundExtractor unbounded = TreeBoundExtractor.unbounded(generator.getNumberOfColumns());

        for (int t = 0; t < forest.getNumberOfTrees(); t++) {
            List<LeafBounds> leaves = unbounded.extract(t, forest.getTree(t));
            for (double[] row : rows) {
                int[] containing = leaves.stream().filter(leaf -> contains(leaf, row)).mapToInt(LeafBounds::getLeaf)
                        .toArray();
                assertArrayEquals(new int[] { forest.getTree(t).getTerminalNode(row) }, containing);
            }
        }
    }

    private static boolean contains(LeafBounds leaf, double[] row) {
        for (int variable = 0; variable < row.length; variable++) {
            if (!(leaf.getMin(variable) < row[variable] && row[variable] <= leaf.getMax(variable))) {
                return false;
            }
        }
        return true;
    }
}
