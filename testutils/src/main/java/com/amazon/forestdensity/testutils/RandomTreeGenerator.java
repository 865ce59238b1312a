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

package com.amazon.forestdensity.testutils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Grows random decision trees on a bootstrap sample of a dataset, the way a
 * randomized forest trainer would, without any split criterion: every split
 * uses a random variable and a value observed in the node. Categorical
 * variables are split either at an ordinal or halfway between two ordinals.
 */
public class RandomTreeGenerator {

    private final int maxDepth;
    private final int minNodeSize;

    public RandomTreeGenerator(int maxDepth, int minNodeSize) {
        this.maxDepth = maxDepth;
        this.minNodeSize = minNodeSize;
    }

    public List<TreeArrays> generateForest(double[][] rows, boolean[] categorical, int numberOfTrees, long seed) {
        Random random = new Random(seed);
        List<TreeArrays> trees = new ArrayList<>();
        for (int t = 0; t < numberOfTrees; t++) {
            trees.add(generate(rows, categorical, random));
        }
        return trees;
    }

    public TreeArrays generate(double[][] rows, boolean[] categorical, Random random) {
        int n = rows.length;
        int[] inBagCounts = new int[n];
        for (int i = 0; i < n; i++) {
            inBagCounts[random.nextInt(n)]++;
        }

        List<Integer> splitVariables = new ArrayList<>();
        List<Double> splitValues = new ArrayList<>();
        List<Integer> leftChildren = new ArrayList<>();
        List<Integer> rightChildren = new ArrayList<>();
        Deque<NodeTask> queue = new ArrayDeque<>();

        List<Integer> rootRows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (inBagCounts[i] > 0) {
                rootRows.add(i);
            }
        }
        addNode(splitVariables, splitValues, leftChildren, rightChildren);
        queue.add(new NodeTask(0, 0, rootRows));

        while (!queue.isEmpty()) {
            NodeTask task = queue.poll();
            if (task.depth >= maxDepth || task.rows.size() < minNodeSize) {
                continue;
            }
            int variable = random.nextInt(categorical.length);
            List<Double> observed = new ArrayList<>();
            for (int row : task.rows) {
                if (!Double.isNaN(rows[row][variable])) {
                    observed.add(rows[row][variable]);
                }
            }
            if (observed.isEmpty()) {
                continue;
            }
            double split = observed.get(random.nextInt(observed.size()));
            if (categorical[variable] && random.nextBoolean()) {
                split += 0.5;
            }
            List<Integer> left = new ArrayList<>();
            List<Integer> right = new ArrayList<>();
            for (int row : task.rows) {
                if (rows[row][variable] <= split) {
                    left.add(row);
                } else {
                    right.add(row);
                }
            }
            if (left.isEmpty() || right.isEmpty()) {
                continue;
            }
            int leftId = addNode(splitVariables, splitValues, leftChildren, rightChildren);
            int rightId = addNode(splitVariables, splitValues, leftChildren, rightChildren);
            splitVariables.set(task.node, variable);
            splitValues.set(task.node, split);
            leftChildren.set(task.node, leftId);
            rightChildren.set(task.node, rightId);
            queue.add(new NodeTask(leftId, task.depth + 1, left));
            queue.add(new NodeTask(rightId, task.depth + 1, right));
        }

        int size = splitVariables.size();
        int[] vars = new int[size];
        double[] values = new double[size];
        int[] lefts = new int[size];
        int[] rights = new int[size];
        for (int i = 0; i < size; i++) {
            vars[i] = splitVariables.get(i);
            values[i] = splitValues.get(i);
            lefts[i] = leftChildren.get(i);
            rights[i] = rightChildren.get(i);
        }
        return new TreeArrays(vars, values, lefts, rights, inBagCounts);
    }

    private static int addNode(List<Integer> splitVariables, List<Double> splitValues, List<Integer> leftChildren,
            List<Integer> rightChildren) {
        splitVariables.add(0);
        splitValues.add(0.0);
        leftChildren.add(0);
        rightChildren.add(0);
        return splitVariables.size() - 1;
    }

    private static class NodeTask {
        final int node;
        final int depth;
        final List<Integer> rows;

        NodeTask(int node, int depth, List<Integer> rows) {
            this.node = node;
            this.depth = depth;
            this.rows = rows;
        }
    }
}
