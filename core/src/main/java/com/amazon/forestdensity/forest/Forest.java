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

package com.amazon.forestdensity.forest;

import static com.amazon.forestdensity.CommonUtils.checkArgument;
import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * A trained ensemble of decision trees, as exposed by the forest trainer. The
 * forest is read only; the estimator never modifies it.
 */
public class Forest {

    private final List<DecisionTree> trees;

    /**
     * The number of rows the trainer was given.
     */
    @Getter
    private final int numberOfSamples;

    /**
     * The number of variables the split variable ids refer to.
     */
    @Getter
    private final int numberOfVariables;

    private final Map<Integer, List<String>> levels;

    protected Forest(Builder<?> builder) {
        checkArgument(!builder.trees.isEmpty(), "a forest needs at least one tree");
        checkArgument(builder.numberOfSamples > 0, "numberOfSamples must be greater than 0");
        checkArgument(builder.numberOfVariables > 0, "numberOfVariables must be greater than 0");
        this.trees = Collections.unmodifiableList(new ArrayList<>(builder.trees));
        this.numberOfSamples = builder.numberOfSamples;
        this.numberOfVariables = builder.numberOfVariables;
        Map<Integer, List<String>> copy = new HashMap<>();
        builder.levels.forEach((variable, labels) -> copy.put(variable, List.copyOf(labels)));
        this.levels = Collections.unmodifiableMap(copy);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public int getNumberOfTrees() {
        return trees.size();
    }

    public DecisionTree getTree(int index) {
        return trees.get(index);
    }

    public List<DecisionTree> getTrees() {
        return trees;
    }

    /**
     * @return true if every tree carries the in-bag counts of its bootstrap sample
     */
    public boolean hasInBagCounts() {
        return trees.stream().allMatch(tree -> tree.getInBagCounts().isPresent());
    }

    /**
     * The level labels the trainer used for a categorical variable, in ordinal
     * order: the label at position i has ordinal i + 1.
     *
     * @param variable a variable index
     * @return the labels, or empty if the trainer recorded none for the variable
     */
    public Optional<List<String>> getLevels(int variable) {
        return Optional.ofNullable(levels.get(variable));
    }

    public static class Builder<T extends Builder<T>> {

        private final List<DecisionTree> trees = new ArrayList<>();
        private int numberOfSamples;
        private int numberOfVariables;
        private final Map<Integer, List<String>> levels = new HashMap<>();

        public T addTree(DecisionTree tree) {
            checkNotNull(tree, "tree must not be null");
            trees.add(tree);
            return (T) this;
        }

        public T numberOfSamples(int numberOfSamples) {
            this.numberOfSamples = numberOfSamples;
            return (T) this;
        }

        public T numberOfVariables(int numberOfVariables) {
            this.numberOfVariables = numberOfVariables;
            return (T) this;
        }

        public T levels(int variable, List<String> labels) {
            checkNotNull(labels, "labels must not be null");
            levels.put(variable, labels);
            return (T) this;
        }

        public Forest build() {
            return new Forest(this);
        }
    }
}
