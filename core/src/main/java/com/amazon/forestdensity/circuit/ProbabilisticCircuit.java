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

import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * A weighted mixture of per-leaf, per-variable factorized distributions. Every
 * leaf of {@link #getLeaves()} is a mixture component weighted by its coverage;
 * its distribution is the product of the rows of
 * {@link #getContinuousParameters()} and {@link #getCategoricalParameters()}
 * sharing its {@code fIdx}.
 *
 * A circuit is immutable.
 */
public class ProbabilisticCircuit {

    @Getter
    private final List<ContinuousLeafParameters> continuousParameters;

    @Getter
    private final List<CategoricalLeafParameters> categoricalParameters;

    @Getter
    private final List<CircuitLeaf> leaves;

    @Getter
    private final List<VariableMetadata> metadata;

    /**
     * the level labels of the categorical columns of the estimation dataset
     */
    @Getter
    private final Map<String, List<String>> levels;

    /**
     * the tag of the input the estimation dataset came from
     */
    @Getter
    private final String inputType;

    public ProbabilisticCircuit(List<ContinuousLeafParameters> continuousParameters,
            List<CategoricalLeafParameters> categoricalParameters, List<CircuitLeaf> leaves,
            List<VariableMetadata> metadata, Map<String, List<String>> levels, String inputType) {
        this.continuousParameters = List.copyOf(checkNotNull(continuousParameters, "continuous must not be null"));
        this.categoricalParameters = List.copyOf(checkNotNull(categoricalParameters, "categorical must not be null"));
        this.leaves = List.copyOf(checkNotNull(leaves, "leaves must not be null"));
        this.metadata = List.copyOf(checkNotNull(metadata, "metadata must not be null"));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        checkNotNull(levels, "levels must not be null").forEach((name, labels) -> copy.put(name, List.copyOf(labels)));
        this.levels = Collections.unmodifiableMap(copy);
        this.inputType = checkNotNull(inputType, "inputType must not be null");
    }

    public int getNumberOfLeaves() {
        return leaves.size();
    }
}
