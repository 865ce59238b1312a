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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.forestdensity.config.DistributionFamily;
import com.amazon.forestdensity.data.CategoricalColumn;
import com.amazon.forestdensity.data.Column;
import com.amazon.forestdensity.data.ColumnKind;
import com.amazon.forestdensity.data.Dataset;
import com.amazon.forestdensity.data.EncodedDataset;
import com.amazon.forestdensity.index.IndexedLeaf;
import com.amazon.forestdensity.index.LeafIndex;

/**
 * Packages the estimated tables into a {@link ProbabilisticCircuit}.
 */
public class CircuitAssembler {

    private final DistributionFamily family;

    public CircuitAssembler(DistributionFamily family) {
        this.family = family;
    }

    public ProbabilisticCircuit assemble(LeafIndex leafIndex, List<ContinuousLeafParameters> continuous,
            List<CategoricalLeafParameters> categorical, Dataset dataset, EncodedDataset data) {
        List<CircuitLeaf> leaves = new ArrayList<>(leafIndex.size());
        for (IndexedLeaf leaf : leafIndex.getLeaves()) {
            leaves.add(new CircuitLeaf(leaf.getFIdx(), leaf.getTree(), leaf.getLeaf(), leaf.getCoverage()));
        }

        List<VariableMetadata> metadata = new ArrayList<>();
        Map<String, List<String>> levels = new LinkedHashMap<>();
        for (int j = 0; j < dataset.getNumberOfColumns(); j++) {
            Column column = dataset.getColumn(j);
            boolean continuousColumn = column.getKind() == ColumnKind.CONTINUOUS;
            metadata.add(new VariableMetadata(column.getName(), column.getOriginalType().getSimpleName(),
                    column.getKind(), continuousColumn ? family : DistributionFamily.MULTINOMIAL,
                    continuousColumn ? data.getDecimals(j) : -1));
            if (!continuousColumn) {
                levels.put(column.getName(), ((CategoricalColumn) column).getLevels());
            }
        }
        return new ProbabilisticCircuit(continuous, categorical, leaves, metadata, levels, dataset.getInputType());
    }
}
