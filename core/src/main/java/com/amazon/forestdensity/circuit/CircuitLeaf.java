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

import lombok.Getter;

/**
 * A leaf of the circuit: its global index, where it sits in the forest and the
 * share of the kept rows of its tree it covers.
 */
@Getter
public class CircuitLeaf {

    private final int fIdx;
    private final int tree;
    private final int leaf;
    private final double coverage;

    public CircuitLeaf(int fIdx, int tree, int leaf, double coverage) {
        this.fIdx = fIdx;
        this.tree = tree;
        this.leaf = leaf;
        this.coverage = coverage;
    }
}
