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

package com.amazon.forestdensity.index;

import lombok.Getter;

import com.amazon.forestdensity.bounds.LeafBounds;

/**
 * A leaf of the forest with its global index, its coverage and its bounds.
 */
@Getter
public class IndexedLeaf {

    /**
     * dense index in {@code 1..K}, unique across the forest
     */
    private final int fIdx;
    private final int tree;
    private final int leaf;
    private final double coverage;
    private final LeafBounds bounds;

    public IndexedLeaf(int fIdx, double coverage, LeafBounds bounds) {
        this.fIdx = fIdx;
        this.tree = bounds.getTree();
        this.leaf = bounds.getLeaf();
        this.coverage = coverage;
        this.bounds = bounds;
    }
}
