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

import static com.amazon.forestdensity.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The leaves of the forest that hold at least one kept row, ordered by tree and
 * leaf id, addressable by global index or by (tree, leaf).
 */
public class LeafIndex {

    private final List<IndexedLeaf> leaves;
    private final Map<Long, IndexedLeaf> byTreeAndLeaf;
    private final Map<Integer, List<IndexedLeaf>> byTree;

    LeafIndex(List<IndexedLeaf> leaves) {
        this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
        this.byTreeAndLeaf = new HashMap<>();
        this.byTree = new HashMap<>();
        for (IndexedLeaf leaf : leaves) {
            byTreeAndLeaf.put(key(leaf.getTree(), leaf.getLeaf()), leaf);
            byTree.computeIfAbsent(leaf.getTree(), t -> new ArrayList<>()).add(leaf);
        }
    }

    static long key(int tree, int leaf) {
        return ((long) tree << 32) | (leaf & 0xffffffffL);
    }

    public List<IndexedLeaf> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    /**
     * @param fIdx a global index in {@code 1..size()}
     * @return the leaf with that index
     */
    public IndexedLeaf get(int fIdx) {
        checkArgument(fIdx >= 1 && fIdx <= leaves.size(), "fIdx out of range");
        return leaves.get(fIdx - 1);
    }

    /**
     * @param tree a tree index
     * @param leaf a leaf id of that tree
     * @return the indexed leaf, or null if the leaf holds no kept row
     */
    public IndexedLeaf find(int tree, int leaf) {
        return byTreeAndLeaf.get(key(tree, leaf));
    }

    /**
     * @param tree a tree index
     * @return the indexed leaves of the tree, in increasing leaf id
     */
    public List<IndexedLeaf> getLeavesOfTree(int tree) {
        return Collections.unmodifiableList(byTree.getOrDefault(tree, Collections.emptyList()));
    }
}
