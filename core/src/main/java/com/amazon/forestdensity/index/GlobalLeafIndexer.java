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

import static com.amazon.forestdensity.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.amazon.forestdensity.bounds.LeafBounds;
import com.amazon.forestdensity.coverage.LeafCoverage;

/**
 * Joins leaf bounds with leaf coverage on (tree, leaf) and numbers the joined
 * leaves {@code 1..K} in (tree, leaf) order. The number is the only key the
 * parameter tables use to refer to a leaf.
 */
public class GlobalLeafIndexer {

    public LeafIndex index(List<LeafBounds> bounds, List<LeafCoverage> coverage) {
        checkNotNull(bounds, "bounds must not be null");
        checkNotNull(coverage, "coverage must not be null");
        Map<Long, LeafCoverage> coverageByLeaf = new HashMap<>();
        for (LeafCoverage entry : coverage) {
            coverageByLeaf.put(LeafIndex.key(entry.getTree(), entry.getLeaf()), entry);
        }
        List<LeafBounds> joined = new ArrayList<>();
        for (LeafBounds leafBounds : bounds) {
            if (coverageByLeaf.containsKey(LeafIndex.key(leafBounds.getTree(), leafBounds.getLeaf()))) {
                joined.add(leafBounds);
            }
        }
        joined.sort(Comparator.comparingInt(LeafBounds::getTree).thenComparingInt(LeafBounds::getLeaf));

        List<IndexedLeaf> leaves = new ArrayList<>(joined.size());
        int fIdx = 0;
        for (LeafBounds leafBounds : joined) {
            LeafCoverage entry = coverageByLeaf.get(LeafIndex.key(leafBounds.getTree(), leafBounds.getLeaf()));
            leaves.add(new IndexedLeaf(++fIdx, entry.getCoverage(), leafBounds));
        }
        return new LeafIndex(leaves);
    }
}
