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

package com.amazon.forestdensity.executor;

import com.amazon.forestdensity.forest.DecisionTree;

/**
 * A computation on a single tree. A task only reads shared state, so the tasks
 * of different trees may run concurrently.
 *
 * @param <R> the result type of the task
 */
@FunctionalInterface
public interface TreeTask<R> {

    /**
     * @param treeIndex the index of the tree in the forest
     * @param tree      the tree
     * @return the result for this tree
     */
    R apply(int treeIndex, DecisionTree tree);
}
