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

import java.util.stream.Collector;
import java.util.stream.IntStream;

import com.amazon.forestdensity.forest.Forest;

/**
 * Visit the trees in a forest sequentially.
 */
public class SequentialTreeExecutor extends AbstractTreeExecutor {

    @Override
    public <R, S> S traverseTrees(Forest forest, TreeTask<R> task, Collector<R, ?, S> collector) {
        return IntStream.range(0, forest.getNumberOfTrees()).mapToObj(i -> task.apply(i, forest.getTree(i)))
                .collect(collector);
    }
}
