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

import com.amazon.forestdensity.forest.Forest;

public abstract class AbstractTreeExecutor {

    /**
     * Run a task on each of the trees in the forest and collect the individual
     * results. The results reach the collector in tree order, whatever order the
     * tasks completed in.
     *
     * @param forest    The forest whose trees are visited.
     * @param task      The computation run on every tree.
     * @param collector A collector used to aggregate individual tree results into
     *                  a final result.
     * @param <R>       The result type of a single tree.
     * @param <S>       The final type, after collecting the results of all trees.
     * @return The collected results.
     */
    public abstract <R, S> S traverseTrees(Forest forest, TreeTask<R> task, Collector<R, ?, S> collector);
}
