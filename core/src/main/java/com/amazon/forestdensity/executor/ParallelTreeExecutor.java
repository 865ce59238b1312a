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

import static com.amazon.forestdensity.CommonUtils.checkArgument;

import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collector;
import java.util.stream.IntStream;

import lombok.Getter;

import com.amazon.forestdensity.forest.Forest;

/**
 * An implementation of tree traversal that uses a private thread pool to visit
 * trees in parallel.
 */
public class ParallelTreeExecutor extends AbstractTreeExecutor {

    private final ForkJoinPool forkJoinPool;

    @Getter
    private final int threadPoolSize;

    public ParallelTreeExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <R, S> S traverseTrees(Forest forest, TreeTask<R> task, Collector<R, ?, S> collector) {
        return submitAndJoin(() -> IntStream.range(0, forest.getNumberOfTrees()).parallel()
                .mapToObj(i -> task.apply(i, forest.getTree(i))).collect(collector));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
