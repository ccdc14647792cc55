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

package com.amazon.statespace.executor;

import static com.amazon.statespace.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.ForkJoinPool;

import lombok.extern.log4j.Log4j2;

import com.amazon.statespace.model.IMultivariateStateSpaceModel;
import com.amazon.statespace.sampler.MultivariateStateSpaceModelSampler;

/**
 * Runs the chains in parallel on a private thread pool. Each chain is advanced
 * by exactly one thread at a time.
 *
 * @param <M> the model type
 */
@Log4j2
public class ParallelChainExecutor<M extends IMultivariateStateSpaceModel<M>> extends AbstractChainExecutor<M> {

    private final ForkJoinPool forkJoinPool;

    private final int threadPoolSize;

    public ParallelChainExecutor(List<MultivariateStateSpaceModelSampler<M>> chains, int threadPoolSize) {
        super(chains);
        checkArgument(threadPoolSize > 0, "thread pool size must be positive");
        this.threadPoolSize = threadPoolSize;
        this.forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public void runChains(int numberOfIterations) {
        checkArgument(numberOfIterations >= 0, "number of iterations must be non-negative");
        log.info("running {} chains for {} iterations on {} threads", chains.size(), numberOfIterations,
                threadPoolSize);
        forkJoinPool.submit(() -> chains.parallelStream().forEach(chain -> chain.run(numberOfIterations))).join();
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void shutdown() {
        forkJoinPool.shutdown();
    }
}
