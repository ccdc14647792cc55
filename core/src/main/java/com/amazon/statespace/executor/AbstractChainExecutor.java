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
import static com.amazon.statespace.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.statespace.model.IMultivariateStateSpaceModel;
import com.amazon.statespace.sampler.MultivariateStateSpaceModelSampler;

/**
 * Base class for executors that advance a collection of independent MCMC
 * chains. The chains share immutable observations but no mutable state, so
 * they can be advanced in any order or concurrently.
 *
 * @param <M> the model type
 */
public abstract class AbstractChainExecutor<M extends IMultivariateStateSpaceModel<M>> {

    protected final List<MultivariateStateSpaceModelSampler<M>> chains;

    protected AbstractChainExecutor(List<MultivariateStateSpaceModelSampler<M>> chains) {
        checkNotNull(chains, "chains must not be null");
        checkArgument(!chains.isEmpty(), "at least one chain is required");
        this.chains = new ArrayList<>(chains);
    }

    /**
     * Creates {@code numberOfChains} chains from a prototype. The prototype itself
     * is the first chain; the others are obtained with
     * {@link MultivariateStateSpaceModelSampler#replicate()}.
     *
     * @param prototype      the first chain
     * @param numberOfChains the total number of chains
     * @param <M>            the model type
     * @return the list of chains
     */
    public static <M extends IMultivariateStateSpaceModel<M>> List<MultivariateStateSpaceModelSampler<M>> replicate(
            MultivariateStateSpaceModelSampler<M> prototype, int numberOfChains) {
        checkNotNull(prototype, "prototype must not be null");
        checkArgument(numberOfChains > 0, "number of chains must be positive");
        List<MultivariateStateSpaceModelSampler<M>> result = new ArrayList<>(numberOfChains);
        result.add(prototype);
        for (int i = 1; i < numberOfChains; i++) {
            result.add(prototype.replicate());
        }
        return result;
    }

    /**
     * Advances every chain by the given number of iterations.
     *
     * @param numberOfIterations the number of draws per chain
     */
    public abstract void runChains(int numberOfIterations);

    public List<MultivariateStateSpaceModelSampler<M>> getChains() {
        return Collections.unmodifiableList(chains);
    }

    public int getNumberOfChains() {
        return chains.size();
    }
}
