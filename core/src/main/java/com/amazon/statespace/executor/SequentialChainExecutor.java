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

import com.amazon.statespace.model.IMultivariateStateSpaceModel;
import com.amazon.statespace.sampler.MultivariateStateSpaceModelSampler;

/**
 * Runs the chains one after the other in the calling thread.
 *
 * @param <M> the model type
 */
public class SequentialChainExecutor<M extends IMultivariateStateSpaceModel<M>> extends AbstractChainExecutor<M> {

    public SequentialChainExecutor(List<MultivariateStateSpaceModelSampler<M>> chains) {
        super(chains);
    }

    @Override
    public void runChains(int numberOfIterations) {
        checkArgument(numberOfIterations >= 0, "number of iterations must be non-negative");
        chains.forEach(chain -> chain.run(numberOfIterations));
    }
}
