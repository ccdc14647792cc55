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

package com.amazon.statespace.model;

import java.util.Random;

/**
 * The part of a multivariate state space model that a Gibbs sampler drives.
 * One iteration imputes any latent data that is not part of the state, then
 * the state, then draws the model parameters given both.
 *
 * @param <M> the concrete model type, so that copies keep their type
 */
public interface IMultivariateStateSpaceModel<M extends IMultivariateStateSpaceModel<M>> {

    int getNumberOfSeries();

    int getTimeDimension();

    /**
     * Draws the latent state given the data, the parameters and any imputed
     * latent data.
     *
     * @param random the random stream of the chain
     */
    void imputeState(Random random);

    /**
     * Draws the model parameters given the complete data.
     *
     * @param random the random stream of the chain
     */
    void sampleParameterPosteriors(Random random);

    /**
     * Creates a model that shares the (immutable) data points of this model but
     * duplicates every piece of mutable inference state, so that the copy can be
     * advanced by a different chain.
     *
     * @return an independent copy of the model
     */
    M copy();
}
