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
 * Draws the contribution of the latent state to every observation, typically
 * by forward filtering and backward sampling. Implementations must not keep
 * per-chain state, since copies of a model share the imputer.
 *
 * @param <M> the model type
 */
@FunctionalInterface
public interface IStateImputer<M> {

    /**
     * @param model  the model whose state is imputed
     * @param random the random stream of the chain
     * @return an array indexed by [series][time] of dimension
     *         numberOfSeries x timeDimension
     */
    double[][] impute(M model, Random random);
}
