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

package com.amazon.statespace.sampler;

/**
 * The steps of one Gibbs iteration of a state space model sampler.
 */
public enum SamplerPhase {

    /**
     * between iterations
     */
    IDLE,
    /**
     * imputing latent data that is not part of the state, for example the
     * observation weights of a Student-t model
     */
    IMPUTE_LATENT,
    /**
     * drawing the state given the data and the latent data
     */
    DRAW_STATE,
    /**
     * drawing the parameters given the complete data
     */
    DRAW_PARAMETERS;
}
