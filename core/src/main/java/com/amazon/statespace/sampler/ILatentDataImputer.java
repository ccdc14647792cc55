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

import com.amazon.statespace.model.IMultivariateStateSpaceModel;

/**
 * <p>
 * The capability a noise model plugs into the shared state space Gibbs
 * sampler. Observation noise that is a scale mixture of normals (Student-t,
 * logit, Poisson via data augmentation, and so on) is handled by drawing the
 * mixing variables before the state is imputed; once they are known, the
 * observation equation is conditionally Gaussian and the shared state and
 * parameter draws apply unchanged.
 * </p>
 *
 * <p>
 * The driver calls {@link #imputeNonstateLatentData()} exactly once per
 * iteration, in phase {@link SamplerPhase#IMPUTE_LATENT}. When it returns, the
 * latent data must be available for every observed data point; failures are
 * reported by throwing.
 * </p>
 *
 * @param <M> the host model type
 */
public interface ILatentDataImputer<M extends IMultivariateStateSpaceModel<M>> {

    void imputeNonstateLatentData();

    /**
     * Resets the complete data sufficient statistics accumulated by the host model
     * from the latent data.
     */
    void clearCompleteDataSufficientStatistics();

    /**
     * Creates an imputer with the same configuration, bound to a different host.
     * No accumulated state is copied.
     *
     * @param newHost the model the new imputer works on
     * @return a new imputer bound to {@code newHost}
     */
    ILatentDataImputer<M> cloneToNewHost(M newHost);
}
