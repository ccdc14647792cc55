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

import static com.amazon.statespace.CommonUtils.checkArgument;
import static com.amazon.statespace.CommonUtils.checkNotNull;
import static com.amazon.statespace.CommonUtils.checkState;

import java.util.Random;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.amazon.statespace.model.IMultivariateStateSpaceModel;

/**
 * <p>
 * The Gibbs sampler shared by the multivariate state space models. Each call
 * to {@link #draw()} performs one iteration:
 * </p>
 * <ol>
 * <li>{@link SamplerPhase#IMPUTE_LATENT}: the latent data imputer, if any, draws
 * the latent data that is not part of the state;</li>
 * <li>{@link SamplerPhase#DRAW_STATE}: the model imputes its state;</li>
 * <li>{@link SamplerPhase#DRAW_PARAMETERS}: the model draws its parameters.</li>
 * </ol>
 * <p>
 * The sampler knows nothing about the noise model; noise models that need a
 * latent data step provide it through {@link ILatentDataImputer}. An exception
 * thrown in any phase propagates to the caller and leaves the sampler
 * {@link SamplerPhase#IDLE}.
 * </p>
 *
 * <p>
 * A sampler and its model form one chain and are not thread safe. Independent
 * chains are created with {@link #replicate()}.
 * </p>
 *
 * @param <M> the model type
 */
@Log4j2
public class MultivariateStateSpaceModelSampler<M extends IMultivariateStateSpaceModel<M>> {

    public static final long DEFAULT_RANDOM_SEED = 42L;

    @Getter
    private final M model;

    /**
     * may be null when the noise model needs no latent data
     */
    @Getter
    private final ILatentDataImputer<M> latentDataImputer;

    private final Random random;

    @Getter
    private SamplerPhase phase;

    @Getter
    private long iterations;

    public MultivariateStateSpaceModelSampler(Builder<M> builder) {
        this.model = checkNotNull(builder.model, "model must not be null");
        this.latentDataImputer = builder.latentDataImputer;
        this.random = (builder.random != null) ? builder.random : new Random(builder.randomSeed);
        this.phase = SamplerPhase.IDLE;
        this.iterations = 0;
    }

    public static <M extends IMultivariateStateSpaceModel<M>> Builder<M> builder() {
        return new Builder<>();
    }

    /**
     * Performs one Gibbs iteration.
     */
    public void draw() {
        checkState(phase == SamplerPhase.IDLE, "draw called while an iteration is in progress");
        try {
            phase = SamplerPhase.IMPUTE_LATENT;
            if (latentDataImputer != null) {
                latentDataImputer.imputeNonstateLatentData();
            }
            phase = SamplerPhase.DRAW_STATE;
            model.imputeState(random);
            phase = SamplerPhase.DRAW_PARAMETERS;
            model.sampleParameterPosteriors(random);
            ++iterations;
        } finally {
            phase = SamplerPhase.IDLE;
        }
        log.trace("completed iteration {}", iterations);
    }

    /**
     * Starts a fresh sweep: clears the complete data sufficient statistics and
     * performs the requested number of iterations.
     *
     * @param numberOfIterations the number of draws
     */
    public void run(int numberOfIterations) {
        checkArgument(numberOfIterations >= 0, "number of iterations must be non-negative");
        if (latentDataImputer != null) {
            latentDataImputer.clearCompleteDataSufficientStatistics();
        }
        for (int i = 0; i < numberOfIterations; i++) {
            draw();
        }
    }

    /**
     * Creates an independent chain: the model is copied, the latent data imputer
     * is cloned onto the copy, and the new random stream is seeded from this one.
     *
     * @return a sampler for a copy of the model
     */
    public MultivariateStateSpaceModelSampler<M> replicate() {
        M newModel = model.copy();
        ILatentDataImputer<M> newImputer = (latentDataImputer == null) ? null
                : latentDataImputer.cloneToNewHost(newModel);
        return MultivariateStateSpaceModelSampler.<M>builder().model(newModel).latentDataImputer(newImputer)
                .randomSeed(random.nextLong()).build();
    }

    public static class Builder<M extends IMultivariateStateSpaceModel<M>> {

        private M model;
        private ILatentDataImputer<M> latentDataImputer;
        private Random random;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public Builder<M> model(M model) {
            this.model = model;
            return this;
        }

        public Builder<M> latentDataImputer(ILatentDataImputer<M> latentDataImputer) {
            this.latentDataImputer = latentDataImputer;
            return this;
        }

        public Builder<M> random(Random random) {
            this.random = random;
            return this;
        }

        public Builder<M> randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public MultivariateStateSpaceModelSampler<M> build() {
            return new MultivariateStateSpaceModelSampler<>(this);
        }
    }
}
