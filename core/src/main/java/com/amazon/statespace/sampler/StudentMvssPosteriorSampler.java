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

import static com.amazon.statespace.CommonUtils.checkNotNull;

import java.util.Random;

import com.amazon.statespace.model.StudentMvssRegressionModel;

/**
 * The latent data step of a Gibbs sampler for a
 * {@link StudentMvssRegressionModel}: before the state and the parameters are
 * drawn, the per-observation weights of the normal mixture representation of
 * the Student-t errors are imputed. The numerics belong to the model; this
 * class routes the random stream of the chain to it.
 *
 * The sampler holds no {@link TDataImputer} of its own. The imputer is
 * stateless and is owned by the model, which draws each weight in
 * {@link StudentMvssRegressionModel#imputeStudentWeights} where the residuals
 * are available.
 *
 * A sampler is bound to one model for its lifetime. To run several chains,
 * copy the model and bind a clone of the sampler to each copy with
 * {@link #cloneToNewHost}.
 */
public class StudentMvssPosteriorSampler implements ILatentDataImputer<StudentMvssRegressionModel> {

    private final StudentMvssRegressionModel model;

    private final Random random;

    /**
     * @param model          the host model
     * @param seedingRandom  a random stream used only to seed the stream of this
     *                       sampler
     */
    public StudentMvssPosteriorSampler(StudentMvssRegressionModel model, Random seedingRandom) {
        this(model, checkNotNull(seedingRandom, "seeding random must not be null").nextLong());
    }

    public StudentMvssPosteriorSampler(StudentMvssRegressionModel model, long seed) {
        this.model = checkNotNull(model, "model must not be null");
        this.random = new Random(seed);
    }

    @Override
    public void imputeNonstateLatentData() {
        model.imputeStudentWeights(random);
    }

    @Override
    public void clearCompleteDataSufficientStatistics() {
        model.clearCompleteDataSufficientStatistics();
    }

    /**
     * The clone is seeded from the stream of this sampler, so clones made in
     * sequence produce different streams.
     */
    @Override
    public StudentMvssPosteriorSampler cloneToNewHost(StudentMvssRegressionModel newHost) {
        return new StudentMvssPosteriorSampler(newHost, random);
    }

    public StudentMvssRegressionModel getModel() {
        return model;
    }
}
