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

import java.util.Random;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGeneratorFactory;

/**
 * Imputes the latent weight of an observation whose error follows a Student-t
 * distribution. Writing {@code e ~ T(0, sigma, nu)} as
 * {@code e | w ~ N(0, sigma^2 / w)} with {@code w ~ Gamma(nu / 2, nu / 2)},
 * the full conditional of the weight given the residual {@code r} is
 * {@code Gamma((nu + 1) / 2, (nu + (r / sigma)^2) / 2)} (shape, rate).
 *
 * The imputer holds no data and can be shared.
 */
public class TDataImputer {

    /**
     * @param degreesOfFreedom the tail parameter nu
     * @return the shape of the full conditional of the weight
     */
    public double posteriorShape(double degreesOfFreedom) {
        return (degreesOfFreedom + 1) / 2;
    }

    /**
     * @param residual         the observation minus its conditional mean
     * @param residualSd       the scale parameter sigma
     * @param degreesOfFreedom the tail parameter nu
     * @return the rate of the full conditional of the weight
     */
    public double posteriorRate(double residual, double residualSd, double degreesOfFreedom) {
        double standardized = residual / residualSd;
        return (degreesOfFreedom + standardized * standardized) / 2;
    }

    /**
     * Draws a weight from its full conditional distribution.
     *
     * @param random           the random stream of the chain
     * @param residual         the observation minus its conditional mean
     * @param residualSd       the scale parameter sigma, positive
     * @param degreesOfFreedom the tail parameter nu, positive; an infinite value
     *                         corresponds to Gaussian errors
     * @return a positive weight
     */
    public double impute(Random random, double residual, double residualSd, double degreesOfFreedom) {
        checkNotNull(random, "random must not be null");
        checkArgument(residualSd > 0, "residual standard deviation must be positive");
        checkArgument(degreesOfFreedom > 0, "degrees of freedom must be positive");
        checkArgument(Double.isFinite(residual), "residual must be finite");
        if (Double.isInfinite(degreesOfFreedom)) {
            return 1.0;
        }
        double scale = 1.0 / posteriorRate(residual, residualSd, degreesOfFreedom);
        GammaDistribution distribution = new GammaDistribution(RandomGeneratorFactory.createRandomGenerator(random),
                posteriorShape(degreesOfFreedom), scale);
        return distribution.sample();
    }
}
