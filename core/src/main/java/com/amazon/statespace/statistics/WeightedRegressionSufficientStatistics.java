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

package com.amazon.statespace.statistics;

import static com.amazon.statespace.CommonUtils.checkArgument;
import static com.amazon.statespace.CommonUtils.deepCopy;

import java.util.Arrays;

import lombok.Getter;

/**
 * Complete data sufficient statistics of a weighted linear regression
 * {@code y = x'beta + e}, {@code e ~ N(0, sigma^2 / w)}. The statistics are
 * enough to drive a posterior draw of {@code beta} and {@code sigma} without
 * revisiting the data.
 */
public class WeightedRegressionSufficientStatistics {

    @Getter
    private final int dimension;

    @Getter
    private long sampleSize;

    @Getter
    private double sumOfWeights;

    /**
     * sum of w * y
     */
    @Getter
    private double weightedSumOfResponses;

    /**
     * sum of w * y * y
     */
    @Getter
    private double weightedSumOfSquaredResponses;

    private final double[][] xtwx;

    private final double[] xtwy;

    public WeightedRegressionSufficientStatistics(int dimension) {
        checkArgument(dimension >= 0, "dimension must be non-negative");
        this.dimension = dimension;
        this.xtwx = new double[dimension][dimension];
        this.xtwy = new double[dimension];
    }

    private WeightedRegressionSufficientStatistics(WeightedRegressionSufficientStatistics other) {
        this.dimension = other.dimension;
        this.sampleSize = other.sampleSize;
        this.sumOfWeights = other.sumOfWeights;
        this.weightedSumOfResponses = other.weightedSumOfResponses;
        this.weightedSumOfSquaredResponses = other.weightedSumOfSquaredResponses;
        this.xtwx = deepCopy(other.xtwx);
        this.xtwy = Arrays.copyOf(other.xtwy, other.xtwy.length);
    }

    public void update(double[] predictors, double response, double weight) {
        checkArgument(predictors.length == dimension, "incorrect predictor dimension");
        checkArgument(weight >= 0, "weights must be non-negative");
        ++sampleSize;
        sumOfWeights += weight;
        weightedSumOfResponses += weight * response;
        weightedSumOfSquaredResponses += weight * response * response;
        for (int i = 0; i < dimension; i++) {
            double wx = weight * predictors[i];
            xtwy[i] += wx * response;
            for (int j = 0; j < dimension; j++) {
                xtwx[i][j] += wx * predictors[j];
            }
        }
    }

    public void clear() {
        sampleSize = 0;
        sumOfWeights = 0;
        weightedSumOfResponses = 0;
        weightedSumOfSquaredResponses = 0;
        for (int i = 0; i < dimension; i++) {
            Arrays.fill(xtwx[i], 0);
        }
        Arrays.fill(xtwy, 0);
    }

    /**
     * @return a copy of X'WX
     */
    public double[][] getXtwx() {
        return deepCopy(xtwx);
    }

    /**
     * @return a copy of X'Wy
     */
    public double[] getXtwy() {
        return Arrays.copyOf(xtwy, xtwy.length);
    }

    public double getWeightedMeanResponse() {
        return (sumOfWeights > 0) ? weightedSumOfResponses / sumOfWeights : 0;
    }

    public WeightedRegressionSufficientStatistics copy() {
        return new WeightedRegressionSufficientStatistics(this);
    }
}
