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

package com.amazon.statespace.testutils;

import java.util.Arrays;
import java.util.Random;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;

/**
 * This class generates an irregularly observed panel of regression series with
 * Student-t errors. Each series is observed at each time step independently
 * with a fixed probability; the first predictor is an intercept and the others
 * are standard normal. The error of every observation is {@code sigma} times a
 * standard Student-t variate with {@code nu} degrees of freedom; errors beyond
 * three standard deviations are reported as outliers.
 */
public class IrregularPanelTestData {

    private final int numberOfSeries;
    private final int predictorDimension;
    private final double observationProbability;
    private final double residualSd;
    private final int degreesOfFreedom;

    public IrregularPanelTestData(int numberOfSeries, int predictorDimension, double observationProbability,
            double residualSd, int degreesOfFreedom) {
        this.numberOfSeries = numberOfSeries;
        this.predictorDimension = predictorDimension;
        this.observationProbability = observationProbability;
        this.residualSd = residualSd;
        this.degreesOfFreedom = degreesOfFreedom;
    }

    public IrregularPanelTestData(int numberOfSeries) {
        this(numberOfSeries, 2, 0.6, 1.0, 3);
    }

    public PanelDataWithKey generateTestData(int timeDimension, long seed) {
        Random rng = new Random(seed);
        RandomGenerator generator = RandomGeneratorFactory.createRandomGenerator(rng);
        NormalDistribution normal = new NormalDistribution(generator, 0.0, 1.0);
        TDistribution student = new TDistribution(generator, degreesOfFreedom);

        double[][] coefficients = new double[numberOfSeries][predictorDimension];
        for (int s = 0; s < numberOfSeries; s++) {
            for (int j = 0; j < predictorDimension; j++) {
                coefficients[s][j] = normal.sample();
            }
        }

        int capacity = numberOfSeries * timeDimension;
        int[] series = new int[capacity];
        int[] timestamps = new int[capacity];
        double[] responses = new double[capacity];
        double[][] predictors = new double[capacity][];
        int[] outliers = new int[capacity];
        int count = 0;
        int numberOfOutliers = 0;

        for (int t = 0; t < timeDimension; t++) {
            for (int s = 0; s < numberOfSeries; s++) {
                if (rng.nextDouble() >= observationProbability) {
                    continue;
                }
                double[] x = new double[predictorDimension];
                double mean = 0;
                for (int j = 0; j < predictorDimension; j++) {
                    x[j] = (j == 0) ? 1.0 : normal.sample();
                    mean += x[j] * coefficients[s][j];
                }
                double error = residualSd * student.sample();
                if (Math.abs(error) > 3 * residualSd) {
                    outliers[numberOfOutliers++] = count;
                }
                series[count] = s;
                timestamps[count] = t;
                responses[count] = mean + error;
                predictors[count] = x;
                ++count;
            }
        }

        return new PanelDataWithKey(Arrays.copyOf(series, count), Arrays.copyOf(timestamps, count),
                Arrays.copyOf(responses, count), Arrays.copyOf(predictors, count), coefficients,
                Arrays.copyOf(outliers, numberOfOutliers));
    }
}
