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

package com.amazon.statespace.data;

import static com.amazon.statespace.CommonUtils.checkArgument;
import static com.amazon.statespace.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An immutable regression observation: a scalar response for one series at one
 * time step together with the predictors that explain it. Instances may be
 * shared freely between stores and between copies of a model.
 */
public class MultivariateRegressionData implements IMultivariateData {

    private final int series;

    private final int timestamp;

    private final double response;

    private final double[] predictors;

    public MultivariateRegressionData(int series, int timestamp, double response, double[] predictors) {
        checkArgument(series >= 0, "series must be non-negative");
        checkArgument(timestamp >= 0, "timestamp must be non-negative");
        checkNotNull(predictors, "predictors must not be null");
        this.series = series;
        this.timestamp = timestamp;
        this.response = response;
        this.predictors = Arrays.copyOf(predictors, predictors.length);
    }

    @Override
    public int getSeries() {
        return series;
    }

    @Override
    public int getTimestamp() {
        return timestamp;
    }

    public double getResponse() {
        return response;
    }

    /**
     * @return a copy of the predictor vector
     */
    public double[] getPredictors() {
        return Arrays.copyOf(predictors, predictors.length);
    }

    public int getPredictorDimension() {
        return predictors.length;
    }

    public double getPredictor(int index) {
        return predictors[index];
    }

    @Override
    public String toString() {
        return "MultivariateRegressionData(series=" + series + ", timestamp=" + timestamp + ", response=" + response
                + ", predictors=" + Arrays.toString(predictors) + ")";
    }
}
