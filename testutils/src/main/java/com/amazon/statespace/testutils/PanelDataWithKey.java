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

/**
 * Observations of a synthetic panel in arrival order, together with the
 * parameters used to generate them. Entry {@code i} of every per-observation
 * array describes the same observation.
 */
public class PanelDataWithKey {

    public final int[] series;

    public final int[] timestamps;

    public final double[] responses;

    public final double[][] predictors;

    /**
     * coefficients[s] generated the responses of series s
     */
    public final double[][] coefficients;

    /**
     * indices of observations whose error exceeds three residual standard
     * deviations
     */
    public final int[] outlierIndices;

    public PanelDataWithKey(int[] series, int[] timestamps, double[] responses, double[][] predictors,
            double[][] coefficients, int[] outlierIndices) {
        this.series = series;
        this.timestamps = timestamps;
        this.responses = responses;
        this.predictors = predictors;
        this.coefficients = coefficients;
        this.outlierIndices = outlierIndices;
    }

    public int size() {
        return series.length;
    }
}
