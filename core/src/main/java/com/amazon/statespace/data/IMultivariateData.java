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

/**
 * A single observation of one series of a multivariate panel at one time step.
 * The coordinates of a data point are fixed once it has been created; stores
 * rely on that when they index points by series and time.
 */
public interface IMultivariateData {

    /**
     * @return the series this observation belongs to, in
     *         {@code [0, numberOfSeries)}
     */
    int getSeries();

    /**
     * @return the non-negative integer time index of the observation
     */
    int getTimestamp();
}
