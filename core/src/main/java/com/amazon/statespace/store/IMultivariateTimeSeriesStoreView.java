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

package com.amazon.statespace.store;

import java.util.Optional;

import com.amazon.statespace.data.IMultivariateData;

/**
 * A view of the MultivariateTimeSeriesStore that forces a read only access to
 * the store.
 *
 * @param <D> the data point type held by the store
 */
public interface IMultivariateTimeSeriesStoreView<D extends IMultivariateData> {

    int getNumberOfSeries();

    /**
     * @return one more than the largest timestamp stored, or 0 if the store is
     *         empty
     */
    int getTimeDimension();

    /**
     * @return the number of points added since the store was last cleared
     */
    int getTotalSampleSize();

    /**
     * Positional access in order of arrival.
     *
     * @param flatIndex position of the point in arrival order
     * @return the data point at that position
     */
    D getDataPoint(int flatIndex);

    /**
     * @param series the series of interest
     * @param time   the time step of interest
     * @return the point most recently added at the coordinate, or
     *         {@code Optional.empty()} if none was added
     */
    Optional<D> getDataPoint(int series, int time);

    /**
     * @param series the series of interest
     * @param time   the time step of interest
     * @return the flat index of the point at the coordinate, or -1 if the
     *         coordinate is not populated
     */
    int getDataIndex(int series, int time);

    /**
     * @param time a time step in {@code [0, getTimeDimension())}
     * @return the series observed at that time step
     */
    Selector getObserved(int time);

    /**
     * @param series the series of interest
     * @param time   a time step in {@code [0, getTimeDimension())}
     * @return true if the series is marked as observed at that time step
     */
    boolean isObserved(int series, int time);

    int getNumberOfObservedSeries(int time);

    /**
     * @param series the series of interest
     * @return the timestamps present for that series, in increasing order
     */
    int[] getTimestamps(int series);
}
