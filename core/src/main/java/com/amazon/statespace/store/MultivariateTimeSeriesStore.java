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

import static com.amazon.statespace.CommonUtils.checkArgument;
import static com.amazon.statespace.CommonUtils.checkNotNull;
import static com.amazon.statespace.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import lombok.extern.log4j.Log4j2;

import com.amazon.statespace.data.IMultivariateData;

/**
 * MultivariateTimeSeriesStore is an append-only repository of the data points
 * of a panel of {@code numberOfSeries} parallel time series. Each point
 * describes one value of one series at a single time step, and the panel is
 * typically sparse: most series are missing at most time steps.
 *
 * Points are addressable two ways. The flat index of a point is its position in
 * arrival order and never changes until the store is cleared. The coordinate
 * index maps (series, time) to the flat index of the point most recently added
 * at that coordinate; it is kept as one sorted map per series so that a single
 * series can be scanned in time order.
 *
 * For every time step in {@code [0, timeDimension)} the store also keeps a
 * {@link Selector} of the series observed at that step. The time dimension only
 * grows; adding a point beyond it appends all-missing selectors up to and
 * including the new timestamp.
 *
 * Registered observers are notified after every add and after every clear.
 * During an add they run once the point is indexed and counted, but before the
 * observed selectors are updated: a time step reached for the first time reads
 * as all missing, and the new series is not yet marked observed.
 *
 * The store is not thread safe. Copies made with {@link #copy()} share the data
 * points but nothing else, and can be used by different threads.
 *
 * @param <D> the data point type
 */
@Log4j2
public class MultivariateTimeSeriesStore<D extends IMultivariateData> implements IMultivariateTimeSeriesStoreView<D> {

    public static final int MISSING_INDEX = -1;

    /**
     * number of parallel series, fixed at construction
     */
    private final int numberOfSeries;

    /**
     * 1 + the largest timestamp added since the last clear
     */
    private int timeDimension;

    /**
     * points in order of arrival; the position is the flat index
     */
    private final List<D> rawData;

    /**
     * dataIndices.get(series).get(time) is the flat index of the point at that
     * coordinate
     */
    private final Map<Integer, NavigableMap<Integer, Integer>> dataIndices;

    /**
     * observed.get(time) holds the series present at that time step
     */
    private final List<Selector> observed;

    /**
     * registered observers, replaced (never mutated) on subscribe and unsubscribe
     */
    private Registration[] observers;

    public MultivariateTimeSeriesStore(int numberOfSeries) {
        checkArgument(numberOfSeries > 0, "number of series must be positive");
        this.numberOfSeries = numberOfSeries;
        this.timeDimension = 0;
        this.rawData = new ArrayList<>();
        this.dataIndices = new HashMap<>();
        this.observed = new ArrayList<>();
        this.observers = new Registration[0];
    }

    private MultivariateTimeSeriesStore(MultivariateTimeSeriesStore<D> other) {
        this.numberOfSeries = other.numberOfSeries;
        this.timeDimension = other.timeDimension;
        this.rawData = new ArrayList<>(other.rawData);
        this.dataIndices = new HashMap<>();
        for (Map.Entry<Integer, NavigableMap<Integer, Integer>> entry : other.dataIndices.entrySet()) {
            dataIndices.put(entry.getKey(), new TreeMap<>(entry.getValue()));
        }
        this.observed = new ArrayList<>(other.observed.size());
        for (Selector selector : other.observed) {
            observed.add(selector.copy());
        }
        this.observers = new Registration[0];
    }

    @Override
    public int getNumberOfSeries() {
        return numberOfSeries;
    }

    @Override
    public int getTimeDimension() {
        return timeDimension;
    }

    /**
     * Removes every data point, index entry and observed selector. The number of
     * series and the registered observers are kept.
     */
    public void clear() {
        timeDimension = 0;
        observed.clear();
        dataIndices.clear();
        rawData.clear();
        log.debug("cleared store of {} series", numberOfSeries);
        notifyObservers();
    }

    /**
     * Adds a data point to the store. If a point was already present at the same
     * (series, time) coordinate, the coordinate index moves to the new point and
     * the earlier point remains reachable only through its flat index.
     *
     * @param point the point to add
     */
    public void add(D point) {
        checkNotNull(point, "data point must not be null");
        int series = point.getSeries();
        int timestamp = point.getTimestamp();
        checkArgument(series >= 0 && series < numberOfSeries,
                () -> String.format("series %d is outside [0, %d)", series, numberOfSeries));
        checkArgument(timestamp >= 0, "timestamp must be non-negative");

        timeDimension = Math.max(timeDimension, 1 + timestamp);
        Integer previous = dataIndices.computeIfAbsent(series, s -> new TreeMap<>()).put(timestamp, rawData.size());
        if (previous != null) {
            log.debug("series {} time {} re-indexed from flat index {} to {}", series, timestamp, previous,
                    rawData.size());
        }
        rawData.add(point);
        // observers run before the observed selectors are updated for this point
        notifyObservers();
        while (observed.size() <= timestamp) {
            observed.add(new Selector(numberOfSeries, false));
        }
        observed.get(timestamp).add(series);
    }

    @Override
    public D getDataPoint(int flatIndex) {
        checkArgument(flatIndex >= 0 && flatIndex < rawData.size(),
                () -> String.format("flat index %d is outside [0, %d)", flatIndex, rawData.size()));
        return rawData.get(flatIndex);
    }

    @Override
    public Optional<D> getDataPoint(int series, int time) {
        int index = getDataIndex(series, time);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(rawData.get(index));
    }

    @Override
    public int getDataIndex(int series, int time) {
        NavigableMap<Integer, Integer> seriesIndices = dataIndices.get(series);
        if (seriesIndices == null) {
            return MISSING_INDEX;
        }
        Integer index = seriesIndices.get(time);
        return (index == null) ? MISSING_INDEX : index;
    }

    /**
     * Registers an observer. Observers are notified in registration order.
     *
     * @param observer the callback to invoke after each structural change
     * @return a handle that can be used to stop the notifications
     */
    public Subscription addObserver(IDataChangeObserver observer) {
        checkNotNull(observer, "observer must not be null");
        Registration registration = new Registration(observer);
        Registration[] next = Arrays.copyOf(observers, observers.length + 1);
        next[observers.length] = registration;
        observers = next;
        return new Subscription(() -> removeObserver(registration));
    }

    public int getNumberOfObservers() {
        return observers.length;
    }

    void removeObserver(Registration registration) {
        Registration[] next = new Registration[observers.length];
        int count = 0;
        for (Registration candidate : observers) {
            if (candidate != registration) {
                next[count++] = candidate;
            }
        }
        observers = Arrays.copyOf(next, count);
    }

    void notifyObservers() {
        // a snapshot, so that observers may subscribe or unsubscribe while being notified
        Registration[] current = observers;
        for (Registration registration : current) {
            registration.observer.dataChanged();
        }
    }

    /**
     * @return a copy of the selector of series observed at {@code time}
     */
    @Override
    public Selector getObserved(int time) {
        checkTime(time);
        if (time >= observed.size()) {
            return new Selector(numberOfSeries, false);
        }
        return observed.get(time).copy();
    }

    @Override
    public boolean isObserved(int series, int time) {
        checkTime(time);
        return time < observed.size() && observed.get(time).contains(series);
    }

    @Override
    public int getNumberOfObservedSeries(int time) {
        checkTime(time);
        return (time < observed.size()) ? observed.get(time).getNumberOfVariablesIncluded() : 0;
    }

    /**
     * Overrides the observed status of the series at a time step, for example to
     * treat a recorded value as missing.
     *
     * @param time     a time step in {@code [0, getTimeDimension())}
     * @param selector a selector over the same number of series as the store
     */
    public void setObservedStatus(int time, Selector selector) {
        checkNotNull(selector, "selector must not be null");
        checkArgument(selector.getNumberOfVariablesPossible() == numberOfSeries,
                () -> String.format("wrong size selector passed to setObservedStatus: expected %d series, got %d",
                        numberOfSeries, selector.getNumberOfVariablesPossible()));
        checkState(!observed.isEmpty(), "no data has been added, observed status cannot be set");
        checkTime(time);
        checkState(time < observed.size(), "observed status cannot be set while the time step is being added");
        observed.set(time, selector.copy());
    }

    @Override
    public int getTotalSampleSize() {
        return rawData.size();
    }

    @Override
    public int[] getTimestamps(int series) {
        NavigableMap<Integer, Integer> seriesIndices = dataIndices.get(series);
        if (seriesIndices == null) {
            return new int[0];
        }
        return seriesIndices.keySet().stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Creates an independent store holding the same data points. The indices and
     * observed selectors are duplicated, so mutations of either store are not
     * visible in the other. Observers are not carried over.
     *
     * @return a copy of this store without observers
     */
    public MultivariateTimeSeriesStore<D> copy() {
        return new MultivariateTimeSeriesStore<>(this);
    }

    void checkTime(int time) {
        checkArgument(time >= 0 && time < timeDimension,
                () -> String.format("time %d is outside [0, %d)", time, timeDimension));
    }

    private static final class Registration {
        private final IDataChangeObserver observer;

        Registration(IDataChangeObserver observer) {
            this.observer = observer;
        }
    }
}
