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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.statespace.data.MultivariateRegressionData;

public class MultivariateTimeSeriesStoreTest {

    private int numberOfSeries;
    private MultivariateTimeSeriesStore<MultivariateRegressionData> store;

    @BeforeEach
    public void setUp() {
        numberOfSeries = 4;
        store = new MultivariateTimeSeriesStore<>(numberOfSeries);
    }

    private static MultivariateRegressionData point(int series, int time) {
        return new MultivariateRegressionData(series, time, series + 0.1 * time, new double[] { 1.0 });
    }

    @Test
    public void testNew() {
        assertEquals(numberOfSeries, store.getNumberOfSeries());
        assertEquals(0, store.getTimeDimension());
        assertEquals(0, store.getTotalSampleSize());
        assertEquals(MultivariateTimeSeriesStore.MISSING_INDEX, store.getDataIndex(0, 0));
        assertFalse(store.getDataPoint(0, 0).isPresent());
        assertThrows(IllegalArgumentException.class, () -> new MultivariateTimeSeriesStore<>(0));
        assertThrows(IllegalArgumentException.class, () -> new MultivariateTimeSeriesStore<>(-3));
    }

    @Test
    public void testTimeDimensionTracksLargestTimestamp() {
        Random random = new Random(17);
        int largest = -1;
        for (int i = 0; i < 200; i++) {
            int time = random.nextInt(50);
            store.add(point(random.nextInt(numberOfSeries), time));
            largest = Math.max(largest, time);
            assertEquals(largest + 1, store.getTimeDimension());
            assertEquals(i + 1, store.getTotalSampleSize());
        }
    }

    @Test
    public void testLookupAfterAdd() {
        Random random = new Random(3);
        for (int i = 0; i < 100; i++) {
            MultivariateRegressionData data = point(random.nextInt(numberOfSeries), random.nextInt(30));
            store.add(data);
            Optional<MultivariateRegressionData> found = store.getDataPoint(data.getSeries(), data.getTimestamp());
            assertTrue(found.isPresent());
            assertSame(data, found.get());
            int index = store.getDataIndex(data.getSeries(), data.getTimestamp());
            assertEquals(i, index);
            assertSame(data, store.getDataPoint(index));
            assertTrue(store.isObserved(data.getSeries(), data.getTimestamp()));
        }
    }

    @Test
    public void testMissingCoordinates() {
        store.add(point(1, 2));
        store.add(point(3, 6));

        assertEquals(-1, store.getDataIndex(0, 2));
        assertEquals(-1, store.getDataIndex(1, 3));
        assertEquals(-1, store.getDataIndex(1, 100));
        assertEquals(-1, store.getDataIndex(17, 2));
        assertFalse(store.getDataPoint(0, 2).isPresent());
        for (int time = 0; time < store.getTimeDimension(); time++) {
            for (int series = 0; series < numberOfSeries; series++) {
                boolean present = (series == 1 && time == 2) || (series == 3 && time == 6);
                assertEquals(present, store.isObserved(series, time));
                assertEquals(present, store.getDataIndex(series, time) >= 0);
            }
        }
    }

    @Test
    public void testObservedMaskContainsExactlyTheAddedSeries() {
        store.add(point(0, 5));
        store.add(point(2, 5));

        assertEquals(6, store.getTimeDimension());
        Selector observed = store.getObserved(5);
        assertEquals(numberOfSeries, observed.getNumberOfVariablesPossible());
        assertArrayEquals(new int[] { 0, 2 }, observed.includedPositions());
        assertEquals(2, store.getNumberOfObservedSeries(5));
        for (int time = 0; time < 5; time++) {
            assertTrue(store.getObserved(time).isEmpty());
        }
    }

    @Test
    public void testGetObservedReturnsACopy() {
        store.add(point(0, 0));
        store.getObserved(0).add(3);
        assertFalse(store.isObserved(3, 0));
    }

    @Test
    public void testClear() {
        MultivariateRegressionData first = point(2, 4);
        store.add(first);
        store.add(point(0, 9));
        IDataChangeObserver observer = mock(IDataChangeObserver.class);
        store.addObserver(observer);

        store.clear();
        assertEquals(0, store.getTimeDimension());
        assertEquals(0, store.getTotalSampleSize());
        assertEquals(-1, store.getDataIndex(2, 4));
        assertEquals(numberOfSeries, store.getNumberOfSeries());
        assertEquals(1, store.getNumberOfObservers());
        assertThrows(IllegalArgumentException.class, () -> store.getObserved(0));
        verify(observer, times(1)).dataChanged();

        // behaves like a fresh store
        store.add(first);
        assertEquals(5, store.getTimeDimension());
        assertEquals(1, store.getTotalSampleSize());
        assertEquals(0, store.getDataIndex(2, 4));
        assertArrayEquals(new int[] { 2 }, store.getObserved(4).includedPositions());
    }

    @Test
    public void testObserversFireInRegistrationOrder() {
        List<Integer> calls = new ArrayList<>();
        int numberOfObservers = 3;
        for (int k = 0; k < numberOfObservers; k++) {
            final int id = k;
            store.addObserver(() -> calls.add(id));
        }
        int adds = 5;
        for (int i = 0; i < adds; i++) {
            store.add(point(i % numberOfSeries, i));
        }
        store.clear();

        assertEquals(numberOfObservers * (adds + 1), calls.size());
        for (int i = 0; i < calls.size(); i++) {
            assertEquals(i % numberOfObservers, calls.get(i));
        }
    }

    @Test
    public void testObserversRunBeforeObservedStatusIsUpdated() {
        store.add(point(0, 3));
        List<Boolean> observedDuringAdd = new ArrayList<>();
        List<Integer> sampleSizeDuringAdd = new ArrayList<>();
        store.addObserver(() -> {
            observedDuringAdd.add(store.isObserved(2, 3));
            sampleSizeDuringAdd.add(store.getTotalSampleSize());
        });

        store.add(point(2, 3));
        assertThat(observedDuringAdd, contains(false));
        assertThat(sampleSizeDuringAdd, contains(2));
        assertEquals(1, store.getDataIndex(2, 3));
        assertTrue(store.isObserved(2, 3));
        assertEquals(2, store.getNumberOfObservedSeries(3));
    }

    @Test
    public void testObserversSeeNewTimeStepAsMissing() {
        store.add(point(0, 1));
        List<Integer> observedCounts = new ArrayList<>();
        List<Integer> timeDimensions = new ArrayList<>();
        store.addObserver(() -> {
            timeDimensions.add(store.getTimeDimension());
            observedCounts.add(store.getNumberOfObservedSeries(store.getTimeDimension() - 1));
            assertTrue(store.getObserved(store.getTimeDimension() - 1).isEmpty());
            assertThrows(IllegalStateException.class,
                    () -> store.setObservedStatus(4, new Selector(numberOfSeries, true)));
        });

        store.add(point(1, 4));
        assertThat(timeDimensions, contains(5));
        assertThat(observedCounts, contains(0));
        assertEquals(1, store.getNumberOfObservedSeries(4));
        assertTrue(store.isObserved(1, 4));
        assertFalse(store.isObserved(1, 2));
    }

    @Test
    public void testUnsubscribe() {
        IDataChangeObserver first = mock(IDataChangeObserver.class);
        IDataChangeObserver second = mock(IDataChangeObserver.class);
        Subscription firstSubscription = store.addObserver(first);
        store.addObserver(second);

        store.add(point(0, 0));
        firstSubscription.unsubscribe();
        assertFalse(firstSubscription.isActive());
        store.add(point(1, 0));
        firstSubscription.unsubscribe();

        verify(first, times(1)).dataChanged();
        verify(second, times(2)).dataChanged();
        assertEquals(1, store.getNumberOfObservers());
    }

    @Test
    public void testUnsubscribeDuringNotification() {
        IDataChangeObserver later = mock(IDataChangeObserver.class);
        List<Subscription> holder = new ArrayList<>();
        holder.add(store.addObserver(() -> holder.get(0).unsubscribe()));
        store.addObserver(later);

        store.add(point(0, 1));
        store.add(point(0, 2));
        verify(later, times(2)).dataChanged();
        assertEquals(1, store.getNumberOfObservers());
    }

    @Test
    public void testSameObserverRegisteredTwice() {
        IDataChangeObserver observer = mock(IDataChangeObserver.class);
        Subscription first = store.addObserver(observer);
        store.addObserver(observer);
        first.unsubscribe();
        store.add(point(0, 0));
        verify(observer, times(1)).dataChanged();
    }

    @Test
    public void testDuplicateCoordinateReindexesToLatest() {
        MultivariateRegressionData original = point(1, 1);
        MultivariateRegressionData replacement = new MultivariateRegressionData(1, 1, 42.0, new double[] { 1.0 });
        store.add(original);
        store.add(replacement);

        assertEquals(2, store.getTotalSampleSize());
        assertEquals(1, store.getDataIndex(1, 1));
        assertSame(replacement, store.getDataPoint(1, 1).get());
        assertSame(original, store.getDataPoint(0));
        assertEquals(1, store.getNumberOfObservedSeries(1));
    }

    @Test
    public void testInvalidAdd() {
        assertThrows(NullPointerException.class, () -> store.add(null));
        assertThrows(IllegalArgumentException.class, () -> store.add(point(numberOfSeries, 0)));
        assertEquals(0, store.getTotalSampleSize());
    }

    @Test
    public void testInvalidPositionalAccess() {
        store.add(point(0, 0));
        assertThrows(IllegalArgumentException.class, () -> store.getDataPoint(-1));
        assertThrows(IllegalArgumentException.class, () -> store.getDataPoint(1));
        assertThrows(IllegalArgumentException.class, () -> store.getObserved(1));
        assertThrows(IllegalArgumentException.class, () -> store.getObserved(-1));
    }

    @Test
    public void testSetObservedStatus() {
        store.add(point(0, 0));
        store.add(point(1, 2));
        IDataChangeObserver observer = mock(IDataChangeObserver.class);
        store.addObserver(observer);

        Selector mask = new Selector(numberOfSeries).add(3);
        store.setObservedStatus(2, mask);
        assertArrayEquals(new int[] { 3 }, store.getObserved(2).includedPositions());
        assertFalse(store.isObserved(1, 2));
        // the coordinate index is unaffected
        assertEquals(1, store.getDataIndex(1, 2));

        mask.add(0);
        assertFalse(store.isObserved(0, 2));
        verify(observer, never()).dataChanged();
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 5, 100 })
    public void testSetObservedStatusRejectsWrongSize(int time) {
        assertThrows(IllegalArgumentException.class,
                () -> store.setObservedStatus(time, new Selector(numberOfSeries + 1)));
        for (int t = 0; t < 6; t++) {
            store.add(point(t % numberOfSeries, t));
        }
        assertThrows(IllegalArgumentException.class,
                () -> store.setObservedStatus(time, new Selector(numberOfSeries + 1)));
    }

    @Test
    public void testSetObservedStatusOnEmptyStore() {
        assertThrows(IllegalStateException.class, () -> store.setObservedStatus(0, new Selector(numberOfSeries)));
        store.add(point(0, 1));
        assertThrows(IllegalArgumentException.class, () -> store.setObservedStatus(2, new Selector(numberOfSeries)));
        assertDoesNotThrow(() -> store.setObservedStatus(0, new Selector(numberOfSeries, true)));
    }

    @Test
    public void testTimestampsPerSeries() {
        store.add(point(2, 7));
        store.add(point(2, 1));
        store.add(point(0, 4));
        store.add(point(2, 3));

        assertArrayEquals(new int[] { 1, 3, 7 }, store.getTimestamps(2));
        assertArrayEquals(new int[] { 4 }, store.getTimestamps(0));
        assertArrayEquals(new int[0], store.getTimestamps(1));
    }

    @Test
    public void testCopyIsIndependent() {
        IDataChangeObserver observer = mock(IDataChangeObserver.class);
        store.addObserver(observer);
        MultivariateRegressionData shared = point(1, 1);
        store.add(shared);

        MultivariateTimeSeriesStore<MultivariateRegressionData> copy = store.copy();
        assertEquals(0, copy.getNumberOfObservers());
        assertSame(shared, copy.getDataPoint(0));
        assertEquals(store.getTimeDimension(), copy.getTimeDimension());

        copy.add(point(3, 4));
        copy.setObservedStatus(1, new Selector(numberOfSeries));
        assertEquals(1, store.getTotalSampleSize());
        assertEquals(2, store.getTimeDimension());
        assertTrue(store.isObserved(1, 1));
        assertEquals(-1, store.getDataIndex(3, 4));

        store.clear();
        assertEquals(2, copy.getTotalSampleSize());
        assertEquals(0, store.getTimestamps(1).length);
        assertArrayEquals(new int[] { 1 }, copy.getTimestamps(1));
        verify(observer, times(2)).dataChanged();
    }
}
