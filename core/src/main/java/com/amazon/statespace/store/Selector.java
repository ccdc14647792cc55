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

import java.util.BitSet;

/**
 * A subset of a fixed universe of series indices {@code 0 ... n-1}. A selector
 * is used to record which series were observed at a given time step, so that
 * filtering recursions can visit only the observed series in time proportional
 * to the number of included positions.
 */
public class Selector {

    /**
     * the size of the universe, fixed at construction
     */
    private final int numberOfVariablesPossible;

    private final BitSet included;

    /**
     * Creates a selector in which every position is either included or excluded.
     *
     * @param numberOfVariablesPossible the size of the universe
     * @param allIncluded               true if every position starts out included
     */
    public Selector(int numberOfVariablesPossible, boolean allIncluded) {
        checkArgument(numberOfVariablesPossible >= 0, "universe size must be non-negative");
        this.numberOfVariablesPossible = numberOfVariablesPossible;
        this.included = new BitSet(numberOfVariablesPossible);
        if (allIncluded) {
            included.set(0, numberOfVariablesPossible);
        }
    }

    public Selector(int numberOfVariablesPossible) {
        this(numberOfVariablesPossible, false);
    }

    private Selector(Selector other) {
        this.numberOfVariablesPossible = other.numberOfVariablesPossible;
        this.included = (BitSet) other.included.clone();
    }

    public int getNumberOfVariablesPossible() {
        return numberOfVariablesPossible;
    }

    public int getNumberOfVariablesIncluded() {
        return included.cardinality();
    }

    public boolean contains(int position) {
        checkPosition(position);
        return included.get(position);
    }

    public Selector add(int position) {
        checkPosition(position);
        included.set(position);
        return this;
    }

    public Selector drop(int position) {
        checkPosition(position);
        included.clear(position);
        return this;
    }

    public boolean isEmpty() {
        return included.isEmpty();
    }

    public boolean isFull() {
        return included.cardinality() == numberOfVariablesPossible;
    }

    /**
     * @return the included positions in increasing order
     */
    public int[] includedPositions() {
        return included.stream().toArray();
    }

    public Selector copy() {
        return new Selector(this);
    }

    void checkPosition(int position) {
        checkArgument(position >= 0 && position < numberOfVariablesPossible,
                () -> String.format("position %d is outside the universe [0, %d)", position,
                        numberOfVariablesPossible));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Selector)) {
            return false;
        }
        Selector that = (Selector) other;
        return numberOfVariablesPossible == that.numberOfVariablesPossible && included.equals(that.included);
    }

    @Override
    public int hashCode() {
        return 31 * numberOfVariablesPossible + included.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(numberOfVariablesPossible);
        for (int i = 0; i < numberOfVariablesPossible; i++) {
            builder.append(included.get(i) ? '1' : '0');
        }
        return builder.toString();
    }
}
