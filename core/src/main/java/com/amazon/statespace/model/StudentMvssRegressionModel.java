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

package com.amazon.statespace.model;

import static com.amazon.statespace.CommonUtils.checkArgument;
import static com.amazon.statespace.CommonUtils.checkNotNull;
import static com.amazon.statespace.CommonUtils.checkState;
import static com.amazon.statespace.CommonUtils.deepCopy;
import static com.amazon.statespace.CommonUtils.dotProduct;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.amazon.statespace.data.MultivariateRegressionData;
import com.amazon.statespace.sampler.IPosteriorSampler;
import com.amazon.statespace.sampler.TDataImputer;
import com.amazon.statespace.statistics.WeightedRegressionSufficientStatistics;
import com.amazon.statespace.store.IMultivariateTimeSeriesStoreView;
import com.amazon.statespace.store.MultivariateTimeSeriesStore;
import com.amazon.statespace.store.Selector;

/**
 * <p>
 * A multivariate state space regression model with Student-t observation
 * errors. Each series {@code s} observed at time {@code t} follows
 * </p>
 *
 * <pre>
 *     y[s, t] = state[s, t] + x[s, t]' beta[s] + e[s, t],    e[s, t] ~ T(0, sigma[s], nu[s])
 * </pre>
 *
 * <p>
 * The error is represented as a scale mixture of normals with one latent weight
 * per observation. Given the weights the model is conditionally Gaussian, and
 * the complete data sufficient statistics for each series' regression are
 * accumulated when the weights are imputed.
 * </p>
 *
 * <p>
 * The data live in a {@link MultivariateTimeSeriesStore} owned by the model.
 * The model observes its store: whenever data is added or cleared the weights
 * are resized, the sufficient statistics are cleared and the cached state
 * contribution is dropped.
 * </p>
 *
 * <p>
 * State imputation and parameter draws are delegated to collaborators
 * ({@link IStateImputer}, {@link IPosteriorSampler}); without a state imputer
 * the state contribution is zero.
 * </p>
 */
@Log4j2
public class StudentMvssRegressionModel implements IMultivariateStateSpaceModel<StudentMvssRegressionModel> {

    public static final int DEFAULT_PREDICTOR_DIMENSION = 1;

    public static final double DEFAULT_RESIDUAL_SD = 1.0;

    public static final double DEFAULT_DEGREES_OF_FREEDOM = 3.0;

    public static final double DEFAULT_WEIGHT = 1.0;

    @Getter
    private final int numberOfSeries;

    @Getter
    private final int predictorDimension;

    private final MultivariateTimeSeriesStore<MultivariateRegressionData> store;

    /**
     * coefficients[s] is the regression coefficient vector of series s
     */
    private final double[][] coefficients;

    private final double[] residualSd;

    private final double[] degreesOfFreedom;

    /**
     * latent weights indexed by the flat index of the data point
     */
    private double[] weights;

    private final WeightedRegressionSufficientStatistics[] sufficientStatistics;

    private final TDataImputer dataImputer;

    private IStateImputer<StudentMvssRegressionModel> stateImputer;

    private final List<IPosteriorSampler<StudentMvssRegressionModel>> parameterSamplers;

    /**
     * stateContribution[s][t], null until the state is imputed and after any
     * change to the data
     */
    private double[][] stateContribution;

    public StudentMvssRegressionModel(Builder builder) {
        checkArgument(builder.numberOfSeries > 0, "number of series must be positive");
        checkArgument(builder.predictorDimension >= 0, "predictor dimension must be non-negative");
        checkArgument(builder.residualSd > 0, "residual standard deviation must be positive");
        checkArgument(builder.degreesOfFreedom > 0, "degrees of freedom must be positive");
        this.numberOfSeries = builder.numberOfSeries;
        this.predictorDimension = builder.predictorDimension;
        this.store = new MultivariateTimeSeriesStore<>(numberOfSeries);
        this.coefficients = new double[numberOfSeries][predictorDimension];
        this.residualSd = new double[numberOfSeries];
        Arrays.fill(residualSd, builder.residualSd);
        this.degreesOfFreedom = new double[numberOfSeries];
        Arrays.fill(degreesOfFreedom, builder.degreesOfFreedom);
        this.weights = new double[0];
        this.sufficientStatistics = new WeightedRegressionSufficientStatistics[numberOfSeries];
        for (int s = 0; s < numberOfSeries; s++) {
            sufficientStatistics[s] = new WeightedRegressionSufficientStatistics(predictorDimension);
        }
        this.dataImputer = new TDataImputer();
        this.stateImputer = builder.stateImputer;
        this.parameterSamplers = new ArrayList<>(builder.parameterSamplers);
        store.addObserver(this::onDataChange);
    }

    private StudentMvssRegressionModel(StudentMvssRegressionModel other) {
        this.numberOfSeries = other.numberOfSeries;
        this.predictorDimension = other.predictorDimension;
        this.store = other.store.copy();
        this.coefficients = deepCopy(other.coefficients);
        this.residualSd = Arrays.copyOf(other.residualSd, numberOfSeries);
        this.degreesOfFreedom = Arrays.copyOf(other.degreesOfFreedom, numberOfSeries);
        this.weights = Arrays.copyOf(other.weights, other.weights.length);
        this.sufficientStatistics = new WeightedRegressionSufficientStatistics[numberOfSeries];
        for (int s = 0; s < numberOfSeries; s++) {
            sufficientStatistics[s] = other.sufficientStatistics[s].copy();
        }
        this.dataImputer = other.dataImputer;
        this.stateImputer = other.stateImputer;
        this.parameterSamplers = new ArrayList<>(other.parameterSamplers);
        this.stateContribution = deepCopy(other.stateContribution);
        store.addObserver(this::onDataChange);
    }

    public static Builder builder() {
        return new Builder();
    }

    void onDataChange() {
        int size = store.getTotalSampleSize();
        if (size < weights.length) {
            weights = new double[size];
            Arrays.fill(weights, DEFAULT_WEIGHT);
        } else if (size > weights.length) {
            int oldSize = weights.length;
            weights = Arrays.copyOf(weights, size);
            Arrays.fill(weights, oldSize, size, DEFAULT_WEIGHT);
        }
        clearCompleteDataSufficientStatistics();
        stateContribution = null;
    }

    /**
     * Adds an observation to the model.
     *
     * @param data an observation whose predictor vector has the dimension of the
     *             model
     */
    public void addData(MultivariateRegressionData data) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.getPredictorDimension() == predictorDimension,
                () -> String.format("expected %d predictors, got %d", predictorDimension,
                        data.getPredictorDimension()));
        store.add(data);
    }

    public void clearData() {
        store.clear();
    }

    /**
     * @return a read only view of the data held by the model
     */
    public IMultivariateTimeSeriesStoreView<MultivariateRegressionData> getData() {
        return store;
    }

    public void setObservedStatus(int time, Selector observed) {
        store.setObservedStatus(time, observed);
    }

    @Override
    public int getTimeDimension() {
        return store.getTimeDimension();
    }

    public double[] getCoefficients(int series) {
        return Arrays.copyOf(coefficients[series], predictorDimension);
    }

    public void setCoefficients(int series, double[] beta) {
        checkNotNull(beta, "coefficients must not be null");
        checkArgument(beta.length == predictorDimension, "incorrect number of coefficients");
        System.arraycopy(beta, 0, coefficients[series], 0, predictorDimension);
    }

    public double getResidualSd(int series) {
        return residualSd[series];
    }

    public void setResidualSd(int series, double sigma) {
        checkArgument(sigma > 0, "residual standard deviation must be positive");
        residualSd[series] = sigma;
    }

    public double getDegreesOfFreedom(int series) {
        return degreesOfFreedom[series];
    }

    public void setDegreesOfFreedom(int series, double nu) {
        checkArgument(nu > 0, "degrees of freedom must be positive");
        degreesOfFreedom[series] = nu;
    }

    public double getWeight(int flatIndex) {
        checkArgument(flatIndex >= 0 && flatIndex < weights.length, "incorrect flat index");
        return weights[flatIndex];
    }

    public double[] getWeights() {
        return Arrays.copyOf(weights, weights.length);
    }

    /**
     * @param series the series of interest
     * @return a copy of the complete data sufficient statistics of the series
     */
    public WeightedRegressionSufficientStatistics getSufficientStatistics(int series) {
        return sufficientStatistics[series].copy();
    }

    public void clearCompleteDataSufficientStatistics() {
        for (WeightedRegressionSufficientStatistics suf : sufficientStatistics) {
            suf.clear();
        }
    }

    public void setStateImputer(IStateImputer<StudentMvssRegressionModel> stateImputer) {
        this.stateImputer = stateImputer;
        this.stateContribution = null;
    }

    public void addParameterSampler(IPosteriorSampler<StudentMvssRegressionModel> sampler) {
        parameterSamplers.add(checkNotNull(sampler, "sampler must not be null"));
    }

    public List<IPosteriorSampler<StudentMvssRegressionModel>> getParameterSamplers() {
        return Collections.unmodifiableList(parameterSamplers);
    }

    /**
     * @param series the series of interest
     * @param time   the time step of interest
     * @return the most recently imputed contribution of the state to the
     *         observation, 0 if the state has not been imputed since the data last
     *         changed
     */
    public double getStateContribution(int series, int time) {
        if (stateContribution == null || time >= stateContribution[series].length) {
            return 0;
        }
        return stateContribution[series][time];
    }

    @Override
    public void imputeState(Random random) {
        if (stateImputer == null) {
            stateContribution = null;
            return;
        }
        double[][] contribution = stateImputer.impute(this, random);
        checkState(contribution != null && contribution.length == numberOfSeries,
                "state imputer returned an array with the wrong number of series");
        for (double[] row : contribution) {
            checkState(row.length >= getTimeDimension(), "state imputer returned too few time steps");
        }
        stateContribution = contribution;
    }

    @Override
    public void sampleParameterPosteriors(Random random) {
        for (IPosteriorSampler<StudentMvssRegressionModel> sampler : parameterSamplers) {
            sampler.draw(this, random);
        }
    }

    /**
     * Draws the latent weight of every observed data point given the current
     * state and parameters, and rebuilds the complete data sufficient statistics
     * from them. Points that were superseded by a later point at the same
     * coordinate, or whose coordinate is marked missing, keep their current
     * weight and do not contribute to the statistics.
     *
     * @param random the random stream of the chain
     */
    public void imputeStudentWeights(Random random) {
        checkNotNull(random, "random must not be null");
        int sampleSize = store.getTotalSampleSize();
        checkState(weights.length == sampleSize, "weights are out of sync with the data");
        clearCompleteDataSufficientStatistics();
        int imputed = 0;
        for (int i = 0; i < sampleSize; i++) {
            MultivariateRegressionData data = store.getDataPoint(i);
            int series = data.getSeries();
            int time = data.getTimestamp();
            if (store.getDataIndex(series, time) != i || !store.isObserved(series, time)) {
                continue;
            }
            double[] predictors = data.getPredictors();
            double adjustedResponse = data.getResponse() - getStateContribution(series, time);
            double residual = adjustedResponse - dotProduct(coefficients[series], predictors);
            double weight = dataImputer.impute(random, residual, residualSd[series], degreesOfFreedom[series]);
            weights[i] = weight;
            sufficientStatistics[series].update(predictors, adjustedResponse, weight);
            ++imputed;
        }
        log.trace("imputed {} of {} student weights", imputed, sampleSize);
    }

    @Override
    public StudentMvssRegressionModel copy() {
        return new StudentMvssRegressionModel(this);
    }

    public static class Builder {

        private int numberOfSeries;
        private int predictorDimension = DEFAULT_PREDICTOR_DIMENSION;
        private double residualSd = DEFAULT_RESIDUAL_SD;
        private double degreesOfFreedom = DEFAULT_DEGREES_OF_FREEDOM;
        private IStateImputer<StudentMvssRegressionModel> stateImputer;
        private final List<IPosteriorSampler<StudentMvssRegressionModel>> parameterSamplers = new ArrayList<>();

        public Builder numberOfSeries(int numberOfSeries) {
            this.numberOfSeries = numberOfSeries;
            return this;
        }

        public Builder predictorDimension(int predictorDimension) {
            this.predictorDimension = predictorDimension;
            return this;
        }

        public Builder residualSd(double residualSd) {
            this.residualSd = residualSd;
            return this;
        }

        public Builder degreesOfFreedom(double degreesOfFreedom) {
            this.degreesOfFreedom = degreesOfFreedom;
            return this;
        }

        public Builder stateImputer(IStateImputer<StudentMvssRegressionModel> stateImputer) {
            this.stateImputer = stateImputer;
            return this;
        }

        public Builder parameterSampler(IPosteriorSampler<StudentMvssRegressionModel> sampler) {
            this.parameterSamplers.add(checkNotNull(sampler, "sampler must not be null"));
            return this;
        }

        public StudentMvssRegressionModel build() {
            return new StudentMvssRegressionModel(this);
        }
    }
}
