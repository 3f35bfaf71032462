package io.nosqlbench.estimators.models.linear;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.estimators.config.ModelConfig;

import java.util.Objects;

/**
 * Hyperparameters of {@link LogisticRegression}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "fit_intercept": true,     // optional, default true
 *   "l2_penalty": 0.0,         // optional, default 0
 *   "learning_rate": 0.1,      // optional, default 0.1
 *   "max_iterations": 1000,    // optional, default 1000
 *   "tolerance": 1e-6          // optional, default 1e-6, on the largest gradient component
 * }
 * }</pre>
 */
public final class LogisticRegressionConfig implements ModelConfig {

    /** Model type identifier. */
    public static final String MODEL_TYPE = "logistic_regression";

    private static final double DEFAULT_LEARNING_RATE = 0.1;
    private static final int DEFAULT_MAX_ITERATIONS = 1000;
    private static final double DEFAULT_TOLERANCE = 1e-6;

    @SerializedName("fit_intercept")
    private Boolean fitIntercept;

    @SerializedName("l2_penalty")
    private Double l2Penalty;

    @SerializedName("learning_rate")
    private Double learningRate;

    @SerializedName("max_iterations")
    private Integer maxIterations;

    @SerializedName("tolerance")
    private Double tolerance;

    private LogisticRegressionConfig() {
    }

    private LogisticRegressionConfig(boolean fitIntercept, double l2Penalty, double learningRate,
                                     int maxIterations, double tolerance) {
        this.fitIntercept = fitIntercept;
        this.l2Penalty = l2Penalty;
        this.learningRate = learningRate;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * @return the default config
     */
    public static LogisticRegressionConfig defaults() {
        return new LogisticRegressionConfig(true, 0.0, DEFAULT_LEARNING_RATE, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public LogisticRegressionConfig withFitIntercept(boolean fitIntercept) {
        return new LogisticRegressionConfig(fitIntercept, l2Penalty(), learningRate(), maxIterations(), tolerance());
    }

    public LogisticRegressionConfig withL2Penalty(double l2Penalty) {
        return new LogisticRegressionConfig(fitIntercept(), l2Penalty, learningRate(), maxIterations(), tolerance());
    }

    public LogisticRegressionConfig withLearningRate(double learningRate) {
        return new LogisticRegressionConfig(fitIntercept(), l2Penalty(), learningRate, maxIterations(), tolerance());
    }

    public LogisticRegressionConfig withMaxIterations(int maxIterations) {
        return new LogisticRegressionConfig(fitIntercept(), l2Penalty(), learningRate(), maxIterations, tolerance());
    }

    public LogisticRegressionConfig withTolerance(double tolerance) {
        return new LogisticRegressionConfig(fitIntercept(), l2Penalty(), learningRate(), maxIterations(), tolerance);
    }

    public boolean fitIntercept() {
        return fitIntercept == null || fitIntercept;
    }

    public double l2Penalty() {
        return l2Penalty != null ? l2Penalty : 0.0;
    }

    public double learningRate() {
        return learningRate != null ? learningRate : DEFAULT_LEARNING_RATE;
    }

    public int maxIterations() {
        return maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
    }

    public double tolerance() {
        return tolerance != null ? tolerance : DEFAULT_TOLERANCE;
    }

    @Override
    public String modelType() {
        return MODEL_TYPE;
    }

    @Override
    public void validate() {
        if (!(l2Penalty() >= 0) || Double.isInfinite(l2Penalty())) {
            throw new IllegalArgumentException("l2_penalty must be a finite value >= 0, got " + l2Penalty());
        }
        if (!(learningRate() > 0) || Double.isInfinite(learningRate())) {
            throw new IllegalArgumentException("learning_rate must be a finite value > 0, got " + learningRate());
        }
        if (maxIterations() < 1) {
            throw new IllegalArgumentException("max_iterations must be >= 1, got " + maxIterations());
        }
        if (!(tolerance() >= 0)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogisticRegressionConfig that)) return false;
        return fitIntercept() == that.fitIntercept()
            && Double.compare(l2Penalty(), that.l2Penalty()) == 0
            && Double.compare(learningRate(), that.learningRate()) == 0
            && maxIterations() == that.maxIterations()
            && Double.compare(tolerance(), that.tolerance()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fitIntercept(), l2Penalty(), learningRate(), maxIterations(), tolerance());
    }

    @Override
    public String toString() {
        return "LogisticRegressionConfig{fitIntercept=" + fitIntercept() + ", l2Penalty=" + l2Penalty()
            + ", learningRate=" + learningRate() + ", maxIterations=" + maxIterations()
            + ", tolerance=" + tolerance() + "}";
    }
}
