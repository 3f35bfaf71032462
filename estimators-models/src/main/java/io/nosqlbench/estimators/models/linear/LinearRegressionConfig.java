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
 * Hyperparameters of {@link LinearRegression}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "fit_intercept": true,   // optional, default true
 *   "l2_penalty": 0.0        // optional, default 0 (ordinary least squares)
 * }
 * }</pre>
 */
public final class LinearRegressionConfig implements ModelConfig {

    /** Model type identifier. */
    public static final String MODEL_TYPE = "linear_regression";

    @SerializedName("fit_intercept")
    private Boolean fitIntercept;

    @SerializedName("l2_penalty")
    private Double l2Penalty;

    private LinearRegressionConfig() {
    }

    private LinearRegressionConfig(boolean fitIntercept, double l2Penalty) {
        this.fitIntercept = fitIntercept;
        this.l2Penalty = l2Penalty;
    }

    /**
     * Ordinary least squares with an intercept.
     *
     * @return the default config
     */
    public static LinearRegressionConfig defaults() {
        return new LinearRegressionConfig(true, 0.0);
    }

    /**
     * @param fitIntercept whether to learn a constant term
     * @return a copy with the given setting
     */
    public LinearRegressionConfig withFitIntercept(boolean fitIntercept) {
        return new LinearRegressionConfig(fitIntercept, l2Penalty());
    }

    /**
     * @param l2Penalty ridge penalty on the weights, not applied to the intercept
     * @return a copy with the given penalty
     */
    public LinearRegressionConfig withL2Penalty(double l2Penalty) {
        return new LinearRegressionConfig(fitIntercept(), l2Penalty);
    }

    public boolean fitIntercept() {
        return fitIntercept == null || fitIntercept;
    }

    public double l2Penalty() {
        return l2Penalty != null ? l2Penalty : 0.0;
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
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearRegressionConfig that)) return false;
        return fitIntercept() == that.fitIntercept() && Double.compare(l2Penalty(), that.l2Penalty()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fitIntercept(), l2Penalty());
    }

    @Override
    public String toString() {
        return "LinearRegressionConfig{fitIntercept=" + fitIntercept() + ", l2Penalty=" + l2Penalty() + "}";
    }
}
