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
 * Hyperparameters of {@link SgdRegressor}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "fit_intercept": true,    // optional, default true
 *   "l2_penalty": 0.0,        // optional, default 0
 *   "learning_rate": 0.01,    // optional, default 0.01
 *   "epochs": 5               // optional, default 5, passes made by fit
 * }
 * }</pre>
 */
public final class SgdRegressorConfig implements ModelConfig {

    /** Model type identifier. */
    public static final String MODEL_TYPE = "sgd_regressor";

    private static final double DEFAULT_LEARNING_RATE = 0.01;
    private static final int DEFAULT_EPOCHS = 5;

    @SerializedName("fit_intercept")
    private Boolean fitIntercept;

    @SerializedName("l2_penalty")
    private Double l2Penalty;

    @SerializedName("learning_rate")
    private Double learningRate;

    @SerializedName("epochs")
    private Integer epochs;

    private SgdRegressorConfig() {
    }

    private SgdRegressorConfig(boolean fitIntercept, double l2Penalty, double learningRate, int epochs) {
        this.fitIntercept = fitIntercept;
        this.l2Penalty = l2Penalty;
        this.learningRate = learningRate;
        this.epochs = epochs;
    }

    /**
     * @return the default config
     */
    public static SgdRegressorConfig defaults() {
        return new SgdRegressorConfig(true, 0.0, DEFAULT_LEARNING_RATE, DEFAULT_EPOCHS);
    }

    public SgdRegressorConfig withFitIntercept(boolean fitIntercept) {
        return new SgdRegressorConfig(fitIntercept, l2Penalty(), learningRate(), epochs());
    }

    public SgdRegressorConfig withL2Penalty(double l2Penalty) {
        return new SgdRegressorConfig(fitIntercept(), l2Penalty, learningRate(), epochs());
    }

    public SgdRegressorConfig withLearningRate(double learningRate) {
        return new SgdRegressorConfig(fitIntercept(), l2Penalty(), learningRate, epochs());
    }

    public SgdRegressorConfig withEpochs(int epochs) {
        return new SgdRegressorConfig(fitIntercept(), l2Penalty(), learningRate(), epochs);
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

    public int epochs() {
        return epochs != null ? epochs : DEFAULT_EPOCHS;
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
        if (epochs() < 1) {
            throw new IllegalArgumentException("epochs must be >= 1, got " + epochs());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SgdRegressorConfig that)) return false;
        return fitIntercept() == that.fitIntercept()
            && Double.compare(l2Penalty(), that.l2Penalty()) == 0
            && Double.compare(learningRate(), that.learningRate()) == 0
            && epochs() == that.epochs();
    }

    @Override
    public int hashCode() {
        return Objects.hash(fitIntercept(), l2Penalty(), learningRate(), epochs());
    }

    @Override
    public String toString() {
        return "SgdRegressorConfig{fitIntercept=" + fitIntercept() + ", l2Penalty=" + l2Penalty()
            + ", learningRate=" + learningRate() + ", epochs=" + epochs() + "}";
    }
}
