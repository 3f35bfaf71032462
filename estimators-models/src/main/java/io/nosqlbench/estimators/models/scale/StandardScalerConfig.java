package io.nosqlbench.estimators.models.scale;

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
 * Hyperparameters of {@link StandardScaler}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "with_mean": true,   // optional, default true, subtract the column mean
 *   "with_std": true     // optional, default true, divide by the column standard deviation
 * }
 * }</pre>
 */
public final class StandardScalerConfig implements ModelConfig {

    /** Model type identifier. */
    public static final String MODEL_TYPE = "standard_scaler";

    @SerializedName("with_mean")
    private Boolean withMean;

    @SerializedName("with_std")
    private Boolean withStd;

    private StandardScalerConfig() {
    }

    private StandardScalerConfig(boolean withMean, boolean withStd) {
        this.withMean = withMean;
        this.withStd = withStd;
    }

    /**
     * Centers and scales every column.
     *
     * @return the default config
     */
    public static StandardScalerConfig defaults() {
        return new StandardScalerConfig(true, true);
    }

    public StandardScalerConfig withMean(boolean withMean) {
        return new StandardScalerConfig(withMean, withStd());
    }

    public StandardScalerConfig withStd(boolean withStd) {
        return new StandardScalerConfig(withMean(), withStd);
    }

    public boolean withMean() {
        return withMean == null || withMean;
    }

    public boolean withStd() {
        return withStd == null || withStd;
    }

    @Override
    public String modelType() {
        return MODEL_TYPE;
    }

    @Override
    public void validate() {
        // every combination of flags is legal
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StandardScalerConfig that)) return false;
        return withMean() == that.withMean() && withStd() == that.withStd();
    }

    @Override
    public int hashCode() {
        return Objects.hash(withMean(), withStd());
    }

    @Override
    public String toString() {
        return "StandardScalerConfig{withMean=" + withMean() + ", withStd=" + withStd() + "}";
    }
}
