package io.nosqlbench.estimators.models.decompose;

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
 * Hyperparameters of {@link IncrementalSvd}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "rank": 2,                // required, number of components
 *   "projection_ridge": 0.0   // optional, default 0, ridge used by transform
 * }
 * }</pre>
 */
public final class IncrementalSvdConfig implements ModelConfig {

    /** Model type identifier. */
    public static final String MODEL_TYPE = "incremental_svd";

    @SerializedName("rank")
    private Integer rank;

    @SerializedName("projection_ridge")
    private Double projectionRidge;

    private IncrementalSvdConfig() {
    }

    private IncrementalSvdConfig(int rank, double projectionRidge) {
        this.rank = rank;
        this.projectionRidge = projectionRidge;
    }

    /**
     * @param rank number of components to keep
     * @return a config keeping {@code rank} components
     */
    public static IncrementalSvdConfig ofRank(int rank) {
        return new IncrementalSvdConfig(rank, 0.0);
    }

    /**
     * @param projectionRidge ridge penalty applied when projecting new data
     * @return a copy with the given ridge
     */
    public IncrementalSvdConfig withProjectionRidge(double projectionRidge) {
        return new IncrementalSvdConfig(rank(), projectionRidge);
    }

    /**
     * @return the number of components
     * @throws IllegalStateException if no rank was configured
     */
    public int rank() {
        if (rank == null) {
            throw new IllegalStateException("rank is required");
        }
        return rank;
    }

    public double projectionRidge() {
        return projectionRidge != null ? projectionRidge : 0.0;
    }

    @Override
    public String modelType() {
        return MODEL_TYPE;
    }

    @Override
    public void validate() {
        if (rank == null || rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1, got " + rank);
        }
        if (!(projectionRidge() >= 0) || Double.isInfinite(projectionRidge())) {
            throw new IllegalArgumentException("projection_ridge must be a finite value >= 0, got " + projectionRidge());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IncrementalSvdConfig that)) return false;
        return Objects.equals(rank, that.rank) && Double.compare(projectionRidge(), that.projectionRidge()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, projectionRidge());
    }

    @Override
    public String toString() {
        return "IncrementalSvdConfig{rank=" + rank + ", projectionRidge=" + projectionRidge() + "}";
    }
}
