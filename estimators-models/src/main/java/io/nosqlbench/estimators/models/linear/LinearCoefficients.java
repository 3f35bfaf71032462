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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;
import java.util.Objects;

/// Learned parameters of a linear model: one weight per feature column plus
/// an intercept.
///
/// @param weights the per-column weights
/// @param intercept the constant term, zero when not fitted
public record LinearCoefficients(double[] weights, double intercept) {

    public LinearCoefficients {
        Objects.requireNonNull(weights, "weights cannot be null");
        weights = weights.clone();
    }

    /// @return a copy of the per-column weights
    @Override
    public double[] weights() {
        return weights.clone();
    }

    /// Computes `x · weights + intercept` for every row.
    ///
    /// @param x features with one column per weight
    /// @return the linear response, one value per row
    public RealVector response(RealMatrix x) {
        RealVector out = new ArrayRealVector(x.operate(weights), false);
        return intercept == 0.0 ? out : out.mapAdd(intercept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearCoefficients that)) return false;
        return Double.compare(intercept, that.intercept) == 0 && Arrays.equals(weights, that.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(weights) + Double.hashCode(intercept);
    }

    @Override
    public String toString() {
        return "LinearCoefficients{weights=" + Arrays.toString(weights) + ", intercept=" + intercept + "}";
    }
}
