package io.nosqlbench.estimators.api;

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

import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.matrix.MatrixInputs;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// An estimator that can also be trained incrementally on successive batches.
public interface OnlineEstimator extends Estimator {

    @Override
    default FitMode fitMode() {
        return FitMode.ONLINE;
    }

    /// Updates the learned state with one batch.
    ///
    /// The first call on an unfitted model establishes the column count.
    /// A failed call leaves the learned state as it was.
    ///
    /// @param x batch features
    /// @param y batch targets, one per row
    /// @throws ShapeMismatchException if x's column count differs from the established one,
    ///     or y's length differs from x's rows
    void partialFit(RealMatrix x, RealVector y);

    /// Array form of [#partialFit(RealMatrix, RealVector)].
    ///
    /// @param x batch rows
    /// @param y batch targets
    default void partialFit(double[][] x, double[] y) {
        partialFit(MatrixInputs.asMatrix(x), MatrixInputs.asVector(y));
    }
}
