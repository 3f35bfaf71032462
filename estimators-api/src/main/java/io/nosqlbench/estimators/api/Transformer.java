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

import io.nosqlbench.estimators.errors.NotFittedException;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.matrix.MatrixInputs;
import org.apache.commons.math3.linear.RealMatrix;

/// A model that maps a feature matrix to another feature matrix with the
/// same rows and possibly a different number of columns.
///
/// Fitting and first application are one operation: [#fitTransform]
/// trains on x and returns x transformed by the freshly learned state.
/// Row i of the output always corresponds to row i of the input.
public interface Transformer extends Stage {

    @Override
    default ModelKind kind() {
        return ModelKind.TRANSFORMER;
    }

    /// Trains on x, replacing any earlier learned state, and returns x transformed.
    ///
    /// @param x feature matrix
    /// @return the transformed matrix, same row count as x
    /// @throws ShapeMismatchException if x has no rows
    RealMatrix fitTransform(RealMatrix x);

    /// Array form of [#fitTransform(RealMatrix)].
    ///
    /// @param x feature rows
    /// @return the transformed matrix
    default RealMatrix fitTransform(double[][] x) {
        return fitTransform(MatrixInputs.asMatrix(x));
    }

    /// Applies the learned state to new data.
    ///
    /// @param x feature matrix with the fitted column count
    /// @return the transformed matrix, same row count as x
    /// @throws NotFittedException if the model is not fitted
    /// @throws ShapeMismatchException if x's column count differs from the fitted one
    RealMatrix transform(RealMatrix x);
}
