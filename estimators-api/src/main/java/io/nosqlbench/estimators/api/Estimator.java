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
import io.nosqlbench.estimators.errors.TypeMismatchException;
import io.nosqlbench.estimators.errors.UnsupportedFormatException;
import io.nosqlbench.estimators.matrix.MatrixInputs;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// A model trained on features and targets that predicts one value per row.
///
/// ```java
/// Estimator model = new LinearRegression(LinearRegressionConfig.defaults());
/// model.fit(x, y);
/// RealVector predictions = model.predict(newX);
/// ```
public interface Estimator extends Stage {

    @Override
    default ModelKind kind() {
        return ModelKind.ESTIMATOR;
    }

    /// Trains this model, replacing any earlier learned state.
    ///
    /// If training fails the model is left unfitted.
    ///
    /// @param x feature matrix with n rows
    /// @param y target vector of length n; categorical targets as class codes
    /// @throws ShapeMismatchException if x has no rows or y's length differs from x's rows
    /// @throws TypeMismatchException if x is neither dense nor sparse
    /// @throws UnsupportedFormatException if x's format is not accepted
    void fit(RealMatrix x, RealVector y);

    /// Array form of [#fit(RealMatrix, RealVector)].
    ///
    /// @param x feature rows
    /// @param y targets, one per row
    default void fit(double[][] x, double[] y) {
        fit(MatrixInputs.asMatrix(x), MatrixInputs.asVector(y));
    }

    /// Predicts one value per row of x.
    ///
    /// @param x feature matrix with the fitted column count
    /// @return predictions, one per row, in row order
    /// @throws NotFittedException if the model is not fitted
    /// @throws ShapeMismatchException if x's column count differs from the fitted one
    RealVector predict(RealMatrix x);
}
