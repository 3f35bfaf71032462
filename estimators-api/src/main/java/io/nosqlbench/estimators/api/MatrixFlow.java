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

import io.nosqlbench.estimators.matrix.MatrixInputs;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Objects;

/// Left-to-right composition of stages over one matrix, without naming the
/// intermediate results.
///
/// ```java
/// RealVector predictions = MatrixFlow.of(newX)
///     .transform(scaler)
///     .transform(svd)
///     .predict(regression);
/// ```
///
/// Every step delegates to the stage's own method; a flow is equivalent to
/// the nested direct calls. Flows are immutable: each step returns a new
/// flow.
public final class MatrixFlow {

    private final RealMatrix matrix;

    private MatrixFlow(RealMatrix matrix) {
        this.matrix = matrix;
    }

    /// @param x the starting matrix
    /// @return a flow over x
    public static MatrixFlow of(RealMatrix x) {
        return new MatrixFlow(Objects.requireNonNull(x, "x cannot be null"));
    }

    /// @param x the starting rows
    /// @return a flow over x
    public static MatrixFlow of(double[][] x) {
        return new MatrixFlow(MatrixInputs.asMatrix(x));
    }

    /// @param stage a fitted transformer
    /// @return a flow over `stage.transform(matrix)`
    public MatrixFlow transform(Transformer stage) {
        return new MatrixFlow(Calls.transform(matrix, stage));
    }

    /// @param stage a transformer to train on the current matrix
    /// @return a flow over `stage.fitTransform(matrix)`
    public MatrixFlow fitTransform(Transformer stage) {
        return new MatrixFlow(Calls.fitTransform(matrix, stage));
    }

    /// Trains an estimator on the current matrix and ends the flow.
    ///
    /// @param y targets, one per row
    /// @param stage the estimator to train
    public void fit(RealVector y, Estimator stage) {
        Calls.fit(matrix, y, stage);
    }

    /// Ends the flow with a prediction.
    ///
    /// @param stage a fitted estimator
    /// @return `stage.predict(matrix)`
    public RealVector predict(Estimator stage) {
        return Calls.predict(matrix, stage);
    }

    /// @return the current matrix
    public RealMatrix matrix() {
        return matrix;
    }
}
