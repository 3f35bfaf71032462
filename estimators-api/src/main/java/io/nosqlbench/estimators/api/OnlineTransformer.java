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

/// A transformer that can also be trained incrementally on successive batches.
public interface OnlineTransformer extends Transformer {

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
    /// @throws ShapeMismatchException if x's column count differs from the established one
    void partialFit(RealMatrix x);

    /// Array form of [#partialFit(RealMatrix)].
    ///
    /// @param x batch rows
    /// @throws ShapeMismatchException if x has no rows
    default void partialFit(double[][] x) {
        partialFit(MatrixInputs.asMatrix(x));
    }
}
