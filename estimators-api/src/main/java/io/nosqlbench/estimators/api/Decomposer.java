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
import org.apache.commons.math3.linear.RealMatrix;

/// A transformer that factors its input as `x ≈ P · Q`.
///
/// ## Storage convention
///
/// ```
///        x          ≈       P        ·         Q
///  (rows × cols)       (rows × rank)     (rank × cols)
///                       returned by       retained as
///                      fitTransform       components()
/// ```
///
/// `fitTransform(x)` returns P and keeps Q. `transform(x')` does not store
/// anything: it solves the least-squares problem `x' ≈ P' · Q` for P'
/// against the retained components. Applied to the training matrix it
/// reproduces the output of `fitTransform` within numerical tolerance.
public interface Decomposer extends Transformer {

    @Override
    default ModelKind kind() {
        return ModelKind.DECOMPOSER;
    }

    /// @return the number of factors, the column count of P
    int rank();

    /// Returns a copy of the retained components Q.
    ///
    /// @return Q, with [#rank()] rows and the fitted column count
    /// @throws NotFittedException if the model is not fitted
    RealMatrix components();
}
