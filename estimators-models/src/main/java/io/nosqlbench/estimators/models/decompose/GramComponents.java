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

import io.nosqlbench.estimators.api.ComponentState;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Objects;

/// Learned parameters of [IncrementalSvd].
///
/// @param gram the accumulated Gram matrix XᵀX over every batch seen, cols × cols
/// @param components the leading eigenvectors of the Gram matrix as rows
/// @param singularValues square roots of the matching eigenvalues, descending
record GramComponents(RealMatrix gram, RealMatrix components, double[] singularValues) implements ComponentState {

    GramComponents {
        Objects.requireNonNull(gram, "gram cannot be null");
        Objects.requireNonNull(components, "components cannot be null");
        Objects.requireNonNull(singularValues, "singularValues cannot be null");
    }
}
