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

/// Learned parameters of [TruncatedSvd].
///
/// @param components the leading right singular vectors as rows, Q = V_kᵀ
/// @param singularValues the matching singular values, descending
record SvdComponents(RealMatrix components, double[] singularValues) implements ComponentState {

    SvdComponents {
        Objects.requireNonNull(components, "components cannot be null");
        Objects.requireNonNull(singularValues, "singularValues cannot be null");
    }
}
