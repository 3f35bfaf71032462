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

/// The three model categories of the stage contract.
///
/// | Kind | Training | Application | Output |
/// |------|----------|-------------|--------|
/// | ESTIMATOR | `fit(x, y)` | `predict(x)` | one value per row |
/// | TRANSFORMER | `fitTransform(x)` | `transform(x)` | matrix, same rows |
/// | DECOMPOSER | `fitTransform(x)` | `transform(x)` | factor P, keeps components Q |
public enum ModelKind {
    ESTIMATOR,
    TRANSFORMER,
    DECOMPOSER
}
