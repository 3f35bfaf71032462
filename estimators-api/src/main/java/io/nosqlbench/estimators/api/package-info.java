/// # Model Contracts
///
/// Capability interfaces for trainable models and the abstract bases that
/// enforce their shared contract.
///
/// ## Kinds and Fit Modes
///
/// | Interface | Kind | Training |
/// |-----------|------|----------|
/// | {@link io.nosqlbench.estimators.api.Estimator} | ESTIMATOR | `fit(x, y)` then `predict(x)` |
/// | {@link io.nosqlbench.estimators.api.Transformer} | TRANSFORMER | `fitTransform(x)` then `transform(x)` |
/// | {@link io.nosqlbench.estimators.api.Decomposer} | DECOMPOSER | a transformer that also keeps `components()` |
///
/// The `Online*` variants add `partialFit`, which merges one batch into the
/// learned state instead of replacing it.
///
/// ## Order of Checks
///
/// Every application call checks, in this order: fitted state, matrix type,
/// accepted format, column count. Training calls skip the fitted check and
/// add the row/target agreement check.
///
/// ## Subject-First Calls
///
/// {@link io.nosqlbench.estimators.api.Calls} and
/// {@link io.nosqlbench.estimators.api.MatrixFlow} put the data first:
///
/// ```java
/// RealVector labels = MatrixFlow.of(x).transform(scaler).predict(classifier);
/// ```
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
