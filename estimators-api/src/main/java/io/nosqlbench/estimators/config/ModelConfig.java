package io.nosqlbench.estimators.config;

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

/// Immutable hyperparameters of a model.
///
/// ## Two-phase initialization
///
/// A config value is built first and validated, then handed to a model
/// constructor. Models never perform data-dependent work at construction;
/// learned state is only produced by a training call.
///
/// ```
/// ModelConfig ──► new Model(config) ──► fit / fitTransform / partialFit
///  (immutable)      (unfitted)              (fitted)
/// ```
///
/// Implementations expose no setters. They are serialized by Gson with
/// snake_case field names, see [ModelConfigs].
public interface ModelConfig {

    /// Returns the model type identifier for this configuration.
    ///
    /// @return the model type (e.g. "linear_regression", "truncated_svd")
    String modelType();

    /// Verifies that every hyperparameter is within its legal range.
    ///
    /// @throws IllegalArgumentException if a hyperparameter is invalid
    void validate();
}
