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

import io.nosqlbench.estimators.config.ModelConfig;
import io.nosqlbench.estimators.errors.NotFittedException;
import io.nosqlbench.estimators.matrix.InputFormats;

/// Common surface of every model that can participate in a pipeline.
///
/// ## Capability interfaces
///
/// The legal operations of a model are selected by the capability
/// interfaces it implements, so the compiler rejects calls that the
/// contract forbids for a variant:
///
/// ```
///                         Stage
///              ┌────────────┴────────────┐
///          Estimator                Transformer
///              │                    ┌────┴──────────────┐
///       OnlineEstimator         Decomposer       OnlineTransformer
///                                   └────────┬──────────┘
///                                     OnlineDecomposer
/// ```
///
/// ## Threading
///
/// Models are mutable and not safe for concurrent use. Callers must
/// serialize `fit`, `partialFit`, `transform` and `predict` on the same
/// instance.
public interface Stage {

    /// @return the category of this model
    ModelKind kind();

    /// @return whether this model supports incremental training
    default FitMode fitMode() {
        return FitMode.BATCH;
    }

    /// @return the model type identifier, taken from the config
    default String modelType() {
        return config().modelType();
    }

    /// @return the immutable hyperparameters this model was constructed with
    ModelConfig config();

    /// @return the matrix formats this model accepts and the one it computes on
    InputFormats inputFormats();

    /// @return true once a training call has completed successfully
    boolean isFitted();

    /// Returns the number of columns established by training.
    ///
    /// @return the fitted column count
    /// @throws NotFittedException if the model is not fitted
    int featureCount();
}
