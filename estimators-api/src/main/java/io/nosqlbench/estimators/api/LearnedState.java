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

import java.util.Objects;

/// The learned state a model owns exclusively.
///
/// ## Lifecycle
///
/// ```
///            commit(...)                commit(...)  (partialFit)
///  UNFITTED ─────────────►  FITTED  ─────────────────► FITTED
///     ▲                        │
///     └──────── reset() ───────┘   (fit / fitTransform start here)
/// ```
///
/// Parameters are only replaced by [#commit], never mutated in place, so a
/// training call that fails before committing leaves the previous state
/// untouched.
///
/// Not thread-safe; guarded by the owning model's calling discipline.
///
/// @param <P> the type of the learned parameters
public final class LearnedState<P> {

    private final String modelType;
    private P parameters;
    private int columns = -1;
    private long samplesSeen;

    /// Creates an unfitted state.
    /// @param modelType the owning model type, for error messages
    public LearnedState(String modelType) {
        this.modelType = Objects.requireNonNull(modelType, "modelType cannot be null");
    }

    /// Discards all learned parameters and returns to the unfitted state.
    public void reset() {
        parameters = null;
        columns = -1;
        samplesSeen = 0;
    }

    /// @return true once parameters have been committed
    public boolean isFitted() {
        return parameters != null;
    }

    /// Verifies the column count of a batch against the established one.
    ///
    /// Passes when no column count is established yet.
    ///
    /// @param actual the batch column count
    /// @throws ShapeMismatchException if a different column count was established
    public void checkColumns(int actual) {
        if (columns >= 0 && columns != actual) {
            throw ShapeMismatchException.columns(modelType, columns, actual);
        }
    }

    /// Replaces the parameters after a successful training step.
    ///
    /// @param parameters the new parameters
    /// @param batchColumns the column count of the batch trained on
    /// @param batchRows the row count of the batch trained on
    public void commit(P parameters, int batchColumns, long batchRows) {
        checkColumns(batchColumns);
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.columns = batchColumns;
        this.samplesSeen += batchRows;
    }

    /// Returns the parameters, requiring the fitted state.
    ///
    /// @param operation the operation that needs the parameters
    /// @return the learned parameters
    /// @throws NotFittedException if nothing has been committed
    public P require(String operation) {
        if (parameters == null) {
            throw new NotFittedException(operation, modelType);
        }
        return parameters;
    }

    /// @return the current parameters, or null when unfitted
    public P current() {
        return parameters;
    }

    /// @return the established column count
    /// @throws NotFittedException if nothing has been committed
    public int columns() {
        require("featureCount");
        return columns;
    }

    /// @return the number of rows trained on since the last reset
    public long samplesSeen() {
        return samplesSeen;
    }
}
