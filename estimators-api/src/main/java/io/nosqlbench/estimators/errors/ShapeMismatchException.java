package io.nosqlbench.estimators.errors;

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

/// Exception thrown when two dimensions that must agree do not.
///
/// This covers the row count of a feature matrix versus the length of its
/// target vector, the column count of new data versus the column count a
/// model was fitted on, empty inputs, and stages that change the number of
/// rows flowing through a pipeline.
public class ShapeMismatchException extends EstimatorException {

    /// The dimension that was required.
    private final long expected;

    /// The dimension that was supplied.
    private final long actual;

    /// Creates a new ShapeMismatchException.
    /// @param message The error message
    /// @param expected The dimension that was required
    /// @param actual The dimension that was supplied
    public ShapeMismatchException(String message, long expected, long actual) {
        super(message + " (expected " + expected + ", got " + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }

    /// Row count of a feature matrix disagrees with the length of its target vector.
    /// @param rows rows in the feature matrix
    /// @param targets length of the target vector
    /// @return a new exception
    public static ShapeMismatchException targetLength(int rows, int targets) {
        return new ShapeMismatchException("target length must equal feature row count", rows, targets);
    }

    /// Column count of new data disagrees with the column count established by fitting.
    /// @param modelType the model reporting the mismatch
    /// @param fittedColumns columns seen during fitting
    /// @param actualColumns columns in the supplied matrix
    /// @return a new exception
    public static ShapeMismatchException columns(String modelType, int fittedColumns, int actualColumns) {
        return new ShapeMismatchException(
            modelType + " was fitted on a different number of columns", fittedColumns, actualColumns);
    }

    /// An input without rows was supplied where at least one is needed.
    /// @param operation the operation that received the empty input
    /// @return a new exception
    public static ShapeMismatchException noRows(String operation) {
        return new ShapeMismatchException(operation + " requires at least one row", 1, 0);
    }

    /// A stage produced a different number of rows than it received.
    /// @param stage the name of the offending stage
    /// @param inputRows rows handed to the stage
    /// @param outputRows rows returned by the stage
    /// @return a new exception
    public static ShapeMismatchException rowsChanged(String stage, int inputRows, int outputRows) {
        return new ShapeMismatchException("stage '" + stage + "' must preserve row count", inputRows, outputRows);
    }

    /// @return the dimension that was required
    public long getExpected() {
        return expected;
    }

    /// @return the dimension that was supplied
    public long getActual() {
        return actual;
    }
}
