package io.nosqlbench.estimators.matrix;

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
import io.nosqlbench.estimators.errors.TypeMismatchException;
import io.nosqlbench.estimators.errors.UnsupportedFormatException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Objects;

/// The input-conversion step every stage runs before computing.
///
/// ```
/// input ──► recognized? ──no──► TypeMismatchException
///               │yes
///               ▼
///           accepted? ──no──► UnsupportedFormatException
///               │yes
///               ▼
///      convert to preferred format ──► computation
/// ```
public final class MatrixInputs {

    private MatrixInputs() {
        // Utility class
    }

    /// Validates a matrix against a model's declared formats and converts it
    /// to the preferred representation.
    ///
    /// @param input the supplied matrix
    /// @param formats the formats declared by the model
    /// @param modelType the model type, for error messages
    /// @return the input in the preferred representation
    /// @throws TypeMismatchException if the input is not a recognized representation
    /// @throws UnsupportedFormatException if the input format is not accepted
    public static RealMatrix prepare(RealMatrix input, InputFormats formats, String modelType) {
        Objects.requireNonNull(input, "input cannot be null");
        MatrixFormat format = MatrixFormat.of(input);
        if (!formats.accepts(format)) {
            throw new UnsupportedFormatException(modelType, format, formats.accepted());
        }
        return MatrixConversions.convert(input, formats.preferred());
    }

    /// Adapts an arbitrary object to a matrix.
    ///
    /// Recognized `RealMatrix` instances pass through unchanged; `double[][]`
    /// is copied into a dense matrix.
    ///
    /// @param input a matrix-like object
    /// @return the input as a matrix
    /// @throws TypeMismatchException if the input is not a recognized representation
    /// @throws ShapeMismatchException if an array has no rows or ragged rows
    public static RealMatrix asMatrix(Object input) {
        MatrixFormat.of(input);
        if (input instanceof RealMatrix matrix) {
            return matrix;
        }
        double[][] rows = (double[][]) input;
        if (rows.length == 0) {
            throw ShapeMismatchException.noRows("matrix construction");
        }
        int columns = rows[0].length;
        if (columns == 0) {
            throw new ShapeMismatchException("matrix construction requires at least one column", 1, 0);
        }
        for (double[] row : rows) {
            if (row.length != columns) {
                throw new ShapeMismatchException("matrix rows must all have the same length", columns, row.length);
            }
        }
        return new Array2DRowRealMatrix(rows, true);
    }

    /// @param values target values
    /// @return a copy of the values as a vector
    public static RealVector asVector(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new ArrayRealVector(values, true);
    }
}
