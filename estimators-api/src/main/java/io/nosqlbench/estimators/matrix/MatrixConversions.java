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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.OpenMapRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Objects;

/// Conversion between the dense and sparse matrix representations.
///
/// Conversions are lossless: a value converted to the other format and back
/// holds the same entries. A matrix already in the requested format is
/// returned as is, without copying.
public final class MatrixConversions {

    private MatrixConversions() {
        // Utility class
    }

    /// Converts a matrix to the requested format.
    ///
    /// @param matrix a dense or sparse matrix
    /// @param target the requested format
    /// @return the matrix in the requested format
    public static RealMatrix convert(RealMatrix matrix, MatrixFormat target) {
        Objects.requireNonNull(target, "target cannot be null");
        return target == MatrixFormat.DENSE ? toDense(matrix) : toSparse(matrix);
    }

    /// @param matrix a dense or sparse matrix
    /// @return a dense matrix holding the same entries
    public static RealMatrix toDense(RealMatrix matrix) {
        if (MatrixFormat.of(matrix) == MatrixFormat.DENSE) {
            return matrix;
        }
        return new Array2DRowRealMatrix(matrix.getData(), false);
    }

    /// @param matrix a dense or sparse matrix
    /// @return a sparse matrix holding the nonzero entries of the input
    public static RealMatrix toSparse(RealMatrix matrix) {
        if (MatrixFormat.of(matrix) == MatrixFormat.SPARSE) {
            return matrix;
        }
        OpenMapRealMatrix sparse = new OpenMapRealMatrix(matrix.getRowDimension(), matrix.getColumnDimension());
        matrix.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(int row, int column, double value) {
                if (value != 0.0) {
                    sparse.setEntry(row, column, value);
                }
            }
        });
        return sparse;
    }
}
