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

import io.nosqlbench.estimators.errors.TypeMismatchException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.BlockRealMatrix;
import org.apache.commons.math3.linear.SparseRealMatrix;

import java.util.Objects;

/// The two matrix representations a stage may consume.
///
/// | Format | Representations |
/// |--------|-----------------|
/// | DENSE | `double[][]`, [Array2DRowRealMatrix], [BlockRealMatrix] |
/// | SPARSE | any [SparseRealMatrix], e.g. `OpenMapRealMatrix` |
///
/// Any other object, including other `RealMatrix` implementations such as
/// `DiagonalMatrix`, is not a recognized representation.
public enum MatrixFormat {

    /// Every entry is stored.
    DENSE,

    /// Only nonzero entries are stored.
    SPARSE;

    /// Classifies an input as one of the recognized representations.
    ///
    /// @param input the candidate matrix
    /// @return the format of the input
    /// @throws NullPointerException if input is null
    /// @throws TypeMismatchException if input is not a recognized representation
    public static MatrixFormat of(Object input) {
        Objects.requireNonNull(input, "input cannot be null");
        if (input instanceof SparseRealMatrix) {
            return SPARSE;
        }
        if (input instanceof Array2DRowRealMatrix || input instanceof BlockRealMatrix || input instanceof double[][]) {
            return DENSE;
        }
        throw new TypeMismatchException(input.getClass());
    }
}
