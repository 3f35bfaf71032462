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

import io.nosqlbench.estimators.matrix.MatrixFormat;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/// Exception thrown when a recognized matrix representation is not among the
/// formats a model declares it accepts.
public class UnsupportedFormatException extends EstimatorException {

    private final MatrixFormat format;
    private final Set<MatrixFormat> accepted;

    /// Creates a new UnsupportedFormatException.
    /// @param modelType The model that rejected the input
    /// @param format The format of the supplied matrix
    /// @param accepted The formats the model accepts
    public UnsupportedFormatException(String modelType, MatrixFormat format, Set<MatrixFormat> accepted) {
        super(modelType + " does not accept " + format + " input, accepted formats are " + accepted);
        this.format = format;
        this.accepted = Collections.unmodifiableSet(EnumSet.copyOf(accepted));
    }

    /// @return the format of the rejected matrix
    public MatrixFormat getFormat() {
        return format;
    }

    /// @return the formats the model accepts
    public Set<MatrixFormat> getAccepted() {
        return accepted;
    }
}
