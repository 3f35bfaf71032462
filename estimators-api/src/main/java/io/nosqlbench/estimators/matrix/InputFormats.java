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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// Declaration of the matrix formats a model accepts and the one it computes on.
///
/// Inputs in an accepted format are converted to the preferred format before
/// any computation; inputs in any other format are rejected.
///
/// @param accepted the formats the model accepts, never empty
/// @param preferred the format computation runs on, always one of `accepted`
public record InputFormats(Set<MatrixFormat> accepted, MatrixFormat preferred) {

    public InputFormats {
        Objects.requireNonNull(accepted, "accepted cannot be null");
        Objects.requireNonNull(preferred, "preferred cannot be null");
        if (accepted.isEmpty()) {
            throw new IllegalArgumentException("at least one format must be accepted");
        }
        if (!accepted.contains(preferred)) {
            throw new IllegalArgumentException("preferred format " + preferred + " is not in " + accepted);
        }
        accepted = Collections.unmodifiableSet(EnumSet.copyOf(accepted));
    }

    /// @return formats accepting dense input only
    public static InputFormats denseOnly() {
        return new InputFormats(EnumSet.of(MatrixFormat.DENSE), MatrixFormat.DENSE);
    }

    /// @return formats accepting sparse input only
    public static InputFormats sparseOnly() {
        return new InputFormats(EnumSet.of(MatrixFormat.SPARSE), MatrixFormat.SPARSE);
    }

    /// @param preferred the format computation runs on
    /// @return formats accepting both representations
    public static InputFormats both(MatrixFormat preferred) {
        return new InputFormats(EnumSet.allOf(MatrixFormat.class), preferred);
    }

    /// @param format a matrix format
    /// @return true if the format is accepted
    public boolean accepts(MatrixFormat format) {
        return accepted.contains(format);
    }
}
