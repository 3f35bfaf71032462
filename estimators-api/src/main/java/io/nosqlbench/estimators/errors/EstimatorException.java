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

/// Base type for all contract violations raised by stages.
///
/// Every error is raised synchronously at the point of violation and is
/// never retried or recovered internally. Callers can catch this type to
/// handle any contract failure uniformly, or one of the subtypes to react
/// to a specific kind:
///
/// | Exception | Raised when |
/// |-----------|-------------|
/// | [ShapeMismatchException] | dimensions disagree |
/// | [NotFittedException] | an application operation runs before fitting |
/// | [UnsupportedFormatException] | a model does not accept the matrix format |
/// | [TypeMismatchException] | the input is not a recognized matrix |
public abstract class EstimatorException extends RuntimeException {

    /// Creates a new exception with the given message.
    /// @param message the error message
    protected EstimatorException(String message) {
        super(message);
    }
}
