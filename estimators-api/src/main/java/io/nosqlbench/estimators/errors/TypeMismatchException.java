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

/// Exception thrown when an input is not one of the recognized matrix
/// representations (dense or sparse).
public class TypeMismatchException extends EstimatorException {

    private final Class<?> actualType;

    /// Creates a new TypeMismatchException.
    /// @param actualType The runtime type of the rejected input
    public TypeMismatchException(Class<?> actualType) {
        super("expected a dense or sparse matrix but got " + actualType.getName());
        this.actualType = actualType;
    }

    /// @return the runtime type of the rejected input
    public Class<?> getActualType() {
        return actualType;
    }
}
