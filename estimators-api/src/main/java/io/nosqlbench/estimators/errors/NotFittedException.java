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

/// Exception thrown when an application operation (predict, transform, or a
/// learned-parameter accessor) is invoked on a model that has not completed a
/// successful training call.
public class NotFittedException extends EstimatorException {

    /// The operation that was refused.
    private final String operation;

    /// The model type that refused it.
    private final String modelType;

    /// Creates a new NotFittedException.
    /// @param operation The operation that was invoked
    /// @param modelType The type of the unfitted model
    public NotFittedException(String operation, String modelType) {
        super(modelType + " must be fitted before calling " + operation);
        this.operation = operation;
        this.modelType = modelType;
    }

    /// @return the operation that was invoked
    public String getOperation() {
        return operation;
    }

    /// @return the type of the unfitted model
    public String getModelType() {
        return modelType;
    }
}
