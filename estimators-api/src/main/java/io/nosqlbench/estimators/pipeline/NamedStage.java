package io.nosqlbench.estimators.pipeline;

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

import io.nosqlbench.estimators.api.Stage;

import java.util.Objects;

/// A stage together with the name it is known by inside a pipeline.
///
/// @param name unique name within the pipeline
/// @param stage the stage
/// @param <S> the stage type
public record NamedStage<S extends Stage>(String name, S stage) {

    public NamedStage {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(stage, "stage cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("stage name cannot be blank");
        }
    }
}
