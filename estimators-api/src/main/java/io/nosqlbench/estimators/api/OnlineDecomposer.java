package io.nosqlbench.estimators.api;

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

/// A decomposer whose components can be refined incrementally on successive batches.
///
/// How batches are merged into the components is up to each implementation.
public interface OnlineDecomposer extends Decomposer, OnlineTransformer {

    @Override
    default ModelKind kind() {
        return ModelKind.DECOMPOSER;
    }

    @Override
    default FitMode fitMode() {
        return FitMode.ONLINE;
    }
}
