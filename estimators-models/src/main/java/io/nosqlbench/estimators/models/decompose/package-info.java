/// Matrix decompositions X ≈ P·Q.
///
/// - {@link io.nosqlbench.estimators.models.decompose.TruncatedSvd}: batch rank-k SVD
/// - {@link io.nosqlbench.estimators.models.decompose.IncrementalSvd}: rank-k SVD merged batch by batch
///
/// Both project new data onto the learned components Q by least squares.
package io.nosqlbench.estimators.models.decompose;

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
