/// Named chains of stages. A pipeline fits each stage on the output of the
/// previous one and fails with a shape error as soon as a stage changes the
/// number of rows.
///
/// ```java
/// EstimatorPipeline pipeline = Pipeline.builder()
///     .then("scale", new StandardScaler(StandardScalerConfig.defaults()))
///     .then("svd", new TruncatedSvd(TruncatedSvdConfig.ofRank(8)))
///     .endWith("classify", new LogisticRegression(LogisticRegressionConfig.defaults()));
/// ```
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
