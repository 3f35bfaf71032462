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

import io.nosqlbench.estimators.api.Estimator;
import io.nosqlbench.estimators.api.Transformer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Entry point for assembling pipelines.
///
/// ## Usage
///
/// ```java
/// EstimatorPipeline pipeline = Pipeline.builder()
///     .then("scale", new StandardScaler(StandardScalerConfig.defaults()))
///     .then("svd", new TruncatedSvd(TruncatedSvdConfig.ofRank(2)))
///     .endWith("regression", new LinearRegression(LinearRegressionConfig.defaults()));
///
/// pipeline.fit(x, y);
/// RealVector predictions = pipeline.predict(newX);
/// ```
///
/// A pipeline ending in an estimator is an [Estimator]; one built from
/// transformers only is a [Transformer]. Either can be nested as a stage
/// in a larger pipeline.
public final class Pipeline {

    private Pipeline() {
        // Factory class
    }

    /// @return a new, empty builder
    public static Builder builder() {
        return new Builder();
    }

    /// Collects named transformer stages in order.
    ///
    /// A builder is single-use: after [#build] or [#endWith] it rejects
    /// further calls, since its stages now belong to the built pipeline.
    public static final class Builder {

        private final List<NamedStage<Transformer>> transformers = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private boolean consumed;

        private Builder() {
        }

        /// Appends a transformer.
        ///
        /// @param name unique stage name
        /// @param transformer the stage
        /// @return this builder
        /// @throws IllegalArgumentException if the name is already used
        /// @throws IllegalStateException if the builder has already built a pipeline
        public Builder then(String name, Transformer transformer) {
            checkOpen();
            transformers.add(new NamedStage<>(claim(name), transformer));
            return this;
        }

        /// Finishes a pipeline of transformers only.
        ///
        /// @return the pipeline
        /// @throws IllegalStateException if no stage was added
        public TransformerPipeline build() {
            checkOpen();
            if (transformers.isEmpty()) {
                throw new IllegalStateException("a transformer pipeline needs at least one stage");
            }
            consumed = true;
            return new TransformerPipeline(transformers);
        }

        /// Finishes a pipeline with a final estimator.
        ///
        /// @param name unique stage name
        /// @param estimator the final stage
        /// @return the pipeline
        /// @throws IllegalStateException if the builder has already built a pipeline
        public EstimatorPipeline endWith(String name, Estimator estimator) {
            checkOpen();
            NamedStage<Estimator> last = new NamedStage<>(claim(name), estimator);
            consumed = true;
            return new EstimatorPipeline(transformers, last);
        }

        private void checkOpen() {
            if (consumed) {
                throw new IllegalStateException("this builder already built a pipeline; start a new one");
            }
        }

        private String claim(String name) {
            if (name != null && !names.add(name)) {
                throw new IllegalArgumentException("duplicate stage name '" + name + "'");
            }
            return name;
        }
    }
}
