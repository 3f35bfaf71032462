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

import io.nosqlbench.estimators.api.Transformer;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.List;

/**
 * A pipeline of transformers, itself usable as a transformer.
 *
 * <pre>{@code
 * x ──► stage 1 ──► stage 2 ──► ... ──► stage n ──► result
 * }</pre>
 *
 * @see Pipeline#builder()
 */
public final class TransformerPipeline extends AbstractPipeline implements Transformer {

    TransformerPipeline(List<NamedStage<Transformer>> transformers) {
        super(transformers, new ArrayList<>(transformers));
    }

    @Override
    public RealMatrix fitTransform(RealMatrix x) {
        return fitThrough(x);
    }

    @Override
    public RealMatrix transform(RealMatrix x) {
        requireFitted("transform");
        return applyThrough(x);
    }
}
