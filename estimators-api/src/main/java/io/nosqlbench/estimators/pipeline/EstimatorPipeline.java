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
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A pipeline of transformers ending in an estimator, itself usable as an estimator.
 *
 * <pre>{@code
 * x ──► transformer 1 ──► ... ──► transformer n ──► estimator ──► predictions
 *                                                      ▲
 *                                      y ──────────────┘ (fit only)
 * }</pre>
 *
 * <p>The targets pass untouched to the final estimator; every transformer
 * preserves rows, so target i stays aligned with row i.
 *
 * @see Pipeline#builder()
 */
public final class EstimatorPipeline extends AbstractPipeline implements Estimator {

    private final NamedStage<Estimator> estimator;

    EstimatorPipeline(List<NamedStage<Transformer>> transformers, NamedStage<Estimator> estimator) {
        super(transformers, concat(transformers, estimator));
        this.estimator = estimator;
    }

    @Override
    public void fit(RealMatrix x, RealVector y) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (x.getRowDimension() != y.getDimension()) {
            throw ShapeMismatchException.targetLength(x.getRowDimension(), y.getDimension());
        }
        estimator.stage().fit(fitThrough(x), y);
    }

    @Override
    public RealVector predict(RealMatrix x) {
        requireFitted("predict");
        return estimator.stage().predict(applyThrough(x));
    }

    /**
     * Returns the final estimator.
     *
     * @return the estimator ending this pipeline
     */
    public Estimator estimator() {
        return estimator.stage();
    }

    private static List<NamedStage<?>> concat(List<NamedStage<Transformer>> transformers,
                                             NamedStage<Estimator> estimator) {
        List<NamedStage<?>> all = new ArrayList<>(transformers);
        all.add(estimator);
        return all;
    }
}
