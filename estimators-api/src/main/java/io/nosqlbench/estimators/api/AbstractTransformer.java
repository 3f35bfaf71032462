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

import io.nosqlbench.estimators.config.ModelConfig;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Abstract base class for transformers.
 *
 * <h2>Subclass Contract</h2>
 *
 * <p>Subclasses implement:
 * <ul>
 *   <li>{@link #doFit} - learn parameters from validated, converted input</li>
 *   <li>{@link #doTransform} - apply learned parameters</li>
 *   <li>{@link #doPartialFit} - only for {@link OnlineTransformer} implementations,
 *       which expose it through {@link #incrementalFit}</li>
 * </ul>
 *
 * <p>{@link #fitTransform} is {@code doFit} followed by {@code doTransform}
 * on the same input, so its output always equals a later
 * {@code transform} of the training matrix. The learned parameters are
 * committed only after that output passes the row check.
 *
 * @param <C> the config type
 * @param <P> the learned parameter type
 */
public abstract class AbstractTransformer<C extends ModelConfig, P> extends AbstractStage<C, P> implements Transformer {

    /**
     * Creates a transformer from a validated config.
     *
     * @param config the hyperparameters
     */
    protected AbstractTransformer(C config) {
        super(config);
    }

    @Override
    public final RealMatrix fitTransform(RealMatrix x) {
        long start = System.nanoTime();
        state.reset();
        RealMatrix prepared = prepareTraining(x, "fitTransform");
        P parameters = doFit(prepared);
        RealMatrix output = doTransform(prepared, parameters);
        checkRowsPreserved(prepared.getRowDimension(), output.getRowDimension());
        state.commit(parameters, prepared.getColumnDimension(), prepared.getRowDimension());
        logger.debug("fitTransform {} on {}x{} -> {}x{} in {} ms", modelType(),
            prepared.getRowDimension(), prepared.getColumnDimension(),
            output.getRowDimension(), output.getColumnDimension(), elapsedMillis(start));
        return output;
    }

    @Override
    public final RealMatrix transform(RealMatrix x) {
        RealMatrix prepared = prepareApplication(x, "transform");
        RealMatrix output = doTransform(prepared, state.require("transform"));
        checkRowsPreserved(prepared.getRowDimension(), output.getRowDimension());
        return output;
    }

    /**
     * Updates the learned state with one batch. Online subclasses call this
     * from {@link OnlineTransformer#partialFit}.
     *
     * @param x batch features
     */
    protected final void incrementalFit(RealMatrix x) {
        RealMatrix prepared = prepareTraining(x, "partialFit");
        state.checkColumns(prepared.getColumnDimension());
        P parameters = doPartialFit(prepared, state.current());
        state.commit(parameters, prepared.getColumnDimension(), prepared.getRowDimension());
        logger.trace("partialFit {} on {} rows, {} seen", modelType(), prepared.getRowDimension(), state.samplesSeen());
    }

    /**
     * Learns parameters from a full training set.
     *
     * @param x features in the preferred format, at least one row
     * @return the learned parameters
     */
    protected abstract P doFit(RealMatrix x);

    /**
     * Transforms x using learned parameters.
     *
     * @param x features in the preferred format, fitted column count
     * @param parameters the learned parameters
     * @return the transformed matrix, one row per input row
     */
    protected abstract RealMatrix doTransform(RealMatrix x, P parameters);

    /**
     * Merges one batch into the current parameters, returning new parameters
     * without modifying {@code current}.
     *
     * @param x batch features in the preferred format
     * @param current the current parameters, or null on the first batch
     * @return the updated parameters
     */
    protected P doPartialFit(RealMatrix x, P current) {
        throw new UnsupportedOperationException(modelType() + " does not support partialFit");
    }
}
