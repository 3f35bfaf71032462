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
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Objects;

/**
 * Abstract base class for estimators.
 *
 * <h2>Subclass Contract</h2>
 *
 * <p>Subclasses implement:
 * <ul>
 *   <li>{@link #doFit} - learn parameters from validated, converted input</li>
 *   <li>{@link #doPredict} - apply learned parameters to validated input</li>
 *   <li>{@link #doPartialFit} - only for {@link OnlineEstimator} implementations,
 *       which expose it through {@link #incrementalFit}</li>
 * </ul>
 *
 * <p>Subclasses never see a matrix in a format they did not declare, a
 * target whose length differs from the row count, or an application call
 * before fitting.
 *
 * @param <C> the config type
 * @param <P> the learned parameter type
 */
public abstract class AbstractEstimator<C extends ModelConfig, P> extends AbstractStage<C, P> implements Estimator {

    /**
     * Creates an estimator from a validated config.
     *
     * @param config the hyperparameters
     */
    protected AbstractEstimator(C config) {
        super(config);
    }

    @Override
    public final void fit(RealMatrix x, RealVector y) {
        long start = System.nanoTime();
        state.reset();
        RealMatrix prepared = prepareTraining(x, "fit");
        checkTarget(prepared, y);
        P parameters = doFit(prepared, y);
        state.commit(parameters, prepared.getColumnDimension(), prepared.getRowDimension());
        logger.debug("fit {} on {}x{} in {} ms", modelType(),
            prepared.getRowDimension(), prepared.getColumnDimension(), elapsedMillis(start));
    }

    @Override
    public final RealVector predict(RealMatrix x) {
        RealMatrix prepared = prepareApplication(x, "predict");
        RealVector predictions = doPredict(prepared, state.require("predict"));
        checkRowsPreserved(prepared.getRowDimension(), predictions.getDimension());
        return predictions;
    }

    /**
     * Updates the learned state with one batch. Online subclasses call this
     * from {@link OnlineEstimator#partialFit}.
     *
     * @param x batch features
     * @param y batch targets
     */
    protected final void incrementalFit(RealMatrix x, RealVector y) {
        RealMatrix prepared = prepareTraining(x, "partialFit");
        state.checkColumns(prepared.getColumnDimension());
        checkTarget(prepared, y);
        P parameters = doPartialFit(prepared, y, state.current());
        state.commit(parameters, prepared.getColumnDimension(), prepared.getRowDimension());
        logger.trace("partialFit {} on {} rows, {} seen", modelType(), prepared.getRowDimension(), state.samplesSeen());
    }

    /**
     * Learns parameters from a full training set.
     *
     * @param x features in the preferred format, at least one row
     * @param y targets, one per row
     * @return the learned parameters
     */
    protected abstract P doFit(RealMatrix x, RealVector y);

    /**
     * Predicts one value per row.
     *
     * @param x features in the preferred format, fitted column count
     * @param parameters the learned parameters
     * @return predictions in row order
     */
    protected abstract RealVector doPredict(RealMatrix x, P parameters);

    /**
     * Merges one batch into the current parameters, returning new parameters
     * without modifying {@code current}.
     *
     * @param x batch features in the preferred format
     * @param y batch targets
     * @param current the current parameters, or null on the first batch
     * @return the updated parameters
     */
    protected P doPartialFit(RealMatrix x, RealVector y, P current) {
        throw new UnsupportedOperationException(modelType() + " does not support partialFit");
    }

    private static void checkTarget(RealMatrix x, RealVector y) {
        Objects.requireNonNull(y, "y cannot be null");
        if (y.getDimension() != x.getRowDimension()) {
            throw ShapeMismatchException.targetLength(x.getRowDimension(), y.getDimension());
        }
    }
}
