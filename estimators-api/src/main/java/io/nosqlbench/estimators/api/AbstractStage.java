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

import io.nosqlbench.estimators.config.EstimatorsGsonConfig;
import io.nosqlbench.estimators.config.ModelConfig;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixInputs;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Abstract base class for stages built on a config value and an owned
 * {@link LearnedState}.
 *
 * <p>This class performs the checks every variant of the contract shares,
 * so that subclasses only implement the model-specific computation:
 * <ul>
 *   <li>format negotiation through {@link MatrixInputs#prepare}</li>
 *   <li>fitted-state gating of application operations</li>
 *   <li>column agreement between training and application</li>
 *   <li>row preservation of outputs</li>
 * </ul>
 *
 * <p>The config is validated once, at construction. No data-dependent work
 * happens before the first training call.
 *
 * @param <C> the config type
 * @param <P> the learned parameter type
 * @see AbstractEstimator
 * @see AbstractTransformer
 */
public abstract class AbstractStage<C extends ModelConfig, P> implements Stage {

    /** Logger named after the concrete model class. */
    protected final Logger logger = LogManager.getLogger(getClass());

    private final C config;

    /** The learned state owned by this model. */
    protected final LearnedState<P> state;

    /**
     * Creates a stage from a validated config.
     *
     * @param config the hyperparameters
     * @throws IllegalArgumentException if the config is invalid
     */
    protected AbstractStage(C config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        this.state = new LearnedState<>(config.modelType());
        if (logger.isDebugEnabled()) {
            logger.debug("Created {} with {}", config.modelType(), EstimatorsGsonConfig.compactGson().toJson(config));
        }
    }

    @Override
    public C config() {
        return config;
    }

    @Override
    public boolean isFitted() {
        return state.isFitted();
    }

    @Override
    public int featureCount() {
        return state.columns();
    }

    /**
     * Returns the number of rows trained on since the last reset.
     *
     * @return the sample count
     */
    public long samplesSeen() {
        return state.samplesSeen();
    }

    /**
     * Runs the input-conversion step for a training call.
     *
     * @param x the supplied matrix
     * @param operation the training operation, for error messages
     * @return x in the preferred format
     */
    protected RealMatrix prepareTraining(RealMatrix x, String operation) {
        Objects.requireNonNull(x, "x cannot be null");
        RealMatrix prepared = MatrixInputs.prepare(x, inputFormats(), modelType());
        if (prepared.getRowDimension() == 0) {
            throw ShapeMismatchException.noRows(operation);
        }
        return prepared;
    }

    /**
     * Runs the checks for an application call: fitted state first, then
     * format, then column agreement.
     *
     * @param x the supplied matrix
     * @param operation the application operation, for error messages
     * @return x in the preferred format
     */
    protected RealMatrix prepareApplication(RealMatrix x, String operation) {
        Objects.requireNonNull(x, "x cannot be null");
        state.require(operation);
        RealMatrix prepared = MatrixInputs.prepare(x, inputFormats(), modelType());
        state.checkColumns(prepared.getColumnDimension());
        return prepared;
    }

    /**
     * Verifies that an output has one row per input row.
     *
     * @param inputRows rows handed in
     * @param outputRows rows produced
     */
    protected void checkRowsPreserved(int inputRows, int outputRows) {
        if (inputRows != outputRows) {
            throw ShapeMismatchException.rowsChanged(modelType(), inputRows, outputRows);
        }
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} reading.
     *
     * @param startNanos the start reading
     * @return elapsed milliseconds
     */
    protected static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + modelType() + (isFitted() ? ", fitted" : "") + "]";
    }
}
