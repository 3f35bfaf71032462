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

/**
 * Abstract base class for decomposers.
 *
 * <p>Subclasses only compute components: {@link #doFit} returns parameters
 * holding Q. Both {@code fitTransform} and {@code transform} produce P by
 * least-squares projection onto Q through {@link ComponentProjection}, so a
 * {@code transform} of the training matrix reproduces the
 * {@code fitTransform} output. The factored projection is kept until the
 * learned parameters are replaced.
 *
 * @param <C> the config type
 * @param <P> the learned parameter type, carrying the components
 */
public abstract class AbstractDecomposer<C extends ModelConfig, P extends ComponentState>
    extends AbstractTransformer<C, P> implements Decomposer {

    private P projectedState;
    private ComponentProjection projection;

    /**
     * Creates a decomposer from a validated config.
     *
     * @param config the hyperparameters
     */
    protected AbstractDecomposer(C config) {
        super(config);
    }

    @Override
    public RealMatrix components() {
        return state.require("components").components().copy();
    }

    /**
     * Returns the ridge penalty applied when projecting onto the components.
     *
     * @return λ, zero by default
     */
    protected double projectionRidge() {
        return 0.0;
    }

    /**
     * Verifies that the requested rank fits the training data.
     *
     * @param rows available rows, or {@link Integer#MAX_VALUE} when rows do not bound the rank
     * @param columns available columns
     */
    protected void checkRank(int rows, int columns) {
        int limit = Math.min(rows, columns);
        if (rank() > limit) {
            throw new ShapeMismatchException(modelType() + " rank exceeds the dimensions of the data", limit, rank());
        }
    }

    @Override
    protected final RealMatrix doTransform(RealMatrix x, P parameters) {
        return projectionFor(parameters).project(x);
    }

    /// Refactors only when the parameters instance changes.
    private ComponentProjection projectionFor(P parameters) {
        if (projection == null || projectedState != parameters) {
            projection = new ComponentProjection(parameters.components(), projectionRidge());
            projectedState = parameters;
        }
        return projection;
    }

    /// @return the most recently factored projection, or null before the first transform
    protected ComponentProjection cachedProjection() {
        return projection;
    }
}
