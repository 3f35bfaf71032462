package io.nosqlbench.estimators.models.linear;

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

import io.nosqlbench.estimators.api.AbstractEstimator;
import io.nosqlbench.estimators.api.OnlineEstimator;
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixFormat;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Linear regression trained by stochastic gradient descent on squared loss.
 *
 * <h2>Update Rule</h2>
 *
 * <p>Rows are visited in order. For each row xᵢ with target yᵢ:
 *
 * <pre>
 * e = xᵢ·w + b - yᵢ
 * w = w - η(e·xᵢ + λw)
 * b = b - η·e
 * </pre>
 *
 * <h2>Batch and Online Training</h2>
 *
 * <ul>
 *   <li>{@link #fit} starts from zero and makes {@code epochs} passes over x</li>
 *   <li>{@link #partialFit} makes one pass over the batch, continuing from
 *       the current weights</li>
 * </ul>
 *
 * <p>Since updates are sequential, one pass over batches A then B equals
 * one pass over A stacked on B.
 *
 * @see SgdRegressorConfig
 */
public final class SgdRegressor extends AbstractEstimator<SgdRegressorConfig, LinearCoefficients>
    implements OnlineEstimator {

    /**
     * Creates an unfitted regressor.
     *
     * @param config the hyperparameters
     */
    public SgdRegressor(SgdRegressorConfig config) {
        super(config);
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.both(MatrixFormat.DENSE);
    }

    @Override
    public void partialFit(RealMatrix x, RealVector y) {
        incrementalFit(x, y);
    }

    /**
     * Returns the learned coefficients.
     *
     * @return weights and intercept
     */
    public LinearCoefficients coefficients() {
        return state.require("coefficients");
    }

    @Override
    protected LinearCoefficients doFit(RealMatrix x, RealVector y) {
        LinearCoefficients coefficients = null;
        for (int epoch = 0; epoch < config().epochs(); epoch++) {
            coefficients = doPartialFit(x, y, coefficients);
            logger.trace("epoch {}: intercept {}", epoch, coefficients.intercept());
        }
        return coefficients;
    }

    @Override
    protected LinearCoefficients doPartialFit(RealMatrix x, RealVector y, LinearCoefficients current) {
        int columns = x.getColumnDimension();
        double[] weights = current != null ? current.weights() : new double[columns];
        double intercept = current != null ? current.intercept() : 0.0;
        double rate = config().learningRate();
        double l2 = config().l2Penalty();
        boolean fitIntercept = config().fitIntercept();

        for (int r = 0; r < x.getRowDimension(); r++) {
            double[] row = x.getRow(r);
            double error = intercept - y.getEntry(r);
            for (int c = 0; c < columns; c++) {
                error += row[c] * weights[c];
            }
            for (int c = 0; c < columns; c++) {
                weights[c] -= rate * (error * row[c] + l2 * weights[c]);
            }
            if (fitIntercept) {
                intercept -= rate * error;
            }
        }

        if (!Double.isFinite(intercept)) {
            logger.warn("{} diverged, consider a smaller learning_rate than {}", modelType(), rate);
        }
        return new LinearCoefficients(weights, intercept);
    }

    @Override
    protected RealVector doPredict(RealMatrix x, LinearCoefficients coefficients) {
        return coefficients.response(x);
    }
}
