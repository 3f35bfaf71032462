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
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixFormat;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Binary logistic regression trained by full-batch gradient descent.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Minimizes the mean log-loss plus an L2 penalty on the weights:
 *
 * <pre>
 * p = σ(x·w + b)
 * ∇w = xᵀ(p - y) / n + λw
 * ∇b = Σ(p - y) / n
 * </pre>
 *
 * <p>Starting from zero, each iteration takes a step of {@code learning_rate}
 * against the gradient and stops when the largest gradient component falls
 * below {@code tolerance} or after {@code max_iterations} steps.
 *
 * <h2>Targets</h2>
 *
 * <p>Labels are class codes 0 and 1. {@link #predict} returns the label
 * with the higher probability (ties go to 1); {@link #predictProbability}
 * returns P(y = 1).
 *
 * @see LogisticRegressionConfig
 */
public final class LogisticRegression extends AbstractEstimator<LogisticRegressionConfig, LinearCoefficients> {

    /**
     * Creates an unfitted classifier.
     *
     * @param config the hyperparameters
     */
    public LogisticRegression(LogisticRegressionConfig config) {
        super(config);
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.both(MatrixFormat.DENSE);
    }

    /**
     * Returns the learned coefficients of the log-odds.
     *
     * @return weights and intercept
     */
    public LinearCoefficients coefficients() {
        return state.require("coefficients");
    }

    /**
     * Computes P(y = 1) for every row.
     *
     * @param x features with the fitted column count
     * @return probabilities, one per row
     */
    public RealVector predictProbability(RealMatrix x) {
        RealMatrix prepared = prepareApplication(x, "predictProbability");
        RealVector probabilities = state.require("predictProbability").response(prepared).map(LogisticRegression::sigmoid);
        checkRowsPreserved(prepared.getRowDimension(), probabilities.getDimension());
        return probabilities;
    }

    @Override
    protected LinearCoefficients doFit(RealMatrix x, RealVector y) {
        checkLabels(y);
        int rows = x.getRowDimension();
        int columns = x.getColumnDimension();
        boolean fitIntercept = config().fitIntercept();
        double rate = config().learningRate();
        double l2 = config().l2Penalty();

        double[] weights = new double[columns];
        double intercept = 0.0;
        int iteration = 0;
        double largestGradient = Double.POSITIVE_INFINITY;

        while (iteration < config().maxIterations() && largestGradient > config().tolerance()) {
            double[] residuals = new LinearCoefficients(weights, intercept).response(x)
                .map(LogisticRegression::sigmoid)
                .subtract(y)
                .toArray();

            double[] gradient = x.preMultiply(residuals);
            largestGradient = 0.0;
            for (int c = 0; c < columns; c++) {
                gradient[c] = gradient[c] / rows + l2 * weights[c];
                largestGradient = Math.max(largestGradient, Math.abs(gradient[c]));
                weights[c] -= rate * gradient[c];
            }
            if (fitIntercept) {
                double interceptGradient = 0.0;
                for (double residual : residuals) {
                    interceptGradient += residual;
                }
                interceptGradient /= rows;
                largestGradient = Math.max(largestGradient, Math.abs(interceptGradient));
                intercept -= rate * interceptGradient;
            }
            iteration++;
            if (iteration % 100 == 0) {
                logger.trace("iteration {}: largest gradient {}", iteration, largestGradient);
            }
        }

        if (largestGradient > config().tolerance()) {
            logger.warn("{} did not converge in {} iterations, largest gradient {}",
                modelType(), config().maxIterations(), largestGradient);
        } else {
            logger.debug("{} converged after {} iterations", modelType(), iteration);
        }
        return new LinearCoefficients(weights, intercept);
    }

    @Override
    protected RealVector doPredict(RealMatrix x, LinearCoefficients coefficients) {
        return coefficients.response(x).map(z -> z >= 0.0 ? 1.0 : 0.0);
    }

    private static void checkLabels(RealVector y) {
        for (int i = 0; i < y.getDimension(); i++) {
            double label = y.getEntry(i);
            if (label != 0.0 && label != 1.0) {
                throw new IllegalArgumentException("labels must be 0 or 1, found " + label + " at row " + i);
            }
        }
    }

    /**
     * Numerically stable logistic function.
     */
    static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
