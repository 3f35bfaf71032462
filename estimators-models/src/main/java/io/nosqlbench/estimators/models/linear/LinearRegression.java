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
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Least-squares linear regression, optionally ridge-penalized.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Builds the design matrix A from x (plus a column of ones when an
 * intercept is fitted) and solves
 *
 * <pre>
 * minimize ‖A·β - y‖² + λ‖w‖²
 * </pre>
 *
 * <p>where w excludes the intercept. The penalty is applied by augmenting
 * A with √λ on the diagonal of the weight columns and y with zeros, so a
 * single QR least-squares solve handles both cases. A rank-deficient or
 * underdetermined design falls back to the SVD pseudo-inverse (minimum-norm
 * solution).
 *
 * <h2>Input</h2>
 *
 * <p>Accepts dense and sparse matrices and computes on dense.
 *
 * @see LinearRegressionConfig
 */
public final class LinearRegression extends AbstractEstimator<LinearRegressionConfig, LinearCoefficients> {

    /// Diagonal magnitude of R below which the design counts as rank deficient.
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    /**
     * Creates an unfitted regression.
     *
     * @param config the hyperparameters
     */
    public LinearRegression(LinearRegressionConfig config) {
        super(config);
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.both(MatrixFormat.DENSE);
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
        int rows = x.getRowDimension();
        int columns = x.getColumnDimension();
        boolean intercept = config().fitIntercept();
        double l2 = config().l2Penalty();

        int unknowns = columns + (intercept ? 1 : 0);
        int penaltyRows = l2 > 0 ? columns : 0;

        RealMatrix design = MatrixUtils.createRealMatrix(rows + penaltyRows, unknowns);
        design.setSubMatrix(x.getData(), 0, 0);
        if (intercept) {
            for (int r = 0; r < rows; r++) {
                design.setEntry(r, columns, 1.0);
            }
        }
        double scale = Math.sqrt(l2);
        for (int c = 0; c < penaltyRows; c++) {
            design.setEntry(rows + c, c, scale);
        }

        RealVector target = new ArrayRealVector(rows + penaltyRows);
        target.setSubVector(0, y);

        double[] beta = solver(design).solve(target).toArray();
        double[] weights = new double[columns];
        System.arraycopy(beta, 0, weights, 0, columns);
        return new LinearCoefficients(weights, intercept ? beta[columns] : 0.0);
    }

    @Override
    protected RealVector doPredict(RealMatrix x, LinearCoefficients coefficients) {
        return coefficients.response(x);
    }

    private DecompositionSolver solver(RealMatrix design) {
        if (design.getRowDimension() >= design.getColumnDimension()) {
            DecompositionSolver qr = new QRDecomposition(design, SINGULARITY_THRESHOLD).getSolver();
            if (qr.isNonSingular()) {
                return qr;
            }
        }
        logger.warn("design matrix {}x{} is rank deficient, using minimum-norm solution",
            design.getRowDimension(), design.getColumnDimension());
        return new SingularValueDecomposition(design).getSolver();
    }
}
