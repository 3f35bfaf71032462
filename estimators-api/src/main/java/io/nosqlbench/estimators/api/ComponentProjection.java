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

import io.nosqlbench.estimators.errors.ShapeMismatchException;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Least-squares projection of new data onto retained components.
///
/// ## Algorithm
///
/// For components Q (k × m) and data x (n × m), finds P (n × k) minimizing
///
/// ```text
/// ‖x - P·Q‖² + λ‖P‖²
/// ```
///
/// Each row of P is the solution of the overdetermined system `Qᵀ·p = xᵢ`,
/// so all rows are solved at once as `Qᵀ·Pᵀ = xᵀ`. With a ridge λ > 0 the
/// system is augmented with `√λ·I` rows:
///
/// ```text
/// ┌      ┐        ┌    ┐
/// │  Qᵀ  │ · Pᵀ = │ xᵀ │
/// │ √λ·I │        │ 0  │
/// └      ┘        └    ┘
/// ```
///
/// The system is factored once with a QR decomposition. When Q is rank
/// deficient (QR reports it singular) the SVD pseudo-inverse is used instead,
/// yielding the minimum-norm least-squares solution.
///
/// Row i of the result always corresponds to row i of x.
public final class ComponentProjection {

    private static final Logger logger = LogManager.getLogger(ComponentProjection.class);

    /// Diagonal magnitude of R below which the system counts as singular.
    private static final double SINGULARITY_THRESHOLD = 1e-12;

    private final int rank;
    private final int columns;
    private final double ridge;
    private final DecompositionSolver solver;

    /// Factors the projection system for the given components.
    ///
    /// @param components the components Q, rank rows by column count
    /// @param ridge the ridge penalty λ, zero for plain least squares
    public ComponentProjection(RealMatrix components, double ridge) {
        Objects.requireNonNull(components, "components cannot be null");
        if (ridge < 0 || !Double.isFinite(ridge)) {
            throw new IllegalArgumentException("ridge must be a finite value >= 0, got " + ridge);
        }
        this.rank = components.getRowDimension();
        this.columns = components.getColumnDimension();
        this.ridge = ridge;

        RealMatrix system = components.transpose();
        if (ridge > 0) {
            RealMatrix augmented = MatrixUtils.createRealMatrix(columns + rank, rank);
            augmented.setSubMatrix(system.getData(), 0, 0);
            double scale = Math.sqrt(ridge);
            for (int i = 0; i < rank; i++) {
                augmented.setEntry(columns + i, i, scale);
            }
            system = augmented;
        }

        DecompositionSolver qr = system.getRowDimension() >= rank
            ? new QRDecomposition(system, SINGULARITY_THRESHOLD).getSolver()
            : null;
        if (qr != null && qr.isNonSingular()) {
            this.solver = qr;
        } else {
            logger.warn("components of rank {} over {} columns are rank deficient, projecting with pseudo-inverse",
                rank, columns);
            this.solver = new SingularValueDecomposition(system).getSolver();
        }
    }

    /// Projects data onto the components.
    ///
    /// @param x data with the components' column count
    /// @return P, one row per row of x and one column per component
    /// @throws ShapeMismatchException if x's column count differs from the components'
    public RealMatrix project(RealMatrix x) {
        Objects.requireNonNull(x, "x cannot be null");
        if (x.getColumnDimension() != columns) {
            throw new ShapeMismatchException("data must have one column per component column",
                columns, x.getColumnDimension());
        }
        RealMatrix rhs = x.transpose();
        if (ridge > 0) {
            RealMatrix augmented = MatrixUtils.createRealMatrix(columns + rank, x.getRowDimension());
            augmented.setSubMatrix(rhs.getData(), 0, 0);
            rhs = augmented;
        }
        return solver.solve(rhs).transpose();
    }

    /// @return the number of components
    public int rank() {
        return rank;
    }
}
