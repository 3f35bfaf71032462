package io.nosqlbench.estimators.models.decompose;

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

import io.nosqlbench.estimators.api.AbstractDecomposer;
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixFormat;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;

/**
 * Rank-k truncated singular value decomposition.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Computes the compact SVD {@code x = U·S·Vᵀ} and keeps the k leading
 * right singular vectors as components:
 *
 * <pre>
 * Q = V_kᵀ           (k × cols, orthonormal rows)
 * P = x·Qᵀ = U_k·S_k (rows × k)
 * </pre>
 *
 * <p>P is not stored. {@code fitTransform} and {@code transform} both obtain it
 * by least-squares projection onto Q, which for orthonormal Q equals
 * {@code x·Qᵀ}.
 *
 * <h2>Constraints</h2>
 *
 * <p>The rank must not exceed {@code min(rows, cols)} of the training matrix.
 *
 * @see TruncatedSvdConfig
 */
public final class TruncatedSvd extends AbstractDecomposer<TruncatedSvdConfig, SvdComponents> {

    /**
     * Creates an unfitted decomposition.
     *
     * @param config the hyperparameters
     */
    public TruncatedSvd(TruncatedSvdConfig config) {
        super(config);
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.both(MatrixFormat.DENSE);
    }

    @Override
    public int rank() {
        return config().rank();
    }

    /**
     * Returns the singular values matching the components.
     *
     * @return the k leading singular values, descending
     */
    public double[] singularValues() {
        return state.require("singularValues").singularValues().clone();
    }

    @Override
    protected double projectionRidge() {
        return config().projectionRidge();
    }

    @Override
    protected SvdComponents doFit(RealMatrix x) {
        int columns = x.getColumnDimension();
        checkRank(x.getRowDimension(), columns);
        int k = rank();

        SingularValueDecomposition svd = new SingularValueDecomposition(x);
        RealMatrix components = svd.getVT().getSubMatrix(0, k - 1, 0, columns - 1);
        double[] singularValues = Arrays.copyOf(svd.getSingularValues(), k);

        if (singularValues[k - 1] == 0.0) {
            logger.warn("{} of rank {} exceeds the numerical rank of the data", modelType(), k);
        }
        return new SvdComponents(components, singularValues);
    }
}
