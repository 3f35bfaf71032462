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
import io.nosqlbench.estimators.api.OnlineDecomposer;
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixFormat;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/// Truncated SVD whose components can be refined batch by batch.
///
/// # Algorithm
///
/// The right singular vectors of a matrix X are the eigenvectors of its Gram
/// matrix XᵀX. The Gram matrix of row-stacked batches is the sum of the
/// batch Gram matrices, so batches merge exactly:
///
/// ```text
/// ┌─────┐
/// │ X₁  │        G = X₁ᵀX₁ + X₂ᵀX₂ + ...
/// ├─────┤  ──►
/// │ X₂  │        Q = top-k eigenvectors of G  (as rows)
/// ├─────┤        σᵢ = √λᵢ
/// │ ... │
/// └─────┘
/// ```
///
/// Memory is O(cols²) regardless of how many rows were seen. After any
/// sequence of [#partialFit] calls the components span the same subspace
/// as a [TruncatedSvd] of all batches stacked.
///
/// [#fitTransform] resets, accumulates x as a single batch, and projects x.
public final class IncrementalSvd extends AbstractDecomposer<IncrementalSvdConfig, GramComponents>
    implements OnlineDecomposer {

    /// Creates an unfitted decomposition.
    ///
    /// @param config the hyperparameters
    public IncrementalSvd(IncrementalSvdConfig config) {
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

    @Override
    public void partialFit(RealMatrix x) {
        incrementalFit(x);
    }

    /// @return the k leading singular values of all batches seen, descending
    public double[] singularValues() {
        return state.require("singularValues").singularValues().clone();
    }

    @Override
    protected double projectionRidge() {
        return config().projectionRidge();
    }

    @Override
    protected GramComponents doFit(RealMatrix x) {
        return doPartialFit(x, null);
    }

    @Override
    protected GramComponents doPartialFit(RealMatrix x, GramComponents current) {
        int columns = x.getColumnDimension();
        checkRank(Integer.MAX_VALUE, columns);

        RealMatrix gram = x.transpose().multiply(x);
        if (current != null) {
            gram = gram.add(current.gram());
        }

        EigenDecomposition eigen = new EigenDecomposition(gram);
        double[] eigenvalues = eigen.getRealEigenvalues();
        int[] order = IntStream.range(0, eigenvalues.length)
            .boxed()
            .sorted(Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed())
            .mapToInt(Integer::intValue)
            .toArray();

        int k = rank();
        RealMatrix components = MatrixUtils.createRealMatrix(k, columns);
        double[] singularValues = new double[k];
        for (int i = 0; i < k; i++) {
            components.setRowVector(i, eigen.getEigenvector(order[i]));
            singularValues[i] = Math.sqrt(Math.max(0.0, eigenvalues[order[i]]));
        }
        logger.trace("leading singular values {}", Arrays.toString(singularValues));
        return new GramComponents(gram, components, singularValues);
    }
}
