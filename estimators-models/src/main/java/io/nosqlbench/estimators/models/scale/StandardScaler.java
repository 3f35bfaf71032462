package io.nosqlbench.estimators.models.scale;

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

import io.nosqlbench.estimators.api.AbstractTransformer;
import io.nosqlbench.estimators.api.OnlineTransformer;
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixFormat;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Standardizes every column to zero mean and unit variance.
 *
 * <h2>Transformation</h2>
 *
 * <pre>
 * z = (x - mean) / std
 * </pre>
 *
 * <p>Centering is skipped when {@code with_mean} is false, scaling when
 * {@code with_std} is false. Columns with zero variance are scaled by 1.
 *
 * <h2>Online Training</h2>
 *
 * <p>Per-column moments are accumulated with Welford's algorithm and merged
 * across batches, so any sequence of {@link #partialFit} calls learns the
 * same moments as one {@code fitTransform} over all batches stacked.
 *
 * <h2>Input</h2>
 *
 * <p>Centering turns zeros into nonzeros, so a sparse input is only accepted
 * when {@code with_mean} is false. Computation is dense in both cases.
 *
 * @see StandardScalerConfig
 */
public final class StandardScaler extends AbstractTransformer<StandardScalerConfig, StandardScaler.Moments>
    implements OnlineTransformer {

    /**
     * Creates an unfitted scaler.
     *
     * @param config the hyperparameters
     */
    public StandardScaler(StandardScalerConfig config) {
        super(config);
    }

    @Override
    public InputFormats inputFormats() {
        return config().withMean() ? InputFormats.denseOnly() : InputFormats.both(MatrixFormat.DENSE);
    }

    @Override
    public void partialFit(RealMatrix x) {
        incrementalFit(x);
    }

    /**
     * @return the learned per-column means
     */
    public double[] mean() {
        ColumnMomentsAccumulator[] columns = state.require("mean").columns;
        double[] means = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            means[c] = columns[c].mean();
        }
        return means;
    }

    /**
     * @return the learned per-column population variances
     */
    public double[] variance() {
        ColumnMomentsAccumulator[] columns = state.require("variance").columns;
        double[] variances = new double[columns.length];
        for (int c = 0; c < columns.length; c++) {
            variances[c] = columns[c].variance();
        }
        return variances;
    }

    /**
     * Returns the divisor applied to every column: the standard deviation, or
     * 1 for zero-variance columns.
     *
     * @return the per-column scale
     */
    public double[] scale() {
        return state.require("scale").scale();
    }

    @Override
    protected Moments doFit(RealMatrix x) {
        Moments moments = doPartialFit(x, null);
        int constant = 0;
        for (ColumnMomentsAccumulator column : moments.columns) {
            if (column.variance() == 0.0) {
                constant++;
            }
        }
        if (constant > 0 && config().withStd()) {
            logger.warn("{} of {} columns have zero variance and are left unscaled", constant, moments.columns.length);
        }
        return moments;
    }

    @Override
    protected Moments doPartialFit(RealMatrix x, Moments current) {
        int columns = x.getColumnDimension();
        ColumnMomentsAccumulator[] batch = new ColumnMomentsAccumulator[columns];
        for (int c = 0; c < columns; c++) {
            batch[c] = new ColumnMomentsAccumulator();
            for (int r = 0; r < x.getRowDimension(); r++) {
                batch[c].accept(x.getEntry(r, c));
            }
        }
        if (current == null) {
            return new Moments(batch);
        }
        ColumnMomentsAccumulator[] merged = new ColumnMomentsAccumulator[columns];
        for (int c = 0; c < columns; c++) {
            merged[c] = current.columns[c].combine(batch[c]);
        }
        return new Moments(merged);
    }

    @Override
    protected RealMatrix doTransform(RealMatrix x, Moments moments) {
        int rows = x.getRowDimension();
        int columns = x.getColumnDimension();
        boolean center = config().withMean();
        double[] scale = config().withStd() ? moments.scale() : null;

        RealMatrix out = MatrixUtils.createRealMatrix(rows, columns);
        for (int c = 0; c < columns; c++) {
            double offset = center ? moments.columns[c].mean() : 0.0;
            double divisor = scale != null ? scale[c] : 1.0;
            for (int r = 0; r < rows; r++) {
                out.setEntry(r, c, (x.getEntry(r, c) - offset) / divisor);
            }
        }
        return out;
    }

    /**
     * Learned per-column moments. Replaced, never modified, on each update.
     */
    static final class Moments {

        private final ColumnMomentsAccumulator[] columns;

        Moments(ColumnMomentsAccumulator[] columns) {
            this.columns = columns;
        }

        double[] scale() {
            double[] scale = new double[columns.length];
            for (int c = 0; c < columns.length; c++) {
                double std = Math.sqrt(columns[c].variance());
                scale[c] = std > 0 ? std : 1.0;
            }
            return scale;
        }
    }
}
