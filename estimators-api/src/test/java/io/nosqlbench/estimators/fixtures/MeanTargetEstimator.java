package io.nosqlbench.estimators.fixtures;

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
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Predicts the scaled mean of every target seen, for every row.
 * Accepts dense and sparse input and computes on sparse.
 */
public final class MeanTargetEstimator extends AbstractEstimator<FixtureConfig, MeanTargetEstimator.Sum>
    implements OnlineEstimator {

    /** The formats of every matrix handed to the training hooks, in call order. */
    public final List<MatrixFormat> seenFormats = new ArrayList<>();

    public MeanTargetEstimator(FixtureConfig config) {
        super(config);
    }

    public MeanTargetEstimator() {
        this(FixtureConfig.defaults());
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.both(MatrixFormat.SPARSE);
    }

    @Override
    public void partialFit(RealMatrix x, RealVector y) {
        incrementalFit(x, y);
    }

    public double mean() {
        Sum sum = state.require("mean");
        return sum.total / sum.count;
    }

    @Override
    protected Sum doFit(RealMatrix x, RealVector y) {
        return doPartialFit(x, y, null);
    }

    @Override
    protected Sum doPartialFit(RealMatrix x, RealVector y, Sum current) {
        seenFormats.add(MatrixFormat.of(x));
        double total = current != null ? current.total : 0.0;
        long count = current != null ? current.count : 0L;
        for (int i = 0; i < y.getDimension(); i++) {
            if (Double.isNaN(y.getEntry(i))) {
                throw new IllegalArgumentException("NaN target at row " + i);
            }
            total += y.getEntry(i);
        }
        return new Sum(total, count + y.getDimension());
    }

    @Override
    protected RealVector doPredict(RealMatrix x, Sum parameters) {
        seenFormats.add(MatrixFormat.of(x));
        double value = config().scaleFactor() * parameters.total / parameters.count;
        return new ArrayRealVector(x.getRowDimension(), value);
    }

    public record Sum(double total, long count) {
    }
}
