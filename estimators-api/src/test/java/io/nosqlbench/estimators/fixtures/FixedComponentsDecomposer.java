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

import io.nosqlbench.estimators.api.AbstractDecomposer;
import io.nosqlbench.estimators.api.ComponentState;
import io.nosqlbench.estimators.matrix.InputFormats;
import io.nosqlbench.estimators.matrix.MatrixFormat;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A decomposer whose components are given up front. Fitting only checks
 * the rank against the data and the component width.
 */
public final class FixedComponentsDecomposer extends AbstractDecomposer<FixtureConfig, ComponentState> {

    private final RealMatrix components;

    public FixedComponentsDecomposer(RealMatrix components) {
        super(FixtureConfig.defaults());
        this.components = components.copy();
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.both(MatrixFormat.DENSE);
    }

    @Override
    public int rank() {
        return components.getRowDimension();
    }

    @Override
    protected ComponentState doFit(RealMatrix x) {
        checkRank(x.getRowDimension(), x.getColumnDimension());
        if (x.getColumnDimension() != components.getColumnDimension()) {
            throw new IllegalArgumentException("fixture components have " + components.getColumnDimension() + " columns");
        }
        RealMatrix learned = components.copy();
        return () -> learned;
    }
}
