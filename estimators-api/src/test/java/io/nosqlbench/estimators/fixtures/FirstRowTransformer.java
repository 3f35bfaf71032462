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

import io.nosqlbench.estimators.api.AbstractTransformer;
import io.nosqlbench.estimators.matrix.InputFormats;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Learns the column count, then emits only the first row of its input.
 * Trips the row check of {@link AbstractTransformer}.
 */
public final class FirstRowTransformer extends AbstractTransformer<FixtureConfig, Integer> {

    public FirstRowTransformer() {
        super(FixtureConfig.defaults());
    }

    @Override
    public InputFormats inputFormats() {
        return InputFormats.denseOnly();
    }

    @Override
    protected Integer doFit(RealMatrix x) {
        return x.getColumnDimension();
    }

    @Override
    protected RealMatrix doTransform(RealMatrix x, Integer columns) {
        return x.getSubMatrix(0, 0, 0, columns - 1);
    }
}
