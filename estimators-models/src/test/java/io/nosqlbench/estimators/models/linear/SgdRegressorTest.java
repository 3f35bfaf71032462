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

import io.nosqlbench.estimators.api.Calls;
import io.nosqlbench.estimators.api.FitMode;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.models.ModelFixtures;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SgdRegressorTest {

    private final RealMatrix x = ModelFixtures.gaussian(600, 2, ModelFixtures.SEED);
    private final RealVector y = ModelFixtures.linearTargets(x, new double[]{2.0, -1.0}, 1.0);

    @Test
    void testConvergesOnNoiseFreeData() {
        SgdRegressor model = new SgdRegressor(SgdRegressorConfig.defaults().withEpochs(20));
        model.fit(x, y);

        LinearCoefficients coefficients = model.coefficients();
        assertEquals(FitMode.ONLINE, model.fitMode());
        assertArrayEquals(new double[]{2.0, -1.0}, coefficients.weights(), 0.05);
        assertEquals(1.0, coefficients.intercept(), 0.05);
    }

    @Test
    void testPartialFitBatchesMatchSinglePass() {
        SgdRegressorConfig config = SgdRegressorConfig.defaults().withEpochs(1);

        SgdRegressor batches = new SgdRegressor(config);
        batches.partialFit(ModelFixtures.rows(x, 0, 100), y.getSubVector(0, 100));
        Calls.partialFit(ModelFixtures.rows(x, 100, 350), y.getSubVector(100, 250), batches);
        batches.partialFit(ModelFixtures.rows(x, 350, 600), y.getSubVector(350, 250));

        SgdRegressor single = new SgdRegressor(config);
        single.fit(x, y);

        assertArrayEquals(single.coefficients().weights(), batches.coefficients().weights(), 1e-12);
        assertEquals(single.coefficients().intercept(), batches.coefficients().intercept(), 1e-12);
        assertEquals(600, batches.samplesSeen());
    }

    @Test
    void testFitDiscardsEarlierBatches() {
        SgdRegressorConfig config = SgdRegressorConfig.defaults().withEpochs(3);

        SgdRegressor reused = new SgdRegressor(config);
        reused.partialFit(ModelFixtures.rows(x, 0, 50), y.getSubVector(0, 50));
        reused.fit(x, y);

        SgdRegressor fresh = new SgdRegressor(config);
        fresh.fit(x, y);

        assertEquals(fresh.coefficients(), reused.coefficients());
        assertEquals(600, reused.samplesSeen());
    }

    @Test
    void testPartialFitRejectsColumnChange() {
        SgdRegressor model = new SgdRegressor(SgdRegressorConfig.defaults());
        model.partialFit(ModelFixtures.rows(x, 0, 10), y.getSubVector(0, 10));
        LinearCoefficients before = model.coefficients();

        assertThrows(ShapeMismatchException.class,
            () -> model.partialFit(ModelFixtures.gaussian(10, 3, 1L), y.getSubVector(0, 10)));
        assertEquals(before, model.coefficients());
    }
}
