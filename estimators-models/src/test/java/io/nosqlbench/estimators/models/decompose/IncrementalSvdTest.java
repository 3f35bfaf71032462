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

import io.nosqlbench.estimators.api.Calls;
import io.nosqlbench.estimators.api.Decomposer;
import io.nosqlbench.estimators.api.FitMode;
import io.nosqlbench.estimators.api.ModelKind;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.models.ModelFixtures;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Component signs are arbitrary, so results are compared through the
 * projector QᵀQ and through reconstructions, both of which are sign-free.
 */
@Tag("unit")
class IncrementalSvdTest {

    private final RealMatrix x = ModelFixtures.gaussian(120, 6, ModelFixtures.SEED);

    @Test
    void testDescribesItself() {
        IncrementalSvd svd = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));
        assertEquals(ModelKind.DECOMPOSER, svd.kind());
        assertEquals(FitMode.ONLINE, svd.fitMode());
    }

    @Test
    void testPartialFitBatchesMatchSingleFit() {
        IncrementalSvd batches = new IncrementalSvd(IncrementalSvdConfig.ofRank(3));
        batches.partialFit(ModelFixtures.rows(x, 0, 30));
        Calls.partialFit(ModelFixtures.rows(x, 30, 75), batches);
        batches.partialFit(ModelFixtures.rows(x, 75, 120));

        IncrementalSvd single = new IncrementalSvd(IncrementalSvdConfig.ofRank(3));
        single.fitTransform(x);

        assertEquals(120, batches.samplesSeen());
        assertArrayEquals(single.singularValues(), batches.singularValues(), 1e-8);
        assertEquals(0.0, ModelFixtures.maxAbsDifference(projector(single), projector(batches)), 1e-8);
        assertEquals(0.0, ModelFixtures.maxAbsDifference(
            reconstruct(single, x), reconstruct(batches, x)), 1e-8);
    }

    @Test
    void testAgreesWithTruncatedSvd() {
        IncrementalSvd incremental = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));
        incremental.fitTransform(x);
        TruncatedSvd truncated = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));
        truncated.fitTransform(x);

        assertArrayEquals(truncated.singularValues(), incremental.singularValues(), 1e-6);
        assertEquals(0.0, ModelFixtures.maxAbsDifference(projector(truncated), projector(incremental)), 1e-6);
    }

    @Test
    void testRoundTripAfterFitTransform() {
        IncrementalSvd svd = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));
        RealMatrix fitted = svd.fitTransform(x);

        assertEquals(120, fitted.getRowDimension());
        assertEquals(2, fitted.getColumnDimension());
        assertEquals(0.0, ModelFixtures.maxAbsDifference(fitted, svd.transform(x)), 1e-8);
    }

    @Test
    void testFitTransformDiscardsEarlierBatches() {
        IncrementalSvd svd = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));
        svd.partialFit(ModelFixtures.gaussian(40, 6, 99L));
        svd.fitTransform(x);

        IncrementalSvd fresh = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));
        fresh.fitTransform(x);

        assertEquals(120, svd.samplesSeen());
        assertArrayEquals(fresh.singularValues(), svd.singularValues(), 0.0);
    }

    @Test
    void testZeroRowBatchesAreRejected() {
        IncrementalSvd svd = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));

        ShapeMismatchException e = assertThrows(ShapeMismatchException.class, () -> svd.fitTransform(new double[0][]));
        assertEquals(0, e.getActual());
        assertThrows(ShapeMismatchException.class, () -> svd.partialFit(new double[0][]));
        assertFalse(svd.isFitted());

        svd.partialFit(ModelFixtures.rows(x, 0, 20));
        double[] singularValues = svd.singularValues();
        assertThrows(ShapeMismatchException.class, () -> svd.partialFit(new double[0][]));
        assertArrayEquals(singularValues, svd.singularValues(), 0.0);
        assertEquals(20, svd.samplesSeen());
    }

    @Test
    void testShapeErrors() {
        IncrementalSvd tooWide = new IncrementalSvd(IncrementalSvdConfig.ofRank(7));
        assertThrows(ShapeMismatchException.class, () -> tooWide.partialFit(x));
        assertFalse(tooWide.isFitted());

        IncrementalSvd svd = new IncrementalSvd(IncrementalSvdConfig.ofRank(2));
        svd.partialFit(ModelFixtures.rows(x, 0, 20));
        assertThrows(ShapeMismatchException.class, () -> svd.partialFit(ModelFixtures.gaussian(20, 5, 3L)));
        assertThrows(ShapeMismatchException.class, () -> svd.transform(ModelFixtures.gaussian(20, 5, 3L)));
        assertEquals(20, svd.samplesSeen());
    }

    private static RealMatrix projector(Decomposer decomposer) {
        RealMatrix q = decomposer.components();
        return q.transpose().multiply(q);
    }

    private static RealMatrix reconstruct(IncrementalSvd svd, RealMatrix data) {
        return svd.transform(data).multiply(svd.components());
    }
}
