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
import io.nosqlbench.estimators.api.FitMode;
import io.nosqlbench.estimators.api.ModelKind;
import io.nosqlbench.estimators.errors.NotFittedException;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.matrix.MatrixConversions;
import io.nosqlbench.estimators.models.ModelFixtures;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TruncatedSvdTest {

    private final RealMatrix x = ModelFixtures.randomIntegers(100, 10, 10, ModelFixtures.SEED);

    @Test
    void testRankTwoRoundTrip() {
        TruncatedSvd svd = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));

        RealMatrix fitted = svd.fitTransform(x);
        RealMatrix applied = svd.transform(x);

        assertEquals(100, fitted.getRowDimension());
        assertEquals(2, fitted.getColumnDimension());
        assertEquals(0.0, ModelFixtures.maxAbsDifference(fitted, applied), 1e-8);
        assertEquals(ModelKind.DECOMPOSER, svd.kind());
        assertEquals(FitMode.BATCH, svd.fitMode());
    }

    @Test
    void testSubjectFirstFormMatchesDirectCall() {
        TruncatedSvd direct = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));
        TruncatedSvd subjectFirst = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));

        assertEquals(direct.fitTransform(x), Calls.fitTransform(x, subjectFirst));
        assertEquals(direct.transform(x), Calls.transform(x, subjectFirst));
    }

    @Test
    void testOutputIsScaledLeftSingularVectors() {
        TruncatedSvd svd = new TruncatedSvd(TruncatedSvdConfig.ofRank(3));
        RealMatrix projected = svd.fitTransform(x);
        double[] singularValues = svd.singularValues();

        assertEquals(3, singularValues.length);
        for (int j = 0; j < 3; j++) {
            assertEquals(singularValues[j], projected.getColumnVector(j).getNorm(), 1e-8);
        }
        assertTrue(singularValues[0] >= singularValues[1] && singularValues[1] >= singularValues[2]);

        RealMatrix q = svd.components();
        RealMatrix gram = q.multiply(q.transpose());
        assertEquals(0.0, ModelFixtures.maxAbsDifference(MatrixUtils.createRealIdentityMatrix(3), gram), 1e-10);
    }

    @Test
    void testReconstructsLowRankData() {
        RealMatrix lowRank = ModelFixtures.lowRank(50, 8, 2, 0.0, 5L);
        TruncatedSvd svd = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));

        RealMatrix reconstructed = svd.fitTransform(lowRank).multiply(svd.components());

        assertEquals(0.0, ModelFixtures.maxAbsDifference(lowRank, reconstructed), 1e-8);
    }

    @Test
    void testSparseInputMatchesDense() {
        RealMatrix sparseSource = ModelFixtures.randomIntegers(40, 6, 2, 6L);
        TruncatedSvd dense = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));
        TruncatedSvd sparse = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));

        RealMatrix fromDense = dense.fitTransform(sparseSource);
        RealMatrix fromSparse = sparse.fitTransform(MatrixConversions.toSparse(sparseSource));

        assertEquals(0.0, ModelFixtures.maxAbsDifference(fromDense, fromSparse), 1e-10);
    }

    @Test
    void testProjectionRidgeShrinksOutput() {
        TruncatedSvd plain = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));
        TruncatedSvd ridged = new TruncatedSvd(TruncatedSvdConfig.ofRank(2).withProjectionRidge(1.0));

        RealMatrix plainOutput = plain.fitTransform(x);
        RealMatrix ridgedOutput = ridged.fitTransform(x);

        // orthonormal components: the ridge divides every coordinate by 1 + λ
        assertEquals(0.0, ModelFixtures.maxAbsDifference(plainOutput.scalarMultiply(0.5), ridgedOutput), 1e-8);
        assertEquals(0.0, ModelFixtures.maxAbsDifference(ridgedOutput, ridged.transform(x)), 1e-8);
    }

    @Test
    void testShapeErrors() {
        TruncatedSvd svd = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));
        assertThrows(NotFittedException.class, svd::components);
        assertThrows(NotFittedException.class, () -> svd.transform(x));

        svd.fitTransform(x);
        ShapeMismatchException columns = assertThrows(ShapeMismatchException.class,
            () -> svd.transform(ModelFixtures.randomIntegers(5, 9, 10, 1L)));
        assertEquals(10, columns.getExpected());
        assertEquals(9, columns.getActual());

        TruncatedSvd tooWide = new TruncatedSvd(TruncatedSvdConfig.ofRank(11));
        assertThrows(ShapeMismatchException.class, () -> tooWide.fitTransform(x));

        TruncatedSvd tooTall = new TruncatedSvd(TruncatedSvdConfig.ofRank(5));
        assertThrows(ShapeMismatchException.class,
            () -> tooTall.fitTransform(ModelFixtures.randomIntegers(3, 10, 10, 2L)));
        assertFalse(tooTall.isFitted());

        TruncatedSvd unfitted = new TruncatedSvd(TruncatedSvdConfig.ofRank(2));
        ShapeMismatchException empty = assertThrows(ShapeMismatchException.class,
            () -> unfitted.fitTransform(new double[0][]));
        assertEquals(1, empty.getExpected());
        assertEquals(0, empty.getActual());
        assertFalse(unfitted.isFitted());
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TruncatedSvd(TruncatedSvdConfig.ofRank(0)));
        assertThrows(IllegalArgumentException.class,
            () -> new TruncatedSvd(TruncatedSvdConfig.ofRank(2).withProjectionRidge(-1.0)));
    }
}
