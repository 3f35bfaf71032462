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
import io.nosqlbench.estimators.fixtures.Matrices;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for least-squares projection onto a set of component rows.
 */
@Tag("unit")
class ComponentProjectionTest {

    @Test
    void testOrthonormalComponentsProjectByDotProduct() {
        double s = Math.sqrt(0.5);
        RealMatrix components = new Array2DRowRealMatrix(new double[][]{
            {s, s, 0, 0},
            {0, 0, 1, 0}
        });
        RealMatrix x = Matrices.gaussian(20, 4, 7L);

        RealMatrix projected = new ComponentProjection(components, 0.0).project(x);

        assertEquals(20, projected.getRowDimension());
        assertEquals(2, projected.getColumnDimension());
        RealMatrix expected = x.multiply(components.transpose());
        assertEquals(0.0, Matrices.maxAbsDifference(expected, projected), 1e-12);
    }

    @Test
    void testNonOrthogonalComponentsReconstructRowSpaceData() {
        RealMatrix components = new Array2DRowRealMatrix(new double[][]{
            {1, 2, 0},
            {1, 0, 1}
        });
        RealMatrix coefficients = Matrices.gaussian(15, 2, 11L);
        RealMatrix x = coefficients.multiply(components);

        RealMatrix projected = new ComponentProjection(components, 0.0).project(x);

        assertEquals(0.0, Matrices.maxAbsDifference(coefficients, projected), 1e-10);
    }

    @Test
    void testRankDeficientComponentsFallBackToPseudoInverse() {
        RealMatrix components = new Array2DRowRealMatrix(new double[][]{
            {1, 0, 0},
            {1, 0, 0}
        });
        RealMatrix x = new Array2DRowRealMatrix(new double[][]{{4, 0, 0}, {-2, 0, 0}});

        RealMatrix projected = new ComponentProjection(components, 0.0).project(x);

        // minimum-norm solution splits the weight evenly
        assertEquals(2.0, projected.getEntry(0, 0), 1e-10);
        assertEquals(2.0, projected.getEntry(0, 1), 1e-10);
        assertEquals(0.0, Matrices.maxAbsDifference(x, projected.multiply(components)), 1e-10);
    }

    @Test
    void testRidgeShrinksCoefficients() {
        RealMatrix components = new Array2DRowRealMatrix(new double[][]{{1, 0}, {0, 1}});
        RealMatrix x = new Array2DRowRealMatrix(new double[][]{{3, -6}});

        RealMatrix plain = new ComponentProjection(components, 0.0).project(x);
        RealMatrix ridged = new ComponentProjection(components, 1.0).project(x);

        assertEquals(3.0, plain.getEntry(0, 0), 1e-12);
        // (QQᵀ + λI)⁻¹Qx with Q = I, λ = 1 halves every coefficient
        assertEquals(1.5, ridged.getEntry(0, 0), 1e-12);
        assertEquals(-3.0, ridged.getEntry(0, 1), 1e-12);
    }

    @Test
    void testValidation() {
        RealMatrix components = new Array2DRowRealMatrix(new double[][]{{1, 0, 0}});
        ComponentProjection projection = new ComponentProjection(components, 0.0);

        assertEquals(1, projection.rank());
        ShapeMismatchException e = assertThrows(ShapeMismatchException.class,
            () -> projection.project(new Array2DRowRealMatrix(new double[][]{{1, 2}})));
        assertEquals(3, e.getExpected());
        assertEquals(2, e.getActual());

        assertThrows(IllegalArgumentException.class, () -> new ComponentProjection(components, -0.5));
        assertThrows(IllegalArgumentException.class, () -> new ComponentProjection(components, Double.NaN));
    }
}
