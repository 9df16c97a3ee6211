/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.tides.harmonics;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.tides.DisplacementSeries;
import com.github.tinemuz.tides.TideConfigurationException;
import java.util.List;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeformationMatrixTest {
    private static final double G = 9.8;
    private static final Vector3D P = new Vector3D(0.48, 0.36, 0.8);
    private static final LoveNumbers LOVE = LoveNumbers.of(
            new double[] {0.11, 0.3, 0.6, 0.29}, new double[] {0.02, 0.06, 0.08, 0.015});

    @Nested
    @DisplayName("Columns of a unit station")
    class Columns {
        private final RealMatrix a =
                DeformationMatrix.build(List.of(P), new double[] {G}, LOVE, 1.0, 1.0, 3).matrix();

        @Test
        @DisplayName("Matrix shape is 3K x (N+1)^2")
        void shape() {
            assertEquals(3, a.getRowDimension());
            assertEquals(16, a.getColumnDimension());
        }

        @Test
        @DisplayName("(0,0) is purely vertical")
        void degreeZero() {
            assertColumn(0, 0, false);
            Vector3D c = column(CoefficientIndex.pack(0, 0, false));
            assertArrayEquals(P.scalarMultiply(0.11 / G).toArray(), c.toArray(), 1e-14);
        }

        @Test
        @DisplayName("(1,0), (1,1) cosine and sine")
        void degreeOne() {
            assertColumn(1, 0, false);
            assertColumn(1, 1, false);
            assertColumn(1, 1, true);
        }

        @Test
        @DisplayName("(3,2) cosine and sine")
        void degreeThreeOrderTwo() {
            assertColumn(3, 2, false);
            assertColumn(3, 2, true);
        }

        @Test
        @DisplayName("All columns match the basis function response")
        void allColumns() {
            for (int n = 0; n <= 3; n++) {
                assertColumn(n, 0, false);
                for (int m = 1; m <= n; m++) {
                    assertColumn(n, m, false);
                    assertColumn(n, m, true);
                }
            }
        }

        private Vector3D column(int index) {
            return new Vector3D(a.getEntry(0, index), a.getEntry(1, index), a.getEntry(2, index));
        }

        private void assertColumn(int n, int m, boolean sine) {
            double v = basis(P, n, m, sine);
            double h = 1e-6;
            Vector3D grad = new Vector3D(
                    (basis(P.add(h, Vector3D.PLUS_I), n, m, sine) - basis(P.subtract(h, Vector3D.PLUS_I), n, m, sine)) / (2 * h),
                    (basis(P.add(h, Vector3D.PLUS_J), n, m, sine) - basis(P.subtract(h, Vector3D.PLUS_J), n, m, sine)) / (2 * h),
                    (basis(P.add(h, Vector3D.PLUS_K), n, m, sine) - basis(P.subtract(h, Vector3D.PLUS_K), n, m, sine)) / (2 * h));
            Vector3D up = P.normalize();
            Vector3D horizontal = grad.subtract(grad.dotProduct(up), up);
            Vector3D expected = new Vector3D(LOVE.h(n) * v / G, up, LOVE.l(n) / G, horizontal);
            Vector3D actual = column(CoefficientIndex.pack(n, m, sine));
            assertArrayEquals(expected.toArray(), actual.toArray(), 1e-8, "column " + n + "," + m + (sine ? "s" : "c"));
        }
    }

    @Nested
    @DisplayName("Closed form displacement")
    class ClosedForm {

        @Test
        @DisplayName("Degree 1 zonal field up to degree 2")
        void zonalDegreeOne() {
            double[] x = new double[CoefficientIndex.count(2)];
            x[CoefficientIndex.pack(1, 0, false)] = 1.0;
            SphericalHarmonics field = SphericalHarmonics.of(1.0, 1.0, x);
            LoveNumbers love = LoveNumbers.of(new double[] {0.6, 0.3, 0.1}, new double[] {0.08, 0.06, 0.04});

            Vector3D u = field.deformation(P, G, love);

            double s3 = Math.sqrt(3);
            Vector3D expected = new Vector3D(0.3 / G * s3 * 0.8, P, 0.06 / G * s3, new Vector3D(-0.384, -0.288, 0.36));
            assertArrayEquals(expected.toArray(), u.toArray(), 1e-14);
        }

        @Test
        @DisplayName("Station on the rotation axis stays finite")
        void polarStation() {
            SphericalHarmonics field = SphericalHarmonicsTest.random(11, 3, 3.986004415e14, 6378136.3).scale(1e-8);
            Vector3D pole = new Vector3D(0, 0, 6356752.0);
            Vector3D u = field.deformation(pole, 9.83, LOVE);
            for (double c : u.toArray()) assertTrue(Double.isFinite(c));
            assertTrue(u.getNorm() > 0);
        }
    }

    @Nested
    @DisplayName("Application to fields")
    class Application {
        private final List<Vector3D> points = List.of(
                new Vector3D(4.0e6, 1.0e6, 4.8e6), new Vector3D(-2.0e6, 5.5e6, -2.4e6));
        private final double[] gravity = {9.81, 9.79};

        @Test
        @DisplayName("Accumulated epochs equal separate single station queries")
        void accumulateMatchesDirect() {
            double gm = 3.986004415e14;
            double r = 6378136.3;
            DeformationMatrix a = DeformationMatrix.build(points, gravity, LOVE, gm, r, 3);
            DisplacementSeries out = new DisplacementSeries(2, 3);
            SphericalHarmonics[] fields = new SphericalHarmonics[3];
            for (int i = 0; i < 3; i++) {
                fields[i] = SphericalHarmonicsTest.random(20 + i, 3, gm, r).scale(1e-8);
                a.accumulate(fields[i], i, out);
            }
            for (int i = 0; i < 3; i++) {
                for (int k = 0; k < 2; k++) {
                    Vector3D direct = fields[i].deformation(points.get(k), gravity[k], LOVE);
                    assertArrayEquals(direct.toArray(), out.get(k, i).toArray(), 1e-12 * direct.getNorm() + 1e-15);
                }
            }
        }

        @Test
        @DisplayName("Fields in another scale are converted first")
        void convertsField() {
            DeformationMatrix a = DeformationMatrix.build(points, gravity, LOVE, 3.986e14, 6.378e6, 3);
            SphericalHarmonics field = SphericalHarmonicsTest.random(30, 2, 3.986e14, 6.378e6).scale(1e-8);
            List<Vector3D> u1 = a.apply(field);
            List<Vector3D> u2 = a.apply(field.convert(4.0e14, 6.4e6));
            for (int k = 0; k < 2; k++) {
                assertArrayEquals(u1.get(k).toArray(), u2.get(k).toArray(), 1e-12 * u1.get(k).getNorm());
            }
        }

        @Test
        @DisplayName("Size mismatches and short Love number tables are rejected")
        void validation() {
            assertEquals("gravity", assertThrows(TideConfigurationException.class,
                    () -> DeformationMatrix.build(points, new double[] {9.8}, LOVE, 1.0, 1.0, 2)).field());
            assertEquals("points", assertThrows(TideConfigurationException.class,
                    () -> DeformationMatrix.build(List.of(), new double[0], LOVE, 1.0, 1.0, 2)).field());
            assertEquals("hn", assertThrows(TideConfigurationException.class,
                    () -> DeformationMatrix.build(points, gravity, LOVE, 1.0, 1.0, 4)).field());
        }
    }

    private static double basis(Vector3D p, int n, int m, boolean sine) {
        SolidHarmonics h = SolidHarmonics.of(p, n);
        return sine ? h.snm(n, m) : h.cnm(n, m);
    }
}
