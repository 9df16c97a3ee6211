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
package com.github.tinemuz.tides;

import static com.github.tinemuz.tides.TideFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.tides.earth.Body;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import java.util.List;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AstronomicalTideTest {
    private final AstronomicalTide tide = AstronomicalTide.sunAndMoon();
    private final Rotation rot = rotEarth(T0);
    private final Vector3D p = station(47.0, 15.4, 6371000.0);

    @Nested
    @DisplayName("Direct evaluation")
    class Direct {

        @Test
        @DisplayName("Potential is of the expected size")
        void magnitude() {
            double v = tide.potential(T0, p, rot, ROTATION, EPHEMERIDES);
            assertTrue(Math.abs(v) > 1e-2 && Math.abs(v) < 10.0, "potential " + v);
        }

        @Test
        @DisplayName("Gravity is the gradient of the potential")
        void gravity() {
            Vector3D g = tide.gravity(T0, p, rot, ROTATION, EPHEMERIDES);
            double h = 100.0;
            double[] numeric = new double[3];
            Vector3D[] axes = {Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K};
            for (int i = 0; i < 3; i++) {
                numeric[i] = (tide.potential(T0, p.add(h, axes[i]), rot, ROTATION, EPHEMERIDES)
                        - tide.potential(T0, p.subtract(h, axes[i]), rot, ROTATION, EPHEMERIDES)) / (2 * h);
            }
            assertArrayEquals(numeric, g.toArray(), 1e-12);
            assertEquals(g.dotProduct(p.normalize()), tide.radialGradient(T0, p, rot, ROTATION, EPHEMERIDES), 1e-18);
        }

        @Test
        @DisplayName("Gradient tensor is trace free and the derivative of gravity")
        void gradient() {
            RealMatrix t = tide.gravityGradient(T0, p, rot, ROTATION, EPHEMERIDES);
            assertEquals(0.0, t.getTrace(), 1e-20);
            double h = 10.0;
            Vector3D[] axes = {Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K};
            for (int j = 0; j < 3; j++) {
                Vector3D column = tide.gravity(T0, p.add(h, axes[j]), rot, ROTATION, EPHEMERIDES)
                        .subtract(tide.gravity(T0, p.subtract(h, axes[j]), rot, ROTATION, EPHEMERIDES))
                        .scalarMultiply(1 / (2 * h));
                for (int i = 0; i < 3; i++) {
                    assertEquals(column.toArray()[i], t.getEntry(i, j), 1e-16);
                }
            }
        }

        @Test
        @DisplayName("Factor scales every quantity")
        void factor() {
            AstronomicalTide scaled = new AstronomicalTide(List.of(Body.SUN, Body.MOON), 1.16, 4);
            assertEquals(1.16 * tide.potential(T0, p, rot, ROTATION, EPHEMERIDES),
                    scaled.potential(T0, p, rot, ROTATION, EPHEMERIDES), 1e-12);
            assertEquals(1.16 * tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES).cnm(2, 1),
                    scaled.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES).cnm(2, 1), 1e-20);
        }
    }

    @Nested
    @DisplayName("Harmonic expansion")
    class Expansion {

        @Test
        @DisplayName("Matches the direct potential on the reference sphere")
        void matchesDirect() {
            AstronomicalTide deep = new AstronomicalTide(List.of(Body.SUN, Body.MOON), 1.0, 8);
            SphericalHarmonics field = deep.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES);
            for (double[] ll : new double[][] {{0, 0}, {47, 15.4}, {-33, 151}, {80, -100}}) {
                Vector3D q = station(ll[0], ll[1], AstronomicalTide.DEFAULT_R);
                double direct = deep.potential(T0, q, rot, ROTATION, EPHEMERIDES);
                assertEquals(direct, field.potential(q), 1e-8, "at " + ll[0] + "," + ll[1]);
            }
        }

        @Test
        @DisplayName("Degrees 0 and 1 and those below minDegree are empty")
        void degreeBand() {
            SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES);
            assertEquals(AstronomicalTide.DEFAULT_MAX_DEGREE, field.maxDegree());
            assertEquals(0.0, field.cnm(0, 0));
            assertEquals(0.0, field.cnm(1, 1));
            assertNotEquals(0.0, field.cnm(2, 0));
            SphericalHarmonics high = tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES, 4, 3, 0.0, 0.0);
            assertEquals(0.0, high.cnm(2, 0));
            assertNotEquals(0.0, high.cnm(3, 0));
        }

        @Test
        @DisplayName("Requested scale is honoured")
        void scale() {
            SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES, 3, 0, 4.0e14, 6.4e6);
            assertEquals(4.0e14, field.gm());
            assertEquals(6.4e6, field.r());
            assertEquals(3, field.maxDegree());
        }
    }

    @Test
    @DisplayName("Invalid configurations name the field")
    void validation() {
        assertEquals("bodies", assertThrows(TideConfigurationException.class,
                () -> new AstronomicalTide(List.of(Body.EARTH), 1.0, 4)).field());
        assertEquals("bodies", assertThrows(TideConfigurationException.class,
                () -> new AstronomicalTide(List.of(), 1.0, 4)).field());
        assertEquals("maxDegree", assertThrows(TideConfigurationException.class,
                () -> new AstronomicalTide(List.of(Body.SUN), 1.0, 1)).field());
    }
}
