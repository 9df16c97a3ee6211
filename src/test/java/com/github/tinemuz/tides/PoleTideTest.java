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

import com.github.tinemuz.tides.earth.EarthRotation;
import com.github.tinemuz.tides.earth.PolarMotion;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PoleTideTest {
    // m1 = 0.3", m2 = -0.4"
    private final EarthRotation rotation = fixedPole(0.3, 0.4);
    private final PoleTide tide = new PoleTide(0.3077, 0.0036, 0.6207, 0.0836, MeanPole.NONE);
    private final Rotation rot = rotEarth(T0);

    @Nested
    @DisplayName("Potential coefficients")
    class Coefficients {

        @Test
        @DisplayName("Only c21 and s21 are set, matching the conventional formula")
        void degreeTwoOrderOne() {
            SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, rotation, EPHEMERIDES);
            double m1 = 0.3;
            double m2 = -0.4;
            double c21 = -1.333e-9 * (m1 + 0.0115 * m2);
            double s21 = -1.333e-9 * (m2 - 0.0115 * m1);
            assertEquals(c21, field.cnm(2, 1), 0.005 * Math.abs(c21));
            assertEquals(s21, field.snm(2, 1), 0.005 * Math.abs(s21));
            assertEquals(0.0, field.cnm(2, 0));
            assertEquals(0.0, field.cnm(2, 2));
            assertEquals(2, field.maxDegree());
        }

        @Test
        @DisplayName("No wobble gives no tide")
        void zeroWobble() {
            SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, fixedPole(0, 0), EPHEMERIDES);
            assertTrue(field.isZero());
        }
    }

    @Nested
    @DisplayName("Station displacement")
    class Displacement {

        @Test
        @DisplayName("Matches the conventional millimetre formulas")
        void conventional() {
            double lat = 30.0;
            double lon = 30.0;
            Vector3D p = station(lat, lon, 6378137.0);
            Vector3D u = tide.deformation(T0, p, rot, rotation, EPHEMERIDES, 9.81, BODY_LOVE);

            double theta = Math.toRadians(90 - lat);
            double lambda = Math.toRadians(lon);
            double m1 = 0.3;
            double m2 = -0.4;
            double sr = -33e-3 * Math.sin(2 * theta) * (m1 * Math.cos(lambda) + m2 * Math.sin(lambda));
            double st = -9e-3 * Math.cos(2 * theta) * (m1 * Math.cos(lambda) + m2 * Math.sin(lambda));
            double sl = 9e-3 * Math.cos(theta) * (m1 * Math.sin(lambda) - m2 * Math.cos(lambda));

            Vector3D up = p.normalize();
            Vector3D south = new Vector3D(Math.cos(theta) * Math.cos(lambda), Math.cos(theta) * Math.sin(lambda), -Math.sin(theta));
            Vector3D east = new Vector3D(-Math.sin(lambda), Math.cos(lambda), 0);
            assertEquals(sr, u.dotProduct(up), 0.03 * Math.abs(sr));
            assertEquals(st, u.dotProduct(south), 0.03 * Math.abs(st));
            assertEquals(sl, u.dotProduct(east), 0.03 * Math.abs(sl));
        }

        @Test
        @DisplayName("Batched displacement equals pointwise evaluation")
        void batched() {
            List<GpsTime> times = epochs(3, 86400.0);
            List<Vector3D> points = List.of(station(10, 20, 6378000), station(-60, 300, 6360000));
            double[] gravity = {9.78, 9.82};
            DisplacementSeries out = new DisplacementSeries(2, 3);
            tide.deformation(times, points, rotations(times), rotation, EPHEMERIDES, gravity, BODY_LOVE, out);
            for (int i = 0; i < 3; i++) {
                for (int k = 0; k < 2; k++) {
                    Vector3D direct = tide.deformation(
                            times.get(i), points.get(k), rotEarth(times.get(i)), rotation, EPHEMERIDES, gravity[k], BODY_LOVE);
                    assertArrayEquals(direct.toArray(), out.get(k, i).toArray(), 1e-18);
                }
            }
        }
    }

    @Nested
    @DisplayName("Mean pole")
    class MeanPoleTests {

        @Test
        @DisplayName("Secular pole of 2018 grows linearly from J2000")
        void iers2018() {
            PolarMotion mean = MeanPole.IERS2018.at(GpsTime.of(2000, 1, 1, 12, 0, 0));
            assertEquals(55.0e-3 * ARCSEC, mean.xp(), 1e-6 * ARCSEC);
            assertEquals(320.5e-3 * ARCSEC, mean.yp(), 1e-6 * ARCSEC);
            PolarMotion later = MeanPole.IERS2018.at(GpsTime.of(2010, 1, 1, 12, 0, 0));
            assertEquals((55.0 + 16.77) * 1e-3 * ARCSEC, later.xp(), 1e-3 * ARCSEC);
        }

        @Test
        @DisplayName("Wobble flips the sign of y")
        void wobble() {
            double[] m = MeanPole.NONE.wobble(new PolarMotion(0.1, 0.2), T0);
            assertArrayEquals(new double[] {0.1, -0.2}, m, 0.0);
        }

        @Test
        @DisplayName("Pole on the mean pole gives no tide")
        void onMeanPole() {
            PoleTide iers = PoleTide.iers2010();
            PolarMotion mean = MeanPole.IERS2018.at(T0);
            EarthRotation onMean = fixedPole(mean.xp() / ARCSEC, mean.yp() / ARCSEC);
            SphericalHarmonics field = iers.sphericalHarmonics(T0, rot, onMean, EPHEMERIDES);
            assertEquals(0.0, field.cnm(2, 1), 1e-24);
            assertEquals(0.0, field.snm(2, 1), 1e-24);
        }
    }
}
