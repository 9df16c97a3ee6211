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
import com.github.tinemuz.tides.harmonics.CoefficientIndex;
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OceanPoleTideTest {
    private final Rotation rot = rotEarth(T0);
    private final double[] loadK = loadK(LoveNumbers.loadLoveNumbers());

    private static double[] loadK(LoveNumbers love) {
        double[] k = new double[love.maxDegree() + 1];
        for (int n = 0; n < k.length; n++) k[n] = love.k(n);
        return k;
    }

    private static SphericalHarmonics unit(int maxDegree, int n, int m) {
        double[] x = new double[CoefficientIndex.count(maxDegree)];
        x[CoefficientIndex.pack(n, m, false)] = 1.0;
        return SphericalHarmonics.of(1.0, 1.0, x);
    }

    private static SphericalHarmonics empty(int maxDegree) {
        return SphericalHarmonics.of(1.0, 1.0, new double[CoefficientIndex.count(maxDegree)]);
    }

    @Test
    @DisplayName("Unit real coefficient gives the equilibrium response of one arc second")
    void magnitude() {
        OceanPoleTide tide = new OceanPoleTide(unit(3, 2, 1), empty(3), loadK, -1, MeanPole.NONE);
        EarthRotation rotation = fixedPole(1.0, 0.0);
        SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, rotation, EPHEMERIDES);
        assertEquals(3, field.maxDegree());
        assertEquals(OceanPoleTide.GM, field.gm());
        assertEquals(8.952e-10, field.cnm(2, 1), 0.01 * 8.952e-10);
        assertEquals(0.0, field.snm(2, 1));
    }

    @Test
    @DisplayName("Imaginary coefficients respond with the out of phase combination")
    void imaginaryPart() {
        EarthRotation rotation = fixedPole(1.0, 0.0);
        double real = new OceanPoleTide(unit(2, 2, 1), empty(2), loadK, -1, MeanPole.NONE)
                .sphericalHarmonics(T0, rot, rotation, EPHEMERIDES).cnm(2, 1);
        double imag = new OceanPoleTide(empty(2), unit(2, 2, 1), loadK, -1, MeanPole.NONE)
                .sphericalHarmonics(T0, rot, rotation, EPHEMERIDES).cnm(2, 1);
        assertEquals(-0.6870 / 0.0036, real / imag, 1e-9);
    }

    @Test
    @DisplayName("Degrees scale with (1 + k'n)/(2n + 1)")
    void degreeScaling() {
        double[] x = new double[CoefficientIndex.count(3)];
        x[CoefficientIndex.pack(2, 1, false)] = 1.0;
        x[CoefficientIndex.pack(3, 1, false)] = 1.0;
        OceanPoleTide tide = new OceanPoleTide(SphericalHarmonics.of(1.0, 1.0, x), empty(3), loadK, -1, MeanPole.NONE);
        SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, fixedPole(0.2, 0.3), EPHEMERIDES);
        double expected = ((1 + loadK[3]) / 7) / ((1 + loadK[2]) / 5);
        assertEquals(expected, field.cnm(3, 1) / field.cnm(2, 1), 1e-12);
    }

    @Test
    @DisplayName("Deformation uses the caller's Love numbers")
    void deformation() {
        OceanPoleTide tide = new OceanPoleTide(unit(2, 2, 1), empty(2), loadK, -1, MeanPole.NONE);
        Vector3D p = station(45, 10, 6378137.0);
        Vector3D u = tide.deformation(T0, p, rot, fixedPole(0.3, 0.3), EPHEMERIDES, 9.81, BODY_LOVE);
        Vector3D expected = tide.sphericalHarmonics(T0, rot, fixedPole(0.3, 0.3), EPHEMERIDES)
                .deformation(p, 9.81, BODY_LOVE);
        assertArrayEquals(expected.toArray(), u.toArray(), 0.0);
        assertTrue(u.getNorm() > 0);
    }

    @Test
    @DisplayName("Load Love numbers must reach the maximum degree")
    void validation() {
        TideConfigurationException e = assertThrows(TideConfigurationException.class,
                () -> new OceanPoleTide(unit(8, 2, 1), empty(8), loadK, -1, MeanPole.NONE));
        assertEquals("kn", e.field());
        assertEquals("meanPole", assertThrows(TideConfigurationException.class,
                () -> new OceanPoleTide(unit(2, 2, 1), empty(2), loadK, -1, null)).field());
    }
}
