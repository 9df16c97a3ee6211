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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SolidMoonTideTest {
    private final SolidMoonTide tide = SolidMoonTide.earthAndSun();
    private final Rotation rot = rotEarth(T0);

    @Test
    @DisplayName("Induced potential on the lunar surface is k2 times the degree 2 forcing")
    void surfacePotential() {
        SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES);
        assertEquals(SolidMoonTide.GM, field.gm());
        assertEquals(SolidMoonTide.R, field.r());
        assertEquals(2, field.maxDegree());

        Vector3D moon = EPHEMERIDES.position(T0, Body.MOON);
        for (Vector3D dir : List.of(Vector3D.PLUS_I, Vector3D.MINUS_J, new Vector3D(1, 1, 1).normalize())) {
            Vector3D p = dir.scalarMultiply(SolidMoonTide.R);
            double expected = 0.0;
            for (Body body : List.of(Body.EARTH, Body.SUN)) {
                Vector3D d = EPHEMERIDES.position(T0, body).subtract(moon);
                double r = d.getNorm();
                double cosPsi = d.dotProduct(dir) / r;
                expected += SolidMoonTide.DEFAULT_K2 * body.gm() * SolidMoonTide.R * SolidMoonTide.R
                        / (r * r * r) * (1.5 * cosPsi * cosPsi - 0.5);
            }
            assertEquals(expected, field.potential(p), 1e-10 * Math.abs(expected) + 1e-12);
        }
    }

    @Test
    @DisplayName("Earth dominates the tide on the Moon")
    void earthDominates() {
        SphericalHarmonics both = tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES);
        SphericalHarmonics earth = new SolidMoonTide(List.of(Body.EARTH), SolidMoonTide.DEFAULT_K2, 2)
                .sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES);
        assertEquals(both.cnm(2, 0), earth.cnm(2, 0), 0.03 * Math.abs(both.cnm(2, 0)));
    }

    @Test
    @DisplayName("Requested degree pads the expansion")
    void padding() {
        SphericalHarmonics field = tide.sphericalHarmonics(T0, rot, ROTATION, EPHEMERIDES, 4, 0, 0.0, 0.0);
        assertEquals(4, field.maxDegree());
        assertEquals(0.0, field.cnm(4, 2));
    }

    @Test
    @DisplayName("The Moon cannot raise tides on itself")
    void validation() {
        assertEquals("bodies", assertThrows(TideConfigurationException.class,
                () -> new SolidMoonTide(List.of(Body.MOON), 0.024, 2)).field());
        assertEquals("maxDegree", assertThrows(TideConfigurationException.class,
                () -> new SolidMoonTide(List.of(Body.EARTH), 0.024, 1)).field());
    }
}
