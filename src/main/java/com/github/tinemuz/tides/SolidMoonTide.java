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

import com.github.tinemuz.tides.earth.Body;
import com.github.tinemuz.tides.earth.EarthRotation;
import com.github.tinemuz.tides.earth.Ephemerides;
import com.github.tinemuz.tides.harmonics.CoefficientIndex;
import com.github.tinemuz.tides.harmonics.SolidHarmonics;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Solid tides raised on the Moon by the Earth and the Sun.
 *
 * <p>The expansion refers to the Moon: GM and radius of the Moon, origin at
 * the lunar centre, axes parallel to the celestial frame. Points passed to
 * the field queries use the same frame. {@code rotEarth} is ignored.</p>
 */
public final class SolidMoonTide extends HarmonicTide {
    public static final double GM = Body.MOON.gm();
    public static final double R = 1737.4e3;
    public static final double DEFAULT_K2 = 0.02405;

    private final List<Body> bodies;
    private final double k2;
    private final int maxDegree;

    public SolidMoonTide(List<Body> bodies, double k2, int maxDegree) {
        if (bodies.isEmpty()) throw new TideConfigurationException("bodies", "at least one body is required");
        if (bodies.contains(Body.MOON)) throw new TideConfigurationException("bodies", "moon cannot raise tides on itself");
        if (maxDegree < 2) throw new TideConfigurationException("maxDegree", "must be at least 2, got " + maxDegree);
        this.bodies = List.copyOf(bodies);
        this.k2 = k2;
        this.maxDegree = maxDegree;
    }

    /** Earth and Sun with the GRAIL lunar k2. */
    public static SolidMoonTide earthAndSun() {
        return new SolidMoonTide(List.of(Body.EARTH, Body.SUN), DEFAULT_K2, 2);
    }

    @Override
    public TideType type() {
        return TideType.SOLID_MOON;
    }

    @Override
    public SphericalHarmonics sphericalHarmonics(
            GpsTime time,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            int maxDegree,
            int minDegree,
            double gm,
            double r) {
        Vector3D moon = ephemerides.position(time, Body.MOON);
        double[] x = new double[CoefficientIndex.count(2)];
        for (Body body : bodies) {
            Vector3D b = ephemerides.position(time, body).subtract(moon);
            SolidHarmonics h = SolidHarmonics.of(b.scalarMultiply(1.0 / R), 2);
            double f = k2 / 5.0 * body.gm() / GM;
            x[CoefficientIndex.pack(2, 0, false)] += f * h.cnm(2, 0);
            for (int m = 1; m <= 2; m++) {
                x[CoefficientIndex.pack(2, m, false)] += f * h.cnm(2, m);
                x[CoefficientIndex.pack(2, m, true)] += f * h.snm(2, m);
            }
        }
        return SphericalHarmonics.of(GM, R, x).get(degreeOr(maxDegree, this.maxDegree), minDegree, gm, r);
    }
}
