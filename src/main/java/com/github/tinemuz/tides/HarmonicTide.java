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

import com.github.tinemuz.tides.earth.EarthRotation;
import com.github.tinemuz.tides.earth.Ephemerides;
import com.github.tinemuz.tides.harmonics.DeformationMatrix;
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Base of all tides that can express themselves as a spherical harmonic
 * expansion. Every field quantity is evaluated from
 * {@link #sphericalHarmonics(GpsTime, Rotation, EarthRotation, Ephemerides)};
 * subclasses override single operations where a direct formula exists.
 *
 * <p>Batched deformation builds one {@link DeformationMatrix} from the
 * first epoch's expansion and applies it to the expansion of every epoch.</p>
 */
public abstract sealed class HarmonicTide implements TideModel
        permits AstronomicalTide, EarthTide, DoodsonHarmonicTide, PoleTide, OceanPoleTide, SolidMoonTide {

    @Override
    public double potential(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return sphericalHarmonics(time, rotEarth, rotation, ephemerides).potential(point);
    }

    @Override
    public double radialGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return sphericalHarmonics(time, rotEarth, rotation, ephemerides).radialGradient(point);
    }

    @Override
    public Vector3D gravity(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return sphericalHarmonics(time, rotEarth, rotation, ephemerides).gravity(point);
    }

    @Override
    public RealMatrix gravityGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return sphericalHarmonics(time, rotEarth, rotation, ephemerides).gravityGradient(point);
    }

    @Override
    public Vector3D deformation(
            GpsTime time,
            Vector3D point,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double gravity,
            LoveNumbers love) {
        return sphericalHarmonics(time, rotEarth, rotation, ephemerides).deformation(point, gravity, love);
    }

    @Override
    public void deformation(
            List<GpsTime> times,
            List<Vector3D> points,
            List<Rotation> rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double[] gravity,
            LoveNumbers love,
            DisplacementSeries out) {
        Batches.check(times, points, rotEarth, gravity, out);
        if (times.isEmpty() || points.isEmpty()) return;

        SphericalHarmonics first = sphericalHarmonics(times.get(0), rotEarth.get(0), rotation, ephemerides);
        DeformationMatrix a =
                DeformationMatrix.build(points, gravity, love, first.gm(), first.r(), first.maxDegree());
        a.accumulate(first, 0, out);
        for (int i = 1; i < times.size(); i++) {
            a.accumulate(sphericalHarmonics(times.get(i), rotEarth.get(i), rotation, ephemerides), i, out);
        }
    }

    /** Resolve a requested degree, falling back to the model default for negative values. */
    static int degreeOr(int requested, int fallback) {
        return requested < 0 ? fallback : requested;
    }

    static double positiveOr(double requested, double fallback) {
        return requested > 0 ? requested : fallback;
    }
}
