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
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * One tidal effect. Implementations are configured once and immutable
 * afterwards, so a single instance may be evaluated from several threads.
 *
 * <p>All methods take the epoch, the rotation from the celestial to the
 * terrestrial frame at that epoch ({@code rotEarth}), the Earth rotation
 * model and the ephemerides. Points are given in the terrestrial frame
 * unless a model documents otherwise. Failures are thrown, never turned
 * into zero contributions.</p>
 */
public sealed interface TideModel permits HarmonicTide, CentrifugalTide {

    TideType type();

    /** Tidal potential at {@code point} (m²/s²). */
    double potential(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides);

    /** Radial derivative of the potential (m/s²). */
    double radialGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides);

    /** Gravity vector (m/s²). */
    Vector3D gravity(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides);

    /** Gravity gradient tensor (1/s²). */
    RealMatrix gravityGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides);

    /**
     * Displacement of a station.
     *
     * @param gravity local gravity at the station
     * @param love Love numbers for models that deform through their harmonic expansion
     */
    Vector3D deformation(
            GpsTime time,
            Vector3D point,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double gravity,
            LoveNumbers love);

    /**
     * Displacements of a fixed station set over a series of epochs, added
     * into {@code out} ([station][epoch]).
     */
    default void deformation(
            List<GpsTime> times,
            List<Vector3D> points,
            List<Rotation> rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double[] gravity,
            LoveNumbers love,
            DisplacementSeries out) {
        Batches.pointwise(this, times, points, rotEarth, rotation, ephemerides, gravity, love, out);
    }

    /**
     * Spherical harmonic expansion of the tidal potential.
     *
     * @param maxDegree highest degree, negative for the model default
     * @param minDegree lowest degree kept
     * @param gm GM of the result, non-positive for the model default
     * @param r reference radius of the result, non-positive for the model default
     * @throws UnsupportedTideOperationException if the model has no closed harmonic form
     */
    SphericalHarmonics sphericalHarmonics(
            GpsTime time,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            int maxDegree,
            int minDegree,
            double gm,
            double r);

    /** Expansion with the model's own degree and scale. */
    default SphericalHarmonics sphericalHarmonics(
            GpsTime time, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return sphericalHarmonics(time, rotEarth, rotation, ephemerides, -1, 0, 0.0, 0.0);
    }
}
