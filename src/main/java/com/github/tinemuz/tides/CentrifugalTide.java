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

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Centrifugal potential of the current Earth rotation,
 * {@code V = ½|ω×p|² = ½(ω²|p|² - (ω·p)²)}.
 *
 * <p>The potential grows with distance and has no exterior harmonic
 * expansion; {@link #sphericalHarmonics} always fails. Deformation uses the
 * degree 2 part {@code V2 = ω²|p|²/6 - (ω·p)²/2} with the caller's h2 and l2.</p>
 */
public final class CentrifugalTide implements TideModel {

    @Override
    public TideType type() {
        return TideType.CENTRIFUGAL;
    }

    @Override
    public double potential(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        Vector3D omega = rotation.rotaryAxis(time);
        double wp = omega.dotProduct(point);
        return 0.5 * (omega.getNormSq() * point.getNormSq() - wp * wp);
    }

    @Override
    public double radialGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return gravity(time, point, rotEarth, rotation, ephemerides).dotProduct(point) / point.getNorm();
    }

    @Override
    public Vector3D gravity(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        Vector3D omega = rotation.rotaryAxis(time);
        return new Vector3D(omega.getNormSq(), point, -omega.dotProduct(point), omega);
    }

    @Override
    public RealMatrix gravityGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        Vector3D omega = rotation.rotaryAxis(time);
        double[] w = omega.toArray();
        RealMatrix t = MatrixUtils.createRealIdentityMatrix(3).scalarMultiply(omega.getNormSq());
        return t.subtract(MatrixUtils.createColumnRealMatrix(w).multiply(MatrixUtils.createRowRealMatrix(w)));
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
        love.requireDegree(2);
        Vector3D omega = rotation.rotaryAxis(time);
        double w2 = omega.getNormSq();
        double wp = omega.dotProduct(point);
        double r = point.getNorm();
        Vector3D up = point.scalarMultiply(1.0 / r);

        double v2 = w2 * r * r / 6.0 - 0.5 * wp * wp;
        Vector3D grad = new Vector3D(w2 / 3.0, point, -wp, omega);
        Vector3D horizontal = grad.subtract(grad.dotProduct(up), up);
        return new Vector3D(love.h(2) * v2 / gravity, up, love.l(2) * r / gravity, horizontal);
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
        throw new UnsupportedTideOperationException(type(), "sphericalHarmonics");
    }
}
