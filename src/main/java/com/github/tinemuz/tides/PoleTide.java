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
import com.github.tinemuz.tides.earth.SimpleEarthRotation;
import com.github.tinemuz.tides.harmonics.CoefficientIndex;
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Solid Earth pole tide (IERS Conventions 2010, 6.4 and 7.1.4).
 *
 * <p>The wobble (m1, m2) relative to the mean pole perturbs the centrifugal
 * potential. The Earth responds with
 * {@code Δc21 - iΔs21 = -(Ω²R³/GM)/√15 · k2 · (m1 - i·m2)}, which for the
 * default k2 reproduces {@code Δc21 = -1.333e-9(m1 + 0.0115 m2)} with m in
 * arc seconds.</p>
 */
public final class PoleTide extends HarmonicTide {
    public static final double GM = EarthTide.GM;
    public static final double R = EarthTide.R;

    private final double k2Real;
    private final double k2Imag;
    private final double h2;
    private final double l2;
    private final MeanPole meanPole;

    public PoleTide(double k2Real, double k2Imag, double h2, double l2, MeanPole meanPole) {
        if (meanPole == null) throw new TideConfigurationException("meanPole", "mean pole model is required");
        this.k2Real = k2Real;
        this.k2Imag = k2Imag;
        this.h2 = h2;
        this.l2 = l2;
        this.meanPole = meanPole;
    }

    /** IERS 2010 values with the 2018 secular mean pole. */
    public static PoleTide iers2010() {
        return new PoleTide(0.3077, 0.0036, 0.6207, 0.0836, MeanPole.IERS2018);
    }

    @Override
    public TideType type() {
        return TideType.POLE;
    }

    public MeanPole meanPole() {
        return meanPole;
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
        double[] m = meanPole.wobble(rotation.polarMotion(time), time);
        double f = SimpleEarthRotation.OMEGA * SimpleEarthRotation.OMEGA * R * R * R / GM / Math.sqrt(15.0);
        double[] x = new double[CoefficientIndex.count(2)];
        x[CoefficientIndex.pack(2, 1, false)] = -f * (k2Real * m[0] + k2Imag * m[1]);
        x[CoefficientIndex.pack(2, 1, true)] = -f * (k2Real * m[1] - k2Imag * m[0]);
        return SphericalHarmonics.of(GM, R, x).get(maxDegree, minDegree, gm, r);
    }

    /** Direct displacement with the configured h2/l2; the caller's Love numbers are not used. */
    @Override
    public Vector3D deformation(
            GpsTime time,
            Vector3D point,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double gravity,
            LoveNumbers love) {
        double[] m = meanPole.wobble(rotation.polarMotion(time), time);
        double theta = 0.5 * Math.PI - point.getDelta();
        double lambda = point.getAlpha();
        double cosL = Math.cos(lambda);
        double sinL = Math.sin(lambda);
        double cosT = Math.cos(theta);
        double sinT = Math.sin(theta);
        double w2r2 = SimpleEarthRotation.OMEGA * SimpleEarthRotation.OMEGA * point.getNormSq();

        double sr = -h2 / gravity * 0.5 * w2r2 * Math.sin(2 * theta) * (m[0] * cosL + m[1] * sinL);
        double st = -l2 / gravity * w2r2 * Math.cos(2 * theta) * (m[0] * cosL + m[1] * sinL);
        double sl = l2 / gravity * w2r2 * cosT * (m[0] * sinL - m[1] * cosL);

        Vector3D up = new Vector3D(sinT * cosL, sinT * sinL, cosT);
        Vector3D south = new Vector3D(cosT * cosL, cosT * sinL, -sinT);
        Vector3D east = new Vector3D(-sinL, cosL, 0.0);
        return new Vector3D(sr, up, st, south, sl, east);
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
        Batches.pointwise(this, times, points, rotEarth, rotation, ephemerides, gravity, love, out);
    }
}
