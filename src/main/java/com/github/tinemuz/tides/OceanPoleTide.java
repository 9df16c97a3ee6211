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
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;

/**
 * Ocean pole tide after Desai (IERS Conventions 2010, 6.5).
 *
 * <p>The self-consistent equilibrium response of the oceans to the pole
 * wobble is given by two coefficient sets, A (real part, in
 * {@code cnm}/{@code snm} of {@code real}) and B (imaginary part, in
 * {@code imag}). Per degree n the change of the potential is</p>
 * <pre>
 * [Δc; Δs] = Rn·{[A^R; B^R](m1·γR + m2·γI) + [A^I; B^I](m2·γR - m1·γI)}
 * Rn = (Ω²a⁴/GM)(4πGρw/ge)((1 + k'n)/(2n + 1))
 * </pre>
 * <p>with the load Love numbers k'n.</p>
 */
public final class OceanPoleTide extends HarmonicTide {
    public static final double GM = EarthTide.GM;
    public static final double R = EarthTide.R;
    private static final double GAMMA_REAL = 0.6870;
    private static final double GAMMA_IMAG = 0.0036;
    private static final double GRAVITATIONAL_CONSTANT = 6.67428e-11;
    private static final double RHO_WATER = 1025.0;
    private static final double G_EQUATOR = 9.7803278;

    private final SphericalHarmonics real;
    private final SphericalHarmonics imag;
    private final double[] loadK;
    private final int maxDegree;
    private final MeanPole meanPole;

    /**
     * @param real real part of the response coefficients
     * @param imag imaginary part of the response coefficients
     * @param loadK load Love numbers k'n indexed by degree
     * @param maxDegree highest degree used, negative for the table degree
     */
    public OceanPoleTide(
            SphericalHarmonics real, SphericalHarmonics imag, double[] loadK, int maxDegree, MeanPole meanPole) {
        if (real == null || imag == null) {
            throw new TideConfigurationException("coefficients", "real and imaginary coefficients are required");
        }
        if (meanPole == null) throw new TideConfigurationException("meanPole", "mean pole model is required");
        this.maxDegree = maxDegree < 0 ? Math.max(real.maxDegree(), imag.maxDegree()) : maxDegree;
        if (loadK == null || loadK.length < this.maxDegree + 1) {
            throw new TideConfigurationException(
                    "kn", "load Love numbers up to degree " + this.maxDegree + " required");
        }
        this.real = real;
        this.imag = imag;
        this.loadK = loadK.clone();
        this.meanPole = meanPole;
    }

    @Override
    public TideType type() {
        return TideType.OCEAN_POLE;
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
        double wReal = m[0] * GAMMA_REAL + m[1] * GAMMA_IMAG;
        double wImag = m[1] * GAMMA_REAL - m[0] * GAMMA_IMAG;
        double omega2 = SimpleEarthRotation.OMEGA * SimpleEarthRotation.OMEGA;
        double common = omega2 * R * R * R * R / GM
                * 4 * Math.PI * GRAVITATIONAL_CONSTANT * RHO_WATER / G_EQUATOR;

        double[] a = real.coefficients();
        double[] b = imag.coefficients();
        double[] x = new double[CoefficientIndex.count(this.maxDegree)];
        for (int i = 0; i < x.length; i++) {
            int n = CoefficientIndex.degree(i);
            double rn = common * (1 + loadK[n]) / (2 * n + 1);
            double ar = i < a.length ? a[i] : 0.0;
            double ai = i < b.length ? b[i] : 0.0;
            x[i] = rn * (ar * wReal + ai * wImag);
        }
        return SphericalHarmonics.of(GM, R, x).get(maxDegree, minDegree, gm, r);
    }
}
