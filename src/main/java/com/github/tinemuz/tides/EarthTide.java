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
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SolidHarmonics;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Solid Earth tides caused by Sun and Moon, frequency independent part
 * (IERS Conventions 2010, step 1 of 6.2 and 7.1.1).
 *
 * <p>The potential is the additional potential of the deformed Earth:
 * degree 2 and 3 scaled by the Love numbers kₙₘ (anelastic, complex for
 * degree 2) and the degree 4 contribution of the degree 2 forcing via k⁺₂ₘ.
 * Unless the permanent tide is included, its constant part is removed from
 * Δc̄20 (zero tide system).</p>
 *
 * <p>Station displacement does not use the caller's Love numbers; it follows
 * the closed formulas of the conventions with latitude dependent h2/l2 and
 * the degree 3 numbers h3/l3.</p>
 */
public final class EarthTide extends HarmonicTide {
    public static final double GM = 3.986004418e14;
    public static final double R = 6378136.6;
    private static final double PERMANENT_TIDE = 4.4228e-8 * -0.31460;

    private final double[] k2Real;
    private final double[] k2Imag;
    private final double[] k3;
    private final double[] k2Plus;
    private final double h2;
    private final double l2;
    private final double h3;
    private final double l3;
    private final boolean includePermanentTide;
    private final List<Body> bodies;

    private EarthTide(Builder b) {
        this.k2Real = b.k2Real.clone();
        this.k2Imag = b.k2Imag.clone();
        this.k3 = b.k3.clone();
        this.k2Plus = b.k2Plus.clone();
        this.h2 = b.h2;
        this.l2 = b.l2;
        this.h3 = b.h3;
        this.l3 = b.l3;
        this.includePermanentTide = b.includePermanentTide;
        this.bodies = List.copyOf(b.bodies);
    }

    /** IERS 2010 parameters in the zero tide system. */
    public static EarthTide iers2010() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TideType type() {
        return TideType.EARTH;
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
        double[] x = new double[CoefficientIndex.count(4)];
        for (Body body : bodies) {
            Vector3D b = rotEarth.applyTo(ephemerides.position(time, body));
            SolidHarmonics h = SolidHarmonics.of(b.scalarMultiply(1.0 / R), 3);
            double f = body.gm() / GM;
            for (int m = 0; m <= 2; m++) {
                double c = f * h.cnm(2, m);
                double s = f * h.snm(2, m);
                x[CoefficientIndex.pack(2, m, false)] += (k2Real[m] * c + k2Imag[m] * s) / 5.0;
                if (m > 0) x[CoefficientIndex.pack(2, m, true)] += (k2Real[m] * s - k2Imag[m] * c) / 5.0;
                x[CoefficientIndex.pack(4, m, false)] += k2Plus[m] * c / 5.0;
                if (m > 0) x[CoefficientIndex.pack(4, m, true)] += k2Plus[m] * s / 5.0;
            }
            for (int m = 0; m <= 3; m++) {
                x[CoefficientIndex.pack(3, m, false)] += k3[m] * f * h.cnm(3, m) / 7.0;
                if (m > 0) x[CoefficientIndex.pack(3, m, true)] += k3[m] * f * h.snm(3, m) / 7.0;
            }
        }
        if (!includePermanentTide) {
            x[CoefficientIndex.pack(2, 0, false)] -= PERMANENT_TIDE * k2Real[0];
        }
        return SphericalHarmonics.of(GM, R, x).get(maxDegree, minDegree, gm, r);
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
        Vector3D up = point.normalize();
        double p2 = 1.5 * up.getZ() * up.getZ() - 0.5;
        double h2Lat = h2 - 0.0006 * p2;
        double l2Lat = l2 + 0.0002 * p2;
        Vector3D disp = Vector3D.ZERO;
        for (Body body : bodies) {
            Vector3D b = rotEarth.applyTo(ephemerides.position(time, body));
            double rb = b.getNorm();
            Vector3D unit = b.scalarMultiply(1.0 / rb);
            double cosPsi = unit.dotProduct(up);
            Vector3D horizontal = unit.subtract(cosPsi, up);

            double f2 = body.gm() / GM * R * R * R * R / (rb * rb * rb);
            disp = disp.add(f2 * h2Lat * (1.5 * cosPsi * cosPsi - 0.5), up)
                    .add(f2 * 3 * l2Lat * cosPsi, horizontal);

            double f3 = f2 * R / rb;
            disp = disp.add(f3 * h3 * (2.5 * cosPsi * cosPsi * cosPsi - 1.5 * cosPsi), up)
                    .add(f3 * l3 * (7.5 * cosPsi * cosPsi - 1.5), horizontal);
        }
        return disp;
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

    /** Parameters default to the IERS 2010 anelastic values. */
    public static final class Builder {
        private double[] k2Real = {0.30190, 0.29830, 0.30102};
        private double[] k2Imag = {0.0, -0.00144, -0.00130};
        private double[] k3 = {0.093, 0.093, 0.093, 0.094};
        private double[] k2Plus = {-0.00089, -0.00080, -0.00057};
        private double h2 = 0.6078;
        private double l2 = 0.0847;
        private double h3 = 0.292;
        private double l3 = 0.015;
        private boolean includePermanentTide;
        private List<Body> bodies = List.of(Body.SUN, Body.MOON);

        private Builder() {}

        /** Degree 2 Love numbers k20, k21, k22 (real and imaginary parts). */
        public Builder k2(double[] real, double[] imag) {
            this.k2Real = requireLength("k2", real, 3);
            this.k2Imag = requireLength("k2Imag", imag, 3);
            return this;
        }

        /** Degree 3 Love numbers k30..k33. */
        public Builder k3(double[] values) {
            this.k3 = requireLength("k3", values, 4);
            return this;
        }

        /** k⁺20, k⁺21, k⁺22 mapping degree 2 forcing onto degree 4. */
        public Builder k2Plus(double[] values) {
            this.k2Plus = requireLength("k2Plus", values, 3);
            return this;
        }

        public Builder displacementLoveNumbers(double h2, double l2, double h3, double l3) {
            this.h2 = h2;
            this.l2 = l2;
            this.h3 = h3;
            this.l3 = l3;
            return this;
        }

        public Builder includePermanentTide(boolean include) {
            this.includePermanentTide = include;
            return this;
        }

        public Builder bodies(List<Body> bodies) {
            if (bodies.isEmpty() || bodies.contains(Body.EARTH)) {
                throw new TideConfigurationException("bodies", "needs disturbing bodies other than the earth");
            }
            this.bodies = bodies;
            return this;
        }

        public EarthTide build() {
            return new EarthTide(this);
        }

        private static double[] requireLength(String field, double[] values, int length) {
            if (values == null || values.length != length) {
                throw new TideConfigurationException(field, "expected " + length + " values");
            }
            return values.clone();
        }
    }
}
