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
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Direct tidal forcing of Sun, Moon and planets treated as point masses.
 *
 * <p>The tidal potential of a body at position b is
 * {@code V = GM_b·(1/|b-p| - 1/|b| - p·b/|b|³)}, i.e. the body's potential
 * without the constant and the part that accelerates the Earth as a whole.
 * Potential, gravity and gradient are evaluated with this closed formula;
 * the harmonic expansion (degrees 2 and up) serves the deformation queries.</p>
 */
public final class AstronomicalTide extends HarmonicTide {
    public static final double DEFAULT_GM = 3.986004415e14;
    public static final double DEFAULT_R = 6378136.3;
    public static final int DEFAULT_MAX_DEGREE = 4;

    private final List<Body> bodies;
    private final double factor;
    private final int maxDegree;

    /**
     * @param bodies disturbing bodies, the Earth itself is rejected
     * @param factor scale applied to the whole potential
     * @param maxDegree default degree of the harmonic expansion (at least 2)
     */
    public AstronomicalTide(List<Body> bodies, double factor, int maxDegree) {
        if (bodies.isEmpty()) throw new TideConfigurationException("bodies", "at least one body is required");
        if (bodies.contains(Body.EARTH)) throw new TideConfigurationException("bodies", "earth cannot raise tides on itself");
        if (maxDegree < 2) throw new TideConfigurationException("maxDegree", "must be at least 2, got " + maxDegree);
        this.bodies = List.copyOf(bodies);
        this.factor = factor;
        this.maxDegree = maxDegree;
    }

    /** Sun and Moon, unscaled. */
    public static AstronomicalTide sunAndMoon() {
        return new AstronomicalTide(List.of(Body.SUN, Body.MOON), 1.0, DEFAULT_MAX_DEGREE);
    }

    @Override
    public TideType type() {
        return TideType.ASTRONOMICAL;
    }

    public List<Body> bodies() {
        return bodies;
    }

    @Override
    public double potential(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        double v = 0.0;
        for (Body body : bodies) {
            Vector3D b = rotEarth.applyTo(ephemerides.position(time, body));
            Vector3D d = b.subtract(point);
            double rb = b.getNorm();
            double rd = d.getNorm();
            double pb = point.dotProduct(b);
            // 1/|d| - 1/|b| rearranged to avoid cancellation
            double diff = (2 * pb - point.getNormSq()) / ((rb + rd) * rb * rd);
            v += body.gm() * (diff - pb / (rb * rb * rb));
        }
        return factor * v;
    }

    @Override
    public double radialGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        return gravity(time, point, rotEarth, rotation, ephemerides).dotProduct(point.normalize());
    }

    @Override
    public Vector3D gravity(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        Vector3D g = Vector3D.ZERO;
        for (Body body : bodies) {
            Vector3D b = rotEarth.applyTo(ephemerides.position(time, body));
            Vector3D d = b.subtract(point);
            double rb = b.getNorm();
            double rd = d.getNorm();
            g = g.add(body.gm() / (rd * rd * rd), d).subtract(body.gm() / (rb * rb * rb), b);
        }
        return g.scalarMultiply(factor);
    }

    @Override
    public RealMatrix gravityGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        RealMatrix t = new Array2DRowRealMatrix(3, 3);
        for (Body body : bodies) {
            Vector3D d = rotEarth.applyTo(ephemerides.position(time, body)).subtract(point);
            double rd = d.getNorm();
            double[] dv = d.toArray();
            RealMatrix dd = MatrixUtils.createColumnRealMatrix(dv).multiply(MatrixUtils.createRowRealMatrix(dv));
            RealMatrix term = dd.scalarMultiply(3.0 / (rd * rd))
                    .subtract(MatrixUtils.createRealIdentityMatrix(3))
                    .scalarMultiply(body.gm() / (rd * rd * rd));
            t = t.add(term);
        }
        return t.scalarMultiply(factor);
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
        int degree = degreeOr(maxDegree, this.maxDegree);
        double fieldGm = positiveOr(gm, DEFAULT_GM);
        double fieldR = positiveOr(r, DEFAULT_R);
        double[] x = new double[CoefficientIndex.count(degree)];
        for (Body body : bodies) {
            Vector3D b = rotEarth.applyTo(ephemerides.position(time, body));
            SolidHarmonics h = SolidHarmonics.of(b.scalarMultiply(1.0 / fieldR), degree);
            double f = factor * body.gm() / fieldGm;
            for (int n = Math.max(2, minDegree); n <= degree; n++) {
                double fn = f / (2 * n + 1);
                x[CoefficientIndex.pack(n, 0, false)] += fn * h.cnm(n, 0);
                for (int m = 1; m <= n; m++) {
                    x[CoefficientIndex.pack(n, m, false)] += fn * h.cnm(n, m);
                    x[CoefficientIndex.pack(n, m, true)] += fn * h.snm(n, m);
                }
            }
        }
        return SphericalHarmonics.of(fieldGm, fieldR, x);
    }
}
