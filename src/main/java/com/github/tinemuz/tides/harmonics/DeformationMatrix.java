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
package com.github.tinemuz.tides.harmonics;

import com.github.tinemuz.tides.DisplacementSeries;
import com.github.tinemuz.tides.TideConfigurationException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear operator from spherical harmonic coefficients to station
 * displacements.
 *
 * <p>Rows 3k, 3k+1, 3k+2 hold the x, y, z displacement of station k; columns
 * follow {@link CoefficientIndex}. Each column is the displacement caused by
 * a unit coefficient: the potential of the basis function scaled by hn/g
 * along the local vertical plus the horizontal part of its gradient scaled
 * by ln/g. The matrix depends only on station geometry, Love numbers, GM, R
 * and degree, so it is built once and applied to the field of every epoch.
 * Instances are immutable and can be shared between threads.</p>
 */
public final class DeformationMatrix {
    private static final Logger log = LoggerFactory.getLogger(DeformationMatrix.class);

    private final RealMatrix a;
    private final int pointCount;
    private final int maxDegree;
    private final double gm;
    private final double r;

    private DeformationMatrix(RealMatrix a, int pointCount, int maxDegree, double gm, double r) {
        this.a = a;
        this.pointCount = pointCount;
        this.maxDegree = maxDegree;
        this.gm = gm;
        this.r = r;
    }

    /**
     * Build the operator for a set of stations.
     *
     * @param points station positions (terrestrial frame, metres)
     * @param gravity local gravity per station (m/s²)
     * @param love Love numbers, at least up to {@code maxDegree}
     * @param gm GM of the fields this operator will be applied to
     * @param r reference radius of those fields
     * @param maxDegree highest degree of those fields
     * @throws TideConfigurationException on size mismatches
     */
    public static DeformationMatrix build(
            List<Vector3D> points, double[] gravity, LoveNumbers love, double gm, double r, int maxDegree) {
        if (points.isEmpty()) {
            throw new TideConfigurationException("points", "at least one station is required");
        }
        if (gravity.length != points.size()) {
            throw new TideConfigurationException(
                    "gravity", "expected " + points.size() + " values, got " + gravity.length);
        }
        if (maxDegree < 0) {
            throw new TideConfigurationException("maxDegree", "must not be negative: " + maxDegree);
        }
        love.requireDegree(maxDegree);

        RealMatrix a = new Array2DRowRealMatrix(3 * points.size(), CoefficientIndex.count(maxDegree));
        for (int k = 0; k < points.size(); k++) {
            Vector3D point = points.get(k);
            Vector3D up = point.normalize();
            double g = gravity[k];
            SolidHarmonics h = SolidHarmonics.of(point.scalarMultiply(1.0 / r), maxDegree + 1);

            // order 0
            for (int n = 0; n <= maxDegree; n++) {
                double wm0 = Math.sqrt((n + 1.0) * (n + 1.0));
                double wp1 = Math.sqrt((n + 1.0) * (n + 2.0)) / Math.sqrt(2.0);
                double cm0 = wm0 * h.cnm(n + 1, 0);
                double cp1 = wp1 * h.cnm(n + 1, 1);
                double sp1 = wp1 * h.snm(n + 1, 1);

                double vn = gm / r * h.cnm(n, 0);
                Vector3D gradVn =
                        new Vector3D(-2 * cp1, -2 * sp1, -2 * cm0).scalarMultiply(gradientScale(gm, r, n));
                set(a, k, CoefficientIndex.pack(n, 0, false), displacement(up, g, love, n, vn, gradVn));
            }

            // other orders
            for (int m = 1; m <= maxDegree; m++) {
                for (int n = m; n <= maxDegree; n++) {
                    double wm1 = Math.sqrt((n - m + 1.0) * (n - m + 2.0)) * (m == 1 ? Math.sqrt(2.0) : 1.0);
                    double wm0 = Math.sqrt((n - m + 1.0) * (n + m + 1.0));
                    double wp1 = Math.sqrt((n + m + 1.0) * (n + m + 2.0));
                    double cm1 = wm1 * h.cnm(n + 1, m - 1);
                    double sm1 = wm1 * h.snm(n + 1, m - 1);
                    double cm0 = wm0 * h.cnm(n + 1, m);
                    double sm0 = wm0 * h.snm(n + 1, m);
                    double cp1 = wp1 * h.cnm(n + 1, m + 1);
                    double sp1 = wp1 * h.snm(n + 1, m + 1);
                    double scale = gradientScale(gm, r, n);

                    double vn = gm / r * h.cnm(n, m);
                    Vector3D gradVn = new Vector3D(cm1 - cp1, -sm1 - sp1, -2 * cm0).scalarMultiply(scale);
                    set(a, k, CoefficientIndex.pack(n, m, false), displacement(up, g, love, n, vn, gradVn));

                    vn = gm / r * h.snm(n, m);
                    gradVn = new Vector3D(sm1 - sp1, cm1 + cp1, -2 * sm0).scalarMultiply(scale);
                    set(a, k, CoefficientIndex.pack(n, m, true), displacement(up, g, love, n, vn, gradVn));
                }
            }
        }
        log.debug("Built deformation matrix for {} stations up to degree {}", points.size(), maxDegree);
        return new DeformationMatrix(a, points.size(), maxDegree, gm, r);
    }

    /** Displacement of every station for one field. */
    public List<Vector3D> apply(SphericalHarmonics field) {
        double[] ax = a.operate(coefficientsOf(field)).toArray();
        List<Vector3D> out = new ArrayList<>(pointCount);
        for (int k = 0; k < pointCount; k++) {
            out.add(new Vector3D(ax[3 * k], ax[3 * k + 1], ax[3 * k + 2]));
        }
        return out;
    }

    /** Add the displacement caused by {@code field} to column {@code epoch} of {@code out}. */
    public void accumulate(SphericalHarmonics field, int epoch, DisplacementSeries out) {
        if (out.pointCount() != pointCount) {
            throw new IllegalArgumentException(
                    "output has " + out.pointCount() + " stations, matrix has " + pointCount);
        }
        double[] ax = a.operate(coefficientsOf(field)).toArray();
        for (int k = 0; k < pointCount; k++) {
            out.add(k, epoch, ax[3 * k], ax[3 * k + 1], ax[3 * k + 2]);
        }
    }

    /** The raw (3K)×(maxDegree+1)² matrix. */
    public RealMatrix matrix() {
        return a.copy();
    }

    public int pointCount() {
        return pointCount;
    }

    public int maxDegree() {
        return maxDegree;
    }

    private RealVector coefficientsOf(SphericalHarmonics field) {
        return field.get(maxDegree, 0, gm, r).x();
    }

    private static double gradientScale(double gm, double r, int n) {
        return gm / (2 * r) * Math.sqrt((2.0 * n + 1.0) / (2.0 * n + 3.0));
    }

    private static Vector3D displacement(
            Vector3D up, double gravity, LoveNumbers love, int n, double vn, Vector3D gradVn) {
        Vector3D vertical = up.scalarMultiply(love.h(n) / gravity * vn);
        Vector3D horizontal = gradVn.subtract(up.scalarMultiply(gradVn.dotProduct(up)));
        return vertical.add(love.l(n) / gravity, horizontal);
    }

    private static void set(RealMatrix a, int k, int column, Vector3D disp) {
        a.setEntry(3 * k, column, disp.getX());
        a.setEntry(3 * k + 1, column, disp.getY());
        a.setEntry(3 * k + 2, column, disp.getZ());
    }
}
