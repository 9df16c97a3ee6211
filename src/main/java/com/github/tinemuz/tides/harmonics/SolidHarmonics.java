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

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Fully normalized exterior solid harmonics of a single point.
 *
 * <p>For a point x (usually a position divided by the reference radius)
 * this holds {@code C̄nm(x) = P̄nm(cos θ)·cos(mλ)/|x|^(n+1)} and the sine
 * counterpart for all 0 ≤ m ≤ n ≤ maxDegree. The recursion runs directly on
 * Cartesian coordinates, so there is no singularity at the poles.</p>
 */
public final class SolidHarmonics {
    private final int maxDegree;
    private final double[][] cnm;
    private final double[][] snm;

    private SolidHarmonics(int maxDegree, double[][] cnm, double[][] snm) {
        this.maxDegree = maxDegree;
        this.cnm = cnm;
        this.snm = snm;
    }

    /**
     * Evaluate all solid harmonics of {@code point} up to {@code maxDegree}.
     *
     * @throws IllegalArgumentException if the point is the origin or not finite
     */
    public static SolidHarmonics of(Vector3D point, int maxDegree) {
        if (maxDegree < 0) throw new IllegalArgumentException("negative degree: " + maxDegree);
        double x = point.getX();
        double y = point.getY();
        double z = point.getZ();
        double r2 = x * x + y * y + z * z;
        if (!(r2 > 0) || Double.isInfinite(r2)) {
            throw new IllegalArgumentException("solid harmonics undefined at " + point);
        }
        double invR2 = 1.0 / r2;

        double[][] c = new double[maxDegree + 1][];
        double[][] s = new double[maxDegree + 1][];
        for (int n = 0; n <= maxDegree; n++) {
            c[n] = new double[n + 1];
            s[n] = new double[n + 1];
        }
        c[0][0] = Math.sqrt(invR2);

        // sectorial terms
        for (int m = 1; m <= maxDegree; m++) {
            double f = Math.sqrt((2.0 * m + 1.0) / (2.0 * m)) * (m == 1 ? Math.sqrt(2.0) : 1.0);
            double cp = c[m - 1][m - 1];
            double sp = s[m - 1][m - 1];
            c[m][m] = f * (x * cp - y * sp) * invR2;
            s[m][m] = f * (y * cp + x * sp) * invR2;
        }

        // remaining degrees per order
        for (int m = 0; m < maxDegree; m++) {
            for (int n = m + 1; n <= maxDegree; n++) {
                double a = Math.sqrt((2.0 * n - 1.0) * (2.0 * n + 1.0) / ((n - m) * (double) (n + m)));
                double cn = a * z * c[n - 1][m];
                double sn = a * z * s[n - 1][m];
                if (n - 2 >= m) {
                    double b =
                            Math.sqrt(
                                    (2.0 * n + 1.0) * (n + m - 1.0) * (n - m - 1.0)
                                            / ((n - m) * (double) (n + m) * (2.0 * n - 3.0)));
                    cn -= b * c[n - 2][m];
                    sn -= b * s[n - 2][m];
                }
                c[n][m] = cn * invR2;
                s[n][m] = sn * invR2;
            }
        }
        return new SolidHarmonics(maxDegree, c, s);
    }

    public int maxDegree() {
        return maxDegree;
    }

    /** Cosine term of degree n and order m; zero outside the computed range. */
    public double cnm(int n, int m) {
        if (n > maxDegree || m > n || m < 0) return 0.0;
        return cnm[n][m];
    }

    /** Sine term of degree n and order m; zero outside the computed range. */
    public double snm(int n, int m) {
        if (n > maxDegree || m > n || m < 0) return 0.0;
        return snm[n][m];
    }

    /** All terms packed with {@link CoefficientIndex}. */
    public double[] packed() {
        double[] out = new double[CoefficientIndex.count(maxDegree)];
        for (int n = 0; n <= maxDegree; n++) {
            out[CoefficientIndex.pack(n, 0, false)] = cnm[n][0];
            for (int m = 1; m <= n; m++) {
                out[CoefficientIndex.pack(n, m, false)] = cnm[n][m];
                out[CoefficientIndex.pack(n, m, true)] = snm[n][m];
            }
        }
        return out;
    }
}
