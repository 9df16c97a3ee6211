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

import com.github.tinemuz.tides.TideConfigurationException;
import java.util.List;
import java.util.Locale;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Immutable spherical harmonic expansion of a gravitational potential.
 *
 * <p>The potential at a point p is
 * {@code V(p) = GM/R · Σ cnm·C̄nm(p/R) + snm·S̄nm(p/R)} with fully
 * normalized exterior solid harmonics (see {@link SolidHarmonics}).
 * Coefficients are stored packed as described in {@link CoefficientIndex}.</p>
 *
 * <p>Every operation returns a new instance, so values can be shared freely
 * between threads.</p>
 */
public final class SphericalHarmonics {
    private static final SphericalHarmonics ZERO = new SphericalHarmonics(1.0, 1.0, 0, new double[1]);

    private final double gm;
    private final double r;
    private final int maxDegree;
    private final double[] x;

    private SphericalHarmonics(double gm, double r, int maxDegree, double[] x) {
        this.gm = gm;
        this.r = r;
        this.maxDegree = maxDegree;
        this.x = x;
    }

    /** Empty field: degree 0, GM = R = 1, all coefficients zero. */
    public static SphericalHarmonics zero() {
        return ZERO;
    }

    /**
     * Field from packed coefficients.
     *
     * @throws TideConfigurationException if the coefficient count is not (maxDegree+1)²
     *     or GM/R are not positive
     */
    public static SphericalHarmonics of(double gm, double r, double[] packed) {
        requireScale(gm, r);
        int maxDegree = CoefficientIndex.maxDegreeOf(packed.length);
        if (maxDegree < 0) {
            throw new TideConfigurationException(
                    "coefficients", "count " + packed.length + " is not (maxDegree+1)^2");
        }
        return new SphericalHarmonics(gm, r, maxDegree, packed.clone());
    }

    /**
     * Field from triangular coefficient arrays {@code cnm[n][m]}, {@code snm[n][m]}.
     *
     * @throws TideConfigurationException if the arrays are not triangular of equal size
     */
    public static SphericalHarmonics of(double gm, double r, double[][] cnm, double[][] snm) {
        requireScale(gm, r);
        if (cnm.length == 0 || cnm.length != snm.length) {
            throw new TideConfigurationException("coefficients", "cnm and snm must have the same degree");
        }
        int maxDegree = cnm.length - 1;
        double[] x = new double[CoefficientIndex.count(maxDegree)];
        for (int n = 0; n <= maxDegree; n++) {
            if (cnm[n].length < n + 1 || snm[n].length < n + 1) {
                throw new TideConfigurationException("coefficients", "degree " + n + " needs " + (n + 1) + " orders");
            }
            x[CoefficientIndex.pack(n, 0, false)] = cnm[n][0];
            for (int m = 1; m <= n; m++) {
                x[CoefficientIndex.pack(n, m, false)] = cnm[n][m];
                x[CoefficientIndex.pack(n, m, true)] = snm[n][m];
            }
        }
        return new SphericalHarmonics(gm, r, maxDegree, x);
    }

    public double gm() {
        return gm;
    }

    public double r() {
        return r;
    }

    public int maxDegree() {
        return maxDegree;
    }

    /** Copy of the packed coefficients. */
    public double[] coefficients() {
        return x.clone();
    }

    /** Copy of the packed coefficients as a vector, ready to multiply with a {@link DeformationMatrix}. */
    public RealVector x() {
        return new ArrayRealVector(x);
    }

    public double cnm(int n, int m) {
        return n <= maxDegree ? x[CoefficientIndex.pack(n, m, false)] : 0.0;
    }

    public double snm(int n, int m) {
        return (n <= maxDegree && m > 0) ? x[CoefficientIndex.pack(n, m, true)] : 0.0;
    }

    public boolean isZero() {
        for (double v : x) {
            if (v != 0.0) return false;
        }
        return true;
    }

    /**
     * Coefficient-wise sum. The other field is first rescaled to this GM/R;
     * a zero field adopts the GM/R of the other operand.
     */
    public SphericalHarmonics add(SphericalHarmonics other) {
        double baseGm = isZero() ? other.gm : gm;
        double baseR = isZero() ? other.r : r;
        SphericalHarmonics a = convert(baseGm, baseR);
        SphericalHarmonics b = other.convert(baseGm, baseR);
        int degree = Math.max(a.maxDegree, b.maxDegree);
        double[] sum = new double[CoefficientIndex.count(degree)];
        for (int i = 0; i < a.x.length; i++) sum[i] += a.x[i];
        for (int i = 0; i < b.x.length; i++) sum[i] += b.x[i];
        return new SphericalHarmonics(baseGm, baseR, degree, sum);
    }

    public SphericalHarmonics scale(double factor) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = factor * x[i];
        return new SphericalHarmonics(gm, r, maxDegree, out);
    }

    /** Same field expressed with another GM and reference radius. */
    public SphericalHarmonics convert(double newGm, double newR) {
        requireScale(newGm, newR);
        if (newGm == gm && newR == r) return this;
        double[] out = new double[x.length];
        double factor = gm / newGm;
        double ratio = r / newR;
        for (int n = 0; n <= maxDegree; n++) {
            for (int i = n * n; i < (n + 1) * (n + 1); i++) out[i] = factor * x[i];
            factor *= ratio;
        }
        return new SphericalHarmonics(newGm, newR, maxDegree, out);
    }

    /** Keep degrees minDegree..maxDegree; missing degrees are zero. */
    public SphericalHarmonics truncate(int newMaxDegree, int minDegree) {
        if (newMaxDegree < 0) throw new IllegalArgumentException("negative degree: " + newMaxDegree);
        double[] out = new double[CoefficientIndex.count(newMaxDegree)];
        int upper = Math.min(newMaxDegree, maxDegree);
        for (int n = Math.max(minDegree, 0); n <= upper; n++) {
            System.arraycopy(x, n * n, out, n * n, 2 * n + 1);
        }
        return new SphericalHarmonics(gm, r, newMaxDegree, out);
    }

    /**
     * Convert and truncate in one step. A negative {@code newMaxDegree} keeps
     * the own degree, non-positive GM or R keep the own scale.
     */
    public SphericalHarmonics get(int newMaxDegree, int minDegree, double newGm, double newR) {
        SphericalHarmonics out = convert(newGm > 0 ? newGm : gm, newR > 0 ? newR : r);
        if (newMaxDegree < 0 && minDegree <= 0) return out;
        return out.truncate(newMaxDegree < 0 ? maxDegree : newMaxDegree, minDegree);
    }

    /** Potential at p in m²/s². */
    public double potential(Vector3D p) {
        return gm / r * evaluate(x, maxDegree, p.scalarMultiply(1.0 / r));
    }

    /** Gravity vector ∇V at p. */
    public Vector3D gravity(Vector3D p) {
        Vector3D q = p.scalarMultiply(1.0 / r);
        double[][] d = derivative(x, maxDegree);
        double[] basis = SolidHarmonics.of(q, maxDegree + 1).packed();
        double f = gm / (r * r);
        return new Vector3D(f * dot(d[0], basis), f * dot(d[1], basis), f * dot(d[2], basis));
    }

    /** Radial derivative ∂V/∂r at p. */
    public double radialGradient(Vector3D p) {
        return gravity(p).dotProduct(p.normalize());
    }

    /** Gravity gradient tensor ∇∇V at p. */
    public RealMatrix gravityGradient(Vector3D p) {
        Vector3D q = p.scalarMultiply(1.0 / r);
        double[][] d = derivative(x, maxDegree);
        double[] basis = SolidHarmonics.of(q, maxDegree + 2).packed();
        double f = gm / (r * r * r);
        double[][] t = new double[3][3];
        for (int i = 0; i < 3; i++) {
            double[][] dd = derivative(d[i], maxDegree + 1);
            for (int j = 0; j < 3; j++) t[i][j] = f * dot(dd[j], basis);
        }
        return new Array2DRowRealMatrix(t, false);
    }

    /**
     * Displacement of a station at p caused by this potential, via Love numbers.
     *
     * @param gravity local gravity at the station (m/s²)
     * @param love load or body tide Love numbers, at least up to maxDegree
     */
    public Vector3D deformation(Vector3D p, double gravity, LoveNumbers love) {
        return DeformationMatrix.build(List.of(p), new double[] {gravity}, love, gm, r, maxDegree)
                .apply(this)
                .get(0);
    }

    static double evaluate(double[] coefficients, int degree, Vector3D q) {
        return dot(coefficients, SolidHarmonics.of(q, degree).packed());
    }

    /**
     * Partial derivatives (x, y, z) of the field with packed coefficients
     * {@code c}, as packed coefficients of degree+1. Derivatives are taken
     * with respect to p/R.
     */
    static double[][] derivative(double[] c, int degree) {
        int count = CoefficientIndex.count(degree + 1);
        double[] dx = new double[count];
        double[] dy = new double[count];
        double[] dz = new double[count];
        for (int n = 0; n <= degree; n++) {
            double k = 0.5 * Math.sqrt((2.0 * n + 1.0) / (2.0 * n + 3.0));
            double c0 = c[CoefficientIndex.pack(n, 0, false)];
            if (c0 != 0.0) {
                double wp1 = Math.sqrt((n + 1.0) * (n + 2.0) / 2.0);
                double wm0 = n + 1.0;
                dx[CoefficientIndex.pack(n + 1, 1, false)] -= 2 * k * wp1 * c0;
                dy[CoefficientIndex.pack(n + 1, 1, true)] -= 2 * k * wp1 * c0;
                dz[CoefficientIndex.pack(n + 1, 0, false)] -= 2 * k * wm0 * c0;
            }
            for (int m = 1; m <= n; m++) {
                double cc = c[CoefficientIndex.pack(n, m, false)];
                double ss = c[CoefficientIndex.pack(n, m, true)];
                if (cc == 0.0 && ss == 0.0) continue;
                double wm1 = Math.sqrt((n - m + 1.0) * (n - m + 2.0)) * (m == 1 ? Math.sqrt(2.0) : 1.0);
                double wm0 = Math.sqrt((n - m + 1.0) * (n + m + 1.0));
                double wp1 = Math.sqrt((n + m + 1.0) * (n + m + 2.0));
                int cm1 = CoefficientIndex.pack(n + 1, m - 1, false);
                int cm0 = CoefficientIndex.pack(n + 1, m, false);
                int sm0 = CoefficientIndex.pack(n + 1, m, true);
                int cp1 = CoefficientIndex.pack(n + 1, m + 1, false);
                int sp1 = CoefficientIndex.pack(n + 1, m + 1, true);
                // cosine term
                dx[cm1] += k * wm1 * cc;
                dx[cp1] -= k * wp1 * cc;
                if (m > 1) dy[CoefficientIndex.pack(n + 1, m - 1, true)] -= k * wm1 * cc;
                dy[sp1] -= k * wp1 * cc;
                dz[cm0] -= 2 * k * wm0 * cc;
                // sine term
                if (m > 1) dx[CoefficientIndex.pack(n + 1, m - 1, true)] += k * wm1 * ss;
                dx[sp1] -= k * wp1 * ss;
                dy[cm1] += k * wm1 * ss;
                dy[cp1] += k * wp1 * ss;
                dz[sm0] -= 2 * k * wm0 * ss;
            }
        }
        return new double[][] {dx, dy, dz};
    }

    private static double dot(double[] a, double[] b) {
        int len = Math.min(a.length, b.length);
        double sum = 0.0;
        for (int i = 0; i < len; i++) sum += a[i] * b[i];
        return sum;
    }

    private static void requireScale(double gm, double r) {
        if (!(gm > 0) || !Double.isFinite(gm)) throw new TideConfigurationException("GM", "must be positive: " + gm);
        if (!(r > 0) || !Double.isFinite(r)) throw new TideConfigurationException("R", "must be positive: " + r);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SphericalHarmonics{maxDegree=%d, GM=%.6e, R=%.3f}", maxDegree, gm, r);
    }
}
