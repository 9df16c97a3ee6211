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

/**
 * Packing of spherical harmonic coefficients into a linear array.
 *
 * <p>Degree n occupies the slots {@code n²} to {@code (n+1)²-1}: first the
 * zonal cosine term, then cosine and sine terms for m = 1..n interleaved.
 * Sine terms of order 0 do not exist and have no slot. Shared by
 * {@link SphericalHarmonics} and {@link DeformationMatrix}.</p>
 */
public final class CoefficientIndex {
    private CoefficientIndex() {}

    /**
     * Array index of coefficient (n, m, cos/sin).
     *
     * @throws IllegalArgumentException for m &gt; n, negative values or a sine term of order 0
     */
    public static int pack(int n, int m, boolean isSine) {
        if (n < 0 || m < 0 || m > n) {
            throw new IllegalArgumentException("invalid degree/order: n=" + n + ", m=" + m);
        }
        if (m == 0) {
            if (isSine) throw new IllegalArgumentException("no sine coefficient for order 0, n=" + n);
            return n * n;
        }
        return n * n + 2 * m - (isSine ? 0 : 1);
    }

    /** Number of coefficients up to and including {@code maxDegree}. */
    public static int count(int maxDegree) {
        if (maxDegree < 0) throw new IllegalArgumentException("negative degree: " + maxDegree);
        return (maxDegree + 1) * (maxDegree + 1);
    }

    /** Degree of the coefficient stored at {@code index}. */
    public static int degree(int index) {
        if (index < 0) throw new IllegalArgumentException("negative index: " + index);
        return (int) Math.floor(Math.sqrt(index));
    }

    /** Order of the coefficient stored at {@code index}. */
    public static int order(int index) {
        int n = degree(index);
        return (index - n * n + 1) / 2;
    }

    /** Whether {@code index} holds a sine coefficient. */
    public static boolean isSine(int index) {
        int n = degree(index);
        int offset = index - n * n;
        return offset > 0 && offset % 2 == 0;
    }

    /** Degree whose coefficient count is {@code count}, or -1 if it is not a square. */
    static int maxDegreeOf(int count) {
        int root = (int) Math.round(Math.sqrt(count));
        return root * root == count ? root - 1 : -1;
    }
}
