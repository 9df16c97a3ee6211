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

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Station displacements over a series of epochs, indexed [station][epoch].
 *
 * <p>Batched deformation queries add into an instance instead of replacing
 * its content, so several tide contributions can be collected in one output.
 * {@link #add} is synchronized; concurrent callers may share an instance.</p>
 */
public final class DisplacementSeries {
    private final int pointCount;
    private final int epochCount;
    private final double[] values;

    public DisplacementSeries(int pointCount, int epochCount) {
        if (pointCount < 0 || epochCount < 0) {
            throw new IllegalArgumentException("negative size: " + pointCount + "x" + epochCount);
        }
        this.pointCount = pointCount;
        this.epochCount = epochCount;
        this.values = new double[3 * pointCount * epochCount];
    }

    public int pointCount() {
        return pointCount;
    }

    public int epochCount() {
        return epochCount;
    }

    public synchronized void add(int point, int epoch, double dx, double dy, double dz) {
        int i = offset(point, epoch);
        values[i] += dx;
        values[i + 1] += dy;
        values[i + 2] += dz;
    }

    public void add(int point, int epoch, Vector3D displacement) {
        add(point, epoch, displacement.getX(), displacement.getY(), displacement.getZ());
    }

    /**
     * Add every displacement of {@code other}, which must have the same shape.
     */
    public void add(DisplacementSeries other) {
        if (other.pointCount != pointCount || other.epochCount != epochCount) {
            throw new IllegalArgumentException("cannot add " + other.pointCount + "x" + other.epochCount
                    + " series to " + pointCount + "x" + epochCount);
        }
        double[] copy;
        synchronized (other) {
            copy = other.values.clone();
        }
        synchronized (this) {
            for (int i = 0; i < values.length; i++) values[i] += copy[i];
        }
    }

    public synchronized Vector3D get(int point, int epoch) {
        int i = offset(point, epoch);
        return new Vector3D(values[i], values[i + 1], values[i + 2]);
    }

    private int offset(int point, int epoch) {
        if (point < 0 || point >= pointCount || epoch < 0 || epoch >= epochCount) {
            throw new IndexOutOfBoundsException(
                    "station " + point + ", epoch " + epoch + " outside " + pointCount + "x" + epochCount);
        }
        return 3 * (point * epochCount + epoch);
    }
}
