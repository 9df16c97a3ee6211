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
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

// argument checks and the per point fallback for batched deformation
final class Batches {
    private Batches() {}

    static void check(
            List<GpsTime> times, List<Vector3D> points, List<Rotation> rotEarth, double[] gravity, DisplacementSeries out) {
        if (rotEarth.size() != times.size()) {
            throw new IllegalArgumentException(
                    "rotEarth has " + rotEarth.size() + " entries for " + times.size() + " epochs");
        }
        if (gravity.length != points.size()) {
            throw new TideConfigurationException(
                    "gravity", "expected " + points.size() + " values, got " + gravity.length);
        }
        if (out.pointCount() != points.size() || out.epochCount() != times.size()) {
            throw new IllegalArgumentException(
                    "output is " + out.pointCount() + "x" + out.epochCount()
                            + ", expected " + points.size() + "x" + times.size());
        }
    }

    static void pointwise(
            TideModel model,
            List<GpsTime> times,
            List<Vector3D> points,
            List<Rotation> rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double[] gravity,
            LoveNumbers love,
            DisplacementSeries out) {
        check(times, points, rotEarth, gravity, out);
        for (int i = 0; i < times.size(); i++) {
            for (int k = 0; k < points.size(); k++) {
                out.add(k, i, model.deformation(
                        times.get(i), points.get(k), rotEarth.get(i), rotation, ephemerides, gravity[k], love));
            }
        }
    }
}
