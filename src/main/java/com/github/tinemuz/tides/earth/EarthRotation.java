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
package com.github.tinemuz.tides.earth;

import com.github.tinemuz.tides.CoverageException;
import com.github.tinemuz.tides.time.GpsTime;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Orientation of the Earth. Implementations are called once per epoch and
 * must be cheap enough for that. Methods throw {@link CoverageException} if
 * orientation data do not cover the epoch.
 */
public interface EarthRotation {

    /** Rotation from the celestial to the terrestrial frame: {@code r_trf = R.applyTo(r_crf)}. */
    Rotation rotaryMatrix(GpsTime time);

    /** Angular velocity of the Earth in the terrestrial frame (rad/s). */
    Vector3D rotaryAxis(GpsTime time);

    PolarMotion polarMotion(GpsTime time);

    /** Greenwich mean sidereal time in radians. */
    double gmst(GpsTime time);
}
