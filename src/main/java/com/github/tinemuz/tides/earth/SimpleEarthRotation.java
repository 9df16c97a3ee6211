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

import com.github.tinemuz.tides.time.GpsTime;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathUtils;

/**
 * Earth rotation from the Earth rotation angle and polar motion.
 *
 * <p>Precession and nutation are neglected, so the celestial frame is the
 * intermediate frame of date. Orientation parameters come from an optional
 * {@link EarthOrientationParameters} series; without one, pole coordinates,
 * UT1-UTC and LOD are zero and every epoch is covered.</p>
 */
public final class SimpleEarthRotation implements EarthRotation {
    /** Nominal angular velocity of the Earth (rad/s). */
    public static final double OMEGA = 7.292115146706979e-5;
    private static final double ARCSEC = Math.PI / (180.0 * 3600.0);

    private final EarthOrientationParameters eop;

    private SimpleEarthRotation(EarthOrientationParameters eop) {
        this.eop = eop;
    }

    public static SimpleEarthRotation withoutEop() {
        return new SimpleEarthRotation(null);
    }

    public static SimpleEarthRotation of(EarthOrientationParameters eop) {
        return new SimpleEarthRotation(eop);
    }

    @Override
    public Rotation rotaryMatrix(GpsTime time) {
        EarthOrientationParameters.Entry e = entry(time);
        Rotation spin = new Rotation(Vector3D.PLUS_K, era(time, e), RotationConvention.FRAME_TRANSFORM);
        Rotation wobbleX = new Rotation(Vector3D.PLUS_J, -e.xp(), RotationConvention.FRAME_TRANSFORM);
        Rotation wobbleY = new Rotation(Vector3D.PLUS_I, -e.yp(), RotationConvention.FRAME_TRANSFORM);
        return wobbleY.compose(wobbleX.compose(spin, RotationConvention.VECTOR_OPERATOR),
                RotationConvention.VECTOR_OPERATOR);
    }

    @Override
    public Vector3D rotaryAxis(GpsTime time) {
        EarthOrientationParameters.Entry e = entry(time);
        double rate = OMEGA * (1.0 - e.lod() / GpsTime.SECONDS_PER_DAY);
        return new Vector3D(e.xp(), -e.yp(), 1.0).normalize().scalarMultiply(rate);
    }

    @Override
    public PolarMotion polarMotion(GpsTime time) {
        EarthOrientationParameters.Entry e = entry(time);
        return new PolarMotion(e.xp(), e.yp());
    }

    @Override
    public double gmst(GpsTime time) {
        double t = time.centuriesTt();
        double poly = 0.014506 + t * (4612.156534 + t * (1.3915817 + t * (-0.00000044 + t * -0.000029956)));
        return MathUtils.normalizeAngle(era(time, entry(time)) + poly * ARCSEC, FastMath.PI);
    }

    /** Earth rotation angle in radians, in [0, 2π). */
    public double era(GpsTime time) {
        return era(time, entry(time));
    }

    private static double era(GpsTime time, EarthOrientationParameters.Entry e) {
        double du = time.mjd() + e.ut1MinusGps() / GpsTime.SECONDS_PER_DAY - GpsTime.MJD_J2000;
        double turns = 0.7790572732640 + 0.00273781191135448 * du + (du - Math.floor(du));
        return MathUtils.normalizeAngle(2 * Math.PI * turns, FastMath.PI);
    }

    private EarthOrientationParameters.Entry entry(GpsTime time) {
        return eop == null ? EarthOrientationParameters.Entry.ZERO : eop.at(time);
    }
}
