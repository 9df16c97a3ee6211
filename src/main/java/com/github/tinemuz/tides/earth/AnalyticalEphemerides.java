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
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Low precision analytical positions of Sun and Moon (Montenbruck &amp; Gill,
 * Satellite Orbits, 3.3.2), referred to the mean equator and equinox of
 * J2000. Accuracy is about 0.1 % in distance and a few arc minutes in
 * direction, enough for tidal forcing at the centimetre level.
 *
 * <p>Only {@link Body#SUN} and {@link Body#MOON} are supported; the series
 * are accepted only within a configurable time span.</p>
 */
public final class AnalyticalEphemerides implements Ephemerides {
    private static final double DEG = Math.PI / 180.0;
    private static final double ARCSEC = DEG / 3600.0;
    private static final double OBLIQUITY = 23.43929111 * DEG;

    private final GpsTime start;
    private final GpsTime end;

    private AnalyticalEphemerides(GpsTime start, GpsTime end) {
        if (end.compareTo(start) <= 0) {
            throw new IllegalArgumentException("empty time span " + start + " .. " + end);
        }
        this.start = start;
        this.end = end;
    }

    /** Series restricted to 1900..2100. */
    public static AnalyticalEphemerides standard() {
        return new AnalyticalEphemerides(GpsTime.of(1900, 1, 1, 0, 0, 0), GpsTime.of(2100, 1, 1, 0, 0, 0));
    }

    public static AnalyticalEphemerides between(GpsTime start, GpsTime end) {
        return new AnalyticalEphemerides(start, end);
    }

    @Override
    public Vector3D position(GpsTime time, Body body) {
        if (time.compareTo(start) < 0 || time.compareTo(end) > 0) {
            throw new CoverageException("No ephemerides for " + body + " available", time);
        }
        double t = time.centuriesTt();
        switch (body) {
            case SUN:
                return sun(t);
            case MOON:
                return moon(t);
            case EARTH:
                return Vector3D.ZERO;
            default:
                throw new CoverageException("No ephemerides for " + body + " available", time);
        }
    }

    private static Vector3D sun(double t) {
        double m = (357.5256 + 35999.049 * t) * DEG;
        double lambda = 282.9400 * DEG + m + (6892.0 * Math.sin(m) + 72.0 * Math.sin(2 * m)) * ARCSEC;
        double r = (149.619 - 2.499 * Math.cos(m) - 0.021 * Math.cos(2 * m)) * 1e9;
        return equatorial(r, lambda, 0.0);
    }

    private static Vector3D moon(double t) {
        double l0 = (218.31617 + 481267.88088 * t) * DEG;
        double l = (134.96292 + 477198.86753 * t) * DEG;
        double lp = (357.52543 + 35999.04944 * t) * DEG;
        double f = (93.27283 + 483202.01873 * t) * DEG;
        double d = (297.85027 + 445267.11135 * t) * DEG;

        double lambda = l0 + ARCSEC * (22640 * Math.sin(l) + 769 * Math.sin(2 * l)
                - 4586 * Math.sin(l - 2 * d) + 2370 * Math.sin(2 * d)
                - 668 * Math.sin(lp) - 412 * Math.sin(2 * f)
                - 212 * Math.sin(2 * l - 2 * d) - 206 * Math.sin(l + lp - 2 * d)
                + 192 * Math.sin(l + 2 * d) - 165 * Math.sin(lp - 2 * d)
                + 148 * Math.sin(l - lp) - 125 * Math.sin(d)
                - 110 * Math.sin(l + lp) - 55 * Math.sin(2 * f - 2 * d));

        double beta = ARCSEC * (18520 * Math.sin(f + lambda - l0 + ARCSEC * (412 * Math.sin(2 * f) + 541 * Math.sin(lp)))
                - 526 * Math.sin(f - 2 * d) + 44 * Math.sin(l + f - 2 * d)
                - 31 * Math.sin(-l + f - 2 * d) - 25 * Math.sin(-2 * l + f)
                - 23 * Math.sin(lp + f - 2 * d) + 21 * Math.sin(-l + f)
                + 11 * Math.sin(-lp + f - 2 * d));

        double r = (385000.0 - 20905 * Math.cos(l) - 3699 * Math.cos(2 * d - l)
                - 2956 * Math.cos(2 * d) - 570 * Math.cos(2 * l)
                + 246 * Math.cos(2 * l - 2 * d) - 205 * Math.cos(lp - 2 * d)
                - 171 * Math.cos(l + 2 * d) - 152 * Math.cos(l + lp - 2 * d)) * 1e3;
        return equatorial(r, lambda, beta);
    }

    // ecliptic spherical coordinates to equatorial Cartesian
    private static Vector3D equatorial(double r, double lambda, double beta) {
        double x = r * Math.cos(beta) * Math.cos(lambda);
        double y = r * Math.cos(beta) * Math.sin(lambda);
        double z = r * Math.sin(beta);
        double c = Math.cos(OBLIQUITY);
        double s = Math.sin(OBLIQUITY);
        return new Vector3D(x, c * y - s * z, s * y + c * z);
    }
}
