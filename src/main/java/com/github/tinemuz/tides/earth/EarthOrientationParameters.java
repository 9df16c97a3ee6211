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
import com.github.tinemuz.tides.TideConfigurationException;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory time series of Earth orientation parameters (pole coordinates,
 * UT1-UTC, length of day), linearly interpolated.
 *
 * <p>UT1-UTC is stored as UT1-GPS internally so interpolation does not jump
 * at leap seconds.</p>
 */
public final class EarthOrientationParameters {
    private static final double ARCSEC = Math.PI / (180.0 * 3600.0);

    private final double[] mjdGps;
    private final double[] xp;
    private final double[] yp;
    private final double[] ut1MinusGps;
    private final double[] lod;

    private EarthOrientationParameters(List<double[]> rows) {
        int size = rows.size();
        mjdGps = new double[size];
        xp = new double[size];
        yp = new double[size];
        ut1MinusGps = new double[size];
        lod = new double[size];
        for (int i = 0; i < size; i++) {
            double[] row = rows.get(i);
            mjdGps[i] = row[0];
            xp[i] = row[1];
            yp[i] = row[2];
            ut1MinusGps[i] = row[3];
            lod[i] = row[4];
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Interpolated values at {@code time}. */
    public Entry at(GpsTime time) {
        double t = time.mjd();
        if (t < mjdGps[0] || t > mjdGps[mjdGps.length - 1]) {
            throw new CoverageException("No EOPs available", time);
        }
        int hi = upperBound(mjdGps, t);
        int lo = Math.max(hi - 1, 0);
        double w = hi == lo ? 0.0 : (t - mjdGps[lo]) / (mjdGps[hi] - mjdGps[lo]);
        return new Entry(
                lerp(xp, lo, hi, w), lerp(yp, lo, hi, w), lerp(ut1MinusGps, lo, hi, w), lerp(lod, lo, hi, w));
    }

    public GpsTime start() {
        return GpsTime.ofMjd(mjdGps[0]);
    }

    public GpsTime end() {
        return GpsTime.ofMjd(mjdGps[mjdGps.length - 1]);
    }

    private static double lerp(double[] v, int lo, int hi, double w) {
        return v[lo] + w * (v[hi] - v[lo]);
    }

    /** First index with arr[index] >= x. */
    private static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    /**
     * Interpolated orientation values.
     *
     * @param xp pole x in radians
     * @param yp pole y in radians
     * @param ut1MinusGps UT1-GPS in seconds
     * @param lod excess length of day in seconds
     */
    public record Entry(double xp, double yp, double ut1MinusGps, double lod) {
        public static final Entry ZERO = new Entry(0, 0, 0, 0);
    }

    /** Collects daily (or finer) rows in increasing time order. */
    public static final class Builder {
        private final List<double[]> rows = new ArrayList<>();

        private Builder() {}

        /**
         * @param mjdUtc epoch as UTC modified Julian date
         * @param xpArcsec pole x in arcseconds
         * @param ypArcsec pole y in arcseconds
         * @param ut1MinusUtc UT1-UTC in seconds
         * @param lod excess length of day in seconds
         */
        public Builder add(double mjdUtc, double xpArcsec, double ypArcsec, double ut1MinusUtc, double lod) {
            int leap = GpsTime.gpsMinusUtc(mjdUtc);
            double gps = mjdUtc + leap / GpsTime.SECONDS_PER_DAY;
            if (!rows.isEmpty() && gps <= rows.get(rows.size() - 1)[0]) {
                throw new TideConfigurationException("eop", "epochs must increase, got MJD " + mjdUtc);
            }
            rows.add(new double[] {gps, xpArcsec * ARCSEC, ypArcsec * ARCSEC, ut1MinusUtc - leap, lod});
            return this;
        }

        public EarthOrientationParameters build() {
            if (rows.size() < 2) {
                throw new TideConfigurationException("eop", "at least two epochs are required");
            }
            return new EarthOrientationParameters(rows);
        }
    }
}
