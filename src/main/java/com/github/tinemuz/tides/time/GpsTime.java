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
package com.github.tinemuz.tides.time;

import java.util.Locale;

/**
 * An epoch in GPS time, stored as a modified Julian date.
 *
 * <p>Conversions to UTC use the built-in leap second table (GPS-UTC offsets
 * since the GPS epoch 1980-01-06), conversions to TT use the fixed offset
 * TT = GPS + 51.184 s.</p>
 *
 * @param mjd modified Julian date in the GPS time scale
 */
public record GpsTime(double mjd) implements Comparable<GpsTime> {
    public static final double SECONDS_PER_DAY = 86400.0;
    /** MJD of the Julian epoch J2000.0 (2000-01-01 12:00). */
    public static final double MJD_J2000 = 51544.5;
    private static final double TT_MINUS_GPS = 51.184;

    // first MJD (UTC) with the given GPS-UTC offset in seconds
    private static final int[] LEAP_MJD = {
        44786, 45151, 45516, 46247, 47161, 47892, 48257, 48804, 49169,
        49534, 50083, 50630, 51179, 53736, 54832, 56109, 57204, 57754
    };

    public GpsTime {
        if (!Double.isFinite(mjd)) {
            throw new IllegalArgumentException("mjd must be finite: " + mjd);
        }
    }

    /** Epoch from a GPS calendar date and time of day. */
    public static GpsTime of(int year, int month, int day, int hour, int minute, double second) {
        return new GpsTime(
                mjdOfDate(year, month, day)
                        + (hour * 3600.0 + minute * 60.0 + second) / SECONDS_PER_DAY);
    }

    /** Epoch from a UTC calendar date and time of day. */
    public static GpsTime ofUtc(int year, int month, int day, int hour, int minute, double second) {
        double mjdUtc =
                mjdOfDate(year, month, day)
                        + (hour * 3600.0 + minute * 60.0 + second) / SECONDS_PER_DAY;
        return new GpsTime(mjdUtc + gpsMinusUtc(mjdUtc) / SECONDS_PER_DAY);
    }

    public static GpsTime ofMjd(double mjd) {
        return new GpsTime(mjd);
    }

    public GpsTime plusSeconds(double seconds) {
        return new GpsTime(mjd + seconds / SECONDS_PER_DAY);
    }

    /** Seconds from {@code other} to this epoch. */
    public double secondsSince(GpsTime other) {
        return (mjd - other.mjd) * SECONDS_PER_DAY;
    }

    /** GPS-UTC in seconds at this epoch. */
    public int leapSeconds() {
        return gpsMinusUtc(mjdUtc());
    }

    public double mjdUtc() {
        double approx = mjd - gpsMinusUtc(mjd) / SECONDS_PER_DAY;
        return mjd - gpsMinusUtc(approx) / SECONDS_PER_DAY;
    }

    public double mjdTt() {
        return mjd + TT_MINUS_GPS / SECONDS_PER_DAY;
    }

    /** Julian centuries of TT since J2000.0. */
    public double centuriesTt() {
        return (mjdTt() - MJD_J2000) / 36525.0;
    }

    /** Decimal year (TT), used by secular models such as the mean pole. */
    public double decimalYear() {
        return 2000.0 + (mjdTt() - MJD_J2000) / 365.25;
    }

    @Override
    public int compareTo(GpsTime o) {
        return Double.compare(mjd, o.mjd);
    }

    @Override
    public String toString() {
        long day = (long) Math.floor(mjd);
        double secOfDay = (mjd - day) * SECONDS_PER_DAY;
        // Fliegel-Van Flandern, JD = MJD + 2400001 at noon
        long l = day + 2400001L + 68569L;
        long n = 4 * l / 146097;
        l = l - (146097 * n + 3) / 4;
        long i = 4000 * (l + 1) / 1461001;
        l = l - 1461 * i / 4 + 31;
        long j = 80 * l / 2447;
        long d = l - 2447 * j / 80;
        l = j / 11;
        long m = j + 2 - 12 * l;
        long y = 100 * (n - 49) + i + l;
        int h = (int) (secOfDay / 3600.0);
        int min = (int) ((secOfDay - h * 3600.0) / 60.0);
        double s = secOfDay - h * 3600.0 - min * 60.0;
        return String.format(Locale.ROOT, "%04d-%02d-%02d %02d:%02d:%06.3f GPS", y, m, d, h, min, s);
    }

    /** GPS-UTC in seconds at a UTC modified Julian date. */
    public static int gpsMinusUtc(double mjdUtc) {
        int offset = 0;
        for (int leapMjd : LEAP_MJD) {
            if (mjdUtc >= leapMjd) offset++;
            else break;
        }
        return offset;
    }

    static long mjdOfDate(int year, int month, int day) {
        long a = (14 - month) / 12;
        long y = year + 4800L - a;
        long m = month + 12L * a - 3;
        long jdn = day + (153 * m + 2) / 5 + 365 * y + y / 4 - y / 100 + y / 400 - 32045;
        return jdn - 2400001L;
    }
}
