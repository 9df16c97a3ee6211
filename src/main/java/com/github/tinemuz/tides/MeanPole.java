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

import com.github.tinemuz.tides.earth.PolarMotion;
import com.github.tinemuz.tides.time.GpsTime;

/** Models of the secular mean pole, subtracted from the pole coordinates for pole tides. */
public enum MeanPole {
    /** No mean pole: the full pole coordinates drive the tide. */
    NONE {
        @Override
        public PolarMotion at(GpsTime time) {
            return PolarMotion.ZERO;
        }
    },
    /** Linear secular pole of the IERS Conventions 2018 update. */
    IERS2018 {
        @Override
        public PolarMotion at(GpsTime time) {
            double years = time.decimalYear() - 2000.0;
            return new PolarMotion((55.0 + 1.677 * years) * MAS, (320.5 + 3.460 * years) * MAS);
        }
    };

    private static final double MAS = Math.PI / (180.0 * 3600.0 * 1000.0);

    /** Mean pole coordinates in radians. */
    public abstract PolarMotion at(GpsTime time);

    /**
     * Wobble parameters (m1, m2) in radians: m1 = xp - x̄p, m2 = -(yp - ȳp).
     */
    public double[] wobble(PolarMotion pole, GpsTime time) {
        PolarMotion mean = at(time);
        return new double[] {pole.xp() - mean.xp(), -(pole.yp() - mean.yp())};
    }
}
