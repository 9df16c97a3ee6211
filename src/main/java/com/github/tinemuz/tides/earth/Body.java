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

import java.util.Locale;

/** Solar system bodies with their gravitational parameter GM (m³/s²). */
public enum Body {
    SUN(1.32712442099e20),
    MOON(4.9028001e12),
    EARTH(3.986004418e14),
    MERCURY(2.2031780e13),
    VENUS(3.24858592e14),
    MARS(4.282837e13),
    JUPITER(1.26712764e17),
    SATURN(3.7940585e16);

    private final double gm;

    Body(double gm) {
        this.gm = gm;
    }

    public double gm() {
        return gm;
    }

    /** Case-insensitive lookup by name, e.g. "moon". */
    public static Body fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
