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

import com.github.tinemuz.tides.time.GpsTime;

/**
 * The six Doodson fundamental arguments in radians: mean lunar time τ,
 * mean longitude of the Moon s, of the Sun h, of the lunar perigee p,
 * negative longitude of the lunar node N' and longitude of the perihelion ps.
 */
public record DoodsonArguments(double tau, double s, double h, double p, double nPrime, double ps) {
    private static final double DEG = Math.PI / 180.0;

    /**
     * Arguments at {@code time}.
     *
     * @param gmst Greenwich mean sidereal time in radians, usually from the Earth rotation
     */
    public static DoodsonArguments at(GpsTime time, double gmst) {
        double t = time.centuriesTt();
        double s = (218.3164477 + t * (481267.88123421 - t * 0.0015786)) * DEG;
        double h = (280.4664567 + t * (36000.7697489 + t * 0.00030322)) * DEG;
        double p = (83.3532465 + t * (4069.0137287 - t * 0.0103200)) * DEG;
        double n = (125.0445479 - t * (1934.1362891 - t * 0.0020754)) * DEG;
        double ps = (282.9373481 + t * (1.7195366 + t * 0.00045688)) * DEG;
        return new DoodsonArguments(gmst + Math.PI - s, s, h, p, -n, ps);
    }

    public double[] values() {
        return new double[] {tau, s, h, p, nPrime, ps};
    }
}
