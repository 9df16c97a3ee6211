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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.tides.CoverageException;
import com.github.tinemuz.tides.time.GpsTime;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnalyticalEphemeridesTest {
    private final AnalyticalEphemerides ephemerides = AnalyticalEphemerides.standard();

    @Test
    @DisplayName("Sun and Moon distances are in their orbital ranges")
    void distances() {
        for (int day = 0; day < 400; day += 7) {
            GpsTime t = GpsTime.of(2020, 1, 1, 0, 0, 0).plusSeconds(day * 86400.0);
            double sun = ephemerides.position(t, Body.SUN).getNorm();
            double moon = ephemerides.position(t, Body.MOON).getNorm();
            assertTrue(sun > 1.46e11 && sun < 1.53e11, "sun at " + t);
            assertTrue(moon > 3.55e8 && moon < 4.08e8, "moon at " + t);
        }
    }

    @Test
    @DisplayName("Sun is near the winter solstice in early January")
    void sunDirection() {
        Vector3D sun = ephemerides.position(GpsTime.of(2000, 1, 1, 12, 0, 0), Body.SUN);
        double declination = Math.toDegrees(sun.getDelta());
        double rightAscension = Math.toDegrees(sun.getAlpha());
        assertEquals(-23.0, declination, 0.5);
        assertEquals(-78.7, rightAscension, 0.5);
    }

    @Test
    @DisplayName("The Earth is the origin")
    void earth() {
        assertEquals(Vector3D.ZERO, ephemerides.position(GpsTime.of(2010, 1, 1, 0, 0, 0), Body.EARTH));
    }

    @Test
    @DisplayName("Unsupported bodies and epochs carry the epoch")
    void coverage() {
        GpsTime t = GpsTime.of(2010, 1, 1, 0, 0, 0);
        CoverageException planet = assertThrows(CoverageException.class, () -> ephemerides.position(t, Body.MARS));
        assertEquals(t, planet.epoch());

        AnalyticalEphemerides narrow =
                AnalyticalEphemerides.between(GpsTime.of(2020, 1, 1, 0, 0, 0), GpsTime.of(2021, 1, 1, 0, 0, 0));
        CoverageException outside = assertThrows(CoverageException.class, () -> narrow.position(t, Body.SUN));
        assertEquals(t, outside.epoch());
        assertTrue(outside.getMessage().contains("No ephemerides for SUN available"));
    }
}
