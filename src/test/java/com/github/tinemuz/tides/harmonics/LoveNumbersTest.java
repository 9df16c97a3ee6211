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
package com.github.tinemuz.tides.harmonics;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.tides.TideConfigurationException;
import java.io.StringReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LoveNumbersTest {

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        @DisplayName("Shipped load Love numbers reach degree 6")
        void shippedTable() {
            LoveNumbers love = LoveNumbers.loadLoveNumbers();
            assertEquals(6, love.maxDegree());
            assertEquals(-1.001, love.h(2), 1e-12);
            assertEquals(0.0295, love.l(2), 1e-12);
            assertEquals(-0.3075, love.k(2), 1e-12);
            assertEquals(0.0, love.k(7));
            assertSame(love, love.requireDegree(6));
        }

        @Test
        @DisplayName("Parsing skips comments and makes k optional")
        void parse() throws Exception {
            LoveNumbers love = LoveNumbers.parse(new StringReader("# h l\n\n0 0.1 0.2\n1 0.3 0.4\n"));
            assertEquals(1, love.maxDegree());
            assertEquals(0.3, love.h(1));
            assertEquals(0.4, love.l(1));
            assertEquals(0.0, love.k(1));
        }

        @Test
        @DisplayName("Degrees must be contiguous")
        void gap() {
            TideConfigurationException e = assertThrows(
                    TideConfigurationException.class, () -> LoveNumbers.fromResource("love/gap.txt"));
            assertEquals("loveNumbers", e.field());
        }

        @Test
        @DisplayName("Malformed numbers and missing resources are configuration errors")
        void malformed() {
            assertEquals("loveNumbers", assertThrows(TideConfigurationException.class,
                    () -> LoveNumbers.parse(new StringReader("0 abc 0.1\n"))).field());
            assertEquals("loveNumbers", assertThrows(TideConfigurationException.class,
                    () -> LoveNumbers.parse(new StringReader("0 0.1\n"))).field());
            assertEquals("loveNumbers", assertThrows(TideConfigurationException.class,
                    () -> LoveNumbers.fromResource("love/missing.txt")).field());
        }
    }

    @Nested
    @DisplayName("Degree checks")
    class DegreeChecks {

        @Test
        @DisplayName("Too short hn or ln is named in the error")
        void requireDegree() {
            LoveNumbers shortTable = LoveNumbers.fromResource("love/short.txt");
            assertEquals(1, shortTable.maxDegree());
            assertEquals("hn", assertThrows(TideConfigurationException.class,
                    () -> shortTable.requireDegree(2)).field());
            LoveNumbers shortL = LoveNumbers.of(new double[] {0, 0, 0}, new double[] {0, 0});
            assertEquals("ln", assertThrows(TideConfigurationException.class,
                    () -> shortL.requireDegree(2)).field());
        }

        @Test
        @DisplayName("Non finite values are rejected")
        void finite() {
            assertEquals("hn", assertThrows(TideConfigurationException.class,
                    () -> LoveNumbers.of(new double[] {Double.NaN}, new double[] {0})).field());
        }
    }
}
