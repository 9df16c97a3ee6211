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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * A tidal constituent identified by its six Doodson multipliers.
 *
 * <p>Parsed from the classic code <code>ABC.DEF</code> where every digit
 * but the first is offset by 5 (M2 = 255.555), or from a constituent name
 * such as "M2" or "K1".</p>
 */
public final class Doodson {
    private static final Map<String, String> NAMES = Map.ofEntries(
            Map.entry("M2", "255.555"),
            Map.entry("S2", "273.555"),
            Map.entry("N2", "245.655"),
            Map.entry("K2", "275.555"),
            Map.entry("K1", "165.555"),
            Map.entry("O1", "145.555"),
            Map.entry("P1", "163.555"),
            Map.entry("Q1", "135.655"),
            Map.entry("MF", "075.555"),
            Map.entry("MM", "065.455"),
            Map.entry("SSA", "057.555"),
            Map.entry("SA", "056.554"),
            Map.entry("M4", "455.555"));

    private final int[] multipliers;

    private Doodson(int[] multipliers) {
        this.multipliers = multipliers;
    }

    public static Doodson of(int... multipliers) {
        if (multipliers.length != 6) {
            throw new TideConfigurationException("doodson", "needs 6 multipliers, got " + multipliers.length);
        }
        return new Doodson(multipliers.clone());
    }

    /**
     * Parse a Doodson code or a constituent name.
     *
     * @throws TideConfigurationException if the text is neither
     */
    public static Doodson parse(String text) {
        String trimmed = text.trim();
        String code = NAMES.getOrDefault(trimmed.toUpperCase(Locale.ROOT), trimmed);
        String digits = code.replace(".", "");
        if (digits.length() != 6 || code.indexOf('.') != 3 || !digits.chars().allMatch(Character::isDigit)) {
            throw new TideConfigurationException("doodson", "cannot parse '" + text + "'");
        }
        int[] k = new int[6];
        for (int i = 0; i < 6; i++) {
            k[i] = digits.charAt(i) - '0' - (i == 0 ? 0 : 5);
        }
        return new Doodson(k);
    }

    /** Astronomical argument θ = Σ kᵢ βᵢ in radians. */
    public double argument(DoodsonArguments beta) {
        double[] b = beta.values();
        double theta = 0.0;
        for (int i = 0; i < 6; i++) theta += multipliers[i] * b[i];
        return theta;
    }

    /** Angular frequency in rad/day, from the rates of the fundamental arguments. */
    public double frequency() {
        double[] rates = {
            360.0 * 1.0027379093 - 13.17639648, 13.17639648, 0.98564734, 0.11140353, 0.05295377, 0.00004707
        };
        double f = 0.0;
        for (int i = 0; i < 6; i++) f += multipliers[i] * rates[i];
        return Math.toRadians(f);
    }

    public int[] multipliers() {
        return multipliers.clone();
    }

    /** Code in the form ABC.DEF. */
    public String code() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            if (i == 3) sb.append('.');
            int digit = multipliers[i] + (i == 0 ? 0 : 5);
            sb.append(digit >= 0 && digit <= 9 ? (char) ('0' + digit) : 'X');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Doodson && Arrays.equals(multipliers, ((Doodson) o).multipliers);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(multipliers);
    }

    @Override
    public String toString() {
        return code();
    }
}
