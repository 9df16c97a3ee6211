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
package com.github.tinemuz.tides.config;

import com.github.tinemuz.tides.DoodsonHarmonicTide;
import com.github.tinemuz.tides.TideConfigurationException;
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Named in-memory tables referenced from a tide configuration: constituent
 * catalogues for harmonic ocean tides, ocean pole tide coefficients and
 * load Love numbers. Reading these tables from files is left to the caller.
 */
public final class TideTables {
    private final Map<String, List<DoodsonHarmonicTide.Constituent>> catalogues;
    private final Map<String, OceanPoleCoefficients> oceanPole;
    private final Map<String, LoveNumbers> loveNumbers;

    private TideTables(Builder b) {
        this.catalogues = Map.copyOf(b.catalogues);
        this.oceanPole = Map.copyOf(b.oceanPole);
        this.loveNumbers = Map.copyOf(b.loveNumbers);
    }

    public static TideTables empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<DoodsonHarmonicTide.Constituent> catalogue(String name) {
        return require(catalogues, name);
    }

    public OceanPoleCoefficients oceanPole(String name) {
        return require(oceanPole, name);
    }

    public LoveNumbers loveNumbers(String name) {
        return require(loveNumbers, name);
    }

    private static <T> T require(Map<String, T> tables, String name) {
        T table = tables.get(name);
        if (table == null) {
            throw new TideConfigurationException("table", "no table named '" + name + "'");
        }
        return table;
    }

    /** Real (A) and imaginary (B) response coefficients of the ocean pole tide. */
    public record OceanPoleCoefficients(SphericalHarmonics real, SphericalHarmonics imag) {}

    public static final class Builder {
        private final Map<String, List<DoodsonHarmonicTide.Constituent>> catalogues = new HashMap<>();
        private final Map<String, OceanPoleCoefficients> oceanPole = new HashMap<>();
        private final Map<String, LoveNumbers> loveNumbers = new HashMap<>();

        private Builder() {}

        public Builder catalogue(String name, List<DoodsonHarmonicTide.Constituent> constituents) {
            catalogues.put(name, List.copyOf(constituents));
            return this;
        }

        public Builder oceanPole(String name, SphericalHarmonics real, SphericalHarmonics imag) {
            oceanPole.put(name, new OceanPoleCoefficients(real, imag));
            return this;
        }

        public Builder loveNumbers(String name, LoveNumbers love) {
            loveNumbers.put(name, love);
            return this;
        }

        public TideTables build() {
            return new TideTables(this);
        }
    }
}
