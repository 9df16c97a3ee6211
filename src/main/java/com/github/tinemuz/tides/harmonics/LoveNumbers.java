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

import com.github.tinemuz.tides.TideConfigurationException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Degree dependent elastic response numbers: {@code hn} converts a potential
 * harmonic of degree n into vertical displacement, {@code ln} into horizontal
 * displacement and the optional {@code kn} into the induced potential.
 *
 * <p>Tables can be read from text, one line per degree:
 * <code>n h l [k]</code>, blank lines and lines starting with {@code #}
 * ignored, degrees contiguous from 0.</p>
 */
public final class LoveNumbers {
    private static final Logger log = LoggerFactory.getLogger(LoveNumbers.class);
    /** Classpath table of load Love numbers shipped with the library. */
    public static final String LOAD_LOVE_NUMBERS = "love/loadLoveNumbers.txt";

    private final double[] hn;
    private final double[] ln;
    private final double[] kn;

    private LoveNumbers(double[] hn, double[] ln, double[] kn) {
        this.hn = hn;
        this.ln = ln;
        this.kn = kn;
    }

    /**
     * @throws TideConfigurationException if a value is not finite
     */
    public static LoveNumbers of(double[] hn, double[] ln) {
        return of(hn, ln, new double[0]);
    }

    public static LoveNumbers of(double[] hn, double[] ln, double[] kn) {
        requireFinite("hn", hn);
        requireFinite("ln", ln);
        requireFinite("kn", kn);
        return new LoveNumbers(hn.clone(), ln.clone(), kn.clone());
    }

    public double h(int n) {
        return hn[n];
    }

    public double l(int n) {
        return ln[n];
    }

    /** Potential Love number of degree n, zero where the table has none. */
    public double k(int n) {
        return n < kn.length ? kn[n] : 0.0;
    }

    /** Highest degree covered by both hn and ln. */
    public int maxDegree() {
        return Math.min(hn.length, ln.length) - 1;
    }

    /**
     * Check that hn and ln reach {@code maxDegree}.
     *
     * @throws TideConfigurationException naming {@code hn} or {@code ln}
     */
    public LoveNumbers requireDegree(int maxDegree) {
        if (hn.length < maxDegree + 1) {
            throw new TideConfigurationException(
                    "hn", "needs " + (maxDegree + 1) + " values, has " + hn.length);
        }
        if (ln.length < maxDegree + 1) {
            throw new TideConfigurationException(
                    "ln", "needs " + (maxDegree + 1) + " values, has " + ln.length);
        }
        return this;
    }

    /** Load Love numbers up to degree 6, including k'n. */
    public static LoveNumbers loadLoveNumbers() {
        return fromResource(LOAD_LOVE_NUMBERS);
    }

    /**
     * Load a table from the classpath.
     *
     * @throws TideConfigurationException if the resource is missing or malformed
     */
    public static LoveNumbers fromResource(String name) {
        InputStream in = LoveNumbers.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            log.error("Love number table '{}' not found on classpath", name);
            throw new TideConfigurationException(
                    "loveNumbers", "'" + name + "' not found on classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            log.error("Failed to read Love number table '{}'", name, e);
            throw new TideConfigurationException("loveNumbers", "failed to read '" + name + "'", e);
        }
    }

    /**
     * Parse a table in the format described above.
     *
     * @throws TideConfigurationException on any malformed line
     * @throws IOException if the reader fails
     */
    public static LoveNumbers parse(Reader source) throws IOException {
        BufferedReader br =
                source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        List<double[]> rows = new ArrayList<>();
        boolean withK = true;
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] toks = line.split("\\s+");
            if (toks.length < 3 || toks.length > 4) {
                throw new TideConfigurationException(
                        "loveNumbers", "line " + lineNo + ": expected 'n h l [k]'");
            }
            try {
                int n = Integer.parseInt(toks[0]);
                if (n != rows.size()) {
                    throw new TideConfigurationException(
                            "loveNumbers", "line " + lineNo + ": expected degree " + rows.size() + ", got " + n);
                }
                double k = toks.length == 4 ? Double.parseDouble(toks[3]) : Double.NaN;
                withK &= toks.length == 4;
                rows.add(new double[] {Double.parseDouble(toks[1]), Double.parseDouble(toks[2]), k});
            } catch (NumberFormatException e) {
                throw new TideConfigurationException(
                        "loveNumbers", "line " + lineNo + ": " + e.getMessage(), e);
            }
        }
        if (rows.isEmpty()) {
            throw new TideConfigurationException("loveNumbers", "table is empty");
        }
        double[] h = new double[rows.size()];
        double[] l = new double[rows.size()];
        double[] k = new double[withK ? rows.size() : 0];
        for (int n = 0; n < rows.size(); n++) {
            h[n] = rows.get(n)[0];
            l[n] = rows.get(n)[1];
            if (withK) k[n] = rows.get(n)[2];
        }
        return of(h, l, k);
    }

    private static void requireFinite(String field, double[] values) {
        if (values == null) throw new TideConfigurationException(field, "missing");
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new TideConfigurationException(field, "value of degree " + i + " is " + values[i]);
            }
        }
    }

    @Override
    public String toString() {
        return "LoveNumbers{hn=" + Arrays.toString(hn) + ", ln=" + Arrays.toString(ln) + "}";
    }
}
