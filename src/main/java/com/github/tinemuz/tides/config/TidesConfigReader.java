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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tinemuz.tides.AstronomicalTide;
import com.github.tinemuz.tides.CentrifugalTide;
import com.github.tinemuz.tides.DoodsonHarmonicTide;
import com.github.tinemuz.tides.EarthTide;
import com.github.tinemuz.tides.MeanPole;
import com.github.tinemuz.tides.OceanPoleTide;
import com.github.tinemuz.tides.PoleTide;
import com.github.tinemuz.tides.SolidMoonTide;
import com.github.tinemuz.tides.TideConfigurationException;
import com.github.tinemuz.tides.TideModel;
import com.github.tinemuz.tides.TideType;
import com.github.tinemuz.tides.Tides;
import com.github.tinemuz.tides.earth.Body;
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Tides} aggregator from JSON.
 *
 * <p>The document is either an array of model entries or an object with a
 * {@code tides} array. Each entry has a {@code type} tag (deprecated aliases
 * accepted) and the parameters of that model; omitted parameters take the
 * model defaults. Example:</p>
 * <pre>
 * [ { "type": "astronomicalTide", "bodies": ["sun", "moon"], "maxDegree": 4 },
 *   { "type": "earthTide" },
 *   { "type": "doodsonHarmonicTide", "table": "fes2014" } ]
 * </pre>
 * <p>Any invalid field fails the whole configuration with a
 * {@link TideConfigurationException} naming the field.</p>
 */
public final class TidesConfigReader {
    private static final Logger log = LoggerFactory.getLogger(TidesConfigReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TideTables tables;

    public TidesConfigReader(TideTables tables) {
        this.tables = tables;
    }

    public TidesConfigReader() {
        this(TideTables.empty());
    }

    public Tides read(String json) {
        try {
            return read(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new TideConfigurationException("tides", "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Tides read(InputStream json) throws IOException {
        try {
            return read(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new TideConfigurationException("tides", "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Load a configuration from the classpath. */
    public Tides fromResource(String name) {
        InputStream in = TidesConfigReader.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            log.error("Tide configuration '{}' not found on classpath", name);
            throw new TideConfigurationException("tides", "'" + name + "' not found on classpath");
        }
        try (InputStream stream = in) {
            return read(stream);
        } catch (IOException e) {
            log.error("Failed to read tide configuration '{}'", name, e);
            throw new TideConfigurationException("tides", "failed to read '" + name + "'", e);
        }
    }

    public Tides read(JsonNode root) {
        JsonNode entries = root.isObject() ? root.get("tides") : root;
        if (entries == null || !entries.isArray()) {
            throw new TideConfigurationException("tides", "expected an array of tide entries");
        }
        Tides.Builder builder = Tides.builder();
        for (JsonNode entry : entries) {
            builder.add(model(entry));
        }
        Tides tides = builder.build();
        log.debug("Configured {}", tides);
        return tides;
    }

    TideModel model(JsonNode entry) {
        if (!entry.isObject()) throw new TideConfigurationException("tides", "entry is not an object");
        JsonNode tag = entry.get("type");
        TideType type = TideType.fromTag(tag == null || !tag.isTextual() ? null : tag.asText());
        switch (type) {
            case ASTRONOMICAL:
                return new AstronomicalTide(
                        bodies(entry, List.of(Body.SUN, Body.MOON)),
                        number(entry, "factor", 1.0),
                        integer(entry, "maxDegree", AstronomicalTide.DEFAULT_MAX_DEGREE));
            case EARTH:
                return earthTide(entry);
            case DOODSON_HARMONIC:
                return new DoodsonHarmonicTide(
                        tables.catalogue(text(entry, "table")),
                        integer(entry, "minDegree", 0),
                        integer(entry, "maxDegree", -1),
                        number(entry, "factor", 1.0));
            case POLE:
                return new PoleTide(
                        number(entry, "k2Real", 0.3077),
                        number(entry, "k2Imag", 0.0036),
                        number(entry, "h2", 0.6207),
                        number(entry, "l2", 0.0836),
                        meanPole(entry));
            case OCEAN_POLE:
                return oceanPoleTide(entry);
            case CENTRIFUGAL:
                return new CentrifugalTide();
            case SOLID_MOON:
                return new SolidMoonTide(
                        bodies(entry, List.of(Body.EARTH, Body.SUN)),
                        number(entry, "k2", SolidMoonTide.DEFAULT_K2),
                        integer(entry, "maxDegree", 2));
            default:
                throw new TideConfigurationException("type", "unhandled tide type " + type);
        }
    }

    private EarthTide earthTide(JsonNode entry) {
        EarthTide.Builder b = EarthTide.builder();
        if (entry.has("k2Real") || entry.has("k2Imag")) {
            b.k2(numbers(entry, "k2Real"), numbers(entry, "k2Imag"));
        }
        if (entry.has("k3")) b.k3(numbers(entry, "k3"));
        if (entry.has("k2Plus")) b.k2Plus(numbers(entry, "k2Plus"));
        if (entry.has("h2") || entry.has("l2") || entry.has("h3") || entry.has("l3")) {
            b.displacementLoveNumbers(
                    number(entry, "h2", 0.6078), number(entry, "l2", 0.0847),
                    number(entry, "h3", 0.292), number(entry, "l3", 0.015));
        }
        if (entry.has("includePermanentTide")) {
            JsonNode flag = entry.get("includePermanentTide");
            if (!flag.isBoolean()) throw new TideConfigurationException("includePermanentTide", "expected a boolean");
            b.includePermanentTide(flag.booleanValue());
        }
        if (entry.has("bodies")) b.bodies(bodies(entry, List.of()));
        return b.build();
    }

    private OceanPoleTide oceanPoleTide(JsonNode entry) {
        TideTables.OceanPoleCoefficients coefficients = tables.oceanPole(text(entry, "table"));
        LoveNumbers love = entry.has("loveNumbers")
                ? tables.loveNumbers(text(entry, "loveNumbers"))
                : LoveNumbers.loadLoveNumbers();
        double[] loadK = new double[love.maxDegree() + 1];
        for (int n = 0; n < loadK.length; n++) loadK[n] = love.k(n);
        return new OceanPoleTide(
                coefficients.real(), coefficients.imag(), loadK, integer(entry, "maxDegree", -1), meanPole(entry));
    }

    private static MeanPole meanPole(JsonNode entry) {
        JsonNode node = entry.get("meanPole");
        if (node == null) return MeanPole.IERS2018;
        try {
            return MeanPole.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TideConfigurationException("meanPole", "unknown mean pole '" + node.asText() + "'", e);
        }
    }

    private static List<Body> bodies(JsonNode entry, List<Body> fallback) {
        JsonNode node = entry.get("bodies");
        if (node == null) return fallback;
        if (!node.isArray()) throw new TideConfigurationException("bodies", "expected an array of body names");
        List<Body> bodies = new ArrayList<>();
        for (JsonNode name : node) {
            try {
                bodies.add(Body.fromName(name.asText()));
            } catch (IllegalArgumentException e) {
                throw new TideConfigurationException("bodies", "unknown body '" + name.asText() + "'", e);
            }
        }
        return bodies;
    }

    private static String text(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new TideConfigurationException(field, "expected a name");
        }
        return node.asText();
    }

    private static double number(JsonNode entry, String field, double fallback) {
        JsonNode node = entry.get(field);
        if (node == null) return fallback;
        if (!node.isNumber()) throw new TideConfigurationException(field, "expected a number");
        return node.doubleValue();
    }

    private static int integer(JsonNode entry, String field, int fallback) {
        JsonNode node = entry.get(field);
        if (node == null) return fallback;
        if (!node.isIntegralNumber()) throw new TideConfigurationException(field, "expected an integer");
        return node.intValue();
    }

    private static double[] numbers(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || !node.isArray()) throw new TideConfigurationException(field, "expected an array of numbers");
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            if (!node.get(i).isNumber()) throw new TideConfigurationException(field, "expected an array of numbers");
            values[i] = node.get(i).doubleValue();
        }
        return values;
    }
}
