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

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration tags of the available tide models. Each tag selects exactly
 * one {@link TideModel} implementation; deprecated aliases are resolved to
 * their current tag by {@link #fromTag(String)}.
 */
public enum TideType {
    ASTRONOMICAL("astronomicalTide", "direct tides from sun, moon and planets"),
    EARTH("earthTide", "solid earth tides"),
    DOODSON_HARMONIC("doodsonHarmonicTide", "tides with harmonic representation, e.g. ocean tides"),
    POLE("poleTide", "centrifugal effect of polar motion", "poleTide2010"),
    OCEAN_POLE("oceanPoleTide",
            "centrifugal effect of polar motion on the oceans", "poleOceanTide2010"),
    CENTRIFUGAL("centrifugal", "current centrifugal force from Earth rotation"),
    SOLID_MOON("solidMoonTide", "solid moon tides (at moon)", "moonTide");

    private static final Logger log = LoggerFactory.getLogger(TideType.class);

    private final String tag;
    private final String description;
    private final List<String> deprecatedTags;

    TideType(String tag, String description, String... deprecatedTags) {
        this.tag = tag;
        this.description = description;
        this.deprecatedTags = List.of(deprecatedTags);
    }

    public String tag() {
        return tag;
    }

    public String description() {
        return description;
    }

    public List<String> deprecatedTags() {
        return deprecatedTags;
    }

    /**
     * Resolve a configuration tag, accepting deprecated aliases.
     *
     * @param tag tag as written in the configuration
     * @return the matching type
     * @throws TideConfigurationException if the tag is unknown
     */
    public static TideType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new TideConfigurationException("type", "missing tide type");
        }
        String trimmed = tag.trim();
        for (TideType type : values()) {
            if (type.tag.equals(trimmed)) return type;
        }
        for (TideType type : values()) {
            if (type.deprecatedTags.contains(trimmed)) {
                log.warn("Tide type '{}' is deprecated, use '{}' instead", trimmed, type.tag);
                return type;
            }
        }
        throw new TideConfigurationException(
                "type", String.format(Locale.ROOT, "unknown tide type '%s'", trimmed));
    }

    @Override
    public String toString() {
        return tag;
    }
}
