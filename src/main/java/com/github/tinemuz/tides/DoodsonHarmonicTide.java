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

import com.github.tinemuz.tides.earth.EarthRotation;
import com.github.tinemuz.tides.earth.Ephemerides;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;

/**
 * Tides given as a catalogue of harmonic constituents, e.g. an ocean tide
 * model. Every constituent carries a Doodson number and two coefficient
 * sets; at time t the field is
 * {@code Σ cos(θ_f(t))·A_f + sin(θ_f(t))·B_f} with the astronomical
 * argument θ_f from the Doodson arguments.
 *
 * <p>The catalogue itself is read elsewhere and handed over in memory.
 * Deformation uses the Love numbers supplied by the caller, normally load
 * Love numbers.</p>
 */
public final class DoodsonHarmonicTide extends HarmonicTide {
    private final List<Constituent> constituents;
    private final int maxDegree;
    private final int minDegree;
    private final double factor;
    private final double gm;
    private final double r;

    /**
     * @param constituents catalogue, not empty
     * @param minDegree lowest degree used from the catalogue
     * @param maxDegree highest degree used, negative for all
     * @param factor scale applied to the whole field
     */
    public DoodsonHarmonicTide(List<Constituent> constituents, int minDegree, int maxDegree, double factor) {
        if (constituents.isEmpty()) {
            throw new TideConfigurationException("constituents", "catalogue is empty");
        }
        this.constituents = List.copyOf(constituents);
        Constituent first = this.constituents.get(0);
        this.gm = first.cos().gm();
        this.r = first.cos().r();
        int catalogueDegree = 0;
        for (Constituent c : this.constituents) {
            catalogueDegree = Math.max(catalogueDegree, Math.max(c.cos().maxDegree(), c.sin().maxDegree()));
        }
        this.maxDegree = maxDegree < 0 ? catalogueDegree : maxDegree;
        this.minDegree = minDegree;
        this.factor = factor;
    }

    @Override
    public TideType type() {
        return TideType.DOODSON_HARMONIC;
    }

    public List<Constituent> constituents() {
        return constituents;
    }

    @Override
    public SphericalHarmonics sphericalHarmonics(
            GpsTime time,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            int maxDegree,
            int minDegree,
            double gm,
            double r) {
        DoodsonArguments beta = DoodsonArguments.at(time, rotation.gmst(time));
        SphericalHarmonics field = SphericalHarmonics.zero();
        for (Constituent c : constituents) {
            double theta = c.doodson().argument(beta);
            field = field.add(c.cos().scale(Math.cos(theta))).add(c.sin().scale(Math.sin(theta)));
        }
        return field.get(this.maxDegree, this.minDegree, this.gm, this.r)
                .scale(factor)
                .get(degreeOr(maxDegree, this.maxDegree), Math.max(minDegree, this.minDegree), gm, r);
    }

    /**
     * One tidal constituent.
     *
     * @param doodson Doodson number of the constituent
     * @param cos coefficients multiplied with cos θ
     * @param sin coefficients multiplied with sin θ
     */
    public record Constituent(Doodson doodson, SphericalHarmonics cos, SphericalHarmonics sin) {
        public Constituent {
            if (doodson == null || cos == null || sin == null) {
                throw new TideConfigurationException("constituents", "doodson, cos and sin are required");
            }
        }
    }
}
