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
import com.github.tinemuz.tides.harmonics.LoveNumbers;
import com.github.tinemuz.tides.harmonics.SphericalHarmonics;
import com.github.tinemuz.tides.time.GpsTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sum of a list of tide models.
 *
 * <p>Every query is forwarded to each model in insertion order and the
 * results are added. A failing model aborts the query: the failure is
 * logged with the model's tag and the original exception is rethrown.</p>
 *
 * <p>Instances are immutable and safe for concurrent use.</p>
 */
public final class Tides {
    private static final Logger log = LoggerFactory.getLogger(Tides.class);

    private final List<TideModel> models;

    private Tides(List<TideModel> models) {
        this.models = Collections.unmodifiableList(new ArrayList<>(models));
    }

    public static Tides empty() {
        return new Tides(List.of());
    }

    public static Tides of(List<? extends TideModel> models) {
        for (TideModel model : models) {
            if (model == null) throw new TideConfigurationException("tides", "null tide model");
        }
        return new Tides(new ArrayList<>(models));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Read-only view of the models in evaluation order. */
    public List<TideModel> models() {
        return models;
    }

    public double potential(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        double sum = 0.0;
        for (TideModel model : models) {
            sum += call(model, time, m -> m.potential(time, point, rotEarth, rotation, ephemerides));
        }
        return sum;
    }

    public double radialGradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        double sum = 0.0;
        for (TideModel model : models) {
            sum += call(model, time, m -> m.radialGradient(time, point, rotEarth, rotation, ephemerides));
        }
        return sum;
    }

    /** Tidal acceleration (gravity vector). */
    public Vector3D acceleration(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        Vector3D sum = Vector3D.ZERO;
        for (TideModel model : models) {
            sum = sum.add(call(model, time, m -> m.gravity(time, point, rotEarth, rotation, ephemerides)));
        }
        return sum;
    }

    /** Gravity gradient tensor. */
    public RealMatrix gradient(
            GpsTime time, Vector3D point, Rotation rotEarth, EarthRotation rotation, Ephemerides ephemerides) {
        RealMatrix sum = MatrixUtils.createRealMatrix(3, 3);
        for (TideModel model : models) {
            sum = sum.add(call(model, time, m -> m.gravityGradient(time, point, rotEarth, rotation, ephemerides)));
        }
        return sum;
    }

    /** Station displacement, each model using its own deformation formula. */
    public Vector3D deformation(
            GpsTime time,
            Vector3D point,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double gravity,
            LoveNumbers love) {
        Vector3D sum = Vector3D.ZERO;
        for (TideModel model : models) {
            sum = sum.add(call(model, time,
                    m -> m.deformation(time, point, rotEarth, rotation, ephemerides, gravity, love)));
        }
        return sum;
    }

    /**
     * Displacements of all stations at all epochs, added into {@code out}.
     * The sum is collected separately and added only after every model
     * succeeded, so a failure leaves {@code out} untouched.
     *
     * @param gravity local gravity per station
     * @param out accumulator sized [points][times]
     */
    public void deformation(
            List<GpsTime> times,
            List<Vector3D> points,
            List<Rotation> rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            double[] gravity,
            LoveNumbers love,
            DisplacementSeries out) {
        Batches.check(times, points, rotEarth, gravity, out);
        GpsTime first = times.isEmpty() ? null : times.get(0);
        DisplacementSeries sum = new DisplacementSeries(points.size(), times.size());
        for (TideModel model : models) {
            call(model, first, m -> {
                m.deformation(times, points, rotEarth, rotation, ephemerides, gravity, love, sum);
                return null;
            });
        }
        out.add(sum);
    }

    /**
     * Sum of the harmonic expansions of all models, converted to the
     * requested degree and scale. An empty list gives {@link SphericalHarmonics#zero()}.
     *
     * @throws UnsupportedTideOperationException if a model has no expansion
     */
    public SphericalHarmonics sphericalHarmonics(
            GpsTime time,
            Rotation rotEarth,
            EarthRotation rotation,
            Ephemerides ephemerides,
            int maxDegree,
            int minDegree,
            double gm,
            double r) {
        SphericalHarmonics sum = SphericalHarmonics.zero();
        for (TideModel model : models) {
            sum = sum.add(call(model, time,
                    m -> m.sphericalHarmonics(time, rotEarth, rotation, ephemerides, maxDegree, minDegree, gm, r)));
        }
        return models.isEmpty() ? sum : sum.get(maxDegree, minDegree, gm, r);
    }

    private static <T> T call(TideModel model, GpsTime time, Function<TideModel, T> query) {
        try {
            return query.apply(model);
        } catch (RuntimeException e) {
            log.error("Tide model '{}' failed at {}: {}", model.type().tag(), time, e.getMessage());
            throw e;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Tides[");
        for (int i = 0; i < models.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(models.get(i).type().tag());
        }
        return sb.append(']').toString();
    }

    public static final class Builder {
        private final List<TideModel> models = new ArrayList<>();

        private Builder() {}

        public Builder add(TideModel model) {
            if (model == null) throw new TideConfigurationException("tides", "null tide model");
            models.add(model);
            return this;
        }

        public Tides build() {
            return new Tides(models);
        }
    }
}
