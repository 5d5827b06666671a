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
package com.github.tinemuz.units.photometry;

import com.github.tinemuz.units.UnknownPassbandException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passband response curves, read from the classpath resources
 * {@code filters/SYSTEM.FILTER}. Each resource has two whitespace separated
 * columns, wavelength in angstrom and response; further columns and
 * {@code #} comment lines are ignored.
 */
public final class ResponseCurves {
    private static final Logger log = LoggerFactory.getLogger(ResponseCurves.class);

    static final String DIRECTORY = "filters/";
    static final String BOLOMETRIC = "OPEN.BOL";

    private static final Map<String, Curve> CACHE = new ConcurrentHashMap<>();

    private ResponseCurves() {}

    /**
     * A response curve sorted by wavelength.
     *
     * @param wavelength angstrom, ascending
     * @param response   response at each wavelength
     */
    public record Curve(double[] wavelength, double[] response) {

        public Curve {
            if (wavelength.length != response.length) {
                throw new IllegalArgumentException("Wavelength and response differ in length");
            }
            wavelength = wavelength.clone();
            response = response.clone();
        }

        /** Copy of the wavelength grid. */
        @Override
        public double[] wavelength() {
            return wavelength.clone();
        }

        /** Copy of the response values. */
        @Override
        public double[] response() {
            return response.clone();
        }

        /** Response-weighted mean wavelength. */
        public double weightedMeanWavelength() {
            double sum = 0.0;
            double weights = 0.0;
            for (int i = 0; i < wavelength.length; i++) {
                sum += wavelength[i] * response[i];
                weights += response[i];
            }
            return sum / weights;
        }
    }

    /**
     * Response curve of a passband. {@code OPEN.BOL} is a flat curve from 1 to
     * 1e10 angstrom.
     *
     * @throws UnknownPassbandException if there is no curve for the passband
     */
    public static Curve get(String photband) {
        String key = photband.toUpperCase(Locale.ROOT);
        Curve curve = CACHE.get(key);
        if (curve == null) {
            curve = load(key);
            CACHE.put(key, curve);
        }
        return curve;
    }

    private static Curve load(String photband) {
        if (BOLOMETRIC.equals(photband)) {
            double r = 1 / (1e10 - 1);
            return new Curve(new double[] {1, 1e10}, new double[] {r, r});
        }
        InputStream in = ResponseCurves.class.getClassLoader().getResourceAsStream(DIRECTORY + photband);
        if (in == null) throw new UnknownPassbandException("No response curve for passband " + photband);

        List<double[]> points = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                String[] t = trimmed.split("\\s+");
                points.add(new double[] {Double.parseDouble(t[0]), Double.parseDouble(t[1])});
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read response curve of {}", photband, e);
            throw new IllegalStateException("Failed to read response curve of " + photband, e);
        }
        points.sort(Comparator.comparingDouble(p -> p[0]));
        double[] wave = new double[points.size()];
        double[] response = new double[points.size()];
        for (int i = 0; i < wave.length; i++) {
            wave[i] = points.get(i)[0];
            response[i] = points.get(i)[1];
        }
        log.debug("Loaded response curve of {} with {} points", photband, wave.length);
        return new Curve(wave, response);
    }

    /**
     * Effective wavelength in angstrom: the mean wavelength weighted with the
     * response curve.
     *
     * @return NaN if there is no curve for the passband
     */
    public static double effectiveWavelength(String photband) {
        Curve curve;
        try {
            curve = get(photband);
        } catch (UnknownPassbandException e) {
            log.debug("No effective wavelength for {}: {}", photband, e.getMessage());
            return Double.NaN;
        }
        return curve.weightedMeanWavelength();
    }

    /**
     * Effective wavelength in angstrom as seen by a source with the given
     * spectrum (Van der Bliek et al. 1996, eq. 2). The model is interpolated
     * log-log onto the curve's wavelength grid.
     *
     * @param modelWave ascending model wavelengths (angstrom)
     * @param modelFlux model fluxes, positive
     * @return NaN if there is no curve for the passband
     */
    public static double effectiveWavelength(String photband, double[] modelWave, double[] modelFlux) {
        if (modelWave.length != modelFlux.length || modelWave.length < 2) {
            throw new IllegalArgumentException("Model needs at least two matching wavelength and flux points");
        }
        Curve curve;
        try {
            curve = get(photband);
        } catch (UnknownPassbandException e) {
            log.debug("No effective wavelength for {}: {}", photband, e.getMessage());
            return Double.NaN;
        }
        double[] w = curve.wavelength();
        double[] r = curve.response();
        double[] logModelWave = Arrays.stream(modelWave).map(Math::log10).toArray();
        double[] logModelFlux = Arrays.stream(modelFlux).map(Math::log10).toArray();
        double[] num = new double[w.length];
        double[] den = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            double flux = Math.pow(10.0, interpolate(Math.log10(w[i]), logModelWave, logModelFlux));
            num[i] = w[i] * flux * r[i];
            den[i] = flux * r[i];
        }
        return trapezoid(num, w) / trapezoid(den, w);
    }

    /** True for colours ({@code SYSTEM.A-B}) and the Strömgren indices {@code M1} and {@code C1}. */
    public static boolean isColor(String photband) {
        int dot = photband.indexOf('.');
        if (dot < 0) return false;
        String band = photband.substring(dot + 1).toUpperCase(Locale.ROOT);
        return band.contains("-") || band.equals("M1") || band.equals("C1");
    }

    // linear interpolation, clamped to the end values outside the grid
    private static double interpolate(double x, double[] xs, double[] ys) {
        if (x <= xs[0]) return ys[0];
        int last = xs.length - 1;
        if (x >= xs[last]) return ys[last];
        int i = Arrays.binarySearch(xs, x);
        if (i >= 0) return ys[i];
        int hi = -i - 1;
        int lo = hi - 1;
        double f = (x - xs[lo]) / (xs[hi] - xs[lo]);
        return ys[lo] + f * (ys[hi] - ys[lo]);
    }

    private static double trapezoid(double[] y, double[] x) {
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) sum += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
        return sum;
    }
}
