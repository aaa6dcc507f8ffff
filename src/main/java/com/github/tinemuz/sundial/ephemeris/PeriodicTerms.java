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
package com.github.tinemuz.sundial.ephemeris;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coefficient tables of the ephemeris series.
 *
 * <p>Three classpath resources are read: <code>earth-periodic-terms.txt</code>
 * (heliocentric longitude, latitude and radius series),
 * <code>nutation-terms.txt</code> and <code>moon-periodic-terms.txt</code>.
 * Tables are loaded once, on first use or through {@link #preload()}, and are
 * never modified afterwards, so concurrent readers need no locking.</p>
 */
public final class PeriodicTerms {
    private static final Logger log = LoggerFactory.getLogger(PeriodicTerms.class);
    private static final String EARTH_RESOURCE = "earth-periodic-terms.txt";
    private static final String NUTATION_RESOURCE = "nutation-terms.txt";
    private static final String MOON_RESOURCE = "moon-periodic-terms.txt";
    private static final int EARTH_L_SERIES = 6;
    private static final int EARTH_B_SERIES = 2;
    private static final int EARTH_R_SERIES = 5;
    private static final int NUTATION_TERMS = 63;
    private static final int MOON_TERMS = 60;

    private static volatile boolean loaded = false;
    private static double[][][] earthL; // [series][term]{A, B, C}
    private static double[][][] earthB;
    private static double[][][] earthR;
    private static int[][] nutationArgs; // [term]{Y0..Y4}
    private static double[][] nutationCoeffs; // [term]{a, b, c, d}
    private static int[][] moonLrArgs; // [term]{D, M, M', F}
    private static double[][] moonLrCoeffs; // [term]{sigma_l, sigma_r}
    private static int[][] moonBArgs;
    private static double[] moonBCoeffs;

    private PeriodicTerms() {}

    /**
     * Load all coefficient tables now. Call this at startup to detect missing or
     * malformed resources early; otherwise they load on the first computation.
     *
     * @throws IllegalStateException if a table cannot be read or parsed
     */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        try {
            loadEarthTerms();
            loadNutationTerms();
            loadMoonTerms();
        } catch (NumberFormatException e) {
            log.error("Failed to parse coefficient tables", e);
            throw new IllegalStateException("Failed to parse coefficient tables", e);
        }
        loaded = true;
    }

    static double[][][] earthLongitude() {
        ensureLoaded();
        return earthL;
    }

    static double[][][] earthLatitude() {
        ensureLoaded();
        return earthB;
    }

    static double[][][] earthRadius() {
        ensureLoaded();
        return earthR;
    }

    static int[][] nutationArguments() {
        ensureLoaded();
        return nutationArgs;
    }

    static double[][] nutationCoefficients() {
        ensureLoaded();
        return nutationCoeffs;
    }

    static int[][] moonLongitudeArguments() {
        ensureLoaded();
        return moonLrArgs;
    }

    static double[][] moonLongitudeCoefficients() {
        ensureLoaded();
        return moonLrCoeffs;
    }

    static int[][] moonLatitudeArguments() {
        ensureLoaded();
        return moonBArgs;
    }

    static double[] moonLatitudeCoefficients() {
        ensureLoaded();
        return moonBCoeffs;
    }

    /** Number of terms in the longest Earth series, the upper bound for a term limit. */
    public static int maxEarthTerms() {
        double[][][] l = earthLongitude();
        return l[0].length;
    }

    private static void loadEarthTerms() {
        Map<String, List<double[]>> series = new LinkedHashMap<>();
        for (String[] toks : readRows(EARTH_RESOURCE)) {
            if (toks.length != 4) {
                throw malformed(EARTH_RESOURCE, "expected 4 columns, got " + toks.length);
            }
            double[] row = {
                Double.parseDouble(toks[1]), Double.parseDouble(toks[2]), Double.parseDouble(toks[3])
            };
            series.computeIfAbsent(toks[0], k -> new ArrayList<>()).add(row);
        }
        earthL = collectSeries(series, 'L', EARTH_L_SERIES);
        earthB = collectSeries(series, 'B', EARTH_B_SERIES);
        earthR = collectSeries(series, 'R', EARTH_R_SERIES);
        log.debug(
                "Loaded Earth periodic terms: {} longitude, {} latitude, {} radius series",
                earthL.length, earthB.length, earthR.length);
    }

    private static double[][][] collectSeries(
            Map<String, List<double[]>> series, char kind, int count) {
        double[][][] out = new double[count][][];
        for (int i = 0; i < count; i++) {
            List<double[]> rows = series.get(kind + Integer.toString(i));
            if (rows == null || rows.isEmpty()) {
                throw malformed(EARTH_RESOURCE, "series " + kind + i + " is missing");
            }
            out[i] = rows.toArray(new double[0][]);
        }
        return out;
    }

    private static void loadNutationTerms() {
        List<int[]> args = new ArrayList<>();
        List<double[]> coeffs = new ArrayList<>();
        for (String[] toks : readRows(NUTATION_RESOURCE)) {
            if (!"N".equals(toks[0]) || toks.length != 10) {
                throw malformed(NUTATION_RESOURCE, "unexpected row starting with " + toks[0]);
            }
            int[] y = new int[5];
            for (int i = 0; i < 5; i++) y[i] = Integer.parseInt(toks[1 + i]);
            double[] c = new double[4];
            for (int i = 0; i < 4; i++) c[i] = Double.parseDouble(toks[6 + i]);
            args.add(y);
            coeffs.add(c);
        }
        if (args.size() != NUTATION_TERMS) {
            throw malformed(
                    NUTATION_RESOURCE, "expected " + NUTATION_TERMS + " terms, got " + args.size());
        }
        nutationArgs = args.toArray(new int[0][]);
        nutationCoeffs = coeffs.toArray(new double[0][]);
        log.debug("Loaded {} nutation terms", nutationArgs.length);
    }

    private static void loadMoonTerms() {
        List<int[]> lrArgs = new ArrayList<>();
        List<double[]> lrCoeffs = new ArrayList<>();
        List<int[]> bArgs = new ArrayList<>();
        List<Double> bCoeffs = new ArrayList<>();
        for (String[] toks : readRows(MOON_RESOURCE)) {
            int[] arg = new int[4];
            if ("ML".equals(toks[0]) && toks.length == 7) {
                for (int i = 0; i < 4; i++) arg[i] = Integer.parseInt(toks[1 + i]);
                lrArgs.add(arg);
                lrCoeffs.add(new double[] {Double.parseDouble(toks[5]), Double.parseDouble(toks[6])});
            } else if ("MB".equals(toks[0]) && toks.length == 6) {
                for (int i = 0; i < 4; i++) arg[i] = Integer.parseInt(toks[1 + i]);
                bArgs.add(arg);
                bCoeffs.add(Double.parseDouble(toks[5]));
            } else {
                throw malformed(MOON_RESOURCE, "unexpected row starting with " + toks[0]);
            }
        }
        if (lrArgs.size() != MOON_TERMS || bArgs.size() != MOON_TERMS) {
            throw malformed(
                    MOON_RESOURCE,
                    "expected " + MOON_TERMS + " terms per table, got " + lrArgs.size() + " and "
                            + bArgs.size());
        }
        moonLrArgs = lrArgs.toArray(new int[0][]);
        moonLrCoeffs = lrCoeffs.toArray(new double[0][]);
        moonBArgs = bArgs.toArray(new int[0][]);
        moonBCoeffs = bCoeffs.stream().mapToDouble(Double::doubleValue).toArray();
        log.debug("Loaded {} lunar longitude/distance and {} latitude terms",
                moonLrArgs.length, moonBArgs.length);
    }

    /**
     * Read the whitespace separated rows of a table, skipping blank lines and
     * <code>#</code> comments.
     */
    private static List<String[]> readRows(String resource) {
        InputStream in = PeriodicTerms.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Coefficient file '{}' not found on classpath", resource);
            throw new IllegalStateException(
                    "Coefficient file '" + resource + "' not found on classpath");
        }
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader br =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                rows.add(line.split("\\s+"));
            }
        } catch (IOException e) {
            log.error("Failed to read coefficient file '{}'", resource, e);
            throw new IllegalStateException("Failed to read coefficient file '" + resource + "'", e);
        }
        return rows;
    }

    private static IllegalStateException malformed(String resource, String detail) {
        log.error("Failed to parse coefficient file '{}': {}", resource, detail);
        return new IllegalStateException(
                "Failed to parse coefficient file '" + resource + "': " + detail);
    }
}
