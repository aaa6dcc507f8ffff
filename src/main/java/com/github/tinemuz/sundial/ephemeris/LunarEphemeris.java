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

import static com.github.tinemuz.sundial.Angles.limitDegrees;

/**
 * Geocentric apparent position of the moon (Meeus, chapter 47).
 *
 * <p>The periodic terms are the abridged ELP-2000/82 tables. Nutation, true
 * obliquity and sidereal time are taken from the solar ephemeris of the same
 * instant.</p>
 */
public final class LunarEphemeris {
    private static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.14;

    /** Moon mean longitude L', degrees. */
    public final double meanLongitude;

    /** Mean elongation D, degrees. */
    public final double meanElongation;

    /** Sun mean anomaly M, degrees. */
    public final double sunMeanAnomaly;

    /** Moon mean anomaly M', degrees. */
    public final double meanAnomaly;

    /** Argument of latitude F, degrees. */
    public final double argumentLatitude;

    /** Geocentric longitude before nutation, degrees. */
    public final double geocentricLongitude;

    /** Geocentric latitude, degrees. */
    public final double geocentricLatitude;

    /** Distance between the centers of Earth and moon, km. */
    public final double distanceKm;

    /** Equatorial horizontal parallax, degrees. */
    public final double parallax;

    /** Apparent longitude including nutation, degrees. */
    public final double apparentLongitude;

    /** Geocentric right ascension, degrees. */
    public final double rightAscension;

    /** Geocentric declination, degrees. */
    public final double declination;

    private LunarEphemeris(SolarEphemeris sun) {
        double jce = sun.time.jce;
        meanLongitude =
                limitDegrees(
                        fourthOrder(
                                218.3164477,
                                481267.88123421,
                                -0.0015786,
                                1.0 / 538841.0,
                                -1.0 / 65194000.0,
                                jce));
        meanElongation =
                limitDegrees(
                        fourthOrder(
                                297.8501921,
                                445267.1114034,
                                -0.0018819,
                                1.0 / 545868.0,
                                -1.0 / 113065000.0,
                                jce));
        sunMeanAnomaly =
                limitDegrees(
                        fourthOrder(357.5291092, 35999.0502909, -0.0001536, 1.0 / 24490000.0, 0.0, jce));
        meanAnomaly =
                limitDegrees(
                        fourthOrder(
                                134.9633964,
                                477198.8675055,
                                0.0087414,
                                1.0 / 69699.0,
                                -1.0 / 14712000.0,
                                jce));
        argumentLatitude =
                limitDegrees(
                        fourthOrder(
                                93.2720950,
                                483202.0175233,
                                -0.0036539,
                                -1.0 / 3526000.0,
                                1.0 / 863310000.0,
                                jce));

        double eccentricity = 1.0 - jce * (0.002516 + jce * 0.0000074);

        int[][] lrArgs = PeriodicTerms.moonLongitudeArguments();
        double[][] lrCoeffs = PeriodicTerms.moonLongitudeCoefficients();
        double sumL = 0.0;
        double sumR = 0.0;
        for (int i = 0; i < lrArgs.length; i++) {
            double factor = eccentricityFactor(lrArgs[i][1], eccentricity);
            double arg = Math.toRadians(argument(lrArgs[i]));
            sumL += factor * lrCoeffs[i][0] * Math.sin(arg);
            sumR += factor * lrCoeffs[i][1] * Math.cos(arg);
        }
        int[][] bArgs = PeriodicTerms.moonLatitudeArguments();
        double[] bCoeffs = PeriodicTerms.moonLatitudeCoefficients();
        double sumB = 0.0;
        for (int i = 0; i < bArgs.length; i++) {
            double factor = eccentricityFactor(bArgs[i][1], eccentricity);
            sumB += factor * bCoeffs[i] * Math.sin(Math.toRadians(argument(bArgs[i])));
        }

        // Additive terms for Venus, Jupiter and the flattening of the Earth
        double a1 = 119.75 + 131.849 * jce;
        double a2 = 53.09 + 479264.29 * jce;
        double a3 = 313.45 + 481266.484 * jce;
        sumL += 3958 * sinDeg(a1) + 1962 * sinDeg(meanLongitude - argumentLatitude) + 318 * sinDeg(a2);
        sumB +=
                -2235 * sinDeg(meanLongitude)
                        + 382 * sinDeg(a3)
                        + 175 * sinDeg(a1 - argumentLatitude)
                        + 175 * sinDeg(a1 + argumentLatitude)
                        + 127 * sinDeg(meanLongitude - meanAnomaly)
                        - 115 * sinDeg(meanLongitude + meanAnomaly);

        geocentricLongitude = limitDegrees(meanLongitude + sumL / 1_000_000.0);
        geocentricLatitude = sumB / 1_000_000.0;
        distanceKm = 385000.56 + sumR / 1000.0;
        parallax = Math.toDegrees(Math.asin(EARTH_EQUATORIAL_RADIUS_KM / distanceKm));
        apparentLongitude = geocentricLongitude + sun.nutationLongitude;
        rightAscension =
                SolarEphemeris.rightAscension(apparentLongitude, sun.trueObliquity, geocentricLatitude);
        declination =
                SolarEphemeris.declination(apparentLongitude, sun.trueObliquity, geocentricLatitude);
    }

    /** Moon position at the instant of the given solar ephemeris. */
    public static LunarEphemeris compute(SolarEphemeris sun) {
        return new LunarEphemeris(sun);
    }

    /** Equatorial coordinates with the distance in km and the horizontal parallax. */
    public EquatorialPosition equatorial() {
        return new EquatorialPosition(rightAscension, declination, distanceKm, parallax);
    }

    private double argument(int[] multipliers) {
        return multipliers[0] * meanElongation
                + multipliers[1] * sunMeanAnomaly
                + multipliers[2] * meanAnomaly
                + multipliers[3] * argumentLatitude;
    }

    // Terms containing M are scaled by E, terms containing 2M by E squared
    private static double eccentricityFactor(int sunAnomalyMultiplier, double eccentricity) {
        switch (Math.abs(sunAnomalyMultiplier)) {
            case 1:
                return eccentricity;
            case 2:
                return eccentricity * eccentricity;
            default:
                return 1.0;
        }
    }

    private static double fourthOrder(double a, double b, double c, double d, double e, double x) {
        return (((e * x + d) * x + c) * x + b) * x + a;
    }

    private static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    @Override
    public String toString() {
        return String.format(
                "LunarEphemeris[lambda=%.6f, beta=%.6f, distance=%.3fkm, alpha=%.6f, delta=%.6f]",
                apparentLongitude, geocentricLatitude, distanceKm, rightAscension, declination);
    }
}
