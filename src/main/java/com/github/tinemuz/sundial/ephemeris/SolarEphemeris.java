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
 * Geocentric apparent position of the sun for one instant.
 *
 * <p>Heliocentric longitude, latitude and radius come from the abridged VSOP87
 * series; nutation from the 63-term IAU 1980 theory; obliquity from Laskar's
 * polynomial. The result carries every intermediate quantity of the pipeline
 * so callers can inspect or reuse them (the lunar model reuses nutation and
 * sidereal time). Angles are degrees, the radius vector is in AU.</p>
 */
public final class SolarEphemeris {
    /** Use all available terms of each series. */
    public static final int ALL_TERMS = Integer.MAX_VALUE;

    /** Time scales this ephemeris was computed for. */
    public final JulianDate time;

    /** Earth heliocentric longitude L, degrees. */
    public final double earthLongitude;

    /** Earth heliocentric latitude B, degrees. */
    public final double earthLatitude;

    /** Earth radius vector R, AU. */
    public final double radiusVector;

    /** Geocentric longitude, degrees. */
    public final double geocentricLongitude;

    /** Geocentric latitude, degrees. */
    public final double geocentricLatitude;

    /** Mean elongation of the moon from the sun, degrees. */
    public final double meanElongationMoon;

    /** Mean anomaly of the sun (Earth), degrees. */
    public final double meanAnomalySun;

    /** Mean anomaly of the moon, degrees. */
    public final double meanAnomalyMoon;

    /** Moon's argument of latitude, degrees. */
    public final double argumentLatitudeMoon;

    /** Longitude of the ascending node of the moon's mean orbit, degrees. */
    public final double ascendingNodeMoon;

    /** Nutation in longitude, degrees. */
    public final double nutationLongitude;

    /** Nutation in obliquity, degrees. */
    public final double nutationObliquity;

    /** Mean obliquity of the ecliptic, arc seconds. */
    public final double meanObliquityArcsec;

    /** True obliquity of the ecliptic, degrees. */
    public final double trueObliquity;

    /** Aberration correction, degrees. */
    public final double aberration;

    /** Apparent sun longitude, degrees. */
    public final double apparentLongitude;

    /** Greenwich mean sidereal time, degrees. */
    public final double meanSiderealTime;

    /** Greenwich apparent sidereal time, degrees. */
    public final double apparentSiderealTime;

    /** Geocentric right ascension, degrees. */
    public final double rightAscension;

    /** Geocentric declination, degrees. */
    public final double declination;

    /** Sun mean longitude, degrees. */
    public final double sunMeanLongitude;

    /** Equation of time, minutes, within +/-20. */
    public final double equationOfTimeMinutes;

    private SolarEphemeris(JulianDate time, int termLimit) {
        this.time = time;
        double jme = time.jme;
        double jce = time.jce;

        earthLongitude =
                limitDegrees(
                        Math.toDegrees(earthValue(PeriodicTerms.earthLongitude(), jme, termLimit)));
        earthLatitude = Math.toDegrees(earthValue(PeriodicTerms.earthLatitude(), jme, termLimit));
        radiusVector = earthValue(PeriodicTerms.earthRadius(), jme, termLimit);
        geocentricLongitude = limitDegrees(earthLongitude + 180.0);
        geocentricLatitude = -earthLatitude;

        meanElongationMoon =
                thirdOrder(297.85036, 445267.111480, -0.0019142, 1.0 / 189474.0, jce);
        meanAnomalySun = thirdOrder(357.52772, 35999.050340, -0.0001603, -1.0 / 300000.0, jce);
        meanAnomalyMoon = thirdOrder(134.96298, 477198.867398, 0.0086972, 1.0 / 56250.0, jce);
        argumentLatitudeMoon =
                thirdOrder(93.27191, 483202.017538, -0.0036825, 1.0 / 327270.0, jce);
        ascendingNodeMoon = thirdOrder(125.04452, -1934.136261, 0.0020708, 1.0 / 450000.0, jce);

        double[] x = {
            meanElongationMoon, meanAnomalySun, meanAnomalyMoon, argumentLatitudeMoon, ascendingNodeMoon
        };
        int[][] args = PeriodicTerms.nutationArguments();
        double[][] coeffs = PeriodicTerms.nutationCoefficients();
        double sumPsi = 0.0;
        double sumEpsilon = 0.0;
        for (int i = 0; i < args.length; i++) {
            double arg = 0.0;
            for (int j = 0; j < x.length; j++) arg += x[j] * args[i][j];
            double argRad = Math.toRadians(arg);
            sumPsi += (coeffs[i][0] + coeffs[i][1] * jce) * Math.sin(argRad);
            sumEpsilon += (coeffs[i][2] + coeffs[i][3] * jce) * Math.cos(argRad);
        }
        nutationLongitude = sumPsi / 36_000_000.0;
        nutationObliquity = sumEpsilon / 36_000_000.0;

        meanObliquityArcsec = meanObliquity(jme / 10.0);
        trueObliquity = meanObliquityArcsec / 3600.0 + nutationObliquity;
        aberration = -20.4898 / (3600.0 * radiusVector);
        apparentLongitude = geocentricLongitude + nutationLongitude + aberration;

        meanSiderealTime =
                limitDegrees(
                        280.46061837
                                + 360.98564736629 * (time.jd - JulianDate.J2000)
                                + time.jc * time.jc * (0.000387933 - time.jc / 38710000.0));
        double epsilonRad = Math.toRadians(trueObliquity);
        apparentSiderealTime = meanSiderealTime + nutationLongitude * Math.cos(epsilonRad);

        rightAscension = rightAscension(apparentLongitude, trueObliquity, geocentricLatitude);
        declination = declination(apparentLongitude, trueObliquity, geocentricLatitude);

        double jme2 = jme * jme;
        double jme3 = jme2 * jme;
        double jme4 = jme3 * jme;
        double jme5 = jme4 * jme;
        sunMeanLongitude =
                limitDegrees(
                        280.4664567
                                + 360007.6982779 * jme
                                + 0.03032028 * jme2
                                + jme3 / 49931.0
                                - jme4 / 15300.0
                                - jme5 / 2000000.0);
        equationOfTimeMinutes =
                wrapEquationOfTime(
                        4.0
                                * (sunMeanLongitude
                                        - 0.0057183
                                        - rightAscension
                                        + nutationLongitude * Math.cos(epsilonRad)));
    }

    /** Full-precision ephemeris. */
    public static SolarEphemeris compute(JulianDate time) {
        return new SolarEphemeris(time, ALL_TERMS);
    }

    /**
     * Ephemeris keeping only the first {@code termLimit} terms of each Earth
     * series. Nutation always uses the full table.
     *
     * @throws IllegalArgumentException if {@code termLimit} is less than 1
     */
    public static SolarEphemeris compute(JulianDate time, int termLimit) {
        if (termLimit < 1) {
            throw new IllegalArgumentException("Term limit must be at least 1, got " + termLimit);
        }
        return new SolarEphemeris(time, termLimit);
    }

    /** Equatorial coordinates with the radius vector and the sun's horizontal parallax. */
    public EquatorialPosition equatorial() {
        return new EquatorialPosition(
                rightAscension, declination, radiusVector, 8.794 / (3600.0 * radiusVector));
    }

    /**
     * Geocentric right ascension for an ecliptic position, degrees [0, 360).
     * Shared with the lunar model.
     */
    static double rightAscension(double longitude, double obliquity, double latitude) {
        double lambdaRad = Math.toRadians(longitude);
        double epsilonRad = Math.toRadians(obliquity);
        double betaRad = Math.toRadians(latitude);
        return limitDegrees(
                Math.toDegrees(
                        Math.atan2(
                                Math.sin(lambdaRad) * Math.cos(epsilonRad)
                                        - Math.tan(betaRad) * Math.sin(epsilonRad),
                                Math.cos(lambdaRad))));
    }

    /** Geocentric declination for an ecliptic position, degrees. */
    static double declination(double longitude, double obliquity, double latitude) {
        double lambdaRad = Math.toRadians(longitude);
        double epsilonRad = Math.toRadians(obliquity);
        double betaRad = Math.toRadians(latitude);
        return Math.toDegrees(
                Math.asin(
                        Math.sin(betaRad) * Math.cos(epsilonRad)
                                + Math.cos(betaRad) * Math.sin(epsilonRad) * Math.sin(lambdaRad)));
    }

    private static double earthValue(double[][][] series, double jme, int termLimit) {
        double sum = 0.0;
        double power = 1.0;
        for (double[][] rows : series) {
            double partial = 0.0;
            int count = Math.min(termLimit, rows.length);
            for (int i = 0; i < count; i++) {
                double[] row = rows[i];
                partial += row[0] * Math.cos(row[1] + row[2] * jme);
            }
            sum += partial * power;
            power *= jme;
        }
        return sum / 1e8;
    }

    private static double thirdOrder(double a, double b, double c, double d, double x) {
        return ((d * x + c) * x + b) * x + a;
    }

    // Laskar (1986), arc seconds, u in units of 10000 Julian years
    private static double meanObliquity(double u) {
        return 84381.448
                + u * (-4680.93
                + u * (-1.55
                + u * (1999.25
                + u * (-51.38
                + u * (-249.67
                + u * (-39.05
                + u * (7.12
                + u * (27.87
                + u * (5.79
                + u * 2.45)))))))));
    }

    private static double wrapEquationOfTime(double minutes) {
        if (minutes < -20.0) return minutes + 1440.0;
        if (minutes > 20.0) return minutes - 1440.0;
        return minutes;
    }

    @Override
    public String toString() {
        return String.format(
                "SolarEphemeris[jd=%.6f, L=%.6f, B=%.6f, R=%.8f, alpha=%.6f, delta=%.6f]",
                time.jd, earthLongitude, earthLatitude, radiusVector, rightAscension, declination);
    }
}
