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
package com.github.tinemuz.sundial.position;

import static com.github.tinemuz.sundial.Angles.limitDegrees180;
import static com.github.tinemuz.sundial.Angles.limitDegrees180pm;
import static com.github.tinemuz.sundial.Angles.limitZeroToOne;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.SolarDay;
import com.github.tinemuz.sundial.SurfaceOrientation;
import com.github.tinemuz.sundial.TopocentricPosition;
import com.github.tinemuz.sundial.ephemeris.JulianDate;
import com.github.tinemuz.sundial.ephemeris.PeriodicTerms;
import com.github.tinemuz.sundial.ephemeris.SolarEphemeris;

/**
 * NREL Solar Position Algorithm (Reda and Andreas, 2003).
 *
 * <p>Computes the topocentric sun position for the years -2000 to 6000 with an
 * uncertainty of +/-0.0003 degrees when the full periodic term tables are used.
 * {@link #calculate} also reports the equation of time and the sunrise, transit
 * and sunset of the local date, following appendix A.2 of the report.</p>
 */
public final class Spa implements SolarPositionEngine {
    private static final Logger log = LoggerFactory.getLogger(Spa.class);

    /** Full-precision engine. */
    public static final Spa DEFAULT = new Spa(SolarEphemeris.ALL_TERMS);

    // Geometric altitude of the sun's center at rise and set, degrees
    private static final double RISE_SET_ALTITUDE = -Topocentric.HORIZON_DIP;

    private static volatile boolean warnedTruncated = false;

    private final int termLimit;

    private Spa(int termLimit) {
        this.termLimit = termLimit;
    }

    /**
     * Engine that keeps only the first {@code termLimit} terms of each Earth
     * series. Faster, at the cost of precision; a warning is logged once.
     *
     * @throws IllegalArgumentException if {@code termLimit} is less than 1
     */
    public static Spa withTermLimit(int termLimit) {
        if (termLimit < 1) {
            throw new IllegalArgumentException("Term limit must be at least 1, got " + termLimit);
        }
        if (termLimit < PeriodicTerms.maxEarthTerms() && !warnedTruncated) {
            synchronized (Spa.class) {
                if (!warnedTruncated) {
                    warnedTruncated = true;
                    log.warn(
                            "Periodic term series truncated to {} terms; "
                                    + "solar position precision is reduced",
                            termLimit);
                }
            }
        }
        return new Spa(termLimit);
    }

    /** Number of terms kept per Earth series. */
    public int termLimit() {
        return termLimit;
    }

    /**
     * Complete solar position report for a horizontal surface.
     *
     * @throws IllegalStateException if coefficient data cannot be loaded
     */
    public SpaResult calculate(ObservationTime time, Observer observer) {
        return calculate(time, observer, SurfaceOrientation.HORIZONTAL);
    }

    /**
     * Complete solar position report: ephemeris, topocentric position with the
     * incidence angle on {@code surface}, equation of time and sun times.
     *
     * @throws IllegalStateException if coefficient data cannot be loaded
     */
    public SpaResult calculate(ObservationTime time, Observer observer, SurfaceOrientation surface) {
        SolarEphemeris ephemeris = ephemeris(JulianDate.of(time));
        TopocentricPosition position =
                Topocentric.transform(
                        ephemeris.equatorial(), ephemeris.apparentSiderealTime, observer, surface);
        return new SpaResult(time, ephemeris, position, sunTimes(time, observer));
    }

    @Override
    public TopocentricPosition position(ObservationTime time, Observer observer) {
        SolarEphemeris ephemeris = ephemeris(JulianDate.of(time));
        return Topocentric.transform(
                ephemeris.equatorial(),
                ephemeris.apparentSiderealTime,
                observer,
                SurfaceOrientation.HORIZONTAL);
    }

    @Override
    public SolarDay solarDay(ObservationTime time, Observer observer) {
        SolarEphemeris ephemeris = ephemeris(JulianDate.of(time));
        TopocentricPosition position =
                Topocentric.transform(
                        ephemeris.equatorial(),
                        ephemeris.apparentSiderealTime,
                        observer,
                        SurfaceOrientation.HORIZONTAL);
        return new SolarDay(
                time.localDate(),
                position.declination,
                ephemeris.equationOfTimeMinutes);
    }

    /** Geocentric ephemeris with this engine's term limit. */
    public SolarEphemeris ephemeris(JulianDate julianDate) {
        return SolarEphemeris.compute(julianDate, termLimit);
    }

    /**
     * Sun transit, sunrise and sunset for the local date of {@code time}, in
     * local hours of its UTC offset.
     */
    public SunTimes sunTimes(ObservationTime time, Observer observer) {
        double deltaT = time.deltaTSeconds;
        double jd0 = JulianDate.julianDay(time.year, time.month, time.day, 0, 0, 0.0, 0.0);

        // Positions at 0h TT of the previous, current and next day
        double nu = ephemeris(JulianDate.ofJulianDay(jd0, 0.0)).apparentSiderealTime;
        double[] alpha = new double[3];
        double[] delta = new double[3];
        for (int i = 0; i < 3; i++) {
            SolarEphemeris e = ephemeris(JulianDate.ofJulianDay(jd0 + i - 1, 0.0));
            alpha[i] = e.rightAscension;
            delta[i] = e.declination;
        }

        double latRad = Math.toRadians(observer.latitudeDeg);
        double transitFraction = (alpha[1] - observer.longitudeDeg - nu) / 360.0;
        double argument =
                (Math.sin(Math.toRadians(RISE_SET_ALTITUDE))
                                - Math.sin(latRad) * Math.sin(Math.toRadians(delta[1])))
                        / (Math.cos(latRad) * Math.cos(Math.toRadians(delta[1])));

        double[] m = new double[3];
        m[0] = limitZeroToOne(transitFraction);
        if (Math.abs(argument) > 1.0 || Double.isNaN(argument)) {
            double transit = transitHours(m[0], nu, alpha, delta, deltaT, observer);
            SunTimes.Type type =
                    argument > 1.0 ? SunTimes.Type.ALWAYS_BELOW : SunTimes.Type.ALWAYS_ABOVE;
            return new SunTimes(
                    localHours(transit, time.utcOffsetHours), Double.NaN, Double.NaN, type);
        }
        double h0 = limitDegrees180(Math.toDegrees(Math.acos(argument)));
        m[1] = limitZeroToOne(transitFraction - h0 / 360.0);
        m[2] = limitZeroToOne(transitFraction + h0 / 360.0);

        double[] hourAngle = new double[3];
        double[] altitude = new double[3];
        double[] declination = new double[3];
        for (int i = 0; i < 3; i++) {
            double siderealTime = nu + 360.985647 * m[i];
            double n = m[i] + deltaT / 86400.0;
            double alphaPrime = interpolate(alpha, n);
            declination[i] = interpolate(delta, n);
            hourAngle[i] = limitDegrees180pm(siderealTime + observer.longitudeDeg - alphaPrime);
            altitude[i] = altitude(latRad, declination[i], hourAngle[i]);
        }

        double transit = m[0] - hourAngle[0] / 360.0;
        double sunrise = riseOrSet(m[1], altitude[1], declination[1], latRad, hourAngle[1]);
        double sunset = riseOrSet(m[2], altitude[2], declination[2], latRad, hourAngle[2]);
        return new SunTimes(
                localHours(transit, time.utcOffsetHours),
                localHours(sunrise, time.utcOffsetHours),
                localHours(sunset, time.utcOffsetHours),
                SunTimes.Type.NORMAL);
    }

    private static double transitHours(
            double m0, double nu, double[] alpha, double[] delta, double deltaT, Observer observer) {
        double alphaPrime = interpolate(alpha, m0 + deltaT / 86400.0);
        double hourAngle =
                limitDegrees180pm(nu + 360.985647 * m0 + observer.longitudeDeg - alphaPrime);
        return m0 - hourAngle / 360.0;
    }

    // Second-order interpolation of a value tabulated at day -1, 0 and +1
    private static double interpolate(double[] values, double n) {
        double a = values[1] - values[0];
        double b = values[2] - values[1];
        if (Math.abs(a) >= 2.0) a = limitZeroToOne(a);
        if (Math.abs(b) >= 2.0) b = limitZeroToOne(b);
        return values[1] + n * (a + b + (b - a) * n) / 2.0;
    }

    private static double altitude(double latRad, double declinationDeg, double hourAngleDeg) {
        double deltaRad = Math.toRadians(declinationDeg);
        return Math.toDegrees(
                Math.asin(
                        Math.sin(latRad) * Math.sin(deltaRad)
                                + Math.cos(latRad)
                                        * Math.cos(deltaRad)
                                        * Math.cos(Math.toRadians(hourAngleDeg))));
    }

    private static double riseOrSet(
            double m, double altitude, double declinationDeg, double latRad, double hourAngleDeg) {
        return m
                + (altitude - RISE_SET_ALTITUDE)
                        / (360.0
                                * Math.cos(Math.toRadians(declinationDeg))
                                * Math.cos(latRad)
                                * Math.sin(Math.toRadians(hourAngleDeg)));
    }

    private static double localHours(double dayFraction, double utcOffsetHours) {
        return 24.0 * limitZeroToOne(dayFraction + utcOffsetHours / 24.0);
    }

    @Override
    public String toString() {
        return termLimit == SolarEphemeris.ALL_TERMS ? "Spa[full]" : "Spa[terms=" + termLimit + "]";
    }
}
