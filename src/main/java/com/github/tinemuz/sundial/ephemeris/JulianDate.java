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

import com.github.tinemuz.sundial.ObservationTime;

/**
 * Julian day of an instant and the derived dynamical time scales.
 *
 * <p>JD is in universal time; JDE adds delta-T. Century and millennium counts
 * are measured from J2000.0 (JD 2451545.0).</p>
 */
public final class JulianDate {
    /** Julian day of the J2000.0 epoch. */
    public static final double J2000 = 2451545.0;

    // Last Julian-calendar day number; later dates get the Gregorian correction
    private static final double GREGORIAN_SWITCH = 2299160.0;

    /** Julian day (UT). */
    public final double jd;

    /** Julian ephemeris day (TT). */
    public final double jde;

    /** Julian century from J2000 (UT). */
    public final double jc;

    /** Julian ephemeris century from J2000 (TT). */
    public final double jce;

    /** Julian ephemeris millennium from J2000 (TT). */
    public final double jme;

    /** Delta-T used to derive {@link #jde}, seconds. */
    public final double deltaTSeconds;

    private JulianDate(double jd, double deltaTSeconds) {
        this.jd = jd;
        this.deltaTSeconds = deltaTSeconds;
        this.jde = jd + deltaTSeconds / 86400.0;
        this.jc = (jd - J2000) / 36525.0;
        this.jce = (jde - J2000) / 36525.0;
        this.jme = jce / 10.0;
    }

    /** Time scales for a validated observation time. */
    public static JulianDate of(ObservationTime time) {
        double jd =
                julianDay(
                        time.year,
                        time.month,
                        time.day,
                        time.hour,
                        time.minute,
                        time.second,
                        time.utcOffsetHours);
        return new JulianDate(jd, time.deltaTSeconds);
    }

    /** Time scales for a raw Julian day number. */
    public static JulianDate ofJulianDay(double jd, double deltaTSeconds) {
        return new JulianDate(jd, deltaTSeconds);
    }

    /**
     * Julian day for a civil date and time (Meeus, chapter 7). Months January and
     * February count as months 13 and 14 of the previous year; the Gregorian
     * correction applies after 1582-10-04.
     */
    public static double julianDay(
            int year, int month, int day, int hour, int minute, double second, double utcOffsetHours) {
        double dayDecimal =
                day + (hour - utcOffsetHours + (minute + second / 60.0) / 60.0) / 24.0;
        if (month < 3) {
            month += 12;
            year--;
        }
        double jd =
                (long) (365.25 * (year + 4716.0))
                        + (long) (30.6001 * (month + 1))
                        + dayDecimal
                        - 1524.5;
        if (jd > GREGORIAN_SWITCH) {
            int a = year / 100;
            jd += 2 - a + a / 4;
        }
        return jd;
    }

    /**
     * Inverse conversion: calendar date of a Julian day (Meeus, chapter 7).
     * The returned day carries the time of day as a fraction.
     */
    public static CalendarDate toCalendar(double jd) {
        double shifted = jd + 0.5;
        double z = Math.floor(shifted);
        double f = shifted - z;
        double a = z;
        if (z >= 2299161.0) {
            double alpha = Math.floor((z - 1867216.25) / 36524.25);
            a = z + 1 + alpha - Math.floor(alpha / 4.0);
        }
        double b = a + 1524;
        double c = Math.floor((b - 122.1) / 365.25);
        double d = Math.floor(365.25 * c);
        double e = Math.floor((b - d) / 30.6001);
        double day = b - d - Math.floor(30.6001 * e) + f;
        int month = (int) (e < 14 ? e - 1 : e - 13);
        int year = (int) (month > 2 ? c - 4716 : c - 4715);
        return new CalendarDate(year, month, day);
    }

    /**
     * Calendar date with fractional day.
     *
     * @param year  astronomical year
     * @param month month, 1 to 12
     * @param day   day of month with time of day as fraction
     */
    public record CalendarDate(int year, int month, double day) {}

    @Override
    public String toString() {
        return String.format("JulianDate[jd=%.6f, jde=%.6f]", jd, jde);
    }
}
