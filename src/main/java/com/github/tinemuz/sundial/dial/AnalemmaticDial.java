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
package com.github.tinemuz.sundial.dial;

import java.util.ArrayList;
import java.util.List;

import com.github.tinemuz.sundial.DegenerateGeometryException;
import com.github.tinemuz.sundial.InvalidObserverException;
import com.github.tinemuz.sundial.SolarDay;

/**
 * Geometry of a horizontal analemmatic sundial.
 *
 * <p>The hour marks lie on an ellipse whose east-west semi-axis is 1 and whose
 * north-south semi-axis is |sin(latitude)|. A vertical gnomon stands on the
 * north-south axis at an offset that depends on the sun's declination, so the
 * gnomon is moved along a date scale through the year. The dial is a pure
 * function of the declination and equation of time it is given; it does not
 * compute solar positions itself.</p>
 *
 * <p>In the southern hemisphere the marks run counterclockwise, mirrored
 * east-west, and the gnomon offset changes sign.</p>
 */
public final class AnalemmaticDial {
    /** Smallest |latitude| that still gives a usable ellipse, degrees. */
    public static final double MIN_ABS_LATITUDE = 0.1;

    /** Largest |latitude| that still gives a usable ellipse, degrees. */
    public static final double MAX_ABS_LATITUDE = 89.9;

    private final double latitudeDeg;
    private final double longitudeDeg;
    private final double utcOffsetHours;
    private final boolean correctForLongitude;
    private final boolean correctForEquationOfTime;
    private final double[] hours;
    private final double axisRatio;
    private final double hemisphere;

    private AnalemmaticDial(Builder b) {
        this.latitudeDeg = b.latitudeDeg;
        this.longitudeDeg = b.longitudeDeg;
        this.utcOffsetHours = b.utcOffsetHours;
        this.correctForLongitude = b.correctForLongitude;
        this.correctForEquationOfTime = b.correctForEquationOfTime;
        this.hours = b.hours.clone();
        this.axisRatio = Math.abs(Math.sin(Math.toRadians(latitudeDeg)));
        this.hemisphere = latitudeDeg >= 0 ? 1.0 : -1.0;
    }

    /**
     * Start building a dial for a site.
     *
     * @param latitudeDeg  latitude, north positive
     * @param longitudeDeg longitude, east positive
     */
    public static Builder builder(double latitudeDeg, double longitudeDeg) {
        return new Builder(latitudeDeg, longitudeDeg);
    }

    /** North-south over east-west axis length, |sin(latitude)|. */
    public double axisRatio() {
        return axisRatio;
    }

    public double latitudeDeg() {
        return latitudeDeg;
    }

    public double longitudeDeg() {
        return longitudeDeg;
    }

    public double utcOffsetHours() {
        return utcOffsetHours;
    }

    public boolean correctsForLongitude() {
        return correctForLongitude;
    }

    public boolean correctsForEquationOfTime() {
        return correctForEquationOfTime;
    }

    /**
     * Difference between local mean time and zone time in minutes: 4 minutes
     * per degree between the site and the zone's central meridian.
     */
    public double longitudeCorrectionMinutes() {
        return (longitudeDeg - 15.0 * utcOffsetHours) * 4.0;
    }

    /** Clock correction applied to the hour marks, not counting the equation of time. */
    public double appliedLongitudeCorrectionMinutes() {
        return correctForLongitude ? longitudeCorrectionMinutes() : 0.0;
    }

    /** Distance of each focus from the center, sqrt(1 - k^2). */
    public double focusDistance() {
        return Math.sqrt(1.0 - axisRatio * axisRatio);
    }

    /**
     * Gnomon position on the north-south axis for a solar declination:
     * sgn(latitude) * cos(latitude) * tan(declination), north positive.
     */
    public double gnomonOffset(double declinationDeg) {
        return hemisphere
                * Math.cos(Math.toRadians(latitudeDeg))
                * Math.tan(Math.toRadians(declinationDeg));
    }

    /**
     * Hour mark for a clock hour.
     *
     * @param clockHour             civil clock hour, 0 to 24
     * @param equationOfTimeMinutes equation of time for the date; ignored unless the
     *                              dial corrects for it
     */
    public HourPoint hourPoint(double clockHour, double equationOfTimeMinutes) {
        double correction = appliedLongitudeCorrectionMinutes();
        if (correctForEquationOfTime) {
            correction += equationOfTimeMinutes;
        }
        double hourAngleRad = Math.toRadians(15.0 * (clockHour + correction / 60.0 - 12.0));
        double x = hemisphere * Math.sin(hourAngleRad);
        double y = axisRatio * Math.cos(hourAngleRad);
        double dialAngle = Math.toDegrees(Math.atan2(x, y));
        return new HourPoint(clockHour, dialAngle, x, y);
    }

    /** Hour marks for all configured hours. */
    public List<HourPoint> hourPoints(double equationOfTimeMinutes) {
        List<HourPoint> points = new ArrayList<>(hours.length);
        for (double hour : hours) {
            points.add(hourPoint(hour, equationOfTimeMinutes));
        }
        return points;
    }

    /** Complete layout for the date and solar values of {@code day}. */
    public DialGeometry geometry(SolarDay day) {
        double eot = correctForEquationOfTime ? day.equationOfTimeMinutes() : 0.0;
        return new DialGeometry(
                day.date(),
                latitudeDeg,
                axisRatio,
                hourPoints(day.equationOfTimeMinutes()),
                gnomonOffset(day.declinationDeg()),
                appliedLongitudeCorrectionMinutes(),
                eot,
                focusDistance());
    }

    @Override
    public String toString() {
        return String.format(
                "AnalemmaticDial[lat=%.4f, lon=%.4f, utc%+.2f, k=%.6f]",
                latitudeDeg, longitudeDeg, utcOffsetHours, axisRatio);
    }

    /** Builder for {@link AnalemmaticDial}. */
    public static final class Builder {
        private final double latitudeDeg;
        private final double longitudeDeg;
        private double utcOffsetHours = 0.0;
        private boolean correctForLongitude = false;
        private boolean correctForEquationOfTime = false;
        private double[] hours = defaultHours();

        private Builder(double latitudeDeg, double longitudeDeg) {
            this.latitudeDeg = latitudeDeg;
            this.longitudeDeg = longitudeDeg;
        }

        /** UTC offset of the civil time the dial should show, hours. */
        public Builder utcOffsetHours(double utcOffsetHours) {
            this.utcOffsetHours = utcOffsetHours;
            return this;
        }

        /** Shift the marks so the dial reads zone time rather than local mean time. */
        public Builder correctForLongitude(boolean correct) {
            this.correctForLongitude = correct;
            return this;
        }

        /** Shift the marks by the equation of time of the geometry's date. */
        public Builder correctForEquationOfTime(boolean correct) {
            this.correctForEquationOfTime = correct;
            return this;
        }

        /** Clock hours to mark, each within [0, 24). */
        public Builder hours(double... hours) {
            this.hours = hours.clone();
            return this;
        }

        /**
         * @throws InvalidObserverException if latitude or longitude is out of range
         * @throws DegenerateGeometryException if the latitude is too close to the
         *     equator or a pole for a usable ellipse
         * @throws IllegalArgumentException if the UTC offset or an hour is out of range
         */
        public AnalemmaticDial build() {
            if (!(latitudeDeg >= -90.0 && latitudeDeg <= 90.0)) {
                throw new InvalidObserverException(
                        "Latitude must be within [-90, 90] degrees, got " + latitudeDeg);
            }
            if (!(longitudeDeg >= -180.0 && longitudeDeg <= 180.0)) {
                throw new InvalidObserverException(
                        "Longitude must be within [-180, 180] degrees, got " + longitudeDeg);
            }
            double absLat = Math.abs(latitudeDeg);
            if (absLat < MIN_ABS_LATITUDE || absLat > MAX_ABS_LATITUDE) {
                throw new DegenerateGeometryException(
                        "Latitude " + latitudeDeg + " is too close to the equator or a pole "
                                + "for an analemmatic dial; |latitude| must be within ["
                                + MIN_ABS_LATITUDE + ", " + MAX_ABS_LATITUDE + "]");
            }
            if (!(Math.abs(utcOffsetHours) <= 18.0)) {
                throw new IllegalArgumentException(
                        "UTC offset must be within +/-18 hours, got " + utcOffsetHours);
            }
            for (double hour : hours) {
                if (!(hour >= 0.0 && hour < 24.0)) {
                    throw new IllegalArgumentException(
                            "Clock hours must be within [0, 24), got " + hour);
                }
            }
            return new AnalemmaticDial(this);
        }

        private static double[] defaultHours() {
            double[] all = new double[24];
            for (int i = 0; i < all.length; i++) all[i] = i;
            return all;
        }
    }
}
