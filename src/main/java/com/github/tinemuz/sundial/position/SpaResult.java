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

import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.TopocentricPosition;
import com.github.tinemuz.sundial.ephemeris.JulianDate;
import com.github.tinemuz.sundial.ephemeris.SolarEphemeris;

/** Full output of {@link Spa#calculate}. */
public final class SpaResult {
    /** The instant the result was computed for. */
    public final ObservationTime time;

    /** Geocentric solar ephemeris, including all intermediate quantities. */
    public final SolarEphemeris ephemeris;

    /** Topocentric position and incidence angle. */
    public final TopocentricPosition position;

    /** Equation of time in minutes. */
    public final double equationOfTimeMinutes;

    /** Transit, sunrise and sunset for the local date of the instant. */
    public final SunTimes sunTimes;

    /** UTC calendar date of the instant, with the time of day as a day fraction. */
    public final JulianDate.CalendarDate utcDate;

    SpaResult(
            ObservationTime time,
            SolarEphemeris ephemeris,
            TopocentricPosition position,
            SunTimes sunTimes) {
        this.time = time;
        this.ephemeris = ephemeris;
        this.position = position;
        this.equationOfTimeMinutes = ephemeris.equationOfTimeMinutes;
        this.sunTimes = sunTimes;
        this.utcDate = JulianDate.toCalendar(ephemeris.time.jd);
    }

    /** Earth-sun distance in AU. */
    public double radiusVector() {
        return ephemeris.radiusVector;
    }

    @Override
    public String toString() {
        return "SpaResult[" + time + ", " + position + ", eot=" + equationOfTimeMinutes + "min]";
    }
}
