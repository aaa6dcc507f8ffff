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

/**
 * Sun transit, sunrise and sunset for one local date, in local fractional hours.
 *
 * @param transitHours local hour of the sun's meridian transit
 * @param sunriseHours local hour of sunrise, NaN when the sun does not cross the horizon
 * @param sunsetHours  local hour of sunset, NaN when the sun does not cross the horizon
 * @param type         whether the sun rises and sets on that date
 */
public record SunTimes(double transitHours, double sunriseHours, double sunsetHours, Type type) {

    /** Horizon crossing behavior of the sun for a date. */
    public enum Type {
        /** The sun rises and sets. */
        NORMAL,
        /** Midnight sun: the sun stays above the horizon all day. */
        ALWAYS_ABOVE,
        /** Polar night: the sun stays below the horizon all day. */
        ALWAYS_BELOW
    }

    /** Day length in hours; 24 or 0 when the sun does not cross the horizon. */
    public double dayLengthHours() {
        switch (type) {
            case ALWAYS_ABOVE:
                return 24.0;
            case ALWAYS_BELOW:
                return 0.0;
            default:
                double length = sunsetHours - sunriseHours;
                return length < 0 ? length + 24.0 : length;
        }
    }
}
