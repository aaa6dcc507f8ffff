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

import java.time.LocalDate;
import java.util.List;

/**
 * Layout of an analemmatic dial for one date. Lengths are in the normalized
 * frame where the east-west semi-axis is 1; multiply by half the physical width
 * to lay the dial out.
 *
 * @param date                         date the gnomon position is for
 * @param latitudeDeg                  latitude of the dial
 * @param axisRatio                    north-south over east-west axis, |sin(latitude)|
 * @param hourPoints                   hour marks in the order they were requested
 * @param gnomonOffset                 gnomon position on the north-south axis, north positive
 * @param longitudeCorrectionMinutes   clock correction applied to the marks, minutes
 * @param equationOfTimeMinutes        equation of time applied to the marks, minutes
 * @param focusDistance                distance of each focus from the center along the east-west axis
 */
public record DialGeometry(
        LocalDate date,
        double latitudeDeg,
        double axisRatio,
        List<HourPoint> hourPoints,
        double gnomonOffset,
        double longitudeCorrectionMinutes,
        double equationOfTimeMinutes,
        double focusDistance) {

    public DialGeometry {
        hourPoints = List.copyOf(hourPoints);
    }

    /** Semi-minor (north-south) axis in the normalized frame. */
    public double semiMinorAxis() {
        return axisRatio;
    }

    /** Mark for a clock hour, or null when that hour was not requested. */
    public HourPoint hourPoint(double clockHour) {
        for (HourPoint p : hourPoints) {
            if (p.clockHour() == clockHour) return p;
        }
        return null;
    }
}
