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

import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain text report of a dial laid out at a physical width: axis lengths, the
 * longitude correction, the gnomon position and the angle and coordinates of
 * each hour mark. {@link #render(DialGeometry, Map, EquationOfTimeChart)} adds
 * the gnomon date scale and the significant equation of time values.
 */
public final class DialReport implements DialRenderer<String> {
    private static final DateTimeFormatter DAY_FORMAT =
            DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);

    private final double width;

    /**
     * @param width full east-west width of the dial, in the unit the report should use
     * @throws IllegalArgumentException if the width is not positive
     */
    public DialReport(double width) {
        if (!(width > 0.0) || Double.isInfinite(width)) {
            throw new IllegalArgumentException("Dial width must be positive, got " + width);
        }
        this.width = width;
    }

    @Override
    public String render(DialGeometry geometry) {
        return String.join("\n", lines(geometry));
    }

    /** Report including the gnomon date scale and the equation of time chart. */
    public String render(
            DialGeometry geometry, Map<MonthDay, Double> gnomonSchedule, EquationOfTimeChart chart) {
        List<String> lines = new ArrayList<>();
        lines.add(header(geometry));
        if (geometry.longitudeCorrectionMinutes() != 0.0) {
            lines.add("Longitude correction: " + round(geometry.longitudeCorrectionMinutes()));
        }
        for (Map.Entry<MonthDay, Double> e : gnomonSchedule.entrySet()) {
            lines.add(
                    "For " + DAY_FORMAT.format(e.getKey()) + ", the gnomon should move "
                            + round(e.getValue() * width / 2.0) + " forwards");
        }
        lines.addAll(hourLines(geometry));
        for (Map.Entry<MonthDay, Double> e : chart.significant().entrySet()) {
            lines.add(
                    "For " + DAY_FORMAT.format(e.getKey()) + ", the equation of time (EOT) is "
                            + round(e.getValue()) + " minutes");
        }
        return String.join("\n", lines);
    }

    private List<String> lines(DialGeometry geometry) {
        List<String> lines = new ArrayList<>();
        lines.add(header(geometry));
        if (geometry.longitudeCorrectionMinutes() != 0.0) {
            lines.add("Longitude correction: " + round(geometry.longitudeCorrectionMinutes()));
        }
        if (geometry.equationOfTimeMinutes() != 0.0) {
            lines.add("Equation of time correction: " + round(geometry.equationOfTimeMinutes()));
        }
        if (geometry.date() != null) {
            lines.add(
                    "For " + geometry.date() + ", the gnomon should move "
                            + round(geometry.gnomonOffset() * width / 2.0) + " forwards");
        }
        lines.addAll(hourLines(geometry));
        return lines;
    }

    private String header(DialGeometry geometry) {
        return "Width: " + round(width) + ", Height: " + round(geometry.axisRatio() * width)
                + ", Foci: +/-" + round(geometry.focusDistance() * width / 2.0);
    }

    private List<String> hourLines(DialGeometry geometry) {
        List<String> lines = new ArrayList<>();
        for (HourPoint point : geometry.hourPoints()) {
            HourPoint scaled = point.scaled(width);
            lines.add(
                    "The angle for hour " + formatHour(point.clockHour()) + " is "
                            + round(point.dialAngleDeg()) + " and the coordinates: ("
                            + round(scaled.x()) + ", " + round(scaled.y()) + ")");
        }
        return lines;
    }

    private static String formatHour(double hour) {
        return hour == Math.rint(hour) ? Integer.toString((int) hour) : round(hour);
    }

    private static String round(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
