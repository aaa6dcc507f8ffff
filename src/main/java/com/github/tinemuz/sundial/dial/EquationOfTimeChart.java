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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily clock correction for reading an analemmatic dial: the equation of time
 * plus, for dials that do not apply it themselves, the longitude correction.
 * Values are minutes to add to dial time to get clock time, one per calendar
 * day of a common year.
 */
public final class EquationOfTimeChart {
    private final Map<MonthDay, Double> daily;
    private final List<MonthDay> turningPoints;
    private final Map<MonthDay, Double> significant;

    EquationOfTimeChart(Map<MonthDay, Double> daily) {
        this.daily = Collections.unmodifiableMap(new LinkedHashMap<>(daily));
        this.turningPoints = findTurningPoints(this.daily);
        Map<MonthDay, Double> marks = new TreeMap<>();
        for (Map.Entry<MonthDay, Double> e : this.daily.entrySet()) {
            if (e.getKey().getDayOfMonth() == 1) {
                marks.put(e.getKey(), e.getValue());
            }
        }
        for (MonthDay day : turningPoints) {
            marks.put(day, this.daily.get(day));
        }
        this.significant = Collections.unmodifiableMap(marks);
    }

    /** Correction for every day, January 1st to December 31st. */
    public Map<MonthDay, Double> daily() {
        return daily;
    }

    /** Correction on the first of each month and at the turning points, in date order. */
    public Map<MonthDay, Double> significant() {
        return significant;
    }

    /** Days where the correction reaches a local maximum or minimum. */
    public List<MonthDay> turningPoints() {
        return turningPoints;
    }

    /**
     * Correction on a given day. February 29th uses the value of February 28th.
     *
     * @throws IllegalArgumentException if the day is not part of the chart
     */
    public double valueOn(MonthDay day) {
        MonthDay key = day.equals(MonthDay.of(2, 29)) ? MonthDay.of(2, 28) : day;
        Double value = daily.get(key);
        if (value == null) {
            throw new IllegalArgumentException("No equation of time value for " + day);
        }
        return value;
    }

    private static List<MonthDay> findTurningPoints(Map<MonthDay, Double> daily) {
        List<MonthDay> days = new ArrayList<>(daily.keySet());
        List<MonthDay> turning = new ArrayList<>();
        for (int i = 1; i < days.size() - 1; i++) {
            double before = daily.get(days.get(i)) - daily.get(days.get(i - 1));
            double after = daily.get(days.get(i + 1)) - daily.get(days.get(i));
            if ((before > 0 && after <= 0) || (before < 0 && after >= 0)) {
                turning.add(days.get(i));
            }
        }
        return Collections.unmodifiableList(turning);
    }
}
