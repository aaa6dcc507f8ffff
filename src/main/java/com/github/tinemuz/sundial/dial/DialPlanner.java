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
import java.time.Month;
import java.time.MonthDay;
import java.time.Year;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.SolarDay;
import com.github.tinemuz.sundial.position.SolarPositionEngine;
import com.github.tinemuz.sundial.position.Spa;

/**
 * Connects an {@link AnalemmaticDial} to a solar position engine: computes the
 * declination for dates at the dial's local midnight, lays the dial out for a
 * date or a range of dates, and prepares the year-independent gnomon scale and
 * equation of time chart by averaging over a set of years.
 *
 * <p>Delta-T for each date is the polynomial estimate of
 * {@link ObservationTime#estimateDeltaT(int, int)}.</p>
 */
public final class DialPlanner {
    private static final Logger log = LoggerFactory.getLogger(DialPlanner.class);
    private static final Observer GREENWICH_EQUATOR = Observer.of(0.0, 0.0);

    private final AnalemmaticDial dial;
    private final Observer site;
    private final List<Integer> years;
    private final SolarPositionEngine engine;

    private DialPlanner(
            AnalemmaticDial dial, Observer site, List<Integer> years, SolarPositionEngine engine) {
        this.dial = dial;
        this.site = site;
        this.years = years;
        this.engine = engine;
    }

    /**
     * Planner using the SPA engine.
     *
     * @param elevationM elevation of the dial site, meters
     * @param years      years to average the gnomon scale and chart over
     * @throws IllegalArgumentException if no years are given
     */
    public static DialPlanner of(AnalemmaticDial dial, double elevationM, Collection<Integer> years) {
        if (years == null || years.isEmpty()) {
            throw new IllegalArgumentException("At least one year is required");
        }
        Observer site =
                Observer.of(
                        dial.latitudeDeg(),
                        dial.longitudeDeg(),
                        elevationM,
                        Observer.DEFAULT_PRESSURE_HPA,
                        Observer.DEFAULT_TEMPERATURE_C);
        return new DialPlanner(dial, site, List.copyOf(years), Spa.DEFAULT);
    }

    /** Same planner with another solar position engine. */
    public DialPlanner withEngine(SolarPositionEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("Engine must not be null");
        }
        return new DialPlanner(dial, site, years, engine);
    }

    public AnalemmaticDial dial() {
        return dial;
    }

    public List<Integer> years() {
        return years;
    }

    /** Declination and equation of time at local midnight of {@code date}. */
    public SolarDay solarDay(LocalDate date) {
        return engine.solarDay(localMidnight(date), site);
    }

    /** Dial layout with the gnomon set for {@code date}. */
    public DialGeometry geometry(LocalDate date) {
        return dial.geometry(solarDay(date));
    }

    /**
     * Dial layouts for every date from {@code from} to {@code to}, inclusive,
     * tracing the gnomon's path through the period.
     *
     * @throws IllegalArgumentException if {@code to} is before {@code from}
     */
    public List<DialGeometry> geometrySeries(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before start " + from);
        }
        List<DialGeometry> series = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            series.add(geometry(d));
        }
        return series;
    }

    /**
     * Declination at local midnight of a calendar day averaged over the planner's
     * years. Years in which the day does not exist (February 29th) are skipped.
     *
     * @throws IllegalArgumentException if the day exists in none of the years
     */
    public double averageDeclination(MonthDay day) {
        double sum = 0.0;
        int count = 0;
        for (int year : years) {
            if (!day.isValidYear(year)) continue;
            sum += solarDay(day.atYear(year)).declinationDeg();
            count++;
        }
        if (count == 0) {
            throw new IllegalArgumentException(day + " does not occur in years " + years);
        }
        return sum / count;
    }

    /** Gnomon offset for a calendar day, averaged over the planner's years. */
    public double averageGnomonOffset(MonthDay day) {
        return dial.gnomonOffset(averageDeclination(day));
    }

    /**
     * Marks of the gnomon date scale: the first of every month plus the
     * solstices of June 21st and December 21st, in date order.
     */
    public Map<MonthDay, Double> gnomonSchedule() {
        Map<MonthDay, Double> schedule = new LinkedHashMap<>();
        for (Month month : Month.values()) {
            MonthDay first = MonthDay.of(month, 1);
            schedule.put(first, averageGnomonOffset(first));
            if (month == Month.JUNE || month == Month.DECEMBER) {
                MonthDay solstice = MonthDay.of(month, 21);
                schedule.put(solstice, averageGnomonOffset(solstice));
            }
        }
        return schedule;
    }

    /**
     * Equation of time at 0h UT for every day of a common year, averaged over
     * the planner's years, plus the longitude correction when the dial does not
     * apply it itself.
     */
    public EquationOfTimeChart equationOfTimeChart() {
        log.debug("Computing equation of time chart over {} year(s)", years.size());
        double extra = dial.correctsForLongitude() ? 0.0 : dial.longitudeCorrectionMinutes();
        Map<MonthDay, Double> daily = new LinkedHashMap<>();
        LocalDate start = LocalDate.of(2001, 1, 1);
        int days = Year.of(2001).length();
        for (int i = 0; i < days; i++) {
            MonthDay day = MonthDay.from(start.plusDays(i));
            double sum = 0.0;
            for (int year : years) {
                LocalDate date = day.atYear(year);
                ObservationTime time =
                        ObservationTime.of(
                                date,
                                0,
                                0,
                                0.0,
                                0.0,
                                ObservationTime.estimateDeltaT(date.getYear(), date.getMonthValue()));
                sum += engine.solarDay(time, GREENWICH_EQUATOR).equationOfTimeMinutes();
            }
            daily.put(day, sum / years.size() + extra);
        }
        return new EquationOfTimeChart(daily);
    }

    private ObservationTime localMidnight(LocalDate date) {
        return ObservationTime.of(
                date,
                0,
                0,
                0.0,
                dial.utcOffsetHours(),
                ObservationTime.estimateDeltaT(date.getYear(), date.getMonthValue()));
    }

    @Override
    public String toString() {
        return "DialPlanner[" + dial + ", years=" + years + ", engine=" + engine + "]";
    }
}
