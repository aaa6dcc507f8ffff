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
package com.github.tinemuz.sundial;

import java.time.LocalDate;
import java.time.ZonedDateTime;

import net.e175.klaus.solarpositioning.DeltaT;

import com.github.tinemuz.sundial.ephemeris.JulianDate;

/**
 * Civil date and time of an observation together with its UTC offset and the
 * difference between terrestrial and universal time (delta-T).
 *
 * <p>Dates before 1582-10-15 are read in the Julian calendar, later dates in the
 * Gregorian calendar. The local fields are kept as given; the UTC offset is
 * applied when the Julian day is formed, so an instant may fall on a different
 * UTC date than its local date.</p>
 *
 * <p>{@link LocalDate} and {@link ZonedDateTime} inputs are proleptic Gregorian;
 * the factories taking them convert pre-reform dates to Julian calendar fields.</p>
 */
public final class ObservationTime {
    private static final int MIN_YEAR = -2000;
    private static final int MAX_YEAR = 6000;
    private static final double MAX_UTC_OFFSET_HOURS = 18.0;
    private static final double MAX_DELTA_T_SECONDS = 8000.0;

    // Julian day number of 1970-01-01 and of the first Gregorian day, 1582-10-15
    private static final long EPOCH_JULIAN_DAY = 2440588L;
    private static final LocalDate GREGORIAN_REFORM = LocalDate.of(1582, 10, 15);

    /** Calendar year (astronomical numbering, 0 = 1 BC). */
    public final int year;

    /** Month of year, 1 to 12. */
    public final int month;

    /** Day of month. */
    public final int day;

    /** Local hour, 0 to 24. */
    public final int hour;

    /** Minute, 0 to 59. */
    public final int minute;

    /** Second, 0 inclusive to 60 exclusive. */
    public final double second;

    /** Offset of local time from UTC in hours, negative west of Greenwich. */
    public final double utcOffsetHours;

    /** TT minus UT1 in seconds. */
    public final double deltaTSeconds;

    private ObservationTime(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            double second,
            double utcOffsetHours,
            double deltaTSeconds) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
        this.utcOffsetHours = utcOffsetHours;
        this.deltaTSeconds = deltaTSeconds;
    }

    /**
     * Validated observation time.
     *
     * @param utcOffsetHours local offset from UTC (hours, negative west)
     * @param deltaTSeconds  TT - UT1 in seconds, see {@link #estimateDeltaT(int, int)}
     * @throws InvalidDateException if any field is out of range
     */
    public static ObservationTime of(
            int year,
            int month,
            int day,
            int hour,
            int minute,
            double second,
            double utcOffsetHours,
            double deltaTSeconds) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidDateException(
                    "Year must be within [" + MIN_YEAR + ", " + MAX_YEAR + "], got " + year);
        }
        if (month < 1 || month > 12) {
            throw new InvalidDateException("Month must be within [1, 12], got " + month);
        }
        if (day < 1 || day > daysInMonth(year, month)) {
            throw new InvalidDateException(
                    "Day " + day + " does not exist in " + year + "-" + month);
        }
        if (year == 1582 && month == 10 && day > 4 && day < 15) {
            throw new InvalidDateException(
                    "Dates 1582-10-05 to 1582-10-14 were skipped by the Gregorian reform");
        }
        if (hour < 0 || hour > 24) {
            throw new InvalidDateException("Hour must be within [0, 24], got " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new InvalidDateException("Minute must be within [0, 59], got " + minute);
        }
        if (!(second >= 0.0 && second < 60.0)) {
            throw new InvalidDateException("Second must be within [0, 60), got " + second);
        }
        if (!(Math.abs(utcOffsetHours) <= MAX_UTC_OFFSET_HOURS)) {
            throw new InvalidDateException(
                    "UTC offset must be within +/-" + MAX_UTC_OFFSET_HOURS + " hours, got "
                            + utcOffsetHours);
        }
        if (!(Math.abs(deltaTSeconds) <= MAX_DELTA_T_SECONDS)) {
            throw new InvalidDateException(
                    "Delta-T must be within +/-" + MAX_DELTA_T_SECONDS + " seconds, got "
                            + deltaTSeconds);
        }
        return new ObservationTime(
                year, month, day, hour, minute, second, utcOffsetHours, deltaTSeconds);
    }

    /** Observation time in UTC. */
    public static ObservationTime utc(
            int year, int month, int day, int hour, int minute, double second, double deltaTSeconds) {
        return of(year, month, day, hour, minute, second, 0.0, deltaTSeconds);
    }

    /**
     * Observation time from a zoned date-time. The zone's offset at that instant
     * becomes the UTC offset; sub-second precision is kept. Dates before
     * 1582-10-15 are converted from the proleptic Gregorian calendar to the
     * Julian calendar, so the instant is preserved.
     */
    public static ObservationTime of(ZonedDateTime dateTime, double deltaTSeconds) {
        double offsetHours = dateTime.getOffset().getTotalSeconds() / 3600.0;
        double second = dateTime.getSecond() + dateTime.getNano() / 1e9;
        return of(
                dateTime.toLocalDate(),
                dateTime.getHour(),
                dateTime.getMinute(),
                second,
                offsetHours,
                deltaTSeconds);
    }

    /**
     * Observation time on an ISO date. Dates before 1582-10-15 are converted to
     * the Julian calendar fields of the same day.
     *
     * @throws InvalidDateException if any field is out of range
     */
    public static ObservationTime of(
            LocalDate date,
            int hour,
            int minute,
            double second,
            double utcOffsetHours,
            double deltaTSeconds) {
        int year = date.getYear();
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();
        if (date.isBefore(GREGORIAN_REFORM)) {
            JulianDate.CalendarDate julian =
                    JulianDate.toCalendar(date.toEpochDay() + EPOCH_JULIAN_DAY);
            year = julian.year();
            month = julian.month();
            day = (int) Math.floor(julian.day());
        }
        return of(year, month, day, hour, minute, second, utcOffsetHours, deltaTSeconds);
    }

    /**
     * Polynomial estimate of delta-T (Espenak and Meeus) for the first day of
     * the given month.
     *
     * @throws InvalidDateException if the year is outside [-2000, 6000] or the
     *     month is not 1 to 12
     */
    public static double estimateDeltaT(int year, int month) {
        if (year < MIN_YEAR || year > MAX_YEAR || month < 1 || month > 12) {
            throw new InvalidDateException(
                    "Delta-T can only be estimated for years within [" + MIN_YEAR + ", "
                            + MAX_YEAR + "] and months 1 to 12, got " + year + "-" + month);
        }
        return DeltaT.estimate(LocalDate.of(year, month, 1));
    }

    /** Same local date and offset at a different time of day. */
    public ObservationTime withTime(int hour, int minute, double second) {
        return of(year, month, day, hour, minute, second, utcOffsetHours, deltaTSeconds);
    }

    /**
     * Local civil date as an ISO date. Julian calendar dates before the reform
     * are converted, so 1500-02-29 becomes 1500-03-10.
     */
    public LocalDate localDate() {
        if (!isJulianCalendar()) {
            return LocalDate.of(year, month, day);
        }
        long julianDayNumber = Math.round(JulianDate.julianDay(year, month, day, 12, 0, 0.0, 0.0));
        return LocalDate.ofEpochDay(julianDayNumber - EPOCH_JULIAN_DAY);
    }

    private boolean isJulianCalendar() {
        return year < 1582 || (year == 1582 && (month < 10 || (month == 10 && day < 15)));
    }

    /** Local hour of day including minutes and seconds. */
    public double fractionalHour() {
        return hour + (minute + second / 60.0) / 60.0;
    }

    /** Days in the month, using the Julian leap rule before 1583 and Gregorian after. */
    public static int daysInMonth(int year, int month) {
        switch (month) {
            case 2:
                return isLeapYear(year) ? 29 : 28;
            case 4:
            case 6:
            case 9:
            case 11:
                return 30;
            default:
                return 31;
        }
    }

    /** Leap year test in the calendar in force for the given year. */
    public static boolean isLeapYear(int year) {
        if (year <= 1582) {
            return Math.floorMod(year, 4) == 0;
        }
        return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
    }

    @Override
    public String toString() {
        return String.format(
                "%04d-%02d-%02d %02d:%02d:%06.3f UTC%+.2f dT=%.1fs",
                year, month, day, hour, minute, second, utcOffsetHours, deltaTSeconds);
    }
}
