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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.sundial.InvalidDateException;
import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.SolarDay;
import com.github.tinemuz.sundial.SurfaceOrientation;
import com.github.tinemuz.sundial.TopocentricPosition;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import net.e175.klaus.solarpositioning.AzimuthZenithAngle;
import net.e175.klaus.solarpositioning.SPA;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SpaTest {

    private static final double ANGLE_TOLERANCE = 1e-5; // degrees
    private static final double MINUTE = 1.0 / 60.0; // hours

    private static final ObservationTime NREL_TIME =
            ObservationTime.of(2003, 10, 17, 12, 30, 30, -7, 67);
    private static final Observer NREL_SITE = Observer.of(39.742476, -105.1786, 1830.14, 820, 11);
    private static final SurfaceOrientation NREL_SURFACE = new SurfaceOrientation(30, -10);

    @Nested
    @DisplayName("NREL reference example")
    class ReferenceTests {

        @Test
        @DisplayName("Topocentric zenith, azimuth and incidence")
        void position() {
            SpaResult r = Spa.DEFAULT.calculate(NREL_TIME, NREL_SITE, NREL_SURFACE);

            assertEquals(50.11162, r.position.zenith, ANGLE_TOLERANCE);
            assertEquals(194.34024, r.position.azimuth, ANGLE_TOLERANCE);
            assertEquals(14.34024, r.position.astronomersAzimuth, ANGLE_TOLERANCE);
            assertEquals(25.18700, r.position.incidence, ANGLE_TOLERANCE);
            assertEquals(90.0 - r.position.zenith, r.position.elevation, 1e-9);
        }

        @Test
        @DisplayName("Topocentric equatorial coordinates")
        void topocentricEquatorial() {
            TopocentricPosition p = Spa.DEFAULT.position(NREL_TIME, NREL_SITE);
            assertEquals(202.22704, p.rightAscension, ANGLE_TOLERANCE);
            assertEquals(-9.316179, p.declination, ANGLE_TOLERANCE);
            assertEquals(11.10629, p.hourAngle, ANGLE_TOLERANCE);
            assertEquals(39.872046, p.uncorrectedElevation, ANGLE_TOLERANCE);
        }

        @Test
        @DisplayName("Horizontal surface incidence equals the zenith")
        void horizontalIncidence() {
            SpaResult r = Spa.DEFAULT.calculate(NREL_TIME, NREL_SITE);
            assertEquals(r.position.zenith, r.position.incidence, 1e-9);
        }

        @Test
        @DisplayName("Sunrise, transit and sunset")
        void sunTimes() {
            SunTimes t = Spa.DEFAULT.calculate(NREL_TIME, NREL_SITE).sunTimes;

            assertEquals(SunTimes.Type.NORMAL, t.type());
            assertEquals(6.212067, t.sunriseHours(), MINUTE);
            assertEquals(11.768045, t.transitHours(), MINUTE);
            assertEquals(17.338667, t.sunsetHours(), MINUTE);
            assertEquals(11.1266, t.dayLengthHours(), 2 * MINUTE);
        }

        @Test
        @DisplayName("Equation of time and UTC date")
        void equationOfTime() {
            SpaResult r = Spa.DEFAULT.calculate(NREL_TIME, NREL_SITE);
            assertTrue(
                    r.equationOfTimeMinutes > 14.5 && r.equationOfTimeMinutes < 14.8,
                    "EOT " + r.equationOfTimeMinutes);
            assertEquals(2003, r.utcDate.year());
            assertEquals(10, r.utcDate.month());
            assertEquals(17.8128, r.utcDate.day(), 1e-3);
            assertEquals(0.9965422974, r.radiusVector(), 1e-8);
        }
    }

    @Nested
    @DisplayName("Agreement with the solarpositioning library")
    class CrossCheckTests {

        @Test
        @DisplayName("Positions agree for sites around the globe")
        void agreesWithLibrary() {
            double[][] sites = {
                {51.5074, -0.1278, 11},
                {35.6762, 139.6503, 40},
                {-33.8688, 151.2093, 58},
                {64.1466, -21.9426, 0},
                {-1.2921, 36.8219, 1795}
            };
            int[][] times = {{2021, 3, 20, 9}, {2022, 6, 21, 15}, {2023, 12, 1, 12}};
            for (double[] s : sites) {
                for (int[] t : times) {
                    double deltaT = 69.0;
                    ObservationTime time = ObservationTime.utc(t[0], t[1], t[2], t[3], 0, 0, deltaT);
                    Observer observer = Observer.of(s[0], s[1], s[2], 1010, 11);
                    TopocentricPosition ours = Spa.DEFAULT.position(time, observer);

                    ZonedDateTime dateTime = ZonedDateTime.of(t[0], t[1], t[2], t[3], 0, 0, 0, ZoneOffset.UTC);
                    AzimuthZenithAngle theirs =
                            SPA.calculateSolarPosition(dateTime, s[0], s[1], s[2], deltaT, 1010, 11);

                    String where = s[0] + "," + s[1] + " at " + t[0] + "-" + t[1] + "-" + t[2];
                    assertEquals(theirs.getZenithAngle(), ours.zenith, 1e-3, "Zenith " + where);
                    double azimuthDiff = Math.abs(theirs.getAzimuth() - ours.azimuth);
                    assertTrue(
                            Math.min(azimuthDiff, 360.0 - azimuthDiff) < 1e-3,
                            "Azimuth " + where + ": " + theirs.getAzimuth() + " vs " + ours.azimuth);
                }
            }
        }
    }

    @Nested
    @DisplayName("Year 100 on a tilted surface below sea level")
    class AncientReferenceTests {

        // ISO 100-01-05 is Julian 100-01-07; the reference treats the date as proleptic Gregorian
        private final ObservationTime time =
                ObservationTime.of(LocalDate.of(100, 1, 5), 7, 0, 0, 0, 67);
        private final Observer site = Observer.of(30, 90, -1000, 30, -20);
        private final SpaResult result = Spa.DEFAULT.calculate(time, site, new SurfaceOrientation(359, 1));

        private static final double REPORTED = 1.5e-3;

        @Test
        @DisplayName("Local fields follow the Julian calendar")
        void julianFields() {
            assertEquals(100, time.year);
            assertEquals(1, time.month);
            assertEquals(7, time.day);
            assertEquals(100, result.utcDate.year());
            assertEquals(1, result.utcDate.month());
            assertEquals(7.292, result.utcDate.day(), 1e-3);
        }

        @Test
        @DisplayName("Position and incidence")
        void position() {
            assertEquals(55.09, result.position.incidence, REPORTED);
            assertEquals(54.116, result.position.zenith, REPORTED);
            assertEquals(194.299, result.position.azimuth, REPORTED);
            assertEquals(-22.759, result.position.declination, REPORTED);
            assertEquals(12.533, result.position.hourAngle, REPORTED);
            assertEquals(286.957, result.position.rightAscension, REPORTED);
            assertEquals(35.884, result.position.elevation, REPORTED);
        }

        @Test
        @DisplayName("Equation of time and sun times")
        void sunTimes() {
            assertEquals(-9.977, result.equationOfTimeMinutes, REPORTED);
            assertEquals(SunTimes.Type.NORMAL, result.sunTimes.type());
            assertEquals(6.164, result.sunTimes.transitHours(), REPORTED);
            assertEquals(1.027, result.sunTimes.sunriseHours(), REPORTED);
            assertEquals(11.304, result.sunTimes.sunsetHours(), REPORTED);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("Midnight on the equator puts the sun below the horizon")
        void midnightEquator() {
            ObservationTime time = ObservationTime.utc(2020, 12, 31, 23, 59, 59, 69);
            TopocentricPosition p = Spa.DEFAULT.position(time, Observer.of(0, 0, 0, 1000, 10));
            assertTrue(p.zenith > 156 && p.zenith < 158, "Zenith " + p.zenith);
            assertTrue(p.azimuth > 170 && p.azimuth < 195, "Azimuth " + p.azimuth);
        }

        @Test
        @DisplayName("Midnight sun above the Arctic circle")
        void midnightSun() {
            ObservationTime time = ObservationTime.of(2022, 6, 21, 12, 0, 0, 1, 69);
            SunTimes t = Spa.DEFAULT.sunTimes(time, Observer.of(78.22, 15.65));
            assertEquals(SunTimes.Type.ALWAYS_ABOVE, t.type());
            assertTrue(Double.isNaN(t.sunriseHours()));
            assertTrue(Double.isNaN(t.sunsetHours()));
            assertFalse(Double.isNaN(t.transitHours()), "Transit is still reported");
            assertEquals(24.0, t.dayLengthHours());
        }

        @Test
        @DisplayName("Polar night in the Arctic winter")
        void polarNight() {
            ObservationTime time = ObservationTime.of(2022, 12, 21, 12, 0, 0, 1, 69);
            SunTimes t = Spa.DEFAULT.sunTimes(time, Observer.of(78.22, 15.65));
            assertEquals(SunTimes.Type.ALWAYS_BELOW, t.type());
            assertEquals(0.0, t.dayLengthHours());
        }

        @Test
        @DisplayName("Poles give finite positions")
        void poles() {
            ObservationTime time = ObservationTime.utc(2022, 6, 21, 12, 0, 0, 69);
            TopocentricPosition north = Spa.DEFAULT.position(time, Observer.of(90, 0));
            TopocentricPosition south = Spa.DEFAULT.position(time, Observer.of(-90, 0));
            assertTrue(Double.isFinite(north.zenith) && Double.isFinite(north.azimuth));
            assertTrue(Double.isFinite(south.zenith) && Double.isFinite(south.azimuth));
            assertEquals(90.0 - 23.44, north.zenith, 0.1);
        }

        @Test
        @DisplayName("Ranges of zenith and azimuth hold through a day")
        void ranges() {
            Observer observer = Observer.of(-45.0, 170.0);
            for (int hour = 0; hour < 24; hour++) {
                TopocentricPosition p =
                        Spa.DEFAULT.position(ObservationTime.utc(2021, 9, 1, hour, 0, 0, 69), observer);
                assertTrue(p.zenith >= 0 && p.zenith <= 180, "Zenith " + p.zenith);
                assertTrue(p.azimuth >= 0 && p.azimuth < 360, "Azimuth " + p.azimuth);
                assertTrue(p.declination >= -90 && p.declination <= 90);
            }
        }

        @Test
        @DisplayName("Solar day of a Julian leap day carries its ISO date")
        void julianLeapDaySolarDay() {
            ObservationTime time = ObservationTime.utc(1500, 2, 29, 12, 0, 0, 0);
            Observer observer = Observer.of(40, 0);
            SolarDay spa = Spa.DEFAULT.solarDay(time, observer);
            assertEquals(LocalDate.of(1500, 3, 10), spa.date());
            assertEquals(Spa.DEFAULT.position(time, observer).declination, spa.declinationDeg(), 1e-12);
            assertEquals(LocalDate.of(1500, 3, 10), Solpos.DEFAULT.solarDay(time, observer).date());
            assertEquals(LocalDate.of(1500, 3, 10), Sampa.DEFAULT.solarDay(time, observer).date());
        }

        @Test
        @DisplayName("The Gregorian reform skips ten days but no time")
        void gregorianReform() {
            Observer observer = Observer.of(41.9, 12.5);
            assertThrows(
                    InvalidDateException.class,
                    () -> Spa.DEFAULT.position(ObservationTime.utc(1582, 10, 10, 12, 0, 0, 0), observer));
            SpaResult before = Spa.DEFAULT.calculate(ObservationTime.utc(1582, 10, 4, 12, 0, 0, 0), observer);
            SpaResult after = Spa.DEFAULT.calculate(ObservationTime.utc(1582, 10, 15, 12, 0, 0, 0), observer);
            assertEquals(1.0, after.ephemeris.time.jd - before.ephemeris.time.jd, 1e-9);
            double declinationStep = after.position.declination - before.position.declination;
            assertTrue(declinationStep < -0.3 && declinationStep > -0.5, "Step " + declinationStep);
        }

        @Test
        @DisplayName("Incidence stays defined when the sun is on the surface normal")
        void incidenceOnNormal() {
            SurfaceOrientation surface = new SurfaceOrientation(30, 45);
            double incidence = Topocentric.incidence(30, 45, surface);
            assertFalse(Double.isNaN(incidence));
            assertEquals(0.0, incidence, 1e-6);
            assertEquals(180.0, Topocentric.incidence(150, 45 + 180, surface), 1e-6);
        }

        @Test
        @DisplayName("Ancient and far future dates compute")
        void extremeYears() {
            Observer observer = Observer.of(30.0, 30.0);
            assertTrue(Double.isFinite(
                    Spa.DEFAULT.position(ObservationTime.utc(-2000, 1, 1, 12, 0, 0, 0), observer).zenith));
            assertTrue(Double.isFinite(
                    Spa.DEFAULT.position(ObservationTime.utc(6000, 12, 31, 12, 0, 0, 0), observer).zenith));
        }
    }

    @Nested
    @DisplayName("Engine behavior")
    class EngineTests {

        @Test
        @DisplayName("Repeated calls give identical results")
        void idempotent() {
            TopocentricPosition a = Spa.DEFAULT.position(NREL_TIME, NREL_SITE);
            TopocentricPosition b = Spa.DEFAULT.position(NREL_TIME, NREL_SITE);
            assertEquals(a.zenith, b.zenith, 0.0);
            assertEquals(a.azimuth, b.azimuth, 0.0);
        }

        @Test
        @DisplayName("Truncated engine stays within a twentieth of a degree")
        void truncated() {
            Spa truncated = Spa.withTermLimit(10);
            assertEquals(10, truncated.termLimit());
            TopocentricPosition full = Spa.DEFAULT.position(NREL_TIME, NREL_SITE);
            TopocentricPosition reduced = truncated.position(NREL_TIME, NREL_SITE);
            assertEquals(full.zenith, reduced.zenith, 0.05);
            assertEquals(full.azimuth, reduced.azimuth, 0.05);
        }

        @Test
        @DisplayName("Rejects a term limit below one")
        void rejectsTermLimit() {
            assertThrows(IllegalArgumentException.class, () -> Spa.withTermLimit(0));
        }

        @Test
        @DisplayName("Solar day carries the local date, declination and EOT")
        void solarDay() {
            SolarDay day = Spa.DEFAULT.solarDay(NREL_TIME, NREL_SITE);
            assertEquals(LocalDate.of(2003, 10, 17), day.date());
            assertEquals(-9.316179, day.declinationDeg(), 1e-5);
            assertTrue(day.equationOfTimeMinutes() > 14.5 && day.equationOfTimeMinutes() < 14.8);
        }

        @Test
        @DisplayName("Concurrent use gives the same result as sequential use")
        void threadSafety() throws InterruptedException {
            TopocentricPosition expected = Spa.DEFAULT.position(NREL_TIME, NREL_SITE);
            AtomicReference<Throwable> failure = new AtomicReference<>();
            List<Thread> threads = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                Thread t =
                        new Thread(
                                () -> {
                                    try {
                                        for (int j = 0; j < 50; j++) {
                                            TopocentricPosition p =
                                                    Spa.DEFAULT.position(NREL_TIME, NREL_SITE);
                                            if (p.zenith != expected.zenith) {
                                                throw new AssertionError("Zenith " + p.zenith);
                                            }
                                        }
                                    } catch (Throwable e) {
                                        failure.compareAndSet(null, e);
                                    }
                                });
                threads.add(t);
                t.start();
            }
            for (Thread t : threads) {
                t.join();
            }
            assertNull(failure.get(), () -> "Concurrent failure: " + failure.get());
        }
    }
}
