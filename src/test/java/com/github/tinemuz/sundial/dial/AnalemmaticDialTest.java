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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.sundial.DegenerateGeometryException;
import com.github.tinemuz.sundial.InvalidObserverException;
import com.github.tinemuz.sundial.SolarDay;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AnalemmaticDialTest {

    private static final double WIDTH = 5.0;
    private static final double ANGLE_TOLERANCE = 0.01; // degrees
    private static final double LENGTH_TOLERANCE = 0.005; // meters at WIDTH

    @Nested
    @DisplayName("Hour marks")
    class HourMarkTests {

        @Test
        @DisplayName("Los Angeles without corrections")
        void northernHemisphere() {
            AnalemmaticDial dial = AnalemmaticDial.builder(34, -118).utcOffsetHours(-7).build();

            HourPoint one = dial.hourPoint(13, 0).scaled(WIDTH);
            assertEquals(25.602, one.dialAngleDeg(), ANGLE_TOLERANCE);
            assertEquals(0.646, one.x(), LENGTH_TOLERANCE);
            assertEquals(1.349, one.y(), LENGTH_TOLERANCE);

            HourPoint midnight = dial.hourPoint(0, 0).scaled(WIDTH);
            assertEquals(180.0, Math.abs(midnight.dialAngleDeg()), ANGLE_TOLERANCE);
            assertEquals(0.0, midnight.x(), LENGTH_TOLERANCE);
            assertEquals(-1.398, midnight.y(), LENGTH_TOLERANCE);
        }

        @Test
        @DisplayName("Southern hemisphere corrected for longitude")
        void southernHemisphere() {
            AnalemmaticDial dial =
                    AnalemmaticDial.builder(-34, 118)
                            .utcOffsetHours(7)
                            .correctForLongitude(true)
                            .build();
            assertEquals(52.0, dial.longitudeCorrectionMinutes(), 1e-9);

            HourPoint noon = dial.hourPoint(12, 0).scaled(WIDTH);
            assertEquals(-22.434, noon.dialAngleDeg(), ANGLE_TOLERANCE);
            assertEquals(-0.562, noon.x(), LENGTH_TOLERANCE);
            assertEquals(1.361, noon.y(), LENGTH_TOLERANCE);

            HourPoint midnight = dial.hourPoint(0, 0).scaled(WIDTH);
            assertEquals(157.566, midnight.dialAngleDeg(), ANGLE_TOLERANCE);
            assertEquals(0.562, midnight.x(), LENGTH_TOLERANCE);
            assertEquals(-1.361, midnight.y(), LENGTH_TOLERANCE);
        }

        @Test
        @DisplayName("Morning and afternoon marks mirror about the meridian")
        void symmetry() {
            AnalemmaticDial dial = AnalemmaticDial.builder(51.5, 0).build();
            for (int offset = 1; offset <= 6; offset++) {
                HourPoint am = dial.hourPoint(12 - offset, 0);
                HourPoint pm = dial.hourPoint(12 + offset, 0);
                assertEquals(-am.x(), pm.x(), 1e-12);
                assertEquals(am.y(), pm.y(), 1e-12);
                assertEquals(-am.dialAngleDeg(), pm.dialAngleDeg(), 1e-9);
            }
        }

        @Test
        @DisplayName("Marks lie on the dial ellipse")
        void onEllipse() {
            AnalemmaticDial dial = AnalemmaticDial.builder(-41.3, 174.8).utcOffsetHours(12).build();
            double k = dial.axisRatio();
            for (HourPoint p : dial.hourPoints(0)) {
                assertEquals(1.0, p.x() * p.x() + (p.y() / k) * (p.y() / k), 1e-12);
            }
        }

        @Test
        @DisplayName("Equation of time shifts the marks only when enabled")
        void equationOfTime() {
            AnalemmaticDial plain = AnalemmaticDial.builder(45, 0).build();
            AnalemmaticDial corrected =
                    AnalemmaticDial.builder(45, 0).correctForEquationOfTime(true).build();

            assertEquals(plain.hourPoint(12, 0).x(), plain.hourPoint(12, 15).x(), 0.0);
            assertEquals(
                    plain.hourPoint(12.25, 0).x(), corrected.hourPoint(12, 15).x(), 1e-12);
        }

        @Test
        @DisplayName("Configured hours are laid out in order")
        void configuredHours() {
            AnalemmaticDial dial = AnalemmaticDial.builder(45, 0).hours(6, 9, 12, 15, 18).build();
            List<HourPoint> points = dial.hourPoints(0);
            assertEquals(5, points.size());
            assertEquals(6.0, points.get(0).clockHour());
            assertEquals(18.0, points.get(4).clockHour());
        }
    }

    @Nested
    @DisplayName("Ellipse and gnomon")
    class GeometryTests {

        @Test
        @DisplayName("Axis ratio is the sine of the latitude")
        void axisRatio() {
            AnalemmaticDial dial = AnalemmaticDial.builder(30, 0).build();
            assertEquals(0.5, dial.axisRatio(), 1e-12);
            assertEquals(Math.sqrt(0.75), dial.focusDistance(), 1e-12);
            assertEquals(0.5, AnalemmaticDial.builder(-30, 0).build().axisRatio(), 1e-12);
        }

        @Test
        @DisplayName("Gnomon sits at the center at the equinoxes")
        void equinox() {
            AnalemmaticDial dial = AnalemmaticDial.builder(34, -118).build();
            assertEquals(0.0, dial.gnomonOffset(0.0), 1e-12);
        }

        @Test
        @DisplayName("Gnomon at the solstices")
        void solstices() {
            AnalemmaticDial dial = AnalemmaticDial.builder(34, -118).build();
            assertEquals(0.898, dial.gnomonOffset(23.44) * WIDTH / 2, LENGTH_TOLERANCE);
            assertEquals(-0.898, dial.gnomonOffset(-23.44) * WIDTH / 2, LENGTH_TOLERANCE);
        }

        @Test
        @DisplayName("Solstice gnomon stays within the minor axis outside the tropics")
        void solsticeWithinMinorAxis() {
            for (int latitude = 24; latitude <= 89; latitude++) {
                AnalemmaticDial dial = AnalemmaticDial.builder(latitude, 0).build();
                assertTrue(
                        Math.abs(dial.gnomonOffset(23.44)) <= dial.axisRatio(),
                        "Latitude " + latitude);
            }
            AnalemmaticDial tropical = AnalemmaticDial.builder(10, 0).build();
            assertTrue(Math.abs(tropical.gnomonOffset(23.44)) > tropical.axisRatio());
        }

        @Test
        @DisplayName("Southern gnomon moves the other way")
        void southernGnomon() {
            AnalemmaticDial north = AnalemmaticDial.builder(34, 0).build();
            AnalemmaticDial south = AnalemmaticDial.builder(-34, 0).build();
            assertEquals(-north.gnomonOffset(20), south.gnomonOffset(20), 1e-12);
        }

        @Test
        @DisplayName("Geometry carries the date and the applied corrections")
        void geometry() {
            AnalemmaticDial dial =
                    AnalemmaticDial.builder(-34, 118)
                            .utcOffsetHours(7)
                            .correctForLongitude(true)
                            .correctForEquationOfTime(true)
                            .build();
            SolarDay day = new SolarDay(LocalDate.of(2024, 2, 11), -14.0, -14.2);
            DialGeometry g = dial.geometry(day);

            assertEquals(LocalDate.of(2024, 2, 11), g.date());
            assertEquals(52.0, g.longitudeCorrectionMinutes(), 1e-9);
            assertEquals(-14.2, g.equationOfTimeMinutes(), 1e-12);
            assertEquals(dial.gnomonOffset(-14.0), g.gnomonOffset(), 1e-12);
            assertEquals(24, g.hourPoints().size());
            assertEquals(dial.axisRatio(), g.semiMinorAxis());
            assertNotNull(g.hourPoint(12));
            assertNull(g.hourPoint(12.5));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Rejects the equator and the poles")
        void degenerate() {
            assertThrows(DegenerateGeometryException.class, () -> AnalemmaticDial.builder(0.0, 0).build());
            assertThrows(DegenerateGeometryException.class, () -> AnalemmaticDial.builder(0.05, 0).build());
            assertThrows(DegenerateGeometryException.class, () -> AnalemmaticDial.builder(90, 0).build());
            assertThrows(DegenerateGeometryException.class, () -> AnalemmaticDial.builder(-89.95, 0).build());
            assertDoesNotThrow(() -> AnalemmaticDial.builder(0.1, 0).build());
        }

        @Test
        @DisplayName("Rejects coordinates, offsets and hours out of range")
        void outOfRange() {
            assertThrows(InvalidObserverException.class, () -> AnalemmaticDial.builder(91, 0).build());
            assertThrows(InvalidObserverException.class, () -> AnalemmaticDial.builder(45, 181).build());
            assertThrows(IllegalArgumentException.class,
                    () -> AnalemmaticDial.builder(45, 0).utcOffsetHours(19).build());
            assertThrows(IllegalArgumentException.class,
                    () -> AnalemmaticDial.builder(45, 0).hours(24).build());
        }
    }
}
