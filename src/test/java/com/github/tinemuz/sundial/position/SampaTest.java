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

import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.irradiance.AtmosphericComposition;
import com.github.tinemuz.sundial.irradiance.IrradianceResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SampaTest {

    private static final double DELTA_T = 67.0;
    private static final double ANGLE_TOLERANCE = 0.01; // degrees
    private static final double RADIUS_TOLERANCE = 0.002; // degrees
    private static final double IRRADIANCE_TOLERANCE = 0.5; // W/m^2

    @Nested
    @DisplayName("Eclipse classification")
    class EclipseTests {

        @Test
        @DisplayName("Total eclipse over the western Pacific, 2016-03-09")
        void totalEclipse() {
            SampaResult r =
                    Sampa.DEFAULT.calculate(
                            ObservationTime.utc(2016, 3, 9, 1, 58, 19, DELTA_T),
                            Observer.of(10.1, 148.8, 100, 1000, 25));

            assertEquals(15.082, r.sun.zenith, ANGLE_TOLERANCE);
            assertEquals(163.508, r.sun.azimuth, ANGLE_TOLERANCE);
            assertEquals(15.08, r.moon.zenith, ANGLE_TOLERANCE);
            assertEquals(163.488, r.moon.azimuth, ANGLE_TOLERANCE);
            assertEquals(0.268, r.sunRadius, RADIUS_TOLERANCE);
            assertEquals(0.281, r.moonRadius, RADIUS_TOLERANCE);
            assertEquals(EclipseType.TOTAL, r.eclipse);
            assertEquals(0.0, r.unshadedPercent, 1e-9);

            assertIrradiance(r.irradiance, 1001.167, 1062.697, 96.013);
            assertIrradiance(r.unshadedIrradiance, 0.0, 81.056, 81.056);
        }

        @Test
        @DisplayName("Partial eclipse over Patagonia, 2020-12-14")
        void partialEclipse() {
            SampaResult r =
                    Sampa.DEFAULT.calculate(
                            ObservationTime.utc(2020, 12, 14, 16, 19, 0, DELTA_T),
                            Observer.of(-40.3, -67.9, 0, 10, 0));

            assertEquals(17.116, r.sun.zenith, ANGLE_TOLERANCE);
            assertEquals(5.897, r.sun.azimuth, ANGLE_TOLERANCE);
            assertEquals(17.11, r.moon.zenith, ANGLE_TOLERANCE);
            assertEquals(6.01, r.moon.azimuth, ANGLE_TOLERANCE);
            assertEquals(EclipseType.PARTIAL, r.eclipse);
            assertEquals(5.582, r.unshadedPercent, 0.3);

            assertIrradiance(r.irradiance, 1123.668, 1132.799, 58.894);
            assertEquals(62.718, r.unshadedIrradiance.directNormal, 4.0);
            assertEquals(
                    r.irradiance.directNormal * r.unshadedPercent / 100.0,
                    r.unshadedIrradiance.directNormal,
                    1e-9);
        }

        @Test
        @DisplayName("No eclipse with the moon below the horizon")
        void noEclipse() {
            SampaResult r =
                    Sampa.DEFAULT.calculate(
                            ObservationTime.utc(2019, 1, 2, 3, 5, 55, DELTA_T),
                            Observer.of(-23.923, -130.741, -100, 2000, -10));

            assertEquals(84.636, r.sun.zenith, ANGLE_TOLERANCE);
            assertEquals(247.099, r.sun.azimuth, ANGLE_TOLERANCE);
            assertEquals(126.629, r.moon.zenith, ANGLE_TOLERANCE);
            assertEquals(227.878, r.moon.azimuth, ANGLE_TOLERANCE);
            assertEquals(EclipseType.NONE, r.eclipse);
            assertEquals(100.0, r.unshadedPercent, 1e-9);

            assertIrradiance(r.irradiance, 409.514, 61.04, 22.755);
            assertIrradiance(r.unshadedIrradiance, 409.514, 61.04, 22.755);
        }
    }

    @Nested
    @DisplayName("Engine behavior")
    class EngineTests {

        @Test
        @DisplayName("Sun position matches SPA")
        void sunMatchesSpa() {
            ObservationTime time = ObservationTime.utc(2021, 6, 10, 10, 42, 0, 69);
            Observer observer = Observer.of(48.85, 2.35, 35, 1013, 15);
            SampaResult r = Sampa.DEFAULT.calculate(time, observer);
            assertEquals(Spa.DEFAULT.position(time, observer).zenith, r.sun.zenith, 1e-12);
            assertEquals(r.sun.zenith, Sampa.DEFAULT.position(time, observer).zenith, 1e-12);
        }

        @Test
        @DisplayName("Observer pressure overrides the composition pressure")
        void pressureFromObserver() {
            ObservationTime time = ObservationTime.utc(2021, 6, 10, 12, 0, 0, 69);
            AtmosphericComposition thin = AtmosphericComposition.DEFAULT.withPressure(500);
            SampaResult a = Sampa.withAtmosphere(thin).calculate(time, Observer.of(45, 0, 0, 1013, 10));
            SampaResult b = Sampa.DEFAULT.calculate(time, Observer.of(45, 0, 0, 1013, 10));
            assertEquals(b.irradiance.globalHorizontal, a.irradiance.globalHorizontal, 1e-9);
        }

        @Test
        @DisplayName("Percent and area stay within bounds")
        void bounds() {
            Observer observer = Observer.of(10.1, 148.8, 100, 1000, 25);
            for (int minute = 0; minute < 60; minute += 5) {
                SampaResult r =
                        Sampa.DEFAULT.calculate(
                                ObservationTime.utc(2016, 3, 9, 1, minute, 0, DELTA_T), observer);
                assertTrue(r.unshadedPercent >= 0.0 && r.unshadedPercent <= 100.0);
                assertTrue(r.unshadedArea >= 0.0);
                assertTrue(r.angularSeparation >= 0.0 && r.angularSeparation <= 180.0);
            }
        }

        @Test
        @DisplayName("Rejects a missing atmosphere")
        void rejectsNullAtmosphere() {
            assertThrows(IllegalArgumentException.class, () -> Sampa.withAtmosphere(null));
        }
    }

    private static void assertIrradiance(
            IrradianceResult r, double directNormal, double globalHorizontal, double diffuse) {
        assertEquals(directNormal, r.directNormal, IRRADIANCE_TOLERANCE, "Direct normal");
        assertEquals(globalHorizontal, r.globalHorizontal, IRRADIANCE_TOLERANCE, "Global horizontal");
        assertEquals(diffuse, r.diffuseHorizontal, IRRADIANCE_TOLERANCE, "Diffuse horizontal");
    }
}
