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
package com.github.tinemuz.sundial.ephemeris;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.sundial.ObservationTime;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Intermediate values of the NREL report example, 2003-10-17 12:30:30 MST. */
class SolarEphemerisTest {

    private static SolarEphemeris ephemeris;

    @BeforeAll
    static void compute() {
        ephemeris =
                SolarEphemeris.compute(
                        JulianDate.of(ObservationTime.of(2003, 10, 17, 12, 30, 30, -7, 67)));
    }

    @Nested
    @DisplayName("Heliocentric and geocentric values")
    class PositionTests {

        @Test
        @DisplayName("Earth heliocentric position")
        void earth() {
            assertEquals(24.0182616917, ephemeris.earthLongitude, 1e-6);
            assertEquals(-0.0001011219, ephemeris.earthLatitude, 1e-8);
            assertEquals(0.9965422974, ephemeris.radiusVector, 1e-8);
        }

        @Test
        @DisplayName("Geocentric position is opposite the Earth")
        void geocentric() {
            assertEquals(204.0182616917, ephemeris.geocentricLongitude, 1e-6);
            assertEquals(0.0001011219, ephemeris.geocentricLatitude, 1e-8);
        }

        @Test
        @DisplayName("Nutation and obliquity")
        void nutation() {
            assertEquals(-0.00399840, ephemeris.nutationLongitude, 1e-7);
            assertEquals(0.00166657, ephemeris.nutationObliquity, 1e-7);
            assertEquals(23.440465, ephemeris.trueObliquity, 1e-6);
            assertEquals(-0.005711359, ephemeris.aberration, 1e-8);
            assertEquals(204.0085519281, ephemeris.apparentLongitude, 1e-6);
        }

        @Test
        @DisplayName("Sidereal time and equatorial coordinates")
        void equatorial() {
            assertEquals(318.5119, ephemeris.apparentSiderealTime, 1e-4);
            assertEquals(202.22741, ephemeris.rightAscension, 1e-5);
            assertEquals(-9.31434, ephemeris.declination, 1e-5);
        }

        @Test
        @DisplayName("Equation of time in October is about +14.6 minutes")
        void equationOfTime() {
            assertTrue(
                    ephemeris.equationOfTimeMinutes > 14.5 && ephemeris.equationOfTimeMinutes < 14.8,
                    "EOT " + ephemeris.equationOfTimeMinutes);
        }
    }

    @Nested
    @DisplayName("Term truncation")
    class TruncationTests {

        @Test
        @DisplayName("Truncated series stay close to the full result")
        void truncatedClose() {
            SolarEphemeris truncated = SolarEphemeris.compute(ephemeris.time, 10);
            assertEquals(ephemeris.rightAscension, truncated.rightAscension, 0.01);
            assertEquals(ephemeris.declination, truncated.declination, 0.01);
            assertEquals(ephemeris.nutationLongitude, truncated.nutationLongitude, 1e-12,
                    "Nutation is never truncated");
        }

        @Test
        @DisplayName("Limits above the table size change nothing")
        void oversizedLimit() {
            SolarEphemeris same = SolarEphemeris.compute(ephemeris.time, 1000);
            assertEquals(ephemeris.earthLongitude, same.earthLongitude, 0.0);
        }

        @Test
        @DisplayName("Rejects limits below one")
        void rejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> SolarEphemeris.compute(ephemeris.time, 0));
        }
    }
}
