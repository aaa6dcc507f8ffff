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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PeriodicTermsTest {

    @Test
    @DisplayName("Preload reads all coefficient tables")
    void preload() {
        assertDoesNotThrow(PeriodicTerms::preload);

        assertEquals(6, PeriodicTerms.earthLongitude().length);
        assertEquals(2, PeriodicTerms.earthLatitude().length);
        assertEquals(5, PeriodicTerms.earthRadius().length);
        assertEquals(63, PeriodicTerms.nutationArguments().length);
        assertEquals(63, PeriodicTerms.nutationCoefficients().length);
        assertEquals(60, PeriodicTerms.moonLongitudeArguments().length);
        assertEquals(60, PeriodicTerms.moonLongitudeCoefficients().length);
        assertEquals(60, PeriodicTerms.moonLatitudeArguments().length);
        assertEquals(60, PeriodicTerms.moonLatitudeCoefficients().length);
    }

    @Test
    @DisplayName("Longest Earth series is L0")
    void earthSeriesLengths() {
        assertEquals(64, PeriodicTerms.earthLongitude()[0].length);
        assertEquals(64, PeriodicTerms.maxEarthTerms());
        assertEquals(1, PeriodicTerms.earthLongitude()[5].length);
        assertEquals(40, PeriodicTerms.earthRadius()[0].length);
    }

    @Test
    @DisplayName("Leading terms match the published tables")
    void leadingTerms() {
        double[] l0 = PeriodicTerms.earthLongitude()[0][0];
        assertEquals(175347046.0, l0[0]);
        assertEquals(0.0, l0[1]);
        assertEquals(0.0, l0[2]);

        double[] r0 = PeriodicTerms.earthRadius()[0][0];
        assertEquals(100013989.0, r0[0]);

        double[] nutation = PeriodicTerms.nutationCoefficients()[0];
        assertEquals(-171996.0, nutation[0]);
        assertEquals(-174.2, nutation[1], 1e-9);
        assertEquals(92025.0, nutation[2]);
        assertEquals(8.9, nutation[3], 1e-9);

        assertEquals(6288774.0, PeriodicTerms.moonLongitudeCoefficients()[0][0]);
        assertEquals(5128122.0, PeriodicTerms.moonLatitudeCoefficients()[0]);
    }
}
