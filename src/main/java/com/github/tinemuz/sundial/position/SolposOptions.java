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

/**
 * Optional inputs of the SOLPOS engine: the orientation of a tilted receiving
 * surface, the shadow band geometry used for the diffuse correction factor and
 * the averaging interval of the measurements being modelled.
 *
 * @param aspectDeg             azimuth of the tilted panel, degrees clockwise from north
 * @param tiltDeg               tilt of the panel from horizontal, degrees
 * @param shadowBandWidthCm     shadow band width, cm
 * @param shadowBandRadiusCm    shadow band radius, cm
 * @param shadowBandSkyFactor   sky anisotropy correction of the shadow band
 * @param intervalSeconds       measurement interval; the time is moved back half of it
 */
public record SolposOptions(
        double aspectDeg,
        double tiltDeg,
        double shadowBandWidthCm,
        double shadowBandRadiusCm,
        double shadowBandSkyFactor,
        double intervalSeconds) {

    /** South-facing horizontal surface, Eppley shadow band, instantaneous values. */
    public static final SolposOptions DEFAULT = new SolposOptions(180.0, 0.0, 7.6, 31.7, 0.04, 0.0);

    public SolposOptions {
        requireRange("Aspect", aspectDeg, -360.0, 360.0);
        requireRange("Tilt", tiltDeg, -180.0, 180.0);
        requireRange("Shadow band width", shadowBandWidthCm, 1.0, 100.0);
        requireRange("Shadow band radius", shadowBandRadiusCm, 1.0, 100.0);
        requireRange("Shadow band sky factor", shadowBandSkyFactor, -1.0, 1.0);
        requireRange("Interval", intervalSeconds, 0.0, 28800.0);
    }

    /** Same options for a panel with the given aspect and tilt. */
    public SolposOptions withPanel(double aspectDeg, double tiltDeg) {
        return new SolposOptions(
                aspectDeg,
                tiltDeg,
                shadowBandWidthCm,
                shadowBandRadiusCm,
                shadowBandSkyFactor,
                intervalSeconds);
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException(
                    name + " must be within [" + min + ", " + max + "], got " + value);
        }
    }
}
