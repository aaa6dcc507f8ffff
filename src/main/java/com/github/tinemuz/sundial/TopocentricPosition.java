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

/**
 * Position of a body as seen by an observer on the Earth's surface.
 * All angles are in degrees.
 */
public final class TopocentricPosition {
    /** Topocentric zenith angle, refraction corrected. */
    public final double zenith;

    /** Topocentric azimuth, measured eastward from north, [0, 360). */
    public final double azimuth;

    /** Astronomers' azimuth, measured westward from south, [0, 360). */
    public final double astronomersAzimuth;

    /** Topocentric elevation angle, refraction corrected. */
    public final double elevation;

    /** Topocentric elevation angle without atmospheric refraction. */
    public final double uncorrectedElevation;

    /** Topocentric right ascension, [0, 360). */
    public final double rightAscension;

    /** Topocentric declination. */
    public final double declination;

    /** Topocentric local hour angle. */
    public final double hourAngle;

    /** Incidence angle on the requested surface; equals the zenith on a horizontal surface. */
    public final double incidence;

    public TopocentricPosition(
            double zenith,
            double azimuth,
            double astronomersAzimuth,
            double elevation,
            double uncorrectedElevation,
            double rightAscension,
            double declination,
            double hourAngle,
            double incidence) {
        this.zenith = zenith;
        this.azimuth = azimuth;
        this.astronomersAzimuth = astronomersAzimuth;
        this.elevation = elevation;
        this.uncorrectedElevation = uncorrectedElevation;
        this.rightAscension = rightAscension;
        this.declination = declination;
        this.hourAngle = hourAngle;
        this.incidence = incidence;
    }

    @Override
    public String toString() {
        return String.format(
                "TopocentricPosition[zenith=%.6f, azimuth=%.6f, elevation=%.6f, declination=%.6f]",
                zenith, azimuth, elevation, declination);
    }
}
