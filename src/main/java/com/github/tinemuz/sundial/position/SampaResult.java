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

import com.github.tinemuz.sundial.TopocentricPosition;
import com.github.tinemuz.sundial.ephemeris.LunarEphemeris;
import com.github.tinemuz.sundial.irradiance.IrradianceResult;

/**
 * Sun and moon positions with the eclipse geometry and its effect on clear sky
 * irradiance. Angles are degrees.
 */
public final class SampaResult {
    /** Topocentric sun position. */
    public final TopocentricPosition sun;

    /** Topocentric moon position. */
    public final TopocentricPosition moon;

    /** Geocentric moon ephemeris. */
    public final LunarEphemeris moonEphemeris;

    /** Earth-sun distance, AU. */
    public final double sunDistanceAu;

    /** True obliquity of the ecliptic. */
    public final double trueObliquity;

    /** Angular distance between the centers of the sun and the moon. */
    public final double angularSeparation;

    /** Apparent radius of the sun's disk. */
    public final double sunRadius;

    /** Apparent radius of the moon's disk. */
    public final double moonRadius;

    /** Area of the sun's unshaded lune, square degrees. */
    public final double unshadedArea;

    /** Unshaded lune as a percentage of the sun's disk. */
    public final double unshadedPercent;

    /** Eclipse classification. */
    public final EclipseType eclipse;

    /** Clear sky irradiance for the full solar disk. */
    public final IrradianceResult irradiance;

    /** Clear sky irradiance from the sun's unshaded lune. */
    public final IrradianceResult unshadedIrradiance;

    SampaResult(
            TopocentricPosition sun,
            TopocentricPosition moon,
            LunarEphemeris moonEphemeris,
            double sunDistanceAu,
            double trueObliquity,
            double angularSeparation,
            double sunRadius,
            double moonRadius,
            double unshadedArea,
            double unshadedPercent,
            EclipseType eclipse,
            IrradianceResult irradiance,
            IrradianceResult unshadedIrradiance) {
        this.sun = sun;
        this.moon = moon;
        this.moonEphemeris = moonEphemeris;
        this.sunDistanceAu = sunDistanceAu;
        this.trueObliquity = trueObliquity;
        this.angularSeparation = angularSeparation;
        this.sunRadius = sunRadius;
        this.moonRadius = moonRadius;
        this.unshadedArea = unshadedArea;
        this.unshadedPercent = unshadedPercent;
        this.eclipse = eclipse;
        this.irradiance = irradiance;
        this.unshadedIrradiance = unshadedIrradiance;
    }

    @Override
    public String toString() {
        return String.format(
                "SampaResult[sun=(%.4f, %.4f), moon=(%.4f, %.4f), eclipse=%s, unshaded=%.3f%%]",
                sun.zenith, sun.azimuth, moon.zenith, moon.azimuth, eclipse, unshadedPercent);
    }
}
