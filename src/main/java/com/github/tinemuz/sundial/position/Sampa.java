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

import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.SolarDay;
import com.github.tinemuz.sundial.SurfaceOrientation;
import com.github.tinemuz.sundial.TopocentricPosition;
import com.github.tinemuz.sundial.ephemeris.JulianDate;
import com.github.tinemuz.sundial.ephemeris.LunarEphemeris;
import com.github.tinemuz.sundial.ephemeris.SolarEphemeris;
import com.github.tinemuz.sundial.irradiance.AtmosphericComposition;
import com.github.tinemuz.sundial.irradiance.BirdClearSky;
import com.github.tinemuz.sundial.irradiance.IrradianceResult;

/**
 * NREL Solar and Moon Position Algorithm (Reda, 2010).
 *
 * <p>Adds the topocentric moon position (uncertainty about +/-0.003 degrees) to
 * the SPA sun position, classifies solar eclipses from the apparent disks and
 * estimates the reduction of clear sky irradiance by the Bird model applied to
 * the sun's unshaded lune.</p>
 */
public final class Sampa implements SolarPositionEngine {
    /** Engine using {@link AtmosphericComposition#DEFAULT}. */
    public static final Sampa DEFAULT = new Sampa(AtmosphericComposition.DEFAULT);

    // Sun's apparent radius at 1 AU, arc seconds
    private static final double SUN_RADIUS_ARCSEC = 959.63;
    // Moon radius scale (km * arc seconds) for the apparent radius at distance in km
    private static final double MOON_RADIUS_SCALE = 358473400.0;

    private final AtmosphericComposition atmosphere;

    private Sampa(AtmosphericComposition atmosphere) {
        this.atmosphere = atmosphere;
    }

    /**
     * Engine with custom Bird model inputs. The pressure of the observer
     * replaces the composition's pressure at each call.
     */
    public static Sampa withAtmosphere(AtmosphericComposition atmosphere) {
        if (atmosphere == null) {
            throw new IllegalArgumentException("Atmospheric composition must not be null");
        }
        return new Sampa(atmosphere);
    }

    /**
     * Sun and moon positions, eclipse geometry and clear sky irradiance.
     *
     * @throws IllegalStateException if coefficient data cannot be loaded
     */
    public SampaResult calculate(ObservationTime time, Observer observer) {
        SolarEphemeris sunEphemeris = SolarEphemeris.compute(JulianDate.of(time));
        TopocentricPosition sun =
                Topocentric.transform(
                        sunEphemeris.equatorial(),
                        sunEphemeris.apparentSiderealTime,
                        observer,
                        SurfaceOrientation.HORIZONTAL);
        LunarEphemeris moonEphemeris = LunarEphemeris.compute(sunEphemeris);
        TopocentricPosition moon =
                Topocentric.transform(
                        moonEphemeris.equatorial(),
                        sunEphemeris.apparentSiderealTime,
                        observer,
                        SurfaceOrientation.HORIZONTAL);

        double r = sunEphemeris.radiusVector;
        double separation = angularSeparation(sun, moon);
        double sunRadius = SUN_RADIUS_ARCSEC / (3600.0 * r);
        double moonRadius =
                MOON_RADIUS_SCALE
                        * (1
                                + Math.sin(Math.toRadians(moon.elevation))
                                        * Math.sin(Math.toRadians(moonEphemeris.parallax)))
                        / (3600.0 * moonEphemeris.distanceKm);

        EclipseType eclipse;
        double covered;
        if (separation > moonRadius + sunRadius) {
            eclipse = EclipseType.NONE;
            covered = 0.0;
        } else if (separation == moonRadius + sunRadius) {
            eclipse = EclipseType.CONTACT;
            covered = 0.0;
        } else if (separation <= Math.abs(moonRadius - sunRadius)) {
            eclipse = moonRadius >= sunRadius ? EclipseType.TOTAL : EclipseType.ANNULAR;
            covered = Math.PI * moonRadius * moonRadius;
        } else {
            eclipse = EclipseType.PARTIAL;
            covered = overlapArea(separation, sunRadius, moonRadius);
        }
        double sunDisk = Math.PI * sunRadius * sunRadius;
        double unshadedArea = Math.max(0.0, sunDisk - covered);
        double unshadedPercent = unshadedArea * 100.0 / sunDisk;

        AtmosphericComposition local = atmosphere.withPressure(observer.pressureHpa);
        IrradianceResult full = BirdClearSky.compute(sun.zenith, r, local);
        IrradianceResult unshaded =
                BirdClearSky.compute(sun.zenith, r, local, unshadedPercent / 100.0);

        return new SampaResult(
                sun,
                moon,
                moonEphemeris,
                r,
                sunEphemeris.trueObliquity,
                separation,
                sunRadius,
                moonRadius,
                unshadedArea,
                unshadedPercent,
                eclipse,
                full,
                unshaded);
    }

    @Override
    public TopocentricPosition position(ObservationTime time, Observer observer) {
        return Spa.DEFAULT.position(time, observer);
    }

    @Override
    public SolarDay solarDay(ObservationTime time, Observer observer) {
        return Spa.DEFAULT.solarDay(time, observer);
    }

    private static double angularSeparation(TopocentricPosition sun, TopocentricPosition moon) {
        double zs = Math.toRadians(sun.zenith);
        double zm = Math.toRadians(moon.zenith);
        double cos =
                Math.cos(zs) * Math.cos(zm)
                        + Math.sin(zs) * Math.sin(zm) * Math.cos(Math.toRadians(sun.azimuth - moon.azimuth));
        return Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, cos))));
    }

    // Area of the lens shared by two overlapping disks
    private static double overlapArea(double separation, double sunRadius, double moonRadius) {
        double e2 = separation * separation;
        double rs2 = sunRadius * sunRadius;
        double rm2 = moonRadius * moonRadius;
        double s = (e2 + rs2 - rm2) / (2 * separation);
        double m = (e2 - rs2 + rm2) / (2 * separation);
        double h = Math.sqrt(4 * e2 * rs2 - (e2 + rs2 - rm2) * (e2 + rs2 - rm2)) / (2 * separation);
        double sunSegment = rs2 * Math.acos(s / sunRadius) - h * s;
        double moonSegment = rm2 * Math.acos(m / moonRadius) - h * m;
        return sunSegment + moonSegment;
    }
}
