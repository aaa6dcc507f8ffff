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

import static com.github.tinemuz.sundial.Angles.limitDegrees;

import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.SurfaceOrientation;
import com.github.tinemuz.sundial.TopocentricPosition;
import com.github.tinemuz.sundial.ephemeris.EquatorialPosition;

/**
 * Geocentric to topocentric transform shared by the sun and the moon: parallax
 * in right ascension and declination, local hour angle, elevation with
 * refraction, azimuth and the incidence angle on a tilted surface.
 */
final class Topocentric {
    /** Apparent sun radius plus standard refraction at the horizon, degrees. */
    static final double HORIZON_DIP = 0.26667 + 0.5667;

    private static final double EARTH_FLATTENING_RATIO = 0.99664719;
    private static final double EARTH_RADIUS_M = 6378140.0;

    private Topocentric() {}

    /**
     * @param body                 geocentric position; its parallax sets the size of the correction
     * @param apparentSiderealTime Greenwich apparent sidereal time, degrees
     */
    static TopocentricPosition transform(
            EquatorialPosition body,
            double apparentSiderealTime,
            Observer observer,
            SurfaceOrientation surface) {
        double latRad = Math.toRadians(observer.latitudeDeg);
        double hourAngle =
                limitDegrees(apparentSiderealTime + observer.longitudeDeg - body.rightAscensionDeg());
        double hRad = Math.toRadians(hourAngle);
        double deltaRad = Math.toRadians(body.declinationDeg());
        double xiRad = Math.toRadians(body.parallaxDeg());

        double uRad = Math.atan(EARTH_FLATTENING_RATIO * Math.tan(latRad));
        double heightRatio = observer.elevationM / EARTH_RADIUS_M;
        double x = Math.cos(uRad) + heightRatio * Math.cos(latRad);
        double y = EARTH_FLATTENING_RATIO * Math.sin(uRad) + heightRatio * Math.sin(latRad);

        double denominator = Math.cos(deltaRad) - x * Math.sin(xiRad) * Math.cos(hRad);
        double deltaAlphaRad = Math.atan2(-x * Math.sin(xiRad) * Math.sin(hRad), denominator);
        double deltaAlpha = Math.toDegrees(deltaAlphaRad);
        double rightAscension = limitDegrees(body.rightAscensionDeg() + deltaAlpha);
        double declinationRad =
                Math.atan2(
                        (Math.sin(deltaRad) - y * Math.sin(xiRad)) * Math.cos(deltaAlphaRad),
                        denominator);
        double declination = Math.toDegrees(declinationRad);
        double topoHourAngle = hourAngle - deltaAlpha;
        double topoHRad = Math.toRadians(topoHourAngle);

        double uncorrectedElevation =
                Math.toDegrees(
                        Math.asin(
                                Math.sin(latRad) * Math.sin(declinationRad)
                                        + Math.cos(latRad)
                                                * Math.cos(declinationRad)
                                                * Math.cos(topoHRad)));
        double elevation =
                uncorrectedElevation
                        + refraction(
                                uncorrectedElevation, observer.pressureHpa, observer.temperatureC);
        double zenith = 90.0 - elevation;

        double astronomersAzimuth =
                limitDegrees(
                        Math.toDegrees(
                                Math.atan2(
                                        Math.sin(topoHRad),
                                        Math.cos(topoHRad) * Math.sin(latRad)
                                                - Math.tan(declinationRad) * Math.cos(latRad))));
        double azimuth = limitDegrees(astronomersAzimuth + 180.0);

        double incidence = incidence(zenith, astronomersAzimuth, surface);

        return new TopocentricPosition(
                zenith,
                azimuth,
                astronomersAzimuth,
                elevation,
                uncorrectedElevation,
                rightAscension,
                declination,
                topoHourAngle,
                incidence);
    }

    /**
     * Angle between the sun and the surface normal, degrees. The cosine is clamped
     * to [-1, 1] so rounding never yields NaN.
     */
    static double incidence(double zenith, double astronomersAzimuth, SurfaceOrientation surface) {
        double zenithRad = Math.toRadians(zenith);
        double slopeRad = Math.toRadians(surface.slopeDeg());
        double cosIncidence =
                Math.cos(zenithRad) * Math.cos(slopeRad)
                        + Math.sin(slopeRad)
                                * Math.sin(zenithRad)
                                * Math.cos(Math.toRadians(astronomersAzimuth - surface.azimuthRotationDeg()));
        return Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, cosIncidence))));
    }

    /** Atmospheric refraction correction in degrees; zero once the body is fully below the horizon. */
    static double refraction(double elevation, double pressureHpa, double temperatureC) {
        if (elevation < -HORIZON_DIP) {
            return 0.0;
        }
        return (pressureHpa / 1010.0)
                * (283.0 / (273.0 + temperatureC))
                * 1.02
                / (60.0 * Math.tan(Math.toRadians(elevation + 10.3 / (elevation + 5.11))));
    }
}
