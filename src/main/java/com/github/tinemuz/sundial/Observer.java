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
 * Location and surface weather of an observer.
 *
 * <p>Latitude is geodetic, north positive; longitude is east positive. Pressure
 * and temperature are the annual averages used by the refraction correction and
 * the irradiance models. Instances are immutable and validated on creation.</p>
 */
public final class Observer {
    /** Standard surface pressure (hPa) used when none is given. */
    public static final double DEFAULT_PRESSURE_HPA = 1013.0;

    /** Surface temperature (degrees Celsius) used when none is given. */
    public static final double DEFAULT_TEMPERATURE_C = 10.0;

    // Lower bound used by the reference SPA implementation (roughly the Earth radius)
    private static final double MIN_ELEVATION_M = -6_500_000.0;

    /** Latitude in degrees, -90 (south) to 90 (north). */
    public final double latitudeDeg;

    /** Longitude in degrees, -180 (west) to 180 (east). */
    public final double longitudeDeg;

    /** Elevation above mean sea level in meters. */
    public final double elevationM;

    /** Annual average local pressure in hectopascals (millibars). */
    public final double pressureHpa;

    /** Annual average local temperature in degrees Celsius. */
    public final double temperatureC;

    private Observer(
            double latitudeDeg,
            double longitudeDeg,
            double elevationM,
            double pressureHpa,
            double temperatureC) {
        this.latitudeDeg = latitudeDeg;
        this.longitudeDeg = longitudeDeg;
        this.elevationM = elevationM;
        this.pressureHpa = pressureHpa;
        this.temperatureC = temperatureC;
    }

    /**
     * Observer at sea level with standard pressure and temperature.
     *
     * @throws InvalidObserverException if latitude or longitude is out of range
     */
    public static Observer of(double latitudeDeg, double longitudeDeg) {
        return of(latitudeDeg, longitudeDeg, 0.0, DEFAULT_PRESSURE_HPA, DEFAULT_TEMPERATURE_C);
    }

    /**
     * Fully specified observer.
     *
     * @throws InvalidObserverException if latitude, longitude or elevation is out of range
     * @throws InvalidAtmosphericParametersException if pressure or temperature is not physical
     */
    public static Observer of(
            double latitudeDeg,
            double longitudeDeg,
            double elevationM,
            double pressureHpa,
            double temperatureC) {
        if (!(latitudeDeg >= -90.0 && latitudeDeg <= 90.0)) {
            throw new InvalidObserverException(
                    "Latitude must be within [-90, 90] degrees, got " + latitudeDeg);
        }
        if (!(longitudeDeg >= -180.0 && longitudeDeg <= 180.0)) {
            throw new InvalidObserverException(
                    "Longitude must be within [-180, 180] degrees, got " + longitudeDeg);
        }
        if (!(elevationM >= MIN_ELEVATION_M) || Double.isInfinite(elevationM)) {
            throw new InvalidObserverException(
                    "Elevation must be a finite value above " + MIN_ELEVATION_M + " m, got "
                            + elevationM);
        }
        validateAtmosphere(pressureHpa, temperatureC);
        return new Observer(latitudeDeg, longitudeDeg, elevationM, pressureHpa, temperatureC);
    }

    /**
     * Copy of this observer with custom refraction parameters.
     *
     * @throws InvalidAtmosphericParametersException if pressure or temperature is not physical
     */
    public Observer withAtmosphere(double pressureHpa, double temperatureC) {
        validateAtmosphere(pressureHpa, temperatureC);
        return new Observer(latitudeDeg, longitudeDeg, elevationM, pressureHpa, temperatureC);
    }

    private static void validateAtmosphere(double pressureHpa, double temperatureC) {
        if (!(pressureHpa > 0.0 && pressureHpa <= 5000.0)) {
            throw new InvalidAtmosphericParametersException(
                    "Pressure must be within (0, 5000] hPa, got " + pressureHpa);
        }
        if (!(temperatureC > -273.0 && temperatureC <= 6000.0)) {
            throw new InvalidAtmosphericParametersException(
                    "Temperature must be within (-273, 6000] degrees Celsius, got "
                            + temperatureC);
        }
    }

    @Override
    public String toString() {
        return String.format(
                "Observer[lat=%.6f, lon=%.6f, elev=%.2fm, p=%.1fhPa, t=%.1fC]",
                latitudeDeg, longitudeDeg, elevationM, pressureHpa, temperatureC);
    }
}
