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
package com.github.tinemuz.sundial.irradiance;

import com.github.tinemuz.sundial.InvalidAtmosphericParametersException;

/**
 * Atmospheric inputs of the Bird clear sky model.
 *
 * @param pressureHpa            surface pressure, hPa
 * @param ozoneCm                ozone in a vertical column from the surface, cm
 * @param waterCm                precipitable water in a vertical column from the surface, cm
 * @param aerosolOpticalDepth    broadband aerosol optical depth (turbidity)
 * @param albedo                 ground albedo
 * @param forwardScatteringRatio forward-scattered to total scattered irradiance due to aerosols
 * @param aerosolAbsorptance     aerosol absorptance constant (K1)
 */
public record AtmosphericComposition(
        double pressureHpa,
        double ozoneCm,
        double waterCm,
        double aerosolOpticalDepth,
        double albedo,
        double forwardScatteringRatio,
        double aerosolAbsorptance) {

    /** Typical clear, rural atmosphere at sea level. */
    public static final AtmosphericComposition DEFAULT =
            new AtmosphericComposition(1013.0, 0.3, 1.5, 0.04, 0.2, 0.85, 0.1);

    public AtmosphericComposition {
        if (!(pressureHpa > 0.0 && pressureHpa <= 5000.0)) {
            throw new InvalidAtmosphericParametersException(
                    "Pressure must be within (0, 5000] hPa, got " + pressureHpa);
        }
        requireNonNegative("Ozone", ozoneCm);
        requireNonNegative("Precipitable water", waterCm);
        requireNonNegative("Aerosol optical depth", aerosolOpticalDepth);
        requireUnitInterval("Albedo", albedo);
        requireUnitInterval("Forward scattering ratio", forwardScatteringRatio);
        requireUnitInterval("Aerosol absorptance", aerosolAbsorptance);
    }

    /** Same composition at a different surface pressure. */
    public AtmosphericComposition withPressure(double pressureHpa) {
        return new AtmosphericComposition(
                pressureHpa,
                ozoneCm,
                waterCm,
                aerosolOpticalDepth,
                albedo,
                forwardScatteringRatio,
                aerosolAbsorptance);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new InvalidAtmosphericParametersException(
                    name + " must be a finite non-negative value, got " + value);
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidAtmosphericParametersException(
                    name + " must be within [0, 1], got " + value);
        }
    }
}
