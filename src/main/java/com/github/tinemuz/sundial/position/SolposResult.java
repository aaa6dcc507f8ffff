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

import com.github.tinemuz.sundial.irradiance.IrradianceResult;

/**
 * Output of the SOLPOS engine. Angles are degrees, times are minutes from local
 * midnight and irradiances W/m^2.
 */
public final class SolposResult {
    /** Day of year, 1 on January 1st. */
    public final int dayOfYear;

    /** Day angle, degrees. */
    public final double dayAngle;

    /** Earth radius vector correction factor (mean distance over actual, squared). */
    public final double earthRadiusVectorFactor;

    /** Declination. */
    public final double declination;

    /** Right ascension. */
    public final double rightAscension;

    /** Hour angle, within +/-180. */
    public final double hourAngle;

    /** Solar azimuth, clockwise from north. */
    public final double azimuth;

    /** Solar elevation without refraction (extraterrestrial). */
    public final double etrElevation;

    /** Refracted solar elevation, floored at -9. */
    public final double refractedElevation;

    /** Refracted solar zenith. */
    public final double zenith;

    /** Relative optical air mass; -1 when the sun is far below the horizon. */
    public final double airMass;

    /** Pressure corrected air mass; -1 when the sun is far below the horizon. */
    public final double pressureCorrectedAirMass;

    /** Extraterrestrial global horizontal irradiance. */
    public final double etrHorizontal;

    /** Extraterrestrial direct normal irradiance. */
    public final double etrNormal;

    /** Extraterrestrial irradiance on the tilted panel. */
    public final double etrTilt;

    /** Cosine of the incidence angle on the tilted panel. */
    public final double cosIncidence;

    /** Sunrise, minutes from local midnight; +/-2999 when the sun does not rise or set. */
    public final double sunriseMinutes;

    /** Sunset, minutes from local midnight; +/-2999 when the sun does not rise or set. */
    public final double sunsetMinutes;

    /** Equation of time, minutes. */
    public final double equationOfTimeMinutes;

    /** Shadow band correction factor. */
    public final double shadowBandFactor;

    /** Perez factor that normalizes Kt' by air mass. */
    public final double prime;

    /** Perez factor to undo the normalization. */
    public final double unprime;

    /** Clear sky estimate from the extraterrestrial beam and the Meinel transmittance. */
    public final IrradianceResult clearSky;

    SolposResult(Builder b) {
        this.dayOfYear = b.dayOfYear;
        this.dayAngle = b.dayAngle;
        this.earthRadiusVectorFactor = b.earthRadiusVectorFactor;
        this.declination = b.declination;
        this.rightAscension = b.rightAscension;
        this.hourAngle = b.hourAngle;
        this.azimuth = b.azimuth;
        this.etrElevation = b.etrElevation;
        this.refractedElevation = b.refractedElevation;
        this.zenith = b.zenith;
        this.airMass = b.airMass;
        this.pressureCorrectedAirMass = b.pressureCorrectedAirMass;
        this.etrHorizontal = b.etrHorizontal;
        this.etrNormal = b.etrNormal;
        this.etrTilt = b.etrTilt;
        this.cosIncidence = b.cosIncidence;
        this.sunriseMinutes = b.sunriseMinutes;
        this.sunsetMinutes = b.sunsetMinutes;
        this.equationOfTimeMinutes = b.equationOfTimeMinutes;
        this.shadowBandFactor = b.shadowBandFactor;
        this.prime = b.prime;
        this.unprime = b.unprime;
        this.clearSky = b.clearSky;
    }

    @Override
    public String toString() {
        return String.format(
                "SolposResult[zenith=%.4f, azimuth=%.4f, sunrise=%.3f, sunset=%.3f, eot=%.3f]",
                zenith, azimuth, sunriseMinutes, sunsetMinutes, equationOfTimeMinutes);
    }

    // Mutable scratch used while the engine fills in values
    static final class Builder {
        int dayOfYear;
        double dayAngle;
        double earthRadiusVectorFactor;
        double declination;
        double rightAscension;
        double hourAngle;
        double azimuth;
        double etrElevation;
        double refractedElevation;
        double zenith;
        double airMass;
        double pressureCorrectedAirMass;
        double etrHorizontal;
        double etrNormal;
        double etrTilt;
        double cosIncidence;
        double sunriseMinutes;
        double sunsetMinutes;
        double equationOfTimeMinutes;
        double shadowBandFactor;
        double prime;
        double unprime;
        IrradianceResult clearSky;
    }
}
