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

import com.github.tinemuz.sundial.position.SpaResult;

/**
 * Bird clear sky model (Bird and Hulstrom, SERI TR-642-761) with the constants
 * of NREL's reference C implementation.
 *
 * <p>Produces direct beam, hemispherical diffuse and global irradiance on a
 * horizontal surface. Results agree with rigorous radiative transfer codes to
 * about 10%.</p>
 *
 * <p>Near the horizon the model's Rayleigh term turns and its beam transmittance
 * starts rising again with air mass. Past the zenith where the transmittance is
 * lowest, the direct beam is held at that value and scaled by
 * cos(zenith) / cos(turning zenith), so it falls to zero at the horizon; the
 * Rayleigh transmittance of the diffuse term is held at its turning value too.
 * The diffuse term is never negative.</p>
 */
public final class BirdClearSky {
    /** Solar constant, W/m^2. */
    public static final double SOLAR_CONSTANT = 1367.0;

    // Pressure-corrected air mass at which the Rayleigh exponent peaks; below it every
    // beam transmittance factor falls with air mass
    private static final double RAYLEIGH_TURNING_AIR_MASS = 14.09;
    private static final double GOLDEN = (Math.sqrt(5.0) - 1.0) / 2.0;
    private static final double TURNING_TOLERANCE_DEG = 1e-9;

    private BirdClearSky() {}

    /**
     * Clear sky irradiance for the full solar disk.
     *
     * @param zenithDeg      solar zenith angle, degrees
     * @param radiusVectorAu Earth-sun distance, AU
     */
    public static IrradianceResult compute(
            double zenithDeg, double radiusVectorAu, AtmosphericComposition atmosphere) {
        return compute(zenithDeg, radiusVectorAu, atmosphere, 1.0);
    }

    /** Clear sky irradiance for the sun position of an SPA report. */
    public static IrradianceResult compute(SpaResult spa, AtmosphericComposition atmosphere) {
        return compute(spa.position.zenith, spa.radiusVector(), atmosphere, 1.0);
    }

    /**
     * Clear sky irradiance when only part of the solar disk is visible, as
     * during an eclipse. The direct beam is scaled by the unshaded fraction; the
     * sky diffuse component is not.
     *
     * @param unshadedFraction visible fraction of the solar disk, 0 to 1
     * @throws IllegalArgumentException if the fraction is outside [0, 1]
     */
    public static IrradianceResult compute(
            double zenithDeg,
            double radiusVectorAu,
            AtmosphericComposition atmosphere,
            double unshadedFraction) {
        if (!(unshadedFraction >= 0.0 && unshadedFraction <= 1.0)) {
            throw new IllegalArgumentException(
                    "Unshaded fraction must be within [0, 1], got " + unshadedFraction);
        }
        if (!(zenithDeg >= 0.0 && zenithDeg < 90.0) || !(radiusVectorAu > 0.0)) {
            return IrradianceResult.NIGHT;
        }
        double cosZenith = Math.cos(Math.toRadians(zenithDeg));
        double m = airMass(zenithDeg);
        double mPrime = m * atmosphere.pressureHpa() / 1013.0;
        double xo = atmosphere.ozoneCm() * m;
        double xw = atmosphere.waterCm() * m;
        double aod = atmosphere.aerosolOpticalDepth();
        double ba = atmosphere.forwardScatteringRatio();

        double tRayleigh = rayleighTransmittance(mPrime);
        double tOzone = ozoneTransmittance(xo);
        double tGases = Math.exp(-0.0127 * Math.pow(mPrime, 0.26));
        double tWater = waterTransmittance(xw);
        double tAerosol = aerosolTransmittance(aod, m);
        double beam = tRayleigh * tOzone * tGases * tWater * tAerosol;
        if (mPrime > RAYLEIGH_TURNING_AIR_MASS) {
            double turningZenith = turningZenith(atmosphere);
            if (zenithDeg > turningZenith) {
                double turningMPrime = airMass(turningZenith) * atmosphere.pressureHpa() / 1013.0;
                tRayleigh = rayleighTransmittance(turningMPrime);
                beam =
                        beamTransmittance(turningZenith, atmosphere)
                                * cosZenith
                                / Math.cos(Math.toRadians(turningZenith));
            }
        }
        double tAbsorb =
                1 - atmosphere.aerosolAbsorptance() * (1 - m + Math.pow(m, 1.06)) * (1 - tAerosol);
        double tScatter = tAerosol / tAbsorb;
        double skyAlbedo = 0.0685 + (1 - ba) * (1 - tScatter);

        double extraterrestrial = SOLAR_CONSTANT / (radiusVectorAu * radiusVectorAu);
        double scattered =
                Math.max(
                        0.0,
                        extraterrestrial
                                * cosZenith
                                * 0.79
                                * tOzone
                                * tWater
                                * tGases
                                * tAbsorb
                                * (0.5 * (1 - tRayleigh) + ba * (1 - tScatter))
                                / (1 - m + Math.pow(m, 1.02)));
        double directNormal = Math.max(0.0, 0.9662 * extraterrestrial * beam);

        double visibleNormal = directNormal * unshadedFraction;
        double directHorizontal = visibleNormal * cosZenith;
        double global = (directHorizontal + scattered) / (1 - atmosphere.albedo() * skyAlbedo);
        return new IrradianceResult(
                m, mPrime, visibleNormal, directHorizontal, global - directHorizontal, global);
    }

    /**
     * Zenith angle in [0, 90] at which the beam transmittance is lowest. The
     * transmittance falls and then rises with zenith, so a golden-section search
     * finds the turn; it is 90 when there is none.
     */
    static double turningZenith(AtmosphericComposition atmosphere) {
        double lo = 0.0;
        double hi = 90.0;
        double x1 = hi - GOLDEN * (hi - lo);
        double x2 = lo + GOLDEN * (hi - lo);
        double f1 = beamTransmittance(x1, atmosphere);
        double f2 = beamTransmittance(x2, atmosphere);
        while (hi - lo > TURNING_TOLERANCE_DEG) {
            if (f1 < f2) {
                hi = x2;
                x2 = x1;
                f2 = f1;
                x1 = hi - GOLDEN * (hi - lo);
                f1 = beamTransmittance(x1, atmosphere);
            } else {
                lo = x1;
                x1 = x2;
                f1 = f2;
                x2 = lo + GOLDEN * (hi - lo);
                f2 = beamTransmittance(x2, atmosphere);
            }
        }
        return (lo + hi) / 2.0;
    }

    private static double beamTransmittance(double zenithDeg, AtmosphericComposition atmosphere) {
        double m = airMass(zenithDeg);
        double mPrime = m * atmosphere.pressureHpa() / 1013.0;
        return rayleighTransmittance(mPrime)
                * ozoneTransmittance(atmosphere.ozoneCm() * m)
                * Math.exp(-0.0127 * Math.pow(mPrime, 0.26))
                * waterTransmittance(atmosphere.waterCm() * m)
                * aerosolTransmittance(atmosphere.aerosolOpticalDepth(), m);
    }

    private static double rayleighTransmittance(double mPrime) {
        return Math.exp(-0.0903 * Math.pow(mPrime, 0.84) * (1 + mPrime - Math.pow(mPrime, 1.01)));
    }

    private static double ozoneTransmittance(double xo) {
        return 1
                - 0.1611 * xo * Math.pow(1 + 139.48 * xo, -0.3034)
                - 0.002715 * xo / (1 + 0.044 * xo + 0.0003 * xo * xo);
    }

    private static double waterTransmittance(double xw) {
        return 1 - 2.4959 * xw / (Math.pow(1 + 79.034 * xw, 0.6828) + 6.385 * xw);
    }

    private static double aerosolTransmittance(double aod, double m) {
        return Math.exp(-Math.pow(aod, 0.873) * (1 + aod - Math.pow(aod, 0.7088)) * Math.pow(m, 0.9108));
    }

    /** Kasten and Young relative air mass for a zenith angle in degrees. */
    public static double airMass(double zenithDeg) {
        return 1.0
                / (Math.cos(Math.toRadians(zenithDeg))
                        + 0.50572 * Math.pow(96.07995 - zenithDeg, -1.6364));
    }
}
