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

/**
 * Clear sky irradiance on a horizontal surface. Irradiances are in W/m^2; all
 * values are zero when the sun is below the horizon.
 */
public final class IrradianceResult {
    /** All-zero result for a sun at or below the horizon. */
    public static final IrradianceResult NIGHT = new IrradianceResult(0, 0, 0, 0, 0, 0);

    /** Relative optical air mass, not pressure corrected. */
    public final double airMass;

    /** Pressure corrected air mass. */
    public final double pressureCorrectedAirMass;

    /** Direct normal irradiance. */
    public final double directNormal;

    /** Direct beam on the horizontal surface. */
    public final double directHorizontal;

    /** Diffuse horizontal irradiance. */
    public final double diffuseHorizontal;

    /** Global (total hemispherical) horizontal irradiance. */
    public final double globalHorizontal;

    public IrradianceResult(
            double airMass,
            double pressureCorrectedAirMass,
            double directNormal,
            double directHorizontal,
            double diffuseHorizontal,
            double globalHorizontal) {
        this.airMass = airMass;
        this.pressureCorrectedAirMass = pressureCorrectedAirMass;
        this.directNormal = directNormal;
        this.directHorizontal = directHorizontal;
        this.diffuseHorizontal = diffuseHorizontal;
        this.globalHorizontal = globalHorizontal;
    }

    @Override
    public String toString() {
        return String.format(
                "IrradianceResult[am=%.4f, dni=%.3f, dh=%.3f, dhi=%.3f, ghi=%.3f]",
                airMass, directNormal, directHorizontal, diffuseHorizontal, globalHorizontal);
    }
}
