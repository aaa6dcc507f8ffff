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

import static com.github.tinemuz.sundial.Angles.floorMod;
import static com.github.tinemuz.sundial.Angles.limitDegrees;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.tinemuz.sundial.ObservationTime;
import com.github.tinemuz.sundial.Observer;
import com.github.tinemuz.sundial.SolarDay;
import com.github.tinemuz.sundial.TopocentricPosition;
import com.github.tinemuz.sundial.irradiance.BirdClearSky;
import com.github.tinemuz.sundial.irradiance.IrradianceResult;

/**
 * NREL SOLPOS: solar position and intensity from the Michalsky almanac
 * algorithm (Astronomical Almanac, 1988).
 *
 * <p>Cheaper than {@link Spa} and accurate to about 0.01 degrees for the years
 * 1950 to 2050. Besides the position it reports sunrise and sunset, the
 * extraterrestrial irradiance on horizontal, normal and tilted surfaces, the
 * shadow band correction factor and the Perez air mass factors. Delta-T is not
 * used.</p>
 */
public final class Solpos implements SolarPositionEngine {
    private static final Logger log = LoggerFactory.getLogger(Solpos.class);

    /** Engine with {@link SolposOptions#DEFAULT}. */
    public static final Solpos DEFAULT = new Solpos(SolposOptions.DEFAULT);

    private static final int FIRST_VALID_YEAR = 1950;
    private static final int LAST_VALID_YEAR = 2050;
    private static final double NO_SUNRISE_SENTINEL = 2999.0;
    private static final int[] CUMULATIVE_DAYS = {0, 0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334};

    private static volatile boolean warnedOutsideValidity = false;

    private final SolposOptions options;

    private Solpos(SolposOptions options) {
        this.options = options;
    }

    /** Engine with custom panel, shadow band and interval options. */
    public static Solpos withOptions(SolposOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("SOLPOS options must not be null");
        }
        return new Solpos(options);
    }

    /** Options of this engine. */
    public SolposOptions options() {
        return options;
    }

    /**
     * Full SOLPOS report.
     *
     * <p>Years outside 1950 to 2050 are computed anyway; the first such request
     * logs a warning.</p>
     */
    public SolposResult calculate(ObservationTime time, Observer observer) {
        warnIfOutsideValidity(time.year);
        SolposResult.Builder out = new SolposResult.Builder();
        double latRad = Math.toRadians(observer.latitudeDeg);

        // Day of year and Spencer's Earth radius vector factor
        int dayOfYear = time.day + CUMULATIVE_DAYS[time.month];
        if (isGregorianLeap(time.year) && time.month > 2) {
            dayOfYear++;
        }
        double dayAngle = 360.0 * (dayOfYear - 1) / 365.0;
        double dayRad = Math.toRadians(dayAngle);
        double erv =
                1.000110
                        + 0.034221 * Math.cos(dayRad)
                        + 0.001280 * Math.sin(dayRad)
                        + 0.000719 * Math.cos(2 * dayRad)
                        + 0.000077 * Math.sin(2 * dayRad);
        out.dayOfYear = dayOfYear;
        out.dayAngle = dayAngle;
        out.earthRadiusVectorFactor = erv;

        // Universal time, moved back half the averaging interval
        double utime =
                (time.hour * 3600.0 + time.minute * 60.0 + time.second - options.intervalSeconds() / 2.0)
                                / 3600.0
                        - time.utcOffsetHours;

        // Michalsky's almanac: days since 1949 and the epoch J2000.0
        int delta = time.year - 1949;
        int leap = delta / 4;
        double julianDay = 32916.5 + delta * 365.0 + leap + dayOfYear + utime / 24.0;
        double ecTime = julianDay - 51545.0;
        double meanLongitude = limitDegrees(280.460 + 0.9856474 * ecTime);
        double meanAnomaly = limitDegrees(357.528 + 0.9856003 * ecTime);
        double anomalyRad = Math.toRadians(meanAnomaly);
        double eclipticLongitude =
                limitDegrees(
                        meanLongitude + 1.915 * Math.sin(anomalyRad) + 0.020 * Math.sin(2.0 * anomalyRad));
        double obliquity = 23.439 - 4.0e-07 * ecTime;
        double eclRad = Math.toRadians(eclipticLongitude);
        double oblRad = Math.toRadians(obliquity);
        double declination = Math.toDegrees(Math.asin(Math.sin(oblRad) * Math.sin(eclRad)));
        double rightAscension =
                limitDegrees(
                        Math.toDegrees(
                                Math.atan2(Math.cos(oblRad) * Math.sin(eclRad), Math.cos(eclRad))));
        out.declination = declination;
        out.rightAscension = rightAscension;

        double gmst = floorMod(6.697375 + 0.0657098242 * ecTime + utime, 24.0);
        double lmst = limitDegrees(gmst * 15.0 + observer.longitudeDeg);
        double hourAngle = lmst - rightAscension;
        if (hourAngle < -180.0) {
            hourAngle += 360.0;
        } else if (hourAngle > 180.0) {
            hourAngle -= 360.0;
        }
        out.hourAngle = hourAngle;

        double cd = Math.cos(Math.toRadians(declination));
        double sd = Math.sin(Math.toRadians(declination));
        double cl = Math.cos(latRad);
        double sl = Math.sin(latRad);
        double cz = sd * sl + cd * cl * Math.cos(Math.toRadians(hourAngle));
        cz = Math.max(-1.0, Math.min(1.0, cz));
        double etrZenith = Math.min(99.0, Math.toDegrees(Math.acos(cz)));
        double etrElevation = 90.0 - etrZenith;
        out.etrElevation = etrElevation;

        // Sunset hour angle
        double ssha;
        double cdcl = cd * cl;
        if (Math.abs(cdcl) >= 0.001) {
            double cssha = -sl * sd / cdcl;
            if (cssha < -1.0) {
                ssha = 180.0;
            } else if (cssha > 1.0) {
                ssha = 0.0;
            } else {
                ssha = Math.toDegrees(Math.acos(cssha));
            }
        } else if ((declination >= 0.0 && observer.latitudeDeg > 0.0)
                || (declination < 0.0 && observer.latitudeDeg < 0.0)) {
            ssha = 180.0;
        } else {
            ssha = 0.0;
        }

        // Drummond's shadow band correction
        double p =
                0.6366198
                        * options.shadowBandWidthCm()
                        / options.shadowBandRadiusCm()
                        * cd * cd * cd;
        double t1 = Math.toRadians(sl * sd * ssha);
        double t2 = cl * cd * Math.sin(Math.toRadians(ssha));
        out.shadowBandFactor = options.shadowBandSkyFactor() + 1.0 / (1.0 - p * (t1 + t2));

        // True solar time and equation of time
        double trueSolarTime = (180.0 + hourAngle) * 4.0;
        double tstFix =
                trueSolarTime
                        - time.hour * 60.0
                        - time.minute
                        - time.second / 60.0
                        + options.intervalSeconds() / 120.0;
        while (tstFix > 720.0) tstFix -= 1440.0;
        while (tstFix < -720.0) tstFix += 1440.0;
        out.equationOfTimeMinutes =
                tstFix + 60.0 * time.utcOffsetHours - 4.0 * observer.longitudeDeg;

        if (ssha <= 1.0) {
            out.sunriseMinutes = NO_SUNRISE_SENTINEL;
            out.sunsetMinutes = -NO_SUNRISE_SENTINEL;
        } else if (ssha >= 179.0) {
            out.sunriseMinutes = -NO_SUNRISE_SENTINEL;
            out.sunsetMinutes = NO_SUNRISE_SENTINEL;
        } else {
            out.sunriseMinutes = 720.0 - 4.0 * ssha - tstFix;
            out.sunsetMinutes = 720.0 + 4.0 * ssha - tstFix;
        }

        // Azimuth, clockwise from north
        double ce = Math.cos(Math.toRadians(etrElevation));
        double se = Math.sin(Math.toRadians(etrElevation));
        double azimuth = 180.0;
        double cecl = ce * cl;
        if (Math.abs(cecl) >= 0.001) {
            double ca = (se * sl - sd) / cecl;
            ca = Math.max(-1.0, Math.min(1.0, ca));
            azimuth = 180.0 - Math.toDegrees(Math.acos(ca));
            if (hourAngle > 0) {
                azimuth = 360.0 - azimuth;
            }
        }
        out.azimuth = azimuth;

        double refractedElevation =
                Math.max(
                        -9.0,
                        etrElevation
                                + refraction(
                                        etrElevation, observer.pressureHpa, observer.temperatureC));
        double zenith = 90.0 - refractedElevation;
        double cosZenith = Math.cos(Math.toRadians(zenith));
        out.refractedElevation = refractedElevation;
        out.zenith = zenith;

        if (zenith > 93.0) {
            out.airMass = -1.0;
            out.pressureCorrectedAirMass = -1.0;
        } else {
            out.airMass = BirdClearSky.airMass(zenith);
            out.pressureCorrectedAirMass = out.airMass * observer.pressureHpa / 1013.0;
        }
        out.unprime = 1.031 * Math.exp(-1.4 / (0.9 + 9.4 / out.airMass)) + 0.1;
        out.prime = 1.0 / out.unprime;

        if (cosZenith > 0.0) {
            out.etrNormal = BirdClearSky.SOLAR_CONSTANT * erv;
            out.etrHorizontal = out.etrNormal * cosZenith;
        }

        double azRad = Math.toRadians(azimuth);
        double aspectRad = Math.toRadians(options.aspectDeg());
        double tiltRad = Math.toRadians(options.tiltDeg());
        out.cosIncidence =
                cosZenith * Math.cos(tiltRad)
                        + Math.sin(Math.toRadians(zenith))
                                * Math.sin(tiltRad)
                                * (Math.cos(azRad) * Math.cos(aspectRad)
                                        + Math.sin(azRad) * Math.sin(aspectRad));
        out.etrTilt = out.cosIncidence > 0.0 ? out.etrNormal * out.cosIncidence : 0.0;

        out.clearSky = meinelClearSky(out);
        return new SolposResult(out);
    }

    @Override
    public TopocentricPosition position(ObservationTime time, Observer observer) {
        SolposResult r = calculate(time, observer);
        return new TopocentricPosition(
                r.zenith,
                r.azimuth,
                limitDegrees(r.azimuth - 180.0),
                r.refractedElevation,
                r.etrElevation,
                r.rightAscension,
                r.declination,
                r.hourAngle,
                r.zenith);
    }

    @Override
    public SolarDay solarDay(ObservationTime time, Observer observer) {
        SolposResult r = calculate(time, observer);
        return new SolarDay(
                time.localDate(),
                r.declination,
                r.equationOfTimeMinutes);
    }

    /**
     * Zimmerman's refraction correction in degrees for an unrefracted elevation.
     * No correction above 85 degrees.
     */
    static double refraction(double elevation, double pressureHpa, double temperatureC) {
        if (elevation > 85.0) {
            return 0.0;
        }
        double tanElev = Math.tan(Math.toRadians(elevation));
        double arcsec;
        if (elevation >= 5.0) {
            arcsec =
                    58.1 / tanElev
                            - 0.07 / Math.pow(tanElev, 3)
                            + 0.000086 / Math.pow(tanElev, 5);
        } else if (elevation >= -0.575) {
            arcsec =
                    1735.0
                            + elevation
                                    * (-518.2
                                            + elevation
                                                    * (103.4
                                                            + elevation * (-12.79 + elevation * 0.711)));
        } else {
            arcsec = -20.774 / tanElev;
        }
        return arcsec * (pressureHpa * 283.0) / (1013.0 * (273.0 + temperatureC)) / 3600.0;
    }

    // Meinel beam transmittance; diffuse taken as a tenth of the horizontal beam
    private static IrradianceResult meinelClearSky(SolposResult.Builder r) {
        if (r.airMass <= 0.0 || r.etrHorizontal <= 0.0) {
            return IrradianceResult.NIGHT;
        }
        double directNormal = r.etrNormal * Math.pow(0.7, Math.pow(r.airMass, 0.678));
        double directHorizontal = directNormal * Math.cos(Math.toRadians(r.zenith));
        double diffuse = 0.1 * directHorizontal;
        return new IrradianceResult(
                r.airMass,
                r.pressureCorrectedAirMass,
                directNormal,
                directHorizontal,
                diffuse,
                directHorizontal + diffuse);
    }

    private static boolean isGregorianLeap(int year) {
        return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
    }

    private static void warnIfOutsideValidity(int year) {
        if ((year < FIRST_VALID_YEAR || year > LAST_VALID_YEAR) && !warnedOutsideValidity) {
            synchronized (Solpos.class) {
                if (!warnedOutsideValidity) {
                    warnedOutsideValidity = true;
                    log.warn(
                            "Year {} is outside the {}-{} validity range of SOLPOS; "
                                    + "consider Spa for higher accuracy",
                            year, FIRST_VALID_YEAR, LAST_VALID_YEAR);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "Solpos" + options;
    }
}
