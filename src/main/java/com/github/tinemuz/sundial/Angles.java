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
 * Angle reductions shared by the position engines. All inputs and outputs are
 * in degrees unless the method name says otherwise.
 */
public final class Angles {
    private Angles() {}

    /** Reduce an angle into [0, 360). */
    public static double limitDegrees(double degrees) {
        double limited = degrees % 360.0;
        if (limited < 0) limited += 360.0;
        // -1e-15 % 360 + 360 rounds to exactly 360
        return limited >= 360.0 ? 0.0 : limited;
    }

    /** Reduce an angle into [-180, 180]. */
    public static double limitDegrees180pm(double degrees) {
        double limited = limitDegrees(degrees);
        return limited > 180.0 ? limited - 360.0 : limited;
    }

    /** Reduce an angle into [0, 180). */
    public static double limitDegrees180(double degrees) {
        double limited = degrees % 180.0;
        if (limited < 0) limited += 180.0;
        return limited >= 180.0 ? 0.0 : limited;
    }

    /** Fractional part in [0, 1), used for day fractions. */
    public static double limitZeroToOne(double value) {
        double limited = value - Math.floor(value);
        return limited >= 1.0 ? 0.0 : limited;
    }

    /** Floored modulo for arbitrary periods (hours, minutes). */
    public static double floorMod(double value, double period) {
        double limited = value % period;
        if (limited < 0) limited += period;
        return limited >= period ? 0.0 : limited;
    }
}
