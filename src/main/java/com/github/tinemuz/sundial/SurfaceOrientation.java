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
 * Orientation of a receiving surface for the incidence angle.
 *
 * @param slopeDeg             tilt from the horizontal plane, degrees
 * @param azimuthRotationDeg   rotation of the surface normal from south, east negative
 */
public record SurfaceOrientation(double slopeDeg, double azimuthRotationDeg) {
    /** A horizontal surface; its incidence angle is the zenith angle. */
    public static final SurfaceOrientation HORIZONTAL = new SurfaceOrientation(0.0, 0.0);

    public SurfaceOrientation {
        if (!(Math.abs(slopeDeg) <= 360.0)) {
            throw new IllegalArgumentException(
                    "Surface slope must be within +/-360 degrees, got " + slopeDeg);
        }
        if (!(Math.abs(azimuthRotationDeg) <= 360.0)) {
            throw new IllegalArgumentException(
                    "Surface azimuth rotation must be within +/-360 degrees, got "
                            + azimuthRotationDeg);
        }
    }
}
