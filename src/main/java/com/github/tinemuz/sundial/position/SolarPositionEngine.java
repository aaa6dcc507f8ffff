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
import com.github.tinemuz.sundial.TopocentricPosition;

/**
 * A solar position algorithm. Implementations are immutable and may be shared
 * between threads.
 */
public interface SolarPositionEngine {

    /**
     * Topocentric sun position for a horizontal surface.
     *
     * @throws IllegalStateException if coefficient data cannot be loaded
     */
    TopocentricPosition position(ObservationTime time, Observer observer);

    /** Declination and equation of time at the given instant, labelled with its local date. */
    SolarDay solarDay(ObservationTime time, Observer observer);
}
