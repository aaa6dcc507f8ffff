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
package com.github.tinemuz.sundial.dial;

/**
 * Position of one hour mark on the dial ellipse, in the frame where the
 * east-west semi-axis is 1, x points east and y points north.
 *
 * @param clockHour    civil clock hour the mark stands for
 * @param dialAngleDeg angle of the mark from north, east positive, within [-180, 180]
 * @param x            east coordinate
 * @param y            north coordinate
 */
public record HourPoint(double clockHour, double dialAngleDeg, double x, double y) {

    /** Same mark scaled for a dial of the given full width. */
    public HourPoint scaled(double width) {
        double half = width / 2.0;
        return new HourPoint(clockHour, dialAngleDeg, x * half, y * half);
    }
}
