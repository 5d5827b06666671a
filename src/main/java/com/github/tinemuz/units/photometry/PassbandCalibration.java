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
package com.github.tinemuz.units.photometry;

/**
 * One row of the zero-point table: calibration of a single passband.
 * Unknown numbers are NaN. The {@code *Lit} flags are 1 when the value was
 * taken from the literature and 0 when it was calibrated here.
 *
 * @param photband   passband in {@code SYSTEM.FILTER} form
 * @param effWave    effective wavelength (angstrom)
 * @param type       detector type, e.g. {@code CCD} or {@code BOL}
 * @param vegamag    magnitude of Vega in this band
 * @param abMag      AB magnitude offset
 * @param stMag      ST magnitude offset
 * @param flam0      zero-point flux per unit wavelength, in {@code flam0Units}
 * @param fnu0       zero-point flux per unit frequency, in {@code fnu0Units}
 * @param source     reference for the calibration
 */
public record PassbandCalibration(
        String photband,
        double effWave,
        String type,
        double vegamag,
        int vegamagLit,
        double abMag,
        int abMagLit,
        double stMag,
        int stMagLit,
        double flam0,
        String flam0Units,
        int flam0Lit,
        double fnu0,
        String fnu0Units,
        int fnu0Lit,
        String source) {

    /** Same calibration with a new Vega magnitude, e.g. after recalibration. */
    public PassbandCalibration withVegamag(double newVegamag) {
        return new PassbandCalibration(photband, effWave, type, newVegamag, 0, abMag, abMagLit, stMag, stMagLit,
                flam0, flam0Units, flam0Lit, fnu0, fnu0Units, fnu0Lit, source);
    }
}
