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
package com.github.tinemuz.units;

/**
 * A position on the sky as a pair of angles in radians.
 *
 * <p>Depending on the unit it is converted with, the pair is (right ascension,
 * declination), (galactic longitude, latitude) or (ecliptic longitude,
 * latitude). The {@code complex_coord} unit always holds equatorial
 * coordinates.</p>
 *
 * @param longitude right ascension or longitude (radians)
 * @param latitude  declination or latitude (radians)
 */
public record SkyPosition(double longitude, double latitude) implements Quantity {

    /**
     * A position written in sexagesimal notation, e.g.
     * {@code ("17:45:40.4", "-29:00:28.1")}. A right ascension is read in
     * hours, every other angle in degrees.
     */
    public static Sexagesimal sexagesimal(String longitude, String latitude) {
        return new Sexagesimal(longitude, latitude);
    }

    public double longitudeDegrees() {
        return Math.toDegrees(longitude);
    }

    public double latitudeDegrees() {
        return Math.toDegrees(latitude);
    }

    /** Unparsed sexagesimal input; the frame decides how the first angle is read. */
    public record Sexagesimal(String longitude, String latitude) implements Quantity {}
}
