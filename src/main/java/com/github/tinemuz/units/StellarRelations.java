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

import static com.github.tinemuz.units.PhysicalConstants.GG;
import static com.github.tinemuz.units.PhysicalConstants.GG_CGS;
import static com.github.tinemuz.units.PhysicalConstants.SIGMA;

/** Fundamental stellar parameters from pairs of other ones. */
public final class StellarRelations {

    private StellarRelations() {}

    /**
     * Radius from luminosity and effective temperature via the Stefan-Boltzmann
     * law.
     *
     * @return radius in metres
     */
    public static Uncertain deriveRadius(UnitValue luminosity, UnitValue temperature) {
        Uncertain lumi = in(luminosity, "W", "W");
        Uncertain teff = in(temperature, "K", "K");
        return lumi.over(teff.pow(4)).over(4 * Math.PI * SIGMA).sqrt();
    }

    /** @return log10 of the surface gravity in cgs */
    public static Uncertain deriveLogg(UnitValue mass, UnitValue radius) {
        Uncertain m = in(mass, "g", "kg");
        Uncertain r = in(radius, "cm", "m");
        return m.times(GG_CGS).over(r.pow(2)).log10();
    }

    /** @return mass in kilograms */
    public static Uncertain deriveMass(UnitValue surfaceGravity, UnitValue radius) {
        Uncertain g = in(surfaceGravity, "m/s2", "m/s2");
        Uncertain r = in(radius, "m", "m");
        return g.times(r.pow(2)).over(GG);
    }

    // a value without unit is taken to be in siUnit
    private static Uncertain in(UnitValue v, String unit, String siUnit) {
        String from = v.isSI() ? siUnit : v.unit();
        return UnitConverter.convert(from, unit, v.value(), ConversionContext.empty());
    }
}
