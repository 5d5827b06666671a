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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StellarRelationsTest {

    @Test
    @DisplayName("Solar radius from solar luminosity and temperature")
    void radius() {
        Uncertain r = StellarRelations.deriveRadius(UnitValue.of(1.0, "Lsol"), UnitValue.of(5777.0, "K"));
        assertEquals(1.0009006944947254, r.nominal() / PhysicalConstants.RSOL, 1e-9);
    }

    @Test
    @DisplayName("Values without unit are SI")
    void siDefault() {
        Uncertain r = StellarRelations.deriveRadius(
                UnitValue.si(Uncertain.exact(PhysicalConstants.LSOL)), UnitValue.si(Uncertain.exact(5777.0)));
        assertEquals(1.0009006944947254, r.nominal() / PhysicalConstants.RSOL, 1e-9);
    }

    @Test
    @DisplayName("Surface gravity of the sun")
    void logg() {
        Uncertain logg = StellarRelations.deriveLogg(UnitValue.of(1.0, "Msol"), UnitValue.of(1.0, "Rsol"));
        assertEquals(4.438262716339082, logg.nominal(), 1e-9);
    }

    @Test
    @DisplayName("Mass from logarithmic surface gravity")
    void mass() {
        Uncertain m = StellarRelations.deriveMass(UnitValue.of(4.438, "[cm/s2]"), UnitValue.of(1.0, "Rsol"));
        assertEquals(0.9993952562052254, m.nominal() / PhysicalConstants.MSOL, 1e-9);
    }

    @Test
    @DisplayName("Temperature error dominates the radius error")
    void radiusError() {
        Uncertain r = StellarRelations.deriveRadius(UnitValue.of(1.0, "Lsol"), UnitValue.of(5777.0, 57.77, "K"));
        // R ~ T^-2, so 1% in T is 2% in R
        assertEquals(0.02, r.stdDev() / r.nominal(), 1e-9);
    }
}
