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

import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UnitParserTest {

    private static final double REL = 1e-12;

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Aliases are replaced")
        void aliases() {
            assertEquals("W m-2 mum-1", UnitParser.normalize("watt/m2/micron"));
            assertEquals("Jy", UnitParser.normalize("jansky"));
            assertEquals("cy as-1", UnitParser.normalize("cycles/arcsec"));
            assertEquals("m2", UnitParser.normalize("m^2"));
        }

        @Test
        @DisplayName("Division negates the exponent of each divisor")
        void division() {
            assertEquals("erg s-1 cm-2 A-1", UnitParser.normalize("erg/s/cm2/A"));
            assertEquals("10mW m-2 nm-1", UnitParser.normalize("10mW m-2/nm"));
            assertEquals("m s2", UnitParser.normalize("m/s-2"));
        }

        @Test
        @DisplayName("Expressions without slash are left alone")
        void noDivision() {
            assertEquals("erg s-1 cm-2 A-1", UnitParser.normalize(" erg s-1 cm-2 A-1 "));
        }

        @Test
        @DisplayName("Empty divisor is malformed")
        void emptyDivisor() {
            assertThrows(MalformedUnitExpressionException.class, () -> UnitParser.normalize("m//s"));
            assertThrows(MalformedUnitExpressionException.class, () -> UnitParser.normalize("m/"));
        }
    }

    @Nested
    @DisplayName("Token decomposition")
    class Components {

        @Test
        @DisplayName("Prefix and exponent")
        void prefixAndPower() {
            UnitToken t = UnitParser.components("cm-2");
            assertClose(0.01, t.scale());
            assertEquals("m", t.siBase());
            assertEquals(-2, t.power());
            assertFalse(t.isNonlinear());
        }

        @Test
        @DisplayName("Two letter prefixes win over one letter ones")
        void longPrefixes() {
            assertClose(1e-6, UnitParser.components("mum").scale());
            assertClose(10.0, UnitParser.components("dam").scale());
        }

        @Test
        @DisplayName("Numeric and scientific factors")
        void numericFactors() {
            assertClose(10e-3, UnitParser.components("10mW").scale());
            assertClose(1e-7, UnitParser.components("10-07m").scale());
            assertClose(1e-7, UnitParser.components("10e-07m").scale());
        }

        @Test
        @DisplayName("A unit name ending in a digit is taken whole")
        void bohrRadius() {
            UnitToken t = UnitParser.components("a0");
            assertClose(PhysicalConstants.A0, t.scale());
            assertEquals(1, t.power());
        }

        @Test
        @DisplayName("Composite SI bases are kept as written")
        void compositeBase() {
            assertEquals("kg m2 s-3", UnitParser.components("W").siBase());
            assertEquals("rad2", UnitParser.components("sr").siBase());
        }

        @Test
        @DisplayName("Nonlinear units keep their prefix in the converter")
        void nonlinearPrefix() {
            UnitToken t = UnitParser.components("kF");
            assertTrue(t.isNonlinear());
            assertEquals(NonlinearConverter.Kind.FAHRENHEIT, t.nonlinear().kind());
            assertClose(1000.0, t.nonlinear().prefix());
            assertEquals("K", t.siBase());
        }

        @Test
        @DisplayName("Unknown units are rejected")
        void unknown() {
            assertThrows(UnknownUnitException.class, () -> UnitParser.components("furlong"));
            assertThrows(UnknownUnitException.class, () -> UnitParser.components("xm"));
        }
    }

    @Nested
    @DisplayName("Breakdown")
    class Breakdown {

        @Test
        @DisplayName("Flux density per wavelength")
        void flambda() {
            CanonicalUnit u = UnitParser.breakdown("erg s-1 cm-2 A-1");
            assertClose(1e7, u.scale());
            assertEquals("kg1 m-1 s-3", u.signature());
        }

        @Test
        @DisplayName("Slash and space notation agree")
        void notationsAgree() {
            assertEquals(UnitParser.breakdown("erg/s/cm2/A"), UnitParser.breakdown("erg s-1 cm-2 A-1"));
        }

        @Test
        @DisplayName("Token order does not matter")
        void commutative() {
            CanonicalUnit a = UnitParser.breakdown("kg m s-2");
            CanonicalUnit b = UnitParser.breakdown("s-2 m kg");
            assertEquals(a.signature(), b.signature());
            assertClose(a.scale(), b.scale());
        }

        @Test
        @DisplayName("Canceling dimensions disappear")
        void cancellation() {
            CanonicalUnit u = UnitParser.breakdown("m m-1 s");
            assertEquals("s1", u.signature());
            assertEquals(Map.of("s", 1), u.dims());
        }

        @Test
        @DisplayName("Dimensionless units have an empty signature")
        void dimensionless() {
            CanonicalUnit u = UnitParser.breakdown("ppm");
            assertEquals("ampl1", u.signature());
            assertEquals("", UnitParser.breakdown("sidereal").signature());
        }

        @Test
        @DisplayName("Linear factors fold into the nonlinear leaf in any order")
        void foldingCommutes() {
            CanonicalUnit a = UnitParser.breakdown("ppm mag");
            CanonicalUnit b = UnitParser.breakdown("mag ppm");
            assertEquals(a.nonlinear(), b.nonlinear());
            assertClose(1e-6, a.nonlinear().prefix());
            assertEquals(1.0, a.scale());
            assertClose(10.0, UnitParser.breakdown("10mag").nonlinear().prefix());
        }

        @Test
        @DisplayName("Explicit exponent on a nonlinear unit is recorded")
        void nonlinearPower() {
            assertEquals(2, UnitParser.breakdown("F2").nonlinear().power());
        }

        @Test
        @DisplayName("Two nonlinear units cannot be combined")
        void twoNonlinear() {
            assertThrows(MalformedUnitExpressionException.class, () -> UnitParser.breakdown("F mag"));
        }

        @Test
        @DisplayName("Empty expression is malformed")
        void empty() {
            assertThrows(MalformedUnitExpressionException.class, () -> UnitParser.breakdown("   "));
        }

        @Test
        @DisplayName("Leftover dimensions subtract exponents")
        void leftover() {
            CanonicalUnit jy = UnitParser.breakdown("Jy");
            CanonicalUnit flam = UnitParser.breakdown("erg/s/cm2/A");
            Map<String, Integer> expected = new TreeMap<>(Map.of("cy", -1, "m", 1, "s", 1));
            assertEquals(expected, jy.minus(flam));
            assertEquals("cy-1m1s1", CanonicalUnit.render(jy.minus(flam), ""));
        }
    }

    // Helper methods

    private static void assertClose(double expected, double actual) {
        assertEquals(expected, actual, Math.abs(expected) * REL, "expected " + expected + " got " + actual);
    }
}
