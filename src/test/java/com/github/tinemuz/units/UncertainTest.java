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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UncertainTest {

    private static final double EPS = 1e-12;

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Exact values have no uncertainty")
        void exactValue() {
            Uncertain x = Uncertain.exact(3.0);
            assertEquals(3.0, x.nominal());
            assertEquals(0.0, x.stdDev());
            assertFalse(x.hasUncertainty());
        }

        @Test
        @DisplayName("Zero error gives an exact value")
        void zeroError() {
            assertFalse(Uncertain.of(1.0, 0.0).hasUncertainty());
        }

        @Test
        @DisplayName("Negative error is taken as its magnitude")
        void negativeError() {
            assertEquals(0.5, Uncertain.of(1.0, -0.5).stdDev(), EPS);
        }
    }

    @Nested
    @DisplayName("Linear propagation")
    class Propagation {

        @Test
        @DisplayName("Independent errors add in quadrature")
        void independentSum() {
            Uncertain a = Uncertain.of(1.0, 0.3);
            Uncertain b = Uncertain.of(2.0, 0.4);
            Uncertain sum = a.plus(b);
            assertEquals(3.0, sum.nominal(), EPS);
            assertEquals(0.5, sum.stdDev(), EPS);
        }

        @Test
        @DisplayName("A variable minus itself is exact")
        void selfCorrelation() {
            Uncertain a = Uncertain.of(5.0, 0.2);
            Uncertain diff = a.minus(a);
            assertEquals(0.0, diff.nominal(), EPS);
            assertEquals(0.0, diff.stdDev(), EPS);
        }

        @Test
        @DisplayName("A variable divided by itself is exact")
        void selfRatio() {
            Uncertain a = Uncertain.of(4.0, 0.3);
            assertEquals(0.0, a.over(a).stdDev(), EPS);
        }

        @Test
        @DisplayName("Relative errors of a product add in quadrature")
        void product() {
            Uncertain a = Uncertain.of(10.0, 0.3);
            Uncertain b = Uncertain.of(20.0, 0.8);
            Uncertain p = a.times(b);
            double rel = Math.hypot(0.3 / 10.0, 0.8 / 20.0);
            assertEquals(200.0, p.nominal(), EPS);
            assertEquals(200.0 * rel, p.stdDev(), 1e-9);
        }

        @Test
        @DisplayName("Scaling by a constant scales the error")
        void scaling() {
            Uncertain x = Uncertain.of(1.0, 0.1).times(3.6);
            assertEquals(3.6, x.nominal(), EPS);
            assertEquals(0.36, x.stdDev(), EPS);
        }

        @Test
        @DisplayName("Powers, roots and logarithms")
        void functions() {
            Uncertain x = Uncertain.of(4.0, 0.2);
            assertEquals(16.0 * 2 * 0.2 / 4.0, x.pow(2).stdDev(), EPS);
            assertEquals(0.5 * 0.2 / 2.0, x.sqrt().stdDev(), EPS);
            assertEquals(0.2 / (4.0 * Math.log(10)), x.log10().stdDev(), EPS);
            Uncertain y = Uncertain.of(1.0, 0.01).exp10();
            assertEquals(10.0, y.nominal(), EPS);
            assertEquals(10.0 * Math.log(10) * 0.01, y.stdDev(), EPS);
        }

        @Test
        @DisplayName("Constant divided by a value")
        void dividedInto() {
            Uncertain x = Uncertain.of(2.0, 0.1);
            Uncertain q = x.dividedInto(8.0);
            assertEquals(4.0, q.nominal(), EPS);
            assertEquals(8.0 / 4.0 * 0.1, q.stdDev(), EPS);
        }

        @Test
        @DisplayName("Exact operands leave the result exact")
        void exactStaysExact() {
            Uncertain x = Uncertain.exact(2.0).times(Uncertain.exact(3.0)).log10().negate();
            assertFalse(x.hasUncertainty());
        }
    }

    @Test
    @DisplayName("String form shows the error only when there is one")
    void toStringForm() {
        assertEquals("2.0", Uncertain.exact(2.0).toString());
        assertTrue(Uncertain.of(2.0, 0.5).toString().contains("+/-"));
    }
}
