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

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatchConverterTest {

    @Test
    @DisplayName("One unit pair and context for all elements")
    void broadcast() {
        BatchConverter.Result r = BatchConverter.convert(
                "m", "km", new double[] {1000.0, 2500.0}, new double[] {10.0, 20.0}, ConversionContext.empty());
        assertArrayEquals(new double[] {1.0, 2.5}, r.values(), 1e-12);
        assertArrayEquals(new double[] {0.01, 0.02}, r.errors(), 1e-15);
    }

    @Test
    @DisplayName("Missing errors give zero errors")
    void noErrors() {
        BatchConverter.Result r = BatchConverter.convert(
                "C", "K", new double[] {0.0, 100.0}, null, ConversionContext.empty());
        assertArrayEquals(new double[] {273.15, 373.15}, r.values(), 1e-9);
        assertArrayEquals(new double[] {0.0, 0.0}, r.errors(), 0.0);
    }

    @Test
    @DisplayName("Failing elements become NaN, the rest is converted")
    void perElement() {
        ConversionContext none = ConversionContext.empty();
        BatchConverter.Result r = BatchConverter.convert(
                List.of("m", "C", "mag", "km/s"),
                List.of("km", "K", "Jy", "kg"),
                new double[] {1500.0, 25.0, 10.0, 1.0},
                null,
                List.of(none, none, none, none));
        assertEquals(1.5, r.values()[0], 1e-12);
        assertEquals(298.15, r.values()[1], 1e-9);
        assertTrue(Double.isNaN(r.values()[2]));
        assertTrue(Double.isNaN(r.errors()[2]));
        assertTrue(Double.isNaN(r.values()[3]));
    }

    @Test
    @DisplayName("Each element uses its own context")
    void perElementContext() {
        ConversionContext u = ConversionContext.builder().wave(1.0, "mum").build();
        ConversionContext k = ConversionContext.builder().wave(2.0, "mum").build();
        BatchConverter.Result r = BatchConverter.convert(
                List.of("W/m2/Hz", "W/m2/Hz"),
                List.of("W/m2/m", "W/m2/m"),
                new double[] {1.0, 1.0},
                null,
                List.of(u, k));
        assertEquals(4.0, r.values()[0] / r.values()[1], 1e-9);
    }

    @Test
    @DisplayName("Length mismatch")
    void arity() {
        ConversionContext none = ConversionContext.empty();
        assertThrows(ArityException.class, () -> BatchConverter.convert(
                "m", "km", new double[] {1.0, 2.0}, new double[] {0.1}, none));
        assertThrows(ArityException.class, () -> BatchConverter.convert(
                List.of("m"), List.of("km", "km"), new double[] {1.0, 2.0}, null, List.of(none, none)));
    }
}
