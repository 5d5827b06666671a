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
 * A value tagged with the unit it is expressed in. A null unit means the value
 * is already in SI.
 *
 * @param value the (possibly uncertain) value
 * @param unit  unit expression, or null for SI
 */
public record UnitValue(Uncertain value, String unit) {

    public static UnitValue of(double value, String unit) {
        return new UnitValue(Uncertain.exact(value), unit);
    }

    public static UnitValue of(double value, double error, String unit) {
        return new UnitValue(Uncertain.of(value, error), unit);
    }

    public static UnitValue si(Uncertain value) {
        return new UnitValue(value, null);
    }

    public boolean isSI() {
        return unit == null;
    }

    /** This value converted to SI. */
    public UnitValue toSI() {
        if (isSI()) return this;
        return si(UnitConverter.convert(unit, "SI", value, ConversionContext.empty()));
    }
}
