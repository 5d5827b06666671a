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
 * One decomposed token of a unit expression.
 *
 * <p>For a linear unit {@code scale} is the SI factor including any prefix
 * and {@code nonlinear} is null. For a nonlinear unit {@code scale} is one
 * and the prefix lives in the converter.</p>
 *
 * @param scale     SI factor of a single unit, not yet raised to {@code power}
 * @param nonlinear converter for nonlinear units, otherwise null
 * @param siBase    SI base expression, possibly composite (e.g. {@code "kg m2 s-3"})
 * @param power     exponent the token was written with
 */
public record UnitToken(double scale, NonlinearConverter nonlinear, String siBase, int power) {

    public boolean isNonlinear() {
        return nonlinear != null;
    }
}
