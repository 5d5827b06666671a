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

/** Physical and astronomical constants in SI units unless stated otherwise. */
public final class PhysicalConstants {
    /** Speed of light in vacuum (m/s). */
    public static final double CC = 299792458.0;
    /** Gravitational constant (m3 kg-1 s-2). */
    public static final double GG = 6.67300e-11;
    /** Gravitational constant in CGS units (cm3 g-1 s-2). */
    public static final double GG_CGS = GG * 1e3;
    /** Stefan-Boltzmann constant (W m-2 K-4). */
    public static final double SIGMA = 5.67040e-8;

    public static final double AU = 149597870691.0;
    public static final double PC = 3.0856775807e16;
    public static final double LY = 9.460730472e15;
    /** Bohr radius (m). */
    public static final double A0 = 0.52917720859e-10;

    public static final double RSOL = 6.955e8;
    public static final double REARTH = 6.3781e6;
    public static final double MSOL = 1.988547e30;
    public static final double MEARTH = 5.9742e24;
    public static final double MJUP = 1.8986e27;
    public static final double MLUN = 7.3477e22;
    public static final double LSOL = 3.846e26;

    /** AB magnitude zero-point flux density (W m-2 Hz-1). */
    public static final double AB_ZERO_FLUX = 3.6307805477010024e-23;
    /** ST magnitude zero-point flux density (W m-3). */
    public static final double ST_ZERO_FLUX = 0.036307805477010027;

    private PhysicalConstants() {}
}
