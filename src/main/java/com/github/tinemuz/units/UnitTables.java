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

import static com.github.tinemuz.units.PhysicalConstants.*;

import com.github.tinemuz.units.NonlinearConverter.Kind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed registries the unit parser works from: base units with their SI
 * equivalent, metric prefixes and spelling aliases.
 *
 * <p>All tables are built once during class initialization and are
 * unmodifiable afterwards.</p>
 */
final class UnitTables {

    /**
     * A known unit: either a literal factor to its SI base expression or a
     * nonlinear converter kind. The SI base may be a composite expression such
     * as {@code "kg m2 s-3"}, or empty for a dimensionless factor.
     */
    record BaseUnit(double factor, Kind nonlinear, String siBase) {
        boolean isNonlinear() {
            return nonlinear != null;
        }
    }

    static final Map<String, BaseUnit> FACTORS;
    /** Metric prefixes, longest first so that {@code mu} and {@code da} win. */
    static final Map<String, Double> PREFIXES;
    /** Ordered literal replacements applied before tokenizing. */
    static final List<String[]> ALIASES;

    static {
        Map<String, BaseUnit> f = new LinkedHashMap<>();
        // DISTANCE
        linear(f, "m", 1e+00, "m");
        linear(f, "A", 1e-10, "m"); // angstrom
        linear(f, "AU", AU, "m");
        linear(f, "pc", PC, "m");
        linear(f, "ly", LY, "m");
        linear(f, "Rsol", RSOL, "m");
        linear(f, "Rearth", REARTH, "m");
        linear(f, "ft", 0.3048, "m");
        linear(f, "in", 0.0254, "m");
        linear(f, "mi", 1609.344, "m");
        linear(f, "a0", A0, "m"); // Bohr radius
        linear(f, "ell", 1.143, "m");
        linear(f, "yd", 0.9144, "m");
        // MASS
        linear(f, "g", 1e-03, "kg");
        linear(f, "Msol", MSOL, "kg");
        linear(f, "Mearth", MEARTH, "kg");
        linear(f, "Mjup", MJUP, "kg");
        linear(f, "Mlun", MLUN, "kg");
        linear(f, "lbs", 0.45359237, "kg");
        linear(f, "st", 6.35029318, "kg"); // stone
        // TIME
        linear(f, "s", 1e+00, "s");
        linear(f, "min", 60.0, "s");
        linear(f, "h", 3600.0, "s");
        linear(f, "d", 24 * 3600.0, "s");
        linear(f, "wk", 7 * 24 * 3600.0, "s");
        linear(f, "mo", 30 * 7 * 24 * 3600.0, "s");
        linear(f, "sidereal", 1.0027379093, "");
        linear(f, "yr", 365 * 24 * 3600.0, "s");
        linear(f, "cr", 100 * 365 * 24 * 3600.0, "s"); // century
        linear(f, "hz", 1e+00, "cy s-1");
        linear(f, "JD", 1e+00, "JD");
        nonlinear(f, "CD", Kind.CALENDAR_DATE, "JD");
        nonlinear(f, "MJD", Kind.MODIFIED_JULIAN_DAY, "JD");
        linear(f, "j", 1 / 60.0, "s"); // jiffy
        // ANGLES
        linear(f, "rad", 1e+00, "rad");
        linear(f, "cy", 1e+00, "cy");
        linear(f, "deg", Math.PI / 180.0, "rad");
        linear(f, "am", Math.PI / 180.0 / 60.0, "rad"); // arcminute
        linear(f, "as", Math.PI / 180.0 / 3600.0, "rad"); // arcsecond
        linear(f, "sr", 1.0, "rad2");
        linear(f, "rpm", 0.104719755, "rad s-1");
        // COORDINATES
        linear(f, "complex_coord", 1e+00, "complex_coord");
        nonlinear(f, "equ", Kind.EQUATORIAL, "complex_coord");
        nonlinear(f, "gal", Kind.GALACTIC, "complex_coord");
        nonlinear(f, "ecl", Kind.ECLIPTIC, "complex_coord");
        // FORCE
        linear(f, "N", 1e+00, "kg m s-2");
        linear(f, "dyn", 1e-05, "kg m s-2");
        // TEMPERATURE
        linear(f, "K", 1e+00, "K");
        nonlinear(f, "F", Kind.FAHRENHEIT, "K");
        nonlinear(f, "C", Kind.CELSIUS, "K");
        // ENERGY & POWER
        linear(f, "J", 1e+00, "kg m2 s-2");
        linear(f, "W", 1e+00, "kg m2 s-3");
        linear(f, "erg", 1e-07, "kg m2 s-2");
        linear(f, "eV", 1.60217646e-19, "kg m2 s-2");
        linear(f, "cal", 4.1868, "kg m2 s-2");
        linear(f, "Lsol", LSOL, "kg m2 s-3");
        // PRESSURE
        linear(f, "Pa", 1e+00, "kg m-1 s-2");
        linear(f, "bar", 1e+05, "kg m-1 s-2");
        linear(f, "at", 98066.5, "kg m-1 s-2"); // technical atmosphere
        linear(f, "atm", 101325.0, "kg m-1 s-2");
        linear(f, "torr", 133.322, "kg m-1 s-2");
        linear(f, "psi", 6894.0, "kg m-1 s-2");
        // AREA
        linear(f, "ac", 4046.8564224, "m2");
        linear(f, "a", 100.0, "m2"); // are
        // FLUX: absolute magnitudes
        linear(f, "Jy", 1e-26, "kg s-2 cy-1");
        nonlinear(f, "vegamag", Kind.VEGA_MAG, "kg m-1 s-3");
        nonlinear(f, "mag", Kind.VEGA_MAG, "kg m-1 s-3");
        nonlinear(f, "STmag", Kind.ST_MAG, "kg m-1 s-3");
        nonlinear(f, "ABmag", Kind.AB_MAG, "kg s-2 cy-1");
        // FLUX: colours and amplitudes
        nonlinear(f, "mag_color", Kind.COLOR_INDEX, "flux_ratio");
        linear(f, "flux_ratio", 1.0, "flux_ratio");
        linear(f, "ampl", 1e+00, "ampl");
        nonlinear(f, "Amag", Kind.AMPLITUDE_MAG, "ampl");
        linear(f, "pph", 1e-02, "ampl");
        linear(f, "ppt", 1e-03, "ampl");
        linear(f, "ppm", 1e-06, "ampl");
        FACTORS = Collections.unmodifiableMap(f);

        Map<String, Double> p = new LinkedHashMap<>();
        p.put("mu", 1e-06);
        p.put("da", 1e+01);
        p.put("y", 1e-24);
        p.put("z", 1e-21);
        p.put("a", 1e-18);
        p.put("f", 1e-15);
        p.put("p", 1e-12);
        p.put("n", 1e-09);
        p.put("m", 1e-03);
        p.put("c", 1e-02);
        p.put("d", 1e-01);
        p.put("h", 1e+02);
        p.put("k", 1e+03);
        p.put("M", 1e+06);
        p.put("G", 1e+09);
        p.put("T", 1e+12);
        p.put("P", 1e+15);
        p.put("E", 1e+18);
        p.put("Z", 1e+21);
        p.put("Y", 1e+24);
        PREFIXES = Collections.unmodifiableMap(p);

        List<String[]> a = new ArrayList<>();
        alias(a, "micron", "mum");
        alias(a, "au", "AU");
        alias(a, "micro", "mu");
        alias(a, "milli", "m");
        alias(a, "kilo", "k");
        alias(a, "mega", "M");
        alias(a, "giga", "G");
        alias(a, "nano", "n");
        alias(a, "watt", "W");
        alias(a, "Watt", "W");
        alias(a, "Hz", "hz");
        alias(a, "joule", "J");
        alias(a, "Joule", "J");
        alias(a, "jansky", "Jy");
        alias(a, "Jansky", "Jy");
        alias(a, "jy", "Jy");
        alias(a, "arcsec", "as");
        alias(a, "arcmin", "am");
        alias(a, "cycles", "cy");
        alias(a, "cycle", "cy");
        alias(a, "cyc", "cy");
        alias(a, "angstrom", "A");
        alias(a, "Angstrom", "A");
        alias(a, "inch", "in");
        alias(a, "^", "");
        alias(a, "**", "");
        alias(a, "galactic", "gal");
        alias(a, "equatorial", "equ");
        alias(a, "ecliptic", "ecl");
        alias(a, "Vegamag", "vegamag");
        ALIASES = Collections.unmodifiableList(a);
    }

    private UnitTables() {}

    private static void linear(Map<String, BaseUnit> f, String name, double factor, String siBase) {
        f.put(name, new BaseUnit(factor, null, siBase));
    }

    private static void nonlinear(Map<String, BaseUnit> f, String name, Kind kind, String siBase) {
        f.put(name, new BaseUnit(1.0, kind, siBase));
    }

    private static void alias(List<String[]> a, String from, String to) {
        a.add(new String[] {from, to});
    }
}
