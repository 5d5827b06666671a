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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A unit expression reduced to a scale (or a nonlinear leaf) and a set of SI
 * base dimensions with integer exponents.
 *
 * <p>The dimension map never holds a zero exponent and is sorted by base
 * name, so two expressions are dimensionally equal exactly when their maps
 * are equal.</p>
 *
 * @param scale     linear SI factor; one when {@code nonlinear} is set
 * @param nonlinear the nonlinear leaf with all linear factors folded in, or null
 * @param dims      base name to exponent
 */
public record CanonicalUnit(double scale, NonlinearConverter nonlinear, SortedMap<String, Integer> dims) {

    public CanonicalUnit {
        TreeMap<String, Integer> copy = new TreeMap<>();
        for (Map.Entry<String, Integer> e : dims.entrySet()) {
            if (e.getValue() != 0) copy.put(e.getKey(), e.getValue());
        }
        dims = Collections.unmodifiableSortedMap(copy);
    }

    /** The SI unit with the given dimensions. */
    public static CanonicalUnit si(SortedMap<String, Integer> dims) {
        return new CanonicalUnit(1.0, null, dims);
    }

    public boolean isNonlinear() {
        return nonlinear != null;
    }

    /** Space separated base tokens, e.g. {@code "kg1 m-1 s-3"}. Empty if dimensionless. */
    public String signature() {
        return render(dims, " ");
    }

    public boolean sameDimensions(CanonicalUnit other) {
        return dims.equals(other.dims);
    }

    /**
     * Dimensions left over when converting this unit into {@code target}:
     * every base exponent of this minus the one of the target.
     */
    public SortedMap<String, Integer> minus(CanonicalUnit target) {
        TreeMap<String, Integer> left = new TreeMap<>(dims);
        for (Map.Entry<String, Integer> e : target.dims.entrySet()) {
            left.merge(e.getKey(), -e.getValue(), Integer::sum);
        }
        left.values().removeIf(v -> v == 0);
        return left;
    }

    static String render(Map<String, Integer> dims, String separator) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> e : dims.entrySet()) {
            if (sb.length() > 0) sb.append(separator);
            sb.append(e.getKey()).append(e.getValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return (isNonlinear() ? nonlinear.toString() : Double.toString(scale)) + " [" + signature() + "]";
    }
}
