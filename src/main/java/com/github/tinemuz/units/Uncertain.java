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
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A scalar value with a linearly propagated standard deviation.
 *
 * <p>Every value created with {@link #of(double, double)} is an independent
 * variable. Derived values keep, per independent variable, the product of the
 * partial derivative and that variable's standard deviation. Combining two
 * values that share a variable therefore accounts for the correlation, and
 * the standard deviation of any result is the root-sum-square of its
 * contributions.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class Uncertain implements Quantity {
    private static final AtomicLong NEXT_VARIABLE = new AtomicLong();
    private static final double LN10 = Math.log(10.0);

    private final double nominal;
    private final Map<Long, Double> contributions; // variable id -> dF/dx * sigma(x)

    private Uncertain(double nominal, Map<Long, Double> contributions) {
        this.nominal = nominal;
        this.contributions = contributions;
    }

    /** A value without uncertainty. */
    public static Uncertain exact(double value) {
        return new Uncertain(value, Collections.emptyMap());
    }

    /**
     * A new independent variable with the given standard deviation. A zero
     * error yields an exact value.
     */
    public static Uncertain of(double value, double stdDev) {
        if (stdDev == 0.0) return exact(value);
        Map<Long, Double> c = new HashMap<>(2);
        c.put(NEXT_VARIABLE.incrementAndGet(), Math.abs(stdDev));
        return new Uncertain(value, Collections.unmodifiableMap(c));
    }

    public double nominal() {
        return nominal;
    }

    /** Root-sum-square of all contributions; zero for exact values. */
    public double stdDev() {
        double sum = 0.0;
        for (double c : contributions.values()) sum += c * c;
        return Math.sqrt(sum);
    }

    /** True if at least one independent variable contributes to this value. */
    public boolean hasUncertainty() {
        return !contributions.isEmpty();
    }

    public Uncertain plus(Uncertain that) {
        return combine(nominal + that.nominal, 1.0, that, 1.0);
    }

    public Uncertain plus(double constant) {
        return new Uncertain(nominal + constant, contributions);
    }

    public Uncertain minus(Uncertain that) {
        return combine(nominal - that.nominal, 1.0, that, -1.0);
    }

    public Uncertain minus(double constant) {
        return plus(-constant);
    }

    public Uncertain times(Uncertain that) {
        return combine(nominal * that.nominal, that.nominal, that, nominal);
    }

    public Uncertain times(double factor) {
        return derive(nominal * factor, factor);
    }

    public Uncertain over(Uncertain that) {
        double q = nominal / that.nominal;
        return combine(q, 1.0 / that.nominal, that, -q / that.nominal);
    }

    public Uncertain over(double divisor) {
        return derive(nominal / divisor, 1.0 / divisor);
    }

    /** {@code constant / this}. */
    public Uncertain dividedInto(double constant) {
        double q = constant / nominal;
        return derive(q, -q / nominal);
    }

    public Uncertain negate() {
        return derive(-nominal, -1.0);
    }

    public Uncertain pow(double exponent) {
        double v = Math.pow(nominal, exponent);
        double d = exponent == 0.0 ? 0.0 : exponent * Math.pow(nominal, exponent - 1.0);
        return derive(v, d);
    }

    public Uncertain sqrt() {
        double v = Math.sqrt(nominal);
        return derive(v, 0.5 / v);
    }

    public Uncertain log10() {
        return derive(Math.log10(nominal), 1.0 / (nominal * LN10));
    }

    /** {@code 10^this}. */
    public Uncertain exp10() {
        double v = Math.pow(10.0, nominal);
        return derive(v, v * LN10);
    }

    // f(this) with df/dthis = derivative
    private Uncertain derive(double value, double derivative) {
        if (contributions.isEmpty()) return new Uncertain(value, contributions);
        Map<Long, Double> c = new HashMap<>(contributions.size() * 2);
        for (Map.Entry<Long, Double> e : contributions.entrySet())
            c.put(e.getKey(), e.getValue() * derivative);
        return new Uncertain(value, Collections.unmodifiableMap(c));
    }

    // f(this, that) with partials dThis and dThat
    private Uncertain combine(double value, double dThis, Uncertain that, double dThat) {
        if (contributions.isEmpty() && that.contributions.isEmpty())
            return new Uncertain(value, Collections.emptyMap());
        Map<Long, Double> c = new HashMap<>((contributions.size() + that.contributions.size()) * 2);
        for (Map.Entry<Long, Double> e : contributions.entrySet())
            c.put(e.getKey(), e.getValue() * dThis);
        for (Map.Entry<Long, Double> e : that.contributions.entrySet())
            c.merge(e.getKey(), e.getValue() * dThat, Double::sum);
        return new Uncertain(value, Collections.unmodifiableMap(c));
    }

    @Override
    public String toString() {
        return hasUncertainty() ? nominal + "+/-" + stdDev() : Double.toString(nominal);
    }
}
