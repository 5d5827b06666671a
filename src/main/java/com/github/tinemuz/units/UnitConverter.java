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

import com.github.tinemuz.units.photometry.ZeroPointTable;
import java.util.SortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts values between unit expressions.
 *
 * <p>Units are written as space separated tokens with optional prefixes and
 * exponents, e.g. {@code "erg s-1 cm-2 A-1"}, or with slashes, e.g.
 * {@code "erg/s/cm2/A"}. Wrapping an expression in square brackets,
 * {@code "[K]"}, means the value is its base-10 logarithm. The target
 * {@code "SI"} stands for the SI unit with the dimensions of the source.</p>
 *
 * <p>Conversions between different dimensions go through a bridge that needs
 * extra information from the {@link ConversionContext}, for instance a
 * reference wavelength to go from Jansky to {@code erg/s/cm2/A}:</p>
 *
 * <pre>{@code
 * double flam = UnitConverter.convert("Jy", "erg/s/cm2/A", 1.0,
 *         ConversionContext.builder().wave(10000, "A").build());
 * }</pre>
 *
 * <p>Uncertainties are propagated linearly through every step.</p>
 */
public final class UnitConverter {
    private static final Logger log = LoggerFactory.getLogger(UnitConverter.class);

    private static final String SI = "SI";
    private static final int[] RADIAN_POWERS = {2, -2, 1, -1};

    private UnitConverter() {}

    /** Convert a plain number without context. */
    public static double convert(String from, String to, double value) {
        return convert(from, to, value, ConversionContext.empty());
    }

    /** Convert a plain number; only the nominal result is returned. */
    public static double convert(String from, String to, double value, ConversionContext context) {
        return convert(from, to, Uncertain.exact(value), context).nominal();
    }

    /**
     * Convert a value with its error.
     *
     * @return {@code {value, error}}
     */
    public static double[] convert(String from, String to, double value, double error) {
        return convert(from, to, ConversionContext.empty(), value, error);
    }

    /**
     * Convert {@code value} or {@code value, error}. The result holds the
     * error as a second element whenever an error was given or a context
     * entry carries one.
     *
     * @throws ArityException if not one or two numbers are given
     */
    public static double[] convert(String from, String to, ConversionContext context, double... args) {
        if (args == null || args.length < 1 || args.length > 2) {
            throw new ArityException(
                    "Expected a value or a value and an error, got " + (args == null ? 0 : args.length) + " numbers");
        }
        Uncertain start = args.length == 1 ? Uncertain.exact(args[0]) : Uncertain.of(args[0], args[1]);
        Uncertain result = convert(from, to, start, context);
        boolean contextError = context != null && context.hasUncertainty();
        if (args.length == 2 || contextError || result.hasUncertainty()) {
            return new double[] {result.nominal(), result.stdDev()};
        }
        return new double[] {result.nominal()};
    }

    /** Convert a scalar value, keeping its uncertainty. */
    public static Uncertain convert(String from, String to, Uncertain value, ConversionContext context) {
        Quantity result = convert(from, to, (Quantity) value, context);
        if (!(result instanceof Uncertain)) {
            throw new UnsupportedConversionException(
                    "Converting " + from + " to " + to + " does not give a scalar but " + result);
        }
        return (Uncertain) result;
    }

    /**
     * Convert any quantity: a scalar, a {@link CalendarDate} or a sky
     * position. This is the general form the other overloads delegate to.
     *
     * @throws UnknownUnitException             if a unit is not known
     * @throws MalformedUnitExpressionException if a unit cannot be read
     * @throws UnsupportedConversionException   if no bridge connects the dimensions
     * @throws MissingContextException          if a bridge lacks its reference quantity
     */
    public static Quantity convert(String from, String to, Quantity value, ConversionContext context) {
        if (from == null || to == null) throw new MalformedUnitExpressionException("Unit expression is null");
        if (value == null) throw new IllegalArgumentException("value is null");
        if (context == null) context = ConversionContext.empty();

        String fromExpr = from.trim();
        String toExpr = to.trim();
        Quantity start = value;
        if (isLogarithmic(fromExpr)) {
            fromExpr = unwrap(fromExpr);
            start = scalar(start, from).exp10();
        }
        boolean logTarget = isLogarithmic(toExpr);
        if (logTarget) toExpr = unwrap(toExpr);

        CanonicalUnit uniFrom = UnitParser.breakdown(fromExpr);
        CanonicalUnit uniTo = SI.equals(toExpr) ? CanonicalUnit.si(uniFrom.dims()) : UnitParser.breakdown(toExpr);
        ConversionContext ctx = context.toSI();

        boolean sameDims = uniFrom.sameDimensions(uniTo);
        if (!sameDims && ctx.wave() == null && !uniFrom.isNonlinear() && start instanceof Uncertain) {
            Uncertain asSI = ((Uncertain) start).times(uniFrom.scale());
            if ("m1".equals(uniFrom.signature())) {
                log.warn("Assumed input value to serve as reference wavelength");
                ctx = ctx.toBuilder().wave(UnitValue.si(asSI)).build();
            } else if ("cy1 s-1".equals(uniFrom.signature())) {
                log.warn("Assumed input value to serve as reference frequency");
                ctx = ctx.toBuilder().freq(UnitValue.si(asSI)).build();
            }
        }

        log.debug("Convert {} to {}", uniFrom.signature(), uniTo.signature());
        Quantity result;
        if (sameDims) {
            result = toSI(uniFrom, start, ctx);
        } else {
            SortedMap<String, Integer> leftover = uniFrom.minus(uniTo);
            Quantity running = start;
            boolean sourceApplied = false;

            Integer radians = leftover.get("rad");
            if (radians != null) {
                for (int power : RADIAN_POWERS) {
                    if (radians != power) continue;
                    String key = "rad" + power + "_to_";
                    log.debug("Switching {}", key);
                    Uncertain si = scalar(toSI(uniFrom, running, ctx), from);
                    running = bridge(key, from, to).apply(si, ctx);
                    leftover.remove("rad");
                    sourceApplied = true;
                    break;
                }
            }

            if (leftover.isEmpty()) {
                result = sourceApplied ? running : toSI(uniFrom, running, ctx);
            } else {
                String key = CanonicalUnit.render(leftover, "") + "_to_";
                log.debug("Switching {}", key);
                SwitchFunctions.SwitchFunction bridge = bridge(key, from, to);
                Quantity si = sourceApplied ? running : toSI(uniFrom, running, ctx);
                result = bridge.apply(scalar(si, from), ctx);
            }
        }

        if (uniTo.isNonlinear()) {
            result = uniTo.nonlinear().inverse(result, ctx);
        } else if (uniTo.scale() != 1.0) {
            result = scalar(result, to).over(uniTo.scale());
        }
        if (logTarget) result = scalar(result, to).log10();
        return result;
    }

    /** Load the calibration table so the first magnitude conversion does not pay for it. */
    public static void preload() {
        ZeroPointTable.defaultTable();
    }

    private static SwitchFunctions.SwitchFunction bridge(String key, String from, String to) {
        return SwitchFunctions.lookup(key).orElseThrow(() -> {
            log.error("Cannot convert {} to {}: no {} bridge", from, to, key);
            return new UnsupportedConversionException(
                    "Cannot convert " + from + " to " + to + ": no bridge for " + key);
        });
    }

    // native value of the source unit to SI
    private static Quantity toSI(CanonicalUnit unit, Quantity value, ConversionContext ctx) {
        if (unit.isNonlinear()) return unit.nonlinear().forward(value, ctx);
        if (unit.scale() == 1.0) return value;
        return scalar(value, unit.signature()).times(unit.scale());
    }

    private static Uncertain scalar(Quantity value, String unit) {
        if (value instanceof Uncertain) return (Uncertain) value;
        throw new UnsupportedConversionException("Unit " + unit + " needs a scalar value, got " + value);
    }

    private static boolean isLogarithmic(String expr) {
        return expr.length() > 2 && expr.charAt(0) == '[' && expr.charAt(expr.length() - 1) == ']';
    }

    private static String unwrap(String expr) {
        return expr.substring(1, expr.length() - 1).trim();
    }
}
