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

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns unit expressions such as {@code "erg s-1 cm-2 A-1"} or
 * {@code "10mW m-2/nm"} into a {@link CanonicalUnit}.
 *
 * <p>An expression is a whitespace separated list of tokens. Each token is an
 * optional numeric factor, an optional metric prefix, a base unit name and an
 * optional signed integer exponent. Slashes divide: every segment after a
 * {@code /} has its exponent negated.</p>
 */
public final class UnitParser {
    private static final Logger log = LoggerFactory.getLogger(UnitParser.class);

    // 10-07 or 10e-07 in front of a token
    private static final Pattern SCIENTIFIC = Pattern.compile("^(\\d\\d)[eE]?([-+])(\\d\\d)");
    private static final Pattern TOKEN = Pattern.compile("^(\\d+(?:\\.\\d+)?)?(.+?)(-?\\d+)$");

    private UnitParser() {}

    /**
     * Apply the alias table and rewrite division into negative exponents, so
     * that {@code "W/m2/mum"} becomes {@code "W m-2 mum-1"}.
     *
     * @throws MalformedUnitExpressionException for an empty divisor such as {@code "m//s"}
     */
    public static String normalize(String unit) {
        if (unit == null) throw new MalformedUnitExpressionException("Unit expression is null");
        String out = unit;
        for (String[] alias : UnitTables.ALIASES) {
            out = out.replace(alias[0], alias[1]);
        }
        if (!out.contains("/")) return out.trim();

        StringBuilder sb = new StringBuilder();
        for (String word : out.trim().split("\\s+")) {
            String[] parts = word.split("/", -1);
            if (!parts[0].isEmpty()) append(sb, parts[0]);
            for (int i = 1; i < parts.length; i++) {
                if (parts[i].isEmpty()) {
                    throw new MalformedUnitExpressionException("Empty divisor in '" + unit + "'");
                }
                append(sb, invert(parts[i], unit));
            }
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String token) {
        if (sb.length() > 0) sb.append(' ');
        sb.append(token);
    }

    private static String invert(String part, String unit) {
        if (UnitTables.FACTORS.containsKey(part)) return part + "-1";
        String candidate = endsWithDigit(part) ? part : part + "1";
        Matcher m = TOKEN.matcher(candidate);
        if (!m.matches()) {
            throw new MalformedUnitExpressionException("Cannot read divisor '" + part + "' in '" + unit + "'");
        }
        String factor = m.group(1) == null ? "" : m.group(1);
        return factor + m.group(2) + (-Integer.parseInt(m.group(3)));
    }

    /**
     * Decompose one token into its SI factor, SI base expression and exponent.
     * A numeric factor or scientific prefix is multiplied into the scale, as is
     * a metric prefix when the remainder is a known unit.
     *
     * @throws MalformedUnitExpressionException if the token has no recognizable shape
     * @throws UnknownUnitException             if the base is not a known unit
     */
    public static UnitToken components(String token) {
        String rest = token.trim();
        double factor = 1.0;

        Matcher sci = SCIENTIFIC.matcher(rest);
        if (sci.find()) {
            int exponent = Integer.parseInt(sci.group(3));
            if ("-".equals(sci.group(2))) exponent = -exponent;
            factor *= Math.pow(Double.parseDouble(sci.group(1)), exponent);
            rest = rest.substring(sci.end());
        }
        if (rest.isEmpty()) throw new MalformedUnitExpressionException("Empty unit token '" + token + "'");

        String basis;
        int power;
        if (UnitTables.FACTORS.containsKey(rest)) {
            basis = rest;
            power = 1;
        } else {
            Matcher m = TOKEN.matcher(endsWithDigit(rest) ? rest : rest + "1");
            if (!m.matches()) throw new MalformedUnitExpressionException("Cannot read unit token '" + token + "'");
            if (m.group(1) != null) factor *= Double.parseDouble(m.group(1));
            basis = m.group(2);
            power = Integer.parseInt(m.group(3));
        }

        UnitTables.BaseUnit base = UnitTables.FACTORS.get(basis);
        if (base == null) {
            for (Map.Entry<String, Double> prefix : UnitTables.PREFIXES.entrySet()) {
                String p = prefix.getKey();
                if (basis.length() > p.length() && basis.startsWith(p)) {
                    base = UnitTables.FACTORS.get(basis.substring(p.length()));
                    if (base != null) {
                        factor *= prefix.getValue();
                        break;
                    }
                }
            }
        }
        if (base == null) throw new UnknownUnitException("Unknown unit '" + basis + "' in token '" + token + "'");

        if (base.isNonlinear()) {
            return new UnitToken(1.0, NonlinearConverter.of(base.nonlinear()).scale(factor), base.siBase(), power);
        }
        return new UnitToken(factor * base.factor(), null, base.siBase(), power);
    }

    /**
     * Reduce a full expression to its scale and SI dimensions. Linear factors
     * are folded into a nonlinear leaf wherever they appear in the expression.
     *
     * @throws MalformedUnitExpressionException for an empty expression or two nonlinear units
     * @throws UnknownUnitException             if a token names no known unit
     */
    public static CanonicalUnit breakdown(String unit) {
        String normalized = normalize(unit);
        if (normalized.isEmpty()) throw new MalformedUnitExpressionException("Empty unit expression");

        double scale = 1.0;
        NonlinearConverter leaf = null;
        TreeMap<String, Integer> dims = new TreeMap<>();
        for (String tok : normalized.split("\\s+")) {
            UnitToken t = components(tok);
            if (t.isNonlinear()) {
                if (leaf != null) {
                    throw new MalformedUnitExpressionException(
                            "More than one nonlinear unit in '" + unit + "'");
                }
                leaf = t.nonlinear().raisePower(t.power());
            } else {
                scale *= Math.pow(t.scale(), t.power());
            }
            for (String sub : t.siBase().trim().split("\\s+")) {
                if (sub.isEmpty()) continue;
                UnitToken s = components(sub);
                dims.merge(s.siBase(), s.power() * t.power(), Integer::sum);
            }
        }
        if (leaf != null) {
            leaf = leaf.scale(scale);
            scale = 1.0;
        }
        CanonicalUnit result = new CanonicalUnit(scale, leaf, dims);
        log.trace("Parsed '{}' as {}", unit, result);
        return result;
    }

    private static boolean endsWithDigit(String s) {
        return !s.isEmpty() && Character.isDigit(s.charAt(s.length() - 1));
    }
}
