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
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Element-wise conversion of arrays. An element that cannot be converted
 * becomes NaN and the remaining elements are still processed.
 */
public final class BatchConverter {
    private static final Logger log = LoggerFactory.getLogger(BatchConverter.class);

    private BatchConverter() {}

    /**
     * Converted values with their errors. {@code errors} is all zeros when no
     * element carried an uncertainty.
     */
    public record Result(double[] values, double[] errors) {}

    /** Convert every element with the same units and context. */
    public static Result convert(String from, String to, double[] values, double[] errors, ConversionContext context) {
        requireErrors(values, errors);
        return convert(
                Collections.nCopies(values.length, from),
                Collections.nCopies(values.length, to),
                values,
                errors,
                Collections.nCopies(values.length, context));
    }

    /**
     * Convert element {@code i} from {@code froms[i]} to {@code tos[i]} with
     * {@code contexts[i]}. {@code errors} may be null.
     *
     * @throws ArityException if the lists and arrays differ in length
     */
    public static Result convert(
            List<String> froms,
            List<String> tos,
            double[] values,
            double[] errors,
            List<ConversionContext> contexts) {
        int n = values.length;
        requireErrors(values, errors);
        if (froms.size() != n || tos.size() != n || contexts.size() != n) {
            throw new ArityException("Expected " + n + " units and contexts, got "
                    + froms.size() + " from, " + tos.size() + " to and " + contexts.size() + " contexts");
        }
        double[] outValues = new double[n];
        double[] outErrors = new double[n];
        for (int i = 0; i < n; i++) {
            Uncertain value = errors == null ? Uncertain.exact(values[i]) : Uncertain.of(values[i], errors[i]);
            try {
                Uncertain result = UnitConverter.convert(froms.get(i), tos.get(i), value, contexts.get(i));
                outValues[i] = result.nominal();
                outErrors[i] = result.stdDev();
            } catch (UnitConversionException e) {
                log.debug("Element {} ({} to {}) failed: {}", i, froms.get(i), tos.get(i), e.getMessage());
                outValues[i] = Double.NaN;
                outErrors[i] = Double.NaN;
            }
        }
        return new Result(outValues, outErrors);
    }

    private static void requireErrors(double[] values, double[] errors) {
        if (errors != null && errors.length != values.length) {
            throw new ArityException("Got " + values.length + " values but " + errors.length + " errors");
        }
    }
}
