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

import static com.github.tinemuz.units.PhysicalConstants.CC;

import com.github.tinemuz.units.photometry.PassbandCalibration;
import com.github.tinemuz.units.photometry.ResponseCurves;
import com.github.tinemuz.units.photometry.ZeroPointTable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges between quantities of different dimensions that are related through
 * a reference wavelength, frequency or angular size: wavelength and Doppler
 * velocity, flux per frequency and per wavelength, per steradian and absolute.
 *
 * <p>Bridges are keyed by the leftover dimensions of source over target with
 * all spaces removed and {@code "_to_"} appended, e.g. {@code "cy-1m1s1_to_"}
 * takes a flux density per hertz to one per metre. Inputs and outputs are SI.</p>
 */
public final class SwitchFunctions {
    private static final Logger log = LoggerFactory.getLogger(SwitchFunctions.class);

    /** One bridge; values and context are in SI. */
    @FunctionalInterface
    public interface SwitchFunction {
        Uncertain apply(Uncertain value, ConversionContext context);
    }

    private static final Map<String, SwitchFunction> TABLE;

    static {
        Map<String, SwitchFunction> t = new LinkedHashMap<>();
        t.put("s1_to_", SwitchFunctions::distanceToVelocity);
        t.put("s-1_to_", SwitchFunctions::velocityToDistance);
        t.put("cy-1m1_to_", SwitchFunctions::distanceToSpatialFrequency);
        t.put("cy1m-1_to_", SwitchFunctions::spatialFrequencyToDistance);
        t.put("cy-1m1s1_to_", SwitchFunctions::fnuToFlambda);
        t.put("cy1m-1s-1_to_", SwitchFunctions::flambdaToFnu);
        t.put("cy-1s1_to_", SwitchFunctions::fnuToNuFnu);
        t.put("cy1s-1_to_", SwitchFunctions::nuFnuToFnu);
        t.put("m1_to_", SwitchFunctions::lambdaFlambdaToFlambda);
        t.put("m-1_to_", SwitchFunctions::flambdaToLambdaFlambda);
        t.put("rad2_to_", SwitchFunctions::perSteradian);
        t.put("rad-2_to_", SwitchFunctions::timesSteradian);
        t.put("rad1_to_", SwitchFunctions::perCycle);
        t.put("rad-1_to_", SwitchFunctions::timesCycle);
        TABLE = Collections.unmodifiableMap(t);
    }

    private SwitchFunctions() {}

    /** The bridge for a key such as {@code "s1_to_"}, if there is one. */
    public static Optional<SwitchFunction> lookup(String key) {
        return Optional.ofNullable(TABLE.get(key));
    }

    /**
     * Doppler velocity of a wavelength relative to the context wavelength. A
     * passband in the context is ignored here.
     */
    public static Uncertain distanceToVelocity(Uncertain distance, ConversionContext context) {
        Uncertain wave = requireWave(context, "distance to velocity");
        return distance.minus(wave).over(wave).times(CC);
    }

    public static Uncertain velocityToDistance(Uncertain velocity, ConversionContext context) {
        Uncertain wave = requireWave(context, "velocity to distance");
        return wave.over(CC).times(velocity).plus(wave);
    }

    /** Baseline to spatial frequency, {@code 2 pi B / lambda}. */
    public static Uncertain distanceToSpatialFrequency(Uncertain baseline, ConversionContext context) {
        return baseline.times(2 * Math.PI).over(wavelength(context, "distance to spatial frequency"));
    }

    public static Uncertain spatialFrequencyToDistance(Uncertain frequency, ConversionContext context) {
        return wavelength(context, "spatial frequency to distance").times(frequency).over(2 * Math.PI);
    }

    public static Uncertain fnuToFlambda(Uncertain fnu, ConversionContext context) {
        Uncertain wave = referenceWave(context);
        if (wave != null) return wave.pow(2).dividedInto(CC).times(fnu);
        return requireFreq(context, "Fnu to Flambda").pow(2).over(CC).times(fnu);
    }

    public static Uncertain flambdaToFnu(Uncertain flambda, ConversionContext context) {
        Uncertain wave = referenceWave(context);
        if (wave != null) return wave.pow(2).over(CC).times(flambda);
        return requireFreq(context, "Flambda to Fnu").pow(2).dividedInto(CC).times(flambda);
    }

    public static Uncertain fnuToNuFnu(Uncertain fnu, ConversionContext context) {
        Uncertain wave = referenceWave(context);
        if (wave != null) return wave.dividedInto(CC).times(fnu);
        return requireFreq(context, "Fnu to nuFnu").times(fnu);
    }

    public static Uncertain nuFnuToFnu(Uncertain nuFnu, ConversionContext context) {
        Uncertain wave = referenceWave(context);
        if (wave != null) return wave.over(CC).times(nuFnu);
        return nuFnu.over(requireFreq(context, "nuFnu to Fnu"));
    }

    public static Uncertain flambdaToLambdaFlambda(Uncertain flambda, ConversionContext context) {
        return wavelength(context, "Flambda to lambda Flambda").times(flambda);
    }

    public static Uncertain lambdaFlambdaToFlambda(Uncertain lambdaFlambda, ConversionContext context) {
        return lambdaFlambda.over(wavelength(context, "lambda Flambda to Flambda"));
    }

    /** Divide by the projected surface of the source. */
    public static Uncertain perSteradian(Uncertain value, ConversionContext context) {
        return value.over(surface(context));
    }

    public static Uncertain timesSteradian(Uncertain value, ConversionContext context) {
        return value.times(surface(context));
    }

    public static Uncertain perCycle(Uncertain value, ConversionContext context) {
        return value.over(2 * Math.PI);
    }

    public static Uncertain timesCycle(Uncertain value, ConversionContext context) {
        return value.times(2 * Math.PI);
    }

    /**
     * Reference wavelength in metres: the effective wavelength of the
     * passband if one is given, otherwise the context wavelength, otherwise
     * null.
     */
    static Uncertain referenceWave(ConversionContext context) {
        if (context.photband() != null) return effectiveWavelength(context.photband());
        return context.wave() == null ? null : context.wave().value();
    }

    /**
     * Effective wavelength of a passband in metres, from the calibration table
     * or, if the table has none, from the response curve.
     *
     * @throws UnknownPassbandException if neither source knows the passband
     */
    public static Uncertain effectiveWavelength(String photband) {
        double angstrom = ZeroPointTable.defaultTable()
                .find(photband)
                .map(PassbandCalibration::effWave)
                .orElse(Double.NaN);
        if (Double.isNaN(angstrom)) angstrom = ResponseCurves.effectiveWavelength(photband);
        if (Double.isNaN(angstrom)) {
            throw new UnknownPassbandException("No effective wavelength known for " + photband);
        }
        log.debug("Effective wavelength of {} is {} A", photband, angstrom);
        return Uncertain.exact(angstrom * 1e-10);
    }

    // wave, or c/freq when only a frequency is known
    private static Uncertain wavelength(ConversionContext context, String bridge) {
        Uncertain wave = referenceWave(context);
        if (wave != null) return wave;
        return requireFreq(context, bridge).dividedInto(CC);
    }

    // Doppler bridges read the context wavelength only, never a passband
    private static Uncertain requireWave(ConversionContext context, String bridge) {
        if (context.wave() == null) {
            throw new MissingContextException("Reference wavelength (wave) not given for " + bridge);
        }
        return context.wave().value();
    }

    private static Uncertain requireFreq(ConversionContext context, String bridge) {
        if (context.freq() == null) {
            throw new MissingContextException("Reference wave/freq not given for " + bridge);
        }
        return context.freq().value();
    }

    private static Uncertain surface(ConversionContext context) {
        if (context.angDiam() != null) return context.angDiam().value().over(2.0).pow(2).times(Math.PI);
        if (context.radius() != null) return context.radius().value().pow(2).times(Math.PI);
        if (context.pix() != null) return context.pix().value().pow(2);
        throw new MissingContextException("Angular size (ang_diam/radius/pix) not given");
    }
}
