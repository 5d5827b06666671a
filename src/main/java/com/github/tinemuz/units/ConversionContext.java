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
 * Auxiliary quantities some conversions need: a reference wavelength or
 * frequency for flux conversions, an angular diameter, angular radius or
 * pixel size for solid angle bridges, a passband for magnitudes, a Julian day
 * flavour and an epoch for sky coordinates.
 *
 * <p>Quantities can be given in any unit; the converter brings them to SI
 * with {@link #toSI()} before use. Instances are immutable.</p>
 */
public final class ConversionContext {
    private static final ConversionContext EMPTY = builder().build();

    private final UnitValue wave;
    private final UnitValue freq;
    private final UnitValue angDiam;
    private final UnitValue radius;
    private final UnitValue pix;
    private final String photband;
    private final String jtype;
    private final String epoch;

    private ConversionContext(Builder b) {
        this.wave = b.wave;
        this.freq = b.freq;
        this.angDiam = b.angDiam;
        this.radius = b.radius;
        this.pix = b.pix;
        this.photband = b.photband;
        this.jtype = b.jtype;
        this.epoch = b.epoch;
    }

    public static ConversionContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Reference wavelength. */
    public UnitValue wave() {
        return wave;
    }

    /** Reference frequency. */
    public UnitValue freq() {
        return freq;
    }

    /** Angular diameter of the source. */
    public UnitValue angDiam() {
        return angDiam;
    }

    /** Angular radius of the source. */
    public UnitValue radius() {
        return radius;
    }

    /** Angular size of a square pixel. */
    public UnitValue pix() {
        return pix;
    }

    /** Passband in {@code SYSTEM.FILTER} form, e.g. {@code "GENEVA.V"}. */
    public String photband() {
        return photband;
    }

    /** Julian day flavour for {@code MJD}: {@code MJD}, {@code COROT} or {@code HIP}. */
    public String jtype() {
        return jtype;
    }

    /** Epoch of equatorial coordinates as a year, e.g. {@code "2000"}. */
    public String epoch() {
        return epoch;
    }

    /** Copy of this context with every quantity converted to SI. */
    public ConversionContext toSI() {
        if (isSI(wave) && isSI(freq) && isSI(angDiam) && isSI(radius) && isSI(pix)) return this;
        return toBuilder()
                .wave(toSI(wave))
                .freq(toSI(freq))
                .angDiam(toSI(angDiam))
                .radius(toSI(radius))
                .pix(toSI(pix))
                .build();
    }

    /** True if any quantity carries an uncertainty. */
    public boolean hasUncertainty() {
        return uncertain(wave) || uncertain(freq) || uncertain(angDiam) || uncertain(radius) || uncertain(pix);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.wave = wave;
        b.freq = freq;
        b.angDiam = angDiam;
        b.radius = radius;
        b.pix = pix;
        b.photband = photband;
        b.jtype = jtype;
        b.epoch = epoch;
        return b;
    }

    private static boolean isSI(UnitValue v) {
        return v == null || v.isSI();
    }

    private static UnitValue toSI(UnitValue v) {
        return v == null ? null : v.toSI();
    }

    private static boolean uncertain(UnitValue v) {
        return v != null && v.value().hasUncertainty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ConversionContext{");
        field(sb, "wave", wave);
        field(sb, "freq", freq);
        field(sb, "ang_diam", angDiam);
        field(sb, "radius", radius);
        field(sb, "pix", pix);
        field(sb, "photband", photband);
        field(sb, "jtype", jtype);
        field(sb, "epoch", epoch);
        return sb.append('}').toString();
    }

    private static void field(StringBuilder sb, String name, Object value) {
        if (value == null) return;
        if (sb.charAt(sb.length() - 1) != '{') sb.append(", ");
        sb.append(name).append('=').append(value);
    }

    public static final class Builder {
        private UnitValue wave;
        private UnitValue freq;
        private UnitValue angDiam;
        private UnitValue radius;
        private UnitValue pix;
        private String photband;
        private String jtype;
        private String epoch;

        private Builder() {}

        public Builder wave(UnitValue wave) {
            this.wave = wave;
            return this;
        }

        public Builder wave(double value, String unit) {
            return wave(UnitValue.of(value, unit));
        }

        public Builder wave(double value, double error, String unit) {
            return wave(UnitValue.of(value, error, unit));
        }

        public Builder freq(UnitValue freq) {
            this.freq = freq;
            return this;
        }

        public Builder freq(double value, String unit) {
            return freq(UnitValue.of(value, unit));
        }

        public Builder freq(double value, double error, String unit) {
            return freq(UnitValue.of(value, error, unit));
        }

        public Builder angDiam(UnitValue angDiam) {
            this.angDiam = angDiam;
            return this;
        }

        public Builder angDiam(double value, String unit) {
            return angDiam(UnitValue.of(value, unit));
        }

        public Builder angDiam(double value, double error, String unit) {
            return angDiam(UnitValue.of(value, error, unit));
        }

        public Builder radius(UnitValue radius) {
            this.radius = radius;
            return this;
        }

        public Builder radius(double value, String unit) {
            return radius(UnitValue.of(value, unit));
        }

        public Builder pix(UnitValue pix) {
            this.pix = pix;
            return this;
        }

        public Builder pix(double value, String unit) {
            return pix(UnitValue.of(value, unit));
        }

        public Builder photband(String photband) {
            this.photband = photband;
            return this;
        }

        public Builder jtype(String jtype) {
            this.jtype = jtype;
            return this;
        }

        public Builder epoch(String epoch) {
            this.epoch = epoch;
            return this;
        }

        public ConversionContext build() {
            return new ConversionContext(this);
        }
    }
}
