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

import com.github.tinemuz.units.photometry.PassbandCalibration;
import com.github.tinemuz.units.photometry.ZeroPointTable;
import com.github.tinemuz.units.sky.SkyFrames;
import java.util.Locale;
import java.util.Map;

/**
 * A unit whose relation to its SI base is not a constant factor, such as a
 * temperature scale, a magnitude system or a calendar.
 *
 * <p>A converter is always a single leaf of a unit expression. A metric prefix
 * or numeric factor in front of it ends up in {@link #prefix}, an explicit
 * exponent in {@link #power}. Only a power of one can actually be converted;
 * calendar and coordinate kinds additionally refuse a prefix.</p>
 *
 * @param kind   which scale or system
 * @param prefix multiplicative prefix applied to the native value
 * @param power  exponent the unit was written with
 */
public record NonlinearConverter(Kind kind, double prefix, int power) {

    static NonlinearConverter of(Kind kind) {
        return new NonlinearConverter(kind, 1.0, 1);
    }

    /** Multiply the prefix, e.g. for {@code kF}. */
    public NonlinearConverter scale(double factor) {
        return new NonlinearConverter(kind, prefix * factor, power);
    }

    /** Raise to an explicit exponent, e.g. for {@code F2}. */
    public NonlinearConverter raisePower(int exponent) {
        return new NonlinearConverter(kind, prefix, power * exponent);
    }

    /** Native value to its SI representation. */
    public Quantity forward(Quantity value, ConversionContext context) {
        checkConvertible();
        return kind.forward(value, prefix, context);
    }

    /** SI representation back to the native value. */
    public Quantity inverse(Quantity value, ConversionContext context) {
        checkConvertible();
        return kind.inverse(value, prefix, context);
    }

    private void checkConvertible() {
        if (power != 1) {
            throw new UnsupportedConversionException(
                    "Nonlinear unit " + kind + " cannot be raised to power " + power);
        }
        if (!kind.scalable && prefix != 1.0) {
            throw new UnsupportedConversionException(
                    "Nonlinear unit " + kind + " does not accept a prefix or factor (" + prefix + ")");
        }
    }

    /** The fixed set of nonlinear scales. */
    public enum Kind {
        FAHRENHEIT(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).times(prefix).plus(459.67).times(5.0 / 9.0);
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).times(9.0 / 5.0).minus(459.67).over(prefix);
            }
        },
        CELSIUS(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).times(prefix).plus(273.15);
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).minus(273.15).over(prefix);
            }
        },
        AMPLITUDE_MAG(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).times(prefix / 2.5).exp10().minus(1.0);
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).plus(1.0).log10().times(2.5).over(prefix);
            }
        },
        VEGA_MAG(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                PassbandCalibration cal = calibration(context, this);
                return magToFlux(scalar(value, this).times(prefix), vegaZeroFlux(cal), cal.vegamag());
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                PassbandCalibration cal = calibration(context, this);
                return fluxToMag(scalar(value, this), vegaZeroFlux(cal), cal.vegamag()).over(prefix);
            }
        },
        AB_MAG(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                PassbandCalibration cal = calibration(context, this);
                return magToFlux(
                        scalar(value, this).times(prefix), PhysicalConstants.AB_ZERO_FLUX, cal.abMag());
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                PassbandCalibration cal = calibration(context, this);
                return fluxToMag(scalar(value, this), PhysicalConstants.AB_ZERO_FLUX, cal.abMag())
                        .over(prefix);
            }
        },
        ST_MAG(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                PassbandCalibration cal = calibration(context, this);
                return magToFlux(
                        scalar(value, this).times(prefix), PhysicalConstants.ST_ZERO_FLUX, cal.stMag());
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                PassbandCalibration cal = calibration(context, this);
                return fluxToMag(scalar(value, this), PhysicalConstants.ST_ZERO_FLUX, cal.stMag())
                        .over(prefix);
            }
        },
        /**
         * Colour index to flux ratio. Handles {@code SYSTEM.A-B} colours and the
         * Strömgren indices {@code c1 = u - 2v + b} and {@code m1 = v - 2b + y}.
         * Reference bands are evaluated at magnitude 0 (forward) or unit flux
         * (inverse), so forward and inverse are exact inverses.
         */
        COLOR_INDEX(true) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                String photband = requirePhotband(context, this);
                Uncertain color = scalar(value, this).times(prefix);
                String[] parts = splitPassband(photband);
                String system = parts[0];
                String band = parts[1];
                if (band.contains("-")) {
                    String[] bands = band.split("-", 2);
                    Uncertain f0 = bandFlux(system, bands[0], color);
                    Uncertain f1 = bandFlux(system, bands[1], Uncertain.exact(0.0));
                    return f0.over(f1);
                }
                if ("STROMGREN.C1".equals(photband)) {
                    Uncertain fu = bandFlux("STROMGREN", "U", color);
                    Uncertain fb = bandFlux("STROMGREN", "B", Uncertain.exact(0.0));
                    Uncertain fv = bandFlux("STROMGREN", "V", Uncertain.exact(0.0));
                    return fu.times(fb).over(fv.pow(2));
                }
                if ("STROMGREN.M1".equals(photband)) {
                    Uncertain fv = bandFlux("STROMGREN", "V", color);
                    Uncertain fy = bandFlux("STROMGREN", "Y", Uncertain.exact(0.0));
                    Uncertain fb = bandFlux("STROMGREN", "B", Uncertain.exact(0.0));
                    return fv.times(fy).over(fb.pow(2));
                }
                throw new UnknownPassbandException("No color calibrations for " + photband);
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                String photband = requirePhotband(context, this);
                Uncertain ratio = scalar(value, this);
                String[] parts = splitPassband(photband);
                String system = parts[0];
                String band = parts[1];
                Uncertain unit = Uncertain.exact(1.0);
                if (band.contains("-")) {
                    String[] bands = band.split("-", 2);
                    Uncertain m0 = bandMag(system, bands[0], ratio);
                    Uncertain m1 = bandMag(system, bands[1], unit);
                    return m0.minus(m1).over(prefix);
                }
                if ("STROMGREN.C1".equals(photband)) {
                    Uncertain mu = bandMag("STROMGREN", "U", ratio);
                    Uncertain mv = bandMag("STROMGREN", "V", unit);
                    Uncertain mb = bandMag("STROMGREN", "B", unit);
                    return mu.minus(mv.times(2.0)).plus(mb).over(prefix);
                }
                if ("STROMGREN.M1".equals(photband)) {
                    Uncertain mv = bandMag("STROMGREN", "V", ratio);
                    Uncertain mb = bandMag("STROMGREN", "B", unit);
                    Uncertain my = bandMag("STROMGREN", "Y", unit);
                    return mv.minus(mb.times(2.0)).plus(my).over(prefix);
                }
                throw new UnknownPassbandException("No color calibrations for " + photband);
            }
        },
        /** Fliegel and Van Flandern (1968), shifted by half a day to start at midnight. */
        CALENDAR_DATE(false) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                if (!(value instanceof CalendarDate)) {
                    throw new UnsupportedConversionException(
                            "Calendar date expected for CD, got " + value);
                }
                CalendarDate date = (CalendarDate) value;
                long year = (long) date.year();
                long month = (long) date.month();
                long a = Math.floorDiv(14 - month, 12);
                long y = year + 4800 - a;
                long m = month + 12 * a - 3;
                double jd = date.day()
                        + Math.floorDiv(153 * m + 2, 5)
                        + 365 * y
                        + Math.floorDiv(y, 4)
                        - Math.floorDiv(y, 100)
                        + Math.floorDiv(y, 400)
                        - 32045;
                jd += date.hour() / 24.0;
                jd += date.minute() / 24.0 / 60.0;
                jd += date.second() / 24.0 / 3600.0;
                jd -= 0.5;
                return Uncertain.exact(jd);
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                double jd = scalar(value, this).nominal();
                double l = jd + 68569;
                double n = Math.floor(4 * l / 146097);
                l = l - Math.floor((146097 * n + 3) / 4);
                double i = Math.floor(4000 * (l + 1) / 1461001);
                l = l - Math.floor(1461 * i / 4) + 31;
                double j = Math.floor(80 * l / 2447);
                double day = l - Math.floor(2447 * j / 80) + 0.5;
                l = Math.floor(j / 11);
                double month = j + 2 - 12 * l;
                double year = 100 * (n - 49) + i + l;
                return CalendarDate.of(year, month, day);
            }
        },
        MODIFIED_JULIAN_DAY(false) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).plus(julianZeroPoint(context));
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                return scalar(value, this).minus(julianZeroPoint(context));
            }
        },
        EQUATORIAL(false) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                return position(value, true, this);
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                return position(value, true, this);
            }
        },
        GALACTIC(false) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                SkyPosition gal = position(value, false, this);
                return SkyFrames.galacticToEquatorial(gal, epochJulianDay(context));
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                SkyPosition equ = position(value, true, this);
                return SkyFrames.equatorialToGalactic(equ, epochJulianDay(context));
            }
        },
        ECLIPTIC(false) {
            @Override
            Quantity forward(Quantity value, double prefix, ConversionContext context) {
                SkyPosition ecl = position(value, false, this);
                return SkyFrames.eclipticToEquatorial(ecl, epochJulianDay(context));
            }

            @Override
            Quantity inverse(Quantity value, double prefix, ConversionContext context) {
                SkyPosition equ = position(value, true, this);
                return SkyFrames.equatorialToEcliptic(equ, epochJulianDay(context));
            }
        };

        private static final Map<String, Double> JULIAN_ZERO_POINTS =
                Map.of("COROT", 2451545.0, "HIP", 2440000.0, "MJD", 2400000.5);

        private final boolean scalable;

        Kind(boolean scalable) {
            this.scalable = scalable;
        }

        abstract Quantity forward(Quantity value, double prefix, ConversionContext context);

        abstract Quantity inverse(Quantity value, double prefix, ConversionContext context);

        private static Uncertain scalar(Quantity value, Kind kind) {
            if (value instanceof Uncertain) return (Uncertain) value;
            throw new UnsupportedConversionException(kind + " expects a scalar value, got " + value);
        }

        private static String requirePhotband(ConversionContext context, Kind kind) {
            if (context.photband() == null) {
                throw new MissingContextException(kind + " conversion needs a photband");
            }
            return context.photband().toUpperCase(Locale.ROOT);
        }

        private static PassbandCalibration calibration(ConversionContext context, Kind kind) {
            return ZeroPointTable.defaultTable().lookup(requirePhotband(context, kind));
        }

        private static String[] splitPassband(String photband) {
            int dot = photband.indexOf('.');
            if (dot < 0) throw new UnknownPassbandException("Not a SYSTEM.FILTER passband: " + photband);
            return new String[] {photband.substring(0, dot), photband.substring(dot + 1)};
        }

        // 10^(-(mag - mag0)/2.5) * F0, unknown mag0 counts as 0
        private static Uncertain magToFlux(Uncertain mag, double zeroFlux, double mag0) {
            return mag.minus(zeroIfNaN(mag0)).over(-2.5).exp10().times(zeroFlux);
        }

        private static Uncertain fluxToMag(Uncertain flux, double zeroFlux, double mag0) {
            return flux.over(zeroFlux).log10().times(-2.5).plus(zeroIfNaN(mag0));
        }

        private static double zeroIfNaN(double mag0) {
            return Double.isNaN(mag0) ? 0.0 : mag0;
        }

        private static double vegaZeroFlux(PassbandCalibration cal) {
            return UnitConverter.convert(cal.flam0Units(), "W/m3", cal.flam0());
        }

        // Vega magnitude of a single band to W/m3
        private static Uncertain bandFlux(String system, String band, Uncertain mag) {
            return UnitConverter.convert("mag", "SI", mag, bandContext(system, band));
        }

        // W/m3 to Vega magnitude of a single band
        private static Uncertain bandMag(String system, String band, Uncertain flux) {
            return UnitConverter.convert("W/m3", "mag", flux, bandContext(system, band));
        }

        private static ConversionContext bandContext(String system, String band) {
            return ConversionContext.builder().photband(system + "." + band).build();
        }

        private static double julianZeroPoint(ConversionContext context) {
            String jtype = context.jtype() == null ? "MJD" : context.jtype().toUpperCase(Locale.ROOT);
            Double zp = JULIAN_ZERO_POINTS.get(jtype);
            if (zp == null) {
                throw new UnsupportedConversionException(
                        "Unknown Julian day type " + jtype + ", expected one of " + JULIAN_ZERO_POINTS.keySet());
            }
            return zp;
        }

        private static double epochJulianDay(ConversionContext context) {
            return SkyFrames.epochToJulianDay(context.epoch() == null ? "2000" : context.epoch());
        }

        // Right ascension in sexagesimal notation is in hours, everything else in degrees
        private static SkyPosition position(Quantity value, boolean equatorial, Kind kind) {
            if (value instanceof SkyPosition) return (SkyPosition) value;
            if (value instanceof SkyPosition.Sexagesimal) {
                SkyPosition.Sexagesimal s = (SkyPosition.Sexagesimal) value;
                double lon = SkyFrames.parseSexagesimal(s.longitude());
                double lat = SkyFrames.parseSexagesimal(s.latitude());
                return new SkyPosition(Math.toRadians(equatorial ? lon * 15.0 : lon), Math.toRadians(lat));
            }
            throw new UnsupportedConversionException(kind + " expects a sky position, got " + value);
        }
    }
}
