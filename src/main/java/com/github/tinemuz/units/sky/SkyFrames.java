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
package com.github.tinemuz.units.sky;

import com.github.tinemuz.units.MalformedUnitExpressionException;
import com.github.tinemuz.units.SkyPosition;

/**
 * Rotations between equatorial, galactic and ecliptic coordinates. All angles
 * are radians; longitudes are returned in {@code [0, 2pi)}.
 *
 * <p>Galactic coordinates are defined for the J2000 equinox, so equatorial
 * positions of other epochs are precessed first. Ecliptic coordinates use the
 * mean obliquity of the epoch of the equatorial position.</p>
 */
public final class SkyFrames {

    /** Julian day of the J2000.0 epoch. */
    public static final double J2000 = 2451545.0;

    private static final double DAYS_PER_CENTURY = 36525.0;
    private static final double ARCSEC = Math.PI / 180.0 / 3600.0;
    private static final double TWO_PI = 2 * Math.PI;

    // North galactic pole and longitude of the north celestial pole, J2000
    private static final double NGP_RA = Math.toRadians(192.85948);
    private static final double NGP_DEC = Math.toRadians(27.12825);
    private static final double NCP_LON = Math.toRadians(122.93192);

    private SkyFrames() {}

    /**
     * Julian day of an epoch given as a (Julian) year, e.g. {@code "2000"},
     * {@code "J2000"} or {@code "1950.5"}.
     */
    public static double epochToJulianDay(String epoch) {
        String s = epoch.trim();
        if (s.startsWith("J") || s.startsWith("j")) s = s.substring(1);
        double year;
        try {
            year = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new MalformedUnitExpressionException("Cannot read epoch '" + epoch + "'", e);
        }
        return J2000 + (year - 2000.0) * 365.25;
    }

    /**
     * Precess equatorial coordinates between two epochs with the IAU 1976
     * precession angles (Lieske et al. 1977).
     */
    public static SkyPosition precess(SkyPosition equatorial, double fromJd, double toJd) {
        if (fromJd == toJd) return equatorial;
        double bigT = (fromJd - J2000) / DAYS_PER_CENTURY;
        double t = (toJd - fromJd) / DAYS_PER_CENTURY;
        double t2 = t * t;
        double t3 = t2 * t;

        double base = 2306.2181 + 1.39656 * bigT - 0.000139 * bigT * bigT;
        double zeta = (base * t + (0.30188 - 0.000344 * bigT) * t2 + 0.017998 * t3) * ARCSEC;
        double z = (base * t + (1.09468 + 0.000066 * bigT) * t2 + 0.018203 * t3) * ARCSEC;
        double theta = ((2004.3109 - 0.85330 * bigT - 0.000217 * bigT * bigT) * t
                - (0.42665 + 0.000217 * bigT) * t2 - 0.041833 * t3) * ARCSEC;

        double ra = equatorial.longitude();
        double dec = equatorial.latitude();
        double a = Math.cos(dec) * Math.sin(ra + zeta);
        double b = Math.cos(theta) * Math.cos(dec) * Math.cos(ra + zeta) - Math.sin(theta) * Math.sin(dec);
        double c = Math.sin(theta) * Math.cos(dec) * Math.cos(ra + zeta) + Math.cos(theta) * Math.sin(dec);
        return new SkyPosition(normalize(Math.atan2(a, b) + z), Math.asin(c));
    }

    /** Equatorial coordinates of the given epoch to galactic coordinates. */
    public static SkyPosition equatorialToGalactic(SkyPosition equatorial, double epochJd) {
        SkyPosition j2000 = precess(equatorial, epochJd, J2000);
        double ra = j2000.longitude();
        double dec = j2000.latitude();
        double dra = ra - NGP_RA;
        double b = Math.asin(Math.sin(dec) * Math.sin(NGP_DEC) + Math.cos(dec) * Math.cos(NGP_DEC) * Math.cos(dra));
        double y = Math.cos(dec) * Math.sin(dra);
        double x = Math.sin(dec) * Math.cos(NGP_DEC) - Math.cos(dec) * Math.sin(NGP_DEC) * Math.cos(dra);
        return new SkyPosition(normalize(NCP_LON - Math.atan2(y, x)), b);
    }

    /** Galactic coordinates to equatorial coordinates of the given epoch. */
    public static SkyPosition galacticToEquatorial(SkyPosition galactic, double epochJd) {
        double l = galactic.longitude();
        double b = galactic.latitude();
        double dl = NCP_LON - l;
        double dec = Math.asin(Math.sin(b) * Math.sin(NGP_DEC) + Math.cos(b) * Math.cos(NGP_DEC) * Math.cos(dl));
        double y = Math.cos(b) * Math.sin(dl);
        double x = Math.sin(b) * Math.cos(NGP_DEC) - Math.cos(b) * Math.sin(NGP_DEC) * Math.cos(dl);
        SkyPosition j2000 = new SkyPosition(normalize(NGP_RA + Math.atan2(y, x)), dec);
        return precess(j2000, J2000, epochJd);
    }

    public static SkyPosition equatorialToEcliptic(SkyPosition equatorial, double epochJd) {
        double eps = meanObliquity(epochJd);
        double ra = equatorial.longitude();
        double dec = equatorial.latitude();
        double lon = Math.atan2(Math.sin(ra) * Math.cos(eps) + Math.tan(dec) * Math.sin(eps), Math.cos(ra));
        double lat = Math.asin(Math.sin(dec) * Math.cos(eps) - Math.cos(dec) * Math.sin(eps) * Math.sin(ra));
        return new SkyPosition(normalize(lon), lat);
    }

    public static SkyPosition eclipticToEquatorial(SkyPosition ecliptic, double epochJd) {
        double eps = meanObliquity(epochJd);
        double lon = ecliptic.longitude();
        double lat = ecliptic.latitude();
        double ra = Math.atan2(Math.sin(lon) * Math.cos(eps) - Math.tan(lat) * Math.sin(eps), Math.cos(lon));
        double dec = Math.asin(Math.sin(lat) * Math.cos(eps) + Math.cos(lat) * Math.sin(eps) * Math.sin(lon));
        return new SkyPosition(normalize(ra), dec);
    }

    /** Mean obliquity of the ecliptic, IAU 1980. */
    public static double meanObliquity(double jd) {
        double t = (jd - J2000) / DAYS_PER_CENTURY;
        double arcsec = 84381.448 - 46.8150 * t - 0.00059 * t * t + 0.001813 * t * t * t;
        return arcsec * ARCSEC;
    }

    /**
     * Read {@code [-]D:M:S} (or {@code D:M}, or {@code D}) as a decimal number
     * in the unit of the first field.
     */
    public static double parseSexagesimal(String text) {
        String s = text.trim();
        boolean negative = s.startsWith("-");
        if (negative || s.startsWith("+")) s = s.substring(1);
        String[] fields = s.split(":");
        if (fields.length > 3 || s.isEmpty()) {
            throw new MalformedUnitExpressionException("Cannot read sexagesimal angle '" + text + "'");
        }
        double value = 0.0;
        double unit = 1.0;
        try {
            for (String field : fields) {
                value += Double.parseDouble(field) / unit;
                unit *= 60.0;
            }
        } catch (NumberFormatException e) {
            throw new MalformedUnitExpressionException("Cannot read sexagesimal angle '" + text + "'", e);
        }
        return negative ? -value : value;
    }

    private static double normalize(double angle) {
        double a = angle % TWO_PI;
        return a < 0 ? a + TWO_PI : a;
    }
}
