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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.units.MalformedUnitExpressionException;
import com.github.tinemuz.units.SkyPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SkyFramesTest {

    private static final double ANGLE_TOL = 1e-9;

    @Nested
    @DisplayName("Precession")
    class Precession {

        @Test
        @DisplayName("Meeus example 21.b, theta Persei")
        void meeus() {
            SkyPosition start = degrees(41.054063, 49.227750);
            SkyPosition p = SkyFrames.precess(start, SkyFrames.J2000, 2462088.69);
            assertEquals(41.547214, p.longitudeDegrees(), 1e-6);
            assertEquals(49.348483, p.latitudeDegrees(), 1e-6);
        }

        @Test
        @DisplayName("Precessing back returns the start")
        void back() {
            SkyPosition start = degrees(41.054063, 49.227750);
            SkyPosition p = SkyFrames.precess(start, SkyFrames.J2000, 2462088.69);
            SkyPosition q = SkyFrames.precess(p, 2462088.69, SkyFrames.J2000);
            assertEquals(start.longitude(), q.longitude(), ANGLE_TOL);
            assertEquals(start.latitude(), q.latitude(), ANGLE_TOL);
        }

        @Test
        @DisplayName("Same epoch is a no-op")
        void sameEpoch() {
            SkyPosition start = degrees(10.0, 20.0);
            assertSame(start, SkyFrames.precess(start, SkyFrames.J2000, SkyFrames.J2000));
        }
    }

    @Nested
    @DisplayName("Frames")
    class Frames {

        @Test
        @DisplayName("Galactic centre")
        void galacticCentre() {
            double ra = Math.toRadians(SkyFrames.parseSexagesimal("17:45:40.4") * 15.0);
            double dec = Math.toRadians(SkyFrames.parseSexagesimal("-29:00:28.1"));
            SkyPosition gal = SkyFrames.equatorialToGalactic(new SkyPosition(ra, dec), SkyFrames.J2000);
            assertEquals(6.282224277178722, gal.longitude(), ANGLE_TOL);
            assertEquals(-0.0008251788338988985, gal.latitude(), ANGLE_TOL);
        }

        @Test
        @DisplayName("Galactic round trip at another epoch")
        void galacticRoundTrip() {
            double b1950 = SkyFrames.epochToJulianDay("1950");
            SkyPosition equ = degrees(83.8221, -5.3911);
            SkyPosition gal = SkyFrames.equatorialToGalactic(equ, b1950);
            SkyPosition back = SkyFrames.galacticToEquatorial(gal, b1950);
            assertEquals(equ.longitude(), back.longitude(), ANGLE_TOL);
            assertEquals(equ.latitude(), back.latitude(), ANGLE_TOL);
        }

        @Test
        @DisplayName("Equinox of the summer solstice lies on the ecliptic")
        void ecliptic() {
            SkyPosition ecl = SkyFrames.equatorialToEcliptic(new SkyPosition(Math.PI / 2, 0.0), SkyFrames.J2000);
            assertEquals(Math.PI / 2, ecl.longitude(), ANGLE_TOL);
            assertEquals(-0.40909280422232897, ecl.latitude(), ANGLE_TOL);
            SkyPosition equ = SkyFrames.eclipticToEquatorial(ecl, SkyFrames.J2000);
            assertEquals(Math.PI / 2, equ.longitude(), ANGLE_TOL);
            assertEquals(0.0, equ.latitude(), ANGLE_TOL);
        }

        @Test
        @DisplayName("Longitudes are normalized")
        void normalized() {
            SkyPosition ecl = SkyFrames.equatorialToEcliptic(degrees(350.0, -10.0), SkyFrames.J2000);
            assertTrue(ecl.longitude() >= 0.0 && ecl.longitude() < 2 * Math.PI);
        }

        @Test
        @DisplayName("Obliquity at J2000")
        void obliquity() {
            assertEquals(84381.448, Math.toDegrees(SkyFrames.meanObliquity(SkyFrames.J2000)) * 3600.0, 1e-6);
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Sexagesimal fields")
        void sexagesimal() {
            assertEquals(-29.007805555555557, SkyFrames.parseSexagesimal("-29:00:28.1"), 1e-12);
            assertEquals(12.5, SkyFrames.parseSexagesimal("12:30"), 1e-12);
            assertEquals(7.25, SkyFrames.parseSexagesimal("+7.25"), 1e-12);
        }

        @Test
        @DisplayName("Malformed sexagesimal")
        void malformedSexagesimal() {
            assertThrows(MalformedUnitExpressionException.class, () -> SkyFrames.parseSexagesimal("1:2:3:4"));
            assertThrows(MalformedUnitExpressionException.class, () -> SkyFrames.parseSexagesimal("ab:cd"));
            assertThrows(MalformedUnitExpressionException.class, () -> SkyFrames.parseSexagesimal(""));
        }

        @Test
        @DisplayName("Epochs")
        void epochs() {
            assertEquals(2451545.0, SkyFrames.epochToJulianDay("J2000"), 0.0);
            assertEquals(2451545.0, SkyFrames.epochToJulianDay("2000"), 0.0);
            assertEquals(2433282.5, SkyFrames.epochToJulianDay("1950"), 0.0);
            assertThrows(MalformedUnitExpressionException.class, () -> SkyFrames.epochToJulianDay("B1950"));
        }
    }

    // Helper methods

    private static SkyPosition degrees(double lon, double lat) {
        return new SkyPosition(Math.toRadians(lon), Math.toRadians(lat));
    }
}
