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
package com.github.tinemuz.units.photometry;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.units.UnknownPassbandException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ZeroPointTableTest {

    @Nested
    @DisplayName("Bundled table")
    class Bundled {

        @Test
        @DisplayName("Loaded once")
        void singleton() {
            assertSame(ZeroPointTable.defaultTable(), ZeroPointTable.defaultTable());
        }

        @Test
        @DisplayName("Lookup ignores case")
        void lookup() {
            PassbandCalibration v = ZeroPointTable.defaultTable().lookup("johnson.v");
            assertEquals("JOHNSON.V", v.photband());
            assertEquals(5510.0, v.effWave(), 0.0);
            assertEquals(0.03, v.vegamag(), 0.0);
            assertEquals(3.631e-9, v.flam0(), 0.0);
            assertEquals("erg/s/cm2/A", v.flam0Units());
        }

        @Test
        @DisplayName("Unknown values are NaN")
        void nan() {
            assertTrue(Double.isNaN(ZeroPointTable.defaultTable().lookup("SDSS.G").vegamag()));
        }

        @Test
        @DisplayName("Unknown passband")
        void unknown() {
            ZeroPointTable table = ZeroPointTable.defaultTable();
            assertThrows(UnknownPassbandException.class, () -> table.lookup("JOHNSON.Q"));
            assertTrue(table.find("JOHNSON.Q").isEmpty());
            assertTrue(table.find(null).isEmpty());
        }

        @Test
        @DisplayName("Passbands are sorted")
        void sorted() {
            List<String> passbands = ZeroPointTable.defaultTable().passbands();
            assertEquals("2MASS.H", passbands.get(0));
            assertTrue(passbands.contains("STROMGREN.Y"));
            for (int i = 1; i < passbands.size(); i++) {
                assertTrue(passbands.get(i - 1).compareTo(passbands.get(i)) < 0);
            }
        }

        @Test
        @DisplayName("Header line is not kept as a comment")
        void comments() {
            List<String> comments = ZeroPointTable.defaultTable().comments();
            assertFalse(comments.isEmpty());
            assertTrue(comments.stream().noneMatch(c -> c.startsWith("photband")));
        }
    }

    @Nested
    @DisplayName("Reading and writing")
    class ReadWrite {

        @Test
        @DisplayName("Written table reads back identically")
        void roundTrip() {
            ZeroPointTable table = ZeroPointTable.defaultTable();
            StringWriter out = new StringWriter();
            table.write(out);
            ZeroPointTable again = ZeroPointTable.read(stream(out.toString()));
            assertEquals(table.passbands(), again.passbands());
            assertEquals(table.comments(), again.comments());
            for (String pb : table.passbands()) assertEquals(table.lookup(pb), again.lookup(pb));
        }

        @Test
        @DisplayName("Columns are aligned")
        void aligned() {
            StringWriter out = new StringWriter();
            ZeroPointTable.defaultTable().write(out);
            String[] lines = out.toString().split("\n");
            String header = lines[ZeroPointTable.defaultTable().comments().size()];
            String row = lines[lines.length - 1];
            assertTrue(header.startsWith("#photband"));
            assertEquals(header.indexOf(" eff_wave") + 1, row.indexOf(row.trim().split("\\s+")[1]));
        }

        @Test
        @DisplayName("New entry replaces the old one in a copy")
        void withEntry() {
            ZeroPointTable table = ZeroPointTable.defaultTable();
            PassbandCalibration v = table.lookup("JOHNSON.V");
            ZeroPointTable changed = table.withEntry(v.withVegamag(0.0));
            assertEquals(0.0, changed.lookup("JOHNSON.V").vegamag(), 0.0);
            assertEquals(0, changed.lookup("JOHNSON.V").vegamagLit());
            assertEquals(0.03, table.lookup("JOHNSON.V").vegamag(), 0.0);
            assertEquals(table.passbands().size(), changed.passbands().size());
        }

        @Test
        @DisplayName("Without a header row every comment is kept")
        void noHeaderRow() {
            String row = "X.Y 5000.0 CCD 0.0 1 nan 0 nan 0 1e-9 erg/s/cm2/A 1 nan Jy 0 me\n";
            ZeroPointTable table = ZeroPointTable.read(stream("# first note\n# last note\n" + row));
            assertEquals(List.of(" first note", " last note"), table.comments());
            assertEquals(List.of("X.Y"), table.passbands());

            ZeroPointTable withHeader = ZeroPointTable.read(
                    stream("# first note\n#photband eff_wave\n" + row));
            assertEquals(List.of(" first note"), withHeader.comments());
        }

        @Test
        @DisplayName("Malformed row")
        void malformed() {
            assertThrows(IllegalStateException.class,
                    () -> ZeroPointTable.read(stream("#photband eff_wave\nJOHNSON.V 5510\n")));
            assertThrows(IllegalStateException.class, () -> ZeroPointTable.read(stream(
                    "#h\nX.Y abc CCD 0 1 0 1 0 1 1e-9 erg/s/cm2/A 1 1 Jy 1 me\n")));
        }
    }

    // Helper methods

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
