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

import com.github.tinemuz.units.UnknownPassbandException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Photometric calibration of passbands: effective wavelengths, Vega, AB and ST
 * magnitude offsets and zero-point fluxes.
 *
 * <p>The table is a whitespace separated text file. Lines starting with
 * {@code #} are comments; the last comment line before the data names the
 * columns. The bundled table {@code zeropoints.dat} is read from the
 * classpath the first time {@link #defaultTable()} is called.</p>
 *
 * <p>Tables are immutable; {@link #withEntry} returns an updated copy.</p>
 */
public final class ZeroPointTable {
    private static final Logger log = LoggerFactory.getLogger(ZeroPointTable.class);

    static final String RESOURCE = "zeropoints.dat";
    static final List<String> COLUMNS = List.of(
            "photband", "eff_wave", "type",
            "vegamag", "vegamag_lit", "ABmag", "ABmag_lit", "STmag", "STmag_lit",
            "Flam0", "Flam0_units", "Flam0_lit", "Fnu0", "Fnu0_units", "Fnu0_lit",
            "source");

    private static volatile ZeroPointTable defaultTable;

    private final List<String> comments;
    private final SortedMap<String, PassbandCalibration> entries;

    private ZeroPointTable(List<String> comments, SortedMap<String, PassbandCalibration> entries) {
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    /**
     * The bundled calibration table, loaded once on first use.
     *
     * @throws IllegalStateException if the resource is missing or cannot be parsed
     */
    public static ZeroPointTable defaultTable() {
        ZeroPointTable table = defaultTable;
        if (table == null) table = ensureLoaded();
        return table;
    }

    private static synchronized ZeroPointTable ensureLoaded() {
        if (defaultTable != null) return defaultTable;
        InputStream in = ZeroPointTable.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Zero-point table '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Zero-point table '" + RESOURCE + "' not found on classpath");
        }
        defaultTable = read(in);
        log.debug("Loaded {} passband calibrations", defaultTable.entries.size());
        return defaultTable;
    }

    /**
     * Parse a table. The stream is closed afterwards.
     *
     * @throws IllegalStateException if the stream cannot be read or a row is malformed
     */
    public static ZeroPointTable read(InputStream in) {
        List<String> comments = new ArrayList<>();
        SortedMap<String, PassbandCalibration> entries = new TreeMap<>();
        int lineNo = 0;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                if (trimmed.startsWith("#")) {
                    comments.add(trimmed.substring(1));
                    continue;
                }
                PassbandCalibration cal = parseRow(trimmed.split("\\s+"));
                entries.put(cal.photband(), cal);
            }
        } catch (IOException e) {
            log.error("Failed to read zero-point table", e);
            throw new IllegalStateException("Failed to read zero-point table", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse zero-point table at line {}", lineNo, e);
            throw new IllegalStateException("Failed to parse zero-point table at line " + lineNo, e);
        }
        // a last comment line naming the columns is the header
        if (!comments.isEmpty() && isHeader(comments.get(comments.size() - 1))) {
            comments.remove(comments.size() - 1);
        }
        return new ZeroPointTable(comments, entries);
    }

    private static boolean isHeader(String comment) {
        return comment.trim().startsWith(COLUMNS.get(0));
    }

    private static PassbandCalibration parseRow(String[] t) {
        if (t.length != COLUMNS.size()) {
            throw new IllegalArgumentException("Expected " + COLUMNS.size() + " columns, got " + t.length);
        }
        return new PassbandCalibration(
                t[0].toUpperCase(Locale.ROOT), number(t[1]), t[2],
                number(t[3]), Integer.parseInt(t[4]),
                number(t[5]), Integer.parseInt(t[6]),
                number(t[7]), Integer.parseInt(t[8]),
                number(t[9]), t[10], Integer.parseInt(t[11]),
                number(t[12]), t[13], Integer.parseInt(t[14]),
                t[15]);
    }

    private static double number(String s) {
        return "nan".equalsIgnoreCase(s) ? Double.NaN : Double.parseDouble(s);
    }

    /**
     * Write the table in the same column order, with every column padded to
     * its widest cell. Comment lines are kept.
     */
    public void write(Writer out) {
        List<String[]> rows = new ArrayList<>();
        String[] header = COLUMNS.toArray(new String[0]);
        header[0] = "#" + header[0];
        rows.add(header);
        for (PassbandCalibration c : entries.values()) rows.add(cells(c));

        int[] width = new int[COLUMNS.size()];
        for (String[] row : rows)
            for (int i = 0; i < row.length; i++) width[i] = Math.max(width[i], row[i].length());

        try {
            for (String comment : comments) out.write("#" + comment + "\n");
            for (String[] row : rows) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < row.length; i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(row[i]);
                    if (i < row.length - 1) sb.append(" ".repeat(width[i] - row[i].length()));
                }
                out.write(sb.append('\n').toString());
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write zero-point table", e);
        }
    }

    private static String[] cells(PassbandCalibration c) {
        return new String[] {
            c.photband(), format(c.effWave()), c.type(),
            format(c.vegamag()), Integer.toString(c.vegamagLit()),
            format(c.abMag()), Integer.toString(c.abMagLit()),
            format(c.stMag()), Integer.toString(c.stMagLit()),
            format(c.flam0()), c.flam0Units(), Integer.toString(c.flam0Lit()),
            format(c.fnu0()), c.fnu0Units(), Integer.toString(c.fnu0Lit()),
            c.source()
        };
    }

    private static String format(double v) {
        return Double.isNaN(v) ? "nan" : Double.toString(v);
    }

    /**
     * Calibration of a passband.
     *
     * @throws UnknownPassbandException if the table has no such passband
     */
    public PassbandCalibration lookup(String photband) {
        return find(photband).orElseThrow(
                () -> new UnknownPassbandException("No calibration for passband " + photband));
    }

    public Optional<PassbandCalibration> find(String photband) {
        if (photband == null) return Optional.empty();
        return Optional.ofNullable(entries.get(photband.toUpperCase(Locale.ROOT)));
    }

    /** Copy of this table with {@code calibration} added or replacing the row of its passband. */
    public ZeroPointTable withEntry(PassbandCalibration calibration) {
        SortedMap<String, PassbandCalibration> copy = new TreeMap<>(entries);
        copy.put(calibration.photband().toUpperCase(Locale.ROOT), calibration);
        return new ZeroPointTable(comments, copy);
    }

    /** All passbands in sorted order. */
    public List<String> passbands() {
        return new ArrayList<>(entries.keySet());
    }

    public List<String> comments() {
        return comments;
    }

    @Override
    public String toString() {
        return "ZeroPointTable" + Arrays.toString(entries.keySet().toArray());
    }
}
