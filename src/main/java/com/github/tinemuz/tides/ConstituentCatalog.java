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
package com.github.tinemuz.tides;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static reference tables for tidal constituents.
 *
 * <p>Each known code maps to its orbital frequency and, where defined, its
 * Doodson coefficients, tidal potential amplitude and Earth tidal-potential
 * reduction factor. Values are loaded once from the classpath resource
 * <code>constituents.txt</code>.</p>
 *
 * <p>Only the {@link #DEFAULT_CONSTITUENTS} may be requested by callers; they
 * are the constituents carried by the TPXO harmonic dataset. The rest of the
 * file (the extended vocabulary) exists so every nodal-factor and Greenwich
 * formula has catalog data behind it.</p>
 */
public final class ConstituentCatalog {
    private static final Logger log = LoggerFactory.getLogger(ConstituentCatalog.class);
    private static final String RESOURCE = "constituents.txt";
    private static final String ABSENT = "-";

    /** Selectable constituents, in declaration order. */
    public static final List<String> DEFAULT_CONSTITUENTS =
            List.of("Mm", "Mf", "Q1", "O1", "P1", "S1", "K1", "2N2", "N2", "M2", "S2", "K2",
                    "MN4", "M4", "MS4");

    private static volatile boolean loaded = false;
    private static Map<String, Entry> entries; // every catalog row, file order

    private ConstituentCatalog() {}

    /**
     * Look up a code in the extended vocabulary.
     *
     * @return the catalog entry, or empty if the code is not in the catalog
     * @throws IllegalStateException if the catalog resource cannot be loaded
     */
    public static Optional<Entry> lookup(String code) {
        ensureLoaded();
        return Optional.ofNullable(entries.get(code));
    }

    /** True if {@code code} belongs to the selectable default vocabulary. */
    public static boolean isSelectable(String code) {
        return DEFAULT_CONSTITUENTS.contains(code);
    }

    /**
     * Validate a caller-supplied code against the default vocabulary.
     *
     * @throws UnknownConstituentException listing the default vocabulary
     */
    public static void requireSelectable(String code) {
        if (!isSelectable(code)) {
            throw new UnknownConstituentException(code, DEFAULT_CONSTITUENTS);
        }
    }

    /** Every code in the catalog (default and extended), in file order. */
    public static List<String> allCodes() {
        ensureLoaded();
        return List.copyOf(entries.keySet());
    }

    /**
     * Load the catalog now. Safe to call repeatedly; use at startup to detect a
     * missing or malformed resource early.
     */
    public static void preload() {
        ensureLoaded();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        entries = loadFromResource();
        loaded = true;
    }

    /**
     * Read <code>constituents.txt</code>. Rows are whitespace separated:
     * code, frequency, Doodson tuple, potential amplitude, reduction factor.
     * Any problem reading or parsing the file throws IllegalStateException.
     */
    private static Map<String, Entry> loadFromResource() {
        InputStream in = ConstituentCatalog.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Constituent catalog '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException(
                    "Constituent catalog '" + RESOURCE + "' not found on classpath");
        }
        Map<String, Entry> parsed = new LinkedHashMap<>();
        int lineNo = 0;
        try (BufferedReader br =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue; // skip blanks/comments
                String[] toks = line.split("\\s+");
                if (toks.length != 5) {
                    throw new IllegalArgumentException(
                            "expected 5 columns but found " + toks.length);
                }
                Entry entry = new Entry(
                        toks[0],
                        Double.parseDouble(toks[1]),
                        ABSENT.equals(toks[2]) ? null : DoodsonCoefficients.parse(toks[2]),
                        ABSENT.equals(toks[3]) ? null : Double.valueOf(toks[3]),
                        ABSENT.equals(toks[4]) ? null : Double.valueOf(toks[4]));
                if (parsed.put(entry.code, entry) != null) {
                    throw new IllegalArgumentException("duplicate code " + entry.code);
                }
            }
        } catch (IOException e) {
            log.error("Failed to read constituent catalog", e);
            throw new IllegalStateException("Failed to read constituent catalog", e);
        } catch (RuntimeException e) {
            log.error("Failed to parse constituent catalog at line {}", lineNo, e);
            throw new IllegalStateException(
                    "Failed to parse constituent catalog at line " + lineNo, e);
        }
        List<String> missing = new ArrayList<>(DEFAULT_CONSTITUENTS);
        missing.removeAll(parsed.keySet());
        if (!missing.isEmpty()) {
            log.error("Constituent catalog is missing default constituents {}", missing);
            throw new IllegalStateException(
                    "Constituent catalog is missing default constituents " + missing);
        }
        log.debug("Loaded {} constituents from {}", parsed.size(), RESOURCE);
        return Collections.unmodifiableMap(parsed);
    }

    /**
     * One catalog row. Orbital frequency is always present; the other fields
     * are defined only for some constituents.
     */
    public static final class Entry {
        /** Constituent code, e.g. "M2". */
        public final String code;

        /** Angular frequency in radians per second. */
        public final double orbitalFrequency;

        private final DoodsonCoefficients doodson;
        private final Double potentialAmplitude;
        private final Double reductionFactor;

        private Entry(
                String code,
                double orbitalFrequency,
                DoodsonCoefficients doodson,
                Double potentialAmplitude,
                Double reductionFactor) {
            this.code = code;
            this.orbitalFrequency = orbitalFrequency;
            this.doodson = doodson;
            this.potentialAmplitude = potentialAmplitude;
            this.reductionFactor = reductionFactor;
        }

        public Optional<DoodsonCoefficients> doodsonCoefficient() {
            return Optional.ofNullable(doodson);
        }

        /** Tidal potential amplitude in meters. */
        public OptionalDouble tidalPotentialAmplitude() {
            return potentialAmplitude == null
                    ? OptionalDouble.empty()
                    : OptionalDouble.of(potentialAmplitude);
        }

        public OptionalDouble earthTidalPotentialReductionFactor() {
            return reductionFactor == null
                    ? OptionalDouble.empty()
                    : OptionalDouble.of(reductionFactor);
        }
    }
}
