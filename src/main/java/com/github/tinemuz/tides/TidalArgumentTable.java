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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nodal factors and Greenwich arguments for a set of constituents at one
 * epoch, in request order.
 *
 * <p>The orbital elements are computed once per table and shared by every
 * constituent. The table is read-only after {@link #build} returns.</p>
 */
public final class TidalArgumentTable {
    private static final Logger log = LoggerFactory.getLogger(TidalArgumentTable.class);

    /** Units of {@link Constituent#orbitalFrequency}. */
    public static final String UNITS = "rad/sec";

    private final EpochWindow epoch;
    private final OrbitalElements elements;
    private final Map<String, Constituent> constituents;

    private TidalArgumentTable(
            EpochWindow epoch, OrbitalElements elements, Map<String, Constituent> constituents) {
        this.epoch = epoch;
        this.elements = elements;
        this.constituents = Collections.unmodifiableMap(constituents);
    }

    /** Build a table for the full default vocabulary, in catalog order. */
    public static TidalArgumentTable build(EpochWindow epoch) {
        return build(epoch, null);
    }

    /**
     * Build a table for the requested codes.
     *
     * @param epoch validated epoch window
     * @param codes codes from {@link ConstituentCatalog#DEFAULT_CONSTITUENTS};
     *              {@code null} selects all of them. Order is preserved and
     *              a repeated code keeps its first position.
     * @throws UnknownConstituentException if a code is not in the default vocabulary
     */
    public static TidalArgumentTable build(EpochWindow epoch, List<String> codes) {
        Objects.requireNonNull(epoch, "epoch");
        List<String> selected = codes == null ? ConstituentCatalog.DEFAULT_CONSTITUENTS : codes;
        // Reject the whole request before computing anything
        for (String code : selected) {
            ConstituentCatalog.requireSelectable(code);
        }
        OrbitalElements elements = OrbitalElements.of(epoch);
        Map<String, Constituent> rows = new LinkedHashMap<>();
        for (String code : selected) {
            if (rows.containsKey(code)) continue;
            ConstituentCatalog.Entry entry = ConstituentCatalog.lookup(code)
                    .orElseThrow(() -> new IllegalStateException(
                            "Constituent catalog has no entry for " + code));
            rows.put(code, new Constituent(
                    entry,
                    NodalFactors.nodalFactor(code, elements),
                    GreenwichArguments.greenwichTerm(code, elements)));
        }
        log.debug("Built tidal argument table for {} with constituents {}", epoch, rows.keySet());
        return new TidalArgumentTable(epoch, elements, rows);
    }

    /** Units of the orbital frequencies, always {@value #UNITS}. */
    public String units() {
        return UNITS;
    }

    /** The row for {@code code}, or null if the table does not contain it. */
    public Constituent get(String code) {
        return constituents.get(code);
    }

    public boolean contains(String code) {
        return constituents.containsKey(code);
    }

    /** Codes in table order. */
    public List<String> codes() {
        return new ArrayList<>(constituents.keySet());
    }

    /** Rows in table order. */
    public Collection<Constituent> constituents() {
        return constituents.values();
    }

    /** Read-only view of the table keyed by code. */
    public Map<String, Constituent> asMap() {
        return constituents;
    }

    public int size() {
        return constituents.size();
    }

    public EpochWindow epoch() {
        return epoch;
    }

    public OrbitalElements elements() {
        return elements;
    }

    @Override
    public String toString() {
        return "TidalArgumentTable[" + epoch + ", " + constituents.values() + "]";
    }
}
