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

import java.time.LocalDateTime;
import java.util.List;

/**
 * Astronomical inputs for harmonic tidal forcing.
 *
 * <p>For a simulation window and a set of constituents this computes, per
 * constituent, the nodal factor and the equilibrium argument at Greenwich,
 * along with catalog data such as the orbital frequency. It is the main entry
 * point; {@link EpochWindow}, {@link OrbitalElements} and
 * {@link TidalArgumentTable} can be used directly for finer control.</p>
 *
 * <p>Constituent data is loaded from the classpath resource
 * <code>constituents.txt</code>. Call {@link #preload()} once at startup.</p>
 */
public final class TidalForcing {

    private TidalForcing() {}

    /**
     * All default constituents, with spinup 15 days before {@code start}.
     *
     * @throws InvalidDateTypeException  if a date is null
     * @throws InvalidDateOrderException if {@code end} is not after {@code start}
     */
    public static TidalArgumentTable compute(LocalDateTime start, LocalDateTime end) {
        return compute(start, end, null, null);
    }

    /**
     * All default constituents.
     *
     * @param spinup spinup date before {@code start}, or null for the default
     */
    public static TidalArgumentTable compute(
            LocalDateTime start, LocalDateTime end, LocalDateTime spinup) {
        return compute(start, end, spinup, null);
    }

    /**
     * Validate the window and build the table for the requested constituents.
     *
     * @param start  simulation start (UTC)
     * @param end    simulation end (UTC), after {@code start}
     * @param spinup spinup date before {@code start}, or null for {@code start - 15 days}
     * @param codes  constituents in output order, or null for the default vocabulary
     * @return table keyed by code, in request order
     * @throws InvalidDateTypeException    if a mandatory date is null
     * @throws InvalidDateOrderException   if the dates are out of order
     * @throws UnknownConstituentException if a code is not in the default vocabulary
     * @throws IllegalStateException       if the constituent catalog cannot be loaded
     */
    public static TidalArgumentTable compute(
            LocalDateTime start, LocalDateTime end, LocalDateTime spinup, List<String> codes) {
        EpochWindow epoch = EpochWindow.validate(start, end, spinup);
        return TidalArgumentTable.build(epoch, codes);
    }

    /**
     * Load the constituent catalog. Call at startup to detect a missing or
     * invalid catalog resource early.
     */
    public static void preload() {
        ConstituentCatalog.preload();
    }
}
