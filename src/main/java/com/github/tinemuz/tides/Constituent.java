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

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One row of a {@link TidalArgumentTable}: catalog data for a constituent
 * together with its nodal factor and Greenwich argument for the table's epoch.
 */
public final class Constituent {
    /** Constituent code, e.g. "M2". */
    public final String code;

    /** Angular frequency in radians per second. */
    public final double orbitalFrequency;

    /** Dimensionless amplitude correction for the lunar nodal cycle. */
    public final double nodalFactor;

    /** Equilibrium argument at Greenwich in degrees, in [0, 360). */
    public final double greenwichTerm;

    private final ConstituentCatalog.Entry entry;

    Constituent(ConstituentCatalog.Entry entry, double nodalFactor, double greenwichTerm) {
        this.entry = entry;
        this.code = entry.code;
        this.orbitalFrequency = entry.orbitalFrequency;
        this.nodalFactor = nodalFactor;
        this.greenwichTerm = greenwichTerm;
    }

    public Optional<DoodsonCoefficients> doodsonCoefficient() {
        return entry.doodsonCoefficient();
    }

    /** Tidal potential amplitude in meters, where the catalog defines one. */
    public OptionalDouble tidalPotentialAmplitude() {
        return entry.tidalPotentialAmplitude();
    }

    public OptionalDouble earthTidalPotentialReductionFactor() {
        return entry.earthTidalPotentialReductionFactor();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constituent)) return false;
        Constituent other = (Constituent) o;
        return code.equals(other.code)
                && Double.compare(orbitalFrequency, other.orbitalFrequency) == 0
                && Double.compare(nodalFactor, other.nodalFactor) == 0
                && Double.compare(greenwichTerm, other.greenwichTerm) == 0
                && doodsonCoefficient().equals(other.doodsonCoefficient())
                && tidalPotentialAmplitude().equals(other.tidalPotentialAmplitude())
                && earthTidalPotentialReductionFactor()
                        .equals(other.earthTidalPotentialReductionFactor());
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, orbitalFrequency, nodalFactor, greenwichTerm);
    }

    @Override
    public String toString() {
        return String.format(
                "%s[frequency=%.11e rad/s, f=%.6f, V0+u=%.4f deg]",
                code, orbitalFrequency, nodalFactor, greenwichTerm);
    }
}
