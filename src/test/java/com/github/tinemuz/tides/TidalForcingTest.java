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

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TidalForcingTest {

    @Test
    @DisplayName("Default request covers the 15 default constituents")
    void defaultRequest() {
        TidalForcing.preload();
        TidalArgumentTable table =
                TidalForcing.compute(ReferenceValues.WINTER_START, ReferenceValues.WINTER_END);

        assertEquals(ConstituentCatalog.DEFAULT_CONSTITUENTS, table.codes());
        assertEquals(LocalDateTime.of(2019, 12, 17, 0, 0), table.epoch().spinupDate);
        assertEquals(1.00520676834523, table.get("M2").nodalFactor, 1e-9);
    }

    @Test
    @DisplayName("Explicit spinup and selection")
    void explicitRequest() {
        TidalArgumentTable table = TidalForcing.compute(
                ReferenceValues.SUMMER_START,
                ReferenceValues.SUMMER_END,
                ReferenceValues.SUMMER_SPINUP,
                List.of("K1"));

        assertEquals(List.of("K1"), table.codes());
        assertEquals(62.6023259192508, table.get("K1").greenwichTerm, 1e-9);
    }

    @Test
    @DisplayName("Spinup overload without selection")
    void spinupOnly() {
        TidalArgumentTable table = TidalForcing.compute(
                ReferenceValues.SUMMER_START, ReferenceValues.SUMMER_END, ReferenceValues.SUMMER_SPINUP);
        assertEquals(15, table.size());
        assertEquals(ReferenceValues.SUMMER_SPINUP, table.epoch().spinupDate);
    }

    @Test
    @DisplayName("Date errors surface before constituent errors")
    void errorOrder() {
        assertThrows(
                InvalidDateOrderException.class,
                () -> TidalForcing.compute(
                        LocalDateTime.of(2020, 1, 1, 0, 0),
                        LocalDateTime.of(2019, 12, 1, 0, 0),
                        null,
                        List.of("Zx")));
        assertThrows(
                InvalidDateTypeException.class,
                () -> TidalForcing.compute(null, LocalDateTime.of(2019, 12, 1, 0, 0)));
    }
}
