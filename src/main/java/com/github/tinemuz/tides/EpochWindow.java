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

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The three reference instants of a forcing request: model spinup, nominal
 * start and end. Always satisfies {@code spinup < start < end}; all checks run
 * in the factory methods so a partially valid window is never returned.
 *
 * <p>Dates are UTC wall-clock times without a zone.</p>
 */
public final class EpochWindow {
    private static final Logger log = LoggerFactory.getLogger(EpochWindow.class);

    /** Spinup length used when the caller does not supply a spinup date. */
    public static final Duration DEFAULT_SPINUP = Duration.ofDays(15);

    /** Start of model warm-up; the reference instant for most orbital angles. */
    public final LocalDateTime spinupDate;

    /** Nominal simulation start. */
    public final LocalDateTime startDate;

    /** Simulation end. */
    public final LocalDateTime endDate;

    private EpochWindow(LocalDateTime spinupDate, LocalDateTime startDate, LocalDateTime endDate) {
        this.spinupDate = spinupDate;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * Validate a window with the default spinup of {@link #DEFAULT_SPINUP}
     * before {@code start}.
     */
    public static EpochWindow validate(LocalDateTime start, LocalDateTime end) {
        return validate(start, end, null);
    }

    /**
     * Validate a window.
     *
     * @param start  simulation start
     * @param end    simulation end, strictly after {@code start}
     * @param spinup optional spinup date, strictly before {@code start};
     *               {@code null} selects {@code start - 15 days}
     * @throws InvalidDateTypeException  if {@code start} or {@code end} is null
     * @throws InvalidDateOrderException if the dates are out of order
     */
    public static EpochWindow validate(
            LocalDateTime start, LocalDateTime end, LocalDateTime spinup) {
        if (start == null) {
            throw new InvalidDateTypeException("start_date must be a date-time, got null");
        }
        if (end == null) {
            throw new InvalidDateTypeException("end_date must be a date-time, got null");
        }
        if (!end.isAfter(start)) {
            throw new InvalidDateOrderException(
                    "end_date " + end + " must be later than start_date " + start);
        }
        LocalDateTime resolvedSpinup;
        if (spinup == null) {
            resolvedSpinup = start.minus(DEFAULT_SPINUP);
            log.debug("No spinup_date given; using {}", resolvedSpinup);
        } else if (!spinup.isBefore(start)) {
            throw new InvalidDateOrderException(
                    "spinup_date " + spinup + " must be earlier than start_date " + start);
        } else {
            resolvedSpinup = spinup;
        }
        return new EpochWindow(resolvedSpinup, start, end);
    }

    /**
     * Validate a window given as ISO-8601 local date-times such as
     * {@code 2020-01-01T00:00}. A null or blank {@code spinup} selects the
     * default spinup.
     *
     * @throws InvalidDateTypeException if a value is missing or does not parse
     */
    public static EpochWindow parse(String start, String end, String spinup) {
        LocalDateTime s = parseDate("start_date", start);
        LocalDateTime e = parseDate("end_date", end);
        LocalDateTime sp = spinup == null || spinup.isBlank() ? null : parseDate("spinup_date", spinup);
        return validate(s, e, sp);
    }

    private static LocalDateTime parseDate(String field, String text) {
        if (text == null) {
            throw new InvalidDateTypeException(field + " must be a date-time, got null");
        }
        try {
            return LocalDateTime.parse(text.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidDateTypeException(
                    field + " must be an ISO-8601 date-time, got '" + text + "'", ex);
        }
    }

    /** Time from spinup to end, the span whose midpoint anchors node and perigee. */
    public Duration spinupToEnd() {
        return Duration.between(spinupDate, endDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EpochWindow)) return false;
        EpochWindow other = (EpochWindow) o;
        return spinupDate.equals(other.spinupDate)
                && startDate.equals(other.startDate)
                && endDate.equals(other.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spinupDate, startDate, endDate);
    }

    @Override
    public String toString() {
        return "EpochWindow[spinup=" + spinupDate + ", start=" + startDate + ", end=" + endDate + "]";
    }
}
