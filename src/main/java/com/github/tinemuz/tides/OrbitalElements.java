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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lunar and solar orbital elements at the reference epoch of an
 * {@link EpochWindow}.
 *
 * <p>Every angle is held in degrees ({@code ...Deg}) and radians. The values
 * are computed once by {@link #of(EpochWindow)} and never change; the nodal
 * factor and Greenwich argument formulas only read them, so a single instance
 * may be shared freely between threads.</p>
 *
 * <p>The mean longitudes, solar perigee and hour angle are referenced to the
 * hour of the spinup date. Lunar node and lunar perigee are referenced to
 * {@link #hourMiddle}, the middle of the spinup-to-end record. Minutes and
 * seconds of the spinup date do not enter the hour terms.</p>
 */
public final class OrbitalElements {
    private static final Logger log = LoggerFactory.getLogger(OrbitalElements.class);

    // The leap-day correction (year - 1901) / 4 ignores the century rule
    private static final int FIRST_EXACT_YEAR = 1901;
    private static final int LAST_EXACT_YEAR = 2099;
    private static volatile boolean warnedOutsideCalendarRange = false;

    /** Years since 1900 at the spinup date. */
    public final double dyr;

    /** Day of year of the spinup date plus leap days since 1901, zero based. */
    public final int dday;

    /** Spinup hour plus half the hours from spinup to end. */
    public final double hourMiddle;

    /** Hour of day of the spinup date. */
    public final int hour;

    /** Longitude of the lunar ascending node N. */
    public final double lunarNodeDeg;
    public final double lunarNode;

    /** Longitude of lunar perigee P. */
    public final double lunarPerigeeDeg;
    public final double lunarPerigee;

    /** Mean longitude of the moon S. */
    public final double lunarMeanLongitudeDeg;
    public final double lunarMeanLongitude;

    /** Longitude of solar perigee P1. */
    public final double solarPerigeeDeg;
    public final double solarPerigee;

    /** Mean longitude of the sun H. */
    public final double solarMeanLongitudeDeg;
    public final double solarMeanLongitude;

    /** Hour angle of the mean sun T at Greenwich. */
    public final double hourAngleDeg;
    public final double hourAngle;

    /** Inclination of the lunar orbit to the equator I. */
    public final double inclinationDeg;
    public final double inclination;

    /** Right ascension of the lunar intersection, nu. */
    public final double nuDeg;
    public final double nu;

    /** Longitude in the moon's orbit of the lunar intersection, xi. */
    public final double xiDeg;
    public final double xi;

    /** Term in the argument of the lunisolar K1 constituent, nu'. */
    public final double nuPrimeDeg;
    public final double nuPrime;

    /** Lunar perigee measured from the lunar intersection, P - xi, in [0, 360). */
    public final double pcDeg;
    public final double pc;

    /** Term in the argument of the L2 constituent, R. */
    public final double rDeg;
    public final double r;

    /** Term in the argument of the lunisolar K2 constituent, 2nu'' halved. */
    public final double nuDoublePrimeDeg;
    public final double nuDoublePrime;

    /** Term in the argument of the M1 constituent, Q. */
    public final double qDeg;
    public final double q;

    private OrbitalElements(int year, int dayOfYear, int hour, double hoursSpinupToEnd) {
        this.hour = hour;
        this.dyr = year - 1900.0;
        this.dday = dayOfYear + (int) ((year - 1901.0) / 4.0) - 1;
        this.hourMiddle = hour + hoursSpinupToEnd / 2.0;

        // Slow lunar angles use the mid-record hour; the rest use the spinup hour
        lunarNodeDeg = mod360(
                259.1560564 - 19.328185764 * dyr - 0.0529539336 * dday - 0.0022064139 * hourMiddle);
        lunarPerigeeDeg = mod360(
                334.3837214 + 40.66246584 * dyr + 0.111404016 * dday + 0.004641834 * hourMiddle);
        lunarMeanLongitudeDeg = mod360(
                277.0256206 + 129.38482032 * dyr + 13.176396768 * dday + 0.549016532 * hour);
        solarPerigeeDeg = mod360(
                281.2208569 + 0.01717836 * dyr + 0.000047064 * dday + 0.000001961 * hour);
        solarMeanLongitudeDeg = mod360(
                280.1895014 - 0.238724988 * dyr + 0.9856473288 * dday + 0.0410686387 * hour);
        hourAngleDeg = mod360(180.0 + hour * (360.0 / 24.0));

        lunarNode = Math.toRadians(lunarNodeDeg);
        lunarPerigee = Math.toRadians(lunarPerigeeDeg);
        lunarMeanLongitude = Math.toRadians(lunarMeanLongitudeDeg);
        solarPerigee = Math.toRadians(solarPerigeeDeg);
        solarMeanLongitude = Math.toRadians(solarMeanLongitudeDeg);
        hourAngle = Math.toRadians(hourAngleDeg);

        inclination = Math.acos(0.9136949 - 0.0356926 * Math.cos(lunarNode));
        nu = Math.asin(0.0897056 * Math.sin(lunarNode) / Math.sin(inclination));
        xi = lunarNode - 2.0 * Math.atan(0.64412 * Math.tan(lunarNode / 2.0)) - nu;
        nuPrime = Math.atan(
                Math.sin(nu) / (Math.cos(nu) + 0.334766 / Math.sin(2.0 * inclination)));
        inclinationDeg = Math.toDegrees(inclination);
        nuDeg = Math.toDegrees(nu);
        xiDeg = Math.toDegrees(xi);
        nuPrimeDeg = Math.toDegrees(nuPrime);

        pcDeg = mod360(lunarPerigeeDeg - xiDeg);
        pc = Math.toRadians(pcDeg);

        double cotHalfI = 1.0 / Math.tan(0.5 * inclination);
        r = Math.atan(Math.sin(2.0 * pc) / (cotHalfI * cotHalfI / 6.0 - Math.cos(2.0 * pc)));
        double sinI = Math.sin(inclination);
        nuDoublePrime = Math.atan(
                Math.sin(2.0 * nu) / (Math.cos(2.0 * nu) + 0.0726184 / (sinI * sinI))) / 2.0;
        q = Math.atan2(
                (5.0 * Math.cos(inclination) - 1.0) * Math.sin(pc),
                (7.0 * Math.cos(inclination) + 1.0) * Math.cos(pc));
        rDeg = Math.toDegrees(r);
        nuDoublePrimeDeg = Math.toDegrees(nuDoublePrime);
        qDeg = Math.toDegrees(q);
    }

    /**
     * Compute the orbital elements for a validated window. Only the spinup
     * date and the spinup-to-end span are used; the start date has no effect.
     */
    public static OrbitalElements of(EpochWindow epoch) {
        LocalDateTime spinup = epoch.spinupDate;
        warnIfOutsideCalendarRange(spinup.getYear());
        Duration span = epoch.spinupToEnd();
        double hours = (span.getSeconds() + span.getNano() / 1e9) / 3600.0;
        OrbitalElements e =
                new OrbitalElements(spinup.getYear(), spinup.getDayOfYear(), spinup.getHour(), hours);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Orbital elements for {}: DYR={} DDAY={} hourMiddle={} N={} P={} S={} H={} I={}",
                    epoch, e.dyr, e.dday, e.hourMiddle,
                    String.format("%.6f", e.lunarNodeDeg),
                    String.format("%.6f", e.lunarPerigeeDeg),
                    String.format("%.6f", e.lunarMeanLongitudeDeg),
                    String.format("%.6f", e.solarMeanLongitudeDeg),
                    String.format("%.6f", e.inclinationDeg));
        }
        return e;
    }

    /**
     * Reduce an angle in degrees to [0, 360). Negative inputs wrap upward the
     * way a floored modulo does.
     */
    static double mod360(double deg) {
        double m = deg % 360.0;
        if (m < 0) m += 360.0;
        // -1e-14 + 360 rounds to 360; -0.0 folds to 0.0
        return m >= 360.0 || m == 0.0 ? 0.0 : m;
    }

    private static void warnIfOutsideCalendarRange(int year) {
        if (year >= FIRST_EXACT_YEAR && year <= LAST_EXACT_YEAR) return;
        if (!warnedOutsideCalendarRange) {
            synchronized (OrbitalElements.class) {
                if (!warnedOutsideCalendarRange) {
                    warnedOutsideCalendarRange = true;
                    log.warn(
                            "Spinup year {} is outside {}..{}; the leap-day count used for the "
                                + "day number is approximate there",
                            year, FIRST_EXACT_YEAR, LAST_EXACT_YEAR);
                }
            }
        }
    }
}
