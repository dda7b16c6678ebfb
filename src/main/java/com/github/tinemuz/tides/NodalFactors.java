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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Nodal (satellite) correction factors.
 *
 * <p>The base formulas carry the equation numbers of Schureman's
 * <i>Manual of Harmonic Analysis and Prediction of Tides</i>. Each is
 * normalized by its mean value over the 18.6-year nodal cycle. Every
 * constituent maps to one {@link Formula}, a base equation or a fixed product
 * of them.</p>
 */
public final class NodalFactors {

    private static final Map<String, Formula> FORMULAS = buildFormulaTable();

    private NodalFactors() {}

    /**
     * Nodal factor of {@code code} for the given elements.
     *
     * @throws UnknownConstituentException if {@code code} has no formula
     */
    public static double nodalFactor(String code, OrbitalElements e) {
        return formulaFor(code).apply(e);
    }

    /**
     * The formula assigned to {@code code}.
     *
     * @throws UnknownConstituentException if {@code code} has no formula
     */
    public static Formula formulaFor(String code) {
        Formula f = FORMULAS.get(code);
        if (f == null) {
            throw new UnknownConstituentException(code, supportedCodes());
        }
        return f;
    }

    /** Codes with a nodal factor formula, in table order. */
    public static List<String> supportedCodes() {
        return List.copyOf(FORMULAS.keySet());
    }

    /** Nodal factor expressions. */
    public enum Formula {
        UNITY(e -> 1.0),
        EQ73(NodalFactors::eq73),
        EQ74(NodalFactors::eq74),
        EQ75(NodalFactors::eq75),
        EQ76(NodalFactors::eq76),
        EQ77(NodalFactors::eq77),
        EQ78(NodalFactors::eq78),
        EQ78_SQUARED(e -> Math.pow(eq78(e), 2)),
        EQ78_CUBED(e -> Math.pow(eq78(e), 3)),
        EQ78_FOURTH(e -> Math.pow(eq78(e), 4)),
        EQ149(NodalFactors::eq149),
        EQ207(NodalFactors::eq207),
        EQ215(NodalFactors::eq215),
        EQ227(NodalFactors::eq227),
        EQ78_EQ227(e -> eq78(e) * eq227(e)),
        EQ227_EQ78_SQUARED(e -> eq227(e) * Math.pow(eq78(e), 2)),
        EQ235(NodalFactors::eq235);

        private final ToDoubleFunction<OrbitalElements> expression;

        Formula(ToDoubleFunction<OrbitalElements> expression) {
            this.expression = expression;
        }

        public double apply(OrbitalElements e) {
            return expression.applyAsDouble(e);
        }
    }

    static double eq73(OrbitalElements e) {
        double sinI = Math.sin(e.inclination);
        return (2.0 / 3.0 - sinI * sinI) / 0.5021;
    }

    static double eq74(OrbitalElements e) {
        double sinI = Math.sin(e.inclination);
        return sinI * sinI / 0.1578;
    }

    static double eq75(OrbitalElements e) {
        double cosHalfI = Math.cos(e.inclination / 2.0);
        return Math.sin(e.inclination) * cosHalfI * cosHalfI / 0.37988;
    }

    static double eq76(OrbitalElements e) {
        return Math.sin(2.0 * e.inclination) / 0.7214;
    }

    static double eq77(OrbitalElements e) {
        double sinHalfI = Math.sin(e.inclination / 2.0);
        return Math.sin(e.inclination) * sinHalfI * sinHalfI / 0.0164;
    }

    static double eq78(OrbitalElements e) {
        return Math.pow(Math.cos(e.inclination / 2.0), 4) / 0.91544;
    }

    static double eq149(OrbitalElements e) {
        return Math.pow(Math.cos(e.inclination / 2.0), 6) / 0.8758;
    }

    static double eq197(OrbitalElements e) {
        return Math.sqrt(2.310 + 1.435 * Math.cos(2.0 * (e.lunarPerigee - e.xi)));
    }

    static double eq207(OrbitalElements e) {
        return eq75(e) * eq197(e);
    }

    static double eq213(OrbitalElements e) {
        double tanHalfI = Math.tan(e.inclination / 2.0);
        double t2 = tanHalfI * tanHalfI;
        return Math.sqrt(1.0 - 12.0 * t2 * Math.cos(2.0 * e.lunarPerigee) + 36.0 * t2 * t2);
    }

    static double eq215(OrbitalElements e) {
        return eq78(e) * eq213(e);
    }

    static double eq227(OrbitalElements e) {
        double sin2I = Math.sin(2.0 * e.inclination);
        return Math.sqrt(0.8965 * sin2I * sin2I + 0.6001 * sin2I * Math.cos(e.nu) + 0.1006);
    }

    static double eq235(OrbitalElements e) {
        double sinI = Math.sin(e.inclination);
        double s2 = sinI * sinI;
        return 0.001 + Math.sqrt(19.0444 * s2 * s2 + 2.7702 * s2 * Math.cos(2.0 * e.nu) + 0.0981);
    }

    private static Map<String, Formula> buildFormulaTable() {
        Map<String, Formula> t = new LinkedHashMap<>();
        // Long period
        t.put("Mm", Formula.EQ73);
        t.put("Mf", Formula.EQ74);
        t.put("Msf", Formula.EQ78);
        t.put("Sa", Formula.UNITY);
        t.put("Ssa", Formula.UNITY);
        // Diurnal
        t.put("Q1", Formula.EQ75);
        t.put("2Q1", Formula.EQ75);
        t.put("RHO", Formula.EQ75);
        t.put("O1", Formula.EQ75);
        t.put("M1", Formula.EQ207);
        t.put("P1", Formula.UNITY);
        t.put("S1", Formula.UNITY);
        t.put("K1", Formula.EQ227);
        t.put("J1", Formula.EQ76);
        t.put("OO1", Formula.EQ77);
        // Semidiurnal
        t.put("2N2", Formula.EQ78);
        t.put("MU2", Formula.EQ78);
        t.put("N2", Formula.EQ78);
        t.put("Nu2", Formula.EQ78);
        t.put("M2", Formula.EQ78);
        t.put("lambda2", Formula.EQ78);
        t.put("L2", Formula.EQ215);
        t.put("T2", Formula.UNITY);
        t.put("S2", Formula.UNITY);
        t.put("R2", Formula.UNITY);
        t.put("K2", Formula.EQ235);
        t.put("2SM2", Formula.EQ78);
        // Terdiurnal and shallow water
        t.put("M3", Formula.EQ149);
        t.put("MK3", Formula.EQ78_EQ227);
        t.put("2MK3", Formula.EQ227_EQ78_SQUARED);
        t.put("MN4", Formula.EQ78_SQUARED);
        t.put("M4", Formula.EQ78_SQUARED);
        // MS4 carries a single M2 factor
        t.put("MS4", Formula.EQ78);
        t.put("S4", Formula.UNITY);
        t.put("M6", Formula.EQ78_CUBED);
        t.put("S6", Formula.UNITY);
        t.put("M8", Formula.EQ78_FOURTH);
        return Collections.unmodifiableMap(t);
    }
}
