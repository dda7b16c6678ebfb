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

/**
 * Equilibrium arguments at Greenwich, V0 + u, in degrees.
 *
 * <p>Each constituent is a fixed integer combination of the degree-valued
 * orbital elements plus a constant phase. The sum is reduced to [0, 360).</p>
 */
public final class GreenwichArguments {

    private static final Map<String, Argument> ARGUMENTS = buildArgumentTable();

    private GreenwichArguments() {}

    /**
     * Greenwich argument of {@code code} in degrees, in [0, 360).
     *
     * @throws UnknownConstituentException if {@code code} has no argument
     */
    public static double greenwichTerm(String code, OrbitalElements e) {
        return OrbitalElements.mod360(argumentFor(code).evaluate(e));
    }

    /**
     * The coefficient vector assigned to {@code code}.
     *
     * @throws UnknownConstituentException if {@code code} has no argument
     */
    public static Argument argumentFor(String code) {
        Argument a = ARGUMENTS.get(code);
        if (a == null) {
            throw new UnknownConstituentException(code, supportedCodes());
        }
        return a;
    }

    /** Codes with a Greenwich argument, in table order. */
    public static List<String> supportedCodes() {
        return List.copyOf(ARGUMENTS.keySet());
    }

    /**
     * Coefficients of T, S, H, P, P1, xi, nu, nu', nu'', R and Q plus a
     * constant phase in degrees. Immutable once built.
     */
    public static final class Argument {
        public final double constant;
        public final int t;
        public final int s;
        public final int h;
        public final int p;
        public final int p1;
        public final int xi;
        public final int nu;
        public final int nuPrime;
        public final int nuDoublePrime;
        public final int r;
        public final int q;

        private Argument(Builder b) {
            this.constant = b.constant;
            this.t = b.t;
            this.s = b.s;
            this.h = b.h;
            this.p = b.p;
            this.p1 = b.p1;
            this.xi = b.xi;
            this.nu = b.nu;
            this.nuPrime = b.nuPrime;
            this.nuDoublePrime = b.nuDoublePrime;
            this.r = b.r;
            this.q = b.q;
        }

        /** Unreduced argument in degrees. */
        public double evaluate(OrbitalElements e) {
            return constant
                    + t * e.hourAngleDeg
                    + s * e.lunarMeanLongitudeDeg
                    + h * e.solarMeanLongitudeDeg
                    + p * e.lunarPerigeeDeg
                    + p1 * e.solarPerigeeDeg
                    + xi * e.xiDeg
                    + nu * e.nuDeg
                    + nuPrime * e.nuPrimeDeg
                    + nuDoublePrime * e.nuDoublePrimeDeg
                    + r * e.rDeg
                    + q * e.qDeg;
        }
    }

    private static Builder arg() {
        return new Builder();
    }

    private static final class Builder {
        private double constant;
        private int t, s, h, p, p1, xi, nu, nuPrime, nuDoublePrime, r, q;

        Builder constant(double v) { constant = v; return this; }
        Builder t(int v) { t = v; return this; }
        Builder s(int v) { s = v; return this; }
        Builder h(int v) { h = v; return this; }
        Builder p(int v) { p = v; return this; }
        Builder p1(int v) { p1 = v; return this; }
        Builder xi(int v) { xi = v; return this; }
        Builder nu(int v) { nu = v; return this; }
        Builder nuPrime(int v) { nuPrime = v; return this; }
        Builder nuDoublePrime(int v) { nuDoublePrime = v; return this; }
        Builder r(int v) { r = v; return this; }
        Builder q(int v) { q = v; return this; }

        Argument build() {
            return new Argument(this);
        }
    }

    private static Map<String, Argument> buildArgumentTable() {
        Map<String, Argument> a = new LinkedHashMap<>();
        // Long period
        a.put("Mm", arg().s(1).p(-1).build());
        a.put("Mf", arg().s(2).xi(-2).build());
        a.put("Msf", arg().s(2).h(-2).build());
        a.put("Sa", arg().h(1).build());
        a.put("Ssa", arg().h(2).build());
        // Diurnal
        a.put("2Q1", arg().t(1).s(-4).h(1).p(2).constant(90).xi(2).nu(-1).build());
        a.put("Q1", arg().t(1).s(-3).h(1).p(1).constant(90).xi(2).nu(-1).build());
        a.put("RHO", arg().t(1).s(-3).h(3).p(-1).constant(90).xi(2).nu(-1).build());
        a.put("O1", arg().t(1).s(-2).h(1).constant(90).xi(2).nu(-1).build());
        a.put("M1", arg().t(1).s(-1).h(1).constant(-90).xi(1).nu(-1).q(1).build());
        a.put("P1", arg().t(1).h(-1).constant(90).build());
        a.put("S1", arg().t(1).build());
        a.put("K1", arg().t(1).h(1).constant(-90).nuPrime(-1).build());
        a.put("J1", arg().t(1).s(1).h(1).p(-1).constant(-90).nu(-1).build());
        a.put("OO1", arg().t(1).s(2).h(1).constant(-90).xi(-2).nu(-1).build());
        // Semidiurnal
        a.put("2N2", arg().t(2).s(-4).h(2).p(2).xi(2).nu(-2).build());
        a.put("MU2", arg().t(2).s(-4).h(4).xi(2).nu(-2).build());
        a.put("N2", arg().t(2).s(-3).h(2).p(1).xi(2).nu(-2).build());
        a.put("Nu2", arg().t(2).s(-3).h(4).p(-1).xi(2).nu(-2).build());
        a.put("M2", arg().t(2).s(-2).h(2).xi(2).nu(-2).build());
        a.put("lambda2", arg().t(2).s(-1).p(1).constant(180).xi(2).nu(-2).build());
        a.put("L2", arg().t(2).s(-1).h(2).p(-1).constant(180).xi(2).nu(-2).r(-1).build());
        a.put("T2", arg().t(2).h(-1).p1(1).build());
        a.put("S2", arg().t(2).build());
        a.put("R2", arg().t(2).h(1).p1(-1).constant(180).build());
        a.put("K2", arg().t(2).h(2).nuDoublePrime(-2).build());
        a.put("2SM2", arg().t(2).s(2).h(-2).xi(-2).nu(2).build());
        // Terdiurnal and shallow water
        a.put("M3", arg().t(3).s(-3).h(3).xi(3).nu(-3).build());
        a.put("MK3", arg().t(3).s(-2).h(3).constant(-90).xi(2).nu(-2).nuPrime(-1).build());
        a.put("2MK3", arg().t(3).s(-4).h(3).constant(90).xi(4).nu(-4).nuPrime(1).build());
        a.put("MN4", arg().t(4).s(-5).h(4).p(1).xi(4).nu(-4).build());
        a.put("M4", arg().t(4).s(-4).h(4).xi(4).nu(-4).build());
        a.put("MS4", arg().t(4).s(-2).h(2).xi(2).nu(-2).build());
        a.put("S4", arg().t(4).build());
        a.put("M6", arg().t(6).s(-6).h(6).xi(6).nu(-6).build());
        a.put("S6", arg().t(6).build());
        a.put("M8", arg().t(8).s(-8).h(8).xi(8).nu(-8).build());
        return Collections.unmodifiableMap(a);
    }
}
