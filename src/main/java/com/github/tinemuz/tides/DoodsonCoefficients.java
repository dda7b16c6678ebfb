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

/**
 * Doodson classification of a constituent: the integer multipliers of the six
 * fundamental astronomical arguments (lunar time, lunar mean longitude, solar
 * mean longitude, lunar perigee, negated lunar node, solar perigee).
 */
public record DoodsonCoefficients(int tau, int s, int h, int p, int nPrime, int p1) {

    /** Parse the catalog form {@code "2,-1,0,1,0,0"}. */
    static DoodsonCoefficients parse(String text) {
        String[] toks = text.split(",");
        if (toks.length != 6) {
            throw new IllegalArgumentException("Expected 6 Doodson coefficients, got '" + text + "'");
        }
        int[] v = new int[6];
        for (int i = 0; i < 6; i++) v[i] = Integer.parseInt(toks[i].trim());
        return new DoodsonCoefficients(v[0], v[1], v[2], v[3], v[4], v[5]);
    }

    /** Coefficients in argument order. */
    public int[] toArray() {
        return new int[] {tau, s, h, p, nPrime, p1};
    }
}
