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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OrbitalElementsTest {

    private static final double ANGLE_TOLERANCE = 1e-9; // degrees

    @Nested
    @DisplayName("Time arguments")
    class TimeArgumentTests {

        @Test
        @DisplayName("Years, day number and mid-record hour")
        void timeArguments() {
            OrbitalElements e = OrbitalElements.of(ReferenceValues.winterEpoch());

            // spinup 2019-12-17T00:00: day 351 + 29 leap days - 1
            assertEquals(119.0, e.dyr);
            assertEquals(379, e.dday);
            assertEquals(0, e.hour);
            // 46 days from spinup to end, halved
            assertEquals(552.0, e.hourMiddle);
        }

        @Test
        @DisplayName("Only the hour of the spinup date enters the hour terms")
        void minutesIgnored() {
            OrbitalElements e = OrbitalElements.of(ReferenceValues.summerEpoch());

            assertEquals(121.0, e.dyr);
            assertEquals(181, e.dday);
            assertEquals(18, e.hour);
            // 18 + 1043.5 h / 2; the half hour of the span still counts
            assertEquals(539.75, e.hourMiddle);
            assertEquals(90.0, e.hourAngleDeg);
        }

        @Test
        @DisplayName("Start date does not change the elements")
        void startDateIrrelevant() {
            LocalDateTime spinup = LocalDateTime.of(2020, 3, 1, 0, 0);
            LocalDateTime end = LocalDateTime.of(2020, 5, 1, 0, 0);
            OrbitalElements a = OrbitalElements.of(
                    EpochWindow.validate(LocalDateTime.of(2020, 3, 2, 0, 0), end, spinup));
            OrbitalElements b = OrbitalElements.of(
                    EpochWindow.validate(LocalDateTime.of(2020, 4, 20, 0, 0), end, spinup));

            assertEquals(a.lunarNodeDeg, b.lunarNodeDeg);
            assertEquals(a.lunarMeanLongitudeDeg, b.lunarMeanLongitudeDeg);
            assertEquals(a.qDeg, b.qDeg);
        }

        @Test
        @DisplayName("End date moves node and perigee but not the mean longitudes")
        void endDateMovesSlowAngles() {
            LocalDateTime start = LocalDateTime.of(2020, 1, 1, 0, 0);
            OrbitalElements shortRun = OrbitalElements.of(
                    EpochWindow.validate(start, LocalDateTime.of(2020, 1, 10, 0, 0)));
            OrbitalElements longRun = OrbitalElements.of(
                    EpochWindow.validate(start, LocalDateTime.of(2020, 12, 31, 0, 0)));

            assertNotEquals(shortRun.lunarNodeDeg, longRun.lunarNodeDeg);
            assertNotEquals(shortRun.lunarPerigeeDeg, longRun.lunarPerigeeDeg);
            assertEquals(shortRun.lunarMeanLongitudeDeg, longRun.lunarMeanLongitudeDeg);
            assertEquals(shortRun.solarMeanLongitudeDeg, longRun.solarMeanLongitudeDeg);
            assertEquals(shortRun.solarPerigeeDeg, longRun.solarPerigeeDeg);
            assertEquals(shortRun.hourAngleDeg, longRun.hourAngleDeg);
        }
    }

    @Nested
    @DisplayName("Known Reference Values")
    class ReferenceValueTests {

        @Test
        @DisplayName("Winter 2019/2020 epoch")
        void winter() {
            OrbitalElements e = OrbitalElements.of(ReferenceValues.winterEpoch());

            assertEquals(97.8144691768002, e.lunarNodeDeg, ANGLE_TOLERANCE, "N");
            assertEquals(178.001570792001, e.lunarPerigeeDeg, ANGLE_TOLERANCE, "P");
            assertEquals(147.673613751998, e.lunarMeanLongitudeDeg, ANGLE_TOLERANCE, "S");
            assertEquals(283.282918996, e.solarPerigeeDeg, ANGLE_TOLERANCE, "P1");
            assertEquals(265.3415654432, e.solarMeanLongitudeDeg, ANGLE_TOLERANCE, "H");
            assertEquals(180.0, e.hourAngleDeg, ANGLE_TOLERANCE, "T");
            assertEquals(23.2852944777346, e.inclinationDeg, ANGLE_TOLERANCE, "I");
            assertEquals(12.9921467295774, e.nuDeg, ANGLE_TOLERANCE, "nu");
            assertEquals(11.9263714758128, e.xiDeg, ANGLE_TOLERANCE, "xi");
            assertEquals(8.90173475253831, e.nuPrimeDeg, ANGLE_TOLERANCE, "nu'");
            assertEquals(166.075199316188, e.pcDeg, ANGLE_TOLERANCE, "P - xi");
            assertEquals(-8.73186421857213, e.rDeg, ANGLE_TOLERANCE, "R");
            assertEquals(8.90602738992766, e.nuDoublePrimeDeg, ANGLE_TOLERANCE, "nu''");
            assertEquals(173.16343424678, e.qDeg, ANGLE_TOLERANCE, "Q");
        }

        @Test
        @DisplayName("Summer 2021 epoch with non-midnight spinup")
        void summer() {
            OrbitalElements e = OrbitalElements.of(ReferenceValues.summerEpoch());

            assertEquals(69.670005071875, e.lunarNodeDeg, ANGLE_TOLERANCE, "N");
            assertEquals(237.2116448375, e.lunarPerigeeDeg, ANGLE_TOLERANCE, "P");
            assertEquals(327.398991904, e.lunarMeanLongitudeDeg, ANGLE_TOLERANCE, "S");
            assertEquals(283.307992342, e.solarPerigeeDeg, ANGLE_TOLERANCE, "P1");
            assertEquals(70.4451798614, e.solarMeanLongitudeDeg, ANGLE_TOLERANCE, "H");
            assertEquals(25.6712723353605, e.inclinationDeg, ANGLE_TOLERANCE, "I");
            assertEquals(11.1964754666759, e.nuDeg, ANGLE_TOLERANCE, "nu");
            assertEquals(10.1840652301827, e.xiDeg, ANGLE_TOLERANCE, "xi");
            assertEquals(7.84285394214918, e.nuPrimeDeg, ANGLE_TOLERANCE, "nu'");
            assertEquals(227.027579607317, e.pcDeg, ANGLE_TOLERANCE, "P - xi");
            assertEquals(16.9099731133429, e.rDeg, ANGLE_TOLERANCE, "R");
            assertEquals(8.09834987648447, e.nuDoublePrimeDeg, ANGLE_TOLERANCE, "nu''");
            assertEquals(-152.75342127986, e.qDeg, ANGLE_TOLERANCE, "Q");
        }

        @Test
        @DisplayName("Radian and degree forms agree")
        void radiansMatchDegrees() {
            OrbitalElements e = OrbitalElements.of(ReferenceValues.summerEpoch());

            assertEquals(Math.toRadians(e.lunarNodeDeg), e.lunarNode, 1e-15);
            assertEquals(Math.toRadians(e.lunarPerigeeDeg), e.lunarPerigee, 1e-15);
            assertEquals(Math.toRadians(e.hourAngleDeg), e.hourAngle, 1e-15);
            assertEquals(Math.toDegrees(e.inclination), e.inclinationDeg, 1e-12);
            assertEquals(Math.toDegrees(e.q), e.qDeg, 1e-12);
        }
    }

    @Nested
    @DisplayName("Boundary Conditions")
    class BoundaryConditionTests {

        @Test
        @DisplayName("Reduced angles stay in [0, 360) across a nodal cycle")
        void anglesInRange() {
            LocalDateTime start = LocalDateTime.of(2005, 1, 1, 0, 0);
            for (int month = 0; month < 12 * 19; month += 7) {
                for (int hour = 0; hour < 24; hour += 5) {
                    LocalDateTime s = start.plusMonths(month).plusHours(hour);
                    OrbitalElements e = OrbitalElements.of(EpochWindow.validate(s, s.plusDays(30)));
                    assertInDegreeRange(e.lunarNodeDeg, "N");
                    assertInDegreeRange(e.lunarPerigeeDeg, "P");
                    assertInDegreeRange(e.lunarMeanLongitudeDeg, "S");
                    assertInDegreeRange(e.solarPerigeeDeg, "P1");
                    assertInDegreeRange(e.solarMeanLongitudeDeg, "H");
                    assertInDegreeRange(e.hourAngleDeg, "T");
                    assertInDegreeRange(e.pcDeg, "PC");
                    // Inclination oscillates between about 18.3 and 28.6 degrees
                    assertTrue(e.inclinationDeg > 18.0 && e.inclinationDeg < 29.0,
                            "I in lunar range: " + e.inclinationDeg);
                }
            }
        }

        @Test
        @DisplayName("Years outside 1901..2099 still compute")
        void outsideCalendarRange() {
            LocalDateTime start = LocalDateTime.of(1890, 6, 1, 0, 0);
            OrbitalElements e = OrbitalElements.of(EpochWindow.validate(start, start.plusDays(10)));

            // (1890 - 1901) / 4 truncates toward zero
            assertEquals(-10.0, e.dyr);
            assertEquals(start.minusDays(15).getDayOfYear() - 2 - 1, e.dday);
            assertInDegreeRange(e.lunarNodeDeg, "N");
            assertTrue(Double.isFinite(e.qDeg));
        }

        @Test
        @DisplayName("Degree reduction wraps negative angles upward")
        void mod360() {
            assertEquals(350.0, OrbitalElements.mod360(-10.0));
            assertEquals(0.0, OrbitalElements.mod360(360.0));
            assertEquals(0.0, OrbitalElements.mod360(-720.0));
            assertEquals(10.0, OrbitalElements.mod360(730.0), 1e-12);
            assertEquals(0.0, OrbitalElements.mod360(-1e-15));
        }
    }

    private static void assertInDegreeRange(double value, String message) {
        assertTrue(value >= 0.0 && value < 360.0, message + " in [0, 360), got: " + value);
    }
}
