package com.chessws.server.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class EloCalculatorTest {

    private final EloCalculator calculator = new EloCalculator();

    @Test
    public void testEqualRatingsAreSymmetric() {
        int winner = calculator.delta(1500, 1500, 1.0);
        int loser = calculator.delta(1500, 1500, 0.0);

        assertEquals(16, winner);
        assertEquals(-winner, loser);
    }

    @Test
    public void testDrawBetweenEqualsChangesNothing() {
        assertEquals(0, calculator.delta(1200, 1200, 0.5));
    }

    @Test
    public void testUpsetWorthMoreThanExpectedWin() {
        int favouriteWins = calculator.delta(1800, 1400, 1.0);
        int underdogWins = calculator.delta(1400, 1800, 1.0);

        assertTrue(underdogWins > favouriteWins);
        assertEquals(3, favouriteWins);
        assertEquals(29, underdogWins);
    }

    @Test
    public void testExpectedScore() {
        assertEquals(0.5, calculator.expectedScore(1000, 1000), 1e-9);
        assertEquals(1.0 / 11.0, calculator.expectedScore(1000, 1400), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveKFactorRejected() {
        new EloCalculator(0);
    }
}
