package com.chessws.server.service;

/**
 * Standard Elo update with a fixed K-factor.
 */
public class EloCalculator {
    public static final int DEFAULT_K_FACTOR = 32;

    private final int kFactor;

    public EloCalculator() {
        this(DEFAULT_K_FACTOR);
    }

    public EloCalculator(int kFactor) {
        if (kFactor <= 0) {
            throw new IllegalArgumentException("kFactor must be positive: " + kFactor);
        }
        this.kFactor = kFactor;
    }

    public double expectedScore(int playerRating, int opponentRating) {
        return 1.0 / (1.0 + Math.pow(10, (opponentRating - playerRating) / 400.0));
    }

    /**
     * @param actualScore 1.0 for a win, 0.5 for a draw, 0.0 for a loss
     */
    public int delta(int playerRating, int opponentRating, double actualScore) {
        return (int) Math.round(kFactor * (actualScore - expectedScore(playerRating, opponentRating)));
    }
}
