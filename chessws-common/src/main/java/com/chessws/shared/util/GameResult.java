package com.chessws.shared.util;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Final result of a game, as reported in {@code gameOver.outcome}.
 */
public enum GameResult {
    WHITE_WIN("white won", "white"),
    BLACK_WIN("black won", "black"),
    DRAW("draw", "draw");

    private final String wireName;
    private final String winner;

    GameResult(String wireName, String winner) {
        this.wireName = wireName;
        this.winner = winner;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** The {@code gameOver.winner} spelling: a colour name or {@code "draw"}. */
    public String winner() {
        return winner;
    }

    /**
     * Score used by rating calculations: 1.0 for a win, 0.5 for a draw, 0.0 for a loss.
     */
    public double scoreFor(Colour colour) {
        if (this == DRAW) return 0.5;
        return winnerColour() == colour ? 1.0 : 0.0;
    }

    public Colour winnerColour() {
        switch (this) {
            case WHITE_WIN: return Colour.WHITE;
            case BLACK_WIN: return Colour.BLACK;
            default: return null;
        }
    }

    public static GameResult winFor(Colour colour) {
        return colour == Colour.WHITE ? WHITE_WIN : BLACK_WIN;
    }
}
