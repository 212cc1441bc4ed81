package com.chessws.shared.util;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GameOverReason {
    CHECKMATE("checkmate"),
    STALEMATE("stalemate"),
    RESIGN("resignation"),
    ABANDON("abandonment"),
    AGREED_DRAW("agreement"),
    FIFTY_MOVE("fifty-move rule"),
    REPETITION("threefold repetition"),
    INSUFFICIENT_MATERIAL("insufficient material");

    private final String wireName;

    GameOverReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
