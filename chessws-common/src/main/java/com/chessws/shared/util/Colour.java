package com.chessws.shared.util;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Colour {
    WHITE("white"),
    BLACK("black");

    private final String wireName;

    Colour(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Colour opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
