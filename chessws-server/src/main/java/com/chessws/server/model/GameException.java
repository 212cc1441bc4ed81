package com.chessws.server.model;

public class GameException extends Exception {
    private final GameError error;

    public GameException(GameError error) {
        this(error, error.defaultMessage());
    }

    public GameException(GameError error, String message) {
        super(message);
        this.error = error;
    }

    public GameError getError() {
        return error;
    }
}
