package com.chessws.server.model;

/**
 * Failures reported to the sender as {@code error{code,message}}. The code is the stable
 * token clients switch on; the message is a human-readable default.
 */
public enum GameError {
    GAME_NOT_FOUND("gameNotFound", "Game not found"),
    PLAYER_NOT_IN_GAME("playerNotInGame", "You are not a player in this game"),
    NOT_YOUR_TURN("notYourTurn", "Not your turn"),
    INVALID_MOVE("invalidMove", "Invalid move"),
    NO_DRAW_PENDING("noDrawPending", "No draw offer is pending"),
    GAME_NOT_ACTIVE("gameNotActive", "Game is already over");

    private final String code;
    private final String defaultMessage;

    GameError(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String code() {
        return code;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
