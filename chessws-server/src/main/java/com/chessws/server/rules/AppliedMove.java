package com.chessws.server.rules;

/**
 * Result of a legal move: the position after it and the move in the notation broadcast to players.
 */
public record AppliedMove(Position position, String notation) {
}
