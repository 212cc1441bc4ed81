package com.chessws.server.rules;

import com.chessws.shared.util.Colour;

/**
 * Decides move legality, the resulting position and terminal outcomes. Implementations
 * must not mutate positions passed to them: {@link #applyMove} returns a new one.
 */
public interface RulesOracle {

    Position newGame();

    AppliedMove applyMove(Position position, String moveText) throws IllegalMoveException;

    Outcome outcome(Position position);

    String renderPosition(Position position);

    Colour sideToMove(Position position);
}
