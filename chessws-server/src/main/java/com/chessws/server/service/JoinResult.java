package com.chessws.server.service;

import com.chessws.server.model.GameSession;
import com.chessws.shared.util.Colour;

/**
 * Outcome of a join: either the caller is now waiting, or it was paired into {@code session}.
 */
public record JoinResult(GameSession session, Colour colour, String opponentName) {

    private static final JoinResult WAITING = new JoinResult(null, null, null);

    public static JoinResult waiting() {
        return WAITING;
    }

    public static JoinResult paired(GameSession session, Colour colour, String opponentName) {
        return new JoinResult(session, colour, opponentName);
    }

    public boolean isWaiting() {
        return session == null;
    }
}
