package com.chessws.server.model;

import com.chessws.server.auth.Principal;
import com.chessws.shared.util.GameResult;

/**
 * Notified once per session when it reaches a terminal outcome, after {@code gameOver}
 * has been queued to both players. Implementations must not block the caller.
 */
@FunctionalInterface
public interface GameCompletionListener {

    void onGameCompleted(String gameId, Principal white, Principal black, GameResult outcome);
}
