package com.chessws.server.rules;

import com.chessws.shared.util.GameOverReason;
import com.chessws.shared.util.GameResult;

public record Outcome(boolean terminal, GameResult result, GameOverReason method) {

    public static final Outcome ONGOING = new Outcome(false, null, null);

    public static Outcome over(GameResult result, GameOverReason method) {
        return new Outcome(true, result, method);
    }
}
