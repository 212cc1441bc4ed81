package com.chessws.shared.dto;

import com.chessws.shared.util.GameOverReason;
import com.chessws.shared.util.GameResult;

public record GameOverDTO(GameResult outcome, GameOverReason method, String winner) {

    public static GameOverDTO of(GameResult result, GameOverReason reason) {
        return new GameOverDTO(result, reason, result.winner());
    }
}
