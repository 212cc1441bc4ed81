package com.chessws.shared.dto;

import com.chessws.shared.util.Colour;

/**
 * Full state replayed to a player who reconnects to a running (or finished) game.
 */
public record GameStateDTO(
    String position,
    Colour turn,
    String whitePlayer,
    String blackPlayer,
    double whiteTime,
    double blackTime
) {}
