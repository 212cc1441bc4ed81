package com.chessws.server.model;

import com.chessws.server.rules.Outcome;
import com.chessws.shared.util.Colour;

public record MoveResult(String move, String position, Colour turn, Outcome outcome) {
}
