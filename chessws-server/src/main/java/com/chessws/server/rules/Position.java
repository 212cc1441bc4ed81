package com.chessws.server.rules;

/**
 * Opaque board state owned by a {@link RulesOracle}. Sessions only store it and pass it back.
 */
public interface Position {
}
