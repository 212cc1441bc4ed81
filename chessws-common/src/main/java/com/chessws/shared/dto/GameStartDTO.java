package com.chessws.shared.dto;

import com.chessws.shared.util.Colour;

public record GameStartDTO(
    String gameId,
    Colour color,
    String opponent
) {}
