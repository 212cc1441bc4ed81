package com.chessws.shared.dto;

import com.chessws.shared.util.Colour;

public record MoveBroadcastDTO(String move, String position, Colour turn) {}
