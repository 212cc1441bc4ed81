package com.chessws.shared.dto;

import com.chessws.shared.util.Colour;

public record TimeUpdateDTO(Colour color, double timeLeft) {}
