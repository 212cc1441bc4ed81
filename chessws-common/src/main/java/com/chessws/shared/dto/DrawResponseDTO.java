package com.chessws.shared.dto;

public record DrawResponseDTO(boolean accepted) {}
