package com.chessws.shared.dto;

public record ErrorDTO(String code, String message) {}
