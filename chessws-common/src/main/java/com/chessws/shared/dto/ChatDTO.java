package com.chessws.shared.dto;

public record ChatDTO(String sender, String message) {}
