package com.chessws.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeUpdateMessageDTO(String gameId, Double timeLeft) {}
