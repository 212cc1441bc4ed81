package com.chessws.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DrawResponseMessageDTO(String gameId, Boolean accept) {}
