package com.chessws.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Payload of requests that only name their game: resign, draw_offer, reconnect. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameRefDTO(String gameId) {}
