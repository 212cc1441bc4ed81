package com.chessws.shared.dto;

import com.chessws.shared.util.MessageType;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope<T>(String type, T payload) {

    public static <T> Envelope<T> of(MessageType type, T payload) {
        return new Envelope<>(type.wireName(), payload);
    }

    public static Envelope<Void> of(MessageType type) {
        return new Envelope<>(type.wireName(), null);
    }
}
