package com.chessws.server.protocol;

import com.chessws.shared.util.MessageType;

/**
 * A decoded client message. {@code payload} is the record registered for {@code type}
 * in {@link MessageCodec}, or null for types without a payload.
 */
public record InboundMessage(MessageType type, Object payload) {

    public <T> T payload(Class<T> payloadClass) {
        return payloadClass.cast(payload);
    }
}
