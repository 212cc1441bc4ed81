package com.chessws.shared.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Every {@code type} string carried by an envelope, in both directions.
 * {@code move} and {@code chat} are used for the request and for the broadcast.
 */
public enum MessageType {
    // client -> server
    JOIN("join"),
    MOVE("move"),
    RESIGN("resign"),
    DRAW_OFFER("draw_offer"),
    DRAW_RESPONSE("draw_response"),
    TIME_UPDATE("time_update"),
    CHAT("chat"),
    RECONNECT("reconnect"),
    PING("ping"),

    // server -> client
    WAITING("waiting"),
    GAME_START("gameStart"),
    GAME_OVER("gameOver"),
    DRAW_OFFERED("drawOffer"),
    DRAW_ANSWERED("drawResponse"),
    TIME_UPDATED("timeUpdate"),
    GAME_STATE("gameState"),
    OPPONENT_DISCONNECTED("opponentDisconnected"),
    OPPONENT_RECONNECTED("opponentReconnected"),
    ERROR("error"),
    PONG("pong");

    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_WIRE_NAME.putIfAbsent(type.wireName, type);
        }
    }

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns the constant for a wire name, or null if the name is not part of the protocol. */
    public static MessageType fromWireName(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }
}
