package com.chessws.server.protocol;

public class UnknownMessageTypeException extends MessageDecodeException {
    private final String type;

    public UnknownMessageTypeException(String type) {
        super("unknown message type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
