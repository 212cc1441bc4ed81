package com.chessws.server.protocol;

/**
 * An inbound frame that is not a well-formed envelope for a known client message.
 */
public class MessageDecodeException extends Exception {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
