package com.chessws.server.registry;

/**
 * Opaque identity of one transport-level connection. Sessions keep handles, never sockets,
 * and resolve them through the {@link ConnectionRegistry} when they need to send.
 */
public record ConnectionHandle(long id) {

    @Override
    public String toString() {
        return "conn-" + id;
    }
}
