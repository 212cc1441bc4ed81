package com.chessws.server.network;

import java.io.IOException;

/**
 * The raw write side of one connection. Implementations need not be thread-safe:
 * the owning {@link Outbox} guarantees a single writer at a time.
 */
public interface OutboundSink {

    void send(String frame) throws IOException;

    boolean isOpen();

    void close(int code, String reason);
}
