package com.chessws.server.network;

import com.chessws.server.registry.ConnectionHandle;
import com.chessws.shared.dto.Envelope;

/**
 * Enqueues an envelope for one connection. Sending to a handle that is no longer
 * registered is silently skipped: the player is disconnected, not in error.
 */
public interface MessageSender {

    void send(ConnectionHandle handle, Envelope<?> envelope);
}
