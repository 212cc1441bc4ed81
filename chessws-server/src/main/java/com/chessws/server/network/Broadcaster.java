package com.chessws.server.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.protocol.MessageCodec;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.server.registry.ConnectionRegistry;
import com.chessws.shared.dto.Envelope;

/**
 * Encodes envelopes and hands them to the outbox of the target connection.
 */
public class Broadcaster implements MessageSender {
    private static final Logger LOGGER = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry registry;
    private final MessageCodec codec;

    public Broadcaster(ConnectionRegistry registry, MessageCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    @Override
    public void send(ConnectionHandle handle, Envelope<?> envelope) {
        if (handle == null) {
            return;
        }
        registry.lookup(handle).ifPresentOrElse(
            connection -> connection.outbox().enqueue(codec.encode(envelope)),
            () -> LOGGER.debug("Dropping {} for {}: connection gone", envelope.type(), handle));
    }
}
