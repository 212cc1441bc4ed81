package com.chessws.server.network;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import com.chessws.server.registry.ConnectionHandle;
import com.chessws.shared.dto.Envelope;

/**
 * {@link MessageSender} that records envelopes per handle instead of encoding them.
 */
public class RecordingSender implements MessageSender {

    public record Sent(ConnectionHandle handle, Envelope<?> envelope) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();

    @Override
    public void send(ConnectionHandle handle, Envelope<?> envelope) {
        if (handle != null) {
            sent.add(new Sent(handle, envelope));
        }
    }

    public List<Envelope<?>> to(ConnectionHandle handle) {
        return sent.stream()
            .filter(s -> s.handle().equals(handle))
            .map(Sent::envelope)
            .collect(Collectors.toList());
    }

    public List<String> typesTo(ConnectionHandle handle) {
        return to(handle).stream().map(Envelope::type).collect(Collectors.toList());
    }

    public Envelope<?> lastTo(ConnectionHandle handle) {
        List<Envelope<?>> envelopes = to(handle);
        return envelopes.isEmpty() ? null : envelopes.get(envelopes.size() - 1);
    }

    public List<Sent> all() {
        return sent;
    }

    public void clear() {
        sent.clear();
    }
}
