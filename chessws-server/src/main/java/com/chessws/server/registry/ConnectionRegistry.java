package com.chessws.server.registry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.auth.Principal;
import com.chessws.server.network.OutboundSink;
import com.chessws.server.network.Outbox;

/**
 * Thread-safe registry of live connections and the principal bound to each.
 *
 * <p>Backed by a {@link ConcurrentHashMap}, so register/unregister of unrelated handles
 * never contend on a shared lock. Unregistering only drops the mapping: sessions that
 * still hold the handle simply stop resolving it.
 */
public class ConnectionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<ConnectionHandle, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong handleCounter = new AtomicLong();

    public Connection register(Principal principal, OutboundSink sink) {
        ConnectionHandle handle = new ConnectionHandle(handleCounter.incrementAndGet());
        Connection connection = new Connection(handle, principal, new Outbox(handle, sink));
        connections.put(handle, connection);
        LOGGER.debug("Registered {} for {}", handle, principal);
        return connection;
    }

    public Optional<Connection> unregister(ConnectionHandle handle) {
        Connection removed = connections.remove(handle);
        if (removed != null) {
            removed.outbox().close();
            LOGGER.debug("Unregistered {}", handle);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Connection> lookup(ConnectionHandle handle) {
        return handle == null ? Optional.empty() : Optional.ofNullable(connections.get(handle));
    }

    public Optional<Principal> principalOf(ConnectionHandle handle) {
        return lookup(handle).map(Connection::principal);
    }

    /**
     * Records that the connection is bound to a session.
     *
     * @return false if the handle is no longer registered
     */
    public boolean bindSession(ConnectionHandle handle, String sessionId) {
        // atomic with unregister's remove: either the close path sees the id or we report false
        return connections.computeIfPresent(handle, (h, c) -> {
            c.addSession(sessionId);
            return c;
        }) != null;
    }

    public int size() {
        return connections.size();
    }
}
