package com.chessws.server.registry;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.chessws.server.auth.Principal;
import com.chessws.server.network.Outbox;

public class Connection {
    private final ConnectionHandle handle;
    private final Principal principal;
    private final Outbox outbox;
    private final Set<String> sessionIds = ConcurrentHashMap.newKeySet();

    Connection(ConnectionHandle handle, Principal principal, Outbox outbox) {
        this.handle = handle;
        this.principal = principal;
        this.outbox = outbox;
    }

    public ConnectionHandle handle() {
        return handle;
    }

    public Principal principal() {
        return principal;
    }

    public Outbox outbox() {
        return outbox;
    }

    /** Ids of the sessions this connection has been bound to, used to unbind on close. */
    public Set<String> sessionIds() {
        return Collections.unmodifiableSet(sessionIds);
    }

    void addSession(String sessionId) {
        sessionIds.add(sessionId);
    }

    @Override
    public String toString() {
        return "Connection{ " + handle + ", " + principal + " }";
    }
}
