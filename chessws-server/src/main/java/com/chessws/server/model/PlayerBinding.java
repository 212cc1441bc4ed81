package com.chessws.server.model;

import java.time.Instant;

import com.chessws.server.auth.Principal;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.shared.util.Colour;

/**
 * One colour's seat in a session. The handle is null while the player is disconnected;
 * reconnecting fills it in place. Guarded by the owning session's lock.
 */
public class PlayerBinding {
    private final Principal principal;
    private final Colour colour;
    private ConnectionHandle handle;
    private Instant disconnectedAt;

    PlayerBinding(Principal principal, Colour colour, ConnectionHandle handle) {
        this.principal = principal;
        this.colour = colour;
        this.handle = handle;
    }

    public Principal getPrincipal() {
        return principal;
    }

    public Colour getColour() {
        return colour;
    }

    public ConnectionHandle getHandle() {
        return handle;
    }

    public boolean isConnected() {
        return handle != null;
    }

    public Instant getDisconnectedAt() {
        return disconnectedAt;
    }

    void bind(ConnectionHandle handle) {
        this.handle = handle;
        this.disconnectedAt = null;
    }

    void unbind(Instant now) {
        this.handle = null;
        this.disconnectedAt = now;
    }

    boolean matches(Principal candidate) {
        return principal.id().equals(candidate.id());
    }

    boolean matchesName(String displayName) {
        return principal.displayName().equals(displayName);
    }

    @Override
    public String toString() {
        return colour + "=" + principal.displayName() + (handle == null ? " (away)" : "@" + handle);
    }
}
