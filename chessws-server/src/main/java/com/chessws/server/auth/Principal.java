package com.chessws.server.auth;

import java.util.Objects;

/**
 * Authenticated identity attached to a connection before any protocol message is read.
 * Immutable for the lifetime of the connection.
 */
public record Principal(String id, String displayName) {

    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        if (id.isBlank() || displayName.isBlank()) {
            throw new IllegalArgumentException("principal id and display name must not be blank");
        }
    }

    @Override
    public String toString() {
        return "Principal{ id=" + id + ", name=" + displayName + " }";
    }
}
