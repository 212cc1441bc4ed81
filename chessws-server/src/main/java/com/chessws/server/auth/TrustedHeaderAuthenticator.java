package com.chessws.server.auth;

import java.util.Optional;

import org.java_websocket.handshake.ClientHandshake;

/**
 * Reads the identity headers the fronting gateway sets after it has verified the
 * caller's token. The server must only be reachable through that gateway.
 */
public class TrustedHeaderAuthenticator implements Authenticator {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_NAME_HEADER = "X-User-Name";

    @Override
    public Optional<Principal> authenticate(ClientHandshake handshake) {
        String userId = handshake.getFieldValue(USER_ID_HEADER).trim();
        String username = handshake.getFieldValue(USER_NAME_HEADER).trim();
        if (userId.isEmpty() || username.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Principal(userId, username));
    }
}
