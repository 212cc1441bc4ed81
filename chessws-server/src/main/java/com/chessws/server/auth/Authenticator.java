package com.chessws.server.auth;

import java.util.Optional;

import org.java_websocket.handshake.ClientHandshake;

/**
 * Turns an upgrade request into a trusted principal. Credential verification itself
 * happens upstream; an empty result rejects the upgrade.
 */
public interface Authenticator {

    Optional<Principal> authenticate(ClientHandshake handshake);
}
