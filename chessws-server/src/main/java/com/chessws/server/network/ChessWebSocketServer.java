package com.chessws.server.network;

import java.net.InetSocketAddress;
import java.util.Optional;

import org.java_websocket.WebSocket;
import org.java_websocket.drafts.Draft;
import org.java_websocket.exceptions.InvalidDataException;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.handshake.ServerHandshakeBuilder;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.auth.Authenticator;
import com.chessws.server.auth.Principal;
import com.chessws.server.protocol.ProtocolRouter;
import com.chessws.server.registry.Connection;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.server.registry.ConnectionRegistry;

/**
 * WebSocket transport. Authenticates during the upgrade, registers each accepted socket and
 * forwards its frames to the {@link ProtocolRouter}. A socket's attachment is its
 * {@link Principal} between handshake and open, then its {@link ConnectionHandle}.
 */
public class ChessWebSocketServer extends WebSocketServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChessWebSocketServer.class);

    private final Authenticator authenticator;
    private final ConnectionRegistry registry;
    private final ProtocolRouter router;
    private final int connectionLostTimeoutSeconds;

    public ChessWebSocketServer(InetSocketAddress address, Authenticator authenticator,
                                ConnectionRegistry registry, ProtocolRouter router,
                                int connectionLostTimeoutSeconds) {
        super(address);
        this.authenticator = authenticator;
        this.registry = registry;
        this.router = router;
        this.connectionLostTimeoutSeconds = connectionLostTimeoutSeconds;
        setReuseAddr(true);
    }

    @Override
    public ServerHandshakeBuilder onWebsocketHandshakeReceivedAsServer(WebSocket conn, Draft draft,
                                                                      ClientHandshake request) throws InvalidDataException {
        ServerHandshakeBuilder builder = super.onWebsocketHandshakeReceivedAsServer(conn, draft, request);
        Optional<Principal> principal = authenticator.authenticate(request);
        if (principal.isEmpty()) {
            LOGGER.info("Rejected unauthenticated upgrade from {}", conn.getRemoteSocketAddress());
            throw new InvalidDataException(CloseFrame.POLICY_VALIDATION, "Unauthorized");
        }
        conn.setAttachment(principal.get());
        return builder;
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        Object attachment = conn.getAttachment();
        if (!(attachment instanceof Principal)) {
            conn.close(CloseFrame.POLICY_VALIDATION, "Unauthorized");
            return;
        }
        Connection connection = registry.register((Principal) attachment, new WebSocketSink(conn));
        conn.setAttachment(connection.handle());
        LOGGER.info("Connection {} opened from {} as {}", connection.handle(), conn.getRemoteSocketAddress(), attachment);
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        Object attachment = conn.getAttachment();
        if (attachment instanceof ConnectionHandle) {
            LOGGER.info("Connection {} closed code={} reason='{}' remote={}", attachment, code, reason, remote);
            router.onDisconnect((ConnectionHandle) attachment);
        }
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        Object attachment = conn.getAttachment();
        if (attachment instanceof ConnectionHandle) {
            router.onMessage((ConnectionHandle) attachment, message);
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        if (conn == null) {
            LOGGER.error("WebSocket server error", ex);
        } else {
            LOGGER.warn("Error on connection {}: {}", conn.getRemoteSocketAddress(), ex.toString());
        }
    }

    @Override
    public void onStart() {
        setConnectionLostTimeout(connectionLostTimeoutSeconds);
        LOGGER.info("Server started successfully on port {}", getPort());
    }
}
