package com.chessws.server.network;

import java.io.IOException;

import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;

public class WebSocketSink implements OutboundSink {
    private final WebSocket socket;

    public WebSocketSink(WebSocket socket) {
        this.socket = socket;
    }

    @Override
    public void send(String frame) throws IOException {
        try {
            socket.send(frame);
        } catch (WebsocketNotConnectedException e) {
            throw new IOException("not connected: " + socket.getRemoteSocketAddress(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return socket.isOpen();
    }

    @Override
    public void close(int code, String reason) {
        socket.close(code, reason);
    }
}
