package com.chessws.server.protocol;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.auth.Principal;
import com.chessws.server.model.GameException;
import com.chessws.server.model.GameSession;
import com.chessws.server.network.MessageSender;
import com.chessws.server.registry.Connection;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.server.registry.ConnectionRegistry;
import com.chessws.server.service.JoinResult;
import com.chessws.server.service.MatchmakingService;
import com.chessws.server.service.SessionStore;
import com.chessws.shared.dto.ChatMessageDTO;
import com.chessws.shared.dto.DrawResponseMessageDTO;
import com.chessws.shared.dto.Envelope;
import com.chessws.shared.dto.ErrorDTO;
import com.chessws.shared.dto.GameRefDTO;
import com.chessws.shared.dto.MoveMessageDTO;
import com.chessws.shared.dto.TimeUpdateMessageDTO;
import com.chessws.shared.util.Colour;
import com.chessws.shared.util.MessageType;

/**
 * Turns decoded client messages into matchmaking and session calls. Holds no game state of
 * its own: everything it changes goes through {@link MatchmakingService} or a
 * {@link GameSession}, and every failure it reports goes to the sender only.
 */
public class ProtocolRouter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProtocolRouter.class);

    private final ConnectionRegistry registry;
    private final MatchmakingService matchmaking;
    private final SessionStore store;
    private final MessageSender sender;
    private final MessageCodec codec;

    public ProtocolRouter(ConnectionRegistry registry, MatchmakingService matchmaking, SessionStore store,
                          MessageSender sender, MessageCodec codec) {
        this.registry = registry;
        this.matchmaking = matchmaking;
        this.store = store;
        this.sender = sender;
        this.codec = codec;
    }

    public void onMessage(ConnectionHandle handle, String text) {
        Optional<Principal> principal = registry.principalOf(handle);
        if (principal.isEmpty()) {
            LOGGER.warn("Message on unregistered {} ignored", handle);
            return;
        }
        LOGGER.debug("<- {} {}", handle, text);

        InboundMessage message;
        try {
            message = codec.decode(text);
        } catch (UnknownMessageTypeException e) {
            LOGGER.warn("Ignoring message of unknown type '{}' from {}", e.getType(), handle);
            return;
        } catch (MessageDecodeException e) {
            LOGGER.warn("Dropping malformed message from {}: {}", handle, e.getMessage());
            return;
        }

        try {
            dispatch(handle, principal.get(), message);
        } catch (GameException e) {
            LOGGER.debug("{} {} failed: {} ({})", handle, message.type().wireName(), e.getError().code(), e.getMessage());
            sender.send(handle, Envelope.of(MessageType.ERROR, new ErrorDTO(e.getError().code(), e.getMessage())));
        }
    }

    private void dispatch(ConnectionHandle handle, Principal principal, InboundMessage message) throws GameException {
        switch (message.type()) {
            case JOIN:
                handleJoin(handle, principal);
                break;
            case PING:
                sender.send(handle, Envelope.of(MessageType.PONG));
                break;
            case MOVE: {
                MoveMessageDTO move = message.payload(MoveMessageDTO.class);
                GameSession session = store.require(move.gameId());
                session.move(session.colourOf(handle), move.move());
                break;
            }
            case RESIGN: {
                GameSession session = store.require(message.payload(GameRefDTO.class).gameId());
                session.resign(session.colourOf(handle));
                break;
            }
            case DRAW_OFFER: {
                GameSession session = store.require(message.payload(GameRefDTO.class).gameId());
                session.offerDraw(session.colourOf(handle));
                break;
            }
            case DRAW_RESPONSE: {
                DrawResponseMessageDTO response = message.payload(DrawResponseMessageDTO.class);
                GameSession session = store.require(response.gameId());
                session.respondDraw(session.colourOf(handle), response.accept());
                break;
            }
            case TIME_UPDATE: {
                TimeUpdateMessageDTO update = message.payload(TimeUpdateMessageDTO.class);
                GameSession session = store.require(update.gameId());
                session.updateClock(session.colourOf(handle), update.timeLeft());
                break;
            }
            case CHAT: {
                ChatMessageDTO chat = message.payload(ChatMessageDTO.class);
                GameSession session = store.require(chat.gameId());
                session.appendChat(session.colourOf(handle), chat.message());
                break;
            }
            case RECONNECT: {
                GameSession session = store.require(message.payload(GameRefDTO.class).gameId());
                session.bindConnection(principal, handle);
                trackBinding(handle, session);
                break;
            }
            default:
                LOGGER.warn("No handler for {}", message.type());
        }
    }

    private void handleJoin(ConnectionHandle handle, Principal principal) {
        JoinResult result = matchmaking.join(principal, handle);
        if (result.isWaiting()) {
            return;
        }
        GameSession session = result.session();
        trackBinding(handle, session);
        ConnectionHandle whiteHandle = session.getHandle(Colour.WHITE);
        if (whiteHandle != null) {
            trackBinding(whiteHandle, session);
        }
    }

    // a handle that closed before it could be tracked is unbound here, since its close
    // path will not find the session
    private void trackBinding(ConnectionHandle handle, GameSession session) {
        if (!registry.bindSession(handle, session.getGameId())) {
            session.unbindConnection(handle);
        }
    }

    /**
     * Connection teardown: drops the registry entry, clears the waiting slot if this
     * connection held it, and unbinds the connection from every session it played in.
     * Sessions themselves keep running.
     */
    public void onDisconnect(ConnectionHandle handle) {
        Optional<Connection> removed = registry.unregister(handle);
        if (removed.isEmpty()) {
            return;
        }
        matchmaking.cancel(handle);
        for (String gameId : removed.get().sessionIds()) {
            store.find(gameId).ifPresent(session -> session.unbindConnection(handle));
        }
    }
}
