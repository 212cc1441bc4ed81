package com.chessws.server.service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.auth.Principal;
import com.chessws.server.model.GameSession;
import com.chessws.server.network.MessageSender;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.shared.dto.Envelope;
import com.chessws.shared.dto.GameStartDTO;
import com.chessws.shared.util.Colour;
import com.chessws.shared.util.MessageType;

/**
 * Single-slot matchmaking. The first arrival waits and will play white; the next distinct
 * principal takes the slot, plays black, and a session is created for the pair.
 *
 * <p>Reading and clearing the slot, creating the session and inserting it into the store all
 * happen under {@code matchLock}, so concurrent joins can never both pair with one waiting
 * entry or both find the slot empty.
 */
public class MatchmakingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MatchmakingService.class);

    static final String WAITING_MESSAGE = "Waiting for opponent...";

    private record WaitingEntry(Principal principal, ConnectionHandle handle) {
    }

    private final SessionStore store;
    private final SessionFactory sessionFactory;
    private final MessageSender sender;
    private final ReentrantLock matchLock = new ReentrantLock();
    private WaitingEntry waiting;

    public MatchmakingService(SessionStore store, SessionFactory sessionFactory, MessageSender sender) {
        this.store = store;
        this.sessionFactory = sessionFactory;
        this.sender = sender;
    }

    public JoinResult join(Principal principal, ConnectionHandle handle) {
        matchLock.lock();
        try {
            if (waiting == null || waiting.principal().id().equals(principal.id())) {
                // a principal re-joining while waiting keeps its place on the newest connection
                waiting = new WaitingEntry(principal, handle);
                sender.send(handle, Envelope.of(MessageType.WAITING, WAITING_MESSAGE));
                LOGGER.info("{} waiting for an opponent", principal);
                return JoinResult.waiting();
            }

            WaitingEntry opponent = waiting;
            waiting = null;
            GameSession session = sessionFactory.create(opponent.principal(), opponent.handle(), principal, handle);
            store.insert(session);

            sender.send(opponent.handle(), Envelope.of(MessageType.GAME_START,
                new GameStartDTO(session.getGameId(), Colour.WHITE, principal.displayName())));
            sender.send(handle, Envelope.of(MessageType.GAME_START,
                new GameStartDTO(session.getGameId(), Colour.BLACK, opponent.principal().displayName())));
            LOGGER.info("Matched {} vs {} -> game {}", opponent.principal().displayName(),
                principal.displayName(), session.getGameId());
            return JoinResult.paired(session, Colour.BLACK, opponent.principal().displayName());
        } finally {
            matchLock.unlock();
        }
    }

    /**
     * Clears the slot if {@code handle} occupies it.
     *
     * @return true if the slot was cleared
     */
    public boolean cancel(ConnectionHandle handle) {
        matchLock.lock();
        try {
            if (waiting != null && waiting.handle().equals(handle)) {
                LOGGER.info("{} left the queue", waiting.principal());
                waiting = null;
                return true;
            }
            return false;
        } finally {
            matchLock.unlock();
        }
    }

    public Optional<Principal> waitingPrincipal() {
        matchLock.lock();
        try {
            return Optional.ofNullable(waiting).map(WaitingEntry::principal);
        } finally {
            matchLock.unlock();
        }
    }
}
