package com.chessws.server.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.chessws.server.model.GameError;
import com.chessws.server.model.GameException;
import com.chessws.server.model.GameSession;

/**
 * Concurrent map of game id to session. Active sessions are never removed.
 */
public class SessionStore {
    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();

    public void insert(GameSession session) {
        GameSession previous = sessions.putIfAbsent(session.getGameId(), session);
        if (previous != null) {
            throw new IllegalStateException("duplicate game id " + session.getGameId());
        }
    }

    public Optional<GameSession> find(String gameId) {
        return gameId == null ? Optional.empty() : Optional.ofNullable(sessions.get(gameId));
    }

    public GameSession require(String gameId) throws GameException {
        return find(gameId).orElseThrow(() -> new GameException(GameError.GAME_NOT_FOUND));
    }

    /** Removes the session only if it has completed; returns whether it was removed. */
    public boolean removeIfCompleted(String gameId) {
        GameSession session = sessions.get(gameId);
        return session != null && session.isCompleted() && sessions.remove(gameId, session);
    }

    public Collection<GameSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public long activeCount() {
        return sessions.values().stream().filter(s -> !s.isCompleted()).count();
    }
}
