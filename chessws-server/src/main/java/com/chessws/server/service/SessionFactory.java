package com.chessws.server.service;

import java.time.Clock;
import java.util.UUID;

import com.chessws.server.auth.Principal;
import com.chessws.server.model.GameCompletionListener;
import com.chessws.server.model.GameSession;
import com.chessws.server.model.SessionSettings;
import com.chessws.server.network.MessageSender;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.server.rules.RulesOracle;

public class SessionFactory {
    private final RulesOracle oracle;
    private final MessageSender sender;
    private final GameCompletionListener completionListener;
    private final SessionSettings settings;
    private final Clock clock;

    public SessionFactory(RulesOracle oracle, MessageSender sender, GameCompletionListener completionListener,
                          SessionSettings settings, Clock clock) {
        this.oracle = oracle;
        this.sender = sender;
        this.completionListener = completionListener;
        this.settings = settings;
        this.clock = clock;
    }

    public GameSession create(Principal white, ConnectionHandle whiteHandle,
                              Principal black, ConnectionHandle blackHandle) {
        return new GameSession(UUID.randomUUID().toString(), white, whiteHandle, black, blackHandle,
            oracle, sender, completionListener, settings, clock);
    }
}
