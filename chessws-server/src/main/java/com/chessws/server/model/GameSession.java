package com.chessws.server.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.auth.Principal;
import com.chessws.server.network.MessageSender;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.server.rules.AppliedMove;
import com.chessws.server.rules.IllegalMoveException;
import com.chessws.server.rules.Outcome;
import com.chessws.server.rules.Position;
import com.chessws.server.rules.RulesOracle;
import com.chessws.shared.dto.ChatDTO;
import com.chessws.shared.dto.DrawOfferDTO;
import com.chessws.shared.dto.DrawResponseDTO;
import com.chessws.shared.dto.Envelope;
import com.chessws.shared.dto.GameOverDTO;
import com.chessws.shared.dto.GameStateDTO;
import com.chessws.shared.dto.MoveBroadcastDTO;
import com.chessws.shared.dto.OpponentStatusDTO;
import com.chessws.shared.dto.TimeUpdateDTO;
import com.chessws.shared.util.Colour;
import com.chessws.shared.util.GameOverReason;
import com.chessws.shared.util.GameResult;
import com.chessws.shared.util.MessageType;

/**
 * State machine for one match between two principals.
 *
 * <p>Every operation runs under this session's own lock, so two sessions never contend and
 * racing operations on one session are linearized: the loser of a race observes the
 * post-state. Broadcasts are queued while the lock is held, which keeps the order seen by
 * each player identical to the order of state changes.
 *
 * <p>Once {@link STATUS#COMPLETED} the session only serves reconnection snapshots.
 */
public class GameSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameSession.class);

    public enum STATUS {
        ACTIVE,
        COMPLETED
    }

    private final String gameId;
    private final PlayerBinding white;
    private final PlayerBinding black;
    private final RulesOracle oracle;
    private final MessageSender sender;
    private final GameCompletionListener completionListener;
    private final Clock clock;
    private final int chatHistoryLimit;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private Position position;
    private Colour currentTurn;
    private boolean drawOffered;
    private double whiteSeconds;
    private double blackSeconds;
    private final Deque<ChatEntry> chatLog = new ArrayDeque<>();
    private STATUS status = STATUS.ACTIVE;
    private GameResult result;
    private GameOverReason reason;
    private Instant completedAt;

    public GameSession(String gameId,
                       Principal whitePlayer, ConnectionHandle whiteHandle,
                       Principal blackPlayer, ConnectionHandle blackHandle,
                       RulesOracle oracle, MessageSender sender,
                       GameCompletionListener completionListener,
                       SessionSettings settings, Clock clock) {
        this.gameId = gameId;
        this.white = new PlayerBinding(whitePlayer, Colour.WHITE, whiteHandle);
        this.black = new PlayerBinding(blackPlayer, Colour.BLACK, blackHandle);
        this.oracle = oracle;
        this.sender = sender;
        this.completionListener = completionListener;
        this.clock = clock;
        this.chatHistoryLimit = settings.chatHistoryLimit();
        this.whiteSeconds = settings.initialClockSeconds();
        this.blackSeconds = settings.initialClockSeconds();
        this.position = oracle.newGame();
        this.currentTurn = oracle.sideToMove(position);
        this.createdAt = clock.instant();
    }

    public String getGameId() {
        return gameId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public STATUS getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCompleted() {
        return getStatus() == STATUS.COMPLETED;
    }

    /** When the session completed, or null while it is still active. */
    public Instant getCompletedAt() {
        lock.lock();
        try {
            return completedAt;
        } finally {
            lock.unlock();
        }
    }

    public GameResult getResult() {
        lock.lock();
        try {
            return result;
        } finally {
            lock.unlock();
        }
    }

    public GameOverReason getReason() {
        lock.lock();
        try {
            return reason;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrawOffered() {
        lock.lock();
        try {
            return drawOffered;
        } finally {
            lock.unlock();
        }
    }

    public List<ChatEntry> getChatLog() {
        lock.lock();
        try {
            return new ArrayList<>(chatLog);
        } finally {
            lock.unlock();
        }
    }

    public Principal getPlayer(Colour colour) {
        return binding(colour).getPrincipal();
    }

    public ConnectionHandle getHandle(Colour colour) {
        lock.lock();
        try {
            return binding(colour).getHandle();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves the colour whose binding currently holds {@code handle}.
     */
    public Colour colourOf(ConnectionHandle handle) throws GameException {
        lock.lock();
        try {
            if (handle != null && handle.equals(white.getHandle())) return Colour.WHITE;
            if (handle != null && handle.equals(black.getHandle())) return Colour.BLACK;
            throw new GameException(GameError.PLAYER_NOT_IN_GAME);
        } finally {
            lock.unlock();
        }
    }

    public MoveResult move(Colour acting, String moveText) throws GameException {
        lock.lock();
        try {
            requireActive();
            if (acting != currentTurn) {
                throw new GameException(GameError.NOT_YOUR_TURN);
            }
            AppliedMove applied;
            try {
                applied = oracle.applyMove(position, moveText);
            } catch (IllegalMoveException e) {
                LOGGER.debug("[{}] {} rejected move '{}': {}", gameId, acting, moveText, e.getMessage());
                throw new GameException(GameError.INVALID_MOVE, e.getMessage());
            }
            position = applied.position();
            currentTurn = oracle.sideToMove(position);
            drawOffered = false;

            String fen = oracle.renderPosition(position);
            broadcast(Envelope.of(MessageType.MOVE, new MoveBroadcastDTO(applied.notation(), fen, currentTurn)));

            Outcome outcome = oracle.outcome(position);
            if (outcome.terminal()) {
                complete(outcome.result(), outcome.method());
            }
            return new MoveResult(applied.notation(), fen, currentTurn, outcome);
        } finally {
            lock.unlock();
        }
    }

    public void resign(Colour acting) throws GameException {
        lock.lock();
        try {
            requireActive();
            complete(GameResult.winFor(acting.opposite()), GameOverReason.RESIGN);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flags a pending draw offer and tells the opponent. Either side may offer at any time;
     * a repeated offer simply re-notifies.
     */
    public void offerDraw(Colour acting) throws GameException {
        lock.lock();
        try {
            requireActive();
            drawOffered = true;
            sender.send(binding(acting.opposite()).getHandle(),
                Envelope.of(MessageType.DRAW_OFFERED, new DrawOfferDTO(acting)));
        } finally {
            lock.unlock();
        }
    }

    public void respondDraw(Colour acting, boolean accept) throws GameException {
        lock.lock();
        try {
            requireActive();
            if (!drawOffered) {
                throw new GameException(GameError.NO_DRAW_PENDING);
            }
            drawOffered = false;
            if (accept) {
                complete(GameResult.DRAW, GameOverReason.AGREED_DRAW);
            } else {
                LOGGER.debug("[{}] {} declined the draw offer", gameId, acting);
                broadcast(Envelope.of(MessageType.DRAW_ANSWERED, new DrawResponseDTO(false)));
            }
        } finally {
            lock.unlock();
        }
    }

    /** Overwrites the clock for {@code colour} with the client-reported remaining time. */
    public void updateClock(Colour colour, double secondsRemaining) throws GameException {
        lock.lock();
        try {
            requireActive();
            if (colour == Colour.WHITE) {
                whiteSeconds = secondsRemaining;
            } else {
                blackSeconds = secondsRemaining;
            }
            broadcast(Envelope.of(MessageType.TIME_UPDATED, new TimeUpdateDTO(colour, secondsRemaining)));
        } finally {
            lock.unlock();
        }
    }

    public void appendChat(Colour acting, String text) throws GameException {
        lock.lock();
        try {
            requireActive();
            String senderName = binding(acting).getPrincipal().displayName();
            chatLog.addLast(new ChatEntry(senderName, text, clock.instant()));
            if (chatHistoryLimit > 0) {
                while (chatLog.size() > chatHistoryLimit) {
                    chatLog.removeFirst();
                }
            }
            broadcast(Envelope.of(MessageType.CHAT, new ChatDTO(senderName, text)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reconnection path: re-binds {@code handle} to the seat held by {@code principal},
     * matched by principal id and then by display name. Replays the current state to the
     * new connection and, while the game is running, tells the opponent.
     */
    public GameStateDTO bindConnection(Principal principal, ConnectionHandle handle) throws GameException {
        lock.lock();
        try {
            PlayerBinding seat = seatOf(principal);
            if (seat == null) {
                throw new GameException(GameError.PLAYER_NOT_IN_GAME);
            }
            seat.bind(handle);
            GameStateDTO state = snapshotLocked();
            sender.send(handle, Envelope.of(MessageType.GAME_STATE, state));
            if (status == STATUS.ACTIVE) {
                sender.send(binding(seat.getColour().opposite()).getHandle(),
                    Envelope.of(MessageType.OPPONENT_RECONNECTED, new OpponentStatusDTO(gameId, seat.getColour())));
            }
            LOGGER.info("[{}] {} reconnected on {}", gameId, principal.displayName(), handle);
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears whichever binding holds {@code handle}. The session stays as it is; the opponent
     * is told while the game is running.
     *
     * @return true if a binding was cleared
     */
    public boolean unbindConnection(ConnectionHandle handle) {
        lock.lock();
        try {
            for (PlayerBinding seat : List.of(white, black)) {
                if (handle.equals(seat.getHandle())) {
                    seat.unbind(clock.instant());
                    if (status == STATUS.ACTIVE) {
                        sender.send(binding(seat.getColour().opposite()).getHandle(),
                            Envelope.of(MessageType.OPPONENT_DISCONNECTED, new OpponentStatusDTO(gameId, seat.getColour())));
                    }
                    LOGGER.info("[{}] {} disconnected", gameId, seat.getPrincipal().displayName());
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public GameStateDTO snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes an active session by abandonment when a player has been away for longer than
     * {@code timeout}. The player still present wins; if both are gone it is a draw.
     *
     * @return true if this call completed the session
     */
    public boolean abandonIfExpired(Instant now, Duration timeout) {
        lock.lock();
        try {
            if (status != STATUS.ACTIVE) {
                return false;
            }
            boolean whiteGone = expired(white, now, timeout);
            boolean blackGone = expired(black, now, timeout);
            if (!whiteGone && !blackGone) {
                return false;
            }
            // the win goes to a seat that is actually connected, otherwise nobody is present
            GameResult abandoned;
            if (whiteGone && black.isConnected()) {
                abandoned = GameResult.winFor(Colour.BLACK);
            } else if (blackGone && white.isConnected()) {
                abandoned = GameResult.winFor(Colour.WHITE);
            } else {
                abandoned = GameResult.DRAW;
            }
            complete(abandoned, GameOverReason.ABANDON);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private static boolean expired(PlayerBinding seat, Instant now, Duration timeout) {
        Instant since = seat.getDisconnectedAt();
        return !seat.isConnected() && since != null
            && Duration.between(since, now).compareTo(timeout) > 0;
    }

    private void complete(GameResult outcome, GameOverReason method) {
        status = STATUS.COMPLETED;
        drawOffered = false;
        result = outcome;
        reason = method;
        completedAt = clock.instant();
        broadcast(Envelope.of(MessageType.GAME_OVER, GameOverDTO.of(outcome, method)));
        LOGGER.info("[{}] Game over: {} by {} ({} vs {})", gameId, outcome.wireName(), method.wireName(),
            white.getPrincipal().displayName(), black.getPrincipal().displayName());
        try {
            completionListener.onGameCompleted(gameId, white.getPrincipal(), black.getPrincipal(), outcome);
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Completion listener failed", gameId, e);
        }
    }

    private void requireActive() throws GameException {
        if (status != STATUS.ACTIVE) {
            throw new GameException(GameError.GAME_NOT_ACTIVE);
        }
    }

    private void broadcast(Envelope<?> envelope) {
        sender.send(white.getHandle(), envelope);
        sender.send(black.getHandle(), envelope);
    }

    private GameStateDTO snapshotLocked() {
        return new GameStateDTO(
            oracle.renderPosition(position),
            currentTurn,
            white.getPrincipal().displayName(),
            black.getPrincipal().displayName(),
            whiteSeconds,
            blackSeconds);
    }

    private PlayerBinding seatOf(Principal principal) {
        if (white.matches(principal)) return white;
        if (black.matches(principal)) return black;
        if (white.matchesName(principal.displayName())) return white;
        if (black.matchesName(principal.displayName())) return black;
        return null;
    }

    private PlayerBinding binding(Colour colour) {
        return colour == Colour.WHITE ? white : black;
    }

    @Override
    public String toString() {
        return "Game ID: " + gameId + " " + white + " vs " + black;
    }
}
