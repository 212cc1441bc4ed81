package com.chessws.server.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.account.Account;
import com.chessws.server.account.AccountStore;
import com.chessws.server.account.AccountStoreException;
import com.chessws.server.auth.Principal;
import com.chessws.server.model.GameCompletionListener;
import com.chessws.shared.util.Colour;
import com.chessws.shared.util.GameResult;

/**
 * Persists Elo changes when a game completes. Runs off the session's thread; a failure is
 * logged and the game result stands.
 */
public class RatingService implements GameCompletionListener, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RatingService.class);

    private final AccountStore accounts;
    private final EloCalculator calculator;
    private final ExecutorService executor;

    public RatingService(AccountStore accounts, EloCalculator calculator) {
        this(accounts, calculator, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rating-updater");
            t.setDaemon(true);
            return t;
        }));
    }

    public RatingService(AccountStore accounts, EloCalculator calculator, ExecutorService executor) {
        this.accounts = accounts;
        this.calculator = calculator;
        this.executor = executor;
    }

    @Override
    public void onGameCompleted(String gameId, Principal white, Principal black, GameResult outcome) {
        try {
            executor.execute(() -> updateRatings(gameId, white, black, outcome));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("[{}] Rating update not scheduled: executor shut down", gameId);
        }
    }

    /**
     * Applies the rating change for one finished game.
     *
     * @return true if both accounts were updated
     */
    public boolean updateRatings(String gameId, Principal white, Principal black, GameResult outcome) {
        try {
            Account whiteAccount = accounts.getById(white.id());
            Account blackAccount = accounts.getById(black.id());
            int whiteRating = whiteAccount.eloRating();
            int blackRating = blackAccount.eloRating();

            int whiteDelta = calculator.delta(whiteRating, blackRating, outcome.scoreFor(Colour.WHITE));
            int blackDelta = calculator.delta(blackRating, whiteRating, outcome.scoreFor(Colour.BLACK));

            accounts.update(whiteAccount.withEloRating(whiteRating + whiteDelta));
            accounts.update(blackAccount.withEloRating(blackRating + blackDelta));
            LOGGER.info("[{}] Ratings updated: {} {} -> {}, {} {} -> {}", gameId,
                white.displayName(), whiteRating, whiteRating + whiteDelta,
                black.displayName(), blackRating, blackRating + blackDelta);
            return true;
        } catch (AccountStoreException | RuntimeException e) {
            LOGGER.warn("[{}] Rating update failed: {}", gameId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
