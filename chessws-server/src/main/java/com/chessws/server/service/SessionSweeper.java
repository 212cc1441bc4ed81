package com.chessws.server.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.model.GameSession;

/**
 * Periodic housekeeping over the session store: completes sessions abandoned for longer than
 * the abandon timeout (when enabled) and drops completed sessions past their retention.
 */
public class SessionSweeper implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionStore store;
    private final Clock clock;
    private final Duration completedRetention;
    private final Duration abandonTimeout;
    private ScheduledExecutorService scheduler;

    /**
     * @param abandonTimeout zero disables abandonment
     */
    public SessionSweeper(SessionStore store, Clock clock, Duration completedRetention, Duration abandonTimeout) {
        this.store = store;
        this.clock = clock;
        this.completedRetention = completedRetention;
        this.abandonTimeout = abandonTimeout;
    }

    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task
            LOGGER.error("Session sweep failed", e);
        }
    }

    /**
     * Runs one pass.
     *
     * @return number of sessions removed from the store
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (GameSession session : store.all()) {
            if (!abandonTimeout.isZero() && session.abandonIfExpired(now, abandonTimeout)) {
                LOGGER.info("[{}] Completed by abandonment", session.getGameId());
            }
            Instant completedAt = session.getCompletedAt();
            if (completedAt != null && !completedAt.plus(completedRetention).isAfter(now)
                    && store.removeIfCompleted(session.getGameId())) {
                removed++;
            }
        }
        if (removed > 0) {
            LOGGER.debug("Swept {} completed session(s); {} remain", removed, store.size());
        }
        return removed;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
