package com.chessws.server.model;

/**
 * Per-session knobs taken from the server configuration.
 *
 * @param initialClockSeconds starting time on each clock
 * @param chatHistoryLimit    maximum retained chat entries, 0 for unbounded
 */
public record SessionSettings(double initialClockSeconds, int chatHistoryLimit) {

    public static final SessionSettings DEFAULTS = new SessionSettings(600, 0);
}
