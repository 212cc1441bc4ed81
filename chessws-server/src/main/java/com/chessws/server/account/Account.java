package com.chessws.server.account;

public record Account(String id, String username, String email, String displayName, int eloRating) {

    public static final int DEFAULT_RATING = 1200;

    public Account withEloRating(int rating) {
        return new Account(id, username, email, displayName, rating);
    }
}
