package com.chessws.server.account;

/**
 * Durable storage of accounts and their ratings. Owned outside the game server; the server
 * only reads ratings and writes them back after a game.
 */
public interface AccountStore {

    Account getById(String id) throws AccountStoreException;

    Account getByUsername(String username) throws AccountStoreException;

    Account getByEmail(String email) throws AccountStoreException;

    void update(Account account) throws AccountStoreException;

    void create(Account account) throws AccountStoreException;
}
