package com.chessws.server.account;

/**
 * The account backend could not complete a request.
 */
public class AccountStoreException extends Exception {

    public AccountStoreException(String message) {
        super(message);
    }

    public AccountStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
