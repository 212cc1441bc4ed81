package com.chessws.server.account;

public class AccountNotFoundException extends AccountStoreException {

    public AccountNotFoundException(String lookup) {
        super("account not found: " + lookup);
    }
}
