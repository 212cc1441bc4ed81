package com.chessws.server.account;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for tests and single-process runs. With {@code provisionOnLookup} an
 * unknown id is created on first lookup at the default rating, so a local server can rate
 * games between principals nobody registered.
 */
public class InMemoryAccountStore implements AccountStore {
    private final Map<String, Account> byId = new ConcurrentHashMap<>();
    private final boolean provisionOnLookup;

    public InMemoryAccountStore() {
        this(false);
    }

    public InMemoryAccountStore(boolean provisionOnLookup) {
        this.provisionOnLookup = provisionOnLookup;
    }

    @Override
    public Account getById(String id) throws AccountStoreException {
        Account account = provisionOnLookup
            ? byId.computeIfAbsent(id, k -> new Account(k, k, null, k, Account.DEFAULT_RATING))
            : byId.get(id);
        if (account == null) {
            throw new AccountNotFoundException("id=" + id);
        }
        return account;
    }

    @Override
    public Account getByUsername(String username) throws AccountStoreException {
        return byId.values().stream()
            .filter(a -> Objects.equals(a.username(), username))
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException("username=" + username));
    }

    @Override
    public Account getByEmail(String email) throws AccountStoreException {
        return byId.values().stream()
            .filter(a -> Objects.equals(a.email(), email))
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException("email=" + email));
    }

    @Override
    public void update(Account account) throws AccountStoreException {
        if (byId.replace(account.id(), account) == null) {
            throw new AccountNotFoundException("id=" + account.id());
        }
    }

    @Override
    public void create(Account account) throws AccountStoreException {
        if (byId.putIfAbsent(account.id(), account) != null) {
            throw new AccountStoreException("account already exists: " + account.id());
        }
    }
}
