package com.chessws.server.redis;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;

import com.chessws.server.account.Account;
import com.chessws.server.account.AccountNotFoundException;
import com.chessws.server.account.AccountStore;
import com.chessws.server.account.AccountStoreException;

/**
 * Accounts as Redis hashes under {@code account:<id>}, with username and email index keys
 * pointing back at the id.
 */
public class RedisAccountStore implements AccountStore, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisAccountStore.class);

    private final JedisPool pool;

    public RedisAccountStore(String host, int port) {
        this(new JedisPool(host, port));
    }

    public RedisAccountStore(JedisPool pool) {
        this.pool = pool;
    }

    /* ---------- Keys ---------- */
    static String kAccount(String id) { return "account:" + id; }
    static String kUsername(String username) { return "account:username:" + username; }
    static String kEmail(String email) { return "account:email:" + email; }

    @Override
    public Account getById(String id) throws AccountStoreException {
        try (Jedis j = pool.getResource()) {
            Map<String, String> fields = j.hgetAll(kAccount(id));
            if (fields == null || fields.isEmpty()) {
                throw new AccountNotFoundException("id=" + id);
            }
            return fromHash(id, fields);
        } catch (JedisException e) {
            throw new AccountStoreException("read of account " + id + " failed", e);
        }
    }

    @Override
    public Account getByUsername(String username) throws AccountStoreException {
        return getByIndex(kUsername(username), "username=" + username);
    }

    @Override
    public Account getByEmail(String email) throws AccountStoreException {
        return getByIndex(kEmail(email), "email=" + email);
    }

    private Account getByIndex(String indexKey, String lookup) throws AccountStoreException {
        String id;
        try (Jedis j = pool.getResource()) {
            id = j.get(indexKey);
        } catch (JedisException e) {
            throw new AccountStoreException("index lookup " + lookup + " failed", e);
        }
        if (id == null) {
            throw new AccountNotFoundException(lookup);
        }
        return getById(id);
    }

    @Override
    public void update(Account account) throws AccountStoreException {
        try (Jedis j = pool.getResource()) {
            if (!j.exists(kAccount(account.id()))) {
                throw new AccountNotFoundException("id=" + account.id());
            }
            write(j, account);
        } catch (JedisException e) {
            throw new AccountStoreException("update of account " + account.id() + " failed", e);
        }
    }

    @Override
    public void create(Account account) throws AccountStoreException {
        try (Jedis j = pool.getResource()) {
            if (j.setnx(kUsername(account.username()), account.id()) == 0L) {
                throw new AccountStoreException("username taken: " + account.username());
            }
            write(j, account);
        } catch (JedisException e) {
            throw new AccountStoreException("create of account " + account.id() + " failed", e);
        }
    }

    private void write(Jedis j, Account account) throws AccountStoreException {
        Transaction t = j.multi();
        t.hset(kAccount(account.id()), toHash(account));
        if (account.username() != null) {
            t.set(kUsername(account.username()), account.id());
        }
        if (account.email() != null) {
            t.set(kEmail(account.email()), account.id());
        }
        List<Object> res = t.exec();
        if (res == null) {
            throw new AccountStoreException("transaction aborted for account " + account.id());
        }
        LOGGER.debug("[Redis] wrote {} rating={}", kAccount(account.id()), account.eloRating());
    }

    static Map<String, String> toHash(Account account) {
        Map<String, String> fields = new HashMap<>();
        putIfPresent(fields, "username", account.username());
        putIfPresent(fields, "displayName", account.displayName());
        fields.put("eloRating", Integer.toString(account.eloRating()));
        putIfPresent(fields, "email", account.email());
        return fields;
    }

    // redis rejects null values
    private static void putIfPresent(Map<String, String> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }

    static Account fromHash(String id, Map<String, String> fields) throws AccountStoreException {
        String rating = fields.get("eloRating");
        try {
            return new Account(id,
                fields.get("username"),
                fields.get("email"),
                fields.getOrDefault("displayName", fields.get("username")),
                rating == null ? Account.DEFAULT_RATING : Integer.parseInt(rating));
        } catch (NumberFormatException e) {
            throw new AccountStoreException("corrupt eloRating for account " + id + ": " + rating, e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
