package com.chessws.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Server settings. Sources, later ones winning: {@code chessws.properties} on the classpath,
 * the file named by {@code -Dchessws.config}, {@code CHESSWS_*} environment variables, and
 * the port as first command-line argument.
 */
public final class ServerConfig {

    public static final String RESOURCE = "chessws.properties";
    public static final String CONFIG_FILE_PROPERTY = "chessws.config";
    public static final String ENV_PREFIX = "CHESSWS_";

    public static final String SERVER_HOST = "server.host";
    public static final String SERVER_PORT = "server.port";
    public static final String SERVER_HEALTH_PORT = "server.healthPort";
    public static final String CONNECTION_LOST_TIMEOUT = "server.connectionLostTimeoutSeconds";
    public static final String INITIAL_CLOCK = "game.initialClockSeconds";
    public static final String COMPLETED_RETENTION = "session.completedRetentionSeconds";
    public static final String ABANDON_TIMEOUT = "session.abandonTimeoutSeconds";
    public static final String SWEEP_INTERVAL = "session.sweepIntervalSeconds";
    public static final String CHAT_HISTORY_LIMIT = "session.chatHistoryLimit";
    public static final String K_FACTOR = "rating.kFactor";
    public static final String ACCOUNTS_BACKEND = "accounts.backend";
    public static final String REDIS_HOST = "redis.host";
    public static final String REDIS_PORT = "redis.port";

    static final List<String> KEYS = List.of(SERVER_HOST, SERVER_PORT, SERVER_HEALTH_PORT, CONNECTION_LOST_TIMEOUT,
        INITIAL_CLOCK, COMPLETED_RETENTION, ABANDON_TIMEOUT, SWEEP_INTERVAL, CHAT_HISTORY_LIMIT, K_FACTOR,
        ACCOUNTS_BACKEND, REDIS_HOST, REDIS_PORT);

    public enum AccountsBackend {
        MEMORY,
        REDIS
    }

    private final String host;
    private final int port;
    private final int healthPort;
    private final int connectionLostTimeoutSeconds;
    private final int initialClockSeconds;
    private final Duration completedRetention;
    private final Duration abandonTimeout;
    private final Duration sweepInterval;
    private final int chatHistoryLimit;
    private final int kFactor;
    private final AccountsBackend accountsBackend;
    private final String redisHost;
    private final int redisPort;

    private ServerConfig(Properties props) {
        this.host = text(props, SERVER_HOST, "0.0.0.0");
        this.port = port(props, SERVER_PORT, 8080);
        this.healthPort = port(props, SERVER_HEALTH_PORT, port + 1000);
        this.connectionLostTimeoutSeconds = nonNegative(props, CONNECTION_LOST_TIMEOUT, 30);
        this.initialClockSeconds = nonNegative(props, INITIAL_CLOCK, 600);
        this.completedRetention = Duration.ofSeconds(nonNegative(props, COMPLETED_RETENTION, 1800));
        this.abandonTimeout = Duration.ofSeconds(nonNegative(props, ABANDON_TIMEOUT, 0));
        this.sweepInterval = Duration.ofSeconds(positive(props, SWEEP_INTERVAL, 30));
        this.chatHistoryLimit = nonNegative(props, CHAT_HISTORY_LIMIT, 0);
        this.kFactor = positive(props, K_FACTOR, 32);
        this.accountsBackend = backend(props);
        this.redisHost = text(props, REDIS_HOST, "127.0.0.1");
        this.redisPort = port(props, REDIS_PORT, 6379);
    }

    public static ServerConfig load(String[] args) {
        return load(args, System.getenv(), System.getProperty(CONFIG_FILE_PROPERTY));
    }

    static ServerConfig load(String[] args, Map<String, String> env, String externalFile) {
        Properties props = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("cannot read classpath " + RESOURCE, e);
        }
        if (externalFile != null && !externalFile.isBlank()) {
            try (Reader reader = Files.newBufferedReader(Path.of(externalFile), StandardCharsets.UTF_8)) {
                props.load(reader);
            } catch (IOException e) {
                throw new IllegalArgumentException(CONFIG_FILE_PROPERTY + ": cannot read " + externalFile, e);
            }
        }
        for (String key : KEYS) {
            String value = env.get(envName(key));
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        if (args != null && args.length > 0) {
            props.setProperty(SERVER_PORT, args[0]);
        }
        return fromProperties(props);
    }

    public static ServerConfig fromProperties(Properties props) {
        return new ServerConfig(props);
    }

    /** {@code server.healthPort} becomes {@code CHESSWS_SERVER_HEALTHPORT}. */
    static String envName(String key) {
        return ENV_PREFIX + key.toUpperCase().replace('.', '_');
    }

    private static String text(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static int integer(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not a number: '" + value + "'");
        }
    }

    private static int nonNegative(Properties props, String key, int defaultValue) {
        int value = integer(props, key, defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException(key + ": must not be negative: " + value);
        }
        return value;
    }

    private static int positive(Properties props, String key, int defaultValue) {
        int value = integer(props, key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(key + ": must be positive: " + value);
        }
        return value;
    }

    private static int port(Properties props, String key, int defaultValue) {
        int value = integer(props, key, defaultValue);
        if (value < 0 || value > 65535) {
            throw new IllegalArgumentException(key + ": not a valid port: " + value);
        }
        return value;
    }

    private static AccountsBackend backend(Properties props) {
        String value = text(props, ACCOUNTS_BACKEND, "memory");
        try {
            return AccountsBackend.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(ACCOUNTS_BACKEND + ": expected memory or redis, got '" + value + "'");
        }
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getHealthPort() { return healthPort; }
    public int getConnectionLostTimeoutSeconds() { return connectionLostTimeoutSeconds; }
    public int getInitialClockSeconds() { return initialClockSeconds; }
    public Duration getCompletedRetention() { return completedRetention; }
    public Duration getAbandonTimeout() { return abandonTimeout; }
    public Duration getSweepInterval() { return sweepInterval; }
    public int getChatHistoryLimit() { return chatHistoryLimit; }
    public int getKFactor() { return kFactor; }
    public AccountsBackend getAccountsBackend() { return accountsBackend; }
    public String getRedisHost() { return redisHost; }
    public int getRedisPort() { return redisPort; }

    @Override
    public String toString() {
        return "ServerConfig{ ws=" + host + ":" + port + ", health=" + healthPort
            + ", clock=" + initialClockSeconds + "s, retention=" + completedRetention
            + ", abandon=" + abandonTimeout + ", chatLimit=" + chatHistoryLimit
            + ", k=" + kFactor + ", accounts=" + accountsBackend + " }";
    }
}
