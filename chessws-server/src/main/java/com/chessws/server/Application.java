package com.chessws.server;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import com.chessws.server.account.AccountStore;
import com.chessws.server.account.InMemoryAccountStore;
import com.chessws.server.auth.TrustedHeaderAuthenticator;
import com.chessws.server.config.ServerConfig;
import com.chessws.server.model.SessionSettings;
import com.chessws.server.network.Broadcaster;
import com.chessws.server.network.ChessWebSocketServer;
import com.chessws.server.protocol.MessageCodec;
import com.chessws.server.protocol.ProtocolRouter;
import com.chessws.server.redis.RedisAccountStore;
import com.chessws.server.registry.ConnectionRegistry;
import com.chessws.server.rules.ChessRulesOracle;
import com.chessws.server.service.EloCalculator;
import com.chessws.server.service.MatchmakingService;
import com.chessws.server.service.RatingService;
import com.chessws.server.service.SessionFactory;
import com.chessws.server.service.SessionStore;
import com.chessws.server.service.SessionSweeper;

public class Application {
    private static final Logger LOGGER = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws InterruptedException, IOException {
        ServerConfig config;
        try {
            config = ServerConfig.load(args);
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        LOGGER.info("Starting with {}", config);

        Clock clock = Clock.systemUTC();
        AccountStore accounts = config.getAccountsBackend() == ServerConfig.AccountsBackend.REDIS
            ? new RedisAccountStore(config.getRedisHost(), config.getRedisPort())
            : new InMemoryAccountStore(true);
        RatingService ratingService = new RatingService(accounts, new EloCalculator(config.getKFactor()));

        ConnectionRegistry registry = new ConnectionRegistry();
        MessageCodec codec = new MessageCodec();
        Broadcaster broadcaster = new Broadcaster(registry, codec);
        SessionStore store = new SessionStore();
        SessionSettings settings = new SessionSettings(config.getInitialClockSeconds(), config.getChatHistoryLimit());
        SessionFactory sessionFactory = new SessionFactory(new ChessRulesOracle(), broadcaster, ratingService, settings, clock);
        MatchmakingService matchmaking = new MatchmakingService(store, sessionFactory, broadcaster);
        ProtocolRouter router = new ProtocolRouter(registry, matchmaking, store, broadcaster, codec);

        SessionSweeper sweeper = new SessionSweeper(store, clock, config.getCompletedRetention(), config.getAbandonTimeout());
        sweeper.start(config.getSweepInterval());

        HttpServer healthServer = HttpServer.create(new InetSocketAddress(config.getHealthPort()), 0);
        healthServer.createContext("/healthz", new HealthHandler());
        healthServer.setExecutor(null);
        healthServer.start();
        LOGGER.info("Health endpoint on http://{}:{}/healthz", config.getHost(), config.getHealthPort());

        InetSocketAddress address = new InetSocketAddress(config.getHost(), config.getPort());
        ChessWebSocketServer chessServer = new ChessWebSocketServer(address, new TrustedHeaderAuthenticator(),
            registry, router, config.getConnectionLostTimeoutSeconds());
        chessServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            try {
                chessServer.stop(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            healthServer.stop(0);
            sweeper.close();
            ratingService.close();
            if (accounts instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) accounts).close();
                } catch (Exception e) {
                    LOGGER.warn("Closing account store failed", e);
                }
            }
        }, "shutdown"));

        Thread.currentThread().join();
    }

    static class HealthHandler implements HttpHandler {
        public void handle(HttpExchange t) throws IOException {
            byte[] response = "OK\n".getBytes(StandardCharsets.UTF_8);
            t.sendResponseHeaders(200, response.length);
            try (OutputStream os = t.getResponseBody()) {
                os.write(response);
            }
        }
    }
}
