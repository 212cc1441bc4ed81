package com.chessws.server.protocol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.chessws.server.TestClock;
import com.chessws.server.auth.Principal;
import com.chessws.server.model.GameSession;
import com.chessws.server.model.SessionSettings;
import com.chessws.server.network.Broadcaster;
import com.chessws.server.network.RecordingSink;
import com.chessws.server.registry.ConnectionHandle;
import com.chessws.server.registry.ConnectionRegistry;
import com.chessws.server.rules.ChessRulesOracle;
import com.chessws.server.service.MatchmakingService;
import com.chessws.server.service.SessionFactory;
import com.chessws.server.service.SessionStore;
import com.chessws.shared.util.Colour;
import com.chessws.shared.util.GameResult;

/**
 * Drives the router the way the transport does: registered connections with recording sinks,
 * raw JSON in, raw JSON out.
 */
public class ProtocolRouterTest {

    private static final String AFTER_E4 = "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionRegistry registry;
    private SessionStore store;
    private ProtocolRouter router;
    private List<GameResult> completed;

    private final class Client {
        final Principal principal;
        final RecordingSink sink = new RecordingSink();
        final ConnectionHandle handle;

        Client(String id, String name) {
            this.principal = new Principal(id, name);
            this.handle = registry.register(principal, sink).handle();
        }

        void send(String type, String payload) {
            router.onMessage(handle, payload == null
                ? "{\"type\":\"" + type + "\"}"
                : "{\"type\":\"" + type + "\",\"payload\":" + payload + "}");
        }

        void move(String gameId, String move) {
            send("move", "{\"gameId\":\"" + gameId + "\",\"move\":\"" + move + "\"}");
        }

        List<JsonNode> received() {
            List<JsonNode> nodes = new ArrayList<>();
            for (String frame : sink.frames()) {
                try {
                    nodes.add(objectMapper.readTree(frame));
                } catch (Exception e) {
                    throw new AssertionError("unparseable frame " + frame, e);
                }
            }
            return nodes;
        }

        JsonNode last() {
            List<JsonNode> nodes = received();
            assertFalse("nothing received by " + principal.displayName(), nodes.isEmpty());
            return nodes.get(nodes.size() - 1);
        }

        int count() {
            return sink.frames().size();
        }
    }

    @Before
    public void setUp() {
        wire(new ConnectionRegistry());
    }

    private void wire(ConnectionRegistry connections) {
        registry = connections;
        store = new SessionStore();
        completed = new ArrayList<>();
        MessageCodec codec = new MessageCodec();
        Broadcaster broadcaster = new Broadcaster(registry, codec);
        SessionFactory factory = new SessionFactory(new ChessRulesOracle(), broadcaster,
            (id, white, black, outcome) -> completed.add(outcome), SessionSettings.DEFAULTS, new TestClock());
        MatchmakingService matchmaking = new MatchmakingService(store, factory, broadcaster);
        router = new ProtocolRouter(registry, matchmaking, store, broadcaster, codec);
    }

    private String pair(Client white, Client black) {
        white.send("join", null);
        black.send("join", null);
        return white.last().path("payload").path("gameId").asText();
    }

    @Test
    public void testJoinPairsTwoPlayers() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");

        alice.send("join", null);
        assertEquals("waiting", alice.last().path("type").asText());
        assertEquals("Waiting for opponent...", alice.last().path("payload").asText());

        bob.send("join", null);

        JsonNode aliceStart = alice.last();
        JsonNode bobStart = bob.last();
        assertEquals("gameStart", aliceStart.path("type").asText());
        assertEquals("white", aliceStart.path("payload").path("color").asText());
        assertEquals("bob", aliceStart.path("payload").path("opponent").asText());
        assertEquals("gameStart", bobStart.path("type").asText());
        assertEquals("black", bobStart.path("payload").path("color").asText());
        assertEquals("alice", bobStart.path("payload").path("opponent").asText());
        String gameId = aliceStart.path("payload").path("gameId").asText();
        assertEquals(gameId, bobStart.path("payload").path("gameId").asText());
        assertTrue(store.find(gameId).isPresent());
    }

    @Test
    public void testLegalMoveBroadcastIllegalMoveOnlyToSender() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        String gameId = pair(alice, bob);

        alice.move(gameId, "e4");

        for (Client client : List.of(alice, bob)) {
            JsonNode move = client.last();
            assertEquals("move", move.path("type").asText());
            assertEquals("e4", move.path("payload").path("move").asText());
            assertTrue(move.path("payload").path("position").asText().startsWith(AFTER_E4));
            assertEquals("black", move.path("payload").path("turn").asText());
        }

        int aliceFrames = alice.count();
        String positionBefore = store.find(gameId).get().snapshot().position();
        bob.move(gameId, "Qxh7");

        assertEquals("error", bob.last().path("type").asText());
        assertEquals("invalidMove", bob.last().path("payload").path("code").asText());
        assertFalse(bob.last().path("payload").path("message").asText().isEmpty());
        assertEquals(aliceFrames, alice.count());
        assertEquals(positionBefore, store.find(gameId).get().snapshot().position());
    }

    @Test
    public void testCheckmateEndsGame() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        String gameId = pair(alice, bob);

        String[] moves = {"e4", "e5", "Bc4", "Nc6", "Qh5", "Nf6", "Qxf7#"};
        for (int i = 0; i < moves.length; i++) {
            (i % 2 == 0 ? alice : bob).move(gameId, moves[i]);
        }

        for (Client client : List.of(alice, bob)) {
            JsonNode over = client.last();
            assertEquals("gameOver", over.path("type").asText());
            assertEquals("white won", over.path("payload").path("outcome").asText());
            assertEquals("checkmate", over.path("payload").path("method").asText());
            assertEquals("white", over.path("payload").path("winner").asText());
        }
        assertEquals(GameSession.STATUS.COMPLETED, store.find(gameId).get().getStatus());
        assertEquals(List.of(GameResult.WHITE_WIN), completed);

        bob.move(gameId, "a6");
        assertEquals("gameNotActive", bob.last().path("payload").path("code").asText());
    }

    @Test
    public void testWrongTurnReported() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        String gameId = pair(alice, bob);

        bob.move(gameId, "e5");

        assertEquals("notYourTurn", bob.last().path("payload").path("code").asText());
    }

    @Test
    public void testUnknownGameReportedToSenderOnly() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        pair(alice, bob);
        int bobFrames = bob.count();

        alice.send("resign", "{\"gameId\":\"no-such-game\"}");

        assertEquals("error", alice.last().path("type").asText());
        assertEquals("gameNotFound", alice.last().path("payload").path("code").asText());
        assertEquals(bobFrames, bob.count());
    }

    @Test
    public void testOutsiderCannotActInGame() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        Client carol = new Client("3", "carol");
        String gameId = pair(alice, bob);

        carol.send("chat", "{\"gameId\":\"" + gameId + "\",\"message\":\"hi\"}");

        assertEquals("playerNotInGame", carol.last().path("payload").path("code").asText());
    }

    @Test
    public void testPingAnsweredWithPong() {
        Client alice = new Client("1", "alice");

        alice.send("ping", null);

        assertEquals("pong", alice.last().path("type").asText());
        assertFalse(alice.last().has("payload"));
    }

    @Test
    public void testUnknownAndMalformedMessagesIgnored() {
        Client alice = new Client("1", "alice");

        alice.send("teleport", "{}");
        router.onMessage(alice.handle, "{{not json");
        alice.send("move", "{\"move\":\"e4\"}");

        assertEquals(0, alice.count());
    }

    @Test
    public void testDrawOfferResponseAndChat() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        String gameId = pair(alice, bob);
        int aliceFrames = alice.count();

        bob.send("draw_offer", "{\"gameId\":\"" + gameId + "\"}");
        assertEquals(aliceFrames + 1, alice.count());
        assertEquals("drawOffer", alice.last().path("type").asText());
        assertEquals("black", alice.last().path("payload").path("offeredBy").asText());
        assertEquals("gameStart", bob.last().path("type").asText());

        alice.send("draw_response", "{\"gameId\":\"" + gameId + "\",\"accept\":false}");
        assertEquals("drawResponse", bob.last().path("type").asText());
        assertFalse(bob.last().path("payload").path("accepted").asBoolean(true));

        alice.send("draw_response", "{\"gameId\":\"" + gameId + "\",\"accept\":true}");
        assertEquals("noDrawPending", alice.last().path("payload").path("code").asText());

        bob.send("chat", "{\"gameId\":\"" + gameId + "\",\"message\":\"good game\"}");
        assertEquals("chat", alice.last().path("type").asText());
        assertEquals("bob", alice.last().path("payload").path("sender").asText());
        assertEquals("good game", alice.last().path("payload").path("message").asText());
    }

    @Test
    public void testTimeUpdateBroadcast() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        String gameId = pair(alice, bob);

        alice.send("time_update", "{\"gameId\":\"" + gameId + "\",\"timeLeft\":512.25}");

        JsonNode update = bob.last();
        assertEquals("timeUpdate", update.path("type").asText());
        assertEquals("white", update.path("payload").path("color").asText());
        assertEquals(512.25, update.path("payload").path("timeLeft").asDouble(), 0.0);
    }

    @Test
    public void testDisconnectAndReconnect() {
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        String gameId = pair(alice, bob);
        alice.move(gameId, "d4");

        router.onDisconnect(alice.handle);

        assertEquals("opponentDisconnected", bob.last().path("type").asText());
        assertEquals("white", bob.last().path("payload").path("color").asText());
        bob.move(gameId, "d5");
        assertEquals("move", bob.last().path("type").asText());

        Client aliceAgain = new Client("1", "alice");
        aliceAgain.send("reconnect", "{\"gameId\":\"" + gameId + "\"}");

        JsonNode state = aliceAgain.last();
        assertEquals("gameState", state.path("type").asText());
        assertEquals("white", state.path("payload").path("turn").asText());
        assertEquals("alice", state.path("payload").path("whitePlayer").asText());
        assertEquals("bob", state.path("payload").path("blackPlayer").asText());
        assertEquals(600.0, state.path("payload").path("whiteTime").asDouble(), 0.0);
        assertEquals("opponentReconnected", bob.last().path("type").asText());

        aliceAgain.move(gameId, "c4");
        assertEquals("move", bob.last().path("type").asText());
        assertEquals("c4", bob.last().path("payload").path("move").asText());
    }

    @Test
    public void testClosedWaitingConnectionLeavesQueue() {
        Client alice = new Client("1", "alice");
        alice.send("join", null);
        router.onDisconnect(alice.handle);

        Client bob = new Client("2", "bob");
        bob.send("join", null);

        assertEquals("waiting", bob.last().path("type").asText());
        assertEquals(0, store.size());
    }

    @Test
    public void testWhiteClosingBeforePairingIsUnbound() {
        Client alice = new Client("1", "alice");
        alice.send("join", null);
        // connection gone from the registry but its close has not reached the queue yet
        registry.unregister(alice.handle);

        Client bob = new Client("2", "bob");
        bob.send("join", null);

        String gameId = bob.last().path("payload").path("gameId").asText();
        assertNull(store.find(gameId).get().getHandle(Colour.WHITE));
        assertEquals("opponentDisconnected", bob.last().path("type").asText());
    }

    @Test
    public void testWhiteClosingWhileBeingTrackedIsUnbound() {
        ConnectionHandle[] closing = new ConnectionHandle[1];
        wire(new ConnectionRegistry() {
            @Override
            public boolean bindSession(ConnectionHandle handle, String sessionId) {
                if (handle.equals(closing[0])) {
                    closing[0] = null;
                    router.onDisconnect(handle);
                }
                return super.bindSession(handle, sessionId);
            }
        });
        Client alice = new Client("1", "alice");
        Client bob = new Client("2", "bob");
        alice.send("join", null);
        closing[0] = alice.handle;

        bob.send("join", null);

        String gameId = bob.received().get(0).path("payload").path("gameId").asText();
        GameSession session = store.find(gameId).get();
        assertNull(session.getHandle(Colour.WHITE));
        assertEquals(bob.handle, session.getHandle(Colour.BLACK));
        assertEquals("opponentDisconnected", bob.last().path("type").asText());
        assertFalse(registry.lookup(alice.handle).isPresent());
    }
}
