package com.chessws.server.protocol;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.chessws.shared.dto.DrawResponseMessageDTO;
import com.chessws.shared.dto.Envelope;
import com.chessws.shared.dto.GameOverDTO;
import com.chessws.shared.dto.GameRefDTO;
import com.chessws.shared.dto.GameStartDTO;
import com.chessws.shared.dto.MoveMessageDTO;
import com.chessws.shared.dto.TimeUpdateMessageDTO;
import com.chessws.shared.util.Colour;
import com.chessws.shared.util.GameOverReason;
import com.chessws.shared.util.GameResult;
import com.chessws.shared.util.MessageType;

public class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private void assertRejected(String text) {
        try {
            codec.decode(text);
            fail("decoded " + text);
        } catch (MessageDecodeException expected) {
            assertTrue(expected.getMessage() != null);
        }
    }

    private void assertJson(String expected, String actual) throws Exception {
        assertEquals(objectMapper.readTree(expected), objectMapper.readTree(actual));
    }

    @Test
    public void testDecodeMove() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"move\",\"payload\":{\"gameId\":\"g1\",\"move\":\"e4\",\"extra\":1}}");

        assertEquals(MessageType.MOVE, message.type());
        assertEquals(new MoveMessageDTO("g1", "e4"), message.payload(MoveMessageDTO.class));
    }

    @Test
    public void testDecodeTypesWithoutPayload() throws Exception {
        assertNull(codec.decode("{\"type\":\"join\"}").payload());
        assertEquals(MessageType.PING, codec.decode("{\"type\":\"ping\",\"payload\":{}}").type());
    }

    @Test
    public void testDecodeDrawResponseAndTimeUpdate() throws Exception {
        InboundMessage draw = codec.decode("{\"type\":\"draw_response\",\"payload\":{\"gameId\":\"g1\",\"accept\":false}}");
        InboundMessage time = codec.decode("{\"type\":\"time_update\",\"payload\":{\"gameId\":\"g1\",\"timeLeft\":42.5}}");

        assertEquals(new DrawResponseMessageDTO("g1", false), draw.payload(DrawResponseMessageDTO.class));
        assertEquals(42.5, time.payload(TimeUpdateMessageDTO.class).timeLeft(), 0.0);
    }

    @Test
    public void testDecodeReconnect() throws Exception {
        InboundMessage message = codec.decode("{\"type\":\"reconnect\",\"payload\":{\"gameId\":\"g9\"}}");

        assertEquals(new GameRefDTO("g9"), message.payload(GameRefDTO.class));
    }

    @Test
    public void testUnknownAndOutboundTypesRejectedAsUnknown() throws Exception {
        for (String type : new String[] {"teleport", "gameStart", "pong"}) {
            try {
                codec.decode("{\"type\":\"" + type + "\",\"payload\":{}}");
                fail("decoded " + type);
            } catch (UnknownMessageTypeException e) {
                assertEquals(type, e.getType());
            }
        }
    }

    @Test
    public void testMalformedEnvelopesRejected() {
        assertRejected("not json");
        assertRejected("[1,2]");
        assertRejected("{\"payload\":{}}");
        assertRejected("{\"type\":7}");
        assertRejected("{\"type\":\"move\"}");
        assertRejected("{\"type\":\"move\",\"payload\":{\"gameId\":\"g1\"}}");
        assertRejected("{\"type\":\"move\",\"payload\":{\"gameId\":\" \",\"move\":\"e4\"}}");
        assertRejected("{\"type\":\"draw_response\",\"payload\":{\"gameId\":\"g1\"}}");
        assertRejected("{\"type\":\"time_update\",\"payload\":{\"gameId\":\"g1\",\"timeLeft\":\"soon\"}}");
        assertRejected("{\"type\":\"chat\",\"payload\":{\"gameId\":\"g1\"}}");
    }

    @Test
    public void testEncodeUsesWireSpellings() throws Exception {
        assertJson("{\"type\":\"gameOver\",\"payload\":{\"outcome\":\"white won\",\"method\":\"checkmate\",\"winner\":\"white\"}}",
            codec.encode(Envelope.of(MessageType.GAME_OVER, GameOverDTO.of(GameResult.WHITE_WIN, GameOverReason.CHECKMATE))));
        assertJson("{\"type\":\"gameStart\",\"payload\":{\"gameId\":\"g1\",\"color\":\"black\",\"opponent\":\"alice\"}}",
            codec.encode(Envelope.of(MessageType.GAME_START, new GameStartDTO("g1", Colour.BLACK, "alice"))));
        assertJson("{\"type\":\"gameOver\",\"payload\":{\"outcome\":\"draw\",\"method\":\"fifty-move rule\",\"winner\":\"draw\"}}",
            codec.encode(Envelope.of(MessageType.GAME_OVER, GameOverDTO.of(GameResult.DRAW, GameOverReason.FIFTY_MOVE))));
    }

    @Test
    public void testEncodeOmitsMissingPayload() {
        assertEquals("{\"type\":\"pong\"}", codec.encode(Envelope.of(MessageType.PONG)));
        assertEquals("{\"type\":\"waiting\",\"payload\":\"Waiting for opponent...\"}",
            codec.encode(Envelope.of(MessageType.WAITING, "Waiting for opponent...")));
    }
}
