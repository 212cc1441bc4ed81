package com.chessws.server.protocol;

import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.chessws.shared.dto.ChatMessageDTO;
import com.chessws.shared.dto.DrawResponseMessageDTO;
import com.chessws.shared.dto.Envelope;
import com.chessws.shared.dto.GameRefDTO;
import com.chessws.shared.dto.MoveMessageDTO;
import com.chessws.shared.dto.TimeUpdateMessageDTO;
import com.chessws.shared.util.MessageType;

/**
 * JSON codec for envelopes. Decoding validates the payload shape for the message type before
 * anything is dispatched, so handlers only ever see complete payloads.
 */
public class MessageCodec {

    private static final Map<MessageType, Class<?>> INBOUND = new EnumMap<>(MessageType.class);

    static {
        INBOUND.put(MessageType.JOIN, Void.class);
        INBOUND.put(MessageType.PING, Void.class);
        INBOUND.put(MessageType.MOVE, MoveMessageDTO.class);
        INBOUND.put(MessageType.RESIGN, GameRefDTO.class);
        INBOUND.put(MessageType.DRAW_OFFER, GameRefDTO.class);
        INBOUND.put(MessageType.DRAW_RESPONSE, DrawResponseMessageDTO.class);
        INBOUND.put(MessageType.TIME_UPDATE, TimeUpdateMessageDTO.class);
        INBOUND.put(MessageType.CHAT, ChatMessageDTO.class);
        INBOUND.put(MessageType.RECONNECT, GameRefDTO.class);
    }

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InboundMessage decode(String text) throws MessageDecodeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageDecodeException("malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageDecodeException("envelope is not a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MessageDecodeException("envelope has no type");
        }
        MessageType type = MessageType.fromWireName(typeNode.asText());
        // server-to-client types are as unknown here as made-up ones
        if (type == null || !INBOUND.containsKey(type)) {
            throw new UnknownMessageTypeException(typeNode.asText());
        }

        Class<?> payloadClass = INBOUND.get(type);
        if (payloadClass == Void.class) {
            return new InboundMessage(type, null);
        }
        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || !payloadNode.isObject()) {
            throw new MessageDecodeException(type.wireName() + ": payload must be an object");
        }
        Object payload;
        try {
            payload = objectMapper.treeToValue(payloadNode, payloadClass);
        } catch (JsonProcessingException e) {
            throw new MessageDecodeException(type.wireName() + ": bad payload: " + e.getOriginalMessage(), e);
        }
        validate(type, payload);
        return new InboundMessage(type, payload);
    }

    private static void validate(MessageType type, Object payload) throws MessageDecodeException {
        if (payload instanceof MoveMessageDTO) {
            MoveMessageDTO move = (MoveMessageDTO) payload;
            requireText(type, "gameId", move.gameId());
            requireText(type, "move", move.move());
        } else if (payload instanceof GameRefDTO) {
            requireText(type, "gameId", ((GameRefDTO) payload).gameId());
        } else if (payload instanceof DrawResponseMessageDTO) {
            DrawResponseMessageDTO response = (DrawResponseMessageDTO) payload;
            requireText(type, "gameId", response.gameId());
            requirePresent(type, "accept", response.accept());
        } else if (payload instanceof TimeUpdateMessageDTO) {
            TimeUpdateMessageDTO update = (TimeUpdateMessageDTO) payload;
            requireText(type, "gameId", update.gameId());
            requirePresent(type, "timeLeft", update.timeLeft());
        } else if (payload instanceof ChatMessageDTO) {
            ChatMessageDTO chat = (ChatMessageDTO) payload;
            requireText(type, "gameId", chat.gameId());
            requirePresent(type, "message", chat.message());
        }
    }

    private static void requireText(MessageType type, String field, String value) throws MessageDecodeException {
        if (value == null || value.isBlank()) {
            throw new MessageDecodeException(type.wireName() + ": missing " + field);
        }
    }

    private static void requirePresent(MessageType type, String field, Object value) throws MessageDecodeException {
        if (value == null) {
            throw new MessageDecodeException(type.wireName() + ": missing " + field);
        }
    }

    public String encode(Envelope<?> envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + envelope.type(), e);
        }
    }
}
