package com.chessws.server.model;

import java.time.Instant;

public record ChatEntry(String sender, String text, Instant sentAt) {
}
