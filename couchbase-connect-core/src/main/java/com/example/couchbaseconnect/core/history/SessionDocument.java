package com.example.couchbaseconnect.core.history;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stored form of a session's history: {@code {sessionId, messages: [...], updatedAt}}.
 *
 * @param sessionId session the messages belong to
 * @param messages messages in insertion order
 * @param updatedAt time of the last write
 */
public record SessionDocument(String sessionId, List<ChatMessage> messages, Instant updatedAt) {

  public SessionDocument {
    messages = List.copyOf(Optional.ofNullable(messages).orElse(List.of()));
  }
}
