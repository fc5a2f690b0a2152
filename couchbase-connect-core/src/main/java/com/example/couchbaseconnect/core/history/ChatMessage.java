package com.example.couchbaseconnect.core.history;

import java.util.Objects;

/**
 * A single chat message. The history store persists it verbatim and only guarantees ordering.
 *
 * @param role speaker, e.g. {@code human}, {@code ai}, {@code system}
 * @param content message text
 */
public record ChatMessage(String role, String content) {

  public static final String HUMAN = "human";
  public static final String AI = "ai";
  public static final String SYSTEM = "system";

  public ChatMessage {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(content, "content");
  }

  public static ChatMessage human(final String content) {
    return new ChatMessage(HUMAN, content);
  }

  public static ChatMessage ai(final String content) {
    return new ChatMessage(AI, content);
  }

  public static ChatMessage system(final String content) {
    return new ChatMessage(SYSTEM, content);
  }
}
