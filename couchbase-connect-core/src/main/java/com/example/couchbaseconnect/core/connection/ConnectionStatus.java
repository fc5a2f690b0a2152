package com.example.couchbaseconnect.core.connection;

/**
 * Lifecycle of the cached connection.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED
 * CONNECTING   -> DISCONNECTED   (connect failed)
 * CONNECTED    -> DISCONNECTED   (close, idle timeout, credential change)
 * </pre>
 */
public enum ConnectionStatus {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
