package com.example.couchbaseconnect.core.history;

import com.example.couchbaseconnect.core.storage.Keyspace;
import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;

/** A history operation failed; names the stage and the document involved. */
public class SessionHistoryException extends RuntimeException {

  /** Step of a history operation that failed. */
  public enum Stage {
    READ("read"),
    APPEND("append to"),
    CREATE("create"),
    CLEAR("clear");

    private final String verb;

    Stage(final String verb) {
      this.verb = verb;
    }
  }

  private final Stage stage;
  private final String documentKey;

  public SessionHistoryException(
      final Stage stage, final String documentKey, final Keyspace keyspace, final Throwable cause) {
    super(
        "Could not "
            + stage.verb
            + " chat history "
            + documentKey
            + " in "
            + keyspace
            + ": "
            + cause.getMessage(),
        cause);
    this.stage = stage;
    this.documentKey = documentKey;
  }

  public Stage stage() {
    return stage;
  }

  public String documentKey() {
    return documentKey;
  }

  /** Kind of the underlying storage failure, {@link StorageErrorKind#OTHER} if there is none. */
  public StorageErrorKind kind() {
    return StorageException.kindOf(getCause());
  }
}
