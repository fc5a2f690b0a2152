package com.example.couchbaseconnect.core.history;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.couchbaseconnect.core.ValidationException;
import com.example.couchbaseconnect.core.history.SessionHistoryException.Stage;
import com.example.couchbaseconnect.core.storage.DocumentCollection;
import com.example.couchbaseconnect.core.storage.Keyspace;
import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;
import com.example.couchbaseconnect.core.storage.StorageHandle;
import com.example.couchbaseconnect.core.storage.SubdocMutation;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only chat history, one document per session.
 *
 * <p>Each session is stored under {@code keyPrefix + sessionId} as {@code {sessionId, messages,
 * updatedAt}}. Appends use a single sub-document mutation on an existing document; the first write
 * for a session creates the document instead.
 *
 * <pre>{@code
 * var store = new SessionHistoryStore(Keyspace.defaults("n8n_memory"));
 * var handle = manager.acquire(credentials);
 * store.addMessages(handle, "s1", List.of(ChatMessage.human("hi"), ChatMessage.ai("hello")));
 * List<ChatMessage> history = store.getMessages(handle, "s1");
 * }</pre>
 *
 * <p>Concurrent first writes are resolved with a create-only insert: the writer that loses the
 * race sees the document exist and falls back to the atomic append, so no messages are
 * overwritten.
 */
public final class SessionHistoryStore {

  private static final System.Logger LOGGER = System.getLogger(SessionHistoryStore.class.getName());

  public static final String DEFAULT_KEY_PREFIX = "chat_history::";

  /** Couchbase rejects document ids longer than this many bytes. */
  public static final int MAX_DOCUMENT_ID_BYTES = 250;

  static final String MESSAGES_FIELD = "messages";
  static final String UPDATED_AT_FIELD = "updatedAt";

  private final Keyspace keyspace;
  private final String keyPrefix;
  private final ObjectMapper mapper;
  private final Clock clock;

  public SessionHistoryStore(final Keyspace keyspace) {
    this(keyspace, DEFAULT_KEY_PREFIX, defaultMapper(), Clock.systemUTC());
  }

  public SessionHistoryStore(
      final Keyspace keyspace,
      final String keyPrefix,
      final ObjectMapper mapper,
      final Clock clock) {
    if (keyspace == null) throw new ValidationException("Keyspace is required");
    this.keyspace = keyspace;
    this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Mapper configured for {@link SessionDocument}: ISO-8601 timestamps, unknown fields ignored.
   *
   * @return new mapper
   */
  public static ObjectMapper defaultMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  public Keyspace keyspace() {
    return keyspace;
  }

  /**
   * Document key for a session.
   *
   * @param sessionId session id
   * @return {@code keyPrefix + sessionId}
   * @throws ValidationException if the session id is blank or the key is too long
   */
  public String documentKey(final String sessionId) {
    ValidationException.requireNonBlank(
        sessionId, "Session ID is missing. Please ensure a valid Session ID is provided.");
    final var key = keyPrefix + sessionId;
    if (key.getBytes(StandardCharsets.UTF_8).length > MAX_DOCUMENT_ID_BYTES)
      throw new ValidationException(
          "Session ID is too long: document key exceeds " + MAX_DOCUMENT_ID_BYTES + " bytes");
    return key;
  }

  /**
   * Returns all messages of a session in insertion order.
   *
   * @param handle connection obtained from the connection manager
   * @param sessionId session id
   * @return messages, empty when the session has no document
   * @throws SessionHistoryException if the read fails for any reason other than a missing document
   */
  public List<ChatMessage> getMessages(final StorageHandle handle, final String sessionId) {
    final var key = documentKey(sessionId);
    return read(open(handle, Stage.READ, key), key);
  }

  /**
   * Returns the most recent {@code exchanges} human/ai exchanges, i.e. the last {@code 2 *
   * exchanges} messages.
   *
   * @param handle connection obtained from the connection manager
   * @param sessionId session id
   * @param exchanges number of exchanges to keep, must be >= 0
   * @return tail of the history in insertion order
   */
  public List<ChatMessage> getMessageWindow(
      final StorageHandle handle, final String sessionId, final int exchanges) {
    if (exchanges < 0) throw new IllegalArgumentException("exchanges must be >= 0");
    final var messages = getMessages(handle, sessionId);
    final var keep = (int) Math.min((long) exchanges * 2, messages.size());
    return messages.subList(messages.size() - keep, messages.size());
  }

  public void addMessage(
      final StorageHandle handle, final String sessionId, final ChatMessage message) {
    addMessages(handle, sessionId, List.of(message));
  }

  /**
   * Appends messages to a session, creating its document on first write.
   *
   * @param handle connection obtained from the connection manager
   * @param sessionId session id
   * @param messages messages to append, in order
   * @throws SessionHistoryException if the append or the create fails
   */
  public void addMessages(
      final StorageHandle handle, final String sessionId, final List<ChatMessage> messages) {
    final var key = documentKey(sessionId);
    Objects.requireNonNull(messages, "messages");
    if (messages.isEmpty()) return;
    messages.forEach(m -> Objects.requireNonNull(m, "messages must not contain null"));

    final var collection = open(handle, Stage.APPEND, key);
    try {
      append(collection, key, messages);
      return;
    } catch (final StorageException e) {
      if (!e.is(StorageErrorKind.DOCUMENT_NOT_FOUND))
        throw new SessionHistoryException(Stage.APPEND, key, keyspace, e);
    }

    LOGGER.log(DEBUG, "No history document {0}, creating it", key);
    final var all = new ArrayList<>(read(collection, key));
    all.addAll(messages);
    try {
      collection.insert(key, toTree(new SessionDocument(sessionId, all, clock.instant())));
    } catch (final StorageException e) {
      if (!e.is(StorageErrorKind.DOCUMENT_EXISTS))
        throw new SessionHistoryException(Stage.CREATE, key, keyspace, e);

      LOGGER.log(DEBUG, "History document {0} was created concurrently, appending", key);
      try {
        append(collection, key, messages);
      } catch (final StorageException retry) {
        throw new SessionHistoryException(Stage.APPEND, key, keyspace, retry);
      }
    }
  }

  /**
   * Deletes a session's history. Deleting a session that has no document is a no-op.
   *
   * @param handle connection obtained from the connection manager
   * @param sessionId session id
   * @throws SessionHistoryException if the delete fails for any other reason
   */
  public void clear(final StorageHandle handle, final String sessionId) {
    final var key = documentKey(sessionId);
    final var collection = open(handle, Stage.CLEAR, key);
    try {
      collection.remove(key);
    } catch (final StorageException e) {
      if (!e.is(StorageErrorKind.DOCUMENT_NOT_FOUND))
        throw new SessionHistoryException(Stage.CLEAR, key, keyspace, e);
    }
  }

  private DocumentCollection open(final StorageHandle handle, final Stage stage, final String key) {
    if (handle == null) throw new ValidationException("Storage handle is required");
    try {
      return handle.collection(keyspace);
    } catch (final StorageException e) {
      throw new SessionHistoryException(stage, key, keyspace, e);
    }
  }

  private List<ChatMessage> read(final DocumentCollection collection, final String key) {
    final JsonNode node;
    try {
      node = collection.get(key);
    } catch (final StorageException e) {
      if (e.is(StorageErrorKind.DOCUMENT_NOT_FOUND)) return List.of();
      throw new SessionHistoryException(Stage.READ, key, keyspace, e);
    }
    try {
      return mapper.treeToValue(node, SessionDocument.class).messages();
    } catch (final Exception e) {
      throw new SessionHistoryException(Stage.READ, key, keyspace, e);
    }
  }

  private void append(
      final DocumentCollection collection, final String key, final List<ChatMessage> messages) {
    final var values = messages.stream().<JsonNode>map(mapper::valueToTree).toList();
    collection.mutateIn(
        key,
        List.of(
            SubdocMutation.arrayAppendCreatingPath(MESSAGES_FIELD, values),
            SubdocMutation.upsert(UPDATED_AT_FIELD, new TextNode(clock.instant().toString()))));
  }

  private JsonNode toTree(final SessionDocument document) {
    return mapper.valueToTree(document);
  }
}
