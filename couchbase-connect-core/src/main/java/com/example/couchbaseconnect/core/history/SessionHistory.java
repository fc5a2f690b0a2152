package com.example.couchbaseconnect.core.history;

import com.example.couchbaseconnect.core.connection.ConnectionManager;
import com.example.couchbaseconnect.core.retry.Retrier;
import com.example.couchbaseconnect.core.retry.RetryExecutor;
import com.example.couchbaseconnect.core.retry.RetryPolicy;
import com.example.couchbaseconnect.core.secrets.CredentialSupplier;
import com.example.couchbaseconnect.core.secrets.Credentials;
import com.example.couchbaseconnect.core.storage.StorageHandle;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * History of one session, bound to the connection it is read and written through. A handle is
 * acquired for every call, so idle eviction and credential changes between calls are handled by
 * the connection manager.
 *
 * <p>Reads and clears go through the retrier. Appends are attempted once: after an ambiguous
 * timeout the append may already have been applied, and retrying would duplicate messages.
 */
public final class SessionHistory {

  private final SessionHistoryStore store;
  private final Supplier<StorageHandle> handles;
  private final String sessionId;
  private final Retrier retrier;

  public SessionHistory(
      final SessionHistoryStore store,
      final Supplier<StorageHandle> handles,
      final String sessionId,
      final Retrier retrier) {
    this.store = Objects.requireNonNull(store, "store");
    this.handles = Objects.requireNonNull(handles, "handles");
    this.retrier = Objects.requireNonNull(retrier, "retrier");
    store.documentKey(sessionId);
    this.sessionId = sessionId;
  }

  /**
   * History view acquiring handles from {@code manager} with fixed credentials and the default
   * retry policy.
   *
   * @param store history store
   * @param manager connection manager shared by the process
   * @param credentials credentials to acquire with
   * @param sessionId session id
   * @return session history
   */
  public static SessionHistory of(
      final SessionHistoryStore store,
      final ConnectionManager manager,
      final Credentials credentials,
      final String sessionId) {
    Objects.requireNonNull(manager, "manager");
    return new SessionHistory(
        store,
        () -> manager.acquire(credentials),
        sessionId,
        new RetryExecutor().makeRetrier(RetryPolicy.defaults()));
  }

  /**
   * History view resolving credentials through {@code supplier} on every call, so rotated
   * credentials are picked up by the next operation.
   *
   * @param store history store
   * @param manager connection manager shared by the process
   * @param supplier credential supplier
   * @param credentialSetName name passed to the supplier
   * @param sessionId session id
   * @return session history
   */
  public static SessionHistory of(
      final SessionHistoryStore store,
      final ConnectionManager manager,
      final CredentialSupplier supplier,
      final String credentialSetName,
      final String sessionId) {
    Objects.requireNonNull(manager, "manager");
    return new SessionHistory(
        store,
        () -> manager.acquire(supplier, credentialSetName),
        sessionId,
        new RetryExecutor().makeRetrier(RetryPolicy.defaults()));
  }

  public String sessionId() {
    return sessionId;
  }

  public List<ChatMessage> getMessages() {
    return retrier.execute(() -> store.getMessages(handles.get(), sessionId));
  }

  /**
   * Last {@code exchanges} exchanges of the conversation.
   *
   * @param exchanges number of human/ai exchanges
   * @return up to {@code 2 * exchanges} messages
   */
  public List<ChatMessage> getMessageWindow(final int exchanges) {
    return retrier.execute(() -> store.getMessageWindow(handles.get(), sessionId, exchanges));
  }

  public void addMessage(final ChatMessage message) {
    store.addMessage(handles.get(), sessionId, message);
  }

  public void addMessages(final List<ChatMessage> messages) {
    store.addMessages(handles.get(), sessionId, messages);
  }

  public void clear() {
    retrier.execute(
        () -> {
          store.clear(handles.get(), sessionId);
          return null;
        });
  }
}
