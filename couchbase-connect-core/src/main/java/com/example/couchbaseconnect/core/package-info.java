/**
 * Root package for the couchbase-connect library.
 *
 * <p>The library keeps a single Couchbase connection per {@link
 * com.example.couchbaseconnect.core.connection.ConnectionManager ConnectionManager}, reconnects
 * when credentials change, closes the connection after a period of inactivity, and stores chat
 * history as one append-only document per session.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.couchbaseconnect.core.storage} – driver-neutral storage seam ({@code
 *       StorageConnector}, {@code StorageHandle}, {@code DocumentCollection}) and the tagged
 *       {@code StorageException}.
 *   <li>{@link com.example.couchbaseconnect.core.couchbase} – implementation of the seam on the
 *       Couchbase Java SDK.
 *   <li>{@link com.example.couchbaseconnect.core.secrets} – {@code Credentials} and credential
 *       suppliers, including one backed by AWS Secrets Manager.
 *   <li>{@link com.example.couchbaseconnect.core.connection} – {@code ConnectionManager} with
 *       credential-aware caching and idle eviction.
 *   <li>{@link com.example.couchbaseconnect.core.retry} – {@code RetryExecutor} with exponential
 *       backoff.
 *   <li>{@link com.example.couchbaseconnect.core.reactive} – the same retry semantics for Reactor
 *       {@code Mono} operations.
 *   <li>{@link com.example.couchbaseconnect.core.history} – {@code SessionHistoryStore} for chat
 *       memory.
 * </ul>
 */
package com.example.couchbaseconnect.core;
