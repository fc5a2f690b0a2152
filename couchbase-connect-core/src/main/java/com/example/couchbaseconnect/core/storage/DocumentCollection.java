package com.example.couchbaseconnect.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Key/value access to a single collection. Every method throws {@link StorageException} on
 * failure.
 */
public interface DocumentCollection {

  /**
   * Reads a whole document.
   *
   * @throws StorageException with {@link StorageErrorKind#DOCUMENT_NOT_FOUND} if absent
   */
  JsonNode get(String key);

  /**
   * Creates a document.
   *
   * @throws StorageException with {@link StorageErrorKind#DOCUMENT_EXISTS} if already present
   */
  void insert(String key, JsonNode value);

  /** Creates or replaces a document. */
  void upsert(String key, JsonNode value);

  /**
   * Deletes a document.
   *
   * @throws StorageException with {@link StorageErrorKind#DOCUMENT_NOT_FOUND} if absent
   */
  void remove(String key);

  /**
   * Applies all mutations to an existing document in one atomic operation.
   *
   * @throws StorageException with {@link StorageErrorKind#DOCUMENT_NOT_FOUND} if absent
   */
  void mutateIn(String key, List<SubdocMutation> mutations);
}
