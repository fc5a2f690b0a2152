package com.example.couchbaseconnect.core.couchbase;

import static com.couchbase.client.java.kv.GetOptions.getOptions;
import static com.couchbase.client.java.kv.InsertOptions.insertOptions;
import static com.couchbase.client.java.kv.UpsertOptions.upsertOptions;

import com.couchbase.client.java.Collection;
import com.couchbase.client.java.codec.RawJsonTranscoder;
import com.couchbase.client.java.kv.MutateInSpec;
import com.example.couchbaseconnect.core.storage.DocumentCollection;
import com.example.couchbaseconnect.core.storage.StorageErrorKind;
import com.example.couchbaseconnect.core.storage.StorageException;
import com.example.couchbaseconnect.core.storage.SubdocMutation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;

/**
 * {@link DocumentCollection} on a Couchbase {@link Collection}. Whole documents travel as raw JSON
 * bytes; sub-document values are converted to plain maps, lists and scalars for the SDK
 * serializer.
 */
final class CouchbaseDocumentCollection implements DocumentCollection {

  private final Collection collection;
  private final ObjectMapper mapper;

  CouchbaseDocumentCollection(final Collection collection, final ObjectMapper mapper) {
    this.collection = collection;
    this.mapper = mapper;
  }

  @Override
  public JsonNode get(final String key) {
    final byte[] content;
    try {
      content =
          collection
              .get(key, getOptions().transcoder(RawJsonTranscoder.INSTANCE))
              .contentAs(byte[].class);
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("get " + key, e);
    }
    try {
      return mapper.readTree(content);
    } catch (final IOException e) {
      throw new StorageException(
          StorageErrorKind.OTHER, "Document " + key + " is not valid JSON", e);
    }
  }

  @Override
  public void insert(final String key, final JsonNode value) {
    final var bytes = toBytes(key, value);
    try {
      collection.insert(key, bytes, insertOptions().transcoder(RawJsonTranscoder.INSTANCE));
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("insert " + key, e);
    }
  }

  @Override
  public void upsert(final String key, final JsonNode value) {
    final var bytes = toBytes(key, value);
    try {
      collection.upsert(key, bytes, upsertOptions().transcoder(RawJsonTranscoder.INSTANCE));
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("upsert " + key, e);
    }
  }

  @Override
  public void remove(final String key) {
    try {
      collection.remove(key);
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("remove " + key, e);
    }
  }

  @Override
  public void mutateIn(final String key, final List<SubdocMutation> mutations) {
    final var specs = mutations.stream().map(this::toSpec).toList();
    try {
      collection.mutateIn(key, specs);
    } catch (final RuntimeException e) {
      throw CouchbaseErrors.wrap("mutateIn " + key, e);
    }
  }

  private MutateInSpec toSpec(final SubdocMutation mutation) {
    if (mutation instanceof SubdocMutation.ArrayAppend append) {
      final var spec =
          MutateInSpec.arrayAppend(
              append.path(), append.values().stream().map(this::toPlain).toList());
      return append.createPath() ? spec.createPath() : spec;
    }
    if (mutation instanceof SubdocMutation.Upsert upsert)
      return MutateInSpec.upsert(upsert.path(), toPlain(upsert.value()));
    throw new IllegalArgumentException("Unsupported mutation " + mutation);
  }

  private Object toPlain(final JsonNode node) {
    return mapper.convertValue(node, Object.class);
  }

  private byte[] toBytes(final String key, final JsonNode value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (final JsonProcessingException e) {
      throw new StorageException(
          StorageErrorKind.OTHER, "Could not serialize document " + key, e);
    }
  }
}
