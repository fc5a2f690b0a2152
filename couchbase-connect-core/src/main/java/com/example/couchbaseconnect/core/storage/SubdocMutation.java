package com.example.couchbaseconnect.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/** A single path-level mutation applied by {@link DocumentCollection#mutateIn}. */
public sealed interface SubdocMutation {

  String path();

  /**
   * Appends every value, in order, to the array at {@code path}. Without {@code createPath} the
   * array must already exist.
   *
   * @param path array field
   * @param values elements to append
   * @param createPath whether to create an empty array first when {@code path} is absent
   */
  record ArrayAppend(String path, List<JsonNode> values, boolean createPath)
      implements SubdocMutation {
    public ArrayAppend {
      Objects.requireNonNull(path, "path");
      values = List.copyOf(values);
    }
  }

  /**
   * Sets {@code path} to {@code value}, creating the field when absent.
   *
   * @param path field
   * @param value new value
   */
  record Upsert(String path, JsonNode value) implements SubdocMutation {
    public Upsert {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(value, "value");
    }
  }

  static SubdocMutation arrayAppend(final String path, final List<JsonNode> values) {
    return new ArrayAppend(path, values, false);
  }

  static SubdocMutation arrayAppendCreatingPath(final String path, final List<JsonNode> values) {
    return new ArrayAppend(path, values, true);
  }

  static SubdocMutation upsert(final String path, final JsonNode value) {
    return new Upsert(path, value);
  }
}
