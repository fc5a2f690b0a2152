package com.example.couchbaseconnect.core.secrets;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/**
 * Deserializes credential secret payloads into {@link Credentials} using Jackson.
 *
 * <p>Expected secret payload:
 *
 * <pre>{@code
 * {"connectionString": "couchbases://cb.example.com", "username": "app", "password": "..."}
 * }</pre>
 */
public final class SecretHelper {

  private static volatile Supplier<ObjectMapper> mapperSupplier = SecretHelper::defaultMapper;

  private SecretHelper() {}

  private static ObjectMapper defaultMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier == null ? SecretHelper::defaultMapper : supplier;
  }

  /**
   * Parses a secret payload.
   *
   * @param json secret JSON
   * @return the parsed credentials
   * @throws IllegalStateException if the payload cannot be parsed or a field is missing
   */
  public static Credentials parseCredentials(final String json) {
    try {
      return mapperSupplier.get().readValue(json, Credentials.class);
    } catch (final Exception exception) {
      throw new IllegalStateException("Failed to parse Couchbase credentials secret", exception);
    }
  }
}
