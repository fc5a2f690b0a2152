package com.example.couchbaseconnect.core.secrets;

import java.util.Objects;

/**
 * Resolves a named credential set. Implementations may return different values between calls,
 * which drives reconnection in the connection manager.
 */
@FunctionalInterface
public interface CredentialSupplier {

  /**
   * Returns the current credentials for a credential set.
   *
   * @param name credential set name
   * @return current credentials
   */
  Credentials get(final String name);

  /**
   * Supplier that ignores the name and always returns the same credentials.
   *
   * @param credentials credentials to return
   * @return fixed supplier
   */
  static CredentialSupplier fixed(final Credentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    return name -> credentials;
  }
}
