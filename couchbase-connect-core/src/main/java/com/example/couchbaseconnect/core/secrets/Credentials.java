package com.example.couchbaseconnect.core.secrets;

import com.example.couchbaseconnect.core.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection credentials for a cluster. Record equality over all three fields is the fingerprint
 * used to decide whether a cached connection can be reused.
 *
 * @param connectionString cluster endpoint, e.g. {@code couchbases://cb.example.com}
 * @param username user name
 * @param password password
 */
public record Credentials(String connectionString, String username, String password) {

  @JsonCreator
  public Credentials(
      @JsonProperty("connectionString") final String connectionString,
      @JsonProperty("username") final String username,
      @JsonProperty("password") final String password) {
    this.connectionString =
        ValidationException.requireNonBlank(connectionString, "Connection string is required");
    this.username = ValidationException.requireNonBlank(username, "Username is required");
    this.password = ValidationException.requireNonBlank(password, "Password is required");
  }

  @Override
  public String toString() {
    return "Credentials[connectionString=" + connectionString + ", username=" + username + "]";
  }
}
