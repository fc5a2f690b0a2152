package com.example.couchbaseconnect.core.connection;

/** The cluster rejected the supplied username or password. */
public class AuthenticationException extends ConnectionException {

  public AuthenticationException(final String message, final Throwable cause) {
    super(ConnectionFailure.AUTHENTICATION, message, cause);
  }
}
