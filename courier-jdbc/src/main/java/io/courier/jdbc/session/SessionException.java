package io.courier.jdbc.session;

/**
 * Unchecked exception wrapping JDBC errors raised while opening, committing or checking
 * a database session. Exceptions thrown by the unit of work itself are never wrapped.
 */
public final class SessionException extends RuntimeException {
  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
