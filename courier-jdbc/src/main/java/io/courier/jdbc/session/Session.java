package io.courier.jdbc.session;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One database unit of work: a JDBC connection with auto-commit off.
 *
 * <p>Inside {@link SessionManager#withSession(SessionWork)} the manager commits, rolls back
 * and closes the session; work code only uses {@link #connection()} and may register
 * {@link #afterCommit(Runnable)} callbacks, for example to publish an event once the row
 * it describes is durable. Sessions from the deprecated {@link SessionManager#getSession()}
 * must be committed and closed by the caller.
 *
 * <p>Not thread-safe; a session belongs to the thread that opened it.
 */
public final class Session implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Session.class.getName());

  private final Connection connection;
  private final Runnable onClose;
  private final List<Runnable> afterCommit = new ArrayList<>();
  private boolean closed;

  Session(Connection connection, Runnable onClose) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.onClose = Objects.requireNonNull(onClose, "onClose");
  }

  /**
   * @return the session's connection
   * @throws IllegalStateException if the session is closed
   */
  public Connection connection() {
    ensureOpen();
    return connection;
  }

  /**
   * Registers a callback to run after the next successful commit. Callbacks are
   * discarded on rollback.
   */
  public void afterCommit(Runnable callback) {
    ensureOpen();
    afterCommit.add(Objects.requireNonNull(callback, "callback"));
  }

  /**
   * Commits the current transaction, then runs the after-commit callbacks in
   * registration order.
   *
   * @throws SessionException if the commit fails
   * @throws RuntimeException the first exception thrown by a callback, others suppressed
   */
  public void commit() {
    ensureOpen();
    try {
      connection.commit();
    } catch (SQLException e) {
      throw new SessionException("Commit failed", e);
    }
    List<Runnable> callbacks = new ArrayList<>(afterCommit);
    afterCommit.clear();
    RuntimeException first = null;
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Rolls back the current transaction and discards after-commit callbacks.
   *
   * @throws SessionException if the rollback fails
   */
  public void rollback() {
    ensureOpen();
    afterCommit.clear();
    try {
      connection.rollback();
    } catch (SQLException e) {
      throw new SessionException("Rollback failed", e);
    }
  }

  void rollbackQuietly(Throwable primary) {
    afterCommit.clear();
    try {
      connection.rollback();
    } catch (SQLException e) {
      if (primary != null) {
        primary.addSuppressed(e);
      } else {
        logger.log(Level.WARNING, "Rollback failed", e);
      }
    }
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Rolls back uncommitted work, restores auto-commit and closes the connection.
   * Idempotent; never throws.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    afterCommit.clear();
    try {
      connection.rollback();
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to reset session connection", e);
    }
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close session connection", e);
    } finally {
      onClose.run();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Session is closed");
    }
  }
}
