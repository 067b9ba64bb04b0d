package io.courier.jdbc.session;

import io.courier.jdbc.ConnectionProvider;
import io.courier.retry.RetryPolicy;
import io.courier.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scoped database sessions: exactly one {@link Session} per unit of work, always closed.
 *
 * <p>Use via {@link #withSession(SessionWork)}:
 * <pre>{@code
 * long userId = sessions.withSession(session -> {
 *   try (PreparedStatement ps = session.connection().prepareStatement(INSERT_USER)) {
 *     ...
 *   }
 *   session.afterCommit(() -> courier.publish("user_events", "user.registered", payload));
 *   return id;
 * });
 * }</pre>
 *
 * <p>An advisory count of open sessions is kept under a dedicated lock and reported to
 * {@link MetricsExporter#recordSessionsInFlight(int)}.
 */
public final class SessionManager {
  private static final Logger logger = Logger.getLogger(SessionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final MetricsExporter metrics;
  private final int connectivityAttempts;
  private final RetryPolicy connectivityRetryPolicy;
  private final int validationTimeoutSeconds;

  private final ThreadLocal<Session> current = new ThreadLocal<>();
  private final ReentrantLock counterLock = new ReentrantLock();
  private int inFlight;

  private SessionManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.connectivityAttempts < 1) {
      throw new IllegalArgumentException("connectivityAttempts must be >= 1");
    }
    if (builder.validationTimeoutSeconds < 0) {
      throw new IllegalArgumentException("validationTimeoutSeconds must be >= 0");
    }
    this.connectivityAttempts = builder.connectivityAttempts;
    this.connectivityRetryPolicy = builder.connectivityRetryPolicy != null
        ? builder.connectivityRetryPolicy : RetryPolicy.fixed(2000);
    this.validationTimeoutSeconds = builder.validationTimeoutSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs {@code work} in a fresh session bound to the current thread. Commits when the
   * work returns normally; otherwise rolls back. The session is closed in every case.
   *
   * @param work the unit of work
   * @return the work's result
   * @throws E the work's own exception, unchanged, after rollback
   * @throws SessionException if the session cannot be opened or the commit fails
   * @throws IllegalStateException if a session is already open on this thread
   */
  public <R, E extends Exception> R withSession(SessionWork<R, E> work) throws E {
    Objects.requireNonNull(work, "work");
    if (current.get() != null) {
      throw new IllegalStateException("A session is already open on this thread");
    }
    Session session = open();
    current.set(session);
    Throwable failure = null;
    try {
      R result = work.execute(session);
      session.commit();
      return result;
    } catch (Throwable t) {
      failure = t;
      throw t;
    } finally {
      current.remove();
      if (failure != null) {
        session.rollbackQuietly(failure);
      }
      session.close();
    }
  }

  /**
   * @return the session bound to the current thread by {@link #withSession(SessionWork)}
   * @throws IllegalStateException if no session is open on this thread
   */
  public Session currentSession() {
    Session session = current.get();
    if (session == null) {
      throw new IllegalStateException("No session is open on this thread");
    }
    return session;
  }

  public boolean hasCurrentSession() {
    return current.get() != null;
  }

  /**
   * Opens a counted session that the caller must commit and close.
   *
   * @deprecated use {@link #withSession(SessionWork)}, which cannot leak sessions
   * @throws SessionException if the session cannot be opened
   */
  @Deprecated
  public Session getSession() {
    return open();
  }

  /** Number of sessions currently open through this manager. */
  public int inFlightSessions() {
    counterLock.lock();
    try {
      return inFlight;
    } finally {
      counterLock.unlock();
    }
  }

  /**
   * Checks that the database accepts connections, retrying with the configured backoff.
   *
   * @throws SessionException if every attempt fails or the thread is interrupted
   */
  public void verifyConnectivity() {
    SQLException last = null;
    for (int attempt = 1; attempt <= connectivityAttempts; attempt++) {
      try (Connection connection = connectionProvider.getConnection()) {
        if (connection.isValid(validationTimeoutSeconds)) {
          logger.info("Database connection verified");
          return;
        }
        last = new SQLException("Connection reported invalid");
      } catch (SQLException e) {
        last = e;
      }
      logger.warning("Database not reachable (attempt " + attempt + "/" + connectivityAttempts
          + "): " + last.getMessage());
      if (attempt < connectivityAttempts) {
        try {
          Thread.sleep(connectivityRetryPolicy.computeDelayMs(attempt));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new SessionException("Interrupted while waiting for the database", last);
        }
      }
    }
    logger.log(Level.SEVERE, "Giving up on database after " + connectivityAttempts + " attempts", last);
    throw new SessionException("Database not reachable after " + connectivityAttempts + " attempts", last);
  }

  private Session open() {
    Connection connection;
    try {
      connection = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw new SessionException("Could not open database session", e);
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw new SessionException("Could not open database session", e);
    }
    adjustInFlight(1);
    return new Session(connection, () -> adjustInFlight(-1));
  }

  private void adjustInFlight(int delta) {
    int now;
    counterLock.lock();
    try {
      inFlight += delta;
      now = inFlight;
    } finally {
      counterLock.unlock();
    }
    metrics.recordSessionsInFlight(now);
  }

  /** Builder for {@link SessionManager}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private MetricsExporter metrics;
    private int connectivityAttempts = 5;
    private RetryPolicy connectivityRetryPolicy;
    private int validationTimeoutSeconds = 5;

    private Builder() {}

    /**
     * Sets the source of JDBC connections.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the metrics exporter receiving the open-session count.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how many times {@link SessionManager#verifyConnectivity()} tries to connect.
     *
     * <p>Optional. Defaults to {@code 5}.
     *
     * @param connectivityAttempts attempt count
     * @return this builder
     */
    public Builder connectivityAttempts(int connectivityAttempts) {
      this.connectivityAttempts = connectivityAttempts;
      return this;
    }

    /**
     * Sets the wait between connectivity attempts.
     *
     * <p>Optional. Defaults to a fixed 2 second delay.
     *
     * @param connectivityRetryPolicy the retry policy
     * @return this builder
     */
    public Builder connectivityRetryPolicy(RetryPolicy connectivityRetryPolicy) {
      this.connectivityRetryPolicy = connectivityRetryPolicy;
      return this;
    }

    public Builder validationTimeoutSeconds(int validationTimeoutSeconds) {
      this.validationTimeoutSeconds = validationTimeoutSeconds;
      return this;
    }

    public SessionManager build() {
      return new SessionManager(this);
    }
  }
}
