package org.hypertrace.core.filter.service.postgres;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.hypertrace.core.filter.service.FilterServiceConfig.DatabaseClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands out one {@link PostgresClient} per configured database name. */
public final class PostgresClientFactory {

  private static final Map<String, PostgresClient> CLIENTS = new ConcurrentHashMap<>();

  private PostgresClientFactory() {}

  public static PostgresClient createPostgresClient(DatabaseClientConfig clientConfig) {
    return CLIENTS.computeIfAbsent(clientConfig.getName(), name -> new PostgresClient(clientConfig));
  }

  /**
   * A single JDBC connection to the manager database, opened on first use and reopened when the
   * driver reports it unusable. Opening retries with a fixed backoff.
   */
  public static class PostgresClient {
    private static final Logger LOG = LoggerFactory.getLogger(PostgresClient.class);

    private static final int DEFAULT_MAX_CONNECTION_ATTEMPTS = 200;
    private static final Duration DEFAULT_CONNECTION_RETRY_BACKOFF = Duration.ofSeconds(5);
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final String databaseName;
    private final String url;
    private final String user;
    private final String password;
    private final int maxConnectionAttempts;
    private final Duration connectionRetryBackoff;

    private Connection connection;
    private int connectionsOpened;

    PostgresClient(DatabaseClientConfig clientConfig) {
      this.databaseName = clientConfig.getName();
      this.url = clientConfig.getConnectionString();
      this.user =
          clientConfig
              .getUser()
              .orElseThrow(() -> new IllegalArgumentException("No user for " + databaseName));
      this.password =
          clientConfig
              .getPassword()
              .orElseThrow(() -> new IllegalArgumentException("No password for " + databaseName));
      this.maxConnectionAttempts =
          clientConfig.getMaxConnectionAttempts().orElse(DEFAULT_MAX_CONNECTION_ATTEMPTS);
      this.connectionRetryBackoff =
          clientConfig.getConnectionRetryBackoff().orElse(DEFAULT_CONNECTION_RETRY_BACKOFF);
    }

    public synchronized Connection getConnection() {
      try {
        if (connection != null && !isUsable(connection)) {
          LOG.info("Connection to database {} is no longer usable, reopening", databaseName);
          discardConnection();
        }
        if (connection == null) {
          connection = connect();
        }
        return connection;
      } catch (SQLException e) {
        throw new RuntimeException(e);
      }
    }

    private boolean isUsable(Connection current) {
      try {
        return current.isValid(VALIDATION_TIMEOUT_SECONDS);
      } catch (SQLException e) {
        LOG.debug("Validation of the connection to {} failed", databaseName, e);
        return false;
      }
    }

    private Connection connect() throws SQLException {
      for (int attempt = 1; ; attempt++) {
        try {
          Connection opened = DriverManager.getConnection(url, user, password);
          connectionsOpened++;
          LOG.info("Opened connection #{} to database {}", connectionsOpened, databaseName);
          return opened;
        } catch (SQLException e) {
          if (attempt >= maxConnectionAttempts) {
            LOG.error(
                "Giving up on database {} after {} connection attempts", databaseName, attempt);
            throw e;
          }
          LOG.info(
              "Connection attempt {}/{} to database {} failed, retrying in {}",
              attempt,
              maxConnectionAttempts,
              databaseName,
              connectionRetryBackoff,
              e);
          backOff();
        }
      }
    }

    private void backOff() throws SQLException {
      try {
        Thread.sleep(connectionRetryBackoff.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SQLException("Interrupted while waiting to reconnect to " + databaseName, e);
      }
    }

    private void discardConnection() {
      try {
        connection.close();
      } catch (SQLException e) {
        LOG.warn("Failed to close the connection to database {}", databaseName, e);
      } finally {
        connection = null;
      }
    }
  }
}
