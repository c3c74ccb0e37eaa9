package relay.util;

import relay.StatusStoreException;
import relay.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs units of work on a fresh connection, either in autocommit mode or inside a
 * single transaction that is rolled back on any failure.
 */
public final class Transactions {
  private static final Logger logger = Logger.getLogger(Transactions.class.getName());

  private Transactions() {
  }

  /** Work that runs against an open connection. */
  @FunctionalInterface
  public interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  /**
   * Runs {@code work} in one transaction and commits it.
   *
   * @throws StatusStoreException if a connection cannot be obtained or the work fails
   *                              with an {@link SQLException}
   */
  public static <T> T inTransaction(ConnectionProvider provider, SqlWork<T> work) {
    try (Connection conn = provider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    } catch (SQLException e) {
      throw new StatusStoreException("Transaction failed", e);
    }
  }

  /**
   * Runs {@code work} on an autocommit connection.
   *
   * @throws StatusStoreException on {@link SQLException}
   */
  public static <T> T withConnection(ConnectionProvider provider, SqlWork<T> work) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(true);
      return work.execute(conn);
    } catch (SQLException e) {
      throw new StatusStoreException("Statement failed", e);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Could not restore autocommit", e);
    }
  }
}
