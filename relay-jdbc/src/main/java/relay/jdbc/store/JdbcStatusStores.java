package relay.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC status stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/relay.jdbc.store.AbstractJdbcStatusStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcStatusStore store = JdbcStatusStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcStatusStore store = JdbcStatusStores.detect("jdbc:mysql://localhost/crm_relay");
 *
 * // Get by name
 * AbstractJdbcStatusStore store = JdbcStatusStores.get("postgresql");
 * }</pre>
 */
public final class JdbcStatusStores {
  private static final List<AbstractJdbcStatusStore> STORES;
  private static final Map<String, AbstractJdbcStatusStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcStatusStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcStatusStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcStatusStores() {
  }

  /**
   * Returns all registered status stores.
   */
  public static List<AbstractJdbcStatusStore> all() {
    return STORES;
  }

  /**
   * Gets a status store by name.
   *
   * @param name status store name (case-insensitive)
   * @return the status store
   * @throws IllegalArgumentException if no status store is registered under that name
   */
  public static AbstractJdbcStatusStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcStatusStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown status store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the status store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   */
  public static AbstractJdbcStatusStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect status store from DataSource", e);
    }
  }

  /**
   * Auto-detects the status store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcStatusStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcStatusStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No status store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
