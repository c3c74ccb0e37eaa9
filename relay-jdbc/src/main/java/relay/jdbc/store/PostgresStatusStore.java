package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.model.Message;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL status store.
 *
 * <p>A failed statement aborts the whole PostgreSQL transaction, so messages are inserted
 * with {@code ON CONFLICT DO NOTHING} rather than by catching the unique violation.
 */
public final class PostgresStatusStore extends AbstractJdbcStatusStore {

  public PostgresStatusStore() {
    super();
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertMessageIfAbsent(Connection conn, Message message, String reason) {
    String sql = insertMessageSql("") + " ON CONFLICT DO NOTHING";
    int inserted = JdbcTemplate.update(conn, sql, messageInsertParams(message));
    if (inserted == 0) {
      return false;
    }
    appendHistory(conn, MESSAGE_ENTITY, message.id(), null, message.status().code(), reason, message.createdAt());
    return true;
  }
}
