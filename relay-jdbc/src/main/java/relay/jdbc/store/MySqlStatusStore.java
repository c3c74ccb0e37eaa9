package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.model.Message;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL status store. Also compatible with TiDB.
 *
 * <p>Messages are inserted with {@code INSERT IGNORE}, which reports zero affected rows
 * when a unique key already holds the idempotency key or platform message id.
 */
public final class MySqlStatusStore extends AbstractJdbcStatusStore {

  public MySqlStatusStore() {
    super();
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean insertMessageIfAbsent(Connection conn, Message message, String reason) {
    int inserted = JdbcTemplate.update(conn, insertMessageSql("IGNORE "), messageInsertParams(message));
    if (inserted == 0) {
      return false;
    }
    appendHistory(conn, MESSAGE_ENTITY, message.id(), null, message.status().code(), reason, message.createdAt());
    return true;
  }
}
