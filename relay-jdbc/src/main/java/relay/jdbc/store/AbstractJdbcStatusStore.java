package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.model.DeliveryStatus;
import relay.model.Message;
import relay.model.MessageDirection;
import relay.model.MessageError;
import relay.model.MessageStatus;
import relay.model.StatusChange;
import relay.model.WebhookDelivery;
import relay.model.WebhookEventType;
import relay.spi.StatusStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static relay.jdbc.JdbcTemplate.instant;
import static relay.jdbc.JdbcTemplate.timestamp;

/**
 * Base JDBC status store with standard SQL implementations.
 *
 * <p>Three tables are used: {@code relay_message}, {@code relay_webhook_delivery} and
 * {@code relay_status_history}; see the scripts under {@code schema/}. Every status change
 * is a compare-and-set on the current status followed by one history insert on the same
 * connection, so callers get both or neither by running them in one transaction.
 *
 * <p>Subclasses override {@link #insertMessageIfAbsent} where the database offers an
 * insert that skips duplicates without failing the transaction. Register custom
 * implementations via {@code META-INF/services/relay.jdbc.store.AbstractJdbcStatusStore}.
 *
 * @see JdbcStatusStores
 */
public abstract class AbstractJdbcStatusStore implements StatusStore {
  protected static final String MESSAGE_TABLE = "relay_message";
  protected static final String DELIVERY_TABLE = "relay_webhook_delivery";
  protected static final String HISTORY_TABLE = "relay_status_history";
  protected static final String MESSAGE_ENTITY = "message";
  protected static final String DELIVERY_ENTITY = "delivery";
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String OPEN_STATUS_IN = "('" + DeliveryStatus.PENDING.code() + "','"
      + DeliveryStatus.RETRYING.code() + "','" + DeliveryStatus.DELIVERING.code() + "')";

  protected static final String MESSAGE_COLUMNS =
      "id, account_id, direction, idempotency_key, sender_id, recipient_id, message_text, "
          + "platform_message_id, status, retry_count, error_code, error_message, error_retryable, "
          + "created_at, updated_at, sent_at, delivered_at, read_at";

  protected static final String DELIVERY_COLUMNS =
      "id, account_id, event_type, message_id, payload, target_url, status, retry_count, "
          + "last_error, last_attempt_at, next_retry_at, delivered_at, window_started_at, "
          + "created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<Message> MESSAGE_ROW_MAPPER = rs -> {
    String errorCode = rs.getString("error_code");
    MessageError error = errorCode == null ? null
        : new MessageError(errorCode, rs.getString("error_message"), rs.getBoolean("error_retryable"));
    return new Message(
        rs.getString("id"),
        rs.getString("account_id"),
        MessageDirection.fromCode(rs.getString("direction")),
        rs.getString("idempotency_key"),
        rs.getString("sender_id"),
        rs.getString("recipient_id"),
        rs.getString("message_text"),
        rs.getString("platform_message_id"),
        MessageStatus.fromCode(rs.getString("status")),
        rs.getInt("retry_count"),
        error,
        instant(rs, "created_at"),
        instant(rs, "updated_at"),
        instant(rs, "sent_at"),
        instant(rs, "delivered_at"),
        instant(rs, "read_at"));
  };

  protected static final JdbcTemplate.RowMapper<WebhookDelivery> DELIVERY_ROW_MAPPER = rs -> new WebhookDelivery(
      rs.getString("id"),
      rs.getString("account_id"),
      WebhookEventType.fromCode(rs.getString("event_type")),
      rs.getString("message_id"),
      rs.getString("payload"),
      rs.getString("target_url"),
      DeliveryStatus.fromCode(rs.getString("status")),
      rs.getInt("retry_count"),
      rs.getString("last_error"),
      instant(rs, "last_attempt_at"),
      instant(rs, "next_retry_at"),
      instant(rs, "delivered_at"),
      instant(rs, "window_started_at"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  protected static final JdbcTemplate.RowMapper<StatusChange> HISTORY_ROW_MAPPER = rs -> new StatusChange(
      rs.getString("entity_id"),
      rs.getString("from_status"),
      rs.getString("to_status"),
      rs.getString("reason"),
      instant(rs, "occurred_at"));

  /**
   * Unique identifier for this status store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this status store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  // ── Messages ────────────────────────────────────────────────────

  /**
   * Inserts the message and its creating history entry. The default relies on the unique
   * constraints raising a duplicate-key error that leaves the transaction usable, as H2 does.
   */
  @Override
  public boolean insertMessageIfAbsent(Connection conn, Message message, String reason) {
    boolean inserted = JdbcTemplate.insertUnlessDuplicate(conn, insertMessageSql(""), messageInsertParams(message));
    if (inserted) {
      appendHistory(conn, MESSAGE_ENTITY, message.id(), null, message.status().code(), reason, message.createdAt());
    }
    return inserted;
  }

  /**
   * {@code INSERT} statement for a message row, with {@code verb} inserted after
   * {@code INSERT} (e.g. {@code "IGNORE "}).
   */
  protected String insertMessageSql(String verb) {
    return "INSERT " + verb + "INTO " + MESSAGE_TABLE + " (" + MESSAGE_COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
  }

  protected Object[] messageInsertParams(Message m) {
    MessageError error = m.error();
    return new Object[] {
        m.id(), m.accountId(), m.direction().code(), m.idempotencyKey(), m.senderId(),
        m.recipientId(), m.text(), m.platformMessageId(), m.status().code(), m.retryCount(),
        error == null ? null : error.code(),
        error == null ? null : truncate(error.message()),
        error == null ? null : error.retryable(),
        timestamp(m.createdAt()), timestamp(m.updatedAt()), timestamp(m.sentAt()),
        timestamp(m.deliveredAt()), timestamp(m.readAt())};
  }

  @Override
  public Optional<Message> findMessage(Connection conn, String messageId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + MESSAGE_COLUMNS + " FROM " + MESSAGE_TABLE + " WHERE id=?",
        MESSAGE_ROW_MAPPER, messageId);
  }

  @Override
  public Optional<Message> findMessageByIdempotencyKey(Connection conn, String accountId, String idempotencyKey) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + MESSAGE_COLUMNS + " FROM " + MESSAGE_TABLE + " WHERE account_id=? AND idempotency_key=?",
        MESSAGE_ROW_MAPPER, accountId, idempotencyKey);
  }

  @Override
  public Optional<Message> findMessageByPlatformId(Connection conn, String accountId, String platformMessageId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + MESSAGE_COLUMNS + " FROM " + MESSAGE_TABLE + " WHERE account_id=? AND platform_message_id=?",
        MESSAGE_ROW_MAPPER, accountId, platformMessageId);
  }

  @Override
  public int updateMessage(Connection conn, Message m, MessageStatus expected, String reason) {
    MessageError error = m.error();
    String sql = "UPDATE " + MESSAGE_TABLE + " SET status=?, retry_count=?, platform_message_id=?, "
        + "error_code=?, error_message=?, error_retryable=?, updated_at=?, sent_at=?, delivered_at=?, read_at=? "
        + "WHERE id=? AND status=?";
    int updated = JdbcTemplate.update(conn, sql,
        m.status().code(), m.retryCount(), m.platformMessageId(),
        error == null ? null : error.code(),
        error == null ? null : truncate(error.message()),
        error == null ? null : error.retryable(),
        timestamp(m.updatedAt()), timestamp(m.sentAt()), timestamp(m.deliveredAt()), timestamp(m.readAt()),
        m.id(), expected.code());
    if (updated > 0) {
      appendHistory(conn, MESSAGE_ENTITY, m.id(), expected.code(), m.status().code(), reason, m.updatedAt());
    }
    return updated;
  }

  @Override
  public List<StatusChange> messageHistory(Connection conn, String messageId) {
    return history(conn, MESSAGE_ENTITY, messageId);
  }

  @Override
  public List<Message> pollPendingMessages(Connection conn, Instant createdBefore, int limit) {
    String sql = "SELECT " + MESSAGE_COLUMNS + " FROM " + MESSAGE_TABLE
        + " WHERE status=? AND created_at < ? ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER,
        MessageStatus.PENDING.code(), timestamp(createdBefore), limit);
  }

  // ── Webhook deliveries ──────────────────────────────────────────

  @Override
  public void insertDelivery(Connection conn, WebhookDelivery d, String reason) {
    String sql = "INSERT INTO " + DELIVERY_TABLE + " (" + DELIVERY_COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        d.id(), d.accountId(), d.eventType().code(), d.messageId(), d.payload(), d.targetUrl(),
        d.status().code(), d.retryCount(), truncate(d.lastError()),
        timestamp(d.lastAttemptAt()), timestamp(d.nextRetryAt()), timestamp(d.deliveredAt()),
        timestamp(d.windowStartedAt()), timestamp(d.createdAt()), timestamp(updatedAt(d)));
    appendHistory(conn, DELIVERY_ENTITY, d.id(), null, d.status().code(), reason, d.createdAt());
  }

  @Override
  public Optional<WebhookDelivery> findDelivery(Connection conn, String deliveryId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + DELIVERY_COLUMNS + " FROM " + DELIVERY_TABLE + " WHERE id=?",
        DELIVERY_ROW_MAPPER, deliveryId);
  }

  @Override
  public int updateDelivery(Connection conn, WebhookDelivery d, DeliveryStatus expected, String reason) {
    String sql = "UPDATE " + DELIVERY_TABLE + " SET status=?, retry_count=?, last_error=?, "
        + "last_attempt_at=?, next_retry_at=?, delivered_at=?, window_started_at=?, updated_at=? "
        + "WHERE id=? AND status=?";
    int updated = JdbcTemplate.update(conn, sql,
        d.status().code(), d.retryCount(), truncate(d.lastError()),
        timestamp(d.lastAttemptAt()), timestamp(d.nextRetryAt()), timestamp(d.deliveredAt()),
        timestamp(d.windowStartedAt()), timestamp(updatedAt(d)),
        d.id(), expected.code());
    if (updated > 0) {
      appendHistory(conn, DELIVERY_ENTITY, d.id(), expected.code(), d.status().code(), reason, updatedAt(d));
    }
    return updated;
  }

  @Override
  public int deferDelivery(Connection conn, String deliveryId, Instant nextAt) {
    String sql = "UPDATE " + DELIVERY_TABLE + " SET next_retry_at=? WHERE id=? AND status IN ('"
        + DeliveryStatus.PENDING.code() + "','" + DeliveryStatus.RETRYING.code() + "')";
    return JdbcTemplate.update(conn, sql, timestamp(nextAt), deliveryId);
  }

  /**
   * Selects the oldest open delivery of each account, if it is due. Rows are ordered by
   * {@code seq}, the insertion sequence.
   */
  @Override
  public List<WebhookDelivery> pollDueDeliveries(Connection conn, Instant now, Instant staleBefore, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + DELIVERY_TABLE + " d"
        + " WHERE d.status IN " + OPEN_STATUS_IN
        + " AND d.seq = (SELECT MIN(o.seq) FROM " + DELIVERY_TABLE + " o"
        + " WHERE o.account_id = d.account_id AND o.status IN " + OPEN_STATUS_IN + ")"
        + " AND ((d.status IN ('" + DeliveryStatus.PENDING.code() + "','" + DeliveryStatus.RETRYING.code() + "')"
        + " AND d.next_retry_at <= ?)"
        + " OR (d.status = '" + DeliveryStatus.DELIVERING.code() + "' AND d.last_attempt_at < ?))"
        + " ORDER BY d.seq LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, timestamp(now), timestamp(staleBefore), limit);
  }

  @Override
  public boolean hasOpenDeliveries(Connection conn, String accountId) {
    String sql = "SELECT 1 FROM " + DELIVERY_TABLE + " WHERE account_id=? AND status IN " + OPEN_STATUS_IN
        + " LIMIT 1";
    return !JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE, accountId).isEmpty();
  }

  @Override
  public List<WebhookDelivery> queryDeliveries(Connection conn, String accountId, DeliveryStatus status, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + DELIVERY_TABLE
        + " WHERE account_id=? AND status=? ORDER BY seq LIMIT ?";
    return JdbcTemplate.query(conn, sql, DELIVERY_ROW_MAPPER, accountId, status.code(), limit);
  }

  @Override
  public int countDeliveries(Connection conn, String accountId, DeliveryStatus status) {
    String sql = "SELECT COUNT(*) FROM " + DELIVERY_TABLE + " WHERE account_id=? AND status=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt(1), accountId, status.code()).orElse(0);
  }

  @Override
  public List<StatusChange> deliveryHistory(Connection conn, String deliveryId) {
    return history(conn, DELIVERY_ENTITY, deliveryId);
  }

  // ── History ─────────────────────────────────────────────────────

  protected void appendHistory(Connection conn, String entityType, String entityId, String fromStatus,
      String toStatus, String reason, Instant at) {
    String sql = "INSERT INTO " + HISTORY_TABLE
        + " (entity_type, entity_id, from_status, to_status, reason, occurred_at) VALUES (?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql, entityType, entityId, fromStatus, toStatus, truncate(reason), timestamp(at));
  }

  private List<StatusChange> history(Connection conn, String entityType, String entityId) {
    String sql = "SELECT entity_id, from_status, to_status, reason, occurred_at FROM " + HISTORY_TABLE
        + " WHERE entity_type=? AND entity_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, HISTORY_ROW_MAPPER, entityType, entityId);
  }

  private static Instant updatedAt(WebhookDelivery d) {
    return d.updatedAt() != null ? d.updatedAt() : d.createdAt();
  }

  protected static String truncate(String value) {
    if (value == null || value.length() <= MAX_ERROR_LENGTH) {
      return value;
    }
    return value.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
