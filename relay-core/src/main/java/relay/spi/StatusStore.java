package relay.spi;

import relay.model.DeliveryStatus;
import relay.model.Message;
import relay.model.MessageStatus;
import relay.model.StatusChange;
import relay.model.WebhookDelivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of messages and webhook deliveries together with their
 * append-only status history.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Every insert and every successful update appends exactly
 * one {@link StatusChange}; callers run the write and the history append in one
 * transaction. Updates are compare-and-set on the current status: they return
 * {@code 0} when the stored status is no longer the expected one.
 *
 * @see relay.jdbc.store.AbstractJdbcStatusStore
 */
public interface StatusStore {

    // ── Messages ────────────────────────────────────────────────────

    /**
     * Inserts a message unless one with the same {@code (accountId, idempotencyKey)} or
     * {@code (accountId, platformMessageId)} already exists. A collision is not an error.
     *
     * @param conn    the JDBC connection
     * @param message the message to insert
     * @param reason  history reason for the creating entry
     * @return {@code true} if inserted, {@code false} if an equal key already existed
     */
    boolean insertMessageIfAbsent(Connection conn, Message message, String reason);

    Optional<Message> findMessage(Connection conn, String messageId);

    Optional<Message> findMessageByIdempotencyKey(Connection conn, String accountId, String idempotencyKey);

    Optional<Message> findMessageByPlatformId(Connection conn, String accountId, String platformMessageId);

    /**
     * Writes the mutable fields of {@code updated} if the stored status equals
     * {@code expected}, and appends a history entry.
     *
     * @return the number of rows updated (0 or 1)
     */
    int updateMessage(Connection conn, Message updated, MessageStatus expected, String reason);

    /**
     * Returns the status history of a message, oldest first.
     */
    List<StatusChange> messageHistory(Connection conn, String messageId);

    /**
     * Returns {@code pending} messages created before {@code createdBefore}, oldest first.
     * These were reserved but never handed to the platform.
     */
    List<Message> pollPendingMessages(Connection conn, Instant createdBefore, int limit);

    // ── Webhook deliveries ──────────────────────────────────────────

    /**
     * Inserts a new delivery. Deliveries are ordered by insertion within an account.
     */
    void insertDelivery(Connection conn, WebhookDelivery delivery, String reason);

    Optional<WebhookDelivery> findDelivery(Connection conn, String deliveryId);

    /**
     * Compare-and-set update of a delivery, appending a history entry.
     *
     * @return the number of rows updated (0 or 1)
     */
    int updateDelivery(Connection conn, WebhookDelivery updated, DeliveryStatus expected, String reason);

    /**
     * Pushes back the next attempt of an open delivery without changing its status
     * or retry count. Not a status transition, so no history is written.
     *
     * @return the number of rows updated (0 or 1)
     */
    int deferDelivery(Connection conn, String deliveryId, Instant nextAt);

    /**
     * Returns deliveries due for an attempt, at most one per account: the oldest open
     * delivery of the account, provided it is pending or retrying with
     * {@code next_retry_at <= now}, or delivering with {@code last_attempt_at} before
     * {@code staleBefore}.
     *
     * @param conn        the JDBC connection
     * @param now         current time
     * @param staleBefore claims older than this are considered abandoned
     * @param limit       maximum number of deliveries to return
     * @return due deliveries in arrival order
     */
    List<WebhookDelivery> pollDueDeliveries(Connection conn, Instant now, Instant staleBefore, int limit);

    /**
     * Returns whether the account has pending, retrying or delivering deliveries.
     */
    boolean hasOpenDeliveries(Connection conn, String accountId);

    /**
     * Lists deliveries of an account in a given status, oldest first.
     */
    List<WebhookDelivery> queryDeliveries(Connection conn, String accountId, DeliveryStatus status, int limit);

    int countDeliveries(Connection conn, String accountId, DeliveryStatus status);

    /**
     * Returns the status history of a delivery, oldest first.
     */
    List<StatusChange> deliveryHistory(Connection conn, String deliveryId);
}
