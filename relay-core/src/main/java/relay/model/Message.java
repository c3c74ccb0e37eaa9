package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one inbound or outbound message.
 *
 * <p>Transition methods return a new snapshot; persisting it is the job of
 * {@link relay.spi.StatusStore#updateMessage}.
 */
public record Message(
    String id,
    String accountId,
    MessageDirection direction,
    String idempotencyKey,
    String senderId,
    String recipientId,
    String text,
    String platformMessageId,
    MessageStatus status,
    int retryCount,
    MessageError error,
    Instant createdAt,
    Instant updatedAt,
    Instant sentAt,
    Instant deliveredAt,
    Instant readAt
) {

  public Message {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(accountId, "accountId");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /** A new outbound message, reserved but not yet handed to the platform. */
  public static Message outbound(String id, String accountId, String idempotencyKey,
      String recipientId, String text, Instant now) {
    return new Message(id, accountId, MessageDirection.OUTBOUND, idempotencyKey, null,
        recipientId, text, null, MessageStatus.PENDING, 0, null, now, now, null, null, null);
  }

  /** A message received from the platform. */
  public static Message inbound(String id, String accountId, InboundEvent event, Instant now) {
    return new Message(id, accountId, MessageDirection.INBOUND, null, event.senderId(),
        event.recipientId(), event.text(), event.platformMessageId(), MessageStatus.RECEIVED,
        0, null, now, now, null, null, null);
  }

  public Message sending(Instant at) {
    return new Message(id, accountId, direction, idempotencyKey, senderId, recipientId, text,
        platformMessageId, MessageStatus.SENDING, retryCount, error, createdAt, at,
        sentAt, deliveredAt, readAt);
  }

  /** Records a transient failure; the message stays in {@code sending}. */
  public Message retrying(MessageError failure, Instant at) {
    return new Message(id, accountId, direction, idempotencyKey, senderId, recipientId, text,
        platformMessageId, MessageStatus.SENDING, retryCount + 1, failure, createdAt, at,
        sentAt, deliveredAt, readAt);
  }

  public Message sent(String platformId, Instant at) {
    return new Message(id, accountId, direction, idempotencyKey, senderId, recipientId, text,
        platformId, MessageStatus.SENT, retryCount, null, createdAt, at,
        at, deliveredAt, readAt);
  }

  public Message failed(MessageError failure, Instant at) {
    return new Message(id, accountId, direction, idempotencyKey, senderId, recipientId, text,
        platformMessageId, MessageStatus.FAILED, retryCount, failure, createdAt, at,
        sentAt, deliveredAt, readAt);
  }

  public Message delivered(Instant at) {
    return new Message(id, accountId, direction, idempotencyKey, senderId, recipientId, text,
        platformMessageId, MessageStatus.DELIVERED, retryCount, error, createdAt, at,
        sentAt, at, readAt);
  }

  public Message read(Instant at) {
    return new Message(id, accountId, direction, idempotencyKey, senderId, recipientId, text,
        platformMessageId, MessageStatus.READ, retryCount, error, createdAt, at,
        sentAt, deliveredAt, at);
  }
}
