package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One event on its way to the CRM webhook, with its retry bookkeeping.
 *
 * <p>The {@code payload} is the exact JSON body sent on every attempt and never
 * changes. {@code windowStartedAt} marks the start of the retry window that ends
 * in the dead-letter queue; it equals {@code createdAt} unless the delivery was
 * requeued by an operator.
 */
public record WebhookDelivery(
    String id,
    String accountId,
    WebhookEventType eventType,
    String messageId,
    String payload,
    String targetUrl,
    DeliveryStatus status,
    int retryCount,
    String lastError,
    Instant lastAttemptAt,
    Instant nextRetryAt,
    Instant deliveredAt,
    Instant windowStartedAt,
    Instant createdAt,
    Instant updatedAt
) {

  public WebhookDelivery {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(accountId, "accountId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(targetUrl, "targetUrl");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /** A new delivery, due immediately. */
  public static WebhookDelivery create(String id, String accountId, WebhookEventType eventType,
      String messageId, String payload, String targetUrl, Instant now) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.PENDING, 0, null, null, now, null, now, now, now);
  }

  public WebhookDelivery claimed(Instant at) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.DELIVERING, retryCount, lastError, at, null, deliveredAt,
        windowStartedAt, createdAt, at);
  }

  public WebhookDelivery delivered(Instant attemptedAt, Instant at) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.DELIVERED, retryCount, lastError, attemptedAt, null, at,
        windowStartedAt, createdAt, at);
  }

  public WebhookDelivery retrying(String error, Instant attemptedAt, Instant nextAt) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.RETRYING, retryCount + 1, error, attemptedAt, nextAt, deliveredAt,
        windowStartedAt, createdAt, attemptedAt);
  }

  public WebhookDelivery deadLettered(String error, Instant attemptedAt) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.DLQ, retryCount + 1, error, attemptedAt, null, deliveredAt,
        windowStartedAt, createdAt, attemptedAt);
  }

  public WebhookDelivery authFailed(String error, Instant attemptedAt) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.FAILED_AUTH, retryCount, error, attemptedAt, null, deliveredAt,
        windowStartedAt, createdAt, attemptedAt);
  }

  /**
   * Hands back an abandoned claim as {@code pending}, due at {@code at}. The attempt's
   * outcome is unknown, so the retry count is kept.
   */
  public WebhookDelivery released(Instant at) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.PENDING, retryCount, lastError, lastAttemptAt, at, deliveredAt,
        windowStartedAt, createdAt, at);
  }

  /** Same delivery, not due before {@code at}. */
  public WebhookDelivery dueAt(Instant at) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        status, retryCount, lastError, lastAttemptAt, at, deliveredAt,
        windowStartedAt, createdAt, updatedAt);
  }

  /** Dead-letters an open delivery whose retry window closed before its next attempt. */
  public WebhookDelivery expired(Instant at) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.DLQ, retryCount, lastError, lastAttemptAt, null, deliveredAt,
        windowStartedAt, createdAt, at);
  }

  /** Reopens a dead-lettered or auth-failed delivery with a fresh retry window. */
  public WebhookDelivery requeued(Instant at) {
    return new WebhookDelivery(id, accountId, eventType, messageId, payload, targetUrl,
        DeliveryStatus.PENDING, 0, lastError, lastAttemptAt, at, null, at, createdAt, at);
  }
}
