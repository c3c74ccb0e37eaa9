package relay.model;

import java.util.Optional;

/**
 * Event names sent to the CRM in the {@code event} field of a webhook body.
 */
public enum WebhookEventType {
  MESSAGE_RECEIVED("message.received"),
  MESSAGE_SENT("message.sent"),
  MESSAGE_DELIVERED("message.delivered"),
  MESSAGE_READ("message.read"),
  MESSAGE_FAILED("message.failed");

  private final String code;

  WebhookEventType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Maps an outbound message status to the event announcing it. Statuses the CRM
   * is not told about ({@code pending}, {@code sending}) map to empty.
   */
  public static Optional<WebhookEventType> forStatus(MessageStatus status) {
    return switch (status) {
      case SENT -> Optional.of(MESSAGE_SENT);
      case DELIVERED -> Optional.of(MESSAGE_DELIVERED);
      case READ -> Optional.of(MESSAGE_READ);
      case FAILED -> Optional.of(MESSAGE_FAILED);
      default -> Optional.empty();
    };
  }

  public static WebhookEventType fromCode(String code) {
    for (WebhookEventType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown webhook event type: " + code);
  }
}
