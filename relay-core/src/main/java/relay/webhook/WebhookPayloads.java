package relay.webhook;

import relay.model.InboundEvent;
import relay.model.Message;
import relay.model.MessageError;
import relay.model.WebhookEventType;
import relay.util.JsonCodec;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the JSON bodies posted to CRM webhooks. Bodies carry event metadata and the
 * message text, never credentials or secrets. Timestamps are ISO-8601 UTC.
 */
public final class WebhookPayloads {
  private final JsonCodec jsonCodec;

  public WebhookPayloads(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public WebhookPayloads() {
    this(JsonCodec.getDefault());
  }

  /**
   * Body of a {@code message.received} event.
   */
  public String received(Message message, InboundEvent event) {
    Instant timestamp = event.timestamp() != null ? event.timestamp() : message.createdAt();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("event", WebhookEventType.MESSAGE_RECEIVED.code());
    body.put("message_id", message.id());
    body.put("account_id", message.accountId());
    body.put("sender_id", event.senderId());
    body.put("message", event.text());
    body.put("message_type", event.messageType());
    body.put("timestamp", timestamp.toString());
    body.put("platform_message_id", event.platformMessageId());
    body.put("conversation_id", event.conversationId());
    return jsonCodec.toJson(body);
  }

  /**
   * Body of a delivery-status event ({@code message.sent|delivered|read|failed}).
   */
  public String status(Message message, WebhookEventType eventType) {
    if (eventType == WebhookEventType.MESSAGE_RECEIVED) {
      throw new IllegalArgumentException("message.received is not a status event");
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("event", eventType.code());
    body.put("message_id", message.id());
    body.put("account_id", message.accountId());
    body.put("recipient_id", message.recipientId());
    body.put("status", message.status().code());
    body.put("timestamp", message.updatedAt().toString());
    body.put("platform_message_id", message.platformMessageId());
    body.put("error", error(message.error()));
    return jsonCodec.toJson(body);
  }

  private static Map<String, Object> error(MessageError error) {
    if (error == null) {
      return null;
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("code", error.code());
    body.put("message", error.message());
    body.put("retryable", error.retryable());
    return body;
  }
}
