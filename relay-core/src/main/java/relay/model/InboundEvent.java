package relay.model;

import java.time.Instant;

/**
 * A message event received from the platform webhook, already parsed by the
 * HTTP layer.
 *
 * @param platformMessageId the platform's message id
 * @param senderId          PSID of the end user who wrote the message
 * @param recipientId       platform id of the business account
 * @param text              message text, may be {@code null} for attachments
 * @param messageType       {@code text} unless the platform says otherwise
 * @param timestamp         when the platform received the message
 */
public record InboundEvent(
    String platformMessageId,
    String senderId,
    String recipientId,
    String text,
    String messageType,
    Instant timestamp
) {

  public InboundEvent {
    if (messageType == null || messageType.isBlank()) {
      messageType = "text";
    }
  }

  public static InboundEvent text(String platformMessageId, String senderId, String recipientId,
      String text, Instant timestamp) {
    return new InboundEvent(platformMessageId, senderId, recipientId, text, "text", timestamp);
  }

  /** Groups messages of one sender/recipient pair. */
  public String conversationId() {
    return "conv_" + senderId + "_" + recipientId;
  }
}
