package relay.model;

import java.time.Instant;

/**
 * Answer to an outbound send request.
 *
 * @param messageId id of the (new or existing) message
 * @param status    provisional status at the time of the answer
 * @param createdAt when the message was first reserved
 * @param duplicate {@code true} if the idempotency key was already known
 */
public record SendReceipt(String messageId, MessageStatus status, Instant createdAt, boolean duplicate) {
}
