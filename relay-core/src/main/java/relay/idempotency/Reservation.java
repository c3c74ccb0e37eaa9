package relay.idempotency;

import relay.model.Message;

/**
 * Result of {@link IdempotencyLedger#reserve}.
 *
 * @param message the message now owning the key
 * @param isNew   {@code true} only for the single caller whose insert won
 */
public record Reservation(Message message, boolean isNew) {
}
