package relay.model;

import java.time.Instant;

/**
 * One entry of the append-only status history of a message or webhook delivery.
 *
 * @param entityId   message or delivery id
 * @param fromStatus status before the change, {@code null} for the creating entry
 * @param toStatus   status after the change
 * @param reason     short description of what caused the change
 * @param occurredAt when the change was recorded
 */
public record StatusChange(
    String entityId,
    String fromStatus,
    String toStatus,
    String reason,
    Instant occurredAt
) {}
