package relay.outbound;

import relay.model.Message;
import relay.model.WebhookEventType;

import java.sql.Connection;

/**
 * Receives outbound status changes inside the transaction that records them.
 *
 * <p>Implementations must only write through {@code conn}; the event is committed or
 * rolled back together with the status change.
 *
 * @see relay.inbound.DeliveryStatusRelay
 */
@FunctionalInterface
public interface StatusEventSink {

    /** Discards every event. */
    StatusEventSink NONE = (conn, message, eventType) -> { };

    /**
     * @param conn      connection of the open transaction
     * @param message   the message after the transition
     * @param eventType the event announcing the new status
     */
    void publish(Connection conn, Message message, WebhookEventType eventType);
}
