package relay.status;

import relay.NotFoundException;
import relay.model.Message;
import relay.model.StatusChange;
import relay.model.WebhookDelivery;
import relay.spi.ConnectionProvider;
import relay.spi.StatusStore;
import relay.util.Transactions;

import java.util.List;
import java.util.Objects;

/**
 * Read side for callers that track a send or a delivery after the fact.
 */
public final class StatusQueries {
  private final ConnectionProvider connectionProvider;
  private final StatusStore statusStore;

  public StatusQueries(ConnectionProvider connectionProvider, StatusStore statusStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
  }

  public Message message(String messageId) {
    return Transactions.withConnection(connectionProvider, conn -> statusStore.findMessage(conn, messageId))
        .orElseThrow(() -> new NotFoundException("message", messageId));
  }

  public Message messageByIdempotencyKey(String accountId, String idempotencyKey) {
    return Transactions.withConnection(connectionProvider,
            conn -> statusStore.findMessageByIdempotencyKey(conn, accountId, idempotencyKey))
        .orElseThrow(() -> new NotFoundException("message", accountId + "/" + idempotencyKey));
  }

  /**
   * Status history of a message, oldest first.
   *
   * @throws NotFoundException if the message does not exist
   */
  public List<StatusChange> messageHistory(String messageId) {
    return Transactions.withConnection(connectionProvider, conn -> {
      if (statusStore.findMessage(conn, messageId).isEmpty()) {
        throw new NotFoundException("message", messageId);
      }
      return statusStore.messageHistory(conn, messageId);
    });
  }

  public WebhookDelivery delivery(String deliveryId) {
    return Transactions.withConnection(connectionProvider, conn -> statusStore.findDelivery(conn, deliveryId))
        .orElseThrow(() -> new NotFoundException("delivery", deliveryId));
  }

  /**
   * Status history of a webhook delivery, oldest first.
   *
   * @throws NotFoundException if the delivery does not exist
   */
  public List<StatusChange> deliveryHistory(String deliveryId) {
    return Transactions.withConnection(connectionProvider, conn -> {
      if (statusStore.findDelivery(conn, deliveryId).isEmpty()) {
        throw new NotFoundException("delivery", deliveryId);
      }
      return statusStore.deliveryHistory(conn, deliveryId);
    });
  }
}
