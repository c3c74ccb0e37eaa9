package relay.dead;

import relay.NotFoundException;
import relay.model.DeliveryStatus;
import relay.model.WebhookDelivery;
import relay.spi.ConnectionProvider;
import relay.spi.StatusStore;
import relay.util.Transactions;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative facade for listing, counting and requeueing webhook deliveries that
 * ended in {@code dlq} or {@code failed_auth}.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 *
 * @see StatusStore#queryDeliveries
 * @see StatusStore#countDeliveries
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final StatusStore statusStore;
  private final Clock clock;

  public DeadLetterManager(ConnectionProvider connectionProvider, StatusStore statusStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DeadLetterManager(ConnectionProvider connectionProvider, StatusStore statusStore) {
    this(connectionProvider, statusStore, Clock.systemUTC());
  }

  /**
   * Lists dead-lettered deliveries of an account.
   *
   * @param accountId the account
   * @param limit     maximum number of deliveries to return
   * @return deliveries in {@code dlq}, oldest first
   */
  public List<WebhookDelivery> list(String accountId, int limit) {
    return query(accountId, DeliveryStatus.DLQ, limit);
  }

  /**
   * Lists deliveries of an account that the CRM rejected with 401/403.
   */
  public List<WebhookDelivery> listAuthFailures(String accountId, int limit) {
    return query(accountId, DeliveryStatus.FAILED_AUTH, limit);
  }

  /**
   * Counts dead-lettered deliveries of an account.
   */
  public int count(String accountId) {
    Objects.requireNonNull(accountId, "accountId");
    return Transactions.withConnection(connectionProvider,
        conn -> statusStore.countDeliveries(conn, accountId, DeliveryStatus.DLQ));
  }

  /**
   * Re-enqueues a {@code dlq} or {@code failed_auth} delivery: it becomes {@code pending}
   * with a retry count of 0, a fresh retry window, and is due immediately.
   *
   * @param deliveryId the delivery to requeue
   * @return {@code true} if requeued, {@code false} if the delivery is in any other status
   * @throws NotFoundException if no delivery has this id
   */
  public boolean requeue(String deliveryId) {
    Objects.requireNonNull(deliveryId, "deliveryId");
    boolean requeued = Transactions.inTransaction(connectionProvider, conn -> {
      WebhookDelivery current = statusStore.findDelivery(conn, deliveryId)
          .orElseThrow(() -> new NotFoundException("delivery", deliveryId));
      if (!current.status().isRequeueable()) {
        return false;
      }
      return statusStore.updateDelivery(conn, current.requeued(clock.instant()), current.status(),
          "requeued by operator") > 0;
    });
    if (requeued) {
      logger.log(Level.INFO, "Requeued deliveryId={0}", deliveryId);
    }
    return requeued;
  }

  private List<WebhookDelivery> query(String accountId, DeliveryStatus status, int limit) {
    Objects.requireNonNull(accountId, "accountId");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return Transactions.withConnection(connectionProvider,
        conn -> statusStore.queryDeliveries(conn, accountId, status, limit));
  }
}
