package relay.idempotency;

import relay.StatusStoreException;
import relay.ValidationException;
import relay.model.Message;
import relay.model.MessageDirection;
import relay.spi.ConnectionProvider;
import relay.spi.StatusStore;
import relay.util.Transactions;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Grants each {@code (accountId, idempotencyKey)} pair to exactly one outbound message.
 *
 * <p>The reservation is a single insert guarded by the store's unique constraint; there
 * is no read-before-write. A losing caller reads back the winner's row. The insert and
 * its creating history entry commit together.
 */
public final class IdempotencyLedger {
  private static final Logger logger = Logger.getLogger(IdempotencyLedger.class.getName());

  static final String RESERVED_REASON = "reserved";

  private final ConnectionProvider connectionProvider;
  private final StatusStore statusStore;

  public IdempotencyLedger(ConnectionProvider connectionProvider, StatusStore statusStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.statusStore = Objects.requireNonNull(statusStore, "statusStore");
  }

  /**
   * Reserves the draft's idempotency key.
   *
   * @param draft a new outbound message carrying account id and key
   * @return the reservation; {@code isNew = false} means the key was already taken and
   *         the returned message is the existing one
   * @throws ValidationException  if the draft is not an outbound message with a key
   * @throws StatusStoreException if the store fails
   */
  public Reservation reserve(Message draft) {
    Objects.requireNonNull(draft, "draft");
    if (draft.direction() != MessageDirection.OUTBOUND) {
      throw new ValidationException("Only outbound messages carry an idempotency key");
    }
    String key = draft.idempotencyKey();
    if (key == null || key.isBlank()) {
      throw new ValidationException("idempotency_key must not be empty");
    }

    boolean inserted = Transactions.inTransaction(connectionProvider,
        conn -> statusStore.insertMessageIfAbsent(conn, draft, RESERVED_REASON));
    if (inserted) {
      return new Reservation(draft, true);
    }

    Message existing = Transactions.withConnection(connectionProvider,
        conn -> statusStore.findMessageByIdempotencyKey(conn, draft.accountId(), key))
        .orElseThrow(() -> new StatusStoreException(
            "Idempotency key collided but no message found for accountId=" + draft.accountId(), null));
    logger.log(Level.FINE, "Idempotency key already reserved by messageId={0}", existing.id());
    return new Reservation(existing, false);
  }
}
