package relay.inbound;

import relay.NotFoundException;
import relay.StatusStoreException;
import relay.ValidationException;
import relay.model.Account;
import relay.model.InboundEvent;
import relay.model.Message;
import relay.model.WebhookDelivery;
import relay.model.WebhookEventType;
import relay.retry.RetryEngine;
import relay.spi.AccountDirectory;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.StatusStore;
import relay.util.Ids;
import relay.util.Transactions;
import relay.webhook.AttemptOutcome;
import relay.webhook.WebhookClient;
import relay.webhook.WebhookPayloads;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists messages received from the platform and relays them to the CRM webhook.
 *
 * <p>For each event {@link #forward} stores the message as {@code received} together with
 * its {@code pending} webhook delivery in one transaction; a failure there surfaces to the
 * caller so the platform event is not acknowledged. The signed body then gets one
 * immediate POST with a short timeout, and its outcome is recorded on the stored delivery
 * through the {@link RetryEngine}. Until that attempt is over the delivery is held back
 * from the engine for twice the immediate timeout; if the process stops in between, the
 * engine picks it up afterwards.
 *
 * <p>Events of one account are handled one at a time in arrival order. While the account
 * still has open deliveries the immediate attempt is skipped and the new delivery queues
 * behind them, so the CRM sees events in the order they arrived.
 */
public final class InboundRelay {
  private static final Logger logger = Logger.getLogger(InboundRelay.class.getName());

  private final ConnectionProvider connectionProvider;
  private final StatusStore statusStore;
  private final AccountDirectory accountDirectory;
  private final WebhookClient webhookClient;
  private final RetryEngine retryEngine;
  private final WebhookPayloads payloads;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final Duration immediateTimeout;
  private final ConcurrentMap<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();

  private InboundRelay(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.statusStore = Objects.requireNonNull(builder.statusStore, "statusStore");
    this.accountDirectory = Objects.requireNonNull(builder.accountDirectory, "accountDirectory");
    this.webhookClient = Objects.requireNonNull(builder.webhookClient, "webhookClient");
    this.retryEngine = Objects.requireNonNull(builder.retryEngine, "retryEngine");
    this.payloads = builder.payloads != null ? builder.payloads : new WebhookPayloads();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    Objects.requireNonNull(builder.immediateTimeout, "immediateTimeout");
    if (builder.immediateTimeout.isNegative() || builder.immediateTimeout.isZero()) {
      throw new IllegalArgumentException("immediateTimeout must be > 0");
    }
    this.immediateTimeout = builder.immediateTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Stores and relays one platform event.
   *
   * @return the stored message; for a repeated platform message id, the one stored first
   * @throws ValidationException  if the event lacks a platform message id or sender
   * @throws NotFoundException    if the account is unknown
   * @throws StatusStoreException if the message cannot be stored; the event must then not
   *                              be acknowledged to the platform
   */
  public Message forward(String accountId, InboundEvent event) {
    if (accountId == null || accountId.isBlank()) {
      throw new ValidationException("account_id must not be empty");
    }
    Objects.requireNonNull(event, "event");
    if (event.platformMessageId() == null || event.platformMessageId().isBlank()) {
      throw new ValidationException("platform_message_id must not be empty");
    }
    if (event.senderId() == null || event.senderId().isBlank()) {
      throw new ValidationException("sender_id must not be empty");
    }
    Account account = accountDirectory.find(accountId)
        .orElseThrow(() -> new NotFoundException("account", accountId));

    ReentrantLock lock = accountLocks.computeIfAbsent(accountId, id -> new ReentrantLock());
    lock.lock();
    try {
      return persistAndRelay(account, event);
    } finally {
      lock.unlock();
    }
  }

  private Message persistAndRelay(Account account, InboundEvent event) {
    Instant now = clock.instant();
    Message message = Message.inbound(Ids.messageId(), account.id(), event, now);
    WebhookDelivery delivery = account.isActive() && account.hasWebhook()
        ? WebhookDelivery.create(Ids.deliveryId(), account.id(), WebhookEventType.MESSAGE_RECEIVED,
            message.id(), payloads.received(message, event), account.webhookUrl(), now)
        : null;
    WebhookDelivery held = delivery == null ? null : delivery.dueAt(now.plus(immediateTimeout.multipliedBy(2)));

    Staged staged = Transactions.inTransaction(connectionProvider, conn -> {
      if (!statusStore.insertMessageIfAbsent(conn, message, "received")) {
        return Staged.DUPLICATE;
      }
      if (delivery == null) {
        return Staged.NOT_RELAYED;
      }
      if (statusStore.hasOpenDeliveries(conn, account.id())) {
        retryEngine.enqueue(conn, delivery);
        return Staged.QUEUED;
      }
      retryEngine.enqueue(conn, held);
      return Staged.IMMEDIATE;
    });

    if (staged == Staged.DUPLICATE) {
      metrics.incrementInboundDuplicate();
      logger.log(Level.FINE, "Duplicate inbound platformMessageId={0} for accountId={1}",
          new Object[] {event.platformMessageId(), account.id()});
      return Transactions.withConnection(connectionProvider,
          conn -> statusStore.findMessageByPlatformId(conn, account.id(), event.platformMessageId()))
          .orElseThrow(() -> new StatusStoreException(
              "Inbound message collided but was not found: " + event.platformMessageId(), null));
    }
    metrics.incrementInboundReceived();

    switch (staged) {
      case NOT_RELAYED -> logger.log(Level.INFO,
          "Stored messageId={0}; accountId={1} has no active webhook, not relayed",
          new Object[] {message.id(), account.id()});
      case QUEUED -> logger.log(Level.FINE, "accountId={0} has open deliveries; queued deliveryId={1}",
          new Object[] {account.id(), delivery.id()});
      default -> attemptImmediately(account, message, held);
    }
    return message;
  }

  private void attemptImmediately(Account account, Message message, WebhookDelivery delivery) {
    Instant attemptedAt = clock.instant();
    AttemptOutcome outcome = webhookClient.post(delivery, account.webhookSecret(), immediateTimeout);
    try {
      retryEngine.recordAttempt(delivery, outcome, attemptedAt);
    } catch (StatusStoreException e) {
      // the delivery stays pending and the engine attempts it once the hold is over
      logger.log(Level.SEVERE, "Failed to record immediate attempt for deliveryId=" + delivery.id()
          + " outcome=" + outcome.kind(), e);
      return;
    }
    if (outcome.isDelivered()) {
      logger.log(Level.INFO, "Relayed messageId={0} to accountId={1}", new Object[] {message.id(), account.id()});
    }
  }

  private enum Staged {
    DUPLICATE,
    NOT_RELAYED,
    QUEUED,
    IMMEDIATE
  }

  /** Builder for {@link InboundRelay}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private StatusStore statusStore;
    private AccountDirectory accountDirectory;
    private WebhookClient webhookClient;
    private RetryEngine retryEngine;
    private WebhookPayloads payloads;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration immediateTimeout = Duration.ofSeconds(2);

    private Builder() {}

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder statusStore(StatusStore statusStore) {
      this.statusStore = statusStore;
      return this;
    }

    public Builder accountDirectory(AccountDirectory accountDirectory) {
      this.accountDirectory = accountDirectory;
      return this;
    }

    public Builder webhookClient(WebhookClient webhookClient) {
      this.webhookClient = webhookClient;
      return this;
    }

    /**
     * Engine that takes over deliveries whose immediate attempt failed. <b>Required.</b>
     */
    public Builder retryEngine(RetryEngine retryEngine) {
      this.retryEngine = retryEngine;
      return this;
    }

    public Builder payloads(WebhookPayloads payloads) {
      this.payloads = payloads;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Timeout of the immediate attempt. Optional, defaults to 2 seconds.
     */
    public Builder immediateTimeout(Duration immediateTimeout) {
      this.immediateTimeout = immediateTimeout;
      return this;
    }

    public InboundRelay build() {
      return new InboundRelay(this);
    }
  }
}
