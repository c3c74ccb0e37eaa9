package relay.outbound;

import relay.AuthException;
import relay.NotFoundException;
import relay.PermanentDeliveryException;
import relay.PlatformException;
import relay.StatusStoreException;
import relay.TransientException;
import relay.ValidationException;
import relay.idempotency.IdempotencyLedger;
import relay.idempotency.Reservation;
import relay.model.Account;
import relay.model.Message;
import relay.model.MessageError;
import relay.model.MessageStatus;
import relay.model.SendReceipt;
import relay.model.WebhookEventType;
import relay.retry.ExponentialBackoffRetryPolicy;
import relay.retry.RetryPolicy;
import relay.spi.AccountDirectory;
import relay.spi.Alert;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.OperatorAlerts;
import relay.spi.PlatformClient;
import relay.spi.PlatformReceipt;
import relay.spi.StatusStore;
import relay.util.DaemonThreadFactory;
import relay.util.Ids;
import relay.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns CRM send requests into platform API calls.
 *
 * <p>{@link #send} validates the request, reserves the idempotency key and returns at once
 * with a provisional status. A duplicate key returns the existing message without calling
 * the platform. For a new message a worker moves it {@code pending -> sending} and calls
 * the platform:
 * <ul>
 *   <li>success: {@code sent} with the platform message id;</li>
 *   <li>{@link TransientException} (or any unexpected runtime failure): retried up to
 *       {@code maxRetries} times with backoff, then {@code failed} with
 *       {@code retryable = true};</li>
 *   <li>{@link PermanentDeliveryException} or {@link AuthException}: {@code failed} with
 *       {@code retryable = false}, no retry; an auth failure also alerts the operator.</li>
 * </ul>
 *
 * <p>Backoff waits are scheduled on the worker pool, never slept. Transitions to
 * {@code sent}, {@code delivered}, {@code read} and {@code failed} are handed to the
 * {@link StatusEventSink} in the transaction that records them.
 *
 * <p>Once {@link #start()}ed, a periodic sweep hands messages still {@code pending} after
 * the pending grace period back to the workers (see {@link #redispatchPending()}).
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class OutboundDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboundDispatcher.class.getName());

  public static final int MAX_TEXT_LENGTH = 1000;

  private final ConnectionProvider connectionProvider;
  private final StatusStore statusStore;
  private final AccountDirectory accountDirectory;
  private final PlatformClient platformClient;
  private final IdempotencyLedger ledger;
  private final StatusEventSink statusEvents;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final OperatorAlerts alerts;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;
  private final Duration pendingGrace;
  private final long sweepIntervalMs;
  private final int sweepBatchSize;
  private final ScheduledExecutorService workers;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private ScheduledFuture<?> sweepTask;

  private OutboundDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.statusStore = Objects.requireNonNull(builder.statusStore, "statusStore");
    this.accountDirectory = Objects.requireNonNull(builder.accountDirectory, "accountDirectory");
    this.platformClient = Objects.requireNonNull(builder.platformClient, "platformClient");
    this.ledger = new IdempotencyLedger(connectionProvider, statusStore);
    this.statusEvents = builder.statusEvents != null ? builder.statusEvents : StatusEventSink.NONE;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 4000);
    this.alerts = builder.alerts != null ? builder.alerts : OperatorAlerts.LOGGING;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    Objects.requireNonNull(builder.pendingGrace, "pendingGrace");
    if (builder.pendingGrace.isNegative()) {
      throw new IllegalArgumentException("pendingGrace must be >= 0");
    }
    if (builder.sweepIntervalMs <= 0L) {
      throw new IllegalArgumentException("sweepIntervalMs must be > 0");
    }
    if (builder.sweepBatchSize <= 0) {
      throw new IllegalArgumentException("sweepBatchSize must be > 0");
    }
    this.maxRetries = builder.maxRetries;
    this.pendingGrace = builder.pendingGrace;
    this.sweepIntervalMs = builder.sweepIntervalMs;
    this.sweepBatchSize = builder.sweepBatchSize;
    this.workers = Executors.newScheduledThreadPool(builder.workerCount,
        new DaemonThreadFactory("relay-dispatcher-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Accepts a send request.
   *
   * @return the message id and its current status; {@code duplicate} is set when the
   *         idempotency key was already used by this account
   * @throws ValidationException  on blank fields, text over {@value #MAX_TEXT_LENGTH}
   *                              characters, or an inactive account
   * @throws NotFoundException    if the account is unknown
   * @throws StatusStoreException if the reservation cannot be stored
   */
  public SendReceipt send(String accountId, String recipientId, String text, String idempotencyKey) {
    requireText(accountId, "account_id");
    requireText(recipientId, "recipient_id");
    requireText(text, "text");
    requireText(idempotencyKey, "idempotency_key");
    if (text.length() > MAX_TEXT_LENGTH) {
      throw new ValidationException("text must be at most " + MAX_TEXT_LENGTH + " characters");
    }
    Account account = accountDirectory.find(accountId)
        .orElseThrow(() -> new NotFoundException("account", accountId));

    if (!account.isActive()) {
      // a retried request for a send accepted before deactivation still gets its answer
      Optional<Message> existing = Transactions.withConnection(connectionProvider,
          conn -> statusStore.findMessageByIdempotencyKey(conn, accountId, idempotencyKey));
      if (existing.isPresent()) {
        return duplicate(existing.get());
      }
      throw new ValidationException("account " + accountId + " is inactive");
    }
    if (!accepting.get()) {
      throw new IllegalStateException("OutboundDispatcher has been closed");
    }

    Message draft = Message.outbound(Ids.messageId(), accountId, idempotencyKey, recipientId, text,
        clock.instant());
    Reservation reservation = ledger.reserve(draft);
    if (!reservation.isNew()) {
      return duplicate(reservation.message());
    }

    Message message = reservation.message();
    metrics.incrementSendAccepted();
    logger.log(Level.INFO, "Accepted messageId={0} accountId={1}", new Object[] {message.id(), accountId});
    try {
      workers.execute(() -> firstAttempt(message));
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Dispatcher closed before messageId=" + message.id()
          + " was sent; it stays pending until the next sweep", e);
    }
    return new SendReceipt(message.id(), message.status(), message.createdAt(), false);
  }

  private SendReceipt duplicate(Message existing) {
    metrics.incrementSendDuplicate();
    logger.log(Level.FINE, "Duplicate send for messageId={0}", existing.id());
    return new SendReceipt(existing.id(), existing.status(), existing.createdAt(), true);
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " must not be empty");
    }
  }

  // ── Stranded reservations ───────────────────────────────────────

  /**
   * Starts the periodic sweep for stranded {@code pending} messages. Subsequent calls are
   * no-ops.
   */
  public synchronized void start() {
    if (!accepting.get()) {
      throw new IllegalStateException("OutboundDispatcher has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    sweepTask = workers.scheduleWithFixedDelay(this::safeRedispatch, sweepIntervalMs, sweepIntervalMs,
        TimeUnit.MILLISECONDS);
  }

  private void safeRedispatch() {
    try {
      redispatchPending();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Pending message sweep failed", t);
    }
  }

  /**
   * Hands messages that are still {@code pending} after the pending grace period back to
   * the workers. A message stays {@code pending} only when its first attempt never ran,
   * e.g. the worker pool rejected it or marking it {@code sending} failed, so the platform
   * was not called for it. A message already picked up elsewhere loses the
   * {@code pending -> sending} compare-and-set and is skipped.
   *
   * @return the number of messages handed to the workers
   */
  public int redispatchPending() {
    if (!accepting.get()) {
      return 0;
    }
    Instant cutoff = clock.instant().minus(pendingGrace);
    List<Message> stranded = Transactions.withConnection(connectionProvider,
        conn -> statusStore.pollPendingMessages(conn, cutoff, sweepBatchSize));
    int submitted = 0;
    for (Message message : stranded) {
      logger.log(Level.WARNING, "Re-dispatching messageId={0} still pending since {1}",
          new Object[] {message.id(), message.createdAt()});
      try {
        workers.execute(() -> firstAttempt(message));
      } catch (RejectedExecutionException e) {
        logger.log(Level.FINE, "Dispatcher closed during pending message sweep", e);
        break;
      }
      submitted++;
    }
    return submitted;
  }

  // ── Platform attempts ───────────────────────────────────────────

  private void firstAttempt(Message reserved) {
    Message sending = reserved.sending(clock.instant());
    try {
      if (!transition(sending, MessageStatus.PENDING, "dispatching")) {
        return;
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark messageId=" + reserved.id()
          + " sending; left pending for the next sweep", e);
      return;
    }
    attempt(sending);
  }

  private void attempt(Message sending) {
    try {
      callPlatform(sending);
    } catch (RuntimeException e) {
      // the message stays sending; it is never sent twice
      logger.log(Level.SEVERE, "Failed to record send result for messageId=" + sending.id(), e);
    }
  }

  private void callPlatform(Message sending) {
    PlatformReceipt receipt;
    try {
      receipt = platformClient.send(sending.accountId(), sending.recipientId(), sending.text());
    } catch (TransientException e) {
      onTransientFailure(sending, e.code(), e.getMessage());
      return;
    } catch (PermanentDeliveryException e) {
      fail(sending, e);
      return;
    } catch (AuthException e) {
      fail(sending, e);
      raise(new Alert(Alert.Kind.PLATFORM_AUTH_FAILED, sending.accountId(), sending.id(), e.code()));
      return;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Unexpected platform failure for messageId=" + sending.id(), e);
      onTransientFailure(sending, "unexpected", e.getClass().getSimpleName());
      return;
    }
    Message sent = sending.sent(receipt.platformMessageId(), clock.instant());
    if (transition(sent, MessageStatus.SENDING, "sent")) {
      metrics.incrementSendSucceeded();
      logger.log(Level.INFO, "Sent messageId={0} platformMessageId={1}",
          new Object[] {sent.id(), sent.platformMessageId()});
    }
  }

  private void onTransientFailure(Message sending, String code, String detail) {
    MessageError error = new MessageError(code, detail, true);
    Instant now = clock.instant();
    if (sending.retryCount() >= maxRetries) {
      fail(sending, error);
      return;
    }
    Message retrying = sending.retrying(error, now);
    if (!transition(retrying, MessageStatus.SENDING, "transient failure: " + code)) {
      return;
    }
    long delayMs = retryPolicy.computeDelayMs(retrying.retryCount());
    metrics.incrementSendRetried();
    logger.log(Level.WARNING, "Transient failure for messageId={0} ({1}); retry {2} in {3}ms",
        new Object[] {sending.id(), code, retrying.retryCount(), delayMs});
    try {
      workers.schedule(() -> attempt(retrying), delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.SEVERE, "Dispatcher closed before retry of messageId=" + sending.id(), e);
    }
  }

  private void fail(Message sending, PlatformException failure) {
    fail(sending, new MessageError(failure.code(), failure.getMessage(), failure.retryable()));
  }

  private void fail(Message sending, MessageError error) {
    Message failed = sending.failed(error, clock.instant());
    if (transition(failed, MessageStatus.SENDING, "failed: " + error.code())) {
      metrics.incrementSendFailed();
      logger.log(Level.SEVERE, "Send failed for messageId=" + failed.id() + " accountId="
          + failed.accountId() + " code=" + error.code() + " retryable=" + error.retryable()
          + " retries=" + failed.retryCount());
    }
  }

  // ── Platform receipts ───────────────────────────────────────────

  /**
   * Applies a delivery or read receipt from the platform. Status only moves forward along
   * {@code sent -> delivered -> read}.
   *
   * @param receipt {@link MessageStatus#DELIVERED} or {@link MessageStatus#READ}
   * @return {@code true} if the message advanced; {@code false} for unknown messages,
   *         stale or repeated receipts
   */
  public boolean applyReceipt(String accountId, String platformMessageId, MessageStatus receipt, Instant at) {
    if (receipt != MessageStatus.DELIVERED && receipt != MessageStatus.READ) {
      throw new IllegalArgumentException("Receipts are delivered or read, got " + receipt);
    }
    Objects.requireNonNull(at, "at");
    Optional<Message> found = Transactions.withConnection(connectionProvider,
        conn -> statusStore.findMessageByPlatformId(conn, accountId, platformMessageId));
    if (found.isEmpty()) {
      logger.log(Level.FINE, "Receipt for unknown platformMessageId={0}", platformMessageId);
      return false;
    }
    Message current = found.get();
    if (!current.status().acceptsReceipt(receipt)) {
      return false;
    }
    Message next = receipt == MessageStatus.DELIVERED ? current.delivered(at) : current.read(at);
    return transition(next, current.status(), "receipt: " + receipt.code());
  }

  private boolean transition(Message next, MessageStatus expected, String reason) {
    return Transactions.inTransaction(connectionProvider, conn -> {
      if (statusStore.updateMessage(conn, next, expected, reason) == 0) {
        logger.log(Level.FINE, "messageId={0} no longer {1}; skipped", new Object[] {next.id(), expected.code()});
        return false;
      }
      Optional<WebhookEventType> event = WebhookEventType.forStatus(next.status());
      if (event.isPresent()) {
        statusEvents.publish(conn, next, event.get());
      }
      return true;
    });
  }

  private void raise(Alert alert) {
    try {
      alerts.raise(alert);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Operator alert sink failed for " + alert, e);
    }
  }

  /**
   * Stops accepting sends and waits up to the drain timeout for running attempts and
   * scheduled retries. Messages cut off by the timeout stay {@code sending}.
   */
  @Override
  public void close() {
    accepting.set(false);
    synchronized (this) {
      if (sweepTask != null) {
        sweepTask.cancel(false);
        sweepTask = null;
      }
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing dispatcher shutdown");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link OutboundDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private StatusStore statusStore;
    private AccountDirectory accountDirectory;
    private PlatformClient platformClient;
    private StatusEventSink statusEvents;
    private RetryPolicy retryPolicy;
    private int maxRetries = 3;
    private int workerCount = 4;
    private OperatorAlerts alerts;
    private MetricsExporter metrics;
    private Clock clock;
    private long drainTimeoutMs = 5000;
    private Duration pendingGrace = Duration.ofSeconds(30);
    private long sweepIntervalMs = 10_000;
    private int sweepBatchSize = 50;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param statusStore the persistence backend
     * @return this builder
     */
    public Builder statusStore(StatusStore statusStore) {
      this.statusStore = statusStore;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param accountDirectory lookup of account status
     * @return this builder
     */
    public Builder accountDirectory(AccountDirectory accountDirectory) {
      this.accountDirectory = accountDirectory;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param platformClient the platform send API
     * @return this builder
     */
    public Builder platformClient(PlatformClient platformClient) {
      this.platformClient = platformClient;
      return this;
    }

    /**
     * Receives status events in the transitioning transaction.
     *
     * <p>Optional. Defaults to {@link StatusEventSink#NONE}.
     *
     * @param statusEvents the sink
     * @return this builder
     */
    public Builder statusEvents(StatusEventSink statusEvents) {
      this.statusEvents = statusEvents;
      return this;
    }

    /**
     * Delay between local retries of a transient platform failure.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=1000} and {@code maxDelayMs=4000} (1s, 2s, 4s).
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Local retries after the first platform call. Optional, defaults to 3.
     *
     * @param maxRetries retries per message
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Threads calling the platform. Optional, defaults to 4.
     *
     * @param workerCount worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@link OperatorAlerts#LOGGING}.
     *
     * @param alerts operator alert sink
     * @return this builder
     */
    public Builder alerts(OperatorAlerts alerts) {
      this.alerts = alerts;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to the UTC system clock.
     *
     * @param clock time source for recorded timestamps
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Time {@link OutboundDispatcher#close()} waits for running work. Optional, defaults to 5000.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Age after which a message still {@code pending} is dispatched again by the sweep.
     * Optional, defaults to 30 seconds.
     *
     * @param pendingGrace grace period for the first attempt
     * @return this builder
     */
    public Builder pendingGrace(Duration pendingGrace) {
      this.pendingGrace = pendingGrace;
      return this;
    }

    /**
     * Delay between pending message sweeps. Optional, defaults to 10000.
     *
     * @param sweepIntervalMs sweep interval in milliseconds
     * @return this builder
     */
    public Builder sweepIntervalMs(long sweepIntervalMs) {
      this.sweepIntervalMs = sweepIntervalMs;
      return this;
    }

    public Builder sweepBatchSize(int sweepBatchSize) {
      this.sweepBatchSize = sweepBatchSize;
      return this;
    }

    public OutboundDispatcher build() {
      return new OutboundDispatcher(this);
    }
  }
}
