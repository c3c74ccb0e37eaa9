package relay.retry;

import relay.StatusStoreException;
import relay.model.Account;
import relay.model.DeliveryStatus;
import relay.model.WebhookDelivery;
import relay.spi.AccountDirectory;
import relay.spi.Alert;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.OperatorAlerts;
import relay.spi.StatusStore;
import relay.util.DaemonThreadFactory;
import relay.util.Transactions;
import relay.webhook.AttemptOutcome;
import relay.webhook.WebhookClient;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns webhook deliveries from creation until they reach a terminal status.
 *
 * <p>A periodic {@link #tick()} polls the status store for due deliveries, at most one per
 * account: the oldest open one. Each is claimed ({@code delivering}) and attempted on a
 * worker pool:
 * <ul>
 *   <li>2xx: {@code delivered};</li>
 *   <li>401/403: {@code failed_auth} and an operator alert, no further retries;</li>
 *   <li>anything else: {@code retrying} per the {@link RetrySchedule}, or {@code dlq} and
 *       an operator alert once the retry window is over.</li>
 * </ul>
 *
 * <p>Deliveries of inactive or unknown accounts are deferred by the extended interval
 * without consuming a retry. A {@code delivering} row older than the delivering lease
 * is treated as abandoned and attempted again. A delivery that already failed and whose
 * retry window closed before it came due is dead-lettered without another attempt.
 *
 * <p>The scheduled cycle hands claimed deliveries to the workers and returns without
 * waiting for them; the {@code delivering} claim keeps a row from being attempted twice.
 * At most {@code batchSize} attempts are in flight at a time.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized; {@link #tick()} may also be invoked directly, e.g. from tests.
 */
public final class RetryEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetryEngine.class.getName());

    static final String ENQUEUED = "enqueued";
    static final String CLAIMED = "claimed";
    static final String CLAIM_EXPIRED = "claim expired";
    static final String WINDOW_CLOSED = "retry window closed before next attempt";

    private final ConnectionProvider connectionProvider;
    private final StatusStore statusStore;
    private final AccountDirectory accountDirectory;
    private final WebhookClient webhookClient;
    private final RetrySchedule schedule;
    private final OperatorAlerts alerts;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long intervalMs;
    private final int batchSize;
    private final Duration attemptTimeout;
    private final Duration deliveringLease;
    private final long drainTimeoutMs;
    private final ExecutorService workers;
    private final AtomicInteger inFlight = new AtomicInteger();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean closed;

    private RetryEngine(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.statusStore = Objects.requireNonNull(builder.statusStore, "statusStore");
        this.accountDirectory = Objects.requireNonNull(builder.accountDirectory, "accountDirectory");
        this.webhookClient = Objects.requireNonNull(builder.webhookClient, "webhookClient");
        this.schedule = builder.schedule != null ? builder.schedule : RetrySchedule.defaults();
        this.alerts = builder.alerts != null ? builder.alerts : OperatorAlerts.LOGGING;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        Objects.requireNonNull(builder.attemptTimeout, "attemptTimeout");
        Objects.requireNonNull(builder.deliveringLease, "deliveringLease");
        if (builder.attemptTimeout.isNegative() || builder.attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be > 0");
        }
        if (builder.deliveringLease.compareTo(builder.attemptTimeout) <= 0) {
            throw new IllegalArgumentException("deliveringLease must be longer than attemptTimeout");
        }
        this.intervalMs = builder.intervalMs;
        this.batchSize = builder.batchSize;
        this.attemptTimeout = builder.attemptTimeout;
        this.deliveringLease = builder.deliveringLease;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.workers = Executors.newFixedThreadPool(builder.workerCount,
            new DaemonThreadFactory("relay-retry-worker-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Enqueue ─────────────────────────────────────────────────────

    /**
     * Stores a new {@code pending} delivery in its own transaction. The next tick picks it up
     * once every older open delivery of the account is done.
     */
    public void enqueue(WebhookDelivery delivery) {
        Transactions.inTransaction(connectionProvider, conn -> {
            enqueue(conn, delivery);
            return null;
        });
    }

    /**
     * Stores a new {@code pending} delivery inside the caller's transaction.
     */
    public void enqueue(Connection conn, WebhookDelivery delivery) {
        requirePending(delivery);
        statusStore.insertDelivery(conn, delivery, ENQUEUED);
        logger.log(Level.FINE, "Enqueued deliveryId={0} event={1} accountId={2}",
            new Object[] {delivery.id(), delivery.eventType().code(), delivery.accountId()});
    }

    /**
     * Records the outcome of an attempt the caller made itself on a stored {@code pending}
     * delivery, e.g. the Inbound Relay's immediate attempt. The outcome is applied as if
     * the engine had made the attempt: a failure leaves the delivery {@code retrying} with
     * a retry count of 1, and a 401/403 leaves it {@code failed_auth}.
     *
     * @param delivery    the delivery as stored
     * @param outcome     the outcome of the caller's attempt
     * @param attemptedAt when that attempt started
     * @return the delivery after the outcome, or empty if it was no longer {@code pending}
     */
    public Optional<WebhookDelivery> recordAttempt(WebhookDelivery delivery, AttemptOutcome outcome,
            Instant attemptedAt) {
        requirePending(delivery);
        Objects.requireNonNull(outcome, "outcome");
        WebhookDelivery next = afterAttempt(delivery, outcome, attemptedAt);
        if (!update(next, DeliveryStatus.PENDING, reasonFor(next, outcome))) {
            return Optional.empty();
        }
        report(next, outcome);
        return Optional.of(next);
    }

    private static void requirePending(WebhookDelivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        if (delivery.status() != DeliveryStatus.PENDING) {
            throw new IllegalArgumentException("Delivery must be pending, got " + delivery.status());
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * Starts the periodic tick. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetryEngine has been closed");
        }
        if (tickTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-retry-tick-"));
        tickTask = scheduler.scheduleWithFixedDelay(this::safeDispatch, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void safeDispatch() {
        try {
            dispatchDue();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retry tick failed", t);
        }
    }

    /**
     * Runs one cycle and waits until every attempt it started has been recorded. The
     * scheduled cycle does not wait.
     *
     * @return the number of attempts made
     */
    public int tick() {
        List<Future<?>> attempts = dispatchDue();
        for (Future<?> attempt : attempts) {
            try {
                attempt.get();
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Webhook attempt failed unexpectedly", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return attempts.size();
    }

    /**
     * Polls due deliveries, claims them and hands them to the workers. A failure on one
     * delivery is logged and does not hold up the others.
     */
    private List<Future<?>> dispatchDue() {
        if (closed) {
            return List.of();
        }
        int capacity = batchSize - inFlight.get();
        if (capacity <= 0) {
            logger.log(Level.FINE, "{0} webhook attempts in flight; skipping poll", inFlight.get());
            return List.of();
        }
        Instant now = clock.instant();
        List<WebhookDelivery> due = Transactions.withConnection(connectionProvider,
            conn -> statusStore.pollDueDeliveries(conn, now, now.minus(deliveringLease), capacity));
        metrics.recordDueDeliveries(due.size());
        if (due.isEmpty()) {
            return List.of();
        }

        List<Future<?>> attempts = new ArrayList<>(due.size());
        for (WebhookDelivery delivery : due) {
            try {
                Future<?> attempt = claimAndSubmit(delivery, now);
                if (attempt != null) {
                    attempts.add(attempt);
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to dispatch deliveryId=" + delivery.id()
                    + " accountId=" + delivery.accountId(), e);
            }
        }
        return attempts;
    }

    private Future<?> claimAndSubmit(WebhookDelivery delivery, Instant now) {
        WebhookDelivery current = delivery;
        if (current.status() == DeliveryStatus.DELIVERING) {
            logger.log(Level.WARNING, "Claim on deliveryId={0} expired; attempting again", current.id());
            WebhookDelivery released = current.released(now);
            if (!update(released, DeliveryStatus.DELIVERING, CLAIM_EXPIRED)) {
                return null;
            }
            current = released;
        }

        if (current.retryCount() > 0 && schedule.isExhausted(current.windowStartedAt(), now)) {
            WebhookDelivery expired = current.expired(now);
            if (update(expired, current.status(), WINDOW_CLOSED)) {
                reportDeadLettered(expired, current.lastError());
            }
            return null;
        }

        Optional<Account> account = accountDirectory.find(current.accountId());
        if (account.isEmpty() || !account.get().isActive() || !account.get().hasWebhook()) {
            defer(current, now.plus(schedule.extendedInterval()));
            return null;
        }

        WebhookDelivery claimed = current.claimed(now);
        if (!update(claimed, current.status(), CLAIMED)) {
            return null;
        }
        String secret = account.get().webhookSecret();
        inFlight.incrementAndGet();
        try {
            return workers.submit(() -> {
                try {
                    attempt(claimed, secret);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            // the claim expires and the delivery is attempted again
            logger.log(Level.WARNING, "Engine closed before deliveryId={0} was attempted", claimed.id());
            return null;
        }
    }

    private void defer(WebhookDelivery delivery, Instant nextAt) {
        Transactions.withConnection(connectionProvider,
            conn -> statusStore.deferDelivery(conn, delivery.id(), nextAt));
        logger.log(Level.FINE, "Deferred deliveryId={0} of inactive accountId={1} until {2}",
            new Object[] {delivery.id(), delivery.accountId(), nextAt});
    }

    private void attempt(WebhookDelivery claimed, String secret) {
        AttemptOutcome outcome = webhookClient.post(claimed, secret, attemptTimeout);
        WebhookDelivery next = afterAttempt(claimed, outcome, claimed.lastAttemptAt());
        try {
            if (update(next, DeliveryStatus.DELIVERING, reasonFor(next, outcome))) {
                report(next, outcome);
            }
        } catch (StatusStoreException e) {
            // the claim expires and the delivery is attempted again
            logger.log(Level.SEVERE, "Failed to record attempt for deliveryId=" + claimed.id()
                + " outcome=" + outcome.kind(), e);
        }
    }

    private boolean update(WebhookDelivery next, DeliveryStatus expected, String reason) {
        int updated = Transactions.inTransaction(connectionProvider,
            conn -> statusStore.updateDelivery(conn, next, expected, reason));
        if (updated == 0) {
            logger.log(Level.FINE, "deliveryId={0} no longer {1}; skipped",
                new Object[] {next.id(), expected.code()});
            return false;
        }
        return true;
    }

    // ── Outcome handling ────────────────────────────────────────────

    private WebhookDelivery afterAttempt(WebhookDelivery delivery, AttemptOutcome outcome, Instant attemptedAt) {
        Instant finishedAt = clock.instant();
        return switch (outcome.kind()) {
            case DELIVERED -> delivery.delivered(attemptedAt, finishedAt);
            case AUTH_REJECTED -> delivery.authFailed(outcome.detail(), attemptedAt);
            case FAILED -> schedule.nextAttemptAt(delivery.retryCount() + 1, delivery.windowStartedAt(), finishedAt)
                .map(nextAt -> delivery.retrying(outcome.detail(), attemptedAt, nextAt))
                .orElseGet(() -> delivery.deadLettered(outcome.detail(), attemptedAt));
        };
    }

    private static String reasonFor(WebhookDelivery next, AttemptOutcome outcome) {
        return switch (next.status()) {
            case DELIVERED -> "delivered: HTTP " + outcome.statusCode();
            case FAILED_AUTH -> "auth rejected: " + outcome.detail();
            case DLQ -> "retry window exhausted: " + outcome.detail();
            default -> "attempt failed: " + outcome.detail();
        };
    }

    private void report(WebhookDelivery next, AttemptOutcome outcome) {
        switch (next.status()) {
            case DELIVERED -> {
                metrics.incrementWebhookDelivered();
                logger.log(Level.INFO, "Delivered deliveryId={0} event={1} accountId={2} retries={3}",
                    new Object[] {next.id(), next.eventType().code(), next.accountId(), next.retryCount()});
            }
            case FAILED_AUTH -> {
                metrics.incrementWebhookAuthFailed();
                logger.log(Level.SEVERE, "Webhook rejected with HTTP " + outcome.statusCode()
                    + " for deliveryId=" + next.id() + " accountId=" + next.accountId() + "; not retrying");
                raise(new Alert(Alert.Kind.WEBHOOK_AUTH_FAILED, next.accountId(), next.id(), outcome.detail()));
            }
            case DLQ -> reportDeadLettered(next, outcome.detail());
            default -> {
                metrics.incrementWebhookRetried();
                logger.log(Level.WARNING, "Webhook attempt failed for deliveryId={0} ({1}); retry {2} at {3}",
                    new Object[] {next.id(), outcome.detail(), next.retryCount(), next.nextRetryAt()});
            }
        }
    }

    private void reportDeadLettered(WebhookDelivery dead, String lastError) {
        metrics.incrementWebhookDeadLettered();
        logger.log(Level.SEVERE, "Dead-lettered deliveryId=" + dead.id() + " accountId="
            + dead.accountId() + " after " + dead.retryCount() + " attempts: " + lastError);
        raise(new Alert(Alert.Kind.WEBHOOK_DEAD_LETTERED, dead.accountId(), dead.id(),
            "retry window exhausted after " + dead.retryCount() + " attempts"));
    }

    private void raise(Alert alert) {
        try {
            alerts.raise(alert);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Operator alert sink failed for " + alert, e);
        }
    }

    /**
     * Stops the tick, then waits up to the drain timeout for running attempts. Attempts cut
     * off by the timeout keep their claim and are retried after the delivering lease.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        workers.shutdown();
        try {
            if (scheduler != null && !scheduler.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded; interrupting webhook attempts");
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            if (scheduler != null) {
                scheduler.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link RetryEngine}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private StatusStore statusStore;
        private AccountDirectory accountDirectory;
        private WebhookClient webhookClient;
        private RetrySchedule schedule;
        private OperatorAlerts alerts;
        private MetricsExporter metrics;
        private Clock clock;
        private long intervalMs = 1000;
        private int batchSize = 50;
        private int workerCount = 4;
        private Duration attemptTimeout = Duration.ofSeconds(5);
        private Duration deliveringLease = Duration.ofMinutes(5);
        private long drainTimeoutMs = 5000;

        private Builder() {}

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder statusStore(StatusStore statusStore) {
            this.statusStore = statusStore;
            return this;
        }

        /**
         * Source of webhook URL, secret and active flag, read before every attempt.
         * <b>Required.</b>
         */
        public Builder accountDirectory(AccountDirectory accountDirectory) {
            this.accountDirectory = accountDirectory;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder webhookClient(WebhookClient webhookClient) {
            this.webhookClient = webhookClient;
            return this;
        }

        /**
         * Optional. Defaults to {@link RetrySchedule#defaults()}.
         */
        public Builder schedule(RetrySchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        /**
         * Optional. Defaults to {@link OperatorAlerts#LOGGING}.
         */
        public Builder alerts(OperatorAlerts alerts) {
            this.alerts = alerts;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Time source for due checks and recorded timestamps. Optional, defaults to UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Delay between the end of one tick and the start of the next. Optional, defaults to 1000.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Maximum deliveries claimed per tick and maximum attempts in flight. Optional,
         * defaults to 50.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Threads performing webhook attempts. Optional, defaults to 4.
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Timeout of a single webhook POST. Optional, defaults to 5 seconds.
         */
        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        /**
         * Age after which a {@code delivering} claim is considered abandoned. Optional,
         * defaults to 5 minutes; must exceed the attempt timeout.
         */
        public Builder deliveringLease(Duration deliveringLease) {
            this.deliveringLease = deliveringLease;
            return this;
        }

        /**
         * Time {@link RetryEngine#close()} waits for running attempts. Optional, defaults to 5000.
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public RetryEngine build() {
            return new RetryEngine(this);
        }
    }
}
