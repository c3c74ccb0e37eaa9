package relay;

import relay.dead.DeadLetterManager;
import relay.inbound.DeliveryStatusRelay;
import relay.inbound.InboundRelay;
import relay.model.InboundEvent;
import relay.model.Message;
import relay.model.SendReceipt;
import relay.outbound.OutboundDispatcher;
import relay.retry.RetryEngine;
import relay.retry.RetryPolicy;
import relay.retry.RetrySchedule;
import relay.spi.AccountDirectory;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.OperatorAlerts;
import relay.spi.PlatformClient;
import relay.spi.StatusStore;
import relay.spi.WebhookTransport;
import relay.status.StatusQueries;
import relay.util.JsonCodec;
import relay.webhook.HttpClientWebhookTransport;
import relay.webhook.WebhookClient;
import relay.webhook.WebhookPayloads;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the {@link OutboundDispatcher}, {@link InboundRelay},
 * {@link RetryEngine} and the administrative facades into one {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Relay relay = Relay.builder()
 *     .connectionProvider(connProvider)
 *     .statusStore(store)
 *     .accountDirectory(accounts)
 *     .platformClient(platform)
 *     .build()) {
 *   SendReceipt receipt = relay.send("acc_1", "psid_42", "Hello", "order_1");
 * }
 * }</pre>
 *
 * <p>Outbound status changes are relayed to the CRM through the retry engine. The engine's
 * scheduler and the dispatcher's pending message sweep are started by {@link Builder#build()}
 * unless {@link Builder#autoStart(boolean)} is turned off.
 */
public final class Relay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Relay.class.getName());

  private final OutboundDispatcher dispatcher;
  private final InboundRelay inbound;
  private final RetryEngine retryEngine;
  private final DeadLetterManager deadLetters;
  private final StatusQueries queries;
  private final MetricsExporter metrics;

  private Relay(OutboundDispatcher dispatcher, InboundRelay inbound, RetryEngine retryEngine,
      DeadLetterManager deadLetters, StatusQueries queries, MetricsExporter metrics) {
    this.dispatcher = dispatcher;
    this.inbound = inbound;
    this.retryEngine = retryEngine;
    this.deadLetters = deadLetters;
    this.queries = queries;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** @see OutboundDispatcher#send */
  public SendReceipt send(String accountId, String recipientId, String text, String idempotencyKey) {
    return dispatcher.send(accountId, recipientId, text, idempotencyKey);
  }

  /** @see InboundRelay#forward */
  public Message forward(String accountId, InboundEvent event) {
    return inbound.forward(accountId, event);
  }

  public OutboundDispatcher dispatcher() {
    return dispatcher;
  }

  public InboundRelay inbound() {
    return inbound;
  }

  public RetryEngine retryEngine() {
    return retryEngine;
  }

  public DeadLetterManager deadLetters() {
    return deadLetters;
  }

  public StatusQueries queries() {
    return queries;
  }

  /**
   * Shuts down components in order: retry engine, dispatcher, then the metrics exporter
   * if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      retryEngine.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RelayException("Failed to close metrics", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Relay}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private StatusStore statusStore;
    private AccountDirectory accountDirectory;
    private PlatformClient platformClient;
    private WebhookTransport webhookTransport;
    private OperatorAlerts alerts;
    private MetricsExporter metrics;
    private Clock clock;
    private JsonCodec jsonCodec;
    private RetrySchedule retrySchedule;
    private RetryPolicy sendRetryPolicy;
    private int sendMaxRetries = 3;
    private int sendWorkerCount = 4;
    private Duration pendingGrace = Duration.ofSeconds(30);
    private long retryIntervalMs = 1000;
    private int retryBatchSize = 50;
    private int retryWorkerCount = 4;
    private Duration attemptTimeout = Duration.ofSeconds(5);
    private Duration immediateTimeout = Duration.ofSeconds(2);
    private Duration deliveringLease = Duration.ofMinutes(5);
    private String userAgent = WebhookClient.DEFAULT_USER_AGENT;
    private long drainTimeoutMs = 5000;
    private boolean autoStart = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder statusStore(StatusStore statusStore) {
      this.statusStore = statusStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder accountDirectory(AccountDirectory accountDirectory) {
      this.accountDirectory = accountDirectory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder platformClient(PlatformClient platformClient) {
      this.platformClient = platformClient;
      return this;
    }

    /** Optional. Defaults to {@link HttpClientWebhookTransport}. */
    public Builder webhookTransport(WebhookTransport webhookTransport) {
      this.webhookTransport = webhookTransport;
      return this;
    }

    public Builder alerts(OperatorAlerts alerts) {
      this.alerts = alerts;
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

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /** Webhook retry schedule. Optional, defaults to {@link RetrySchedule#defaults()}. */
    public Builder retrySchedule(RetrySchedule retrySchedule) {
      this.retrySchedule = retrySchedule;
      return this;
    }

    /** Backoff between local platform retries. Optional, defaults to 1s, 2s, 4s. */
    public Builder sendRetryPolicy(RetryPolicy sendRetryPolicy) {
      this.sendRetryPolicy = sendRetryPolicy;
      return this;
    }

    public Builder sendMaxRetries(int sendMaxRetries) {
      this.sendMaxRetries = sendMaxRetries;
      return this;
    }

    public Builder sendWorkerCount(int sendWorkerCount) {
      this.sendWorkerCount = sendWorkerCount;
      return this;
    }

    /** Age after which a message still {@code pending} is dispatched again. Defaults to 30 seconds. */
    public Builder pendingGrace(Duration pendingGrace) {
      this.pendingGrace = pendingGrace;
      return this;
    }

    public Builder retryIntervalMs(long retryIntervalMs) {
      this.retryIntervalMs = retryIntervalMs;
      return this;
    }

    public Builder retryBatchSize(int retryBatchSize) {
      this.retryBatchSize = retryBatchSize;
      return this;
    }

    public Builder retryWorkerCount(int retryWorkerCount) {
      this.retryWorkerCount = retryWorkerCount;
      return this;
    }

    /** Timeout of retry engine attempts. Optional, defaults to 5 seconds. */
    public Builder attemptTimeout(Duration attemptTimeout) {
      this.attemptTimeout = attemptTimeout;
      return this;
    }

    /** Timeout of the immediate inbound attempt. Optional, defaults to 2 seconds. */
    public Builder immediateTimeout(Duration immediateTimeout) {
      this.immediateTimeout = immediateTimeout;
      return this;
    }

    public Builder deliveringLease(Duration deliveringLease) {
      this.deliveringLease = deliveringLease;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Whether {@link #build()} starts the retry engine's scheduler and the dispatcher's
     * pending message sweep. Defaults to {@code true}.
     */
    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    /**
     * Builds and, unless disabled, starts the relay.
     *
     * @throws IllegalStateException if called twice on the same builder
     */
    public Relay build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(statusStore, "statusStore");
      Objects.requireNonNull(accountDirectory, "accountDirectory");
      Objects.requireNonNull(platformClient, "platformClient");
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      WebhookPayloads payloads = new WebhookPayloads(jsonCodec != null ? jsonCodec : JsonCodec.getDefault());
      WebhookClient webhookClient = new WebhookClient(
          webhookTransport != null ? webhookTransport : new HttpClientWebhookTransport(),
          userAgent, effectiveMetrics);

      RetryEngine retryEngine = RetryEngine.builder()
          .connectionProvider(connectionProvider)
          .statusStore(statusStore)
          .accountDirectory(accountDirectory)
          .webhookClient(webhookClient)
          .schedule(retrySchedule)
          .alerts(alerts)
          .metrics(effectiveMetrics)
          .clock(effectiveClock)
          .intervalMs(retryIntervalMs)
          .batchSize(retryBatchSize)
          .workerCount(retryWorkerCount)
          .attemptTimeout(attemptTimeout)
          .deliveringLease(deliveringLease)
          .drainTimeoutMs(drainTimeoutMs)
          .build();

      OutboundDispatcher dispatcher = null;
      InboundRelay inbound;
      try {
        dispatcher = OutboundDispatcher.builder()
            .connectionProvider(connectionProvider)
            .statusStore(statusStore)
            .accountDirectory(accountDirectory)
            .platformClient(platformClient)
            .statusEvents(new DeliveryStatusRelay(accountDirectory, retryEngine, payloads, effectiveClock))
            .retryPolicy(sendRetryPolicy)
            .maxRetries(sendMaxRetries)
            .workerCount(sendWorkerCount)
            .pendingGrace(pendingGrace)
            .alerts(alerts)
            .metrics(effectiveMetrics)
            .clock(effectiveClock)
            .drainTimeoutMs(drainTimeoutMs)
            .build();
        inbound = InboundRelay.builder()
            .connectionProvider(connectionProvider)
            .statusStore(statusStore)
            .accountDirectory(accountDirectory)
            .webhookClient(webhookClient)
            .retryEngine(retryEngine)
            .payloads(payloads)
            .metrics(effectiveMetrics)
            .clock(effectiveClock)
            .immediateTimeout(immediateTimeout)
            .build();
      } catch (RuntimeException e) {
        if (dispatcher != null) {
          dispatcher.close();
        }
        retryEngine.close();
        throw e;
      }

      Relay relay = new Relay(dispatcher, inbound, retryEngine,
          new DeadLetterManager(connectionProvider, statusStore, effectiveClock),
          new StatusQueries(connectionProvider, statusStore), effectiveMetrics);
      if (autoStart) {
        retryEngine.start();
        dispatcher.start();
        logger.info("Relay started");
      }
      return relay;
    }
  }
}
