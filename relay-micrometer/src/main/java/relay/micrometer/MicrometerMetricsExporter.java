package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import relay.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.send.accepted} new outbound messages accepted</li>
 *   <li>{@code relay.send.duplicate} sends answered from an existing idempotency key</li>
 *   <li>{@code relay.send.sent} messages confirmed by the platform</li>
 *   <li>{@code relay.send.retried} transient platform failures rescheduled</li>
 *   <li>{@code relay.send.failed} messages that ended in {@code failed}</li>
 *   <li>{@code relay.inbound.received} inbound events persisted</li>
 *   <li>{@code relay.inbound.duplicate} inbound events ignored as duplicates</li>
 *   <li>{@code relay.webhook.delivered} webhooks accepted by the CRM</li>
 *   <li>{@code relay.webhook.retried} failed webhook attempts rescheduled</li>
 *   <li>{@code relay.webhook.failed_auth} webhooks rejected with 401/403</li>
 *   <li>{@code relay.webhook.dlq} deliveries moved to the dead-letter queue</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code relay.webhook.due} deliveries found due by the last retry tick</li>
 *   <li>{@code relay.webhook.attempt} duration of webhook HTTP attempts</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter sendAccepted;
  private final Counter sendDuplicate;
  private final Counter sendSent;
  private final Counter sendRetried;
  private final Counter sendFailed;
  private final Counter inboundReceived;
  private final Counter inboundDuplicate;
  private final Counter webhookDelivered;
  private final Counter webhookRetried;
  private final Counter webhookAuthFailed;
  private final Counter webhookDeadLettered;
  private final Gauge dueGauge;
  private final Timer attemptTimer;

  private final AtomicInteger due = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "crm.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.sendAccepted = counter(namePrefix + ".send.accepted", "Outbound messages accepted for sending");
    this.sendDuplicate = counter(namePrefix + ".send.duplicate", "Sends answered from an existing idempotency key");
    this.sendSent = counter(namePrefix + ".send.sent", "Outbound messages confirmed by the platform");
    this.sendRetried = counter(namePrefix + ".send.retried", "Platform calls rescheduled after a transient failure");
    this.sendFailed = counter(namePrefix + ".send.failed", "Outbound messages that ended in failed");
    this.inboundReceived = counter(namePrefix + ".inbound.received", "Inbound platform events persisted");
    this.inboundDuplicate = counter(namePrefix + ".inbound.duplicate", "Inbound platform events ignored as duplicates");
    this.webhookDelivered = counter(namePrefix + ".webhook.delivered", "Webhooks accepted by the CRM");
    this.webhookRetried = counter(namePrefix + ".webhook.retried", "Failed webhook attempts rescheduled");
    this.webhookAuthFailed = counter(namePrefix + ".webhook.failed_auth", "Webhooks rejected with 401/403");
    this.webhookDeadLettered = counter(namePrefix + ".webhook.dlq", "Deliveries moved to the dead-letter queue");

    this.dueGauge = Gauge.builder(namePrefix + ".webhook.due", due, AtomicInteger::get)
        .description("Deliveries found due by the last retry tick")
        .register(registry);
    this.attemptTimer = Timer.builder(namePrefix + ".webhook.attempt")
        .description("Duration of webhook HTTP attempts")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementSendAccepted() {
    if (closed) return;
    sendAccepted.increment();
  }

  @Override
  public void incrementSendDuplicate() {
    if (closed) return;
    sendDuplicate.increment();
  }

  @Override
  public void incrementSendSucceeded() {
    if (closed) return;
    sendSent.increment();
  }

  @Override
  public void incrementSendRetried() {
    if (closed) return;
    sendRetried.increment();
  }

  @Override
  public void incrementSendFailed() {
    if (closed) return;
    sendFailed.increment();
  }

  @Override
  public void incrementInboundReceived() {
    if (closed) return;
    inboundReceived.increment();
  }

  @Override
  public void incrementInboundDuplicate() {
    if (closed) return;
    inboundDuplicate.increment();
  }

  @Override
  public void incrementWebhookDelivered() {
    if (closed) return;
    webhookDelivered.increment();
  }

  @Override
  public void incrementWebhookRetried() {
    if (closed) return;
    webhookRetried.increment();
  }

  @Override
  public void incrementWebhookAuthFailed() {
    if (closed) return;
    webhookAuthFailed.increment();
  }

  @Override
  public void incrementWebhookDeadLettered() {
    if (closed) return;
    webhookDeadLettered.increment();
  }

  @Override
  public void recordDueDeliveries(int count) {
    if (closed) return;
    due.set(count);
  }

  @Override
  public void recordWebhookAttemptMs(long durationMs) {
    if (closed) return;
    attemptTimer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry, so a closed
   * {@link relay.Relay} leaves no stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(sendAccepted, sendDuplicate, sendSent, sendRetried, sendFailed,
        inboundReceived, inboundDuplicate, webhookDelivered, webhookRetried, webhookAuthFailed,
        webhookDeadLettered, dueGauge, attemptTimer)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
