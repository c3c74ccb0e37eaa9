package relay.webhook;

import relay.model.WebhookDelivery;
import relay.signature.WebhookSigner;
import relay.spi.MetricsExporter;
import relay.spi.WebhookTransport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Signs a delivery's stored payload and posts it to the CRM, classifying the result.
 *
 * <p>The signature covers exactly the bytes that are sent. The client never throws for
 * transport problems; they come back as {@link AttemptOutcome.Kind#FAILED}.
 */
public final class WebhookClient {
  private static final Logger logger = Logger.getLogger(WebhookClient.class.getName());

  public static final String DEFAULT_USER_AGENT = "crm-relay/1.0";
  public static final String EVENT_HEADER = "X-Relay-Event";
  public static final String DELIVERY_HEADER = "X-Relay-Delivery";

  private final WebhookTransport transport;
  private final String userAgent;
  private final MetricsExporter metrics;

  public WebhookClient(WebhookTransport transport, String userAgent, MetricsExporter metrics) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public WebhookClient(WebhookTransport transport) {
    this(transport, DEFAULT_USER_AGENT, MetricsExporter.NOOP);
  }

  /**
   * Performs one attempt.
   *
   * @param delivery the delivery whose payload and target are used
   * @param secret   the account's current webhook secret
   * @param timeout  bound for the whole exchange
   */
  public AttemptOutcome post(WebhookDelivery delivery, String secret, Duration timeout) {
    byte[] body = delivery.payload().getBytes(StandardCharsets.UTF_8);
    URI target;
    try {
      target = URI.create(delivery.targetUrl());
    } catch (IllegalArgumentException e) {
      return AttemptOutcome.networkError("invalid webhook url");
    }

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");
    headers.put(WebhookSigner.HEADER, WebhookSigner.header(body, secret));
    headers.put("User-Agent", userAgent);
    headers.put(EVENT_HEADER, delivery.eventType().code());
    headers.put(DELIVERY_HEADER, delivery.id());

    long start = System.nanoTime();
    try {
      int status = transport.post(target, body, headers, timeout);
      AttemptOutcome outcome = AttemptOutcome.forStatus(status);
      logger.log(Level.FINE, "Webhook attempt deliveryId={0} status={1}",
          new Object[] {delivery.id(), status});
      return outcome;
    } catch (HttpTimeoutException e) {
      return AttemptOutcome.networkError("timeout after " + timeout.toMillis() + "ms");
    } catch (IOException e) {
      return AttemptOutcome.networkError(e.getClass().getSimpleName() + ": " + e.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Webhook transport failed for deliveryId=" + delivery.id(), e);
      return AttemptOutcome.networkError(e.getClass().getSimpleName());
    } finally {
      metrics.recordWebhookAttemptMs((System.nanoTime() - start) / 1_000_000L);
    }
  }
}
