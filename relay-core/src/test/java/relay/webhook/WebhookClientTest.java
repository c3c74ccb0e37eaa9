package relay.webhook;

import org.junit.jupiter.api.Test;
import relay.model.WebhookDelivery;
import relay.model.WebhookEventType;
import relay.signature.WebhookSigner;
import relay.spi.WebhookTransport;
import relay.support.CountingMetrics;
import relay.support.RecordingTransport;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WebhookClientTest {
  private static final String SECRET = "whsec_abc";
  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  private final RecordingTransport transport = new RecordingTransport();
  private final WebhookClient client = new WebhookClient(transport);

  private static WebhookDelivery delivery(String url) {
    return WebhookDelivery.create("dlv_1", "acc_1", WebhookEventType.MESSAGE_RECEIVED, "msg_1",
        "{\"event\":\"message.received\",\"message\":\"héllo\"}", url, Instant.parse("2024-05-01T10:00:00Z"));
  }

  @Test
  void signsExactBodyAndSendsRelayHeaders() {
    AttemptOutcome outcome = client.post(delivery("https://crm.example.com/hook"), SECRET, TIMEOUT);

    assertTrue(outcome.isDelivered());
    RecordingTransport.Request request = transport.requests().get(0);
    assertEquals("https://crm.example.com/hook", request.target().toString());
    assertEquals(TIMEOUT, request.timeout());
    assertEquals("application/json", request.headers().get("Content-Type"));
    assertEquals(WebhookClient.DEFAULT_USER_AGENT, request.headers().get("User-Agent"));
    assertEquals("message.received", request.headers().get(WebhookClient.EVENT_HEADER));
    assertEquals("dlv_1", request.headers().get(WebhookClient.DELIVERY_HEADER));

    byte[] sent = request.body().getBytes(StandardCharsets.UTF_8);
    String signature = request.headers().get(WebhookSigner.HEADER);
    assertTrue(signature.startsWith(WebhookSigner.PREFIX));
    assertTrue(WebhookSigner.verify(sent, SECRET, signature));
    assertFalse(WebhookSigner.verify(sent, "whsec_other", signature));
  }

  @Test
  void classifiesResponses() {
    transport.thenRespond(204, 401, 403, 500, 429, 302);
    WebhookDelivery d = delivery("https://crm.example.com/hook");

    assertEquals(AttemptOutcome.Kind.DELIVERED, client.post(d, SECRET, TIMEOUT).kind());
    assertEquals(AttemptOutcome.Kind.AUTH_REJECTED, client.post(d, SECRET, TIMEOUT).kind());
    assertEquals(AttemptOutcome.Kind.AUTH_REJECTED, client.post(d, SECRET, TIMEOUT).kind());
    AttemptOutcome serverError = client.post(d, SECRET, TIMEOUT);
    assertEquals(AttemptOutcome.Kind.FAILED, serverError.kind());
    assertEquals(500, serverError.statusCode());
    assertEquals("HTTP 500", serverError.detail());
    assertEquals(AttemptOutcome.Kind.FAILED, client.post(d, SECRET, TIMEOUT).kind());
    assertEquals(AttemptOutcome.Kind.FAILED, client.post(d, SECRET, TIMEOUT).kind());
  }

  @Test
  void networkErrorsAreFailures() {
    transport.thenThrow(new ConnectException("Connection refused"))
        .thenThrow(new HttpTimeoutException("request timed out"));
    WebhookDelivery d = delivery("https://crm.example.com/hook");

    AttemptOutcome refused = client.post(d, SECRET, TIMEOUT);
    assertEquals(AttemptOutcome.Kind.FAILED, refused.kind());
    assertEquals(0, refused.statusCode());
    assertEquals("ConnectException: Connection refused", refused.detail());

    AttemptOutcome timedOut = client.post(d, SECRET, TIMEOUT);
    assertEquals(AttemptOutcome.Kind.FAILED, timedOut.kind());
    assertEquals("timeout after 2000ms", timedOut.detail());
  }

  @Test
  void invalidUrlFailsWithoutCallingTransport() {
    AttemptOutcome outcome = client.post(delivery("not a url"), SECRET, TIMEOUT);

    assertEquals(AttemptOutcome.Kind.FAILED, outcome.kind());
    assertEquals("invalid webhook url", outcome.detail());
    assertEquals(0, transport.count());
  }

  @Test
  void unexpectedTransportFailureIsReportedNotThrown() {
    WebhookTransport broken = (target, body, headers, timeout) -> {
      throw new IllegalStateException("pool closed");
    };

    AttemptOutcome outcome = new WebhookClient(broken).post(delivery("https://crm.example.com/hook"), SECRET, TIMEOUT);

    assertEquals(AttemptOutcome.Kind.FAILED, outcome.kind());
    assertEquals("IllegalStateException", outcome.detail());
  }

  @Test
  void recordsAttemptLatency() {
    CountingMetrics metrics = new CountingMetrics();
    WebhookClient timed = new WebhookClient(transport.thenThrow(new IOException("reset")), "crm/2", metrics);

    timed.post(delivery("https://crm.example.com/hook"), SECRET, TIMEOUT);
    timed.post(delivery("https://crm.example.com/hook"), SECRET, TIMEOUT);

    assertEquals(2, metrics.count("webhook.attempt"));
    assertEquals("crm/2", transport.requests().get(1).headers().get("User-Agent"));
  }
}
