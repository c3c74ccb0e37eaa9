package relay.webhook;

import relay.spi.WebhookTransport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * {@link WebhookTransport} on top of the JDK {@link HttpClient}. Redirects are not followed.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {
  // rejected by HttpRequest.Builder
  private static final Set<String> RESTRICTED =
      Set.of("host", "connection", "content-length", "expect", "upgrade");

  private final HttpClient client;

  public HttpClientWebhookTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public HttpClientWebhookTransport(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  public HttpClientWebhookTransport() {
    this(Duration.ofSeconds(2));
  }

  @Override
  public int post(URI target, byte[] body, Map<String, String> headers, Duration timeout)
      throws IOException {
    HttpRequest.Builder request = HttpRequest.newBuilder(target)
        .timeout(timeout)
        .POST(HttpRequest.BodyPublishers.ofByteArray(body));
    headers.forEach((name, value) -> {
      if (!RESTRICTED.contains(name.toLowerCase(Locale.ROOT))) {
        request.header(name, value);
      }
    });
    try {
      return client.send(request.build(), HttpResponse.BodyHandlers.discarding()).statusCode();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while posting webhook");
    }
  }
}
