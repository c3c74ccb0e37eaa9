package relay.support;

import relay.spi.WebhookTransport;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Webhook transport that records every request and answers from a script. Once the
 * script is used up every request gets the default status.
 */
public final class RecordingTransport implements WebhookTransport {

  public record Request(URI target, String body, Map<String, String> headers, Duration timeout) {
  }

  private final Deque<Object> script = new ArrayDeque<>();
  private final List<Request> requests = new ArrayList<>();
  private int defaultStatus = 200;

  public synchronized RecordingTransport thenRespond(int... statuses) {
    for (int status : statuses) {
      script.add(status);
    }
    return this;
  }

  public synchronized RecordingTransport thenThrow(IOException failure) {
    script.add(failure);
    return this;
  }

  public synchronized RecordingTransport always(int status) {
    script.clear();
    defaultStatus = status;
    return this;
  }

  @Override
  public synchronized int post(URI target, byte[] body, Map<String, String> headers, Duration timeout)
      throws IOException {
    requests.add(new Request(target, new String(body, StandardCharsets.UTF_8), Map.copyOf(headers), timeout));
    Object next = script.poll();
    if (next instanceof IOException failure) {
      throw failure;
    }
    return next == null ? defaultStatus : (Integer) next;
  }

  public synchronized List<Request> requests() {
    return List.copyOf(requests);
  }

  public synchronized int count() {
    return requests.size();
  }
}
