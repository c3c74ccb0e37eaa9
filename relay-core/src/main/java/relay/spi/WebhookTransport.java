package relay.spi;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Performs the HTTP POST of a webhook body.
 *
 * @see relay.webhook.HttpClientWebhookTransport
 */
@FunctionalInterface
public interface WebhookTransport {

    /**
     * Posts {@code body} to {@code target}.
     *
     * @param target  webhook URL
     * @param body    raw JSON body, exactly the bytes that were signed
     * @param headers request headers
     * @param timeout upper bound for the whole exchange
     * @return the HTTP status code
     * @throws IOException on network failure or timeout
     */
    int post(URI target, byte[] body, Map<String, String> headers, Duration timeout) throws IOException;
}
