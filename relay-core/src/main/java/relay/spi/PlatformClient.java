package relay.spi;

import relay.AuthException;
import relay.PermanentDeliveryException;
import relay.TransientException;

/**
 * Outbound half of the messaging platform API.
 *
 * <p>Implementations bound each call by their own timeout (5 seconds or less) and
 * translate failures into the relay's exception types.
 */
@FunctionalInterface
public interface PlatformClient {

    /**
     * Sends a text message from the account to the recipient.
     *
     * @param accountId   the sending account
     * @param recipientId PSID of the recipient
     * @param text        message text
     * @return the platform's receipt
     * @throws TransientException          on timeout, 5xx or rate limiting
     * @throws PermanentDeliveryException  on invalid recipient or blocked user
     * @throws AuthException               when the account's token is rejected
     */
    PlatformReceipt send(String accountId, String recipientId, String text);
}
