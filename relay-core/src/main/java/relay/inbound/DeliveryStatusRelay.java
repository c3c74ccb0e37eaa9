package relay.inbound;

import relay.model.Account;
import relay.model.Message;
import relay.model.WebhookDelivery;
import relay.model.WebhookEventType;
import relay.outbound.StatusEventSink;
import relay.retry.RetryEngine;
import relay.spi.AccountDirectory;
import relay.util.Ids;
import relay.webhook.WebhookPayloads;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relays outbound status changes to the CRM by staging a {@code pending} webhook delivery
 * in the transaction of the change. The retry engine performs the actual POST, so neither
 * the send caller nor the dispatcher worker waits for the CRM.
 */
public final class DeliveryStatusRelay implements StatusEventSink {
  private static final Logger logger = Logger.getLogger(DeliveryStatusRelay.class.getName());

  private final AccountDirectory accountDirectory;
  private final RetryEngine retryEngine;
  private final WebhookPayloads payloads;
  private final Clock clock;

  public DeliveryStatusRelay(AccountDirectory accountDirectory, RetryEngine retryEngine,
      WebhookPayloads payloads, Clock clock) {
    this.accountDirectory = Objects.requireNonNull(accountDirectory, "accountDirectory");
    this.retryEngine = Objects.requireNonNull(retryEngine, "retryEngine");
    this.payloads = Objects.requireNonNull(payloads, "payloads");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void publish(Connection conn, Message message, WebhookEventType eventType) {
    Optional<Account> account = accountDirectory.find(message.accountId());
    if (account.isEmpty() || !account.get().isActive() || !account.get().hasWebhook()) {
      logger.log(Level.FINE, "No webhook for accountId={0}; {1} not relayed",
          new Object[] {message.accountId(), eventType.code()});
      return;
    }
    WebhookDelivery delivery = WebhookDelivery.create(Ids.deliveryId(), message.accountId(),
        eventType, message.id(), payloads.status(message, eventType), account.get().webhookUrl(),
        clock.instant());
    retryEngine.enqueue(conn, delivery);
  }
}
