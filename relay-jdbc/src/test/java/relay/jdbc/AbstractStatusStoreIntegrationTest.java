package relay.jdbc;

import org.junit.jupiter.api.Test;
import relay.jdbc.store.AbstractJdbcStatusStore;
import relay.model.DeliveryStatus;
import relay.model.InboundEvent;
import relay.model.Message;
import relay.model.MessageError;
import relay.model.MessageStatus;
import relay.model.StatusChange;
import relay.model.WebhookDelivery;
import relay.model.WebhookEventType;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Status store behaviour shared by every database. Subclasses provide the DataSource
 * and the store under test; tables are expected to be empty before each test.
 */
abstract class AbstractStatusStoreIntegrationTest {
  static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
  static final String URL = "https://crm.example.com/hooks/relay";

  abstract DataSource dataSource();

  abstract AbstractJdbcStatusStore store();

  @Test
  void outboundMessageIsInsertedOncePerIdempotencyKey() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      Message first = Message.outbound(id(), "acc_1", "order_7", "psid_1", "Hello", T0);
      Message retry = Message.outbound(id(), "acc_1", "order_7", "psid_1", "Hello", T0);

      assertTrue(store().insertMessageIfAbsent(conn, first, "accepted"));
      assertFalse(store().insertMessageIfAbsent(conn, retry, "accepted"));

      Message stored = store().findMessageByIdempotencyKey(conn, "acc_1", "order_7").orElseThrow();
      assertEquals(first.id(), stored.id());
      assertEquals(MessageStatus.PENDING, stored.status());
      assertEquals("Hello", stored.text());
      assertEquals(T0, stored.createdAt());
      assertEquals(1, store().messageHistory(conn, first.id()).size());
      assertTrue(store().findMessage(conn, retry.id()).isEmpty());
    }
  }

  @Test
  void sameIdempotencyKeyOnAnotherAccountIsIndependent() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      assertTrue(store().insertMessageIfAbsent(conn,
          Message.outbound(id(), "acc_1", "k1", "psid_1", "a", T0), "accepted"));
      assertTrue(store().insertMessageIfAbsent(conn,
          Message.outbound(id(), "acc_2", "k1", "psid_1", "a", T0), "accepted"));
    }
  }

  @Test
  void inboundMessageIsInsertedOncePerPlatformMessageId() throws Exception {
    InboundEvent event = InboundEvent.text("mid.1", "psid_9", "page_1", "hi", T0);
    try (Connection conn = dataSource().getConnection()) {
      Message first = Message.inbound(id(), "acc_1", event, T0);
      assertTrue(store().insertMessageIfAbsent(conn, first, "received"));
      assertFalse(store().insertMessageIfAbsent(conn, Message.inbound(id(), "acc_1", event, T0), "received"));
      // no idempotency key: the null unique column must not collide
      assertTrue(store().insertMessageIfAbsent(conn,
          Message.inbound(id(), "acc_1", InboundEvent.text("mid.2", "psid_9", "page_1", "again", T0), T0),
          "received"));

      Message stored = store().findMessageByPlatformId(conn, "acc_1", "mid.1").orElseThrow();
      assertEquals(first.id(), stored.id());
      assertEquals(MessageStatus.RECEIVED, stored.status());
      assertEquals("psid_9", stored.senderId());
    }
  }

  @Test
  void messageUpdateIsCompareAndSetWithHistory() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      Message pending = Message.outbound(id(), "acc_1", "k", "psid_1", "Hello", T0);
      store().insertMessageIfAbsent(conn, pending, "accepted");

      Message sending = pending.sending(T0.plusSeconds(1));
      assertEquals(1, store().updateMessage(conn, sending, MessageStatus.PENDING, "dispatching"));
      assertEquals(0, store().updateMessage(conn, sending, MessageStatus.PENDING, "dispatching"));

      Message sent = sending.sent("mid.42", T0.plusSeconds(2));
      assertEquals(1, store().updateMessage(conn, sent, MessageStatus.SENDING, "platform accepted"));

      Message stored = store().findMessage(conn, pending.id()).orElseThrow();
      assertEquals(MessageStatus.SENT, stored.status());
      assertEquals("mid.42", stored.platformMessageId());
      assertEquals(T0.plusSeconds(2), stored.sentAt());

      List<StatusChange> history = store().messageHistory(conn, pending.id());
      assertEquals(List.of("pending", "sending", "sent"), history.stream().map(StatusChange::toStatus).toList());
      assertNull(history.get(0).fromStatus());
      assertEquals("sending", history.get(2).fromStatus());
      assertEquals("platform accepted", history.get(2).reason());
    }
  }

  @Test
  void messageErrorRoundTrips() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      Message pending = Message.outbound(id(), "acc_1", "k", "psid_1", "Hello", T0);
      store().insertMessageIfAbsent(conn, pending, "accepted");
      Message sending = pending.sending(T0);
      store().updateMessage(conn, sending, MessageStatus.PENDING, "dispatching");
      store().updateMessage(conn, sending.failed(new MessageError("recipient_blocked", "user blocked the page", false),
          T0.plusSeconds(1)), MessageStatus.SENDING, "permanent failure");

      Message stored = store().findMessage(conn, pending.id()).orElseThrow();
      assertEquals(MessageStatus.FAILED, stored.status());
      assertEquals(new MessageError("recipient_blocked", "user blocked the page", false), stored.error());
    }
  }

  @Test
  void deliveryRoundTripsAndUpdatesAreCompareAndSet() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      WebhookDelivery pending = delivery("acc_1", T0);
      store().insertDelivery(conn, pending, "enqueued");

      WebhookDelivery stored = store().findDelivery(conn, pending.id()).orElseThrow();
      assertEquals(pending, stored);

      WebhookDelivery claimed = pending.claimed(T0.plusSeconds(1));
      assertEquals(1, store().updateDelivery(conn, claimed, DeliveryStatus.PENDING, "claimed"));
      assertEquals(0, store().updateDelivery(conn, claimed, DeliveryStatus.PENDING, "claimed"));

      WebhookDelivery retrying = claimed.retrying("HTTP 503", T0.plusSeconds(1), T0.plusSeconds(2));
      assertEquals(1, store().updateDelivery(conn, retrying, DeliveryStatus.DELIVERING, "HTTP 503"));

      stored = store().findDelivery(conn, pending.id()).orElseThrow();
      assertEquals(DeliveryStatus.RETRYING, stored.status());
      assertEquals(1, stored.retryCount());
      assertEquals("HTTP 503", stored.lastError());
      assertEquals(T0.plusSeconds(2), stored.nextRetryAt());
      assertEquals(List.of("enqueued", "claimed", "HTTP 503"),
          store().deliveryHistory(conn, pending.id()).stream().map(StatusChange::reason).toList());
    }
  }

  @Test
  void pollReturnsOnlyTheHeadOfEachAccount() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      WebhookDelivery a1 = delivery("acc_a", T0);
      WebhookDelivery a2 = delivery("acc_a", T0);
      WebhookDelivery b1 = delivery("acc_b", T0);
      store().insertDelivery(conn, a1, "enqueued");
      store().insertDelivery(conn, a2, "enqueued");
      store().insertDelivery(conn, b1, "enqueued");

      List<WebhookDelivery> due = store().pollDueDeliveries(conn, T0, T0.minus(Duration.ofMinutes(5)), 10);
      assertEquals(List.of(a1.id(), b1.id()), due.stream().map(WebhookDelivery::id).toList());

      // a1 in flight still blocks a2
      store().updateDelivery(conn, a1.claimed(T0), DeliveryStatus.PENDING, "claimed");
      due = store().pollDueDeliveries(conn, T0, T0.minus(Duration.ofMinutes(5)), 10);
      assertEquals(List.of(b1.id()), due.stream().map(WebhookDelivery::id).toList());

      store().updateDelivery(conn, a1.claimed(T0).delivered(T0, T0.plusSeconds(1)), DeliveryStatus.DELIVERING,
          "delivered");
      due = store().pollDueDeliveries(conn, T0.plusSeconds(1), T0.minus(Duration.ofMinutes(5)), 10);
      assertEquals(List.of(a2.id(), b1.id()), due.stream().map(WebhookDelivery::id).toList());
    }
  }

  @Test
  void pollSkipsDeliveriesNotYetDueAndHonoursLimit() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      WebhookDelivery a1 = delivery("acc_a", T0);
      store().insertDelivery(conn, a1, "enqueued");
      WebhookDelivery claimed = a1.claimed(T0);
      store().updateDelivery(conn, claimed, DeliveryStatus.PENDING, "claimed");
      store().updateDelivery(conn, claimed.retrying("timeout", T0, T0.plusSeconds(60)),
          DeliveryStatus.DELIVERING, "timeout");
      store().insertDelivery(conn, delivery("acc_b", T0), "enqueued");
      store().insertDelivery(conn, delivery("acc_c", T0), "enqueued");

      Instant stale = T0.minus(Duration.ofMinutes(5));
      assertEquals(2, store().pollDueDeliveries(conn, T0.plusSeconds(1), stale, 10).size());
      assertEquals(1, store().pollDueDeliveries(conn, T0.plusSeconds(1), stale, 1).size());
      assertEquals(3, store().pollDueDeliveries(conn, T0.plusSeconds(60), stale, 10).size());
    }
  }

  @Test
  void pollReturnsAbandonedClaimsOnceTheLeaseExpires() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      WebhookDelivery d = delivery("acc_a", T0);
      store().insertDelivery(conn, d, "enqueued");
      store().updateDelivery(conn, d.claimed(T0), DeliveryStatus.PENDING, "claimed");

      Instant now = T0.plus(Duration.ofMinutes(4));
      assertTrue(store().pollDueDeliveries(conn, now, now.minus(Duration.ofMinutes(5)), 10).isEmpty());

      now = T0.plus(Duration.ofMinutes(6));
      List<WebhookDelivery> due = store().pollDueDeliveries(conn, now, now.minus(Duration.ofMinutes(5)), 10);
      assertEquals(1, due.size());
      assertEquals(DeliveryStatus.DELIVERING, due.get(0).status());
    }
  }

  @Test
  void deferMovesOnlyOpenUnclaimedDeliveries() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      WebhookDelivery open = delivery("acc_a", T0);
      WebhookDelivery inFlight = delivery("acc_b", T0);
      store().insertDelivery(conn, open, "enqueued");
      store().insertDelivery(conn, inFlight, "enqueued");
      store().updateDelivery(conn, inFlight.claimed(T0), DeliveryStatus.PENDING, "claimed");

      assertEquals(1, store().deferDelivery(conn, open.id(), T0.plusSeconds(60)));
      assertEquals(0, store().deferDelivery(conn, inFlight.id(), T0.plusSeconds(60)));
      assertEquals(T0.plusSeconds(60), store().findDelivery(conn, open.id()).orElseThrow().nextRetryAt());
      assertEquals(1, store().deliveryHistory(conn, open.id()).size());
    }
  }

  @Test
  void queryAndCountByStatus() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      for (int i = 0; i < 3; i++) {
        WebhookDelivery d = delivery("acc_a", T0);
        store().insertDelivery(conn, d, "enqueued");
        WebhookDelivery claimed = d.claimed(T0);
        store().updateDelivery(conn, claimed, DeliveryStatus.PENDING, "claimed");
        store().updateDelivery(conn, claimed.deadLettered("HTTP 500", T0), DeliveryStatus.DELIVERING, "window exhausted");
      }
      store().insertDelivery(conn, delivery("acc_a", T0), "enqueued");
      store().insertDelivery(conn, delivery("acc_b", T0), "enqueued");

      assertEquals(3, store().countDeliveries(conn, "acc_a", DeliveryStatus.DLQ));
      assertEquals(0, store().countDeliveries(conn, "acc_b", DeliveryStatus.DLQ));
      assertEquals(2, store().queryDeliveries(conn, "acc_a", DeliveryStatus.DLQ, 2).size());
      assertTrue(store().hasOpenDeliveries(conn, "acc_a"));
      assertTrue(store().hasOpenDeliveries(conn, "acc_b"));
      assertFalse(store().hasOpenDeliveries(conn, "acc_c"));
    }
  }

  @Test
  void rolledBackTransitionLeavesNoHistory() throws Exception {
    WebhookDelivery d = delivery("acc_a", T0);
    try (Connection conn = dataSource().getConnection()) {
      conn.setAutoCommit(false);
      store().insertDelivery(conn, d, "enqueued");
      conn.rollback();
      conn.setAutoCommit(true);

      assertTrue(store().findDelivery(conn, d.id()).isEmpty());
      assertTrue(store().deliveryHistory(conn, d.id()).isEmpty());
    }
  }

  @Test
  void duplicateMessageKeepsTheTransactionUsable() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      store().insertMessageIfAbsent(conn, Message.outbound(id(), "acc_1", "k", "psid_1", "a", T0), "accepted");

      conn.setAutoCommit(false);
      assertFalse(store().insertMessageIfAbsent(conn, Message.outbound(id(), "acc_1", "k", "psid_1", "a", T0),
          "accepted"));
      WebhookDelivery d = delivery("acc_1", T0);
      store().insertDelivery(conn, d, "enqueued");
      conn.commit();
      conn.setAutoCommit(true);

      assertTrue(store().findDelivery(conn, d.id()).isPresent());
    }
  }

  static WebhookDelivery delivery(String accountId, Instant at) {
    return WebhookDelivery.create(id(), accountId, WebhookEventType.MESSAGE_RECEIVED, id(),
        "{\"event\":\"message.received\"}", URL, at);
  }

  static String id() {
    return UUID.randomUUID().toString();
  }
}
