package relay.status;

import org.junit.jupiter.api.Test;
import relay.NotFoundException;
import relay.model.Message;
import relay.model.MessageStatus;
import relay.model.StatusChange;
import relay.model.WebhookDelivery;
import relay.model.WebhookEventType;
import relay.support.DummyConnections;
import relay.support.InMemoryStatusStore;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusQueriesTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final InMemoryStatusStore store = new InMemoryStatusStore();
  private final StatusQueries queries = new StatusQueries(DummyConnections.provider(), store);

  @Test
  void findsMessagesAndHistory() {
    Message pending = Message.outbound("msg_1", "acc_1", "order_1", "psid_1", "Hello", T0);
    store.insertMessageIfAbsent(null, pending, "reserved");
    store.updateMessage(null, pending.sending(T0.plusMillis(5)), MessageStatus.PENDING, "dispatching");

    assertEquals(MessageStatus.SENDING, queries.message("msg_1").status());
    assertEquals("msg_1", queries.messageByIdempotencyKey("acc_1", "order_1").id());
    List<StatusChange> history = queries.messageHistory("msg_1");
    assertEquals(2, history.size());
    assertEquals("pending", history.get(1).fromStatus());
    assertEquals("sending", history.get(1).toStatus());
    assertEquals(T0.plusMillis(5), history.get(1).occurredAt());
  }

  @Test
  void findsDeliveriesAndHistory() {
    WebhookDelivery d = WebhookDelivery.create("dlv_1", "acc_1", WebhookEventType.MESSAGE_READ, "msg_1",
        "{}", "https://crm.example.com/hook", T0);
    store.insertDelivery(null, d, "enqueued");

    assertEquals(d, queries.delivery("dlv_1"));
    assertEquals("enqueued", queries.deliveryHistory("dlv_1").get(0).reason());
  }

  @Test
  void unknownIdsAreNotFound() {
    assertThrows(NotFoundException.class, () -> queries.message("msg_404"));
    assertThrows(NotFoundException.class, () -> queries.messageByIdempotencyKey("acc_1", "nope"));
    assertThrows(NotFoundException.class, () -> queries.messageHistory("msg_404"));
    assertThrows(NotFoundException.class, () -> queries.delivery("dlv_404"));
    assertThrows(NotFoundException.class, () -> queries.deliveryHistory("dlv_404"));
  }
}
