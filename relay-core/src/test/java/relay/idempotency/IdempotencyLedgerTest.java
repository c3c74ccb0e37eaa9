package relay.idempotency;

import org.junit.jupiter.api.Test;
import relay.ValidationException;
import relay.model.InboundEvent;
import relay.model.Message;
import relay.model.StatusChange;
import relay.support.DummyConnections;
import relay.support.InMemoryStatusStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyLedgerTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final InMemoryStatusStore store = new InMemoryStatusStore();
  private final IdempotencyLedger ledger = new IdempotencyLedger(DummyConnections.provider(), store);

  private static Message draft(String id, String account, String key) {
    return Message.outbound(id, account, key, "psid_1", "hi", NOW);
  }

  @Test
  void firstReservationIsNewAndRecordsHistory() {
    Reservation reservation = ledger.reserve(draft("msg_1", "acc_1", "order_1"));

    assertTrue(reservation.isNew());
    assertEquals("msg_1", reservation.message().id());
    List<StatusChange> history = store.messageHistory(null, "msg_1");
    assertEquals(1, history.size());
    assertNull(history.get(0).fromStatus());
    assertEquals("pending", history.get(0).toStatus());
  }

  @Test
  void duplicateKeyReturnsExistingMessage() {
    ledger.reserve(draft("msg_1", "acc_1", "order_1"));

    Reservation second = ledger.reserve(draft("msg_2", "acc_1", "order_1"));

    assertFalse(second.isNew());
    assertEquals("msg_1", second.message().id());
    assertNull(store.message("msg_2"));
  }

  @Test
  void sameKeyOnAnotherAccountIsIndependent() {
    ledger.reserve(draft("msg_1", "acc_1", "order_1"));

    assertTrue(ledger.reserve(draft("msg_2", "acc_2", "order_1")).isNew());
  }

  @Test
  void concurrentReservationsHaveExactlyOneWinner() throws Exception {
    int callers = 16;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Reservation>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < callers; i++) {
        String id = "msg_" + i;
        Callable<Reservation> call = () -> {
          start.await();
          return ledger.reserve(draft(id, "acc_1", "order_9"));
        };
        futures.add(pool.submit(call));
      }
      start.countDown();

      int winners = 0;
      Set<String> ids = ConcurrentHashMap.newKeySet();
      for (Future<Reservation> future : futures) {
        Reservation r = future.get();
        if (r.isNew()) {
          winners++;
        }
        ids.add(r.message().id());
      }
      assertEquals(1, winners);
      assertEquals(1, ids.size());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsDraftsWithoutKey() {
    assertThrows(ValidationException.class, () -> ledger.reserve(draft("msg_1", "acc_1", " ")));
    Message inbound = Message.inbound("msg_2", "acc_1",
        InboundEvent.text("pm_1", "psid_1", "page_1", "hi", NOW), NOW);
    assertThrows(ValidationException.class, () -> ledger.reserve(inbound));
  }
}
