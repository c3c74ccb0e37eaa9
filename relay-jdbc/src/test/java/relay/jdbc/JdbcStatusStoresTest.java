package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import relay.jdbc.store.AbstractJdbcStatusStore;
import relay.jdbc.store.JdbcStatusStores;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcStatusStoresTest {

  @Test
  void allReturnsBuiltInStores() {
    List<AbstractJdbcStatusStore> stores = JdbcStatusStores.all();

    assertEquals(3, stores.size());
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcStatusStores.get("MySQL").name());
    assertEquals("postgresql", JdbcStatusStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcStatusStores.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcStatusStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown status store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcStatusStores.detect("jdbc:mysql://localhost:3306/crm").name());
    assertEquals("mysql", JdbcStatusStores.detect("jdbc:tidb://localhost:4000/crm").name());
    assertEquals("postgresql", JdbcStatusStores.detect("jdbc:postgresql://localhost:5432/crm").name());
    assertEquals("h2", JdbcStatusStores.detect("JDBC:H2:mem:test").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknownOrEmpty() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcStatusStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No status store found"));
    assertTrue(ex.getMessage().contains("jdbc:postgresql:"));

    assertThrows(IllegalArgumentException.class, () -> JdbcStatusStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcStatusStores.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:detect_" + UUID.randomUUID());

    assertEquals("h2", JdbcStatusStores.detect(ds).name());
  }
}
