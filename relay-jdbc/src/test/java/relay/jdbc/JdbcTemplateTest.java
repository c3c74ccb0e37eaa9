package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.StatusStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {
  private Connection conn;

  @BeforeEach
  void setup() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:tpl_" + UUID.randomUUID());
    conn = ds.getConnection();
    JdbcTemplate.update(conn, "CREATE TABLE t (id VARCHAR(10) PRIMARY KEY, n INT, flag BOOLEAN, at TIMESTAMP(3))");
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void bindsAndMapsParameters() {
    Instant at = Instant.parse("2024-03-01T10:00:00.123456Z");
    assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO t VALUES (?,?,?,?)", "a", 7, true,
        JdbcTemplate.timestamp(at)));

    List<String> rows = JdbcTemplate.query(conn, "SELECT id, n, flag, at FROM t WHERE n=?",
        rs -> rs.getString("id") + ":" + rs.getInt("n") + ":" + rs.getBoolean("flag") + ":"
            + JdbcTemplate.instant(rs, "at"),
        7);
    assertEquals(List.of("a:7:true:2024-03-01T10:00:00.123Z"), rows);
  }

  @Test
  void queryOneIsEmptyWithoutRows() {
    assertTrue(JdbcTemplate.queryOne(conn, "SELECT id FROM t WHERE id=?", rs -> rs.getString(1), "x").isEmpty());
  }

  @Test
  void insertUnlessDuplicateReportsTheCollision() {
    assertTrue(JdbcTemplate.insertUnlessDuplicate(conn, "INSERT INTO t (id) VALUES (?)", "a"));
    assertFalse(JdbcTemplate.insertUnlessDuplicate(conn, "INSERT INTO t (id) VALUES (?)", "a"));
  }

  @Test
  void otherErrorsAreWrapped() {
    StatusStoreException e = assertThrows(StatusStoreException.class,
        () -> JdbcTemplate.update(conn, "INSERT INTO missing VALUES (?)", "a"));
    assertInstanceOf(SQLException.class, e.getCause());
    assertThrows(StatusStoreException.class,
        () -> JdbcTemplate.insertUnlessDuplicate(conn, "INSERT INTO t (id, n) VALUES (?,?)", "b", "not a number"));
  }

  @Test
  void nullInstantMapsToNullTimestamp() {
    assertNull(JdbcTemplate.timestamp(null));
  }

  @Test
  void recognisesDuplicateKeyCodes() {
    assertTrue(JdbcTemplate.isDuplicateKey(new SQLException("dup", "23505")));
    assertTrue(JdbcTemplate.isDuplicateKey(new SQLException("Duplicate entry", "23000", 1062)));
    assertFalse(JdbcTemplate.isDuplicateKey(new SQLException("fk", "23503")));
  }
}
