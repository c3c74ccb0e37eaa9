/**
 * JDBC support for the relay: a {@link relay.spi.ConnectionProvider} over a
 * {@link javax.sql.DataSource} and the {@link relay.jdbc.JdbcTemplate} helper used by
 * the status stores in {@link relay.jdbc.store}.
 */
package relay.jdbc;
