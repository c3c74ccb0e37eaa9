/**
 * JDBC-based {@link relay.spi.StatusStore} implementations.
 *
 * <p>{@link relay.jdbc.store.AbstractJdbcStatusStore} provides shared SQL and row mapping;
 * subclasses supply the database-specific insert that skips duplicate messages: H2
 * (duplicate-key error), MySQL ({@code INSERT IGNORE}) and PostgreSQL
 * ({@code ON CONFLICT DO NOTHING}).
 *
 * @see relay.jdbc.store.JdbcStatusStores
 */
package relay.jdbc.store;
