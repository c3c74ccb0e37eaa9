package relay.jdbc.store;

import java.util.List;

/**
 * H2 status store. Primarily for testing.
 *
 * <p>Uses the default duplicate-key detection from {@link AbstractJdbcStatusStore}.
 */
public final class H2StatusStore extends AbstractJdbcStatusStore {

  public H2StatusStore() {
    super();
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
