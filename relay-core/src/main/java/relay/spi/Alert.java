package relay.spi;

/**
 * Operator-facing notification about a failure that needs a human.
 *
 * @param kind      what happened
 * @param accountId affected account
 * @param subjectId message or delivery id
 * @param detail    short description (no payload, no secrets)
 */
public record Alert(Kind kind, String accountId, String subjectId, String detail) {

  public enum Kind {
    /** The CRM answered 401/403 to a signed webhook. */
    WEBHOOK_AUTH_FAILED,
    /** A webhook delivery exhausted its retry window. */
    WEBHOOK_DEAD_LETTERED,
    /** The platform rejected the account's credentials. */
    PLATFORM_AUTH_FAILED
  }
}
