package relay;

/**
 * Thrown when an account, message or webhook delivery id is unknown.
 */
public final class NotFoundException extends RelayException {
  private final String kind;
  private final String id;

  public NotFoundException(String kind, String id) {
    super(kind + " not found: " + id);
    this.kind = kind;
    this.id = id;
  }

  /** The kind of entity that was looked up, e.g. {@code "account"}. */
  public String kind() {
    return kind;
  }

  public String id() {
    return id;
  }
}
