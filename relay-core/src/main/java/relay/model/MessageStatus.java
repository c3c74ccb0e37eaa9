package relay.model;

/**
 * Lifecycle of a {@link Message}.
 *
 * <p>Outbound messages move {@code pending -> sending -> sent -> delivered -> read}
 * or end in {@code failed}. Inbound messages are stored as {@code received} and
 * never change afterwards.
 */
public enum MessageStatus {
  PENDING("pending", 0),
  SENDING("sending", 1),
  SENT("sent", 2),
  DELIVERED("delivered", 3),
  READ("read", 4),
  FAILED("failed", 5),
  RECEIVED("received", 0);

  private final String code;
  private final int rank;

  MessageStatus(String code, int rank) {
    this.code = code;
    this.rank = rank;
  }

  public String code() {
    return code;
  }

  /**
   * Returns whether a platform receipt may move a message from this status to {@code next}.
   * Receipts only move forward along {@code sent -> delivered -> read}.
   */
  public boolean acceptsReceipt(MessageStatus next) {
    if (next != DELIVERED && next != READ) {
      return false;
    }
    return (this == SENT || this == DELIVERED) && next.rank > rank;
  }

  public static MessageStatus fromCode(String code) {
    for (MessageStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown message status: " + code);
  }
}
