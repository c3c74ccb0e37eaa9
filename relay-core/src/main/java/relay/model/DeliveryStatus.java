package relay.model;

public enum DeliveryStatus {
  PENDING("pending"),
  DELIVERING("delivering"),
  DELIVERED("delivered"),
  RETRYING("retrying"),
  DLQ("dlq"),
  FAILED_AUTH("failed_auth");

  private final String code;

  DeliveryStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** No automatic transition leaves a terminal status. */
  public boolean isTerminal() {
    return this == DELIVERED || this == DLQ || this == FAILED_AUTH;
  }

  /** Open deliveries still hold their account's place in the delivery order. */
  public boolean isOpen() {
    return !isTerminal();
  }

  /** Only dead-lettered and auth-failed deliveries may be requeued by an operator. */
  public boolean isRequeueable() {
    return this == DLQ || this == FAILED_AUTH;
  }

  public static DeliveryStatus fromCode(String code) {
    for (DeliveryStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + code);
  }
}
