package relay.model;

public enum MessageDirection {
  INBOUND("inbound"),
  OUTBOUND("outbound");

  private final String code;

  MessageDirection(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static MessageDirection fromCode(String code) {
    for (MessageDirection direction : values()) {
      if (direction.code.equals(code)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown message direction: " + code);
  }
}
