package relay.util;

import java.util.UUID;

/**
 * Generates prefixed random ids such as {@code msg_3f2a...}.
 */
public final class Ids {
  private Ids() {
  }

  public static String messageId() {
    return "msg_" + compactUuid();
  }

  public static String deliveryId() {
    return "dlv_" + compactUuid();
  }

  private static String compactUuid() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
