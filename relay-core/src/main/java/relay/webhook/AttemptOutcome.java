package relay.webhook;

/**
 * Classified result of one webhook POST.
 *
 * @param kind       how the retry engine must treat the attempt
 * @param statusCode HTTP status, or {@code 0} if no response was received
 * @param detail     short description for the delivery's {@code last_error}
 */
public record AttemptOutcome(Kind kind, int statusCode, String detail) {

  public enum Kind {
    /** 2xx. */
    DELIVERED,
    /** 401 or 403: the CRM rejected the signature or the endpoint credentials. */
    AUTH_REJECTED,
    /** Any other status, a network error or a timeout. */
    FAILED
  }

  public static AttemptOutcome forStatus(int statusCode) {
    if (statusCode >= 200 && statusCode < 300) {
      return new AttemptOutcome(Kind.DELIVERED, statusCode, null);
    }
    if (statusCode == 401 || statusCode == 403) {
      return new AttemptOutcome(Kind.AUTH_REJECTED, statusCode, "HTTP " + statusCode);
    }
    return new AttemptOutcome(Kind.FAILED, statusCode, "HTTP " + statusCode);
  }

  public static AttemptOutcome networkError(String detail) {
    return new AttemptOutcome(Kind.FAILED, 0, detail);
  }

  public boolean isDelivered() {
    return kind == Kind.DELIVERED;
  }
}
