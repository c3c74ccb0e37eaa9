package relay;

/**
 * Failure reported by the messaging platform, carrying the platform's error code.
 *
 * <p>The concrete subtype decides how the outbound dispatcher treats the failure:
 * {@link TransientException} is retried, {@link PermanentDeliveryException} and
 * {@link AuthException} are terminal.
 */
public abstract sealed class PlatformException extends RelayException
    permits TransientException, PermanentDeliveryException, AuthException {
  private final String code;

  protected PlatformException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? "unknown" : code;
  }

  public String code() {
    return code;
  }

  /**
   * Returns whether the same request may succeed if sent again later.
   */
  public abstract boolean retryable();
}
