package relay;

/**
 * Retryable failure: network timeout, 5xx response or rate limiting.
 */
public final class TransientException extends PlatformException {

  public TransientException(String code, String message) {
    this(code, message, null);
  }

  public TransientException(String code, String message, Throwable cause) {
    super(code, message, cause);
  }

  @Override
  public boolean retryable() {
    return true;
  }
}
