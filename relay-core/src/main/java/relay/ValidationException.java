package relay;

/**
 * Thrown when a caller supplies invalid input. Never retried.
 */
public final class ValidationException extends RelayException {

  public ValidationException(String message) {
    super(message);
  }
}
