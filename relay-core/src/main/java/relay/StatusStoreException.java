package relay;

/**
 * Unchecked exception wrapping persistence failures of the status store.
 */
public final class StatusStoreException extends RelayException {

  public StatusStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
