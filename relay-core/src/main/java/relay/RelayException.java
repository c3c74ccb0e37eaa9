package relay;

/**
 * Base class of every exception raised by the relay.
 *
 * <p>All relay exceptions are unchecked. Callers of synchronous operations
 * ({@code send}, {@code forward}, queries) see {@link ValidationException},
 * {@link NotFoundException} and {@link StatusStoreException}; the remaining
 * subtypes are raised by collaborators and consumed by the dispatcher and the
 * retry engine.
 */
public class RelayException extends RuntimeException {

  public RelayException(String message) {
    super(message);
  }

  public RelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
