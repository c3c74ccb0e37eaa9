package relay.model;

import java.util.Objects;

/**
 * Last error recorded on a message.
 *
 * @param code      platform or relay error code
 * @param message   human readable description
 * @param retryable whether a later attempt might succeed
 */
public record MessageError(String code, String message, boolean retryable) {

  public MessageError {
    Objects.requireNonNull(code, "code");
  }
}
