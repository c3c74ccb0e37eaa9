package relay;

/**
 * Rejected credential: an invalid or expired platform token, or a webhook signature
 * the CRM refused. Terminal; an operator alert is raised.
 */
public final class AuthException extends PlatformException {

  public AuthException(String code, String message) {
    super(code, message, null);
  }

  @Override
  public boolean retryable() {
    return false;
  }
}
