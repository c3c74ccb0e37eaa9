package relay;

/**
 * Terminal failure such as an invalid recipient or a user who blocked the account.
 */
public final class PermanentDeliveryException extends PlatformException {

  public PermanentDeliveryException(String code, String message) {
    super(code, message, null);
  }

  @Override
  public boolean retryable() {
    return false;
  }
}
