package relay.model;

import java.util.Objects;

/**
 * Read-only view of an account's CRM webhook settings.
 *
 * @param id            account id
 * @param webhookUrl    CRM endpoint, {@code null} if none is configured
 * @param webhookSecret shared secret used to sign webhook bodies
 * @param status        whether the account is active
 */
public record Account(String id, String webhookUrl, String webhookSecret, AccountStatus status) {

  public Account {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
  }

  public boolean isActive() {
    return status == AccountStatus.ACTIVE;
  }

  public boolean hasWebhook() {
    return webhookUrl != null && !webhookUrl.isBlank()
        && webhookSecret != null && !webhookSecret.isEmpty();
  }

  @Override
  public String toString() {
    return "Account[id=" + id + ", webhookUrl=" + webhookUrl + ", status=" + status + "]";
  }
}
