package relay.model;

public enum AccountStatus {
  ACTIVE,
  INACTIVE
}
