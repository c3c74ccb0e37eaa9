package relay.spi;

import relay.model.Account;

import java.util.Optional;

/**
 * Read-only lookup of account webhook settings, owned by the account service.
 */
@FunctionalInterface
public interface AccountDirectory {

    /**
     * @param accountId the account id
     * @return the account, or empty if unknown
     */
    Optional<Account> find(String accountId);
}
