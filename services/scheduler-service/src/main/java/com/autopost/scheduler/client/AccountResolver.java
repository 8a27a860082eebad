package com.autopost.scheduler.client;

import java.util.List;
import java.util.Optional;

/**
 * Access to the stored accounts and their login sessions.
 */
public interface AccountResolver {

    Optional<Account> getAccount(String accountId);

    /**
     * The account's current session, empty when it is not logged in.
     */
    Optional<PublishingClient> getClient(String accountId);

    /**
     * @return true when the account ends up with a usable session
     */
    boolean login(String accountId);

    List<Account> listAccounts();
}
