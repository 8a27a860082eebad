package com.autopost.scheduler.service;

import com.autopost.scheduler.client.Account;
import com.autopost.scheduler.client.AccountResolver;
import com.autopost.scheduler.config.AutopostProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Logs every known account in at start-up, one task per account, before the publish
 * loop starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountLoginBootstrap {

    private final AccountResolver accountResolver;
    private final AutopostProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void onApplicationReady() {
        if (!properties.getAccounts().isAutoLogin()) {
            log.info("Account auto-login disabled");
            return;
        }
        try {
            loginAll();
        } catch (RuntimeException e) {
            log.error("Account auto-login failed: {}", e.getMessage());
        }
    }

    /**
     * @return number of accounts with a usable session afterwards
     */
    public int loginAll() {
        List<Account> accounts = accountResolver.listAccounts();
        if (accounts.isEmpty()) {
            log.info("No accounts to log in");
            return 0;
        }

        log.info("Logging in {} account(s)", accounts.size());
        ExecutorService pool = Executors.newFixedThreadPool(accounts.size());
        try {
            List<CompletableFuture<Boolean>> logins = accounts.stream()
                    .map(account -> CompletableFuture.supplyAsync(() -> login(account), pool))
                    .toList();
            CompletableFuture.allOf(logins.toArray(new CompletableFuture[0])).join();

            int active = (int) logins.stream().filter(CompletableFuture::join).count();
            log.info("{}/{} accounts active", active, accounts.size());
            return active;
        } finally {
            pool.shutdown();
        }
    }

    private boolean login(Account account) {
        try {
            return accountResolver.login(account.getId());
        } catch (RuntimeException e) {
            log.error("Login of account @{} failed: {}", account.getUsername(), e.getMessage());
            return false;
        }
    }
}
