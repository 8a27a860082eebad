package com.autopost.scheduler.client;

import com.autopost.scheduler.config.AutopostProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Account store and login sessions held by the platform connector. A session is cached
 * after a successful login and reused until the next login of the same account.
 */
@Service
@Slf4j
public class ConnectorAccountResolver implements AccountResolver {

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient client;
    private final Duration publishTimeout;
    private final Map<String, PublishingClient> sessions = new ConcurrentHashMap<>();

    public ConnectorAccountResolver(WebClient.Builder webClientBuilder, AutopostProperties properties) {
        this.client = webClientBuilder.baseUrl(properties.getConnector().getBaseUrl()).build();
        this.publishTimeout = properties.getConnector().getTimeout();
    }

    @Override
    public Optional<Account> getAccount(String accountId) {
        try {
            return Optional.ofNullable(client.get()
                    .uri("/api/v1/accounts/{accountId}", accountId)
                    .retrieve()
                    .bodyToMono(Account.class)
                    .timeout(LOOKUP_TIMEOUT)
                    .block());
        } catch (WebClientResponseException.NotFound e) {
            return Optional.empty();
        }
    }

    @Override
    public Optional<PublishingClient> getClient(String accountId) {
        return Optional.ofNullable(sessions.get(accountId));
    }

    @Override
    public boolean login(String accountId) {
        try {
            LoginResponse response = client.post()
                    .uri("/api/v1/accounts/{accountId}/login", accountId)
                    .retrieve()
                    .bodyToMono(LoginResponse.class)
                    .timeout(publishTimeout)
                    .block();

            if (response == null || !response.isSuccess()) {
                log.warn("Login refused for account {}: {}", accountId, response != null ? response.getMessage() : "no response");
                sessions.remove(accountId);
                return false;
            }

            sessions.put(accountId, new ConnectorPublishingClient(client, accountId, publishTimeout));
            log.info("Account {} logged in", accountId);
            return true;
        } catch (Exception e) {
            log.error("Login failed for account {}: {}", accountId, e.getMessage());
            sessions.remove(accountId);
            return false;
        }
    }

    @Override
    public List<Account> listAccounts() {
        List<Account> accounts = client.get()
                .uri("/api/v1/accounts")
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<Account>>() {})
                .timeout(LOOKUP_TIMEOUT)
                .block();
        return accounts != null ? accounts : List.of();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class LoginResponse {
        private boolean success;
        private String message;
    }
}
