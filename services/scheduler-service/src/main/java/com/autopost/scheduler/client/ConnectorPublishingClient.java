package com.autopost.scheduler.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Publishes through the platform connector on behalf of one account.
 */
@Slf4j
public class ConnectorPublishingClient implements PublishingClient {

    private final WebClient client;
    private final String accountId;
    private final Duration timeout;

    public ConnectorPublishingClient(WebClient client, String accountId, Duration timeout) {
        this.client = client;
        this.accountId = accountId;
        this.timeout = timeout;
    }

    @Override
    public MediaHandle publishSingle(Path photo, String caption) {
        return publish("photo", Map.of("path", photo.toString(), "caption", caption(caption)));
    }

    @Override
    public MediaHandle publishAlbum(List<Path> items, String caption) {
        List<String> paths = items.stream().map(Path::toString).toList();
        return publish("album", Map.of("paths", paths, "caption", caption(caption)));
    }

    @Override
    public MediaHandle publishVideo(Path video, String caption) {
        return publish("video", Map.of("path", video.toString(), "caption", caption(caption)));
    }

    private MediaHandle publish(String kind, Map<String, Object> body) {
        log.debug("Publishing {} for account {}", kind, accountId);
        MediaHandle handle;
        try {
            handle = client.post()
                    .uri("/api/v1/accounts/{accountId}/media/{kind}", accountId, kind)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(MediaHandle.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            String reason = e.getResponseBodyAsString();
            throw new PublishingException(reason.isBlank() ? e.getMessage() : reason, e);
        } catch (RuntimeException e) {
            throw new PublishingException("Connector call failed: " + e.getMessage(), e);
        }

        if (handle == null || handle.getId() == null) {
            throw new PublishingException("Connector returned no media id");
        }
        return handle;
    }

    private static String caption(String caption) {
        return caption != null ? caption : "";
    }
}
