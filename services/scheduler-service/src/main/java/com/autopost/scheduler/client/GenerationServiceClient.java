package com.autopost.scheduler.client;

import com.autopost.scheduler.config.AutopostProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client of the content generation service. Quota rejections keep the service's message
 * so callers can read the advertised retry delay from it.
 */
@Service
@Slf4j
public class GenerationServiceClient {

    private final WebClient client;
    private final Duration timeout;

    public GenerationServiceClient(WebClient.Builder webClientBuilder, AutopostProperties properties) {
        this.client = webClientBuilder.baseUrl(properties.getGeneration().getBaseUrl()).build();
        this.timeout = properties.getGeneration().getTimeout();
    }

    public String generateCaption(String currentText, String theme, String language, List<String> keywords) {
        Map<String, Object> body = new HashMap<>();
        body.put("text", currentText != null ? currentText : "");
        body.put("theme", theme != null ? theme : "");
        body.put("keywords", keywords != null ? keywords : List.of());
        if (language != null && !language.isBlank()) {
            body.put("language", language);
        }

        GeneratedText response;
        try {
            response = client.post()
                    .uri("/api/v1/generate/text")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(GeneratedText.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            String reason = e.getResponseBodyAsString();
            throw new GenerationServiceException(e.getStatusCode().value() + " " + (reason.isBlank() ? e.getStatusText() : reason), e);
        } catch (RuntimeException e) {
            throw new GenerationServiceException("Generation service unavailable: " + e.getMessage(), e);
        }

        if (response == null || response.getText() == null || response.getText().isBlank()) {
            throw new GenerationServiceException("Generation service returned no text", null);
        }
        log.debug("Generated caption of {} characters", response.getText().length());
        return response.getText();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class GeneratedText {
        private String text;
    }
}
