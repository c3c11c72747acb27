package com.tasklens.server.core.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.tasklens.server.config.TaskLensProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Fetches full session contexts from the remote context service:
 * {@code GET {baseUrl}/contexts/{contextId}} with a bearer token.
 */
@Slf4j
@Component
public class ContextClient {

    static final int MAX_ERROR_BODY = 400;

    private final WebClient webClient;
    private final Duration fetchTimeout;

    public ContextClient(WebClient.Builder webClientBuilder, TaskLensProperties properties) {
        int maxPayloadBytes = (int) Math.min(Integer.MAX_VALUE, properties.getSync().getMaxPayloadSize().toBytes());
        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxPayloadBytes))
                .build();
        this.fetchTimeout = properties.getSync().getFetchTimeout();
    }

    public Mono<JsonNode> fetch(String baseUrl, String apiKey, String contextId) {
        String base = stripTrailingSlashes(baseUrl);
        String url = base + "/contexts/" + contextId;
        log.debug("Fetching context {}", contextId);

        return webClient.get()
                .uri(base + "/contexts/{contextId}", contextId)
                .headers(h -> h.setBearerAuth(apiKey))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ContextFetchException(
                                response.statusCode().value(), url, abbreviate(body))))
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> new ContextFetchException("Empty response body from " + url)))
                .timeout(fetchTimeout);
    }

    public static String stripTrailingSlashes(String baseUrl) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY);
    }
}
