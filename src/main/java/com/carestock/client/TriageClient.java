package com.carestock.client;

import com.carestock.dto.UrgencyTier;
import com.carestock.exception.TriageApiException;
import com.carestock.exception.TriageUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for the external triage assistant. The engine never depends on it; it is exposed
 * so operators get patient urgency in the same tier vocabulary as stock urgency.
 */
@Slf4j
@Component
public class TriageClient {

    @Value("${triage.api.base-url}")
    private String baseUrl;

    @Value("${triage.api.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("TriageClient initialised → {}", baseUrl);
    }

    public Mono<TriageAssessment> assess(String patientId, String requestId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("patient_id", patientId);
        return webClient.post().uri("/triage")
            .header("X-Request-ID", requestId)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new TriageApiException("Triage service rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new TriageUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .switchIfEmpty(Mono.error(() -> new TriageApiException("Triage service returned an empty body")))
            .map(this::toAssessment)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new TriageUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, TriageUnavailableException::new);
    }

    private TriageAssessment toAssessment(JsonNode json) {
        if (json == null || !json.hasNonNull("urgency_level")) {
            throw new TriageApiException("Triage response missing 'urgency_level': " + json);
        }
        List<String> actions = new ArrayList<>();
        JsonNode actionsNode = json.get("recommended_actions");
        if (actionsNode != null && actionsNode.isArray()) {
            actionsNode.forEach(a -> actions.add(a.asText()));
        }
        JsonNode reasoning = json.get("reasoning");
        return new TriageAssessment(
            json.get("urgency_level").asText(),
            List.copyOf(actions),
            (reasoning == null || reasoning.isNull()) ? null : reasoning.asText());
    }

    public record TriageAssessment(String urgencyLevel, List<String> recommendedActions, String reasoning) {
        public UrgencyTier tier() {
            return UrgencyTier.fromLabel(urgencyLevel);
        }
    }
}
