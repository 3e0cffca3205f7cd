package com.whereq.iris.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.exception.CompletionBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CompletionBackend} on the Anthropic Messages API with {@code stream: true}.
 *
 * <p>Only {@code text_delta} content is forwarded; {@code error} events fail the stream with
 * {@link CompletionBackendException}. All other event types (message_start, ping, ...) are
 * ignored.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class AnthropicCompletionBackend implements CompletionBackend {

    static final String MESSAGES_PATH = "/v1/messages";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final IrisProperties.LlmConfig llm;

    public AnthropicCompletionBackend(@Qualifier("completionWebClient") WebClient webClient,
                                      ObjectMapper objectMapper,
                                      IrisProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.llm = properties.getLlm();
    }

    @Override
    public Flux<String> stream(String systemPrompt, String userContent) {
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            return Flux.error(new CompletionBackendException("No API key configured for the completion backend"));
        }

        log.info("Requesting streamed completion from model {}", llm.getModel());

        return webClient.post()
            .uri(MESSAGES_PATH)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(requestBody(systemPrompt, userContent))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new CompletionBackendException(
                    "Completion request failed with status " + response.statusCode().value() + ": " + body))))
            .bodyToFlux(SSE_TYPE)
            .<String>handle((event, sink) -> {
                try {
                    textDelta(event.event(), event.data()).ifPresent(sink::next);
                } catch (CompletionBackendException e) {
                    sink.error(e);
                }
            })
            .doOnComplete(() -> log.debug("Completion stream finished"))
            .doOnError(e -> log.error("Completion stream failed: {}", e.getMessage()));
    }

    Map<String, Object> requestBody(String systemPrompt, String userContent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", llm.getModel());
        body.put("max_tokens", llm.getMaxTokens());
        body.put("temperature", llm.getTemperature());
        body.put("system", systemPrompt);
        body.put("stream", true);
        body.put("messages", List.of(Map.of("role", "user", "content", userContent)));
        return body;
    }

    /**
     * Extract the text carried by one streamed event.
     *
     * @param eventType SSE event name, may be null
     * @param data JSON payload, may be null
     * @return the text of a {@code text_delta}, empty for any other event
     * @throws CompletionBackendException for {@code error} events or malformed payloads
     */
    Optional<String> textDelta(String eventType, String data) {
        if (data == null || data.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new CompletionBackendException("Malformed completion event: " + data, e);
        }

        String type = eventType != null ? eventType : node.path("type").asText();
        if ("error".equals(type) || "error".equals(node.path("type").asText())) {
            String message = node.path("error").path("message").asText("Unknown completion error");
            throw new CompletionBackendException(message);
        }
        if (!"content_block_delta".equals(type)) {
            return Optional.empty();
        }

        JsonNode delta = node.path("delta");
        if (!"text_delta".equals(delta.path("type").asText())) {
            return Optional.empty();
        }
        String text = delta.path("text").asText("");
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
