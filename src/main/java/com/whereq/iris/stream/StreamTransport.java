package com.whereq.iris.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Frames {@link StreamEvent}s as server-sent events carrying a
 * {@code {"event": ..., "data": ...}} JSON envelope.
 *
 * <p>A client disconnect reaches the stream as a cancellation of the response subscription.
 * Cancellation propagates upstream before the next event is requested, so nothing is produced
 * or sent after it and the generation stops without an error. Any upstream error is turned
 * into exactly one {@code error} event, after which the stream ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamTransport {

    private final ObjectMapper objectMapper;

    public Flux<ServerSentEvent<String>> stream(Flux<StreamEvent> events) {
        return events
            .onErrorResume(e -> {
                log.error("Event stream failed: {}", e.getMessage(), e);
                return Flux.just(StreamEvent.error(
                    Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName())));
            })
            .takeUntil(StreamEvent::isError)
            .map(this::frame)
            .doOnCancel(() -> log.info("Client disconnected. Closing stream."));
    }

    ServerSentEvent<String> frame(StreamEvent event) {
        return ServerSentEvent.<String>builder()
            .data(toJson(event))
            .build();
    }

    String toJson(StreamEvent event) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", event.getEvent());
        envelope.put("data", event.getData());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream event " + event.getEvent(), e);
        }
    }
}
