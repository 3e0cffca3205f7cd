package com.whereq.iris.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamTransportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StreamTransport transport = new StreamTransport(objectMapper);

    @Test
    void stream_framesEventsAsJsonEnvelope() throws Exception {
        Flux<ServerSentEvent<String>> frames = transport.stream(
                Flux.just(StreamEvent.message("run();", SectionKind.MACRO_SCRIPT)));

        ServerSentEvent<String> frame = frames.blockFirst();
        JsonNode json = objectMapper.readTree(frame.data());

        assertEquals("message", json.get("event").asText());
        assertEquals("run();", json.get("data").get("content").asText());
        assertEquals("macro_script", json.get("data").get("section").asText());
    }

    @Test
    void stream_errorEndsStream() {
        Flux<StreamEvent> events = Flux.just(
                StreamEvent.complete("first"),
                StreamEvent.error("boom"),
                StreamEvent.complete("never sent"));

        StepVerifier.create(transport.stream(events))
                .expectNextCount(1)
                .assertNext(frame -> assertTrue(frame.data().contains("\"boom\"")))
                .verifyComplete();
    }

    @Test
    void stream_upstreamFailureBecomesErrorEvent() throws Exception {
        Flux<StreamEvent> events = Flux.error(new IllegalStateException("backend down"));

        ServerSentEvent<String> frame = transport.stream(events).blockLast();
        JsonNode json = objectMapper.readTree(frame.data());

        assertEquals("error", json.get("event").asText());
        assertEquals("backend down", json.get("data").get("error").asText());
    }

    @Test
    void stream_stopsProducingOnceClientDisconnects() {
        AtomicInteger produced = new AtomicInteger();
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        Flux<StreamEvent> events = Flux.range(0, 10)
                .doOnNext(i -> produced.incrementAndGet())
                .map(i -> StreamEvent.improvedPromptChunk("chunk-" + i))
                .doOnCancel(() -> upstreamCancelled.set(true));

        StepVerifier.create(transport.stream(events), 0)
                .thenRequest(2)
                .expectNextCount(2)
                .thenCancel()
                .verify();

        assertEquals(2, produced.get());
        assertTrue(upstreamCancelled.get());
    }

    @Test
    void stream_disconnectReleasesLiveUpstream() {
        Sinks.Many<StreamEvent> upstream = Sinks.many().unicast().onBackpressureBuffer();

        StepVerifier.create(transport.stream(upstream.asFlux()))
                .then(() -> upstream.tryEmitNext(StreamEvent.improvedPromptChunk("first")))
                .expectNextCount(1)
                .thenCancel()
                .verify();

        assertTrue(upstream.tryEmitNext(StreamEvent.improvedPromptChunk("late")).isFailure());
    }
}
