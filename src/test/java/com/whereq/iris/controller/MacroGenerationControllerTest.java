package com.whereq.iris.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.iris.service.MacroGenerationService;
import com.whereq.iris.stream.SectionKind;
import com.whereq.iris.stream.StreamEvent;
import com.whereq.iris.stream.StreamTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MacroGenerationControllerTest {

    private MacroGenerationService service;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        service = mock(MacroGenerationService.class);
        client = WebTestClient.bindToController(
                new MacroGenerationController(service, new StreamTransport(new ObjectMapper()))).build();
    }

    @Test
    void generateMacro_streamsEnvelopes() {
        when(service.generateMacro("count cells", false)).thenReturn(Flux.just(
                StreamEvent.sectionChange(SectionKind.DESCRIPTION, "Counts cells."),
                StreamEvent.complete("Macro generation complete")));

        List<String> frames = client.get()
                .uri(uriBuilder -> uriBuilder.path("/api/v1/stream-generate-macro").queryParam("input", "count cells").build())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .returnResult(String.class)
                .getResponseBody()
                .collectList()
                .block();

        assertEquals(2, frames.size());
        assertEquals("{\"event\":\"section_change\",\"data\":{\"section\":\"description\",\"content\":\"Counts cells.\"}}",
                frames.get(0));
        assertTrue(frames.get(1).contains("\"event\":\"complete\""));
    }

    @Test
    void improvePrompt_streamsChunks() {
        when(service.improvePrompt("blur")).thenReturn(Flux.just(
                StreamEvent.improvedPromptChunk("Apply a Gaussian blur"),
                StreamEvent.improvedPromptComplete("Prompt improvement complete")));

        List<String> frames = client.get()
                .uri(uriBuilder -> uriBuilder.path("/api/v1/stream-improve-prompt").queryParam("input", "blur").build())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class)
                .getResponseBody()
                .collectList()
                .block();

        assertEquals("{\"event\":\"improved_prompt_chunk\",\"data\":{\"chunk\":\"Apply a Gaussian blur\"}}", frames.get(0));
        assertTrue(frames.get(1).contains("improved_prompt_complete"));
    }

    @Test
    void generateMacro_passesImprovePromptFlag() {
        when(service.generateMacro("count cells", true)).thenReturn(Flux.just(
                StreamEvent.improvedPromptChunk("Count every cell"),
                StreamEvent.improvedPromptComplete("Prompt improvement complete"),
                StreamEvent.complete("Macro generation complete")));

        List<String> frames = client.get()
                .uri(uriBuilder -> uriBuilder.path("/api/v1/stream-generate-macro")
                        .queryParam("input", "count cells")
                        .queryParam("improve_prompt", "true")
                        .build())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class)
                .getResponseBody()
                .collectList()
                .block();

        assertEquals(3, frames.size());
        assertEquals("{\"event\":\"improved_prompt_chunk\",\"data\":{\"chunk\":\"Count every cell\"}}", frames.get(0));
        assertTrue(frames.get(2).contains("\"event\":\"complete\""));
    }
}
