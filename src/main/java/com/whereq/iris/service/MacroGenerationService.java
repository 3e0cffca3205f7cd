package com.whereq.iris.service;

import com.whereq.iris.llm.CompletionBackend;
import com.whereq.iris.llm.PromptLibrary;
import com.whereq.iris.stream.SectionParser;
import com.whereq.iris.stream.StreamEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.Objects;

/**
 * Streams macro generation and prompt improvement from the completion backend as
 * {@link StreamEvent}s.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MacroGenerationService {

    static final String IMPROVEMENT_COMPLETE_MESSAGE = "Prompt improvement complete";

    private final CompletionBackend completionBackend;
    private final PromptLibrary prompts;

    /**
     * Generate a macro for {@code prompt}, split into description, script and explanation
     * sections while the model is still writing.
     */
    public Flux<StreamEvent> generateMacro(String prompt) {
        log.info("Generating macro for prompt of {} characters", prompt == null ? 0 : prompt.length());
        return SectionParser.parse(Flux.defer(() ->
            completionBackend.stream(prompts.macroGenerationSystem(), generationRequest(prompt))));
    }

    /**
     * Generate a macro, optionally rewriting {@code prompt} first. With {@code improvePrompt}
     * the improvement is streamed as chunk events, and generation starts from the full
     * improved text once it is complete; a failed improvement ends the stream with its error.
     */
    public Flux<StreamEvent> generateMacro(String prompt, boolean improvePrompt) {
        if (!improvePrompt) {
            return generateMacro(prompt);
        }
        return Flux.defer(() -> {
            StringBuilder improved = new StringBuilder();
            return improvementEvents(prompt, improved)
                .concatWith(Flux.defer(() -> {
                    String improvedPrompt = improved.toString().strip();
                    if (improvedPrompt.isEmpty()) {
                        log.warn("Prompt improvement returned no text, generating from the original prompt");
                        return generateMacro(prompt);
                    }
                    return generateMacro(improvedPrompt);
                }))
                .onErrorResume(this::errorEvent);
        });
    }

    /**
     * Rewrite {@code input} into a more precise generation prompt, chunk by chunk.
     */
    public Flux<StreamEvent> improvePrompt(String input) {
        return Flux.defer(() -> improvementEvents(input, new StringBuilder()))
            .onErrorResume(this::errorEvent);
    }

    private Flux<StreamEvent> improvementEvents(String input, StringBuilder improved) {
        log.info("Improving prompt of {} characters", input == null ? 0 : input.length());
        return completionBackend.stream(prompts.promptImprovementSystem(), prompts.promptImprovementUser(input))
            .doOnNext(improved::append)
            .map(StreamEvent::improvedPromptChunk)
            .concatWith(Flux.just(StreamEvent.improvedPromptComplete(IMPROVEMENT_COMPLETE_MESSAGE)));
    }

    private Flux<StreamEvent> errorEvent(Throwable e) {
        log.error("Error improving prompt: {}", e.getMessage(), e);
        return Flux.just(StreamEvent.error(Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName())));
    }

    static String generationRequest(String prompt) {
        return "Generate an ImageJ macro script that accomplishes this task:\n\n"
            + (prompt == null ? "" : prompt)
            + "\n\nEnsure all sections (description, macro script, and explanation) are properly formatted.";
    }
}
