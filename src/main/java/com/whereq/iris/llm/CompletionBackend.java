package com.whereq.iris.llm;

import reactor.core.publisher.Flux;

/**
 * Streaming language-model backend.
 */
public interface CompletionBackend {

    /**
     * Stream the completion for one user message.
     *
     * @param systemPrompt system instructions
     * @param userContent user message
     * @return text deltas in arrival order, completing when the model has finished
     */
    Flux<String> stream(String systemPrompt, String userContent);
}
