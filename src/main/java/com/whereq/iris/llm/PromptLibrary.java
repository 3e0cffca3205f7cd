package com.whereq.iris.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt texts for the completion backend, loaded once from {@code classpath:prompts/}.
 */
@Slf4j
@Component
public class PromptLibrary {

    static final String MACRO_GENERATION = "classpath:prompts/macro_generation.txt";
    static final String PROMPT_IMPROVEMENT = "classpath:prompts/prompt_improvement.txt";
    static final String PROMPT_IMPROVEMENT_USER = "classpath:prompts/prompt_improvement_user.txt";

    private static final String USER_INPUT_PLACEHOLDER = "{user_input}";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public PromptLibrary(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public String macroGenerationSystem() {
        return load(MACRO_GENERATION);
    }

    public String promptImprovementSystem() {
        return load(PROMPT_IMPROVEMENT);
    }

    public String promptImprovementUser(String userInput) {
        return load(PROMPT_IMPROVEMENT_USER).replace(USER_INPUT_PLACEHOLDER, userInput == null ? "" : userInput);
    }

    private String load(String location) {
        return cache.computeIfAbsent(location, this::read);
    }

    private String read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new UncheckedIOException(new FileNotFoundException("Prompt does not exist at: " + location));
        }
        try (InputStream in = resource.getInputStream()) {
            log.debug("Loaded prompt {}", location);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt " + location, e);
        }
    }
}
