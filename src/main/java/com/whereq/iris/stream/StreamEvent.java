package com.whereq.iris.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One event pushed to the browser. Serialized as {@code {"event": <event>, "data": <data>}}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StreamEvent {

    public static final String SECTION_CHANGE = "section_change";
    public static final String MESSAGE = "message";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";
    public static final String IMPROVED_PROMPT_CHUNK = "improved_prompt_chunk";
    public static final String IMPROVED_PROMPT_COMPLETE = "improved_prompt_complete";

    String event;

    Map<String, Object> data;

    public static StreamEvent sectionChange(SectionKind section, String content) {
        return of(SECTION_CHANGE, "section", section.wireName(), "content", content);
    }

    public static StreamEvent message(String chunk, SectionKind section) {
        return of(MESSAGE, "content", chunk, "section", section.wireName());
    }

    public static StreamEvent complete(String message) {
        return of(COMPLETE, "message", message);
    }

    public static StreamEvent error(String message) {
        return of(ERROR, "error", message);
    }

    public static StreamEvent improvedPromptChunk(String chunk) {
        return of(IMPROVED_PROMPT_CHUNK, "chunk", chunk);
    }

    public static StreamEvent improvedPromptComplete(String message) {
        return of(IMPROVED_PROMPT_COMPLETE, "message", message);
    }

    public boolean isError() {
        return ERROR.equals(event);
    }

    private static StreamEvent of(String event, Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new StreamEvent(event, Collections.unmodifiableMap(data));
    }
}
