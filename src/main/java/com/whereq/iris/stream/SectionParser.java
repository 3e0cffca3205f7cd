package com.whereq.iris.stream;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Re-segments a streamed macro response into description, script and explanation sections.
 *
 * <p>Each text delta either belongs to the current section, in which case it is forwarded
 * raw as a {@code message} event, or contains a boundary marker, in which case the current
 * section is closed with a cleaned {@code section_change} event and the next section in
 * {@link SectionKind} order begins. A delta that carries a boundary is split at the marker:
 * text before it closes the old section, the marker and everything after it seed the new one.
 *
 * <p>One instance serves exactly one generation; it is not thread safe and cannot be reused
 * once {@link #finish()} or {@link #fail(Throwable)} has been called.
 */
@Slf4j
public class SectionParser {

    public static final String DESCRIPTION_MARKER = "[DESCRIPTION]";
    public static final String EXPLANATION_MARKER = "[EXPLANATION]";
    public static final String CODE_FENCE = "```";
    public static final String SCRIPT_HEADER = "// Generated ImageJ Macro";
    public static final String COMPLETE_MESSAGE = "Macro generation complete";

    private static final Pattern FENCE = Pattern.compile("```[\\w+#.-]*");
    private static final Pattern MARKERS = Pattern.compile("(\\*\\*)?\\[(DESCRIPTION|EXPLANATION)](\\*\\*)?");

    /**
     * Boundaries, each a marker plus the states in which seeing it ends the current section.
     * A marker never ends the section it opened.
     */
    private enum Boundary {
        DESCRIPTION_START(DESCRIPTION_MARKER, state -> state != SectionKind.DESCRIPTION),
        SCRIPT_START(CODE_FENCE, state -> state == SectionKind.DESCRIPTION),
        EXPLANATION_START(EXPLANATION_MARKER, state -> state != SectionKind.EXPLANATION);

        private final String marker;
        private final Predicate<SectionKind> activeIn;

        Boundary(String marker, Predicate<SectionKind> activeIn) {
            this.marker = marker;
            this.activeIn = activeIn;
        }

        boolean triggers(String delta, SectionKind state) {
            return activeIn.test(state) && delta.contains(marker);
        }
    }

    private SectionKind current = SectionKind.first();
    private final StringBuilder content = new StringBuilder();
    private boolean terminated;

    /**
     * Wrap a delta stream: every delta is parsed as it arrives, the trailing section and a
     * {@code complete} event follow normal completion, and an upstream failure becomes a
     * single {@code error} event with nothing after it.
     */
    public static Flux<StreamEvent> parse(Flux<String> deltas) {
        return Flux.defer(() -> {
            SectionParser parser = new SectionParser();
            return deltas.concatMapIterable(parser::accept)
                .concatWith(Flux.defer(() -> Flux.fromIterable(parser.finish())))
                .onErrorResume(e -> Mono.just(parser.fail(e)));
        });
    }

    public SectionKind currentSection() {
        return current;
    }

    /**
     * Consume one delta and return the events it produces, in order.
     */
    public List<StreamEvent> accept(String delta) {
        ensureOpen();
        List<StreamEvent> events = new ArrayList<>();
        if (delta == null || delta.isEmpty()) {
            return events;
        }

        String remaining = delta;
        boolean transitioned = false;
        int split;
        while ((split = boundaryIndex(remaining)) >= 0) {
            content.append(remaining, 0, split);
            events.add(closeSection());
            remaining = remaining.substring(split);
            transitioned = true;
        }
        content.append(remaining);

        if (!transitioned) {
            events.add(StreamEvent.message(delta, current));
        }
        return events;
    }

    /**
     * Called once the upstream completed normally.
     */
    public List<StreamEvent> finish() {
        ensureOpen();
        terminated = true;
        List<StreamEvent> events = new ArrayList<>(2);
        if (content.length() > 0) {
            events.add(StreamEvent.sectionChange(current, clean(current, content.toString())));
            content.setLength(0);
        }
        events.add(StreamEvent.complete(COMPLETE_MESSAGE));
        return events;
    }

    /**
     * Called once the upstream failed; the returned event is the last of the generation.
     */
    public StreamEvent fail(Throwable error) {
        terminated = true;
        log.error("Macro generation stream failed in section {}: {}", current.wireName(), error.getMessage(), error);
        return StreamEvent.error(Objects.requireNonNullElse(error.getMessage(), error.getClass().getSimpleName()));
    }

    /**
     * Strip section markers; for the script also strip code fences, drop blank lines and
     * make sure the first line is a comment.
     */
    public static String clean(SectionKind section, String raw) {
        String text = MARKERS.matcher(raw).replaceAll("").strip();
        if (section != SectionKind.MACRO_SCRIPT) {
            return text;
        }

        text = FENCE.matcher(text).replaceAll("");
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            return "";
        }
        String first = lines.get(0).strip();
        if (!first.startsWith("//") && !first.startsWith("/*")) {
            lines.add(0, SCRIPT_HEADER);
        }
        return String.join("\n", lines).strip();
    }

    private StreamEvent closeSection() {
        StreamEvent event = StreamEvent.sectionChange(current, clean(current, content.toString()));
        log.debug("Section {} closed ({} chars)", current.wireName(), content.length());
        current = current.next();
        content.setLength(0);
        return event;
    }

    /**
     * Position of the first marker in {@code text} that ends the current section, or -1.
     */
    private int boundaryIndex(String text) {
        int earliest = -1;
        for (Boundary boundary : Boundary.values()) {
            if (boundary.triggers(text, current)) {
                int index = text.indexOf(boundary.marker);
                if (earliest < 0 || index < earliest) {
                    earliest = index;
                }
            }
        }
        return earliest;
    }

    private void ensureOpen() {
        if (terminated) {
            throw new IllegalStateException("Section parser already terminated");
        }
    }
}
