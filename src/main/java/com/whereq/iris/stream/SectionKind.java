package com.whereq.iris.stream;

import java.util.List;

/**
 * Structured regions of a generated macro response, in the order the model writes them.
 * The order is cyclic: after {@link #EXPLANATION} comes {@link #DESCRIPTION} again.
 */
public enum SectionKind {
    DESCRIPTION("description"),
    MACRO_SCRIPT("macro_script"),
    EXPLANATION("explanation");

    private static final List<SectionKind> ORDER = List.of(values());

    private final String wireName;

    SectionKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used for this section in stream events
     */
    public String wireName() {
        return wireName;
    }

    public SectionKind next() {
        return ORDER.get((ORDER.indexOf(this) + 1) % ORDER.size());
    }

    public static SectionKind first() {
        return ORDER.get(0);
    }
}
