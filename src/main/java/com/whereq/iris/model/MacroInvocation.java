package com.whereq.iris.model;

import lombok.Value;

/**
 * What one engine invocation printed: the macro's own output and the engine log written
 * while it ran. Both belong to that invocation only.
 */
@Value
public class MacroInvocation {

    String output;

    String log;

    public static MacroInvocation of(String output, String log) {
        return new MacroInvocation(output == null ? "" : output, log == null ? "" : log);
    }

    /**
     * The macro output, or the engine log when the macro printed nothing.
     */
    public String text() {
        return output.isBlank() ? log : output;
    }
}
