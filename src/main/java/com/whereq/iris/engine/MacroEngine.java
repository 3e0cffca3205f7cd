package com.whereq.iris.engine;

import com.whereq.iris.model.MacroInvocation;

/**
 * The external ImageJ engine. One instance per process: initialized once at startup,
 * disposed once at shutdown, and never invoked concurrently.
 */
public interface MacroEngine {

    /**
     * Start the engine, retrying as configured. Leaves the engine unavailable when every
     * attempt failed.
     */
    void initialize();

    /**
     * Run a complete macro synchronously.
     *
     * @param script macro source, variable bindings included
     * @return the macro output together with the engine log of this invocation
     * @throws com.whereq.iris.exception.EngineUnavailableException if the engine is not ready
     * @throws com.whereq.iris.exception.MacroExecutionException if the macro failed or timed out
     */
    MacroInvocation runMacro(String script);

    boolean isReady();

    /**
     * Launcher the engine runs, null until resolved.
     */
    String getExecutable();

    /**
     * Release the engine. Safe to call more than once; only the first call has an effect.
     */
    void dispose();
}
