package com.whereq.iris.model;

/**
 * Outcome of waiting for a single expected artifact.
 */
public enum FileReadiness {
    /**
     * Exists, non-empty, same size on two consecutive polls
     */
    READY,

    /**
     * Never appeared, or never stopped changing, before the deadline
     */
    TIMEOUT,

    /**
     * Appeared but stayed at zero bytes
     */
    EMPTY
}
