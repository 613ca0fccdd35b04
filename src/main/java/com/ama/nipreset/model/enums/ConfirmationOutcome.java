package com.ama.nipreset.model.enums;

/**
 * Result of a NIP confirmation attempt.
 */
public enum ConfirmationOutcome {

    /**
     * New NIP handed off and token consumed
     */
    CONFIRMED,

    /**
     * NIP and its confirmation differ; nothing was touched
     */
    NIP_MISMATCH,

    /**
     * Token unknown, already used or expired (deliberately indistinguishable)
     */
    INVALID_OR_EXPIRED,

    /**
     * Webhook receiver failed on every attempt; token left active for a retry
     */
    DEPENDENCY_UNAVAILABLE
}
