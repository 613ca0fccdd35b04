package com.ama.nipreset.model.enums;

/**
 * State of a reset token as seen at read time.
 */
public enum ResetTokenState {

    /**
     * Unused and not yet expired
     */
    ACTIVE,

    /**
     * Past its expiration time (derived, never stored)
     */
    EXPIRED,

    /**
     * Replaced by a newer token for the same subject
     */
    SUPERSEDED,

    /**
     * Consumed by a successful confirmation
     */
    USED,

    /**
     * Closed because the reset email failed
     */
    DELIVERY_FAILED;

    public static ResetTokenState fromCloseReason(CloseReason reason) {
        if (reason == null) {
            return USED;
        }
        return switch (reason) {
            case SUPERSEDED -> SUPERSEDED;
            case CONFIRMED -> USED;
            case DELIVERY_FAILED -> DELIVERY_FAILED;
        };
    }
}
