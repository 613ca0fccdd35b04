package com.ama.nipreset.model.enums;

/**
 * Why a reset token stopped being usable. Stored together with {@code used_at}.
 */
public enum CloseReason {

    /**
     * A newer token was issued for the same customer + vehicle
     */
    SUPERSEDED,

    /**
     * The NIP change was handed off and the token consumed
     */
    CONFIRMED,

    /**
     * The reset email could not be delivered, so the link was never sent
     */
    DELIVERY_FAILED
}
