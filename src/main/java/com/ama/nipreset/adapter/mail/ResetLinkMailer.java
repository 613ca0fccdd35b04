package com.ama.nipreset.adapter.mail;

/**
 * Outbound channel for reset links.
 */
public interface ResetLinkMailer {

    /**
     * Send the reset link to the customer.
     *
     * @throws com.ama.nipreset.exception.ResetLinkDeliveryException if the message was not accepted
     */
    void sendResetLink(String email, String vehicleLabel, String resetUrl);
}
