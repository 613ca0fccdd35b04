package com.ama.nipreset.model.domain;

/**
 * Customer + vehicle pair a reset token is scoped to.
 */
public record SubjectKey(String customerId, String vehicleId) {

    public SubjectKey {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customerId is required");
        }
        if (vehicleId == null || vehicleId.isBlank()) {
            throw new IllegalArgumentException("vehicleId is required");
        }
    }

    /**
     * Value stored in the unique active-slot column. Length-prefixed so that
     * distinct pairs never produce the same slot.
     */
    public String asSlot() {
        return customerId.length() + ":" + customerId + "/" + vehicleId;
    }

    @Override
    public String toString() {
        return customerId + "/" + vehicleId;
    }
}
