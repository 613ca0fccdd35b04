package com.ama.nipreset.model.domain;

/**
 * Directory records the system of record needs to apply a new NIP.
 */
public record CorrelationRef(String contactRecordId, String vehicleRecordId) {
}
