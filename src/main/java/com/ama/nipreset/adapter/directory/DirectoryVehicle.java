package com.ama.nipreset.adapter.directory;

/**
 * Vehicle eligible for a NIP reset.
 */
public record DirectoryVehicle(String vehicleId, String recordId, String label) {
}
