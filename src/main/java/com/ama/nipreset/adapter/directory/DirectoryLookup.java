package com.ama.nipreset.adapter.directory;

import java.util.List;
import java.util.Optional;

/**
 * Result of a directory lookup. Only eligible vehicles are listed as targets.
 */
public record DirectoryLookup(Outcome outcome, DirectoryCustomer customer, List<DirectoryVehicle> targets) {

    public enum Outcome {
        NOT_FOUND,
        SINGLE_TARGET,
        MULTIPLE_TARGETS
    }

    public DirectoryLookup {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static DirectoryLookup notFound() {
        return new DirectoryLookup(Outcome.NOT_FOUND, null, List.of());
    }

    /**
     * Classify a customer by its eligible vehicles. A customer without any is
     * reported as not found.
     */
    public static DirectoryLookup of(DirectoryCustomer customer, List<DirectoryVehicle> targets) {
        if (customer == null || targets == null || targets.isEmpty()) {
            return notFound();
        }
        Outcome outcome = targets.size() == 1 ? Outcome.SINGLE_TARGET : Outcome.MULTIPLE_TARGETS;
        return new DirectoryLookup(outcome, customer, targets);
    }

    public boolean isFound() {
        return outcome != Outcome.NOT_FOUND;
    }

    public Optional<DirectoryVehicle> findTarget(String vehicleId) {
        if (vehicleId == null) {
            return Optional.empty();
        }
        return targets.stream()
                .filter(v -> vehicleId.equals(v.vehicleId()))
                .findFirst();
    }
}
