package com.fourpaws.backend.modules.animal.application;

import java.util.UUID;

/**
 * View of foster placements needed by the lifecycle. Implemented by the placement module so
 * the animal module does not depend on it.
 */
public interface FosterPlacementPort {

    boolean hasActiveAssignment(UUID organizationId, UUID animalId);

    /**
     * Closes the animal's active assignment, if any, as FAILED when {@code failed} is set and
     * COMPLETED otherwise.
     */
    void closeActiveAssignment(UUID organizationId, UUID actorId, UUID animalId, boolean failed);
}
