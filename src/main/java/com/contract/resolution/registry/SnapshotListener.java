package com.contract.resolution.registry;

import com.contract.resolution.core.model.CanonicalClauseId;

import java.util.Set;

/**
 * Told about every snapshot a {@link ContractRegistry} publishes.
 */
public interface SnapshotListener {

    /**
     * Called after a new snapshot became current.
     */
    void onSnapshotPublished(ContractSnapshot snapshot);

    /**
     * Called after an override was retracted, with the clause IDs it affected.
     */
    default void onOverrideRetracted(String contractId, String overrideId, Set<CanonicalClauseId> affectedClauses) {
    }
}
