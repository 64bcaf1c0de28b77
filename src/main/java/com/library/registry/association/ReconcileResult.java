package com.library.registry.association;

import java.util.Set;

/** The delta applied by one reconcile call. */
public record ReconcileResult(Set<Long> added, Set<Long> removed) {

    public boolean isNoOp() {
        return added.isEmpty() && removed.isEmpty();
    }
}
