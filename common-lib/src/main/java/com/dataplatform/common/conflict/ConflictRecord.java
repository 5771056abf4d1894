package com.dataplatform.common.conflict;

import java.util.List;

/**
 * Audit trail of one reconciliation. Logged, not persisted.
 */
public record ConflictRecord(
    String          key,
    List<Candidate> candidates,
    Resolution      resolution
) {

    public ConflictRecord {
        candidates = List.copyOf(candidates);
    }
}
