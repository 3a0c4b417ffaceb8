package io.leadscore.engine.leads.model.dto;

import java.util.List;

/**
 * Outcome of a batched lead write. Each row is written independently, so some may fail while others succeed.
 */
public record BulkWriteResult(int modifiedCount, List<WriteFailure> failures) {

    public static BulkWriteResult empty() {
        return new BulkWriteResult(0, List.of());
    }

    public boolean isPartialFailure() {
        return !failures.isEmpty();
    }
}
