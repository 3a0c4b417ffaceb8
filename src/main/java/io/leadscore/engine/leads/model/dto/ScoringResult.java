package io.leadscore.engine.leads.model.dto;

import java.util.List;

/**
 * Result of a full recompute or an incremental update for one client.
 * A non-empty {@code errors} list means the run was only partially applied.
 */
public record ScoringResult(String clientId,
                            int updatedConversionRates,
                            int updatedLeads,
                            int totalProcessedLeads,
                            List<String> errors,
                            List<String> warnings,
                            UpsertStats conversionRateStats) {

    public static ScoringResult empty(String clientId) {
        return new ScoringResult(clientId, 0, 0, 0, List.of(), List.of(), UpsertStats.none());
    }

    public static ScoringResult skipped(String clientId, String warning) {
        return new ScoringResult(clientId, 0, 0, 0, List.of(), List.of(warning), UpsertStats.none());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
