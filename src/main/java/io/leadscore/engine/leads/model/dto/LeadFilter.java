package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.model.enums.LeadStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

/**
 * Lead query. {@code leadDateAfter} is exclusive, {@code leadDateUntil} inclusive; both compare
 * against the calendar day of the lead date. {@code ingestedAfter} is exclusive and only matches
 * leads that carry an ingestion stamp. Soft-deleted leads never match.
 */
public record LeadFilter(String clientId,
                         LocalDate leadDateAfter,
                         LocalDate leadDateUntil,
                         Instant ingestedAfter,
                         Set<LeadStatus> statuses) {

    public static LeadFilter byClient(String clientId) {
        return new LeadFilter(clientId, null, null, null, Set.of());
    }

    public static LeadFilter ingestedAfter(String clientId, Instant after) {
        return new LeadFilter(clientId, null, null, after, Set.of());
    }

    public LeadFilter withStatuses(Set<LeadStatus> statuses) {
        return new LeadFilter(clientId, leadDateAfter, leadDateUntil, ingestedAfter, statuses);
    }

    public boolean hasStatuses() {
        return statuses != null && !statuses.isEmpty();
    }

    public void validate() {
        if (clientId == null || clientId.isBlank()) {
            throw new ScoringValidationException("Lead filter requires a clientId");
        }
        if (leadDateAfter != null && leadDateUntil != null && leadDateUntil.isBefore(leadDateAfter)) {
            throw new ScoringValidationException(
                    "Lead filter range is inverted: after " + leadDateAfter + ", until " + leadDateUntil);
        }
    }
}
