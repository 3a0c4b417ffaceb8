package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.model.enums.KeyField;

public record RateFilter(String clientId, KeyField keyField) {

    public static RateFilter byClient(String clientId) {
        return new RateFilter(clientId, null);
    }

    public void validate() {
        if (clientId == null || clientId.isBlank()) {
            throw new ScoringValidationException("Rate filter requires a clientId");
        }
    }
}
