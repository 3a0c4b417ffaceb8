package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.leads.model.ConversionRateSnapshot;

public record ScoredLead(ConversionRateSnapshot snapshot, int leadScore) {
}
