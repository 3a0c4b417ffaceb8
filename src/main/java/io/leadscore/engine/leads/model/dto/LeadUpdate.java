package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.leads.model.ConversionRateSnapshot;

public record LeadUpdate(String leadId, ConversionRateSnapshot conversionRates, int leadScore) {
}
