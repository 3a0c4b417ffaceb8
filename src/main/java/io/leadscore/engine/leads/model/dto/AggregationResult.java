package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.leads.model.ConversionRate;

import java.util.List;

/**
 * Rates computed from a lead set, plus one warning per lead whose lead date could not be read.
 */
public record AggregationResult(List<ConversionRate> rates, List<String> warnings) {
}
