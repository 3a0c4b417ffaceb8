package io.leadscore.engine.leads.model.dto;

import java.util.List;

public record RecalculateResult(int totalLeads, int updatedLeads, List<String> errors) {
}
