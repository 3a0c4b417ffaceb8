package io.leadscore.engine.leads.model.dto;

import java.util.List;

public record UpdatePlan(List<LeadUpdate> writes, int consideredCount, int changedCount) {
}
