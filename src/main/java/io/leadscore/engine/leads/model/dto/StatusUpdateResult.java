package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.enums.LeadStatus;

import java.util.List;

public record StatusUpdateResult(Lead lead,
                                 LeadStatus previousStatus,
                                 boolean statusChanged,
                                 boolean conversionEventSent,
                                 List<String> warnings) {
}
