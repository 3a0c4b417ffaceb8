package io.leadscore.engine.leads.model.dto;

import java.util.List;

public record FleetSyncResult(int processedClients, int totalUpdatedRates, int totalUpdatedLeads, List<String> errors) {
}
