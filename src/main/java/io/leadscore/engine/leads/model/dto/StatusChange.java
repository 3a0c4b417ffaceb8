package io.leadscore.engine.leads.model.dto;

import io.leadscore.engine.leads.model.enums.LeadStatus;

/**
 * Requested status update. Null amounts leave the stored amounts to the status rules.
 */
public record StatusChange(LeadStatus status, String unqualifiedLeadReason, Double proposalAmount, Double jobBookedAmount) {

    public static StatusChange to(LeadStatus status) {
        return new StatusChange(status, null, null, null);
    }

    public static StatusChange unqualified(String reason) {
        return new StatusChange(LeadStatus.UNQUALIFIED, reason, null, null);
    }
}
