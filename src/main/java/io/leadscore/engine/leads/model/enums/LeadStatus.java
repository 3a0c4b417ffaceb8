package io.leadscore.engine.leads.model.enums;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome status of a lead.
 *
 * Outcome taxonomy:
 * positive/decided  ESTIMATE_SET, VIRTUAL_QUOTE, PROPOSAL_PRESENTED, JOB_BOOKED
 * negative/decided  UNQUALIFIED, ESTIMATE_CANCELED, JOB_LOST
 * neutral/pending   NEW, IN_PROGRESS
 *
 * Only decided leads take part in conversion rate aggregation.
 */
public enum LeadStatus {
    NEW("new"),
    IN_PROGRESS("in_progress"),
    ESTIMATE_SET("estimate_set"),
    VIRTUAL_QUOTE("virtual_quote"),
    PROPOSAL_PRESENTED("proposal_presented"),
    JOB_BOOKED("job_booked"),
    UNQUALIFIED("unqualified"),
    ESTIMATE_CANCELED("estimate_canceled"),
    JOB_LOST("job_lost");

    private static final Set<LeadStatus> POSITIVE =
            EnumSet.of(ESTIMATE_SET, VIRTUAL_QUOTE, PROPOSAL_PRESENTED, JOB_BOOKED);
    private static final Set<LeadStatus> NEGATIVE =
            EnumSet.of(UNQUALIFIED, ESTIMATE_CANCELED, JOB_LOST);

    private final String value;

    LeadStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isPositive() {
        return POSITIVE.contains(this);
    }

    public boolean isNegative() {
        return NEGATIVE.contains(this);
    }

    public boolean isDecided() {
        return isPositive() || isNegative();
    }

    /**
     * Statuses that carry an estimate and may therefore hold a proposal amount.
     */
    public boolean permitsProposalAmount() {
        return isPositive();
    }

    public boolean permitsJobBookedAmount() {
        return this == JOB_BOOKED;
    }

    /**
     * Accepts both the stored snake_case value ("estimate_set") and the constant name.
     */
    public static LeadStatus fromValue(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(trimmed) || s.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown lead status: " + raw));
    }
}
