package io.leadscore.engine.exceptions;

public class LeadNotFoundException extends ScoringException {

    public LeadNotFoundException(String leadId) {
        super("Lead not found: " + leadId);
    }
}
