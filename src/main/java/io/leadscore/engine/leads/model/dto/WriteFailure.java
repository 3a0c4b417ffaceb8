package io.leadscore.engine.leads.model.dto;

public record WriteFailure(String leadId, String message) {
}
