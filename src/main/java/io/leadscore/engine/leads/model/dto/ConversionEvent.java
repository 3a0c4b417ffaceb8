package io.leadscore.engine.leads.model.dto;

public record ConversionEvent(String pixelId, String pixelToken, String email, String phone, String leadId) {
}
