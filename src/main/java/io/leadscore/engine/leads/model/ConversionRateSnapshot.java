package io.leadscore.engine.leads.model;

import io.leadscore.engine.leads.model.enums.KeyField;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Per-lead copy of the conversion rates its dimension values mapped to at the last scoring run.
 */
@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRateSnapshot {

    @Column(name = "cr_service")
    private Double service;

    @Column(name = "cr_ad_set_name")
    private Double adSetName;

    @Column(name = "cr_ad_name")
    private Double adName;

    @Column(name = "cr_lead_date")
    private Double leadDate;

    @Column(name = "cr_zip")
    private Double zip;

    public static ConversionRateSnapshot zero() {
        return new ConversionRateSnapshot(0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public static ConversionRateSnapshot of(Map<KeyField, Double> rates) {
        return new ConversionRateSnapshot(
                rates.getOrDefault(KeyField.SERVICE, 0.0),
                rates.getOrDefault(KeyField.AD_SET_NAME, 0.0),
                rates.getOrDefault(KeyField.AD_NAME, 0.0),
                rates.getOrDefault(KeyField.LEAD_DATE, 0.0),
                rates.getOrDefault(KeyField.ZIP, 0.0));
    }
}
