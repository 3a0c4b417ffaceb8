package io.leadscore.engine.leads.services;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.leads.model.ConversionRateSnapshot;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.dto.ScoredLead;
import io.leadscore.engine.leads.model.enums.KeyField;
import io.leadscore.engine.utils.LeadDates;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;

/**
 * Turns a lead's dimension values into a rate snapshot and a 0-100 score.
 *
 * leadScore = round(clamp(sum(rate_i * weight_i), 0, 100))
 */
@ApplicationScoped
public class LeadScorer {

    private static final double MIN_SCORE = 0;
    private static final double MAX_SCORE = 100;

    @Inject
    LeadScoringConfig config;

    public ScoredLead score(Lead lead, RateTable rateTable, ScoringWeights weights) {
        return score(lead, rateTable, weights, ZoneId.of(config.timezone()));
    }

    public ScoredLead score(Lead lead, RateTable rateTable, ScoringWeights weights, ZoneId zone) {
        Map<KeyField, Double> rates = new EnumMap<>(KeyField.class);
        rates.put(KeyField.SERVICE, rateTable.rateFor(KeyField.SERVICE, lead.getService()));
        rates.put(KeyField.AD_SET_NAME, rateTable.rateFor(KeyField.AD_SET_NAME, lead.getAdSetName()));
        rates.put(KeyField.AD_NAME, rateTable.rateFor(KeyField.AD_NAME, lead.getAdName()));
        rates.put(KeyField.LEAD_DATE, LeadDates.monthNameOf(lead.getLeadDate(), zone)
                .map(month -> rateTable.rateFor(KeyField.LEAD_DATE, month))
                .orElse(0.0));
        rates.put(KeyField.ZIP, rateTable.rateFor(KeyField.ZIP, lead.getZip()));

        double weightedSum = 0;
        for (Map.Entry<KeyField, Double> entry : rates.entrySet()) {
            weightedSum += entry.getValue() * weights.weightOf(entry.getKey());
        }
        int leadScore = (int) Math.round(Math.max(MIN_SCORE, Math.min(MAX_SCORE, weightedSum)));

        return new ScoredLead(ConversionRateSnapshot.of(rates), leadScore);
    }
}
