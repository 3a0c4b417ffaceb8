package io.leadscore.engine.leads.services;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.exceptions.ScoringValidationException;
import io.leadscore.engine.leads.model.enums.KeyField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Validated per-dimension weights. Non-negative and summing to 100, so a weighted sum of
 * rates in [0,1] always lands in [0,100].
 */
public final class ScoringWeights {

    private static final double EXPECTED_TOTAL = 100.0;
    private static final double TOLERANCE = 1e-6;

    private final Map<KeyField, Double> weights;

    private ScoringWeights(Map<KeyField, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static ScoringWeights of(Map<KeyField, Double> weights) {
        Map<KeyField, Double> copy = new EnumMap<>(KeyField.class);
        double total = 0;
        for (KeyField field : KeyField.values()) {
            double weight = weights.getOrDefault(field, 0.0);
            if (weight < 0 || Double.isNaN(weight)) {
                throw new ScoringValidationException("Weight for " + field.key() + " must be non-negative, was " + weight);
            }
            copy.put(field, weight);
            total += weight;
        }
        if (Math.abs(total - EXPECTED_TOTAL) > TOLERANCE) {
            throw new ScoringValidationException("Scoring weights must sum to 100, was " + total);
        }
        return new ScoringWeights(copy);
    }

    public static ScoringWeights from(LeadScoringConfig.Weights config) {
        Map<KeyField, Double> map = new EnumMap<>(KeyField.class);
        map.put(KeyField.SERVICE, config.service());
        map.put(KeyField.AD_SET_NAME, config.adSetName());
        map.put(KeyField.AD_NAME, config.adName());
        map.put(KeyField.LEAD_DATE, config.leadDate());
        map.put(KeyField.ZIP, config.zip());
        return of(map);
    }

    public double weightOf(KeyField field) {
        return weights.get(field);
    }

    public Map<KeyField, Double> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return "ScoringWeights" + weights;
    }
}
