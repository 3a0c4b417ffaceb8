package io.leadscore.engine.leads.services;

import io.leadscore.engine.config.LeadScoringConfig;
import io.leadscore.engine.leads.model.ConversionRate;
import io.leadscore.engine.leads.model.Lead;
import io.leadscore.engine.leads.model.RateKey;
import io.leadscore.engine.leads.model.dto.AggregationResult;
import io.leadscore.engine.leads.model.enums.KeyField;
import io.leadscore.engine.utils.LeadDates;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.ZoneId;
import java.util.*;

/**
 * Computes per-dimension conversion statistics from an in-memory lead set.
 *
 * conversionRate = positive / (positive + negative), neutral leads excluded.
 * Key names are taken verbatim: "Roofing" and "roofing" are different keys.
 */
@JBossLog
@ApplicationScoped
public class ConversionRateAggregator {

    @Inject
    LeadScoringConfig config;

    public List<ConversionRate> compute(List<Lead> leads, String clientId) {
        return aggregate(leads, clientId).rates();
    }

    public AggregationResult aggregate(List<Lead> leads, String clientId) {
        return aggregate(leads, clientId, ZoneId.of(config.timezone()));
    }

    /**
     * Leads of other clients are ignored. A lead whose lead date cannot be read is left out of the
     * leadDate dimension only; its other dimensions still count and a warning is recorded.
     */
    public AggregationResult aggregate(List<Lead> leads, String clientId, ZoneId zone) {
        // insertion order keeps the output stable: dimension order, then first appearance
        Map<RateKey, long[]> counters = new LinkedHashMap<>();
        for (KeyField field : KeyField.values()) {
            counters.putAll(emptyCountersFor(field, leads, clientId, zone));
        }

        List<String> warnings = new ArrayList<>();
        for (Lead lead : leads) {
            if (!clientId.equals(lead.getClientId())) continue;

            Optional<String> month = LeadDates.monthNameOf(lead.getLeadDate(), zone);
            if (month.isEmpty() && !isEmpty(lead.getLeadDate())) {
                warnings.add(String.format("Lead %s has an unreadable leadDate '%s', skipped for leadDate rates",
                        lead.getId(), lead.getLeadDate()));
            }
            if (lead.getStatus() == null || !lead.getStatus().isDecided()) continue;

            for (KeyField field : KeyField.values()) {
                String keyName = field == KeyField.LEAD_DATE ? month.orElse(null) : dimensionValue(lead, field);
                if (isEmpty(keyName)) continue;
                long[] counter = counters.get(new RateKey(field, keyName));
                counter[1]++;
                if (lead.getStatus().isPositive()) counter[0]++;
            }
        }

        List<ConversionRate> rates = new ArrayList<>(counters.size());
        counters.forEach((key, counter) ->
                rates.add(new ConversionRate(clientId, key.keyField(), key.keyName(), counter[0], counter[1])));

        if (!warnings.isEmpty()) {
            log.warnf("[Aggregation] Client %s: %d leads with unreadable leadDate", clientId, warnings.size());
        }
        log.debugf("[Aggregation] Client %s: %d rate rows from %d leads", clientId, rates.size(), leads.size());
        return new AggregationResult(rates, warnings);
    }

    // every distinct non-empty value gets a row, even when none of its leads is decided yet
    private Map<RateKey, long[]> emptyCountersFor(KeyField field, List<Lead> leads, String clientId, ZoneId zone) {
        Map<RateKey, long[]> counters = new LinkedHashMap<>();
        for (Lead lead : leads) {
            if (!clientId.equals(lead.getClientId())) continue;
            String keyName = field == KeyField.LEAD_DATE
                    ? LeadDates.monthNameOf(lead.getLeadDate(), zone).orElse(null)
                    : dimensionValue(lead, field);
            if (isEmpty(keyName)) continue;
            counters.putIfAbsent(new RateKey(field, keyName), new long[2]);
        }
        return counters;
    }

    static String dimensionValue(Lead lead, KeyField field) {
        return switch (field) {
            case SERVICE -> lead.getService();
            case AD_SET_NAME -> lead.getAdSetName();
            case AD_NAME -> lead.getAdName();
            case ZIP -> lead.getZip();
            case LEAD_DATE -> lead.getLeadDate();
        };
    }

    static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
